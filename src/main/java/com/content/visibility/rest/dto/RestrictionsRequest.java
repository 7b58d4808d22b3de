package com.content.visibility.rest.dto;

import com.content.visibility.rules.RestrictionRuleInput;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Request DTO replacing all restriction rules of a user.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RestrictionsRequest(List<RestrictionRuleInput> restrictions) {
}
