package com.content.visibility.rest.dto;

import com.content.visibility.hidden.HideRequestItem;
import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Request DTO for hiding several entities at once.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BulkHideRequest(@JsonAlias("items") List<HideRequestItem> entities) {
}
