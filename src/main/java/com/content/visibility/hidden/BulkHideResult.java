package com.content.visibility.hidden;

/**
 * Outcome of a bulk hide. Items are hidden independently, so a failure of one
 * item only shows up in {@code failCount}.
 */
public record BulkHideResult(int successCount, int failCount) {
}
