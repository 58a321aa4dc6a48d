package io.kubeclient.model;

import org.jspecify.annotations.Nullable;

/**
 * @param reason machine-readable cause
 * @param message human-readable description of the cause
 * @param field the field that caused the error, in JSON path notation
 */
public record StatusCauseV1(@Nullable String reason, @Nullable String message, @Nullable String field) {
}
