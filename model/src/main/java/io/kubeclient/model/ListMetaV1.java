package io.kubeclient.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

/**
 * Metadata of a list response.
 *
 * @param resourceVersion the collection version, usable as the starting point of a watch
 * @param continueToken token for fetching the next page, {@code null} on the last page
 * @param remainingItemCount number of items not yet returned when paging
 * @param selfLink deprecated link to the collection
 */
public record ListMetaV1(@Nullable String resourceVersion,
                         @JsonProperty("continue") @Nullable String continueToken,
                         @Nullable Long remainingItemCount,
                         @Nullable String selfLink) {
}
