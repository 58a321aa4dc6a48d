package io.kubeclient.model;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Equality-based label query.
 *
 * @param matchLabels labels a resource must carry to be selected, never {@code null}
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record LabelSelectorV1(Map<String, String> matchLabels) {

    public LabelSelectorV1 {
        matchLabels = matchLabels == null ? Map.of() : Map.copyOf(matchLabels);
    }
}
