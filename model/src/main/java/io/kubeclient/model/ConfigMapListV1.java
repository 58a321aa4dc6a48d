package io.kubeclient.model;

import java.util.List;

import org.jspecify.annotations.Nullable;

/**
 * A page of {@link ConfigMapV1} resources.
 */
public record ConfigMapListV1(@Nullable String kind,
                              @Nullable String apiVersion,
                              @Nullable ListMetaV1 metadata,
                              List<ConfigMapV1> items) implements KubeResourceList<ConfigMapV1> {

    public static final String KIND = "ConfigMapList";

    public ConfigMapListV1 {
        items = items == null ? List.of() : List.copyOf(items);
    }
}
