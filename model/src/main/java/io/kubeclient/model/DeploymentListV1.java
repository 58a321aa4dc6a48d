package io.kubeclient.model;

import java.util.List;

import org.jspecify.annotations.Nullable;

/**
 * A page of {@link DeploymentV1} resources.
 */
public record DeploymentListV1(@Nullable String kind,
                               @Nullable String apiVersion,
                               @Nullable ListMetaV1 metadata,
                               List<DeploymentV1> items) implements KubeResourceList<DeploymentV1> {

    public static final String KIND = "DeploymentList";

    public DeploymentListV1 {
        items = items == null ? List.of() : List.copyOf(items);
    }
}
