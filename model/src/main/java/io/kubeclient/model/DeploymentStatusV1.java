package io.kubeclient.model;

import org.jspecify.annotations.Nullable;

/**
 * Most recently observed state of a {@link DeploymentV1}.
 */
public record DeploymentStatusV1(@Nullable Long observedGeneration,
                                 @Nullable Integer replicas,
                                 @Nullable Integer updatedReplicas,
                                 @Nullable Integer readyReplicas,
                                 @Nullable Integer availableReplicas,
                                 @Nullable Integer unavailableReplicas) {
}
