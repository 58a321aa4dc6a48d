package io.kubeclient.model;

import org.jspecify.annotations.Nullable;

/**
 * Desired state of a {@link DeploymentV1}. The pod template is not modelled.
 */
public record DeploymentSpecV1(@Nullable Integer replicas,
                               @Nullable LabelSelectorV1 selector,
                               @Nullable DeploymentStrategyV1 strategy,
                               @Nullable Integer minReadySeconds,
                               @Nullable Integer revisionHistoryLimit,
                               @Nullable Boolean paused) {
}
