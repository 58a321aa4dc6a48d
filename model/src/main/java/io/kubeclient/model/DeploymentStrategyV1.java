package io.kubeclient.model;

import org.jspecify.annotations.Nullable;

/**
 * @param type the strategy, {@link DeploymentStrategyType#ROLLING_UPDATE} when unset server-side
 */
public record DeploymentStrategyV1(@Nullable DeploymentStrategyType type) {
}
