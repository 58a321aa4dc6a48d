package io.kubeclient.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * How a deployment replaces old pods with new ones.
 */
public enum DeploymentStrategyType {
    /** Kill all existing pods before creating new ones. */
    @JsonProperty("Recreate")
    RECREATE,

    /** Replace pods gradually, bounded by max surge and max unavailable. */
    @JsonProperty("RollingUpdate")
    ROLLING_UPDATE
}
