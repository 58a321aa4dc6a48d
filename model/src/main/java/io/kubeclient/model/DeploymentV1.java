package io.kubeclient.model;

import org.jspecify.annotations.Nullable;

/**
 * Declarative updates for pods and replica sets.
 *
 * @param kind always {@value #KIND}
 * @param apiVersion always {@value #API_VERSION}
 * @param metadata standard object metadata
 * @param spec desired state
 * @param status observed state, populated by the server
 */
public record DeploymentV1(@Nullable String kind,
                           @Nullable String apiVersion,
                           @Nullable ObjectMetaV1 metadata,
                           @Nullable DeploymentSpecV1 spec,
                           @Nullable DeploymentStatusV1 status) implements KubeResource {

    public static final String KIND = "Deployment";
    public static final String API_VERSION = "apps/v1";

    public DeploymentV1(ObjectMetaV1 metadata, DeploymentSpecV1 spec) {
        this(KIND, API_VERSION, metadata, spec, null);
    }
}
