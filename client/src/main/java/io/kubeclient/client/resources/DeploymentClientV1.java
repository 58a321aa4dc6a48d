package io.kubeclient.client.resources;

import java.util.concurrent.CompletableFuture;

import io.kubeclient.client.KubeApiClient;
import io.kubeclient.model.DeploymentListV1;
import io.kubeclient.model.DeploymentV1;
import org.jspecify.annotations.Nullable;

/**
 * Client for {@link DeploymentV1} resources ({@code /apis/apps/v1/namespaces/{namespace}/deployments}).
 */
public class DeploymentClientV1 extends NamespacedResourceClient<DeploymentV1, DeploymentListV1> {

    public DeploymentClientV1(KubeApiClient client) {
        super(client, DeploymentV1.class, DeploymentListV1.class, "/apis/apps/v1/namespaces/{namespace}/deployments");
    }

    /**
     * Sets the desired replica count.
     *
     * @return the deployment as updated by the server
     */
    public CompletableFuture<DeploymentV1> scale(String name, int replicas, @Nullable String namespace) {
        if (replicas < 0) {
            throw new IllegalArgumentException("Replicas must not be negative");
        }
        return patch(name, patch -> patch.field("spec", "replicas").replace(replicas), namespace);
    }
}
