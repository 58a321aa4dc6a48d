package io.kubeclient.client.resources;

import io.kubeclient.client.KubeApiClient;
import io.kubeclient.model.ConfigMapListV1;
import io.kubeclient.model.ConfigMapV1;

/**
 * Client for {@link ConfigMapV1} resources ({@code /api/v1/namespaces/{namespace}/configmaps}).
 */
public class ConfigMapClientV1 extends NamespacedResourceClient<ConfigMapV1, ConfigMapListV1> {

    public ConfigMapClientV1(KubeApiClient client) {
        super(client, ConfigMapV1.class, ConfigMapListV1.class, "/api/v1/namespaces/{namespace}/configmaps");
    }
}
