package io.kubeclient.client;

import io.kubeclient.client.http.HttpClient;
import io.kubeclient.client.resources.ConfigMapClientV1;
import io.kubeclient.client.resources.DeploymentClientV1;
import io.kubeclient.model.KubeKindRegistry;
import io.kubeclient.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point: owns the transport, the kind registry and the default namespace, and hands out
 * resource clients that share them.
 *
 * <pre>{@code
 * KubeApiClient client = KubeApiClient.create(options);
 * Optional<ConfigMapV1> settings = client.configMapsV1().get("settings").join();
 * }</pre>
 */
public final class KubeApiClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(KubeApiClient.class);

    private final KubeClientOptions options;
    private final HttpClient httpClient;
    private final ConfigMapClientV1 configMaps;
    private final DeploymentClientV1 deployments;

    private KubeApiClient(KubeClientOptions options, HttpClient httpClient) {
        this.options = options;
        this.httpClient = httpClient;
        this.configMaps = new ConfigMapClientV1(this);
        this.deployments = new DeploymentClientV1(this);
    }

    public static KubeApiClient create(KubeClientOptions options) {
        Assert.checkNotNullParam("options", options);
        options.ensureValid();
        LOGGER.debug("Creating API client for {} (default namespace '{}')",
                options.getApiEndpoint(), options.getDefaultNamespace());
        return new KubeApiClient(options, options.getHttpClientBuilder().create(options.getApiEndpoint()));
    }

    public KubeClientOptions getOptions() {
        return options;
    }

    public HttpClient getHttpClient() {
        return httpClient;
    }

    public KubeKindRegistry getKindRegistry() {
        return options.getKindRegistry();
    }

    public String getDefaultNamespace() {
        return options.getDefaultNamespace();
    }

    public ConfigMapClientV1 configMapsV1() {
        return configMaps;
    }

    public DeploymentClientV1 deploymentsV1() {
        return deployments;
    }
}
