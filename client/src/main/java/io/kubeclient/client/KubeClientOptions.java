package io.kubeclient.client;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;

import io.kubeclient.client.http.HttpClientBuilder;
import io.kubeclient.client.http.lines.LineStream;
import io.kubeclient.model.KubeKindRegistry;
import io.kubeclient.util.Assert;
import io.kubeclient.util.Utils;
import org.jspecify.annotations.Nullable;

/**
 * Settings for a {@link KubeApiClient}.
 *
 * <pre>{@code
 * KubeClientOptions options = KubeClientOptions.builder()
 *         .apiEndpoint("https://kubernetes.example:6443")
 *         .defaultNamespace("apps")
 *         .addHeader("Authorization", "Bearer " + token)
 *         .build();
 * }</pre>
 */
public final class KubeClientOptions {

    public static final String API_ENDPOINT_PROPERTY = "kubeclient.api-endpoint";
    public static final String NAMESPACE_PROPERTY = "kubeclient.namespace";
    public static final String STREAM_CAPACITY_PROPERTY = "kubeclient.stream-capacity";

    public static final String DEFAULT_NAMESPACE = "default";

    private final String apiEndpoint;
    private final String defaultNamespace;
    private final HttpClientBuilder httpClientBuilder;
    private final KubeKindRegistry kindRegistry;
    private final int streamCapacity;
    private final Map<String, String> defaultHeaders;

    private KubeClientOptions(Builder builder) {
        this.apiEndpoint = Assert.checkNotBlankParam("apiEndpoint", builder.apiEndpoint);
        this.defaultNamespace = builder.defaultNamespace;
        this.httpClientBuilder = builder.httpClientBuilder;
        this.kindRegistry = builder.kindRegistry;
        this.streamCapacity = builder.streamCapacity;
        this.defaultHeaders = Map.copyOf(builder.defaultHeaders);
        ensureValid();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads options from properties. {@value #API_ENDPOINT_PROPERTY} is required;
     * {@value #NAMESPACE_PROPERTY} and {@value #STREAM_CAPACITY_PROPERTY} are optional.
     *
     * @throws IllegalArgumentException if a value is missing or invalid
     */
    public static KubeClientOptions fromProperties(Properties properties) {
        Assert.checkNotNullParam("properties", properties);
        Builder builder = builder().apiEndpoint(properties.getProperty(API_ENDPOINT_PROPERTY));
        String namespace = properties.getProperty(NAMESPACE_PROPERTY);
        if (!Utils.isBlank(namespace)) {
            builder.defaultNamespace(namespace.trim());
        }
        String capacity = properties.getProperty(STREAM_CAPACITY_PROPERTY);
        if (!Utils.isBlank(capacity)) {
            try {
                builder.streamCapacity(Integer.parseInt(capacity.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(
                        "Property '" + STREAM_CAPACITY_PROPERTY + "' must be an integer: " + capacity, e);
            }
        }
        return builder.build();
    }

    /**
     * @throws IllegalArgumentException if any option is invalid
     */
    public void ensureValid() {
        if (!apiEndpoint.startsWith("http://") && !apiEndpoint.startsWith("https://")) {
            throw new IllegalArgumentException("API endpoint must be an http or https URL: " + apiEndpoint);
        }
        Assert.checkNotBlankParam("defaultNamespace", defaultNamespace);
        if (streamCapacity <= 0) {
            throw new IllegalArgumentException("Stream capacity must be greater than 0");
        }
    }

    public String getApiEndpoint() {
        return apiEndpoint;
    }

    public String getDefaultNamespace() {
        return defaultNamespace;
    }

    public HttpClientBuilder getHttpClientBuilder() {
        return httpClientBuilder;
    }

    public KubeKindRegistry getKindRegistry() {
        return kindRegistry;
    }

    public int getStreamCapacity() {
        return streamCapacity;
    }

    public Map<String, String> getDefaultHeaders() {
        return defaultHeaders;
    }

    public static final class Builder {
        private @Nullable String apiEndpoint;
        private String defaultNamespace = DEFAULT_NAMESPACE;
        private HttpClientBuilder httpClientBuilder = HttpClientBuilder.DEFAULT_FACTORY;
        private KubeKindRegistry kindRegistry = KubeKindRegistry.DEFAULT;
        private int streamCapacity = LineStream.DEFAULT_CAPACITY;
        private final Map<String, String> defaultHeaders = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder apiEndpoint(@Nullable String apiEndpoint) {
            this.apiEndpoint = apiEndpoint;
            return this;
        }

        public Builder defaultNamespace(String defaultNamespace) {
            this.defaultNamespace = Assert.checkNotNullParam("defaultNamespace", defaultNamespace);
            return this;
        }

        public Builder httpClientBuilder(HttpClientBuilder httpClientBuilder) {
            this.httpClientBuilder = Assert.checkNotNullParam("httpClientBuilder", httpClientBuilder);
            return this;
        }

        public Builder kindRegistry(KubeKindRegistry kindRegistry) {
            this.kindRegistry = Assert.checkNotNullParam("kindRegistry", kindRegistry);
            return this;
        }

        public Builder streamCapacity(int streamCapacity) {
            this.streamCapacity = streamCapacity;
            return this;
        }

        /**
         * Adds a header sent with every request, for example {@code Authorization}.
         */
        public Builder addHeader(String name, String value) {
            defaultHeaders.put(Assert.checkNotBlankParam("name", name), Assert.checkNotNullParam("value", value));
            return this;
        }

        public KubeClientOptions build() {
            return new KubeClientOptions(this);
        }
    }
}
