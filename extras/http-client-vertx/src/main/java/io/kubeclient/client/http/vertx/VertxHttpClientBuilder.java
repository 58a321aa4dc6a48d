package io.kubeclient.client.http.vertx;

import io.kubeclient.client.http.HttpClient;
import io.kubeclient.client.http.HttpClientBuilder;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpClientOptions;
import org.jspecify.annotations.Nullable;

/**
 * Creates {@link VertxHttpClient}s. A new {@link Vertx} instance is started when none is given.
 */
public class VertxHttpClientBuilder implements HttpClientBuilder {

    private @Nullable Vertx vertx;

    private @Nullable HttpClientOptions options;

    public VertxHttpClientBuilder vertx(Vertx vertx) {
        this.vertx = vertx;
        return this;
    }

    public VertxHttpClientBuilder options(HttpClientOptions options) {
        this.options = options;
        return this;
    }

    @Override
    public HttpClient create(String url) {
        return new VertxHttpClient(url,
                vertx != null ? vertx : Vertx.vertx(),
                options != null ? new HttpClientOptions(options) : new HttpClientOptions());
    }
}
