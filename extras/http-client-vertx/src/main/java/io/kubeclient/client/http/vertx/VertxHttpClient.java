package io.kubeclient.client.http.vertx;

import static java.nio.charset.StandardCharsets.UTF_8;

import java.net.MalformedURLException;
import java.net.URL;
import java.net.URLConnection;
import java.net.URLStreamHandler;
import java.nio.ByteBuffer;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Flow;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

import io.kubeclient.client.http.HttpClient;
import io.kubeclient.client.http.HttpResponse;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpClientOptions;
import io.vertx.core.http.HttpClientRequest;
import io.vertx.core.http.HttpClientResponse;
import io.vertx.core.http.HttpMethod;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class VertxHttpClient implements HttpClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(VertxHttpClient.class);

    private final io.vertx.core.http.HttpClient client;

    private final Vertx vertx;

    private final String basePath;

    VertxHttpClient(String baseUrl, Vertx vertx, HttpClientOptions options) {
        this.vertx = vertx;
        URL targetUrl = buildUrl(baseUrl);
        this.client = initClient(targetUrl, options);
        String path = targetUrl.getPath();
        while (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        this.basePath = path;
    }

    private io.vertx.core.http.HttpClient initClient(URL targetUrl, HttpClientOptions options) {
        return this.vertx.createHttpClient(options
                .setDefaultHost(targetUrl.getHost())
                .setDefaultPort(targetUrl.getPort() != -1 ? targetUrl.getPort() : targetUrl.getDefaultPort())
                .setSsl(isSecureProtocol(targetUrl.getProtocol())));
    }

    @Override
    public GetRequestBuilder get(String path) {
        return new VertxGetRequestBuilder(path);
    }

    @Override
    public PostRequestBuilder post(String path) {
        return new VertxPostRequestBuilder(path);
    }

    @Override
    public PutRequestBuilder put(String path) {
        return new VertxPutRequestBuilder(path);
    }

    @Override
    public PatchRequestBuilder patch(String path) {
        return new VertxPatchRequestBuilder(path);
    }

    @Override
    public DeleteRequestBuilder delete(String path) {
        return new VertxDeleteRequestBuilder(path);
    }

    private static final URLStreamHandler URL_HANDLER = new URLStreamHandler() {
        protected URLConnection openConnection(URL u) {
            return null;
        }
    };

    private static URL buildUrl(String uri) {
        try {
            return new URL(null, uri, URL_HANDLER);
        } catch (MalformedURLException e) {
            throw new IllegalArgumentException("URI [" + uri + "] is not valid", e);
        }
    }

    private static boolean isSecureProtocol(String protocol) {
        return protocol.charAt(protocol.length() - 1) == 's' && protocol.length() > 2;
    }

    private abstract class VertxRequestBuilder<T extends RequestBuilder<T>> implements RequestBuilder<T> {
        private final String path;
        private final HttpMethod method;
        protected final Map<String, String> headers = new LinkedHashMap<>();

        VertxRequestBuilder(String path, HttpMethod method) {
            this.path = path;
            this.method = method;
        }

        @Override
        public T addHeader(String name, String value) {
            headers.put(name, value);
            return self();
        }

        @Override
        public T addHeaders(@Nullable Map<String, String> headers) {
            if (headers != null && !headers.isEmpty()) {
                for (Map.Entry<String, String> entry : headers.entrySet()) {
                    addHeader(entry.getKey(), entry.getValue());
                }
            }
            return self();
        }

        @SuppressWarnings("unchecked")
        T self() {
            return (T) this;
        }

        protected CompletableFuture<HttpResponse> exchange(@Nullable String body,
                                                           Function<HttpClientResponse, Future<HttpResponse>> mapper) {
            String uri = basePath + path;
            LOGGER.debug("{} {}", method, uri);
            AtomicReference<HttpClientRequest> sent = new AtomicReference<>();
            CompletableFuture<HttpResponse> response = client.request(method, uri)
                    .compose(request -> {
                        sent.set(request);
                        request.headers().addAll(headers);
                        return body != null ? request.send(body) : request.send();
                    })
                    .compose(mapper)
                    .toCompletionStage()
                    .toCompletableFuture();
            // Vert.x futures cannot be cancelled, so the request is reset instead
            response.whenComplete((r, failure) -> {
                HttpClientRequest request = sent.get();
                if (failure instanceof CancellationException && request != null) {
                    request.reset();
                }
            });
            return response;
        }
    }

    private class VertxGetRequestBuilder extends VertxRequestBuilder<GetRequestBuilder> implements GetRequestBuilder {
        private boolean streamed;

        VertxGetRequestBuilder(String path) {
            super(path, HttpMethod.GET);
        }

        @Override
        public GetRequestBuilder streamed() {
            this.streamed = true;
            return this;
        }

        @Override
        public CompletableFuture<HttpResponse> send() {
            return exchange(null, streamed ? STREAMED_RESPONSE_MAPPER : BUFFERED_RESPONSE_MAPPER);
        }
    }

    private class VertxDeleteRequestBuilder extends VertxRequestBuilder<DeleteRequestBuilder>
            implements DeleteRequestBuilder {

        VertxDeleteRequestBuilder(String path) {
            super(path, HttpMethod.DELETE);
        }

        @Override
        public CompletableFuture<HttpResponse> send() {
            return exchange(null, BUFFERED_RESPONSE_MAPPER);
        }
    }

    private abstract class VertxBodyRequestBuilder<T extends BodyRequestBuilder<T>> extends VertxRequestBuilder<T>
            implements BodyRequestBuilder<T> {
        private String body = "";

        VertxBodyRequestBuilder(String path, HttpMethod method) {
            super(path, method);
        }

        @Override
        public T body(@Nullable String body) {
            this.body = body == null ? "" : body;
            return self();
        }

        @Override
        public CompletableFuture<HttpResponse> send() {
            return exchange(body, BUFFERED_RESPONSE_MAPPER);
        }
    }

    private class VertxPostRequestBuilder extends VertxBodyRequestBuilder<PostRequestBuilder>
            implements PostRequestBuilder {

        VertxPostRequestBuilder(String path) {
            super(path, HttpMethod.POST);
        }
    }

    private class VertxPutRequestBuilder extends VertxBodyRequestBuilder<PutRequestBuilder>
            implements PutRequestBuilder {

        VertxPutRequestBuilder(String path) {
            super(path, HttpMethod.PUT);
        }
    }

    private class VertxPatchRequestBuilder extends VertxBodyRequestBuilder<PatchRequestBuilder>
            implements PatchRequestBuilder {

        VertxPatchRequestBuilder(String path) {
            super(path, HttpMethod.PATCH);
        }
    }

    private static final Function<HttpClientResponse, Future<HttpResponse>> BUFFERED_RESPONSE_MAPPER =
            response -> response.body().<HttpResponse>map(buffer -> new VertxHttpResponse(response, buffer.toString(UTF_8)));

    // paused here so that no chunk arrives before the body has a subscriber
    private static final Function<HttpClientResponse, Future<HttpResponse>> STREAMED_RESPONSE_MAPPER =
            response -> Future.<HttpResponse>succeededFuture(new VertxHttpResponse(response.pause(), null));

    private record VertxHttpResponse(HttpClientResponse response, @Nullable String content) implements HttpResponse {

        @Override
        public int statusCode() {
            return response.statusCode();
        }

        @Override
        public Optional<String> header(String name) {
            return Optional.ofNullable(response.getHeader(name));
        }

        @Override
        public CompletableFuture<String> body() {
            if (content != null) {
                return CompletableFuture.completedFuture(content);
            }
            Future<String> body = response.body().map(buffer -> buffer.toString(UTF_8));
            response.resume();
            return body.toCompletionStage().toCompletableFuture();
        }

        @Override
        public Flow.Publisher<List<ByteBuffer>> bodyAsPublisher() {
            if (content != null) {
                throw new IllegalStateException("Response body was not requested as a stream");
            }
            return new VertxBodyPublisher(response);
        }
    }
}
