package io.kubeclient.client.http.jdk;

import static java.nio.charset.StandardCharsets.UTF_8;

import java.net.MalformedURLException;
import java.net.URI;
import java.net.URL;
import java.net.URLConnection;
import java.net.URLStreamHandler;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse.BodyHandler;
import java.net.http.HttpResponse.BodyHandlers;
import java.net.http.HttpResponse.BodySubscriber;
import java.net.http.HttpResponse.BodySubscribers;
import java.nio.ByteBuffer;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Flow;

import io.kubeclient.client.http.HttpClient;
import io.kubeclient.client.http.HttpResponse;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

class JdkHttpClient implements HttpClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(JdkHttpClient.class);

    private final java.net.http.HttpClient httpClient;
    private final String baseUrl;

    JdkHttpClient(String baseUrl) {
        // HTTP/1.1 keeps watches on a plain chunked connection instead of an h2c upgrade
        this.httpClient = java.net.http.HttpClient.newBuilder()
                .version(java.net.http.HttpClient.Version.HTTP_1_1)
                .followRedirects(java.net.http.HttpClient.Redirect.NORMAL)
                .build();

        URL targetUrl = buildUrl(baseUrl);
        String path = targetUrl.getPath();
        while (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        this.baseUrl = targetUrl.getProtocol() + "://" + targetUrl.getAuthority() + path;
    }

    String getBaseUrl() {
        return baseUrl;
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

    @Override
    public GetRequestBuilder get(String path) {
        return new JdkGetRequestBuilder(path);
    }

    @Override
    public PostRequestBuilder post(String path) {
        return new JdkPostRequestBuilder(path);
    }

    @Override
    public PutRequestBuilder put(String path) {
        return new JdkPutRequestBuilder(path);
    }

    @Override
    public PatchRequestBuilder patch(String path) {
        return new JdkPatchRequestBuilder(path);
    }

    @Override
    public DeleteRequestBuilder delete(String path) {
        return new JdkDeleteBuilder(path);
    }

    private abstract class JdkRequestBuilder<T extends RequestBuilder<T>> implements RequestBuilder<T> {
        private final String path;
        protected final Map<String, String> headers = new LinkedHashMap<>();

        JdkRequestBuilder(String path) {
            this.path = path;
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

        protected HttpRequest.Builder createRequestBuilder() {
            HttpRequest.Builder builder = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + path));
            for (Map.Entry<String, String> headerEntry : headers.entrySet()) {
                builder.header(headerEntry.getKey(), headerEntry.getValue());
            }
            return builder;
        }

        protected CompletableFuture<HttpResponse> exchange(HttpRequest request, BodyHandler<?> bodyHandler) {
            LOGGER.debug("{} {}", request.method(), request.uri());
            CompletableFuture<? extends java.net.http.HttpResponse<?>> exchange = httpClient.sendAsync(request, bodyHandler);
            CompletableFuture<HttpResponse> response = exchange.<HttpResponse>thenApply(JdkHttpResponse::new);
            // derived futures do not propagate cancellation on their own
            response.whenComplete((r, failure) -> {
                if (failure instanceof CancellationException) {
                    exchange.cancel(true);
                }
            });
            return response;
        }
    }

    private abstract class JdkBodyRequestBuilder<T extends BodyRequestBuilder<T>> extends JdkRequestBuilder<T>
            implements BodyRequestBuilder<T> {
        private String body = "";

        JdkBodyRequestBuilder(String path) {
            super(path);
        }

        @Override
        public T body(@Nullable String body) {
            this.body = body == null ? "" : body;
            return self();
        }

        protected HttpRequest.BodyPublisher bodyPublisher() {
            return BodyPublishers.ofString(body, UTF_8);
        }
    }

    private class JdkGetRequestBuilder extends JdkRequestBuilder<GetRequestBuilder> implements GetRequestBuilder {
        private boolean streamed;

        JdkGetRequestBuilder(String path) {
            super(path);
        }

        @Override
        public GetRequestBuilder streamed() {
            this.streamed = true;
            return this;
        }

        @Override
        public CompletableFuture<HttpResponse> send() {
            HttpRequest request = super.createRequestBuilder().GET().build();
            BodyHandler<?> bodyHandler = streamed ? BodyHandlers.ofPublisher() : BodyHandlers.ofString(UTF_8);
            return exchange(request, bodyHandler);
        }
    }

    private class JdkDeleteBuilder extends JdkRequestBuilder<DeleteRequestBuilder> implements DeleteRequestBuilder {

        JdkDeleteBuilder(String path) {
            super(path);
        }

        @Override
        public CompletableFuture<HttpResponse> send() {
            HttpRequest request = super.createRequestBuilder().DELETE().build();
            return exchange(request, BodyHandlers.ofString(UTF_8));
        }
    }

    private class JdkPostRequestBuilder extends JdkBodyRequestBuilder<PostRequestBuilder> implements PostRequestBuilder {

        JdkPostRequestBuilder(String path) {
            super(path);
        }

        @Override
        public CompletableFuture<HttpResponse> send() {
            HttpRequest request = super.createRequestBuilder().POST(bodyPublisher()).build();
            return exchange(request, BodyHandlers.ofString(UTF_8));
        }
    }

    private class JdkPutRequestBuilder extends JdkBodyRequestBuilder<PutRequestBuilder> implements PutRequestBuilder {

        JdkPutRequestBuilder(String path) {
            super(path);
        }

        @Override
        public CompletableFuture<HttpResponse> send() {
            HttpRequest request = super.createRequestBuilder().PUT(bodyPublisher()).build();
            return exchange(request, BodyHandlers.ofString(UTF_8));
        }
    }

    private class JdkPatchRequestBuilder extends JdkBodyRequestBuilder<PatchRequestBuilder> implements PatchRequestBuilder {

        JdkPatchRequestBuilder(String path) {
            super(path);
        }

        @Override
        public CompletableFuture<HttpResponse> send() {
            HttpRequest request = super.createRequestBuilder().method("PATCH", bodyPublisher()).build();
            return exchange(request, BodyHandlers.ofString(UTF_8));
        }
    }

    private record JdkHttpResponse(java.net.http.HttpResponse<?> response) implements HttpResponse {

        @Override
        public int statusCode() {
            return response.statusCode();
        }

        @Override
        public Optional<String> header(String name) {
            return response.headers().firstValue(name);
        }

        @Override
        public CompletableFuture<String> body() {
            Object body = response.body();
            if (body instanceof String) {
                return CompletableFuture.completedFuture((String) body);
            }
            BodySubscriber<String> aggregator = BodySubscribers.ofString(UTF_8);
            bodyAsPublisher().subscribe(aggregator);
            return aggregator.getBody().toCompletableFuture();
        }

        @Override
        @SuppressWarnings("unchecked")
        public Flow.Publisher<List<ByteBuffer>> bodyAsPublisher() {
            Object body = response.body();
            if (body instanceof Flow.Publisher) {
                return (Flow.Publisher<List<ByteBuffer>>) body;
            }
            throw new IllegalStateException("Response body was not requested as a stream");
        }
    }
}
