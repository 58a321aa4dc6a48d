package io.kubeclient.client.http;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

import org.jspecify.annotations.Nullable;

/**
 * Performs HTTP exchanges against one API server.
 * <p>
 * Paths are resolved against the base URL given to {@link HttpClientBuilder#create(String)}.
 * A response is produced for every status code; only transport failures complete the
 * returned future exceptionally.
 */
public interface HttpClient {

    static HttpClient createHttpClient(String baseUrl) {
        return HttpClientBuilder.DEFAULT_FACTORY.create(baseUrl);
    }

    GetRequestBuilder get(String path);

    PostRequestBuilder post(String path);

    PutRequestBuilder put(String path);

    PatchRequestBuilder patch(String path);

    DeleteRequestBuilder delete(String path);

    interface RequestBuilder<T extends RequestBuilder<T>> {
        CompletableFuture<HttpResponse> send();

        T addHeader(String name, String value);

        T addHeaders(Map<String, String> headers);
    }

    interface BodyRequestBuilder<T extends BodyRequestBuilder<T>> extends RequestBuilder<T> {
        T body(@Nullable String body);

        default T contentType(String mediaType) {
            return addHeader("Content-Type", mediaType);
        }

        default CompletableFuture<HttpResponse> send(String body) {
            return this.body(body).send();
        }
    }

    interface GetRequestBuilder extends RequestBuilder<GetRequestBuilder> {

        /**
         * Delivers the body incrementally through {@link HttpResponse#bodyAsPublisher()} instead
         * of buffering it. Used for watches, which never end on their own.
         */
        GetRequestBuilder streamed();
    }

    interface PostRequestBuilder extends BodyRequestBuilder<PostRequestBuilder> {

    }

    interface PutRequestBuilder extends BodyRequestBuilder<PutRequestBuilder> {

    }

    interface PatchRequestBuilder extends BodyRequestBuilder<PatchRequestBuilder> {

    }

    interface DeleteRequestBuilder extends RequestBuilder<DeleteRequestBuilder> {

    }
}
