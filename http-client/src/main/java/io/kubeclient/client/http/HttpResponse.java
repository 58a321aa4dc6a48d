package io.kubeclient.client.http;

import java.nio.ByteBuffer;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Flow;

public interface HttpResponse {

    int statusCode();

    default boolean success() {
        return statusCode() >= 200 && statusCode() < 300;
    }

    Optional<String> header(String name);

    default Optional<String> contentType() {
        return header("Content-Type");
    }

    /**
     * @return the whole body decoded as UTF-8; for a streamed response this waits for the
     *         server to close the body
     */
    CompletableFuture<String> body();

    /**
     * Raw body chunks of a streamed response. Cancelling the subscription releases the connection.
     *
     * @throws IllegalStateException if the request was not {@linkplain HttpClient.GetRequestBuilder#streamed() streamed}
     */
    Flow.Publisher<List<ByteBuffer>> bodyAsPublisher();
}
