package io.kubeclient.client.http.vertx;

import java.nio.ByteBuffer;
import java.util.List;
import java.util.concurrent.Flow;
import java.util.concurrent.atomic.AtomicBoolean;

import io.vertx.core.http.HttpClientResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Exposes a paused response body as a single-subscriber {@link Flow.Publisher}. Subscriber demand
 * is forwarded to {@link HttpClientResponse#fetch(long)}; cancelling resets the request, which
 * closes the connection.
 */
final class VertxBodyPublisher implements Flow.Publisher<List<ByteBuffer>> {

    private static final Logger LOGGER = LoggerFactory.getLogger(VertxBodyPublisher.class);

    private final HttpClientResponse response;
    private final AtomicBoolean subscribed = new AtomicBoolean();

    VertxBodyPublisher(HttpClientResponse response) {
        this.response = response;
    }

    @Override
    public void subscribe(Flow.Subscriber<? super List<ByteBuffer>> subscriber) {
        if (!subscribed.compareAndSet(false, true)) {
            subscriber.onSubscribe(new Flow.Subscription() {
                @Override
                public void request(long n) {
                    // nothing is ever delivered
                }

                @Override
                public void cancel() {
                    // nothing to release
                }
            });
            subscriber.onError(new IllegalStateException("Response body already has a subscriber"));
            return;
        }

        AtomicBoolean done = new AtomicBoolean();
        response.handler(buffer -> {
            if (!done.get()) {
                subscriber.onNext(List.of(ByteBuffer.wrap(buffer.getBytes())));
            }
        });
        response.endHandler(v -> {
            if (done.compareAndSet(false, true)) {
                subscriber.onComplete();
            }
        });
        response.exceptionHandler(failure -> {
            if (done.compareAndSet(false, true)) {
                subscriber.onError(failure);
            }
        });
        subscriber.onSubscribe(new Flow.Subscription() {
            @Override
            public void request(long n) {
                if (n <= 0) {
                    if (done.compareAndSet(false, true)) {
                        response.request().reset();
                        subscriber.onError(new IllegalArgumentException("Demand must be positive: " + n));
                    }
                    return;
                }
                response.fetch(n);
            }

            @Override
            public void cancel() {
                if (done.compareAndSet(false, true)) {
                    LOGGER.debug("Body of {} {} cancelled", response.request().getMethod(), response.request().getURI());
                    response.request().reset();
                }
            }
        });
    }
}
