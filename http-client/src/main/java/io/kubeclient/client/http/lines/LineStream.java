package io.kubeclient.client.http.lines;

import java.nio.ByteBuffer;
import java.nio.charset.Charset;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Flow;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import io.kubeclient.model.KubeException;
import io.kubeclient.model.KubeStreamException;
import io.kubeclient.util.Assert;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cancellable channel of text lines read from a streamed HTTP body.
 * <p>
 * The producer side is a {@link Flow.Subscriber} obtained from {@link #subscriber(Charset)} and
 * attached to the response body publisher. It requests one chunk at a time and stops requesting
 * while the channel holds {@link #getCapacity()} lines or more; taking a line resumes it.
 * <p>
 * The consumer side is this iterator. {@link #hasNext()} blocks until a line arrives, the body
 * ends, or the channel is closed. A failure not caused by {@link #close()} is rethrown from
 * {@link #hasNext()} once the lines received before it have been consumed.
 * <p>
 * {@link #close()} may be called from any thread. It cancels the body subscription, runs the
 * registered close handlers and ends the iteration normally. Signals that arrive afterwards are
 * dropped.
 */
public final class LineStream implements Iterator<String>, AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(LineStream.class);

    /**
     * Default number of buffered lines above which no more body chunks are requested.
     */
    public static final int DEFAULT_CAPACITY = 1000;

    private static final Signal END = new Signal(null, null);

    private final BlockingQueue<Signal> queue = new LinkedBlockingQueue<>();
    private final List<Runnable> closeHandlers = new CopyOnWriteArrayList<>();
    private final AtomicBoolean closed = new AtomicBoolean();
    private final AtomicBoolean awaitingDemand = new AtomicBoolean();
    private final int capacity;

    private volatile Flow.@Nullable Subscription subscription;

    // consumer-side state, confined to the iterating thread
    private @Nullable String next;
    private boolean finished;

    public LineStream() {
        this(DEFAULT_CAPACITY);
    }

    /**
     * @param capacity number of buffered lines above which the producer pauses
     * @throws IllegalArgumentException if capacity is less than or equal to 0
     */
    public LineStream(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be greater than 0");
        }
        this.capacity = capacity;
    }

    public int getCapacity() {
        return capacity;
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Creates the producer for this channel. Only one subscriber may be attached.
     *
     * @param charset the charset of the body
     * @return a subscriber decoding body chunks into this channel
     */
    public Flow.Subscriber<List<ByteBuffer>> subscriber(Charset charset) {
        return new DecodingSubscriber(new LineDecoder(charset));
    }

    /**
     * Ends the channel with a failure. Ignored once the channel is closed.
     *
     * @param failure the cause; {@link KubeException}s reach the consumer unchanged
     */
    public void fail(Throwable failure) {
        Assert.checkNotNullParam("failure", failure);
        signal(new Signal(null, failure));
    }

    /**
     * Registers an action run once by {@link #close()}, for example to abort a request still in
     * flight. Runs immediately if the channel is already closed.
     */
    public void onClose(Runnable handler) {
        Assert.checkNotNullParam("handler", handler);
        closeHandlers.add(handler);
        if (closed.get() && closeHandlers.remove(handler)) {
            runCloseHandler(handler);
        }
    }

    @Override
    public boolean hasNext() {
        if (next != null) {
            return true;
        }
        if (finished) {
            return false;
        }
        if (closed.get()) {
            finished = true;
            return false;
        }

        Signal signal;
        try {
            signal = queue.take();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            finished = true;
            close();
            throw new KubeStreamException("Interrupted while waiting for the next line", e);
        }
        resumeDemand();

        if (signal == END || closed.get()) {
            finished = true;
            return false;
        }
        if (signal.error() != null) {
            finished = true;
            close();
            throw asKubeException(signal.error());
        }
        next = signal.line();
        return true;
    }

    @Override
    public String next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        String line = next;
        next = null;
        return line;
    }

    /**
     * @return a sequential view of the remaining lines; closing it closes this channel
     */
    public Stream<String> stream() {
        return StreamSupport.stream(
                        Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED | Spliterator.NONNULL), false)
                .onClose(this::close);
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        LOGGER.debug("Closing line stream");
        Flow.Subscription current = subscription;
        if (current != null) {
            current.cancel();
        }
        for (Runnable handler : closeHandlers) {
            if (closeHandlers.remove(handler)) {
                runCloseHandler(handler);
            }
        }
        queue.clear();
        queue.offer(END);
    }

    private void signal(Signal signal) {
        if (closed.get()) {
            if (signal.error() != null) {
                LOGGER.debug("Dropping failure received after close", signal.error());
            }
            return;
        }
        queue.offer(signal);
    }

    private void resumeDemand() {
        Flow.Subscription current = subscription;
        if (current != null && queue.size() < capacity && awaitingDemand.compareAndSet(true, false)) {
            current.request(1);
        }
    }

    private static void runCloseHandler(Runnable handler) {
        try {
            handler.run();
        } catch (RuntimeException e) {
            LOGGER.warn("Close handler failed", e);
        }
    }

    private static KubeException asKubeException(Throwable failure) {
        Throwable cause = failure;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof KubeException) {
            return (KubeException) cause;
        }
        return new KubeStreamException("Stream failed: " + cause.getMessage(), cause);
    }

    private record Signal(@Nullable String line, @Nullable Throwable error) {
    }

    private final class DecodingSubscriber implements Flow.Subscriber<List<ByteBuffer>> {

        private final LineDecoder decoder;
        private boolean subscribed;

        private DecodingSubscriber(LineDecoder decoder) {
            this.decoder = decoder;
        }

        @Override
        public void onSubscribe(Flow.Subscription s) {
            if (subscribed) {
                s.cancel();
                return;
            }
            subscribed = true;
            subscription = s;
            if (closed.get()) {
                s.cancel();
                return;
            }
            s.request(1);
        }

        @Override
        public void onNext(List<ByteBuffer> chunks) {
            if (closed.get()) {
                return;
            }
            for (ByteBuffer chunk : chunks) {
                for (String line : decoder.decode(chunk)) {
                    signal(new Signal(line, null));
                }
            }
            Flow.Subscription current = subscription;
            if (current == null) {
                return;
            }
            if (queue.size() < capacity) {
                current.request(1);
            } else {
                awaitingDemand.set(true);
                // the consumer may have drained the queue before the flag was set
                resumeDemand();
            }
        }

        @Override
        public void onError(Throwable throwable) {
            signal(new Signal(null, throwable));
        }

        @Override
        public void onComplete() {
            decoder.flush().ifPresent(line -> signal(new Signal(line, null)));
            signal(END);
        }
    }
}
