package io.kubeclient.client.resources;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import io.kubeclient.client.http.lines.LineStream;
import io.kubeclient.model.KubeClientException;
import io.kubeclient.model.KubeProtocolException;
import io.kubeclient.model.KubeResource;
import io.kubeclient.model.ResourceEventType;
import io.kubeclient.model.ResourceEventV1;
import io.kubeclient.model.StatusV1;
import io.kubeclient.util.Assert;
import io.kubeclient.util.Utils;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Typed view of a watch: each line of the underlying {@link LineStream} becomes one
 * {@link ResourceEventV1}, in arrival order.
 * <p>
 * A line that is not a valid event ends the stream with a {@link KubeProtocolException}. An
 * {@link ResourceEventType#ERROR ERROR} event ends it with a {@link KubeClientException} built
 * from the Status it carries. In both cases the underlying request is cancelled and no further
 * events are produced. Blank lines are skipped.
 *
 * <pre>{@code
 * try (ResourceEventStream<ConfigMapV1> events = client.configMapsV1().watchAll(null, "default")) {
 *     while (events.hasNext()) {
 *         ResourceEventV1<ConfigMapV1> event = events.next();
 *         ...
 *     }
 * }
 * }</pre>
 *
 * @param <T> the resource type
 */
public final class ResourceEventStream<T extends KubeResource> implements Iterator<ResourceEventV1<T>>, AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(ResourceEventStream.class);
    // Status of the watch response itself; a stream only exists once the server answered 200.
    private static final int WATCH_RESPONSE_CODE = 200;

    private final LineStream lines;
    private final JavaType eventType;
    private final String resourceTypeDescription;
    private @Nullable ResourceEventV1<T> next;

    public ResourceEventStream(LineStream lines, Class<T> resourceType, String resourceTypeDescription) {
        this.lines = Assert.checkNotNullParam("lines", lines);
        Assert.checkNotNullParam("resourceType", resourceType);
        this.eventType = Utils.OBJECT_MAPPER.getTypeFactory().constructParametricType(ResourceEventV1.class, resourceType);
        this.resourceTypeDescription = Assert.checkNotNullParam("resourceTypeDescription", resourceTypeDescription);
    }

    @Override
    public boolean hasNext() {
        if (next != null) {
            return true;
        }
        while (lines.hasNext()) {
            String line = lines.next();
            if (line.isBlank()) {
                continue;
            }
            next = map(line);
            return true;
        }
        return false;
    }

    @Override
    public ResourceEventV1<T> next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        ResourceEventV1<T> event = next;
        next = null;
        return event;
    }

    /**
     * @return a sequential view of the remaining events; closing it closes this stream
     */
    public Stream<ResourceEventV1<T>> stream() {
        return StreamSupport.stream(
                        Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED | Spliterator.NONNULL), false)
                .onClose(this::close);
    }

    public boolean isClosed() {
        return lines.isClosed();
    }

    @Override
    public void close() {
        lines.close();
    }

    private ResourceEventV1<T> map(String line) {
        try {
            JsonNode tree = Utils.OBJECT_MAPPER.readTree(line);
            if (tree == null || !tree.isObject()) {
                throw malformed("event is not a JSON object", null);
            }
            JsonNode type = tree.get("type");
            if (type != null && ResourceEventType.ERROR.name().equals(type.asText())) {
                throw watchError(tree.get("object"));
            }
            return Utils.OBJECT_MAPPER.treeToValue(tree, eventType);
        } catch (JsonProcessingException e) {
            throw malformed(e.getOriginalMessage(), e);
        }
    }

    private KubeProtocolException malformed(@Nullable String reason, @Nullable Throwable cause) {
        lines.close();
        String message = "Malformed watch event for " + resourceTypeDescription + ": " + reason;
        return cause == null ? new KubeProtocolException(message) : new KubeProtocolException(message, cause);
    }

    private KubeClientException watchError(@Nullable JsonNode object) {
        lines.close();
        Optional<StatusV1> status = object == null
                ? Optional.empty()
                : KubeErrorMapper.parseStatus(object.toString());
        int code = status.map(StatusV1::code).orElse(WATCH_RESPONSE_CODE);
        LOGGER.debug("Watch of {} ended by ERROR event (code {})", resourceTypeDescription, code);
        return KubeErrorMapper.toException("Watch failed for", code, status, resourceTypeDescription);
    }
}
