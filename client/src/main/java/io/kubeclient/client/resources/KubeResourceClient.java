package io.kubeclient.client.resources;

import java.nio.ByteBuffer;
import java.nio.charset.Charset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Flow;
import java.util.function.Consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.kubeclient.client.KubeApiClient;
import io.kubeclient.client.http.HttpClient;
import io.kubeclient.client.http.HttpResponse;
import io.kubeclient.client.http.lines.LineDecoder;
import io.kubeclient.client.http.lines.LineStream;
import io.kubeclient.client.patch.JsonPatchDocument;
import io.kubeclient.client.patch.PatchOperations;
import io.kubeclient.client.patch.TypedJsonPatchDocument;
import io.kubeclient.model.KubeClientException;
import io.kubeclient.model.KubeException;
import io.kubeclient.model.KubeKind;
import io.kubeclient.model.KubeKindRegistry;
import io.kubeclient.model.KubeProtocolException;
import io.kubeclient.model.KubeResource;
import io.kubeclient.model.KubeResourceList;
import io.kubeclient.model.StatusV1;
import io.kubeclient.util.Assert;
import io.kubeclient.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for resource API clients.
 * <p>
 * Every operation turns the HTTP outcome into either a typed result or a
 * {@link KubeClientException} carrying the status code, the {@link StatusV1} returned by the server
 * when there is one, and a description of the resource type. Futures returned here complete
 * exceptionally with {@link KubeException}s, wrapped in a {@link CompletionException} by
 * {@link CompletableFuture#join()}.
 */
public abstract class KubeResourceClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(KubeResourceClient.class);

    public static final String JSON_MEDIA_TYPE = "application/json";
    public static final String PATCH_MEDIA_TYPE = "application/json-patch+json";
    public static final String MERGE_PATCH_MEDIA_TYPE = "application/merge-patch+json";

    private final KubeApiClient client;

    protected KubeResourceClient(KubeApiClient client) {
        this.client = Assert.checkNotNullParam("client", client);
    }

    public KubeApiClient getClient() {
        return client;
    }

    protected HttpClient http() {
        return client.getHttpClient();
    }

    protected KubeKindRegistry kindRegistry() {
        return client.getKindRegistry();
    }

    /**
     * Fetches one resource.
     *
     * @return the resource, or empty if the server reports it as {@code NotFound}
     */
    protected <T extends KubeResource> CompletableFuture<Optional<T>> getSingleResource(Class<T> resourceType,
                                                                                         ResourceRequest request) {
        Assert.checkNotNullParam("resourceType", resourceType);
        Assert.checkNotNullParam("request", request);
        String description = kindRegistry().describeResource(resourceType);
        String action = "Failed to retrieve";

        return send(http().get(request.path()), action, description)
                .thenCompose(response -> {
                    if (response.success()) {
                        return response.body().thenApply(body -> Optional.of(read(body, resourceType, description)));
                    }
                    if (response.statusCode() != 404) {
                        return KubeErrorMapper.mapError(response, action, description);
                    }
                    // a 404 without reason NotFound means the path itself is wrong
                    return response.body().thenCompose(body -> {
                        Optional<StatusV1> status = KubeErrorMapper.parseStatus(body);
                        if (status.map(StatusV1::isNotFound).orElse(false)) {
                            return CompletableFuture.completedFuture(Optional.<T>empty());
                        }
                        return CompletableFuture.failedFuture(
                                KubeErrorMapper.toException(action, response.statusCode(), status, description));
                    });
                });
    }

    /**
     * Fetches a list of resources. Items that declare a kind other than the list's registered
     * item kind are rejected.
     */
    protected <L extends KubeResourceList<?>> CompletableFuture<L> getResourceList(Class<L> listType,
                                                                                 ResourceRequest request) {
        Assert.checkNotNullParam("listType", listType);
        Assert.checkNotNullParam("request", request);
        String description = kindRegistry().describeResourceList(listType);
        String action = "Failed to list";

        return send(http().get(request.path()), action, description)
                .thenCompose(response -> {
                    if (!response.success()) {
                        return KubeErrorMapper.mapError(response, action, description);
                    }
                    return response.body().thenApply(body -> {
                        L list = read(body, listType, description);
                        kindRegistry().listItemKindOf(listType).ifPresent(itemKind -> checkItemKinds(list, itemKind, description));
                        return list;
                    });
                });
    }

    /**
     * Applies a JSON-Patch whose paths are checked against {@code resourceType}.
     *
     * @param patchAction populates the patch document
     */
    protected <T extends KubeResource> CompletableFuture<T> patchResource(Class<T> resourceType,
                                                                          Consumer<TypedJsonPatchDocument<T>> patchAction,
                                                                          ResourceRequest request) {
        Assert.checkNotNullParam("resourceType", resourceType);
        Assert.checkNotNullParam("patchAction", patchAction);
        Assert.checkNotNullParam("request", request);
        TypedJsonPatchDocument<T> patch = new TypedJsonPatchDocument<>(resourceType);
        patchAction.accept(patch);
        return sendPatch(resourceType, patch.getOperations(), request);
    }

    /**
     * Applies a JSON-Patch addressed by raw JSON Pointers.
     *
     * @param patchAction populates the patch document
     */
    protected <T extends KubeResource> CompletableFuture<T> patchResourceRaw(Class<T> resourceType,
                                                                             Consumer<JsonPatchDocument> patchAction,
                                                                             ResourceRequest request) {
        Assert.checkNotNullParam("resourceType", resourceType);
        Assert.checkNotNullParam("patchAction", patchAction);
        Assert.checkNotNullParam("request", request);
        JsonPatchDocument patch = new JsonPatchDocument();
        patchAction.accept(patch);
        return sendPatch(resourceType, patch.getOperations(), request);
    }

    /**
     * Applies a JSON merge patch (RFC 7386).
     *
     * @param mergeDocument any value serializing to a JSON object; {@code null} members remove fields
     */
    protected <T extends KubeResource> CompletableFuture<T> patchResourceMerge(Class<T> resourceType,
                                                                               Object mergeDocument,
                                                                               ResourceRequest request) {
        Assert.checkNotNullParam("resourceType", resourceType);
        Assert.checkNotNullParam("mergeDocument", mergeDocument);
        Assert.checkNotNullParam("request", request);
        String description = kindRegistry().describeResource(resourceType);
        String body;
        try {
            body = mergeDocument instanceof String ? (String) mergeDocument : Utils.marshal(mergeDocument);
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(
                    new KubeProtocolException("Unable to serialize merge patch for " + description + ".", e));
        }
        HttpClient.PatchRequestBuilder builder = http().patch(request.path())
                .contentType(MERGE_PATCH_MEDIA_TYPE)
                .body(body);
        return expectResource(send(builder, "Failed to patch", description), resourceType, "Failed to patch", description);
    }

    /**
     * Creates a resource (POST to the collection).
     */
    protected <T extends KubeResource> CompletableFuture<T> createResource(Class<T> resourceType, T resource,
                                                                           ResourceRequest request) {
        Assert.checkNotNullParam("request", request);
        return sendResource(resourceType, resource, "Failed to create", http().post(request.path()));
    }

    /**
     * Replaces a resource (PUT). The server rejects the request if {@code metadata.resourceVersion}
     * is stale.
     */
    protected <T extends KubeResource> CompletableFuture<T> replaceResource(Class<T> resourceType, T resource,
                                                                            ResourceRequest request) {
        Assert.checkNotNullParam("request", request);
        return sendResource(resourceType, resource, "Failed to replace", http().put(request.path()));
    }

    /**
     * Deletes a resource.
     *
     * @return the Status reported by the server, or a synthesized success Status when the server
     *         answers with the deleted resource instead
     */
    protected CompletableFuture<StatusV1> deleteResource(Class<? extends KubeResource> resourceType,
                                                         ResourceRequest request) {
        Assert.checkNotNullParam("resourceType", resourceType);
        Assert.checkNotNullParam("request", request);
        String description = kindRegistry().describeResource(resourceType);
        String action = "Failed to delete";

        return send(http().delete(request.path()), action, description)
                .thenCompose(response -> {
                    if (!response.success()) {
                        return KubeErrorMapper.mapError(response, action, description);
                    }
                    // the server answers with either a Status or the deleted object
                    return response.body().thenApply(body -> KubeErrorMapper.parseStatus(body)
                            .filter(status -> StatusV1.KIND.equals(status.kind()))
                            .orElseGet(() -> StatusV1.success("Deleted " + description + ".")));
                });
    }

    /**
     * Opens a streamed GET and exposes its body as lines.
     * <p>
     * The stream is returned before the response arrives. A non-success response ends it with a
     * {@link KubeClientException}; a response without {@code Content-Type} or with an unknown
     * charset ends it with a {@link KubeProtocolException}. Closing the stream aborts the request
     * or releases the connection.
     */
    protected LineStream observeLines(ResourceRequest request, String resourceTypeDescription) {
        Assert.checkNotNullParam("request", request);
        String action = "Failed to watch";
        LineStream lines = new LineStream(client.getOptions().getStreamCapacity());

        HttpClient.GetRequestBuilder watch = http().get(request.path()).streamed();
        addDefaultHeaders(watch);
        CompletableFuture<HttpResponse> exchange = watch.send();
        lines.onClose(() -> exchange.cancel(true));
        exchange.whenComplete((response, failure) -> {
            if (failure != null) {
                lines.fail(transportFailure(action, resourceTypeDescription, failure));
                return;
            }
            LOGGER.debug("Watch {} answered HTTP {}", request.getPathTemplate(), response.statusCode());
            if (!response.success()) {
                KubeErrorMapper.mapError(response, action, resourceTypeDescription)
                        .whenComplete((ignored, error) -> {
                            if (error != null) {
                                lines.fail(error);
                            }
                        });
                return;
            }
            Optional<String> contentType = response.contentType();
            if (contentType.isEmpty()) {
                discard(response);
                lines.fail(new KubeProtocolException("Response is missing 'Content-Type' header."));
                return;
            }
            Charset charset;
            try {
                charset = LineDecoder.charsetOf(contentType.get());
            } catch (KubeProtocolException e) {
                discard(response);
                lines.fail(e);
                return;
            }
            response.bodyAsPublisher().subscribe(lines.subscriber(charset));
        });
        return lines;
    }

    protected LineStream observeLines(ResourceRequest request) {
        return observeLines(request, request.getPathTemplate());
    }

    /**
     * Opens a watch and maps each line to a {@link io.kubeclient.model.ResourceEventV1}.
     */
    protected <T extends KubeResource> ResourceEventStream<T> observeEvents(Class<T> resourceType,
                                                                            ResourceRequest request) {
        Assert.checkNotNullParam("resourceType", resourceType);
        String description = kindRegistry().describeResources(resourceType);
        return new ResourceEventStream<>(observeLines(request, description), resourceType, description);
    }

    private <T extends KubeResource> CompletableFuture<T> sendResource(Class<T> resourceType, T resource,
                                                                       String action,
                                                                       HttpClient.BodyRequestBuilder<?> builder) {
        Assert.checkNotNullParam("resourceType", resourceType);
        Assert.checkNotNullParam("resource", resource);
        String description = kindRegistry().describeResource(resourceType);
        String body;
        try {
            body = Utils.marshal(resource);
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(
                    new KubeProtocolException("Unable to serialize " + description + ".", e));
        }
        builder.contentType(JSON_MEDIA_TYPE).body(body);
        return expectResource(send(builder, action, description), resourceType, action, description);
    }

    private <T extends KubeResource> CompletableFuture<T> sendPatch(Class<T> resourceType, PatchOperations operations,
                                                                    ResourceRequest request) {
        String description = kindRegistry().describeResource(resourceType);
        String body;
        try {
            body = operations.serialize();
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(
                    new KubeProtocolException("Unable to serialize patch for " + description + ".", e));
        }
        HttpClient.PatchRequestBuilder builder = http().patch(request.path())
                .contentType(PATCH_MEDIA_TYPE)
                .body(body);
        return expectResource(send(builder, "Failed to patch", description), resourceType, "Failed to patch", description);
    }

    private <T> CompletableFuture<T> expectResource(CompletableFuture<HttpResponse> exchange, Class<T> type,
                                                    String action, String description) {
        return exchange.thenCompose(response -> {
            if (!response.success()) {
                return KubeErrorMapper.mapError(response, action, description);
            }
            return response.body().thenApply(body -> read(body, type, description));
        });
    }

    private void addDefaultHeaders(HttpClient.RequestBuilder<?> builder) {
        builder.addHeader("Accept", JSON_MEDIA_TYPE);
        builder.addHeaders(client.getOptions().getDefaultHeaders());
    }

    private CompletableFuture<HttpResponse> send(HttpClient.RequestBuilder<?> builder, String action,
                                                 String description) {
        addDefaultHeaders(builder);
        return builder.send().handle((response, failure) -> {
            if (failure != null) {
                throw transportFailure(action, description, failure);
            }
            LOGGER.debug("{} answered HTTP {}", description, response.statusCode());
            return response;
        });
    }

    private static <T> T read(String body, Class<T> type, String description) {
        try {
            return Utils.unmarshalFrom(body, type);
        } catch (JsonProcessingException e) {
            throw new KubeProtocolException("Unable to deserialize " + description + " from response body: "
                    + e.getOriginalMessage(), e);
        }
    }

    private static void checkItemKinds(KubeResourceList<?> list, KubeKind itemKind, String description) {
        for (KubeResource item : list.items()) {
            boolean kindMismatch = item.kind() != null && !itemKind.kind().equals(item.kind());
            boolean versionMismatch = item.apiVersion() != null && !itemKind.apiVersion().equals(item.apiVersion());
            if (kindMismatch || versionMismatch) {
                throw new KubeProtocolException("List of " + description + " contains an item of kind "
                        + item.kind() + " (" + item.apiVersion() + ").");
            }
        }
    }

    private static KubeException transportFailure(String action, String description, Throwable failure) {
        Throwable cause = failure;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof KubeException) {
            return (KubeException) cause;
        }
        return new KubeClientException(action + " " + description + ": " + cause.getMessage(), description, cause);
    }

    private static void discard(HttpResponse response) {
        response.bodyAsPublisher().subscribe(new Flow.Subscriber<List<ByteBuffer>>() {
            @Override
            public void onSubscribe(Flow.Subscription subscription) {
                subscription.cancel();
            }

            @Override
            public void onNext(List<ByteBuffer> item) {
                // cancelled before any demand
            }

            @Override
            public void onError(Throwable throwable) {
                LOGGER.debug("Discarded response body failed", throwable);
            }

            @Override
            public void onComplete() {
                // nothing to release
            }
        });
    }
}
