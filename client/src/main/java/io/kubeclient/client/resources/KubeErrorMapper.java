package io.kubeclient.client.resources;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.kubeclient.client.http.HttpResponse;
import io.kubeclient.model.KubeClientException;
import io.kubeclient.model.StatusV1;
import io.kubeclient.util.Utils;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns non-success responses into {@link KubeClientException}s.
 * <p>
 * The body is read as a {@link StatusV1} when it is one. Parsing never fails: a body that is not
 * Status JSON still yields an exception carrying the HTTP status code.
 */
final class KubeErrorMapper {

    private static final Logger LOGGER = LoggerFactory.getLogger(KubeErrorMapper.class);

    private KubeErrorMapper() {
    }

    /**
     * Fails with a {@link KubeClientException} built from the response.
     *
     * @param response the non-success response
     * @param action what was attempted, for example {@code "Failed to retrieve"}
     * @param resourceTypeDescription the resource type involved
     * @param <T> the type the caller expected
     * @return a stage that always completes exceptionally
     */
    static <T> CompletionStage<T> mapError(HttpResponse response, String action, String resourceTypeDescription) {
        return response.body()
                .handle((body, failure) -> {
                    if (failure != null) {
                        LOGGER.debug("Could not read body of HTTP {} response", response.statusCode(), failure);
                    }
                    Optional<StatusV1> status = failure == null ? parseStatus(body) : Optional.empty();
                    return toException(action, response.statusCode(), status, resourceTypeDescription);
                })
                .thenCompose(e -> CompletableFuture.<T>failedFuture(e));
    }

    static KubeClientException toException(String action, int statusCode, Optional<StatusV1> status,
                                           String resourceTypeDescription) {
        String message = action + " " + resourceTypeDescription + " (HTTP status " + statusCode + ").";
        return new KubeClientException(message, statusCode, status.orElse(null), resourceTypeDescription);
    }

    /**
     * Reads a response body as a Status document.
     *
     * @return the status, or empty if the body is blank, not JSON, or a JSON document of another kind
     */
    static Optional<StatusV1> parseStatus(@Nullable String body) {
        if (Utils.isBlank(body)) {
            return Optional.empty();
        }
        try {
            JsonNode tree = Utils.OBJECT_MAPPER.readTree(body);
            if (tree == null || !tree.isObject()) {
                return Optional.empty();
            }
            JsonNode kind = tree.get("kind");
            if (kind != null && !StatusV1.KIND.equals(kind.asText())) {
                return Optional.empty();
            }
            return Optional.of(Utils.OBJECT_MAPPER.treeToValue(tree, StatusV1.class));
        } catch (JsonProcessingException e) {
            LOGGER.debug("Response body is not a Status document: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }
}
