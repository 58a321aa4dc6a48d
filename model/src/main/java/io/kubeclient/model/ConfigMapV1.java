package io.kubeclient.model;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.jspecify.annotations.Nullable;

/**
 * Holds configuration data for pods to consume.
 *
 * @param kind always {@value #KIND}
 * @param apiVersion always {@value #API_VERSION}
 * @param metadata standard object metadata
 * @param data UTF-8 configuration entries, never {@code null}
 * @param binaryData base64-encoded binary entries, never {@code null}
 * @param immutable whether the data may no longer be updated
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ConfigMapV1(@Nullable String kind,
                          @Nullable String apiVersion,
                          @Nullable ObjectMetaV1 metadata,
                          Map<String, String> data,
                          Map<String, String> binaryData,
                          @Nullable Boolean immutable) implements KubeResource {

    public static final String KIND = "ConfigMap";
    public static final String API_VERSION = "v1";

    public ConfigMapV1 {
        data = data == null ? Map.of() : Map.copyOf(data);
        binaryData = binaryData == null ? Map.of() : Map.copyOf(binaryData);
    }

    public ConfigMapV1(ObjectMetaV1 metadata, Map<String, String> data) {
        this(KIND, API_VERSION, metadata, data, Map.of(), null);
    }
}
