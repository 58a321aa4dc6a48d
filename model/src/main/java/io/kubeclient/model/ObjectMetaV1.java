package io.kubeclient.model;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.jspecify.annotations.Nullable;

/**
 * Standard metadata carried by every persisted resource.
 *
 * @param name the resource name, unique within its namespace
 * @param namespace the namespace, {@code null} for cluster-scoped kinds
 * @param generateName prefix used by the server to generate a name when none is given
 * @param uid the server-assigned unique identifier
 * @param resourceVersion opaque version used for optimistic concurrency and watches
 * @param generation sequence number of the desired state
 * @param creationTimestamp RFC 3339 creation time
 * @param deletionTimestamp RFC 3339 time at which graceful deletion was requested
 * @param labels identifying labels, never {@code null}
 * @param annotations non-identifying annotations, never {@code null}
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ObjectMetaV1(@Nullable String name,
                           @Nullable String namespace,
                           @Nullable String generateName,
                           @Nullable String uid,
                           @Nullable String resourceVersion,
                           @Nullable Long generation,
                           @Nullable String creationTimestamp,
                           @Nullable String deletionTimestamp,
                           Map<String, String> labels,
                           Map<String, String> annotations) {

    public ObjectMetaV1 {
        labels = labels == null ? Map.of() : Map.copyOf(labels);
        annotations = annotations == null ? Map.of() : Map.copyOf(annotations);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link ObjectMetaV1}. Only the commonly set fields are exposed; server-assigned
     * fields are left {@code null}.
     */
    public static class Builder {
        private @Nullable String name;
        private @Nullable String namespace;
        private @Nullable String generateName;
        private @Nullable String resourceVersion;
        private @Nullable Map<String, String> labels;
        private @Nullable Map<String, String> annotations;

        private Builder() {
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder namespace(String namespace) {
            this.namespace = namespace;
            return this;
        }

        public Builder generateName(String generateName) {
            this.generateName = generateName;
            return this;
        }

        public Builder resourceVersion(String resourceVersion) {
            this.resourceVersion = resourceVersion;
            return this;
        }

        public Builder labels(Map<String, String> labels) {
            this.labels = labels;
            return this;
        }

        public Builder annotations(Map<String, String> annotations) {
            this.annotations = annotations;
            return this;
        }

        public ObjectMetaV1 build() {
            return new ObjectMetaV1(name, namespace, generateName, null, resourceVersion, null,
                    null, null, labels, annotations);
        }
    }
}
