package io.kubeclient.model;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import io.kubeclient.util.Assert;

/**
 * Maps model types to the {@link KubeKind} they declare.
 * <p>
 * Resource types map to their own kind. List types map to the kind of the items they hold.
 * The registry only describes resource types in error messages and validates list contents;
 * it never drives request routing.
 *
 * <pre>{@code
 * KubeKindRegistry registry = KubeKindRegistry.DEFAULT.toBuilder()
 *         .resource(MyResourceV1.class, new KubeKind("MyResource", "example.io/v1"))
 *         .list(MyResourceListV1.class, new KubeKind("MyResource", "example.io/v1"))
 *         .build();
 * }</pre>
 */
public final class KubeKindRegistry {

    public static final KubeKindRegistry DEFAULT = builder()
            .resource(StatusV1.class, new KubeKind(StatusV1.KIND, StatusV1.API_VERSION))
            .resource(ConfigMapV1.class, new KubeKind(ConfigMapV1.KIND, ConfigMapV1.API_VERSION))
            .list(ConfigMapListV1.class, new KubeKind(ConfigMapV1.KIND, ConfigMapV1.API_VERSION))
            .resource(DeploymentV1.class, new KubeKind(DeploymentV1.KIND, DeploymentV1.API_VERSION))
            .list(DeploymentListV1.class, new KubeKind(DeploymentV1.KIND, DeploymentV1.API_VERSION))
            .build();

    private final Map<Class<?>, KubeKind> resourceKinds;
    private final Map<Class<?>, KubeKind> listItemKinds;

    private KubeKindRegistry(Map<Class<?>, KubeKind> resourceKinds, Map<Class<?>, KubeKind> listItemKinds) {
        this.resourceKinds = Map.copyOf(resourceKinds);
        this.listItemKinds = Map.copyOf(listItemKinds);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.resourceKinds.putAll(resourceKinds);
        builder.listItemKinds.putAll(listItemKinds);
        return builder;
    }

    public Optional<KubeKind> kindOf(Class<?> resourceType) {
        return Optional.ofNullable(resourceKinds.get(resourceType));
    }

    public Optional<KubeKind> listItemKindOf(Class<?> listType) {
        return Optional.ofNullable(listItemKinds.get(listType));
    }

    /**
     * Describes a resource type for error messages.
     *
     * @param resourceType the model type
     * @return {@code "Kind (apiVersion) resource"}, or the simple type name when the type is not registered
     */
    public String describeResource(Class<?> resourceType) {
        return kindOf(resourceType)
                .map(kind -> kind + " resource")
                .orElseGet(resourceType::getSimpleName);
    }

    /**
     * Describes a collection of a resource type, as addressed by a watch.
     *
     * @param resourceType the model type
     * @return {@code "Kind (apiVersion) resources"}, or the simple type name when the type is not registered
     */
    public String describeResources(Class<?> resourceType) {
        return kindOf(resourceType)
                .map(kind -> kind + " resources")
                .orElseGet(resourceType::getSimpleName);
    }

    /**
     * Describes the items of a list type for error messages.
     *
     * @param listType the list model type
     * @return {@code "Kind (apiVersion) resources"}, or the simple type name when the type is not registered
     */
    public String describeResourceList(Class<?> listType) {
        return listItemKindOf(listType)
                .map(kind -> kind + " resources")
                .orElseGet(listType::getSimpleName);
    }

    public static final class Builder {

        private final Map<Class<?>, KubeKind> resourceKinds = new HashMap<>();
        private final Map<Class<?>, KubeKind> listItemKinds = new HashMap<>();

        private Builder() {
        }

        public Builder resource(Class<?> type, KubeKind kind) {
            resourceKinds.put(Assert.checkNotNullParam("type", type), Assert.checkNotNullParam("kind", kind));
            return this;
        }

        public Builder list(Class<? extends KubeResourceList<?>> type, KubeKind itemKind) {
            listItemKinds.put(Assert.checkNotNullParam("type", type), Assert.checkNotNullParam("itemKind", itemKind));
            return this;
        }

        public KubeKindRegistry build() {
            return new KubeKindRegistry(resourceKinds, listItemKinds);
        }
    }
}
