package io.kubeclient.model;

import org.jspecify.annotations.Nullable;

/**
 * An addressable API object.
 * <p>
 * Identity is the combination of {@link #kind()}, {@link #apiVersion()} and the namespace and
 * name held by {@link #metadata()}.
 */
public interface KubeResource {

    @Nullable String kind();

    @Nullable String apiVersion();

    @Nullable ObjectMetaV1 metadata();
}
