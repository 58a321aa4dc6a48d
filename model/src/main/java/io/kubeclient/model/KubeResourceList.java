package io.kubeclient.model;

import java.util.List;

import org.jspecify.annotations.Nullable;

/**
 * An ordered collection of resources of a single kind, as returned by a list request.
 *
 * @param <T> the item type
 */
public interface KubeResourceList<T extends KubeResource> {

    @Nullable String kind();

    @Nullable String apiVersion();

    @Nullable ListMetaV1 metadata();

    List<T> items();
}
