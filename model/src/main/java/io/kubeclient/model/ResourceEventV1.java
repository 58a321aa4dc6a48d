package io.kubeclient.model;

import io.kubeclient.util.Assert;

/**
 * A change to a resource observed through a watch.
 *
 * @param type what happened to the resource
 * @param object snapshot of the resource after (or, for {@link ResourceEventType#DELETED}, before) the change
 * @param <T> the resource type
 */
public record ResourceEventV1<T extends KubeResource>(ResourceEventType type, T object) {

    public ResourceEventV1 {
        Assert.checkNotNullParam("type", type);
        Assert.checkNotNullParam("object", object);
    }
}
