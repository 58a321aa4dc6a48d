package io.kubeclient.model;

import io.kubeclient.util.Assert;

/**
 * The declared kind and API version of a model type, for example {@code ConfigMap} / {@code v1}
 * or {@code Deployment} / {@code apps/v1}.
 *
 * @param kind the resource kind
 * @param apiVersion the API group and version
 */
public record KubeKind(String kind, String apiVersion) {

    public KubeKind {
        Assert.checkNotBlankParam("kind", kind);
        Assert.checkNotBlankParam("apiVersion", apiVersion);
    }

    @Override
    public String toString() {
        return kind + " (" + apiVersion + ")";
    }
}
