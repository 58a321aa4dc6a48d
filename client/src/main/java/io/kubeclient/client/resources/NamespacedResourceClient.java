package io.kubeclient.client.resources;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

import io.kubeclient.client.KubeApiClient;
import io.kubeclient.client.patch.JsonPatchDocument;
import io.kubeclient.client.patch.TypedJsonPatchDocument;
import io.kubeclient.model.KubeResource;
import io.kubeclient.model.KubeResourceList;
import io.kubeclient.model.ObjectMetaV1;
import io.kubeclient.model.StatusV1;
import io.kubeclient.util.Assert;
import io.kubeclient.util.Utils;
import org.jspecify.annotations.Nullable;

/**
 * Operations shared by clients of namespaced resource kinds.
 * <p>
 * Every {@code namespace} argument falls back to the client's default namespace when it is
 * {@code null} or blank.
 *
 * @param <T> the resource type
 * @param <L> the list type
 */
public abstract class NamespacedResourceClient<T extends KubeResource, L extends KubeResourceList<T>>
        extends KubeResourceClient {

    private final Class<T> resourceType;
    private final Class<L> listType;
    private final ResourceRequest collection;
    private final ResourceRequest byName;

    /**
     * @param collectionPath path template of the collection, containing a {@code {namespace}} placeholder
     */
    protected NamespacedResourceClient(KubeApiClient client, Class<T> resourceType, Class<L> listType,
                                       String collectionPath) {
        super(client);
        this.resourceType = Assert.checkNotNullParam("resourceType", resourceType);
        this.listType = Assert.checkNotNullParam("listType", listType);
        this.collection = ResourceRequest.of(collectionPath);
        this.byName = ResourceRequest.of(collectionPath + "/{name}");
    }

    public CompletableFuture<Optional<T>> get(String name) {
        return get(name, null);
    }

    /**
     * @return the resource, or empty if it does not exist
     */
    public CompletableFuture<Optional<T>> get(String name, @Nullable String namespace) {
        return getSingleResource(resourceType, named(name, namespace));
    }

    public CompletableFuture<L> list() {
        return list(null, null);
    }

    /**
     * @param labelSelector an optional label query such as {@code app=web,tier!=cache}
     */
    public CompletableFuture<L> list(@Nullable String labelSelector, @Nullable String namespace) {
        return getResourceList(listType, inNamespace(namespace).query("labelSelector", labelSelector));
    }

    /**
     * Watches every resource in the namespace that matches the selector. The stream stays open
     * until it is closed or the server ends it.
     */
    public ResourceEventStream<T> watchAll(@Nullable String labelSelector, @Nullable String namespace) {
        return observeEvents(resourceType, inNamespace(namespace)
                .query("labelSelector", labelSelector)
                .query("watch", true));
    }

    /**
     * Watches a single resource.
     */
    public ResourceEventStream<T> watch(String name, @Nullable String namespace) {
        Assert.checkNotBlankParam("name", name);
        return observeEvents(resourceType, inNamespace(namespace)
                .query("fieldSelector", "metadata.name=" + name)
                .query("watch", true));
    }

    /**
     * Creates the resource in the namespace named by its metadata, or the default namespace.
     */
    public CompletableFuture<T> create(T resource) {
        Assert.checkNotNullParam("resource", resource);
        return createResource(resourceType, resource, inNamespace(namespaceOf(resource)));
    }

    /**
     * Replaces the resource named by its metadata.
     */
    public CompletableFuture<T> update(T resource) {
        Assert.checkNotNullParam("resource", resource);
        ObjectMetaV1 metadata = resource.metadata();
        String name = metadata == null ? null : metadata.name();
        if (Utils.isBlank(name)) {
            throw new IllegalArgumentException("Resource to update must have metadata.name");
        }
        return replaceResource(resourceType, resource, named(name, namespaceOf(resource)));
    }

    /**
     * Applies a JSON-Patch whose paths are checked against the resource model.
     */
    public CompletableFuture<T> patch(String name, Consumer<TypedJsonPatchDocument<T>> patchAction,
                                      @Nullable String namespace) {
        return patchResource(resourceType, patchAction, named(name, namespace));
    }

    /**
     * Applies a JSON-Patch addressed by raw JSON Pointers.
     */
    public CompletableFuture<T> patchRaw(String name, Consumer<JsonPatchDocument> patchAction,
                                         @Nullable String namespace) {
        return patchResourceRaw(resourceType, patchAction, named(name, namespace));
    }

    /**
     * Applies a JSON merge patch.
     */
    public CompletableFuture<T> patchMerge(String name, Object mergeDocument, @Nullable String namespace) {
        return patchResourceMerge(resourceType, mergeDocument, named(name, namespace));
    }

    public CompletableFuture<StatusV1> delete(String name, @Nullable String namespace) {
        return deleteResource(resourceType, named(name, namespace));
    }

    protected ResourceRequest named(String name, @Nullable String namespace) {
        Assert.checkNotBlankParam("name", name);
        return byName.with("namespace", resolveNamespace(namespace)).with("name", name);
    }

    protected ResourceRequest inNamespace(@Nullable String namespace) {
        return collection.with("namespace", resolveNamespace(namespace));
    }

    private String resolveNamespace(@Nullable String namespace) {
        return Utils.isBlank(namespace) ? getClient().getDefaultNamespace() : namespace;
    }

    private @Nullable String namespaceOf(T resource) {
        ObjectMetaV1 metadata = resource.metadata();
        return metadata == null ? null : metadata.namespace();
    }
}
