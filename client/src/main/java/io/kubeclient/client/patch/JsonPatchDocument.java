package io.kubeclient.client.patch;

import org.jspecify.annotations.Nullable;

/**
 * Untyped JSON-Patch builder addressing locations by JSON Pointer.
 * <p>
 * Nothing is checked against a resource model; use {@link TypedJsonPatchDocument} for that.
 */
public final class JsonPatchDocument {

    private final PatchOperations operations = new PatchOperations();

    public JsonPatchDocument add(String path, @Nullable Object value) {
        operations.append(PatchOperationType.ADD, path, null, value);
        return this;
    }

    public JsonPatchDocument remove(String path) {
        operations.append(PatchOperationType.REMOVE, path, null, null);
        return this;
    }

    public JsonPatchDocument replace(String path, @Nullable Object value) {
        operations.append(PatchOperationType.REPLACE, path, null, value);
        return this;
    }

    public JsonPatchDocument move(String from, String path) {
        operations.append(PatchOperationType.MOVE, path, from, null);
        return this;
    }

    public JsonPatchDocument copy(String from, String path) {
        operations.append(PatchOperationType.COPY, path, from, null);
        return this;
    }

    public JsonPatchDocument test(String path, @Nullable Object value) {
        operations.append(PatchOperationType.TEST, path, null, value);
        return this;
    }

    public PatchOperations getOperations() {
        return operations;
    }
}
