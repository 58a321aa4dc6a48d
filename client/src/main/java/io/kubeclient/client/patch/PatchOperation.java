package io.kubeclient.client.patch;

import com.fasterxml.jackson.databind.JsonNode;
import io.kubeclient.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * One RFC 6902 operation.
 *
 * @param op the operation
 * @param path JSON Pointer of the target location
 * @param from JSON Pointer of the source location, for move and copy
 * @param value the value, for add, replace and test; a JSON {@code null} is a {@code NullNode}
 */
public record PatchOperation(PatchOperationType op, String path, @Nullable String from, @Nullable JsonNode value) {

    public PatchOperation {
        Assert.checkNotNullParam("op", op);
        JsonPointers.checkPointer("path", path);
        if (op.hasFrom()) {
            JsonPointers.checkPointer("from", from);
        }
        if (op.hasValue()) {
            Assert.checkNotNullParam("value", value);
        }
    }
}
