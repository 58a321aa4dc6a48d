package io.kubeclient.client.patch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.kubeclient.util.Utils;
import org.jspecify.annotations.Nullable;

/**
 * Ordered list of patch operations shared by {@link JsonPatchDocument} and
 * {@link TypedJsonPatchDocument}.
 */
public final class PatchOperations {

    private final List<PatchOperation> operations = new ArrayList<>();

    PatchOperations() {
    }

    void append(PatchOperationType op, String path, @Nullable String from, @Nullable Object value) {
        JsonNode node = null;
        if (op.hasValue()) {
            if (value == null) {
                node = NullNode.getInstance();
            } else if (value instanceof JsonNode) {
                node = (JsonNode) value;
            } else {
                node = Utils.OBJECT_MAPPER.valueToTree(value);
            }
        }
        operations.add(new PatchOperation(op, path, from, node));
    }

    public List<PatchOperation> asList() {
        return Collections.unmodifiableList(operations);
    }

    public ArrayNode toJson() {
        ArrayNode document = Utils.OBJECT_MAPPER.createArrayNode();
        for (PatchOperation operation : operations) {
            ObjectNode node = document.addObject();
            node.put("op", operation.op().getOp());
            if (operation.op().hasFrom()) {
                node.put("from", operation.from());
            }
            node.put("path", operation.path());
            if (operation.op().hasValue()) {
                node.set("value", operation.value());
            }
        }
        return document;
    }

    public String serialize() throws JsonProcessingException {
        return Utils.OBJECT_MAPPER.writeValueAsString(toJson());
    }
}
