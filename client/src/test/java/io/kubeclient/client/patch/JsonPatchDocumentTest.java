package io.kubeclient.client.patch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.kubeclient.util.Utils;
import org.junit.jupiter.api.Test;

public class JsonPatchDocumentTest {

    @Test
    public void testOperationsKeepOrder() throws Exception {
        JsonPatchDocument patch = new JsonPatchDocument()
                .add("/metadata/labels/app", "web")
                .replace("/spec/replicas", 2)
                .remove("/spec/paused")
                .copy("/metadata/labels/app", "/metadata/labels/name")
                .move("/data/a", "/data/b")
                .test("/metadata/resourceVersion", "7");

        List<PatchOperation> operations = patch.getOperations().asList();

        assertEquals(6, operations.size());
        assertEquals(PatchOperationType.ADD, operations.get(0).op());
        assertEquals(IntNode.valueOf(2), operations.get(1).value());
        assertNull(operations.get(2).value());
        assertEquals("/metadata/labels/app", operations.get(3).from());
        assertEquals("/data/b", operations.get(4).path());
        assertEquals(TextNode.valueOf("7"), operations.get(5).value());
        assertEquals(Utils.OBJECT_MAPPER.readTree("""
                [
                    {"op": "add", "path": "/metadata/labels/app", "value": "web"},
                    {"op": "replace", "path": "/spec/replicas", "value": 2},
                    {"op": "remove", "path": "/spec/paused"},
                    {"op": "copy", "from": "/metadata/labels/app", "path": "/metadata/labels/name"},
                    {"op": "move", "from": "/data/a", "path": "/data/b"},
                    {"op": "test", "path": "/metadata/resourceVersion", "value": "7"}
                ]
                """), patch.getOperations().toJson());
    }

    @Test
    public void testStructuredValues() throws Exception {
        JsonPatchDocument patch = new JsonPatchDocument()
                .add("/metadata/labels", Map.of("tier", "frontend"))
                .add("/spec/args/-", List.of("--verbose"));

        assertEquals(Utils.OBJECT_MAPPER.readTree("""
                [
                    {"op": "add", "path": "/metadata/labels", "value": {"tier": "frontend"}},
                    {"op": "add", "path": "/spec/args/-", "value": ["--verbose"]}
                ]
                """), patch.getOperations().toJson());
    }

    @Test
    public void testRootPointerIsAllowed() {
        JsonPatchDocument patch = new JsonPatchDocument().replace("", Map.of());

        assertEquals("", patch.getOperations().asList().get(0).path());
    }

    @Test
    public void testPathMustBeAPointer() {
        JsonPatchDocument patch = new JsonPatchDocument();

        assertThrows(IllegalArgumentException.class, () -> patch.add("spec/replicas", 1));
        assertThrows(IllegalArgumentException.class, () -> patch.move("data/a", "/data/b"));
    }

    @Test
    public void testOperationNamesOnTheWire() throws Exception {
        assertEquals("\"replace\"", Utils.OBJECT_MAPPER.writeValueAsString(PatchOperationType.REPLACE));
        assertEquals("\"test\"", Utils.OBJECT_MAPPER.writeValueAsString(PatchOperationType.TEST));
    }
}
