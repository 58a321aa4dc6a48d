package io.kubeclient.client.patch;

import java.util.Arrays;
import java.util.Optional;

import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.introspect.BeanPropertyDefinition;
import io.kubeclient.util.Assert;
import io.kubeclient.util.Utils;
import org.jspecify.annotations.Nullable;

/**
 * JSON-Patch builder whose paths are checked against the JSON properties of a resource model.
 *
 * <pre>{@code
 * patch.field("spec", "replicas").replace(3);
 * patch.field("metadata", "labels", "tier").add("frontend");
 * }</pre>
 *
 * Map-valued properties accept any key, list-valued properties accept an index or {@code -}.
 * Below a {@code JsonNode} or {@code Object} property nothing is checked.
 *
 * @param <T> the resource model
 */
public final class TypedJsonPatchDocument<T> {

    private final Class<T> resourceType;
    private final PatchOperations operations = new PatchOperations();

    public TypedJsonPatchDocument(Class<T> resourceType) {
        this.resourceType = Assert.checkNotNullParam("resourceType", resourceType);
    }

    /**
     * Addresses a location in the resource.
     *
     * @param segments JSON property names, map keys or list indexes, outermost first
     * @return the location
     * @throws IllegalArgumentException if a segment does not exist in the model
     */
    public Field field(String... segments) {
        if (segments.length == 0) {
            throw new IllegalArgumentException("At least one path segment is required");
        }
        resolve(segments);
        return new Field(JsonPointers.toPointer(segments));
    }

    public PatchOperations getOperations() {
        return operations;
    }

    private void resolve(String[] segments) {
        JavaType type = Utils.OBJECT_MAPPER.constructType(resourceType);
        for (int i = 0; i < segments.length; i++) {
            String segment = Assert.checkNotNullParam("segment", segments[i]);
            if (type.isTypeOrSubTypeOf(JsonNode.class) || type.getRawClass() == Object.class) {
                return;
            }
            if (type.isMapLikeType()) {
                type = type.getContentType();
            } else if (type.isCollectionLikeType() || type.isArrayType()) {
                if (!segment.equals("-") && !segment.matches("0|[1-9][0-9]*")) {
                    throw unknown(segments, i, "is not a list index");
                }
                type = type.getContentType();
            } else {
                Optional<JavaType> property = propertyType(type, segment);
                if (property.isEmpty()) {
                    throw unknown(segments, i, "is not a property of " + type.getRawClass().getSimpleName());
                }
                type = property.get();
            }
        }
    }

    private static Optional<JavaType> propertyType(JavaType owner, String name) {
        if (owner.isPrimitive() || owner.isEnumType() || owner.getRawClass().getName().startsWith("java.")) {
            return Optional.empty();
        }
        BeanDescription description = Utils.OBJECT_MAPPER.getSerializationConfig().introspect(owner);
        for (BeanPropertyDefinition property : description.findProperties()) {
            if (property.getName().equals(name)) {
                JavaType type = property.getPrimaryType();
                return Optional.of(type.isReferenceType() ? type.getContentType() : type);
            }
        }
        return Optional.empty();
    }

    private IllegalArgumentException unknown(String[] segments, int index, String reason) {
        return new IllegalArgumentException("Invalid patch path " + Arrays.toString(segments) + " for "
                + resourceType.getSimpleName() + ": '" + segments[index] + "' " + reason);
    }

    /**
     * A validated location within the resource.
     */
    public final class Field {

        private final String pointer;

        private Field(String pointer) {
            this.pointer = pointer;
        }

        public String getPointer() {
            return pointer;
        }

        public TypedJsonPatchDocument<T> add(@Nullable Object value) {
            operations.append(PatchOperationType.ADD, pointer, null, value);
            return TypedJsonPatchDocument.this;
        }

        public TypedJsonPatchDocument<T> replace(@Nullable Object value) {
            operations.append(PatchOperationType.REPLACE, pointer, null, value);
            return TypedJsonPatchDocument.this;
        }

        public TypedJsonPatchDocument<T> remove() {
            operations.append(PatchOperationType.REMOVE, pointer, null, null);
            return TypedJsonPatchDocument.this;
        }

        public TypedJsonPatchDocument<T> test(@Nullable Object value) {
            operations.append(PatchOperationType.TEST, pointer, null, value);
            return TypedJsonPatchDocument.this;
        }

        /**
         * Moves the value at {@code source} here.
         */
        public TypedJsonPatchDocument<T> moveFrom(Field source) {
            operations.append(PatchOperationType.MOVE, pointer, source.pointer, null);
            return TypedJsonPatchDocument.this;
        }

        /**
         * Copies the value at {@code source} here.
         */
        public TypedJsonPatchDocument<T> copyFrom(Field source) {
            operations.append(PatchOperationType.COPY, pointer, source.pointer, null);
            return TypedJsonPatchDocument.this;
        }
    }
}
