package io.kubeclient.client.patch;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * RFC 6902 operation names.
 */
public enum PatchOperationType {
    ADD("add"),
    REMOVE("remove"),
    REPLACE("replace"),
    MOVE("move"),
    COPY("copy"),
    TEST("test");

    private final String op;

    PatchOperationType(String op) {
        this.op = op;
    }

    @JsonValue
    public String getOp() {
        return op;
    }

    boolean hasValue() {
        return this == ADD || this == REPLACE || this == TEST;
    }

    boolean hasFrom() {
        return this == MOVE || this == COPY;
    }
}
