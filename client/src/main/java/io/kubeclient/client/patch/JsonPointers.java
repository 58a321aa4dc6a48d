package io.kubeclient.client.patch;

import io.kubeclient.util.Assert;
import org.jspecify.annotations.Nullable;

final class JsonPointers {

    private JsonPointers() {
    }

    static String checkPointer(String name, @Nullable String pointer) {
        Assert.checkNotNullParam(name, pointer);
        if (!pointer.isEmpty() && !pointer.startsWith("/")) {
            throw new IllegalArgumentException("'" + name + "' must be a JSON Pointer starting with '/': " + pointer);
        }
        return pointer;
    }

    static String escape(String segment) {
        return segment.replace("~", "~0").replace("/", "~1");
    }

    static String toPointer(String... segments) {
        StringBuilder pointer = new StringBuilder();
        for (String segment : segments) {
            pointer.append('/').append(escape(segment));
        }
        return pointer.toString();
    }
}
