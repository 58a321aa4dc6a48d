package io.kubeclient.model;

/**
 * Type of a change event delivered by a watch. The wire form is the constant name.
 */
public enum ResourceEventType {
    /** The resource was created. */
    ADDED,

    /** The resource was updated. */
    MODIFIED,

    /** The resource was deleted; the payload is its last known state. */
    DELETED,

    /** The server aborted the watch; the payload is a {@link StatusV1}. */
    ERROR,

    /** Progress notification carrying only a resource version. */
    BOOKMARK
}
