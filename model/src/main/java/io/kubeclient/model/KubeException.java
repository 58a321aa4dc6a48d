package io.kubeclient.model;

/**
 * Base exception for every failure raised by the resource client.
 */
public class KubeException extends RuntimeException {

    /**
     * Creates a new KubeException with the specified message.
     *
     * @param msg the exception message
     */
    public KubeException(final String msg) {
        super(msg);
    }

    /**
     * Creates a new KubeException with the specified message and cause.
     *
     * @param msg the exception message
     * @param cause the underlying cause
     */
    public KubeException(final String msg, final Throwable cause) {
        super(msg, cause);
    }
}
