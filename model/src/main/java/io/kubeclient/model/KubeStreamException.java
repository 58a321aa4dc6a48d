package io.kubeclient.model;

/**
 * A watch stream was aborted while reading, by a transport failure or an interrupt.
 * Cancellation by the consumer never raises this exception.
 */
public class KubeStreamException extends KubeException {

    public KubeStreamException(final String msg) {
        super(msg);
    }

    public KubeStreamException(final String msg, final Throwable cause) {
        super(msg, cause);
    }
}
