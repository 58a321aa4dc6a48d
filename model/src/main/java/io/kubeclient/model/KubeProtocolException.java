package io.kubeclient.model;

/**
 * The response could not be understood: a missing content type, an unsupported charset,
 * malformed JSON, or a body whose shape does not match the requested type.
 */
public class KubeProtocolException extends KubeException {

    public KubeProtocolException(final String msg) {
        super(msg);
    }

    public KubeProtocolException(final String msg, final Throwable cause) {
        super(msg, cause);
    }
}
