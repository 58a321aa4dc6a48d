package io.kubeclient.model;

import org.jspecify.annotations.Nullable;

/**
 * The API answered with a non-success status, or the request never produced a response.
 * <p>
 * Carries the HTTP status code, the {@link StatusV1} document when one could be parsed from
 * the response body, and a description of the resource type involved, for example
 * {@code ConfigMap (v1) resource}.
 *
 * @see io.kubeclient.model.KubeKindRegistry#describeResource(Class)
 */
public class KubeClientException extends KubeException {

    /**
     * Status code used when the failure happened before any response was received.
     */
    public static final int NO_RESPONSE = -1;

    private final int statusCode;
    @Nullable
    private final StatusV1 status;
    private final String resourceTypeDescription;

    /**
     * Creates a new KubeClientException for an error response.
     *
     * @param msg the exception message
     * @param statusCode the HTTP status code
     * @param status the parsed status document, or {@code null} if the body was not one
     * @param resourceTypeDescription describes the resource type involved
     */
    public KubeClientException(final String msg, final int statusCode, @Nullable final StatusV1 status,
                               final String resourceTypeDescription) {
        super(msg);
        this.statusCode = statusCode;
        this.status = status;
        this.resourceTypeDescription = resourceTypeDescription;
    }

    /**
     * Creates a new KubeClientException for a request that failed without a response.
     *
     * @param msg the exception message
     * @param resourceTypeDescription describes the resource type involved
     * @param cause the transport failure
     */
    public KubeClientException(final String msg, final String resourceTypeDescription, final Throwable cause) {
        super(msg, cause);
        this.statusCode = NO_RESPONSE;
        this.status = null;
        this.resourceTypeDescription = resourceTypeDescription;
    }

    /**
     * @return the HTTP status code, or {@link #NO_RESPONSE}
     */
    public int getStatusCode() {
        return statusCode;
    }

    @Nullable
    public StatusV1 getStatus() {
        return status;
    }

    public String getResourceTypeDescription() {
        return resourceTypeDescription;
    }

    /**
     * @return the machine-readable reason from the status document, if any
     */
    @Nullable
    public String getReason() {
        return status == null ? null : status.reason();
    }
}
