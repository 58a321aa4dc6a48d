package io.kubeclient.model;

import org.jspecify.annotations.Nullable;

/**
 * Outcome document returned by the API for failed requests and for some successful ones
 * (deletion, for instance).
 *
 * @param kind always {@code Status}
 * @param apiVersion always {@code v1}
 * @param metadata list-style metadata
 * @param status {@link #STATUS_SUCCESS} or {@link #STATUS_FAILURE}
 * @param message human-readable description
 * @param reason machine-readable reason such as {@link #REASON_NOT_FOUND}
 * @param details extended data associated with the reason
 * @param code the HTTP status code for this outcome
 */
public record StatusV1(@Nullable String kind,
                       @Nullable String apiVersion,
                       @Nullable ListMetaV1 metadata,
                       @Nullable String status,
                       @Nullable String message,
                       @Nullable String reason,
                       @Nullable StatusDetailsV1 details,
                       @Nullable Integer code) {

    public static final String KIND = "Status";
    public static final String API_VERSION = "v1";

    public static final String STATUS_SUCCESS = "Success";
    public static final String STATUS_FAILURE = "Failure";

    /**
     * Reason reported when the addressed resource itself does not exist.
     */
    public static final String REASON_NOT_FOUND = "NotFound";

    public static StatusV1 success(@Nullable String message) {
        return new StatusV1(KIND, API_VERSION, null, STATUS_SUCCESS, message, null, null, 200);
    }

    public static StatusV1 failure(int code, @Nullable String reason, @Nullable String message) {
        return new StatusV1(KIND, API_VERSION, null, STATUS_FAILURE, message, reason, null, code);
    }

    public boolean isSuccess() {
        return STATUS_SUCCESS.equals(status);
    }

    /**
     * @return {@code true} only when the reason is exactly {@value #REASON_NOT_FOUND}
     */
    public boolean isNotFound() {
        return REASON_NOT_FOUND.equals(reason);
    }
}
