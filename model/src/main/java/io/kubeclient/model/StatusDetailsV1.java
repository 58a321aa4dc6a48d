package io.kubeclient.model;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.jspecify.annotations.Nullable;

/**
 * @param name the name attribute of the resource associated with the status, if any
 * @param group the API group of the resource
 * @param kind the kind of the resource
 * @param uid the UID of the resource
 * @param causes field-level causes of the failure, never {@code null}
 * @param retryAfterSeconds suggested delay before the client retries, if any
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record StatusDetailsV1(@Nullable String name,
                              @Nullable String group,
                              @Nullable String kind,
                              @Nullable String uid,
                              List<StatusCauseV1> causes,
                              @Nullable Integer retryAfterSeconds) {

    public StatusDetailsV1 {
        causes = causes == null ? List.of() : List.copyOf(causes);
    }
}
