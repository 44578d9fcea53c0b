package com.taskflow.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Optional JSON body for gate and operator actions.
 *
 * @param identity operator identity; nullable, defaults to "api"
 * @param decision for operator gates: APPROVE, REVISE or DEFER; nullable, defaults to DEFER
 * @param note     revision request or block reason; nullable
 * @param gate     operator gate the decision is meant for, e.g. "test_plan"; nullable, in which
 *                 case the decision answers the first operator gate reached
 */
public record OperatorRequest(
    @JsonProperty("as") String identity,
    String decision,
    String note,
    String gate
) {
    static final String DEFAULT_IDENTITY = "api";

    static String identityOf(OperatorRequest request) {
        return request == null || request.identity() == null || request.identity().isBlank()
                ? DEFAULT_IDENTITY : request.identity();
    }
}
