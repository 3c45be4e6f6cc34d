package com.askdb.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.slf4j.MDC;

/**
 * Body of every failed request. {@code code} is a stable machine-readable identifier such as
 * {@code STATEMENT_REJECTED} or an execution error kind.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    private static final String MDC_TRACE_ID = "trace_id";

    private String code;
    private String message;
    private String details;
    private String traceId;

    /**
     * Build an error carrying the current request's trace id.
     *
     * @param code error code
     * @param message caller-facing message
     * @param details extra detail, may be null
     * @return error body
     */
    public static ErrorResponse of(String code, String message, String details) {
        return ErrorResponse.builder()
                .code(code)
                .message(message)
                .details(details)
                .traceId(MDC.get(MDC_TRACE_ID))
                .build();
    }
}
