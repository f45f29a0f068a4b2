package com.tradejournal.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.tradejournal.exception.ErrorCode;
import java.time.Instant;
import java.util.Map;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Error envelope: {@code {success: false, error: {code, message, details, timestamp, path}}}.
 *
 * <p>Leg validation failures key their details by leg path, e.g.
 * {@code "legs[1].strike": "must be greater than 0"}. Empty details are omitted.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@JsonPropertyOrder({"success", "error"})
public class ApiErrorResponse {

    boolean success;
    ErrorBody error;

    public static ApiErrorResponse of(ErrorCode errorCode, String message, Map<String, Object> details, String path) {
        Map<String, Object> nonEmptyDetails = details == null || details.isEmpty() ? null : details;
        return new ApiErrorResponse(
                false, new ErrorBody(errorCode.getCode(), message, nonEmptyDetails, Instant.now(), path));
    }

    @Value
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ErrorBody {
        String code;
        String message;
        Map<String, Object> details;
        Instant timestamp;
        String path;
    }
}
