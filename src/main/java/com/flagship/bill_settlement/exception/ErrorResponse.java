package com.flagship.bill_settlement.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Standard API error response.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {
    @JsonProperty("error")
    String error;

    @JsonProperty("message")
    String message;

    @JsonProperty("subject_id")
    String subjectId;

    @JsonProperty("details")
    Map<String, String> details;

    @JsonProperty("timestamp")
    Instant timestamp;
}
