package com.riskledger.common.error;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * RFC 7807 style error response returned by every register endpoint.
 *
 * @see <a href="https://tools.ietf.org/html/rfc7807">RFC 7807</a>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    /**
     * RFC 7807: A URI reference that identifies the problem type
     */
    @JsonProperty("type")
    private String type;

    /**
     * RFC 7807: A short, human-readable summary of the problem type
     */
    @JsonProperty("title")
    private String title;

    @JsonProperty("status")
    private int status;

    /**
     * RFC 7807: A human-readable explanation specific to this occurrence
     */
    @JsonProperty("detail")
    private String detail;

    /**
     * RFC 7807: The request path
     */
    @JsonProperty("instance")
    private String instance;

    @JsonProperty("errorCode")
    private String code;

    @JsonProperty("timestamp")
    private Instant timestamp;

    /**
     * Field name to messages, for validation failures
     */
    @JsonProperty("validationErrors")
    private Map<String, List<String>> validationErrors;

    @JsonProperty("metadata")
    private Map<String, Object> metadata;
}
