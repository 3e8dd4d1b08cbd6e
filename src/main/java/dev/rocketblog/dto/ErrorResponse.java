package dev.rocketblog.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Error envelope: {@code {"success": false, "error": "...", "data": null}}.
 * Status and path are kept for logging and tests but not serialised.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ErrorResponse {

    @Builder.Default
    private boolean success = false;

    private String error;

    @JsonInclude(JsonInclude.Include.ALWAYS)
    private Object data;

    @JsonProperty("validation_errors")
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private Map<String, String> validationErrors;

    @JsonIgnore
    private int status;

    @JsonIgnore
    private String path;
}
