/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.ticketproof.api.exception;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Getter;
import org.springframework.http.HttpStatus;

import java.util.Map;

@Builder
@Getter
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@Schema(name = "ApiError", description = "Error response object")
public class ApiErrorDto {
    @JsonProperty("error")
    @Schema(description = "Stable machine readable error code", example = "replayed_proof")
    String errorCode;
    @JsonProperty("error_description")
    String errorDescription;
    @JsonProperty("detail")
    String errorDetails;
    @JsonProperty("retryable")
    @Schema(description = "Whether the same request may succeed later")
    Boolean retryable;
    @JsonProperty("context")
    Map<String, Object> context;
    @JsonIgnore
    HttpStatus status;
}
