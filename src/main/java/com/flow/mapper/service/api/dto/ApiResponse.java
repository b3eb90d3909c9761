package com.flow.mapper.service.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Envelope around every flow mapper response.
 *
 * A refused patch names the operation that stopped it, and an intent that
 * could not be repaired carries the violations left in its preview.
 *
 * @param <T> payload type
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {

    private boolean success;

    private T data;

    private ErrorInfo error;

    @Builder.Default
    private Instant timestamp = Instant.now();

    public static <T> ApiResponse<T> success(T data) {
        return ApiResponse.<T>builder()
                .success(true)
                .data(data)
                .build();
    }

    public static ApiResponse<Void> error(String message, String code) {
        return failure(ErrorInfo.builder().message(message).code(code).build());
    }

    public static ApiResponse<Void> error(String message, String code, String details) {
        return failure(ErrorInfo.builder().message(message).code(code).details(details).build());
    }

    /**
     * Detail lines are joined with "; ".
     */
    public static ApiResponse<Void> error(String message, String code, List<String> details) {
        return error(message, code, details.isEmpty() ? null : String.join("; ", details));
    }

    /**
     * A patch refused at one operation; nothing of it was applied.
     *
     * @param operationIndex zero-based position in the submitted patch
     * @param operationType  wire name, e.g. {@code add_edge}
     */
    public static ApiResponse<Void> rejectedOperation(String message, String code,
                                                      int operationIndex, String operationType) {
        return failure(ErrorInfo.builder()
                .message(message)
                .code(code)
                .operationIndex(operationIndex)
                .operationType(operationType)
                .build());
    }

    /**
     * An intent that was refused, with the topology violations still open when it was.
     */
    public static ApiResponse<Void> rejectedIntent(String message, String code, List<String> details,
                                                   List<ViolationResponse> violations) {
        return failure(ErrorInfo.builder()
                .message(message)
                .code(code)
                .details(details.isEmpty() ? null : String.join("; ", details))
                .violations(violations.isEmpty() ? null : violations)
                .build());
    }

    private static ApiResponse<Void> failure(ErrorInfo error) {
        return ApiResponse.<Void>builder()
                .success(false)
                .error(error)
                .build();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ErrorInfo {
        private String message;
        private String code;
        private String details;

        /**
         * Set only for refused patches.
         */
        private Integer operationIndex;
        private String operationType;

        private List<ViolationResponse> violations;
    }
}
