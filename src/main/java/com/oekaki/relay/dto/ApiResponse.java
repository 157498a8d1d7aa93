package com.oekaki.relay.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** JSON envelope shared by every endpoint: {@code {success, result | reason}}. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {
    private boolean success;
    private T result;
    private String reason;

    public static <T> ApiResponse<T> ok(T result) {
        return ApiResponse.<T>builder().success(true).result(result).build();
    }

    public static <T> ApiResponse<T> failure(String reason) {
        return ApiResponse.<T>builder().success(false).reason(reason).build();
    }
}
