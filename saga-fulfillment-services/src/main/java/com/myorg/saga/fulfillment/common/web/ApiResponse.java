package com.myorg.saga.fulfillment.common.web;

import java.util.List;

/** Response body shared by every REST endpoint: {@code { success, data, message, errors[] }}. */
public record ApiResponse<T>(boolean success, T data, String message, List<String> errors) {

    public static <T> ApiResponse<T> ok(T data, String message) {
        return new ApiResponse<>(true, data, message, List.of());
    }

    public static <T> ApiResponse<T> ok(T data) {
        return ok(data, null);
    }

    public static <T> ApiResponse<T> fail(String message, List<String> errors) {
        return new ApiResponse<>(false, null, message, errors == null ? List.of() : List.copyOf(errors));
    }
}
