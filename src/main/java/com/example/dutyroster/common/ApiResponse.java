package com.example.dutyroster.common;

import java.util.Collections;
import java.util.Map;

/**
 * Response envelope shared by every endpoint: a {@code success} flag, an optional
 * human-readable message, the payload and free-form metadata.
 */
public record ApiResponse<T>(boolean success, String message, T data, Map<String, Object> meta) {

    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(true, null, data, Collections.emptyMap());
    }

    public static <T> ApiResponse<T> success(String message, T data) {
        return new ApiResponse<>(true, message, data, Collections.emptyMap());
    }

    public static <T> ApiResponse<T> success(String message, T data, Map<String, Object> meta) {
        return new ApiResponse<>(true, message, data, meta == null ? Collections.emptyMap() : Map.copyOf(meta));
    }

    public static <T> ApiResponse<T> failure(String message) {
        return new ApiResponse<>(false, message, null, Collections.emptyMap());
    }

    /**
     * Failure that still carries a payload, e.g. the assignments committed before a run stopped.
     */
    public static <T> ApiResponse<T> failure(String message, T data, Map<String, Object> meta) {
        return new ApiResponse<>(false, message, data, meta == null ? Collections.emptyMap() : Map.copyOf(meta));
    }
}
