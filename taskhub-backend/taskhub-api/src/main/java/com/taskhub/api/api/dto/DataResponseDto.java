package com.taskhub.api.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Single-resource envelope: {@code {"message": ..., "data": {...}}}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DataResponseDto<T> {

    private final String message;
    private final T data;

    public DataResponseDto(String message, T data) {
        this.message = message;
        this.data = data;
    }

    public static <T> DataResponseDto<T> of(T data) {
        return new DataResponseDto<>(null, data);
    }

    public String getMessage() {
        return message;
    }

    public T getData() {
        return data;
    }
}
