package com.peptide_toxicity.dto.response;


import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GenericResponse<T> {
    private boolean success;
    private T data;
    private String errorCode;
    private String message;
    private Metadata metadata;

    public static <T> GenericResponse<T> success(T data) {
        return success(null, data);
    }

    public static <T> GenericResponse<T> success(String message, T data) {
        return GenericResponse.<T>builder()
                .success(true)
                .message(message)
                .data(data)
                .metadata(new Metadata())
                .errorCode("")
                .build();
    }

    public static <T> GenericResponse<T> failure(String errorCode, String message, Metadata metadata) {
        return failure(errorCode, message, null, metadata);
    }

    public static <T> GenericResponse<T> failure(String errorCode, String message, T data, Metadata metadata) {
        return GenericResponse.<T>builder()
                .success(false)
                .errorCode(errorCode)
                .message(message)
                .data(data)
                .metadata(metadata)
                .build();
    }

}
