package com.di.ingestion.exception;

import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Error body returned by {@link GlobalExceptionHandler}.
 */
@Data
public class ErrorResponse {

    private String timestamp;
    private int status;
    private String error;
    private String message;
    private String path;
    private Map<String, Object> details = new LinkedHashMap<>();

    public void addDetail(String key, Object value) {
        this.details.put(key, value);
    }
}
