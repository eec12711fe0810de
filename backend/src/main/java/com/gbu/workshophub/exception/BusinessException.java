package com.gbu.workshophub.exception;

import lombok.Getter;

/**
 * A request that is well-formed but violates a validation or business rule (HTTP 400).
 */
@Getter
public class BusinessException extends RuntimeException {

    private final String code;

    public BusinessException(String message) {
        this("VALIDATION_ERROR", message);
    }

    public BusinessException(String code, String message) {
        super(message);
        this.code = code;
    }
}
