package com.gbu.workshophub.exception;

import lombok.Getter;

@Getter
public class UnauthorizedAccessException extends RuntimeException {

    private final String code;

    public UnauthorizedAccessException(String message) {
        this("FORBIDDEN", message);
    }

    public UnauthorizedAccessException(String code, String message) {
        super(message);
        this.code = code;
    }
}
