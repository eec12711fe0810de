package com.gbu.workshophub.exception;

import lombok.Getter;

/**
 * The request collides with existing state, e.g. a duplicate join or a full workshop (HTTP 409).
 */
@Getter
public class ConflictException extends RuntimeException {

    private final String code;

    public ConflictException(String code, String message) {
        super(message);
        this.code = code;
    }
}
