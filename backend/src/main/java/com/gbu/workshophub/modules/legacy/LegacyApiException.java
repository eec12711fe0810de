package com.gbu.workshophub.modules.legacy;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/** Rendered as {@code {success:false, error, data:{}}} by {@link LegacyExceptionHandler}. */
@Getter
public class LegacyApiException extends RuntimeException {

    private final HttpStatus status;

    public LegacyApiException(HttpStatus status, String message) {
        super(message);
        this.status = status;
    }

    public static LegacyApiException badRequest(String message) {
        return new LegacyApiException(HttpStatus.BAD_REQUEST, message);
    }

    public static LegacyApiException forbidden(String message) {
        return new LegacyApiException(HttpStatus.FORBIDDEN, message);
    }

    public static LegacyApiException workshopNotFound(String workshopId) {
        return new LegacyApiException(HttpStatus.NOT_FOUND, "Workshop with ID '" + workshopId + "' does not exist");
    }
}
