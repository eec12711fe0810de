package com.gbu.workshophub.exception;

import lombok.Getter;

import java.util.Locale;

@Getter
public class ResourceNotFoundException extends RuntimeException {

    private final String resource;
    private final String resourceId;
    private final String code;

    public ResourceNotFoundException(String resource, String resourceId) {
        super(resource + " not found");
        this.resource = resource;
        this.resourceId = resourceId;
        this.code = resource.toUpperCase(Locale.ROOT).replace(' ', '_') + "_NOT_FOUND";
    }
}
