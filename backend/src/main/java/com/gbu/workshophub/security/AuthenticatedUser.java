package com.gbu.workshophub.security;

import lombok.Getter;

@Getter
public class AuthenticatedUser {
    private final String id;
    private final String email;
    private final String name;

    public AuthenticatedUser(String id, String email, String name) {
        this.id = id;
        this.email = email;
        this.name = name;
    }
}
