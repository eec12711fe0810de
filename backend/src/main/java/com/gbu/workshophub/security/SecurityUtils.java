package com.gbu.workshophub.security;

import org.springframework.security.authentication.AuthenticationCredentialsNotFoundException;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.UUID;

@Component
public class SecurityUtils {

    public AuthenticatedUser getCurrentUser() {
        return findCurrentUser()
                .orElseThrow(() -> new AuthenticationCredentialsNotFoundException(
                        "No authenticated user found in security context"));
    }

    public UUID getCurrentUserId() {
        return UUID.fromString(getCurrentUser().getId());
    }

    /** Caller identity on endpoints where authentication is optional. */
    public Optional<AuthenticatedUser> findCurrentUser() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication != null && authentication.getPrincipal() instanceof AuthenticatedUser user) {
            return Optional.of(user);
        }
        return Optional.empty();
    }

    public Optional<UUID> findCurrentUserId() {
        return findCurrentUser().map(user -> UUID.fromString(user.getId()));
    }
}
