package com.gbu.workshophub.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Resolves the bearer token on every request. Failures never stop the chain: the
 * reason is left on the request for {@link JsonAuthenticationEntryPoint}, and public
 * endpoints simply see an anonymous caller.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    public static final String AUTH_ERROR_ATTRIBUTE = JwtAuthenticationFilter.class.getName() + ".error";

    private final JwtTokenProvider jwtTokenProvider;

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
            @NonNull HttpServletResponse response,
            @NonNull FilterChain filterChain) throws ServletException, IOException {

        String header = request.getHeader(HttpHeaders.AUTHORIZATION);

        if (!StringUtils.hasText(header)) {
            request.setAttribute(AUTH_ERROR_ATTRIBUTE, AuthError.UNAUTHORIZED);
        } else {
            String[] parts = header.trim().split("\\s+");
            if (parts.length != 2 || !"bearer".equalsIgnoreCase(parts[0])) {
                request.setAttribute(AUTH_ERROR_ATTRIBUTE, AuthError.INVALID_AUTH_HEADER);
            } else {
                Optional<AuthenticatedUser> user = jwtTokenProvider.verify(parts[1]);
                if (user.isPresent()) {
                    UsernamePasswordAuthenticationToken authentication = new UsernamePasswordAuthenticationToken(
                            user.get(),
                            null,
                            List.of(new SimpleGrantedAuthority("ROLE_USER")));
                    SecurityContextHolder.getContext().setAuthentication(authentication);
                } else {
                    log.debug("Rejected bearer token on {} {}", request.getMethod(), request.getRequestURI());
                    request.setAttribute(AUTH_ERROR_ATTRIBUTE, AuthError.INVALID_TOKEN);
                }
            }
        }

        filterChain.doFilter(request, response);
    }

    public enum AuthError {
        UNAUTHORIZED("Missing authorization token"),
        INVALID_AUTH_HEADER("Invalid authorization header format. Expected: Bearer <token>"),
        INVALID_TOKEN("Invalid or expired token");

        private final String message;

        AuthError(String message) {
            this.message = message;
        }

        public String getMessage() {
            return message;
        }
    }
}
