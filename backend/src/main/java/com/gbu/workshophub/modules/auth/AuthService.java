package com.gbu.workshophub.modules.auth;

import com.gbu.workshophub.exception.BusinessException;
import com.gbu.workshophub.exception.ConflictException;
import com.gbu.workshophub.modules.auth.dto.*;
import com.gbu.workshophub.modules.user.User;
import com.gbu.workshophub.modules.user.UserRepository;
import com.gbu.workshophub.security.JwtTokenProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Slf4j
@Service
@RequiredArgsConstructor
public class AuthService {

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtTokenProvider jwtTokenProvider;

    @Transactional
    public TokenResponse register(RegisterRequest request) {
        String email = request.getEmail().trim();
        String name = request.getName().trim();
        if (name.isEmpty() || name.codePointCount(0, name.length()) > 100) {
            throw new BusinessException("Name must be between 1 and 100 characters");
        }

        if (userRepository.existsByEmailIgnoreCase(email)) {
            throw new ConflictException("EMAIL_EXISTS", "Email already registered");
        }

        User user = User.builder()
                .name(name)
                .email(email)
                .passwordHash(passwordEncoder.encode(request.getPassword()))
                .build();

        try {
            user = userRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException e) {
            throw new ConflictException("EMAIL_EXISTS", "Email already registered");
        }

        log.info("Registered user {} ({})", user.getId(), user.getEmail());
        return buildTokenResponse(user);
    }

    @Transactional(readOnly = true)
    public TokenResponse login(LoginRequest request) {
        User user = userRepository.findByEmailIgnoreCase(request.getEmail().trim())
                .orElseThrow(() -> new BadCredentialsException("Invalid credentials"));

        if (!passwordEncoder.matches(request.getPassword(), user.getPasswordHash())) {
            throw new BadCredentialsException("Invalid credentials");
        }

        return buildTokenResponse(user);
    }

    private TokenResponse buildTokenResponse(User user) {
        String accessToken = jwtTokenProvider.generateAccessToken(
                user.getId().toString(), user.getEmail(), user.getName());

        return TokenResponse.builder()
                .id(user.getId())
                .email(user.getEmail())
                .name(user.getName())
                .createdAt(user.getCreatedAt())
                .accessToken(accessToken)
                .tokenType("Bearer")
                .expiresIn(jwtTokenProvider.getAccessTokenExpirySeconds())
                .build();
    }
}
