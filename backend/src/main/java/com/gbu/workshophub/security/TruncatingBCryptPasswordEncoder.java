package com.gbu.workshophub.security;

import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.nio.charset.StandardCharsets;

/**
 * BCrypt over the first 72 UTF-8 bytes of the password, the only part classic bcrypt
 * reads. Hashes stay compatible with ones made by bcrypt libraries that truncate, and
 * passwords up to the 128 characters registration allows can be encoded.
 * Truncation never splits a character.
 */
public class TruncatingBCryptPasswordEncoder implements PasswordEncoder {

    static final int MAX_BYTES = 72;

    private final BCryptPasswordEncoder delegate;

    public TruncatingBCryptPasswordEncoder(int strength) {
        this.delegate = new BCryptPasswordEncoder(strength);
    }

    @Override
    public String encode(CharSequence rawPassword) {
        return delegate.encode(truncate(rawPassword));
    }

    @Override
    public boolean matches(CharSequence rawPassword, String encodedPassword) {
        if (rawPassword == null) {
            return false;
        }
        return delegate.matches(truncate(rawPassword), encodedPassword);
    }

    @Override
    public boolean upgradeEncoding(String encodedPassword) {
        return delegate.upgradeEncoding(encodedPassword);
    }

    static String truncate(CharSequence rawPassword) {
        String password = rawPassword.toString();
        if (password.getBytes(StandardCharsets.UTF_8).length <= MAX_BYTES) {
            return password;
        }
        StringBuilder kept = new StringBuilder();
        int bytes = 0;
        int i = 0;
        while (i < password.length()) {
            int codePoint = password.codePointAt(i);
            int width = new String(Character.toChars(codePoint)).getBytes(StandardCharsets.UTF_8).length;
            if (bytes + width > MAX_BYTES) {
                break;
            }
            kept.appendCodePoint(codePoint);
            bytes += width;
            i += Character.charCount(codePoint);
        }
        return kept.toString();
    }
}
