package com.gbu.workshophub.security;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("TruncatingBCryptPasswordEncoder")
class TruncatingBCryptPasswordEncoderTest {

    private final TruncatingBCryptPasswordEncoder encoder = new TruncatingBCryptPasswordEncoder(4);

    @Test
    @DisplayName("a 128-character password encodes and matches")
    void longPassword() {
        String password = "Ab1!" + "x".repeat(124);

        String hash = encoder.encode(password);

        assertThat(hash).startsWith("$2a$04$");
        assertThat(encoder.matches(password, hash)).isTrue();
        assertThat(encoder.matches("Ab1!" + "x".repeat(10), hash)).isFalse();
    }

    @Test
    @DisplayName("only the first 72 bytes take part in matching")
    void bytesAfterLimitIgnored() {
        String prefix = "P4ss!" + "y".repeat(67);
        String hash = encoder.encode(prefix + "tail-one");

        assertThat(encoder.matches(prefix + "tail-two", hash)).isTrue();
    }

    @Test
    @DisplayName("truncation stops before a multi-byte character that would cross the limit")
    void multiByteBoundary() {
        // 71 ASCII bytes followed by a 3-byte character
        String password = "z".repeat(71) + "€" + "more";

        String truncated = TruncatingBCryptPasswordEncoder.truncate(password);

        assertThat(truncated).isEqualTo("z".repeat(71));
        assertThat(truncated.getBytes(StandardCharsets.UTF_8)).hasSizeLessThanOrEqualTo(72);
    }

    @Test
    @DisplayName("short passwords are untouched and a null never matches")
    void shortAndNull() {
        assertThat(TruncatingBCryptPasswordEncoder.truncate("Str0ng!Pass")).isEqualTo("Str0ng!Pass");
        assertThat(encoder.matches(null, encoder.encode("Str0ng!Pass"))).isFalse();
    }
}
