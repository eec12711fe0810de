package com.gbu.workshophub.modules.legacy;

import com.gbu.workshophub.modules.auth.dto.RegisterRequest;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Checks untyped JSON bodies of the legacy API. Bodies stay maps so that a capacity of
 * {@code "5"} or a signup flag of {@code "true"} is rejected rather than coerced.
 */
@Component
public class LegacyWorkshopValidator {

    static final Set<String> DELIVERY_MODES = Set.of("online", "face-to-face", "hybrid");
    static final List<String> STATUSES = List.of(LegacyWorkshop.PENDING, LegacyWorkshop.ONGOING,
            LegacyWorkshop.COMPLETED);
    static final int MAX_HTML_CONTENT_BYTES = 50 * 1024;

    private static final List<String> WORKSHOP_FIELDS = List.of("title", "description", "start_time", "end_time",
            "capacity", "delivery_mode");
    private static final List<String> REGISTRATION_FIELDS = List.of("participant_name", "participant_email");
    private static final Pattern EMAIL = Pattern.compile(RegisterRequest.EMAIL_REGEX);

    public void validateWorkshop(Map<String, Object> body) {
        requireFields(body, WORKSHOP_FIELDS);
        requireNonEmptyString(body.get("title"), "Title");

        if (!(body.get("description") instanceof String)) {
            throw LegacyApiException.badRequest("Description must be a string");
        }

        Object capacity = body.get("capacity");
        if (!(capacity instanceof Integer)) {
            throw LegacyApiException.badRequest("Capacity must be an integer");
        }
        if ((Integer) capacity <= 0) {
            throw LegacyApiException.badRequest("Capacity must be a positive integer");
        }

        Object mode = body.get("delivery_mode");
        if (!(mode instanceof String) || !DELIVERY_MODES.contains(mode)) {
            throw LegacyApiException.badRequest("Delivery mode must be one of: online, face-to-face, hybrid");
        }

        Optional<Instant> start = parseTimestamp(body.get("start_time"));
        Optional<Instant> end = parseTimestamp(body.get("end_time"));
        if (start.isEmpty() || end.isEmpty() || !start.get().isBefore(end.get())) {
            throw LegacyApiException.badRequest("Start time must occur before end time");
        }
    }

    public void validateChallenge(Map<String, Object> body) {
        if (!body.containsKey("title")) {
            throw LegacyApiException.badRequest("Missing required field: title");
        }
        requireNonEmptyString(body.get("title"), "Title");

        Object description = body.get("description");
        if (description != null && !(description instanceof String)) {
            throw LegacyApiException.badRequest("Description must be a string");
        }

        Object html = body.get("html_content");
        if (html != null) {
            if (!(html instanceof String)) {
                throw LegacyApiException.badRequest("html_content must be a string");
            }
            if (((String) html).getBytes(StandardCharsets.UTF_8).length > MAX_HTML_CONTENT_BYTES) {
                throw LegacyApiException.badRequest("html_content must not exceed 50KB");
            }
        }
    }

    public void validateRegistration(Map<String, Object> body) {
        requireFields(body, REGISTRATION_FIELDS);
        requireNonEmptyString(body.get("participant_name"), "participant_name");
        Object email = body.get("participant_email");
        if (!(email instanceof String) || !isEmail((String) email)) {
            throw LegacyApiException.badRequest("Invalid email format");
        }
    }

    public String validateStatus(Map<String, Object> body) {
        if (!body.containsKey("status")) {
            throw LegacyApiException.badRequest("Missing required field: status");
        }
        Object status = body.get("status");
        if (!(status instanceof String) || !STATUSES.contains(status)) {
            throw LegacyApiException.badRequest("Status must be one of: pending, ongoing, completed");
        }
        return (String) status;
    }

    public boolean validateSignupEnabled(Map<String, Object> body) {
        if (!body.containsKey("signup_enabled")) {
            throw LegacyApiException.badRequest("Missing required field: signup_enabled");
        }
        Object enabled = body.get("signup_enabled");
        if (!(enabled instanceof Boolean)) {
            throw LegacyApiException.badRequest("signup_enabled must be a boolean");
        }
        return (Boolean) enabled;
    }

    public boolean isEmail(String value) {
        return value != null && EMAIL.matcher(value.trim()).matches();
    }

    /**
     * ISO-8601 with or without an offset, or a bare date. Values without an offset are
     * read as UTC.
     */
    static Optional<Instant> parseTimestamp(Object value) {
        if (!(value instanceof String)) {
            return Optional.empty();
        }
        String text = ((String) value).trim();
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(text, OffsetDateTime::from,
                    LocalDateTime::from);
            if (parsed instanceof OffsetDateTime withOffset) {
                return Optional.of(withOffset.toInstant());
            }
            return Optional.of(((LocalDateTime) parsed).toInstant(ZoneOffset.UTC));
        } catch (DateTimeParseException e) {
            return parseDate(text);
        }
    }

    private static Optional<Instant> parseDate(String text) {
        try {
            return Optional.of(LocalDate.parse(text).atStartOfDay().toInstant(ZoneOffset.UTC));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private static void requireFields(Map<String, Object> body, List<String> fields) {
        List<String> missing = fields.stream().filter(f -> !body.containsKey(f)).collect(Collectors.toList());
        if (!missing.isEmpty()) {
            throw LegacyApiException.badRequest("Missing required fields: " + String.join(", ", missing));
        }
    }

    private static void requireNonEmptyString(Object value, String field) {
        if (!(value instanceof String)) {
            throw LegacyApiException.badRequest(field + " must be a string");
        }
        if (((String) value).isBlank()) {
            throw LegacyApiException.badRequest(field + " must be a non-empty string");
        }
    }
}
