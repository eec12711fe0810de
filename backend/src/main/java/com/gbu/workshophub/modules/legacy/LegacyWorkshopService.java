package com.gbu.workshophub.modules.legacy;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Unauthenticated workshop/registration API backed by {@link LegacyWorkshopStore}.
 * Each operation is one locked store cycle, so checks and writes cannot interleave
 * with another request.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LegacyWorkshopService {

    static final String SIGNUPS_DISABLED = "Signups are currently disabled for this workshop";
    static final String WORKSHOP_FULL = "Workshop is full. Registration count has reached capacity.";
    static final String INVALID_BODY = "Request body must be valid JSON";

    private final LegacyWorkshopStore store;
    private final LegacyWorkshopValidator validator;

    // ── Workshops ────────────────────────────────────────────────────────────

    public LegacyWorkshop createWorkshop(Map<String, Object> body) {
        requireBody(body);
        validator.validateWorkshop(body);

        LegacyWorkshop workshop = new LegacyWorkshop();
        workshop.setId(UUID.randomUUID().toString());
        workshop.setTitle((String) body.get("title"));
        workshop.setDescription((String) body.get("description"));
        workshop.setStartTime((String) body.get("start_time"));
        workshop.setEndTime((String) body.get("end_time"));
        workshop.setCapacity((Integer) body.get("capacity"));
        workshop.setDeliveryMode((String) body.get("delivery_mode"));

        store.update(data -> data.getWorkshops().add(workshop));
        log.info("Legacy workshop {} created", workshop.getId());
        return workshop;
    }

    public List<LegacyWorkshop> listWorkshops() {
        return store.read(LegacyData::getWorkshops);
    }

    public LegacyWorkshop getWorkshop(String workshopId) {
        return store.read(data -> findWorkshop(data, workshopId));
    }

    public LegacyWorkshop updateStatus(String workshopId, Map<String, Object> body) {
        return store.update(data -> {
            LegacyWorkshop workshop = findWorkshop(data, workshopId);
            requireBody(body);
            workshop.setStatus(validator.validateStatus(body));
            log.info("Legacy workshop {} status set to {}", workshopId, workshop.getStatus());
            return workshop;
        });
    }

    public LegacyWorkshop updateSignup(String workshopId, Map<String, Object> body) {
        return store.update(data -> {
            LegacyWorkshop workshop = findWorkshop(data, workshopId);
            requireBody(body);
            workshop.setSignupEnabled(validator.validateSignupEnabled(body));
            return workshop;
        });
    }

    // ── Challenges ───────────────────────────────────────────────────────────

    public LegacyChallenge createChallenge(String workshopId, Map<String, Object> body) {
        return store.update(data -> {
            findWorkshop(data, workshopId);
            requireBody(body);
            validator.validateChallenge(body);

            LegacyChallenge challenge = new LegacyChallenge();
            challenge.setId(UUID.randomUUID().toString());
            challenge.setWorkshopId(workshopId);
            challenge.setTitle((String) body.get("title"));
            challenge.setDescription(body.get("description") != null ? (String) body.get("description") : "");
            challenge.setHtmlContent((String) body.get("html_content"));
            challenge.setCreatedAt(Instant.now().toString());
            data.getChallenges().add(challenge);
            return challenge;
        });
    }

    /** Only registered emails see challenges, and only while the workshop is ongoing. */
    public List<LegacyChallenge> getChallengesForParticipant(String workshopId, String email) {
        if (email == null || email.isBlank()) {
            throw LegacyApiException.badRequest("Missing required query parameter: email");
        }
        if (!validator.isEmail(email)) {
            throw LegacyApiException.badRequest("Invalid email format");
        }

        // stored emails are trimmed on registration; older records may not be
        String wanted = email.trim();
        return store.read(data -> {
            LegacyWorkshop workshop = findWorkshop(data, workshopId);
            boolean registered = data.getRegistrations().stream()
                    .anyMatch(r -> workshopId.equals(r.getWorkshopId()) && r.getParticipantEmail() != null
                            && wanted.equals(r.getParticipantEmail().trim()));
            if (!registered) {
                throw LegacyApiException.forbidden("You must be registered to view challenges");
            }

            String status = statusOf(workshop);
            if (LegacyWorkshop.PENDING.equals(status)) {
                throw LegacyApiException.forbidden("Challenges are not available until the workshop begins");
            }
            if (LegacyWorkshop.COMPLETED.equals(status)) {
                throw LegacyApiException.forbidden("Challenges are no longer available for completed workshops");
            }

            return data.getChallenges().stream()
                    .filter(c -> workshopId.equals(c.getWorkshopId()))
                    .collect(Collectors.toList());
        });
    }

    // ── Registrations ────────────────────────────────────────────────────────

    /**
     * Checks run in a fixed order: existence, body, signup flag, status, capacity. The
     * registration and the count increment are written together.
     */
    public LegacyRegistration register(String workshopId, Map<String, Object> body) {
        return store.update(data -> {
            LegacyWorkshop workshop = findWorkshop(data, workshopId);
            requireBody(body);
            validator.validateRegistration(body);

            if (!Boolean.TRUE.equals(workshop.getSignupEnabled())) {
                throw LegacyApiException.forbidden(SIGNUPS_DISABLED);
            }
            String status = statusOf(workshop);
            if (LegacyWorkshop.ONGOING.equals(status) || LegacyWorkshop.COMPLETED.equals(status)) {
                throw LegacyApiException.forbidden("Signups are closed for " + status + " workshops");
            }
            int count = workshop.getRegistrationCount() != null ? workshop.getRegistrationCount() : 0;
            int capacity = workshop.getCapacity() != null ? workshop.getCapacity() : 0;
            if (count >= capacity) {
                throw new LegacyApiException(HttpStatus.CONFLICT, WORKSHOP_FULL);
            }

            LegacyRegistration registration = new LegacyRegistration();
            registration.setId(UUID.randomUUID().toString());
            registration.setWorkshopId(workshopId);
            registration.setParticipantName((String) body.get("participant_name"));
            registration.setParticipantEmail(((String) body.get("participant_email")).trim());
            registration.setRegisteredAt(Instant.now().toString());

            data.getRegistrations().add(registration);
            workshop.setRegistrationCount(count + 1);
            log.info("Registration {} for legacy workshop {} ({}/{})", registration.getId(), workshopId, count + 1,
                    capacity);
            return registration;
        });
    }

    public List<LegacyRegistration> listRegistrations() {
        return store.read(LegacyData::getRegistrations);
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private static LegacyWorkshop findWorkshop(LegacyData data, String workshopId) {
        return data.findWorkshop(workshopId).orElseThrow(() -> LegacyApiException.workshopNotFound(workshopId));
    }

    private static void requireBody(Map<String, Object> body) {
        if (body == null) {
            throw LegacyApiException.badRequest(INVALID_BODY);
        }
    }

    private static String statusOf(LegacyWorkshop workshop) {
        return workshop.getStatus() != null ? workshop.getStatus() : LegacyWorkshop.PENDING;
    }
}
