package com.gbu.workshophub.modules.legacy;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** Whole content of the store file. */
@Data
@NoArgsConstructor
public class LegacyData {

    private List<LegacyWorkshop> workshops = new ArrayList<>();
    private List<LegacyChallenge> challenges = new ArrayList<>();
    private List<LegacyRegistration> registrations = new ArrayList<>();

    public Optional<LegacyWorkshop> findWorkshop(String workshopId) {
        return workshops.stream().filter(w -> workshopId.equals(w.getId())).findFirst();
    }

    /** A file with a section set to null or left out reads as an empty section. */
    void normalize() {
        if (workshops == null)
            workshops = new ArrayList<>();
        if (challenges == null)
            challenges = new ArrayList<>();
        if (registrations == null)
            registrations = new ArrayList<>();
    }
}
