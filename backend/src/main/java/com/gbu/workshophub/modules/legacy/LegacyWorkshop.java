package com.gbu.workshophub.modules.legacy;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import lombok.AccessLevel;
import lombok.Data;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Workshop record of the JSON store. Records written before status and signup control
 * existed read back as pending with signups enabled.
 */
@Data
@NoArgsConstructor
public class LegacyWorkshop {

    public static final String PENDING = "pending";
    public static final String ONGOING = "ongoing";
    public static final String COMPLETED = "completed";

    private String id;
    private String title;
    private String description;
    private String startTime;
    private String endTime;
    private Integer capacity;
    private String deliveryMode;
    private Integer registrationCount = 0;
    private String status = PENDING;
    private Boolean signupEnabled = true;

    // fields this version does not know about survive a rewrite of the file
    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private Map<String, Object> unknownFields = new LinkedHashMap<>();

    @JsonAnySetter
    public void putUnknownField(String name, Object value) {
        unknownFields.put(name, value);
    }

    @JsonAnyGetter
    public Map<String, Object> unknownFields() {
        return unknownFields;
    }
}
