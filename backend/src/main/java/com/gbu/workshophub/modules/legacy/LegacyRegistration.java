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

@Data
@NoArgsConstructor
public class LegacyRegistration {

    private String id;
    private String workshopId;
    private String participantName;
    private String participantEmail;
    private String registeredAt;

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
