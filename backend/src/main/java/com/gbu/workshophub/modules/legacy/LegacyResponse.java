package com.gbu.workshophub.modules.legacy;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.Map;

@Data
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LegacyResponse<T> {

    private boolean success;
    private T data;
    private String error;

    public static <T> LegacyResponse<T> ok(T data) {
        return new LegacyResponse<>(true, data, null);
    }

    public static LegacyResponse<Map<String, Object>> failure(String error) {
        return new LegacyResponse<>(false, Map.of(), error);
    }
}
