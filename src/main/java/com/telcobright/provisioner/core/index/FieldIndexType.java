package com.telcobright.provisioner.core.index;

import com.telcobright.provisioner.core.exception.IndexConfigurationException;

import java.util.ArrayList;
import java.util.List;

/**
 * Shapes of per-field index that can be requested through the field index setting.
 */
public enum FieldIndexType {

    /**
     * {@code (time DESC, field)}: range scans over time that also read the field.
     */
    TIME_MAJOR("time-major"),

    /**
     * {@code (field, time DESC)}: threshold queries on the field value.
     */
    VALUE_MAJOR("value-major");

    private final String token;

    FieldIndexType(String token) {
        this.token = token;
    }

    public String getToken() {
        return token;
    }

    public static FieldIndexType fromToken(String token) {
        for (FieldIndexType type : values()) {
            if (type.token.equals(token)) {
                return type;
            }
        }
        throw new IndexConfigurationException(token);
    }

    /**
     * Parse a comma separated list of tokens. Empty entries are ignored, so
     * {@code ""}, {@code ","} and {@code "time-major,,value-major"} are all valid.
     *
     * @throws IndexConfigurationException on the first unknown token
     */
    public static List<FieldIndexType> parseSpec(String spec) {
        List<FieldIndexType> types = new ArrayList<>();
        if (spec == null) {
            return types;
        }
        for (String token : spec.split(",", -1)) {
            if (token.isEmpty()) {
                continue;
            }
            types.add(fromToken(token));
        }
        return types;
    }
}
