package me.golemcore.agentloop.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Closed set of thought kinds a tree node can represent.
 */
public enum ThoughtType {
    HYPOTHESIS, OBSERVATION, DECISION, ANALYSIS, CONCLUSION, QUESTION, ALTERNATIVE;

    @JsonValue
    public String getWireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Lenient lookup; anything unrecognised becomes {@link #HYPOTHESIS}.
     */
    @JsonCreator
    public static ThoughtType fromWire(String value) {
        if (value == null || value.isBlank()) {
            return HYPOTHESIS;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (ThoughtType type : values()) {
            if (type.name().equals(normalized)) {
                return type;
            }
        }
        return HYPOTHESIS;
    }
}
