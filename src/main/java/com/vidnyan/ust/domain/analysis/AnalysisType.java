package com.vidnyan.ust.domain.analysis;

import java.util.Arrays;
import java.util.Locale;

/**
 * Sections of an analysis report.
 */
public enum AnalysisType {
    ALL,
    FUNCTIONS,
    VARIABLES,
    CLASSES,
    IMPORTS,
    COMPLEXITY;

    public boolean includes(AnalysisType section) {
        return this == ALL || this == section;
    }

    /**
     * Case-insensitive parse; blank means {@link #ALL}.
     *
     * @throws IllegalArgumentException if the value names no section
     */
    public static AnalysisType parse(String value) {
        if (value == null || value.isBlank()) {
            return ALL;
        }
        String name = value.trim().toUpperCase(Locale.ROOT);
        for (AnalysisType type : values()) {
            if (type.name().equals(name)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown analysis type '" + value.trim()
                + "', expected one of " + Arrays.toString(values()).toLowerCase(Locale.ROOT));
    }
}
