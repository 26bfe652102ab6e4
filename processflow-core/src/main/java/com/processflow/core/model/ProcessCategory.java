package com.processflow.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Closed set of business categories a process definition belongs to.
 */
public enum ProcessCategory {
    FINANCE,
    HR,
    OPERATIONS,
    SALES,
    PROCUREMENT,
    APPROVAL,
    CUSTOM;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ProcessCategory fromValue(String value) {
        return ProcessCategory.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
