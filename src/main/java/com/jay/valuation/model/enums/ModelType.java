package com.jay.valuation.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ModelType {
    FCFE("fcfe"),
    FCFF("fcff"),
    JUSTIFIED_PE("justified_pe"),
    JUSTIFIED_PB("justified_pb");

    private final String wireName;

    ModelType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static ModelType fromWireName(String name) {
        for (ModelType t : values()) {
            if (t.wireName.equals(name.trim().toLowerCase(Locale.ROOT))) return t;
        }
        throw new IllegalArgumentException("Unknown valuation model: " + name);
    }
}
