package com.llmhub.gateway.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.llmhub.gateway.exception.ValidationException;

public enum Role {
    SYSTEM("system"),
    USER("user"),
    ASSISTANT("assistant");

    private final String value;

    Role(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static Role fromValue(String value) {
        if (value != null) {
            for (Role role : values()) {
                if (role.value.equalsIgnoreCase(value.trim())) {
                    return role;
                }
            }
        }
        throw new ValidationException("Unsupported message role: " + value);
    }
}
