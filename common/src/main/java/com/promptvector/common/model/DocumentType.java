package com.promptvector.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DocumentType {
    PROMPT,
    TEMPLATE,
    EXAMPLE,
    FEEDBACK;

    @JsonValue
    public String jsonValue() {
        return name().toLowerCase();
    }
}
