package org.dxworks.ruleframe.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ConditionType {
    HTTP_METHOD("http_method"),
    USER_CHECK("user_check"),
    REQUEST_FIELD("request_field"),
    RULE_WHEN("rule_when"),
    ELSE("else"),
    CUSTOM("custom");

    private final String name;

    ConditionType(String name) {
        this.name = name;
    }

    @JsonValue
    public String getName() {
        return name;
    }
}
