package org.jstats.tipster_api.modules.prediction.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ModelTier {
    FREE("free"),
    PREMIUM("premium");

    private final String wireName;

    ModelTier(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
