package me.golemcore.webai.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Where an {@link Entitlement} was resolved from.
 */
public enum EntitlementSource {

    WHOP("whop"),

    REVENUECAT("revenuecat"),

    NONE("none");

    private final String id;

    EntitlementSource(String id) {
        this.id = id;
    }

    @JsonValue
    public String getId() {
        return id;
    }
}
