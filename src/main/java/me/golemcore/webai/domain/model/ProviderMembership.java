package me.golemcore.webai.domain.model;

/**
 * What a single entitlement provider knows about a user.
 */
public record ProviderMembership(boolean active, String plan) {

    private static final ProviderMembership NOT_FOUND = new ProviderMembership(false, null);

    public static ProviderMembership notFound() {
        return NOT_FOUND;
    }

    public static ProviderMembership active(String plan) {
        return new ProviderMembership(true, plan);
    }
}
