package me.golemcore.webai.domain.model;

/**
 * Failure codes of {@link AskResult}.
 */
public enum AskErrorCode {

    /** Entitlement is inactive, upgrading is required. */
    SUBSCRIPTION_REQUIRED,

    /** Malformed or empty input, retrying does not help. */
    BAD_REQUEST,

    /** Backend or internal failure, safe to retry later. */
    SERVER_ERROR,

    /** Per-user quota exceeded, retry after the advertised delay. */
    RATE_LIMITED
}
