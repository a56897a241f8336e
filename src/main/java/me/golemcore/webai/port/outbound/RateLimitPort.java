package me.golemcore.webai.port.outbound;

import me.golemcore.webai.domain.model.RateLimitResult;

/**
 * Port for per-user request throughput limiting.
 */
public interface RateLimitPort {

    /**
     * Counts one request for the user and reports whether it is admitted. Requests
     * without a user id are always admitted.
     */
    RateLimitResult tryConsume(String userId);
}
