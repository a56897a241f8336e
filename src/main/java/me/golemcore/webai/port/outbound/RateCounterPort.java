package me.golemcore.webai.port.outbound;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import java.time.Instant;

/**
 * Counter store for fixed-window rate limiting. Each key is a
 * {@code (user, window)} bucket that may be discarded once its window ended.
 */
public interface RateCounterPort {

    /**
     * Increments the bucket counter, creating it on first hit.
     *
     * @return the post-increment count
     */
    long incrementAndGet(String key, Instant windowEnd);

    /**
     * Drops buckets whose window ended at or before {@code now}.
     *
     * @return number of removed buckets
     */
    int purgeExpired(Instant now);
}
