package me.golemcore.webai.domain.model;

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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * The single externally observable outcome of an ask: either {@code ok} with
 * {@link AskData}, or a failure with a message and {@link AskErrorCode}.
 *
 * <p>
 * Instances are created through the factory methods only, so a result is never
 * both successful and failed.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AskResult {

    boolean ok;
    AskData data;
    String error;
    AskErrorCode code;
    @JsonProperty("retry")
    Integer retryAfterSeconds;

    public static AskResult success(AskData data) {
        return new AskResult(true, data, null, null, null);
    }

    public static AskResult failure(AskErrorCode code, String error) {
        return new AskResult(false, null, error, code, null);
    }

    public static AskResult badRequest(String error) {
        return failure(AskErrorCode.BAD_REQUEST, error);
    }

    public static AskResult serverError() {
        return failure(AskErrorCode.SERVER_ERROR, "Something went wrong.");
    }

    public static AskResult subscriptionRequired() {
        return failure(AskErrorCode.SUBSCRIPTION_REQUIRED, "Subscription required.");
    }

    public static AskResult rateLimited(int retryAfterSeconds) {
        return new AskResult(false, null, "Too many requests. Retry in " + retryAfterSeconds + "s",
                AskErrorCode.RATE_LIMITED, retryAfterSeconds);
    }
}
