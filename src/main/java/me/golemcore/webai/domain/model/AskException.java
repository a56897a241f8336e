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

/**
 * Failure whose message is safe to return to the caller together with its
 * {@link AskErrorCode}.
 */
public class AskException extends RuntimeException {

    private final AskErrorCode code;

    public AskException(String message, AskErrorCode code) {
        super(message);
        this.code = code;
    }

    public AskException(String message, AskErrorCode code, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public AskErrorCode getCode() {
        return code;
    }
}
