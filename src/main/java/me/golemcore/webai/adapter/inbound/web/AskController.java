package me.golemcore.webai.adapter.inbound.web;

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

import me.golemcore.webai.domain.model.AskErrorCode;
import me.golemcore.webai.domain.model.AskRequest;
import me.golemcore.webai.domain.model.AskResult;
import me.golemcore.webai.domain.service.AskService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * HTTP entry point of the ask workflow.
 *
 * <p>
 * The workflow blocks on providers, tools and the answer backend, so it runs on
 * the bounded elastic scheduler. The body is always an {@link AskResult}; the
 * status code mirrors its failure code.
 */
@RestController
@RequestMapping("/api/ask")
@RequiredArgsConstructor
public class AskController {

    private final AskService askService;

    @PostMapping
    public Mono<ResponseEntity<AskResult>> ask(@RequestBody AskRequest request) {
        return Mono.fromCallable(() -> askService.ask(request))
                .subscribeOn(Schedulers.boundedElastic())
                .map(AskController::toResponse);
    }

    static ResponseEntity<AskResult> toResponse(AskResult result) {
        if (result.isOk()) {
            return ResponseEntity.ok(result);
        }
        ResponseEntity.BodyBuilder builder = ResponseEntity.status(statusFor(result.getCode()));
        if (result.getRetryAfterSeconds() != null) {
            builder.header(HttpHeaders.RETRY_AFTER, String.valueOf(result.getRetryAfterSeconds()));
        }
        return builder.body(result);
    }

    static HttpStatus statusFor(AskErrorCode code) {
        if (code == null) {
            return HttpStatus.INTERNAL_SERVER_ERROR;
        }
        return switch (code) {
        case BAD_REQUEST -> HttpStatus.BAD_REQUEST;
        case RATE_LIMITED -> HttpStatus.TOO_MANY_REQUESTS;
        case SUBSCRIPTION_REQUIRED -> HttpStatus.PAYMENT_REQUIRED;
        case SERVER_ERROR -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
