package me.golemcore.webai.adapter.inbound.web;

import me.golemcore.webai.domain.model.AskData;
import me.golemcore.webai.domain.model.AskErrorCode;
import me.golemcore.webai.domain.model.AskRequest;
import me.golemcore.webai.domain.model.AskResult;
import me.golemcore.webai.domain.service.AskService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import reactor.test.StepVerifier;

class AskControllerTest {

    private AskService askService;
    private AskController controller;

    @BeforeEach
    void setUp() {
        askService = mock(AskService.class);
        controller = new AskController(askService);
    }

    @Test
    void shouldReturnOkWithData() {
        AskData data = AskData.builder()
                .answer("4")
                .usedTools(List.of("math"))
                .citations(List.of())
                .build();
        when(askService.ask(any())).thenReturn(AskResult.success(data));

        StepVerifier.create(controller.ask(AskRequest.builder().prompt("2 + 2").userId("u").build()))
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    AskResult body = response.getBody();
                    assertNotNull(body);
                    assertTrue(body.isOk());
                    assertEquals("4", body.getData().getAnswer());
                })
                .verifyComplete();
    }

    @Test
    void shouldReturnTooManyRequestsWithRetryAfter() {
        when(askService.ask(any())).thenReturn(AskResult.rateLimited(60));

        StepVerifier.create(controller.ask(AskRequest.builder().prompt("hi").userId("u").build()))
                .assertNext(response -> {
                    assertEquals(HttpStatus.TOO_MANY_REQUESTS, response.getStatusCode());
                    assertEquals("60", response.getHeaders().getFirst(HttpHeaders.RETRY_AFTER));
                    assertEquals(AskErrorCode.RATE_LIMITED, response.getBody().getCode());
                })
                .verifyComplete();
    }

    @Test
    void shouldReturnPaymentRequiredForInactiveSubscription() {
        when(askService.ask(any())).thenReturn(AskResult.subscriptionRequired());

        StepVerifier.create(controller.ask(AskRequest.builder().prompt("hi").build()))
                .assertNext(response -> {
                    assertEquals(HttpStatus.PAYMENT_REQUIRED, response.getStatusCode());
                    assertNull(response.getHeaders().getFirst(HttpHeaders.RETRY_AFTER));
                    assertFalse(response.getBody().isOk());
                })
                .verifyComplete();
    }

    @Test
    void shouldMapEveryErrorCodeToStatus() {
        assertEquals(HttpStatus.BAD_REQUEST, AskController.statusFor(AskErrorCode.BAD_REQUEST));
        assertEquals(HttpStatus.TOO_MANY_REQUESTS, AskController.statusFor(AskErrorCode.RATE_LIMITED));
        assertEquals(HttpStatus.PAYMENT_REQUIRED, AskController.statusFor(AskErrorCode.SUBSCRIPTION_REQUIRED));
        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, AskController.statusFor(AskErrorCode.SERVER_ERROR));
        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, AskController.statusFor(null));
    }

    @Test
    void shouldReturnBadRequestBody() {
        when(askService.ask(any())).thenReturn(AskResult.badRequest("Missing prompt."));

        StepVerifier.create(controller.ask(new AskRequest()))
                .assertNext(response -> {
                    assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
                    assertEquals("Missing prompt.", response.getBody().getError());
                })
                .verifyComplete();
    }
}
