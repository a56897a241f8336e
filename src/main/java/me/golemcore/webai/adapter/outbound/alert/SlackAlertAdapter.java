package me.golemcore.webai.adapter.outbound.alert;

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

import me.golemcore.webai.infrastructure.config.WebAiProperties;
import me.golemcore.webai.port.outbound.AlertPort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Map;

/**
 * Sends operational alerts to a Slack incoming webhook as {@code {"text": ...}}.
 *
 * <p>
 * Disabled when {@code webai.alerts.slack-webhook-url} is blank. Delivery
 * failures are logged and never rethrown.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SlackAlertAdapter implements AlertPort {

    private static final MediaType JSON = MediaType.get("application/json");
    private static final int MAX_MESSAGE_CHARS = 3000;

    private final OkHttpClient okHttpClient;
    private final ObjectMapper objectMapper;
    private final WebAiProperties properties;

    @Override
    public boolean isAvailable() {
        String url = properties.getAlerts().getSlackWebhookUrl();
        return url != null && !url.isBlank();
    }

    @Override
    public void notify(String message) {
        if (!isAvailable()) {
            return;
        }
        String text = message != null && message.length() > MAX_MESSAGE_CHARS
                ? message.substring(0, MAX_MESSAGE_CHARS)
                : message;
        try {
            String body = objectMapper.writeValueAsString(Map.of("text", text != null ? text : ""));
            Request request = new Request.Builder()
                    .url(properties.getAlerts().getSlackWebhookUrl())
                    .post(RequestBody.create(body, JSON))
                    .build();
            try (Response response = okHttpClient.newCall(request).execute()) {
                if (!response.isSuccessful()) {
                    log.warn("[Alert] Slack webhook returned {}", response.code());
                }
            }
        } catch (JsonProcessingException e) {
            log.warn("[Alert] Could not serialize alert: {}", e.getMessage());
        } catch (IOException | RuntimeException e) {
            log.warn("[Alert] Slack webhook delivery failed: {}", e.getMessage());
        }
    }
}
