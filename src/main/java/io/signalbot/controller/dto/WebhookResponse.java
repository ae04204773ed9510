package io.signalbot.controller.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record WebhookResponse(String status, String message) {

    public static WebhookResponse ok() {
        return new WebhookResponse("ok", null);
    }

    public static WebhookResponse duplicate() {
        return new WebhookResponse("duplicate", null);
    }

    public static WebhookResponse error(String message) {
        return new WebhookResponse("error", message);
    }
}
