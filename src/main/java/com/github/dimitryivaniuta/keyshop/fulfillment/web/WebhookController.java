package com.github.dimitryivaniuta.keyshop.fulfillment.web;

import com.github.dimitryivaniuta.keyshop.fulfillment.service.WebhookIntakeService;
import com.github.dimitryivaniuta.keyshop.fulfillment.service.dto.WebhookResult;
import com.github.dimitryivaniuta.keyshop.fulfillment.verification.RawWebhook;
import java.util.Map;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

/**
 * Payment provider notifications.
 *
 * <p>Answers 200 for everything that was authenticated, 401 for anything that was not, 503 on ledger
 * contention and 5xx on storage errors so the provider redelivers.</p>
 */
@RestController
public class WebhookController {

    private final WebhookIntakeService intakeService;

    public WebhookController(WebhookIntakeService intakeService) {
        this.intakeService = intakeService;
    }

    @PostMapping(value = "/webhooks/{provider}", produces = MediaType.APPLICATION_JSON_VALUE)
    public WebhookResult receive(
            @PathVariable String provider,
            @RequestHeader Map<String, String> headers,
            @RequestBody(required = false) String body
    ) {
        return intakeService.handle(new RawWebhook(provider, headers, body == null ? "" : body));
    }
}
