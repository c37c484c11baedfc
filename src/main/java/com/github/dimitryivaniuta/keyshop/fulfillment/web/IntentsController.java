package com.github.dimitryivaniuta.keyshop.fulfillment.web;

import com.github.dimitryivaniuta.keyshop.fulfillment.service.PaymentCompletionService;
import com.github.dimitryivaniuta.keyshop.fulfillment.service.PendingLedgerService;
import com.github.dimitryivaniuta.keyshop.fulfillment.service.dto.FulfillmentReport;
import com.github.dimitryivaniuta.keyshop.fulfillment.service.dto.OrderMetadata;
import com.github.dimitryivaniuta.keyshop.fulfillment.web.dto.CompletionResponse;
import com.github.dimitryivaniuta.keyshop.fulfillment.web.dto.CreateIntentRequest;
import com.github.dimitryivaniuta.keyshop.fulfillment.web.dto.IntentResponse;
import com.github.dimitryivaniuta.keyshop.fulfillment.web.dto.IntentStatusResponse;
import jakarta.validation.Valid;
import java.util.Optional;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

/**
 * REST API of the pending ledger, used by the chat-bot front end.
 */
@RestController
public class IntentsController {

    private final PendingLedgerService ledger;
    private final PaymentCompletionService completionService;

    public IntentsController(PendingLedgerService ledger, PaymentCompletionService completionService) {
        this.ledger = ledger;
        this.completionService = completionService;
    }

    /**
     * Records or refreshes a payment intent. Never fails the checkout: {@code recorded=false} is a hint only.
     */
    @PostMapping(value = "/api/intents", consumes = MediaType.APPLICATION_JSON_VALUE)
    public IntentResponse create(@Valid @RequestBody CreateIntentRequest request) {
        boolean recorded = ledger.createOrRefreshIntent(request.paymentId(), request.ownerId(), request.amount(),
                request.currency(), request.metadata());
        return new IntentResponse(request.paymentId(), recorded);
    }

    @GetMapping(value = "/api/intents/{paymentId}/status", produces = MediaType.APPLICATION_JSON_VALUE)
    public IntentStatusResponse status(@PathVariable String paymentId) {
        return ledger.getStatus(paymentId)
                .map(s -> new IntentStatusResponse(paymentId, s))
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Intent not found"));
    }

    /**
     * Metadata of a pending intent; 404 once it is paid.
     */
    @GetMapping(value = "/api/intents/{paymentId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public OrderMetadata peek(@PathVariable String paymentId) {
        return ledger.peekMetadata(paymentId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "No pending intent"));
    }

    @GetMapping(value = "/api/owners/{ownerId}/pending-intent", produces = MediaType.APPLICATION_JSON_VALUE)
    public OrderMetadata mostRecentPending(@PathVariable long ownerId) {
        return ledger.mostRecentPendingFor(ownerId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "No pending intent"));
    }

    /**
     * Manual "check payment": the front end confirmed the payment with the provider itself.
     */
    @PostMapping(value = "/api/intents/{paymentId}/complete", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<CompletionResponse> complete(
            @PathVariable String paymentId,
            @RequestParam(name = "paymentMethod", required = false) String paymentMethod
    ) {
        Optional<FulfillmentReport> report = completionService.completeAndFulfill(paymentId, paymentMethod);
        return ResponseEntity.ok(new CompletionResponse(paymentId, report.isPresent(), report.orElse(null)));
    }
}
