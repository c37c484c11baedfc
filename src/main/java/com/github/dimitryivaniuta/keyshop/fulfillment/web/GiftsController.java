package com.github.dimitryivaniuta.keyshop.fulfillment.web;

import com.github.dimitryivaniuta.keyshop.fulfillment.service.GiftService;
import com.github.dimitryivaniuta.keyshop.fulfillment.service.dto.GiftDelivery;
import com.github.dimitryivaniuta.keyshop.fulfillment.web.dto.GiftRecipientRequest;
import com.github.dimitryivaniuta.keyshop.fulfillment.web.dto.PendingGiftResponse;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * Gift delivery: the payer names a recipient for a paid gift.
 */
@RestController
public class GiftsController {

    private final GiftService giftService;

    public GiftsController(GiftService giftService) {
        this.giftService = giftService;
    }

    @PostMapping(value = "/api/gifts/{paymentId}/recipient", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<GiftDelivery> deliver(@PathVariable String paymentId,
                                                @Valid @RequestBody GiftRecipientRequest request) {
        GiftDelivery delivery = giftService.deliver(paymentId, request.recipient());
        HttpStatus status = switch (delivery.status()) {
            case DELIVERED, ALREADY_DELIVERED -> HttpStatus.OK;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case FAILED -> HttpStatus.BAD_GATEWAY;
        };
        return ResponseEntity.status(status).body(delivery);
    }

    @GetMapping(value = "/api/owners/{ownerId}/gifts", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<PendingGiftResponse> awaiting(@PathVariable long ownerId) {
        return giftService.awaitingFor(ownerId).stream().map(PendingGiftResponse::from).toList();
    }
}
