package com.github.dimitryivaniuta.keyshop.fulfillment.web;

import com.github.dimitryivaniuta.keyshop.fulfillment.service.BalancePaymentService;
import com.github.dimitryivaniuta.keyshop.fulfillment.service.dto.FulfillmentReport;
import com.github.dimitryivaniuta.keyshop.fulfillment.service.dto.OrderMetadata;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class BalancePaymentsController {

    private final BalancePaymentService balancePaymentService;

    public BalancePaymentsController(BalancePaymentService balancePaymentService) {
        this.balancePaymentService = balancePaymentService;
    }

    @PostMapping(value = "/api/balance-payments", consumes = MediaType.APPLICATION_JSON_VALUE)
    public FulfillmentReport pay(@RequestBody OrderMetadata order) {
        return balancePaymentService.pay(order);
    }
}
