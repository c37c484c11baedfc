package com.github.dimitryivaniuta.keyshop.fulfillment.web;

import com.github.dimitryivaniuta.keyshop.fulfillment.service.ReconciliationService;
import com.github.dimitryivaniuta.keyshop.fulfillment.service.dto.ReconciliationReport;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Operator triggers for credential reconciliation.
 */
@RestController
@RequestMapping(value = "/api/admin/reconciliation", produces = MediaType.APPLICATION_JSON_VALUE)
public class ReconciliationController {

    private final ReconciliationService reconciliationService;

    public ReconciliationController(ReconciliationService reconciliationService) {
        this.reconciliationService = reconciliationService;
    }

    @PostMapping("/owners/{ownerId}")
    public ReconciliationReport reconcileOwner(@PathVariable long ownerId) {
        return reconciliationService.reconcileOwner(ownerId);
    }

    @PostMapping("/sweep")
    public ReconciliationReport sweep() {
        return reconciliationService.reconcileAll();
    }
}
