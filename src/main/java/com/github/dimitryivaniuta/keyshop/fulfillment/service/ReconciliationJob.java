package com.github.dimitryivaniuta.keyshop.fulfillment.service;

import com.github.dimitryivaniuta.keyshop.fulfillment.service.dto.ReconciliationReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@ConditionalOnProperty(prefix = "app.reconciliation", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ReconciliationJob {

    private final ReconciliationService reconciliationService;

    public ReconciliationJob(ReconciliationService reconciliationService) {
        this.reconciliationService = reconciliationService;
    }

    @Scheduled(cron = "${app.reconciliation.cron:0 */30 * * * *}")
    public void sweep() {
        ReconciliationReport report = reconciliationService.reconcileAll();
        if (report.deleted() > 0 || report.unknown() > 0) {
            log.warn("Reconciliation sweep deleted={} unknown={} checked={}", report.deleted(), report.unknown(), report.checked());
        }
    }
}
