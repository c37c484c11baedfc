package com.github.dimitryivaniuta.keyshop.fulfillment.service;

import com.github.dimitryivaniuta.keyshop.fulfillment.config.AppProperties;
import com.github.dimitryivaniuta.keyshop.fulfillment.domain.FulfillmentStep.StepType;
import com.github.dimitryivaniuta.keyshop.fulfillment.notification.NotificationSink;
import com.github.dimitryivaniuta.keyshop.fulfillment.repo.ProcessedPaymentRepository;
import com.github.dimitryivaniuta.keyshop.fulfillment.service.dto.StepOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Reports claimed payments whose fulfillment never reached a terminal step (a crash between claim and the
 * last side effect).
 *
 * <p>Nothing is retried automatically: the side effects of a half-finished run are unknown. Each gap gets an
 * {@code ALERTED} step, which also keeps it from being reported twice.</p>
 */
@Slf4j
@Component
public class FulfillmentGapDetector {

    private static final int BATCH = 100;

    private final ProcessedPaymentRepository processedPaymentRepository;
    private final FulfillmentStepRecorder stepRecorder;
    private final NotificationSink notificationSink;
    private final AppProperties properties;
    private final Clock clock;
    private final Counter alertedCounter;

    public FulfillmentGapDetector(
            ProcessedPaymentRepository processedPaymentRepository,
            FulfillmentStepRecorder stepRecorder,
            NotificationSink notificationSink,
            AppProperties properties,
            Clock clock,
            MeterRegistry meterRegistry
    ) {
        this.processedPaymentRepository = processedPaymentRepository;
        this.stepRecorder = stepRecorder;
        this.notificationSink = notificationSink;
        this.properties = properties;
        this.clock = clock;
        this.alertedCounter = Counter.builder("keyshop.fulfillment.gap.alerted").register(meterRegistry);
    }

    /**
     * Finds and reports stale claims.
     *
     * @return number of payments reported
     */
    @Scheduled(fixedDelayString = "${app.fulfillment.gap-detector-interval-ms:60000}")
    public int detect() {
        Instant cutoff = clock.instant().minus(properties.getFulfillment().getGapAlertAfter());
        List<String> unfinished = processedPaymentRepository.findUnfinishedClaims(cutoff, BATCH);
        for (String paymentId : unfinished) {
            stepRecorder.record(paymentId, StepOutcome.failed(StepType.ALERTED, "no terminal step since before " + cutoff));
            notificationSink.notifyOperators("Payment " + paymentId + " was claimed but fulfillment did not finish. "
                    + "Check fulfillment_steps and complete it manually.");
            alertedCounter.increment();
            log.error("Fulfillment gap paymentId={} claimedBefore={}", paymentId, cutoff);
        }
        return unfinished.size();
    }
}
