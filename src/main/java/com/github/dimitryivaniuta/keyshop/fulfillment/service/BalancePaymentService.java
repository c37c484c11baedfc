package com.github.dimitryivaniuta.keyshop.fulfillment.service;

import static com.github.dimitryivaniuta.keyshop.fulfillment.service.PostgresAdvisoryLockService.BALANCE_PAYMENT_SCOPE;

import com.github.dimitryivaniuta.keyshop.fulfillment.config.AppProperties;
import com.github.dimitryivaniuta.keyshop.fulfillment.domain.PaymentLogEntry;
import com.github.dimitryivaniuta.keyshop.fulfillment.repo.PaymentLogRepository;
import com.github.dimitryivaniuta.keyshop.fulfillment.service.dto.FulfillmentAction;
import com.github.dimitryivaniuta.keyshop.fulfillment.service.dto.FulfillmentReport;
import com.github.dimitryivaniuta.keyshop.fulfillment.service.dto.InvalidOrderMetadataException;
import com.github.dimitryivaniuta.keyshop.fulfillment.service.dto.OrderMetadata;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Purchases paid from the stored balance. These never pass through the pending ledger.
 *
 * <p>The debit and its log row are committed under the {@code ("balance:pay", paymentId)} advisory lock, and a
 * second request for the same payment id finds the logged debit and does nothing. Fulfillment then runs exactly
 * as for a provider payment, including the refund to the balance if provisioning fails.</p>
 */
@Slf4j
@Service
public class BalancePaymentService {

    private final BalanceService balanceService;
    private final PaymentLogRepository paymentLogRepository;
    private final PostgresAdvisoryLockService advisoryLockService;
    private final FulfillmentOrchestrator orchestrator;
    private final AppProperties properties;
    private final TransactionTemplate tx;

    public BalancePaymentService(
            BalanceService balanceService,
            PaymentLogRepository paymentLogRepository,
            PostgresAdvisoryLockService advisoryLockService,
            FulfillmentOrchestrator orchestrator,
            AppProperties properties,
            PlatformTransactionManager transactionManager
    ) {
        this.balanceService = balanceService;
        this.paymentLogRepository = paymentLogRepository;
        this.advisoryLockService = advisoryLockService;
        this.orchestrator = orchestrator;
        this.properties = properties;
        this.tx = new TransactionTemplate(transactionManager);
    }

    /**
     * Debits the balance and fulfills the order.
     *
     * @param metadata order; its payment method is forced to the balance method
     * @return fulfillment report; {@code DUPLICATE} when this payment id was already debited
     * @throws InsufficientBalanceException when the balance does not cover the amount
     */
    public FulfillmentReport pay(OrderMetadata metadata) {
        String method = properties.getFulfillment().getBalancePaymentMethod();
        OrderMetadata md = metadata.withPaymentMethod(method).validate();
        if (md.action() == FulfillmentAction.TOP_UP) {
            throw new InvalidOrderMetadataException("A top-up cannot be paid from the balance");
        }
        if (md.amount() == null || md.amount().signum() <= 0) {
            throw new InvalidOrderMetadataException("A balance payment requires a positive amount");
        }
        String currency = md.currency() != null ? md.currency() : properties.getFulfillment().getDefaultCurrency();

        Boolean debited = tx.execute(status -> {
            advisoryLockService.lock(BALANCE_PAYMENT_SCOPE, md.paymentId());
            if (paymentLogRepository.existsByPaymentIdAndKind(md.paymentId(), PaymentLogEntry.Kind.BALANCE_DEBIT)) {
                return false;
            }
            if (!balanceService.debit(md.ownerId(), md.paymentId(), md.amount(), currency, method)) {
                throw new InsufficientBalanceException(md.ownerId(), md.paymentId());
            }
            return true;
        });

        if (!Boolean.TRUE.equals(debited)) {
            log.info("Balance payment already taken paymentId={}", md.paymentId());
            return FulfillmentReport.duplicate(md.paymentId());
        }
        log.info("Balance debited paymentId={} owner={} amount={}", md.paymentId(), md.ownerId(), md.amount());
        return orchestrator.runFulfillment(md);
    }
}
