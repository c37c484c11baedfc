package com.github.dimitryivaniuta.keyshop.fulfillment.service;

import com.github.dimitryivaniuta.keyshop.fulfillment.domain.PaymentLogEntry;
import com.github.dimitryivaniuta.keyshop.fulfillment.repo.AccountRepository;
import com.github.dimitryivaniuta.keyshop.fulfillment.repo.PaymentLogRepository;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Stored-balance movements. Every movement is one conditional statement plus a {@code payment_log} row.
 */
@Service
public class BalanceService {

    private final AccountRepository accountRepository;
    private final PaymentLogRepository paymentLogRepository;
    private final Clock clock;

    public BalanceService(AccountRepository accountRepository, PaymentLogRepository paymentLogRepository, Clock clock) {
        this.accountRepository = accountRepository;
        this.paymentLogRepository = paymentLogRepository;
        this.clock = clock;
    }

    /**
     * Credits a top-up or a refund.
     *
     * @param ownerId   owner
     * @param paymentId payment the money belongs to
     * @param amount    positive amount
     * @param currency  currency
     * @param method    payment method
     * @param kind      {@code TOP_UP} or {@code REFUND}
     */
    @Transactional
    public void credit(long ownerId, String paymentId, BigDecimal amount, String currency, String method,
                       PaymentLogEntry.Kind kind) {
        Instant now = clock.instant();
        accountRepository.credit(ownerId, amount, now);
        paymentLogRepository.save(PaymentLogEntry.of(paymentId, ownerId, kind, amount, currency, method, now));
    }

    /**
     * Takes the price of a balance-paid order.
     *
     * @return false when the balance does not cover the amount
     */
    @Transactional
    public boolean debit(long ownerId, String paymentId, BigDecimal amount, String currency, String method) {
        Instant now = clock.instant();
        if (accountRepository.debitIfCovered(ownerId, amount, now) != 1) {
            return false;
        }
        paymentLogRepository.save(PaymentLogEntry.of(paymentId, ownerId, PaymentLogEntry.Kind.BALANCE_DEBIT,
                amount, currency, method, now));
        return true;
    }

    /**
     * Books a completed purchase against the owner's spending total.
     */
    @Transactional
    public void recordPurchase(long ownerId, String paymentId, BigDecimal amount, String currency, String method) {
        Instant now = clock.instant();
        accountRepository.credit(ownerId, BigDecimal.ZERO, now);
        accountRepository.addSpent(ownerId, amount, now);
        paymentLogRepository.save(PaymentLogEntry.of(paymentId, ownerId, PaymentLogEntry.Kind.PURCHASE,
                amount, currency, method, now));
    }
}
