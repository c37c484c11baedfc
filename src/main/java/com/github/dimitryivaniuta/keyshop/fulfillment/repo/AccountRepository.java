package com.github.dimitryivaniuta.keyshop.fulfillment.repo;

import com.github.dimitryivaniuta.keyshop.fulfillment.domain.Account;
import java.math.BigDecimal;
import java.time.Instant;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/**
 * Repository for {@link Account}. Balance changes are single statements, never read-modify-write.
 */
public interface AccountRepository extends JpaRepository<Account, Long> {

    /**
     * Adds to the stored balance, creating the account on first use.
     *
     * @return rows changed
     */
    @Modifying
    @Query(value = """
            insert into accounts (owner_id, balance, referral_balance, total_spent, updated_at)
            values (:ownerId, :amount, 0, 0, :now)
            on conflict (owner_id) do update set
                balance = accounts.balance + excluded.balance,
                updated_at = excluded.updated_at
            """, nativeQuery = true)
    int credit(@Param("ownerId") long ownerId, @Param("amount") BigDecimal amount, @Param("now") Instant now);

    /**
     * Subtracts from the stored balance when it covers the amount.
     *
     * @return 1 when debited, 0 when the balance is insufficient or the account is unknown
     */
    @Modifying
    @Query(value = """
            update accounts
            set balance = balance - :amount, updated_at = :now
            where owner_id = :ownerId and balance >= :amount
            """, nativeQuery = true)
    int debitIfCovered(@Param("ownerId") long ownerId, @Param("amount") BigDecimal amount, @Param("now") Instant now);

    /**
     * Adds a referral reward to both the spendable and the referral-earnings balances.
     *
     * @return rows changed
     */
    @Modifying
    @Query(value = """
            update accounts
            set balance = balance + :amount, referral_balance = referral_balance + :amount, updated_at = :now
            where owner_id = :ownerId
            """, nativeQuery = true)
    int creditReferral(@Param("ownerId") long ownerId, @Param("amount") BigDecimal amount, @Param("now") Instant now);

    @Modifying
    @Query(value = "update accounts set total_spent = total_spent + :amount, updated_at = :now where owner_id = :ownerId",
            nativeQuery = true)
    int addSpent(@Param("ownerId") long ownerId, @Param("amount") BigDecimal amount, @Param("now") Instant now);

    /**
     * Marks the trial as used, creating the account on first use.
     *
     * @return 1 when this call claimed the trial, 0 when it was already used
     */
    @Modifying
    @Query(value = """
            insert into accounts (owner_id, balance, referral_balance, total_spent, trial_used, updated_at)
            values (:ownerId, 0, 0, 0, true, :now)
            on conflict (owner_id) do update set
                trial_used = true,
                updated_at = excluded.updated_at
            where accounts.trial_used = false
            """, nativeQuery = true)
    int claimTrial(@Param("ownerId") long ownerId, @Param("now") Instant now);

    /**
     * Gives the trial back after provisioning failed.
     *
     * @return rows changed
     */
    @Modifying
    @Query(value = "update accounts set trial_used = false, updated_at = :now where owner_id = :ownerId and trial_used",
            nativeQuery = true)
    int releaseTrial(@Param("ownerId") long ownerId, @Param("now") Instant now);
}
