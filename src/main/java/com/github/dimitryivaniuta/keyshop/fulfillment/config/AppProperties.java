package com.github.dimitryivaniuta.keyshop.fulfillment.config;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Application-level configuration properties.
 *
 * <p>Fulfillment values here are defaults only: operators may override them at runtime through the
 * {@code app_settings} table, and every fulfillment run reads them once into an immutable snapshot.</p>
 */
@ConfigurationProperties(prefix = "app")
@Getter
@Setter
public class AppProperties {

    private final Ledger ledger = new Ledger();
    private final Fulfillment fulfillment = new Fulfillment();
    private final Reconciliation reconciliation = new Reconciliation();
    private final Provisioning provisioning = new Provisioning();
    private final Outbox outbox = new Outbox();
    private final Cache cache = new Cache();

    /**
     * Per-provider verifier settings, keyed by provider name (e.g. {@code yookassa}).
     */
    private final Map<String, Provider> providers = new HashMap<>();

    @Getter
    @Setter
    public static class Ledger {
        /**
         * Attempts for a ledger transaction that loses a lock race before surfacing a storage error.
         */
        private int maxAttempts = 5;

        /**
         * Base delay of the exponential backoff between attempts.
         */
        private Duration baseBackoff = Duration.ofMillis(50);

        /**
         * Longest wait for the completion lock of one payment id before the attempt counts as lost.
         */
        private Duration lockTimeout = Duration.ofSeconds(2);
    }

    @Getter
    @Setter
    public static class Fulfillment {
        /**
         * How referral rewards are computed.
         */
        private ReferralScheme referralScheme = ReferralScheme.PERCENT_OF_PRICE;

        private boolean referralsEnabled = true;

        private BigDecimal referralPercent = new BigDecimal("10");

        private BigDecimal referralFixedAmount = new BigDecimal("50");

        private BigDecimal franchisePercent = new BigDecimal("35");

        /**
         * Payment methods eligible for partner commission. Matching is case-insensitive.
         */
        private List<String> cardPaymentMethods = List.of("yookassa", "platega", "heleket", "yoomoney");

        /**
         * Payment method name used when an order is paid from the stored balance.
         */
        private String balancePaymentMethod = "balance";

        private String defaultCurrency = "RUB";

        /**
         * A claim older than this without a terminal step is reported to operators.
         */
        private Duration gapAlertAfter = Duration.ofMinutes(15);

        private long gapDetectorIntervalMs = 60_000L;

        private boolean trialEnabled = true;

        private int trialDays = 3;

        /**
         * Traffic cap of a trial key in bytes, {@code null} for none.
         */
        private Long trialTrafficLimitBytes;

        private Integer trialDeviceLimit;
    }

    /**
     * Referral payout schemes.
     */
    public enum ReferralScheme {
        /** A percentage of the paid price. */
        PERCENT_OF_PRICE,
        /** A fixed amount on each purchase. */
        FIXED_PER_PURCHASE,
        /** A fixed amount paid once when the referral starts; nothing per purchase. */
        FIXED_AT_START
    }

    @Getter
    @Setter
    public static class Reconciliation {
        private boolean enabled = true;

        private String cron = "0 */30 * * * *";

        /**
         * How long a credential may be missing remotely before it is deleted locally.
         */
        private Duration graceWindow = Duration.ofHours(24);

        /**
         * Max concurrent remote existence checks.
         */
        private int fanOut = 8;

        private Duration checkTimeout = Duration.ofSeconds(30);
    }

    @Getter
    @Setter
    public static class Provisioning {
        private String baseUrl = "http://localhost:3000";

        private String apiToken = "";

        private Duration connectTimeout = Duration.ofSeconds(5);

        private Duration readTimeout = Duration.ofSeconds(20);
    }

    @Getter
    @Setter
    public static class Provider {
        /**
         * Shared secret used to verify the webhook signature.
         */
        private String secret = "";

        /**
         * Header carrying the hex HMAC-SHA256 signature of the raw body.
         */
        private String signatureHeader = "X-Signature";
    }

    @Getter
    @Setter
    public static class Outbox {
        /**
         * Kafka topic consumed by the chat-bot front end.
         */
        private String notificationsTopic = "keyshop-notifications";

        private int notificationsPartitions = 6;

        private short notificationsReplicas = 1;

        private int batchSize = 100;

        private long publishIntervalMs = 1000L;

        private Duration sendTimeout = Duration.ofSeconds(5);

        private int maxAttempts = 10;

        private Duration baseBackoff = Duration.ofSeconds(1);

        private Duration maxBackoff = Duration.ofMinutes(2);
    }

    @Getter
    @Setter
    public static class Cache {
        private boolean redisEnabled = true;

        private Duration statusTtl = Duration.ofHours(6);
    }
}
