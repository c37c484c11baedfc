package com.github.dimitryivaniuta.keyshop.fulfillment;

import com.github.dimitryivaniuta.keyshop.fulfillment.provisioning.ProvisioningClient;
import com.github.dimitryivaniuta.keyshop.fulfillment.service.MutableClock;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.Primary;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Testcontainers;

/**
 * Shared Postgres container, mocked Kafka and panel, and a controllable clock.
 *
 * <p>The container is started once per JVM so the cached Spring context keeps a valid URL.</p>
 */
@Testcontainers(disabledWithoutDocker = true)
@SpringBootTest
@Import(AbstractPostgresIntegrationTest.TestClockConfig.class)
public abstract class AbstractPostgresIntegrationTest {

    protected static final String WEBHOOK_SECRET = "test-secret";

    protected static final Instant T0 = Instant.parse("2026-10-01T12:00:00Z");

    private static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("keyshop")
            .withUsername("keyshop")
            .withPassword("keyshop");

    @DynamicPropertySource
    static void props(DynamicPropertyRegistry r) {
        POSTGRES.start();
        r.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        r.add("spring.datasource.username", POSTGRES::getUsername);
        r.add("spring.datasource.password", POSTGRES::getPassword);

        // Avoid external deps in ITs
        r.add("spring.cache.type", () -> "none");
        r.add("app.cache.redis-enabled", () -> "false");
        r.add("spring.kafka.bootstrap-servers", () -> "localhost:0");
        r.add("spring.kafka.admin.auto-create", () -> "false");
        r.add("app.outbox.publish-interval-ms", () -> "9999999");
        r.add("app.fulfillment.gap-detector-interval-ms", () -> "9999999");
        r.add("app.reconciliation.enabled", () -> "false");
        r.add("app.providers.yookassa.secret", () -> WEBHOOK_SECRET);
        r.add("app.ledger.lock-timeout", () -> "300ms");
        r.add("app.ledger.max-attempts", () -> "3");
        r.add("app.ledger.base-backoff", () -> "20ms");
    }

    @MockBean
    protected KafkaTemplate<String, String> kafkaTemplate;

    @MockBean
    protected ProvisioningClient provisioningClient;

    @Autowired
    protected MutableClock clock;

    @Autowired
    protected JdbcTemplate jdbc;

    @BeforeEach
    void resetState() {
        clock.set(T0);
        jdbc.execute("truncate table pending_transactions, processed_payments, credentials, accounts, payment_log, "
                + "promo_code_usages, promo_codes, partner_commissions, pending_gifts, fulfillment_steps, "
                + "app_settings, outbox_events, plans restart identity cascade");
    }

    @TestConfiguration
    static class TestClockConfig {

        @Bean
        @Primary
        MutableClock testClock() {
            return new MutableClock(T0);
        }
    }
}
