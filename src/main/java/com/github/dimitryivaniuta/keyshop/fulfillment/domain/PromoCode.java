package com.github.dimitryivaniuta.keyshop.fulfillment.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Discount code. Usage counters are incremented by redemption; the code is switched off once a limit is hit.
 */
@Entity
@Table(name = "promo_codes")
@Getter
@Setter
@NoArgsConstructor
public class PromoCode {

    @Id
    @Column(name = "code", nullable = false, updatable = false, length = 64)
    private String code;

    @Column(name = "discount_percent", precision = 5, scale = 2)
    private BigDecimal discountPercent;

    @Column(name = "discount_amount", precision = 12, scale = 2)
    private BigDecimal discountAmount;

    @Column(name = "usage_limit_total")
    private Integer usageLimitTotal;

    @Column(name = "used_total", nullable = false)
    private int usedTotal;

    @Column(name = "valid_until")
    private Instant validUntil;

    @Column(name = "active", nullable = false)
    private boolean active;

    public boolean isExpired(Instant now) {
        return validUntil != null && !validUntil.isAfter(now);
    }

    public boolean isTotalLimitReached() {
        return usageLimitTotal != null && usageLimitTotal > 0 && usedTotal >= usageLimitTotal;
    }
}
