package com.github.dimitryivaniuta.keyshop.fulfillment.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A purchasable plan on one host. Managed by the admin dashboard; read-only here.
 */
@Entity
@Table(name = "plans")
@Getter
@Setter
@NoArgsConstructor
public class Plan {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "host_name", nullable = false, length = 128)
    private String hostName;

    @Column(name = "name", nullable = false, length = 128)
    private String name;

    @Column(name = "months")
    private Integer months;

    @Column(name = "duration_days")
    private Integer durationDays;

    @Column(name = "price", nullable = false, precision = 12, scale = 2)
    private BigDecimal price;

    @Column(name = "traffic_limit_bytes")
    private Long trafficLimitBytes;

    @Column(name = "device_limit")
    private Integer deviceLimit;

    @Column(name = "active", nullable = false)
    private boolean active;

    /**
     * Day count granted by this plan: {@code durationDays} wins over {@code months * 30}.
     *
     * @return days, or 0 when the plan defines neither
     */
    public int grantedDays() {
        if (durationDays != null && durationDays > 0) {
            return durationDays;
        }
        if (months != null && months > 0) {
            return months * 30;
        }
        return 0;
    }
}
