package com.github.dimitryivaniuta.keyshop.fulfillment.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Snapshot of how a credential was issued. Copied at issue time so displays survive later plan edits.
 */
@Embeddable
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class CredentialOrigin {

    @Enumerated(EnumType.STRING)
    @Column(name = "origin_source", length = 16)
    private OriginSource source;

    @Column(name = "origin_plan_id")
    private Long planId;

    @Column(name = "origin_plan_name", length = 128)
    private String planName;

    @Column(name = "origin_days")
    private Integer days;

    @Column(name = "origin_label", length = 64)
    private String label;

    /**
     * Builds an origin note with a human-readable duration label.
     *
     * @param source   how the key was issued
     * @param planId   plan id, if any
     * @param planName plan name at issue time
     * @param days     day count granted
     * @return origin
     */
    public static CredentialOrigin of(OriginSource source, Long planId, String planName, int days) {
        return new CredentialOrigin(source, planId, planName, days, days == 1 ? "1 day" : days + " days");
    }
}
