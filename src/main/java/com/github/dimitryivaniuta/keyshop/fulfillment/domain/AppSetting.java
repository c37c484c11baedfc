package com.github.dimitryivaniuta.keyshop.fulfillment.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Operator-editable setting. Written by the admin dashboard, read here.
 */
@Entity
@Table(name = "app_settings")
@Getter
@NoArgsConstructor
public class AppSetting {

    @Id
    @Column(name = "setting_key", nullable = false, updatable = false, length = 128)
    private String key;

    @Column(name = "setting_value", columnDefinition = "text")
    private String value;
}
