package com.github.dimitryivaniuta.keyshop.fulfillment.repo;

import com.github.dimitryivaniuta.keyshop.fulfillment.domain.AppSetting;
import org.springframework.data.jpa.repository.JpaRepository;

/**
 * Repository for {@link AppSetting}.
 */
public interface AppSettingRepository extends JpaRepository<AppSetting, String> {
}
