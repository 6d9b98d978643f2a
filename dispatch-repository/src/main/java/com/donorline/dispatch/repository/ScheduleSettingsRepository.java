package com.donorline.dispatch.repository;

import com.donorline.dispatch.model.ScheduleSettings;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ScheduleSettingsRepository extends JpaRepository<ScheduleSettings, String> {
}
