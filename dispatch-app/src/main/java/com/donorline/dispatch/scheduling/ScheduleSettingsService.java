package com.donorline.dispatch.scheduling;

import com.donorline.dispatch.model.ScheduleSettings;
import com.donorline.dispatch.repository.ScheduleSettingsRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Organization-level sending rules. An organization without stored rules gets the
 * defaults written on first read.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ScheduleSettingsService {

    private final ScheduleSettingsRepository settingsRepository;
    private final ScheduleConfigMapper mapper;

    @Transactional
    public ScheduleConfig getOrCreate(String organizationId) {
        return settingsRepository.findById(organizationId)
                .map(mapper::toConfig)
                .orElseGet(() -> {
                    ScheduleConfig defaults = ScheduleConfig.defaults();
                    settingsRepository.save(mapper.toSettings(organizationId, defaults));
                    log.info("Created default schedule config for organization {}", organizationId);
                    return defaults;
                });
    }

    /**
     * @throws InvalidScheduleConfigException if the new rules are invalid; nothing is stored
     */
    @Transactional
    public ScheduleConfig update(String organizationId, ScheduleConfig config) {
        config.validate();
        ScheduleSettings saved = settingsRepository.save(mapper.toSettings(organizationId, config));
        log.info("Updated schedule config for organization {}: limit={}, gap={}-{}m, {} {}-{}",
                organizationId, config.dailyLimit(), config.minGapMinutes(), config.maxGapMinutes(),
                config.timezone(), config.allowedStartTime(), config.allowedEndTime());
        return mapper.toConfig(saved);
    }
}
