package com.donorline.dispatch.scheduling;

import com.donorline.dispatch.exception.ScheduleConfigFormatException;
import com.donorline.dispatch.model.ScheduleSettings;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.ObjectMapper;

import java.util.Map;
import java.util.Set;

/**
 * Converts between {@link ScheduleConfig} and its stored forms: the
 * {@link ScheduleSettings} row with JSON columns, and the JSON document kept on a
 * campaign as its override.
 */
@Component
@RequiredArgsConstructor
public class ScheduleConfigMapper {

    private static final TypeReference<Set<Integer>> DAYS = new TypeReference<>() {
    };
    private static final TypeReference<Map<Integer, DailySchedule>> DAILY_SCHEDULES = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public ScheduleConfig toConfig(ScheduleSettings settings) {
        try {
            Set<Integer> days = objectMapper.readValue(settings.getAllowedDays(), DAYS);
            Map<Integer, DailySchedule> dailySchedules = settings.getDailySchedules() == null
                    ? Map.of()
                    : objectMapper.readValue(settings.getDailySchedules(), DAILY_SCHEDULES);
            return new ScheduleConfig(settings.getDailyLimit(), settings.getMinGapMinutes(),
                    settings.getMaxGapMinutes(), settings.getTimezone(), days,
                    settings.getAllowedStartTime(), settings.getAllowedEndTime(), dailySchedules);
        } catch (JacksonException e) {
            throw new ScheduleConfigFormatException(
                    "Stored schedule config of organization " + settings.getOrganizationId() + " is unreadable", e);
        }
    }

    public ScheduleSettings toSettings(String organizationId, ScheduleConfig config) {
        return ScheduleSettings.builder()
                .organizationId(organizationId)
                .dailyLimit(config.dailyLimit())
                .minGapMinutes(config.minGapMinutes())
                .maxGapMinutes(config.maxGapMinutes())
                .timezone(config.timezone())
                .allowedDays(objectMapper.writeValueAsString(config.allowedDays()))
                .allowedStartTime(config.allowedStartTime())
                .allowedEndTime(config.allowedEndTime())
                .dailySchedules(config.dailySchedules().isEmpty()
                        ? null
                        : objectMapper.writeValueAsString(config.dailySchedules()))
                .build();
    }

    public String toJson(ScheduleConfig config) {
        return objectMapper.writeValueAsString(config);
    }

    public ScheduleConfig fromJson(String json) {
        try {
            return objectMapper.readValue(json, ScheduleConfig.class);
        } catch (JacksonException e) {
            throw new ScheduleConfigFormatException("Stored campaign schedule config is unreadable", e);
        }
    }
}
