package com.donorline.dispatch.scheduling;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Assigns send times to a batch of tasks under a daily quota, the allowed sending
 * windows and a randomized gap between consecutive sends.
 * <p>
 * The scheduler holds no per-run state: the cursor ({@code currentTime},
 * {@code dayIndex}, {@code dailyCount}) lives in a local {@link Cursor}, so one
 * instance can serve concurrent callers.
 */
@Slf4j
public class BatchScheduler {

    public static final int DEFAULT_MAX_DAYS = 365;

    private static final Comparator<SchedulableTask<?>> BY_PRIORITY_DESC =
            Comparator.comparingInt((SchedulableTask<?> task) -> task.effectivePriority()).reversed();

    private final TimeWindowEvaluator evaluator;
    private final GapGenerator gapGenerator;

    public BatchScheduler() {
        this(new TimeWindowEvaluator(), new RandomGapGenerator());
    }

    public BatchScheduler(TimeWindowEvaluator evaluator, GapGenerator gapGenerator) {
        this.evaluator = evaluator;
        this.gapGenerator = gapGenerator;
    }

    public <T> ScheduleResult<T> schedule(List<SchedulableTask<T>> tasks, ScheduleConfig config,
                                          Instant startTime, int maxDays) {
        return schedule(tasks, config, startTime, maxDays, Map.of());
    }

    /**
     * @param priorUsage sends already counted against the quota on a local calendar
     *                   date (in the config's timezone); each day's counter starts there
     * @throws InvalidScheduleConfigException before anything is placed
     */
    public <T> ScheduleResult<T> schedule(List<SchedulableTask<T>> tasks, ScheduleConfig config,
                                          Instant startTime, int maxDays,
                                          Map<LocalDate, Integer> priorUsage) {
        config.validate();
        if (maxDays < 1) {
            throw new IllegalArgumentException("maxDays must be at least 1");
        }

        List<SchedulableTask<T>> ordered = new ArrayList<>(tasks);
        // List.sort is stable, so equal priorities keep their input order
        ordered.sort(BY_PRIORITY_DESC);

        List<ScheduledTask<T>> scheduled = new ArrayList<>();
        Map<Integer, Integer> tasksPerDay = new LinkedHashMap<>();
        Set<SchedulableTask<T>> placed = Collections.newSetFromMap(new IdentityHashMap<>());

        Optional<Instant> seed = evaluator.nextAllowed(startTime, config);
        if (seed.isEmpty()) {
            log.info("No allowed sending window within {} days of {}; {} tasks left unscheduled",
                    TimeWindowEvaluator.SEARCH_HORIZON_DAYS, startTime, tasks.size());
            return new ScheduleResult<>(List.of(), List.copyOf(tasks), Map.of());
        }

        ZoneId zone = config.zoneId();
        Cursor cursor = new Cursor(seed.get(), seed.get().atZone(zone).toLocalDate(), priorUsage);
        int probeBudget = maxDays * 24;

        for (SchedulableTask<T> task : ordered) {
            if (cursor.exhausted) {
                break;
            }
            for (int probe = 0; probe < probeBudget; probe++) {
                LocalDate currentDate = cursor.currentTime.atZone(zone).toLocalDate();
                if (!currentDate.equals(cursor.date)) {
                    // only dates with an open window count as scheduling days
                    if (!evaluator.isAllowed(cursor.currentTime, config)) {
                        Optional<Instant> next = evaluator.nextAllowed(cursor.currentTime, config);
                        if (next.isEmpty()) {
                            cursor.exhausted = true;
                            break;
                        }
                        cursor.currentTime = next.get();
                        continue;
                    }
                    if (!cursor.enterDay(currentDate, maxDays)) {
                        break;
                    }
                }

                boolean quotaReached = cursor.dailyCount >= config.dailyLimit();
                if (quotaReached || !evaluator.isAllowed(cursor.currentTime, config)) {
                    Optional<Instant> next = quotaReached
                            ? evaluator.nextAllowedDay(cursor.currentTime, config)
                            : evaluator.nextAllowed(cursor.currentTime, config);
                    if (next.isEmpty()) {
                        cursor.exhausted = true;
                        break;
                    }
                    cursor.currentTime = next.get();
                    continue;
                }

                scheduled.add(new ScheduledTask<>(task, cursor.currentTime, cursor.dayIndex));
                placed.add(task);
                cursor.dailyCount++;
                tasksPerDay.merge(cursor.dayIndex, 1, Integer::sum);

                int gap = gapGenerator.nextGapMinutes(config.minGapMinutes(), config.maxGapMinutes());
                cursor.currentTime = cursor.currentTime.plus(Duration.ofMinutes(gap));
                break;
            }
        }

        List<SchedulableTask<T>> unscheduled = tasks.stream()
                .filter(task -> !placed.contains(task))
                .toList();

        log.debug("Scheduled {} of {} tasks across {} days ({} unscheduled)",
                scheduled.size(), tasks.size(), tasksPerDay.size(), unscheduled.size());
        return new ScheduleResult<>(List.copyOf(scheduled), unscheduled, Collections.unmodifiableMap(tasksPerDay));
    }

    private static final class Cursor {

        private final Map<LocalDate, Integer> priorUsage;
        private Instant currentTime;
        private LocalDate date;
        private int dayIndex;
        private int dailyCount;
        private boolean exhausted;

        private Cursor(Instant start, LocalDate date, Map<LocalDate, Integer> priorUsage) {
            this.priorUsage = priorUsage;
            this.currentTime = start;
            this.date = date;
            this.dailyCount = priorUsage.getOrDefault(date, 0);
        }

        /**
         * Moves to a new scheduling day. Returns false, and marks the cursor exhausted,
         * when that day lies beyond the {@code maxDays} horizon.
         */
        private boolean enterDay(LocalDate newDate, int maxDays) {
            if (dayIndex + 1 >= maxDays) {
                exhausted = true;
                return false;
            }
            dayIndex++;
            date = newDate;
            dailyCount = priorUsage.getOrDefault(newDate, 0);
            return true;
        }
    }
}
