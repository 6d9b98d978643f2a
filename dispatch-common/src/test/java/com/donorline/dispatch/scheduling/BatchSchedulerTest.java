package com.donorline.dispatch.scheduling;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SplittableRandom;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class BatchSchedulerTest {

    private static final ZoneId NEW_YORK = ZoneId.of("America/New_York");
    // 2025-03-03 is a Monday
    private static final Instant MONDAY_9AM = newYork("2025-03-03T09:00:00");

    private final TimeWindowEvaluator evaluator = new TimeWindowEvaluator();

    private static Instant newYork(String localDateTime) {
        return LocalDateTime.parse(localDateTime).atZone(NEW_YORK).toInstant();
    }

    private static ScheduleConfig weekdays(int dailyLimit, int minGap, int maxGap) {
        return new ScheduleConfig(dailyLimit, minGap, maxGap, "America/New_York",
                Set.of(1, 2, 3, 4, 5), "09:00", "17:00", Map.of());
    }

    private static List<SchedulableTask<String>> tasks(int count) {
        return IntStream.rangeClosed(1, count)
                .mapToObj(i -> new SchedulableTask<>("t" + i, "payload-" + i))
                .toList();
    }

    private static LocalDate localDate(Instant instant) {
        return instant.atZone(NEW_YORK).toLocalDate();
    }

    @Test
    void schedule_spillsOverQuotaToFollowingDays() {
        BatchScheduler scheduler = new BatchScheduler(evaluator, (min, max) -> min);

        ScheduleResult<String> result = scheduler.schedule(tasks(5), weekdays(2, 1, 3), MONDAY_9AM, 365);

        assertThat(result.unscheduled()).isEmpty();
        assertThat(result.tasksPerDay()).containsEntry(0, 2).containsEntry(1, 2).containsEntry(2, 1);

        List<ScheduledTask<String>> scheduled = result.scheduled();
        assertEquals(MONDAY_9AM, scheduled.get(0).scheduledTime());
        assertEquals(newYork("2025-03-03T09:01:00"), scheduled.get(1).scheduledTime());
        assertEquals(newYork("2025-03-04T09:00:00"), scheduled.get(2).scheduledTime());
        assertEquals(newYork("2025-03-05T09:00:00"), scheduled.get(4).scheduledTime());
        assertThat(result.lastScheduledTime()).contains(newYork("2025-03-05T09:00:00"));
    }

    @Test
    void schedule_neverExceedsDailyLimitAndStaysInsideWindows() {
        ScheduleConfig config = new ScheduleConfig(7, 1, 30, "America/New_York",
                Set.of(1, 3, 5), "09:00", "10:00", Map.of(6, new DailySchedule("12:00", "12:30", true)));
        BatchScheduler scheduler = new BatchScheduler(evaluator, new RandomGapGenerator(new SplittableRandom(7)));

        ScheduleResult<String> result = scheduler.schedule(tasks(60), config, newYork("2025-03-06T22:00:00"), 365);

        assertThat(result.scheduled()).hasSize(60);
        result.scheduled().forEach(task ->
                assertThat(evaluator.isAllowed(task.scheduledTime(), config))
                        .as("scheduled time %s", task.scheduledTime())
                        .isTrue());

        Map<LocalDate, Long> perDate = result.scheduled().stream()
                .collect(Collectors.groupingBy(task -> localDate(task.scheduledTime()), Collectors.counting()));
        assertThat(perDate.values()).allSatisfy(count -> assertThat(count).isLessThanOrEqualTo(7L));
        assertThat(result.tasksPerDay().values()).allSatisfy(count -> assertThat(count).isLessThanOrEqualTo(7));
    }

    @Test
    void schedule_consecutiveSameDayGapsStayWithinBounds() {
        BatchScheduler scheduler = new BatchScheduler(evaluator, new RandomGapGenerator(new SplittableRandom(42)));

        ScheduleResult<String> result = scheduler.schedule(tasks(120), weekdays(50, 1, 3), MONDAY_9AM, 365);

        List<ScheduledTask<String>> scheduled = result.scheduled();
        for (int i = 1; i < scheduled.size(); i++) {
            ScheduledTask<String> previous = scheduled.get(i - 1);
            ScheduledTask<String> current = scheduled.get(i);
            if (previous.dayIndex() == current.dayIndex()) {
                Duration delta = Duration.between(previous.scheduledTime(), current.scheduledTime());
                assertThat(delta).isBetween(Duration.ofMinutes(1), Duration.ofMinutes(3));
            }
        }
    }

    @Test
    void schedule_ordersByPriorityAndKeepsInputOrderOnTies() {
        List<SchedulableTask<String>> input = List.of(
                new SchedulableTask<>("a", "a", 1),
                new SchedulableTask<>("b", "b", 5),
                new SchedulableTask<>("c", "c", null),
                new SchedulableTask<>("d", "d", 5),
                new SchedulableTask<>("e", "e", 3));
        BatchScheduler scheduler = new BatchScheduler(evaluator, (min, max) -> max);

        ScheduleResult<String> result = scheduler.schedule(input, weekdays(100, 1, 3), MONDAY_9AM, 365);

        assertThat(result.scheduled())
                .extracting(task -> task.task().id())
                .containsExactly("b", "d", "e", "a", "c");
        assertThat(result.scheduled())
                .extracting(ScheduledTask::scheduledTime)
                .isSorted();
    }

    @Test
    void schedule_reportsTasksBeyondHorizonInInputOrder() {
        BatchScheduler scheduler = new BatchScheduler(evaluator, (min, max) -> min);

        ScheduleResult<String> result = scheduler.schedule(tasks(4), weekdays(1, 1, 3), MONDAY_9AM, 2);

        assertThat(result.scheduled()).extracting(task -> task.task().id()).containsExactly("t1", "t2");
        assertThat(result.unscheduled()).extracting(SchedulableTask::id).containsExactly("t3", "t4");
        assertThat(result.tasksPerDay()).containsOnlyKeys(0, 1);
    }

    @Test
    void schedule_rollsToNextDayWhenGapLeavesTheWindow() {
        BatchScheduler scheduler = new BatchScheduler(evaluator, (min, max) -> min);

        ScheduleResult<String> result = scheduler.schedule(tasks(3), weekdays(10, 1, 1),
                newYork("2025-03-03T16:59:00"), 365);

        assertThat(result.scheduled())
                .extracting(ScheduledTask::scheduledTime)
                .containsExactly(
                        newYork("2025-03-03T16:59:00"),
                        newYork("2025-03-03T17:00:00"),
                        newYork("2025-03-04T09:00:00"));
        assertThat(result.scheduled()).extracting(ScheduledTask::dayIndex).containsExactly(0, 0, 1);
    }

    @Test
    void schedule_countsPriorUsageAgainstTheQuota() {
        BatchScheduler scheduler = new BatchScheduler(evaluator, (min, max) -> min);
        Map<LocalDate, Integer> priorUsage = Map.of(LocalDate.of(2025, 3, 3), 2, LocalDate.of(2025, 3, 4), 1);

        ScheduleResult<String> result = scheduler.schedule(tasks(2), weekdays(2, 1, 3), MONDAY_9AM, 365, priorUsage);

        assertThat(result.scheduled())
                .extracting(ScheduledTask::scheduledTime)
                .containsExactly(newYork("2025-03-04T09:00:00"), newYork("2025-03-05T09:00:00"));
    }

    @Test
    void schedule_startsAtNextWindowWhenStartIsOutsideIt() {
        BatchScheduler scheduler = new BatchScheduler(evaluator, (min, max) -> min);

        ScheduleResult<String> result = scheduler.schedule(tasks(1), weekdays(10, 1, 3),
                newYork("2025-03-08T11:00:00"), 365);

        assertThat(result.scheduled()).singleElement()
                .extracting(ScheduledTask::scheduledTime)
                .isEqualTo(newYork("2025-03-10T09:00:00"));
    }

    @Test
    void schedule_leavesEverythingUnscheduledWhenNoDayIsOpen() {
        ScheduleConfig closed = new ScheduleConfig(10, 1, 3, "America/New_York",
                Set.of(1), "09:00", "17:00", Map.of(1, DailySchedule.disabled()));
        BatchScheduler scheduler = new BatchScheduler();

        ScheduleResult<String> result = scheduler.schedule(tasks(3), closed, MONDAY_9AM, 365);

        assertThat(result.scheduled()).isEmpty();
        assertThat(result.unscheduled()).hasSize(3);
        assertThat(result.lastScheduledTime()).isEmpty();
    }

    @Test
    void schedule_rejectsInvalidConfigBeforePlacingAnything() {
        BatchScheduler scheduler = new BatchScheduler();

        assertThrows(InvalidScheduleConfigException.class,
                () -> scheduler.schedule(tasks(3), weekdays(10, 5, 1), MONDAY_9AM, 365));
    }

    @Test
    void schedule_gapIntoClosedWeekendDoesNotUseUpHorizon() {
        ScheduleConfig lateWindow = new ScheduleConfig(2, 10, 10, "America/New_York",
                Set.of(1, 2, 3, 4, 5), "09:00", "23:59", Map.of());
        BatchScheduler scheduler = new BatchScheduler(evaluator, (min, max) -> min);

        // 2025-03-07 is a Friday; the gap after the first send lands on Saturday 00:00
        ScheduleResult<String> result = scheduler.schedule(tasks(3), lateWindow,
                newYork("2025-03-07T23:50:00"), 2);

        assertThat(result.unscheduled()).isEmpty();
        assertThat(result.scheduled())
                .extracting(ScheduledTask::scheduledTime)
                .containsExactly(
                        newYork("2025-03-07T23:50:00"),
                        newYork("2025-03-10T09:00:00"),
                        newYork("2025-03-10T09:10:00"));
        assertThat(result.scheduled()).extracting(ScheduledTask::dayIndex).containsExactly(0, 1, 1);
        assertThat(result.tasksPerDay()).containsExactly(Map.entry(0, 1), Map.entry(1, 2));
    }

    @Test
    void schedule_reportsUnplacedTaskEvenWhenItSharesAnIdWithAPlacedOne() {
        BatchScheduler scheduler = new BatchScheduler(evaluator, (min, max) -> min);
        List<SchedulableTask<String>> duplicates = List.of(
                new SchedulableTask<>("same", "first"),
                new SchedulableTask<>("same", "second"));

        ScheduleResult<String> result = scheduler.schedule(duplicates, weekdays(1, 1, 3), MONDAY_9AM, 1);

        assertThat(result.scheduled()).extracting(task -> task.task().payload()).containsExactly("first");
        assertThat(result.unscheduled()).extracting(SchedulableTask::payload).containsExactly("second");
    }
}
