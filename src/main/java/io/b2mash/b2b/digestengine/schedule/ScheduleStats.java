package io.b2mash.b2b.digestengine.schedule;

/**
 * Overview numbers across all schedules.
 *
 * @param activeSchedules enabled schedules
 * @param totalRecipients distinct addresses across all enabled recipient groups
 * @param successRate successful runs as a percentage of all runs, 100 before the first run
 */
public record ScheduleStats(
    int totalSchedules, int activeSchedules, int totalRecipients, int successRate) {}
