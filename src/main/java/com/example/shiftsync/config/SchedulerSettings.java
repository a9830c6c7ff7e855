package com.example.shiftsync.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Labour-law limits and scoring constants used by the schedule generator.
 */
@Component
public class SchedulerSettings {
    private final int minRestHours;
    private final int standardWeeklyHours;
    private final int maxWeeklyHours;
    private final int defaultCoverageHeadcount;
    private final double defaultHourlyRate;
    private final double costBaselineRate;
    private final double costRateSpan;
    private final double weeksPerMonth;
    private final double underTargetRatio;

    public SchedulerSettings(
            @Value("${scheduler.rest.min-hours:8}") int minRestHours,
            @Value("${scheduler.weekly.standard-hours:40}") int standardWeeklyHours,
            @Value("${scheduler.weekly.max-hours:48}") int maxWeeklyHours,
            @Value("${scheduler.default-coverage.headcount:2}") int defaultCoverageHeadcount,
            @Value("${scheduler.cost.default-hourly-rate:20}") double defaultHourlyRate,
            @Value("${scheduler.cost.baseline-rate:15}") double costBaselineRate,
            @Value("${scheduler.cost.rate-span:15}") double costRateSpan,
            @Value("${scheduler.fairness.weeks-per-month:4.33}") double weeksPerMonth,
            @Value("${scheduler.fairness.under-target-ratio:0.7}") double underTargetRatio) {
        this.minRestHours = minRestHours;
        this.standardWeeklyHours = standardWeeklyHours;
        this.maxWeeklyHours = maxWeeklyHours;
        this.defaultCoverageHeadcount = defaultCoverageHeadcount;
        this.defaultHourlyRate = defaultHourlyRate;
        this.costBaselineRate = costBaselineRate;
        this.costRateSpan = costRateSpan;
        this.weeksPerMonth = weeksPerMonth;
        this.underTargetRatio = underTargetRatio;
    }

    /** Values used when no property source is present (unit tests, tooling). */
    public static SchedulerSettings defaults() {
        return new SchedulerSettings(8, 40, 48, 2, 20, 15, 15, 4.33, 0.7);
    }

    public int getMinRestHours() { return minRestHours; }
    public int getStandardWeeklyHours() { return standardWeeklyHours; }
    public int getMaxWeeklyHours() { return maxWeeklyHours; }
    public int getDefaultCoverageHeadcount() { return defaultCoverageHeadcount; }
    public double getDefaultHourlyRate() { return defaultHourlyRate; }
    public double getCostBaselineRate() { return costBaselineRate; }
    public double getCostRateSpan() { return costRateSpan; }
    public double getWeeksPerMonth() { return weeksPerMonth; }
    public double getUnderTargetRatio() { return underTargetRatio; }
}
