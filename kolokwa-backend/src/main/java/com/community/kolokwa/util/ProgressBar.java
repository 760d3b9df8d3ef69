package com.community.kolokwa.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;

/**
 * Progress reporting for long batch jobs. Reports every {@code updateInterval} percent.
 */
public class ProgressBar {
    private static final Logger log = LoggerFactory.getLogger(ProgressBar.class);
    private final String taskName;
    private final int totalSteps;
    private int currentStep;
    private final Instant startTime;
    private final int updateInterval;
    private int lastReportedPercentage = -1;

    public ProgressBar(String taskName, int totalSteps) {
        this(taskName, totalSteps, 25);
    }

    /**
     * @param updateInterval percentage between two reports
     */
    public ProgressBar(String taskName, int totalSteps, int updateInterval) {
        this.taskName = taskName;
        this.totalSteps = totalSteps > 0 ? totalSteps : 1;
        this.currentStep = 0;
        this.startTime = Instant.now();
        this.updateInterval = updateInterval > 0 ? updateInterval : 25;
        log.info("[{}] started, {} steps", taskName, totalSteps);
    }

    public void step() {
        increment(1);
    }

    public void increment(int steps) {
        currentStep = Math.min(totalSteps, currentStep + steps);
        displayProgress();
    }

    /**
     * @return elapsed milliseconds
     */
    public long complete() {
        currentStep = totalSteps;
        long duration = Duration.between(startTime, Instant.now()).toMillis();
        log.info("[{}] finished: {}/{} in {}ms", taskName, currentStep, totalSteps, duration);
        return duration;
    }

    private void displayProgress() {
        int percentage = calculatePercentage();

        if (percentage != lastReportedPercentage && (percentage % updateInterval == 0 || percentage == 100)) {
            log.debug("[{}] progress: {}/{} ({}%) | remaining: {}",
                    taskName, currentStep, totalSteps, percentage, calculateEstimatedTime(percentage));
            lastReportedPercentage = percentage;
        }
    }

    private int calculatePercentage() {
        return Math.min(100, (int) ((currentStep * 100.0) / totalSteps));
    }

    private String calculateEstimatedTime(int percentage) {
        if (percentage == 0) {
            return "estimating...";
        }

        long elapsedMs = Duration.between(startTime, Instant.now()).toMillis();
        long remainingMs = (elapsedMs * 100) / percentage - elapsedMs;

        if (remainingMs < 1000) {
            return "<1s";
        } else if (remainingMs < 60000) {
            return (remainingMs / 1000) + "s";
        } else {
            return (remainingMs / 60000) + "m " + ((remainingMs % 60000) / 1000) + "s";
        }
    }
}
