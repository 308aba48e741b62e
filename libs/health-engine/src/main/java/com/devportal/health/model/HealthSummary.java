package com.devportal.health.model;

import java.util.Collection;

/**
 * Aggregate counts over one batch of {@link ComponentHealthCheck} records.
 *
 * @param total             number of records
 * @param up                records reporting UP
 * @param down              records reporting DOWN or OUT_OF_SERVICE
 * @param error             records that could not be probed
 * @param unknown           any other status (including LOADING and UNKNOWN)
 * @param avgResponseTimeMs rounded mean response time over records that have one
 */
public record HealthSummary(int total, int up, int down, int error, int unknown, long avgResponseTimeMs) {

    public static final HealthSummary EMPTY = new HealthSummary(0, 0, 0, 0, 0, 0);

    public static HealthSummary of(Collection<ComponentHealthCheck> checks) {
        int up = 0;
        int down = 0;
        int error = 0;
        int unknown = 0;
        long timedTotal = 0;
        int timedCount = 0;
        for (ComponentHealthCheck check : checks) {
            String status = check.status() == null ? "" : check.status();
            switch (status) {
                case "UP" -> up++;
                case "DOWN", "OUT_OF_SERVICE" -> down++;
                case ComponentHealthCheck.STATUS_ERROR -> error++;
                default -> unknown++;
            }
            if (check.responseTimeMs() != null) {
                timedTotal += check.responseTimeMs();
                timedCount++;
            }
        }
        long avg = timedCount == 0 ? 0 : Math.round((double) timedTotal / timedCount);
        return new HealthSummary(checks.size(), up, down, error, unknown, avg);
    }

    public double upPercentage() {
        return percentage(up);
    }

    public double downPercentage() {
        return percentage(down);
    }

    private double percentage(int count) {
        if (total == 0) {
            return 0;
        }
        return Math.round(count * 1000.0 / total) / 10.0;
    }
}
