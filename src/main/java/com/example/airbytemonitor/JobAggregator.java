package com.example.airbytemonitor;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derives job counts and sync throughput statistics from one cycle's job listing.
 *
 * <p>A malformed {@code lastUpdatedAt} or {@code duration} is logged and left out of the
 * timestamp or average it feeds; the job still counts everywhere else.
 */
public class JobAggregator {

    private static final Logger log = LoggerFactory.getLogger(JobAggregator.class);

    public JobSummary aggregate(List<JsonNode> items) {
        int runningJobs = 0;
        int pendingJobs = 0;
        int failedJobs = 0;
        int successfulSyncs = 0;
        int failedSyncs = 0;
        long totalBytesSynced = 0;
        long totalRowsSynced = 0;
        List<Double> durations = new ArrayList<>();
        Map<String, Long> lastSuccessfulSync = new TreeMap<>();
        Map<String, Integer> successfulPerConnection = new TreeMap<>();
        Map<String, Integer> failedPerConnection = new TreeMap<>();

        for (JsonNode item : items) {
            Job job = Job.fromJson(item);

            if (job.hasStatus(Job.STATUS_RUNNING)) {
                runningJobs++;
            } else if (job.hasStatus(Job.STATUS_PENDING)) {
                pendingJobs++;
            } else if (job.hasStatus(Job.STATUS_FAILED)) {
                failedJobs++;
            }

            if (!job.isSync()) {
                continue;
            }

            String connectionKey = job.connectionId() != null ? job.connectionId() : Connection.UNKNOWN;
            if (job.hasStatus(Job.STATUS_SUCCEEDED)) {
                successfulSyncs++;
                successfulPerConnection.merge(connectionKey, 1, Integer::sum);
                totalBytesSynced += job.bytesSynced();
                totalRowsSynced += job.rowsSynced();

                if (job.connectionId() != null && job.lastUpdatedAt() != null) {
                    try {
                        long updatedAt = parseTimestamp(job.lastUpdatedAt());
                        lastSuccessfulSync.merge(job.connectionId(), updatedAt, Long::max);
                    } catch (DateTimeParseException e) {
                        log.warn("Skipping malformed lastUpdatedAt '{}' of job {}", job.lastUpdatedAt(), job.jobId());
                    }
                }

                if (job.duration() != null) {
                    try {
                        durations.add(parseDurationSeconds(job.duration()));
                    } catch (DateTimeParseException e) {
                        log.warn("Skipping malformed duration '{}' of job {}", job.duration(), job.jobId());
                    }
                }
            } else if (job.hasStatus(Job.STATUS_FAILED)) {
                failedSyncs++;
                failedPerConnection.merge(connectionKey, 1, Integer::sum);
            }
        }

        double averageDuration = durations.isEmpty()
                ? 0
                : durations.stream().mapToDouble(Double::doubleValue).sum() / durations.size();

        return new JobSummary(
                runningJobs,
                pendingJobs,
                failedJobs,
                successfulSyncs,
                failedSyncs,
                totalBytesSynced,
                totalRowsSynced,
                averageDuration,
                Collections.unmodifiableMap(lastSuccessfulSync),
                Collections.unmodifiableMap(successfulPerConnection),
                Collections.unmodifiableMap(failedPerConnection));
    }

    /**
     * Parses an ISO-8601 timestamp to epoch seconds. Timestamps without an offset are read as
     * UTC.
     */
    static long parseTimestamp(String timestamp) {
        try {
            return OffsetDateTime.parse(timestamp).toEpochSecond();
        } catch (DateTimeParseException e) {
            return LocalDateTime.parse(timestamp).toEpochSecond(ZoneOffset.UTC);
        }
    }

    /**
     * Parses an ISO-8601 duration such as {@code PT1H2M30S} to seconds.
     */
    static double parseDurationSeconds(String duration) {
        Duration parsed = Duration.parse(duration);
        return parsed.getSeconds() + parsed.getNano() / 1_000_000_000.0;
    }
}
