package com.frameception.core.logs;

import com.frameception.core.model.DeploymentStatusReport;
import com.frameception.core.model.Job;
import com.frameception.core.model.LogData;
import com.frameception.core.model.LogEntry;
import com.frameception.core.model.LogSource;
import com.frameception.core.model.Project;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Maintains the activity timeline across repeated fetches.
 * <p>
 * Job-derived entries are refetched wholesale on every poll (replace semantics) while
 * deployment-platform entries are appended one at a time when a status change is seen
 * (event semantics). {@link #mergeLogs} reconciles the two: deployment-platform entries
 * survive every refresh, everything else is taken from the incoming batch.
 */
@Component
public class LogAggregator {

    /** Newest first; entries without a timestamp sort last. List.sort is stable so ties keep their order. */
    static final Comparator<LogEntry> NEWEST_FIRST = Comparator.comparing(
            LogEntry::createdAt, Comparator.nullsLast(Comparator.<Instant>reverseOrder()));

    /**
     * Merges a freshly fetched batch of job-derived entries into the previous timeline.
     *
     * @param previous the timeline currently shown
     * @param incoming entries fetched from the backend in this poll
     * @return a new unmodifiable timeline with unique identities, ordered newest first
     */
    public List<LogEntry> mergeLogs(List<LogEntry> previous, List<LogEntry> incoming) {
        List<LogEntry> merged = new ArrayList<>();
        Set<String> seenIds = new HashSet<>();

        if (previous != null) {
            for (LogEntry entry : previous) {
                if (entry.source() == LogSource.DEPLOYMENT_PLATFORM && seenIds.add(entry.id())) {
                    merged.add(entry);
                }
            }
        }
        if (incoming != null) {
            for (LogEntry entry : incoming) {
                if (seenIds.add(entry.id())) {
                    merged.add(entry);
                }
            }
        }

        merged.sort(NEWEST_FIRST);
        return Collections.unmodifiableList(merged);
    }

    /**
     * Flattens the log entries of every job of the project, newest first.
     */
    public List<LogEntry> jobLogs(Project project) {
        if (project == null) {
            return List.of();
        }
        List<LogEntry> entries = new ArrayList<>();
        for (Job job : project.jobs()) {
            entries.addAll(job.logs());
        }
        entries.sort(NEWEST_FIRST);
        return entries;
    }

    /**
     * Builds the deployment-platform entry recorded when a new deployment status is observed.
     */
    public LogEntry statusChangeEntry(DeploymentStatusReport report, Instant now) {
        return new LogEntry(
                UUID.randomUUID().toString(),
                LogSource.DEPLOYMENT_PLATFORM,
                "Deployment status: " + report.status().wireValue(),
                now,
                new LogData(report.status().wireValue(), report.logs()));
    }

    /**
     * Returns a new timeline with {@code entry} added to {@code logs}, replacing an entry with the
     * same id. The result is ordered newest first; an entry stamped with the local clock can land
     * behind backend entries whose timestamps run ahead of it.
     */
    public List<LogEntry> prepend(LogEntry entry, List<LogEntry> logs) {
        List<LogEntry> result = new ArrayList<>(logs.size() + 1);
        result.add(entry);
        for (LogEntry existing : logs) {
            if (!Objects.equals(existing.id(), entry.id())) {
                result.add(existing);
            }
        }
        result.sort(NEWEST_FIRST);
        return Collections.unmodifiableList(result);
    }

    /**
     * The newest deployment-platform entry that carries build-log lines, if any.
     */
    public Optional<LogEntry> latestBuildReport(List<LogEntry> logs) {
        return logs.stream()
                .filter(entry -> entry.source() == LogSource.DEPLOYMENT_PLATFORM && entry.hasBuildLines())
                .min(NEWEST_FIRST);
    }
}
