package com.frameception.core.logs;

import com.frameception.core.model.BuildLogLine;
import com.frameception.core.model.DeploymentBuildStatus;
import com.frameception.core.model.DeploymentStatusReport;
import com.frameception.core.model.JobData;
import com.frameception.core.model.JobStatus;
import com.frameception.core.model.JobType;
import com.frameception.core.model.LogEntry;
import com.frameception.core.model.LogSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static com.frameception.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class LogAggregatorTest {

    private final LogAggregator aggregator = new LogAggregator();

    private static List<String> ids(List<LogEntry> entries) {
        return entries.stream().map(LogEntry::id).toList();
    }

    @Nested
    @DisplayName("mergeLogs")
    class MergeLogs {

        @Test
        @DisplayName("keeps deployment entries, replaces job entries and orders newest first")
        void mergeScenario() {
            List<LogEntry> previous = List.of(
                    entry("1", LogSource.DEPLOYMENT_PLATFORM, 10),
                    entry("2", LogSource.BACKEND, 5));
            List<LogEntry> incoming = List.of(
                    entry("2", LogSource.BACKEND, 5),
                    entry("3", LogSource.BACKEND, 8));

            assertEquals(List.of("1", "3", "2"), ids(aggregator.mergeLogs(previous, incoming)));
        }

        @Test
        @DisplayName("drops previous job entries missing from the incoming batch")
        void replaceSemanticsForJobEntries() {
            List<LogEntry> previous = List.of(entry("old", LogSource.FRONTEND, 3));

            assertEquals(List.of("new"),
                    ids(aggregator.mergeLogs(previous, List.of(entry("new", LogSource.FRONTEND, 4)))));
        }

        @Test
        @DisplayName("re-merging the same batch changes nothing")
        void idempotent() {
            List<LogEntry> previous = List.of(entry("1", LogSource.DEPLOYMENT_PLATFORM, 10));
            List<LogEntry> incoming = List.of(entry("2", LogSource.BACKEND, 5), entry("3", LogSource.SOURCE_CONTROL, 8));

            List<LogEntry> once = aggregator.mergeLogs(previous, incoming);
            List<LogEntry> twice = aggregator.mergeLogs(once, incoming);

            assertEquals(once, twice);
        }

        @Test
        @DisplayName("never yields duplicate identities, even inside the incoming batch")
        void noDuplicates() {
            List<LogEntry> previous = List.of(
                    entry("1", LogSource.DEPLOYMENT_PLATFORM, 10),
                    entry("1", LogSource.DEPLOYMENT_PLATFORM, 10));
            List<LogEntry> incoming = List.of(
                    entry("1", LogSource.BACKEND, 12),
                    entry("4", LogSource.BACKEND, 2),
                    entry("4", LogSource.BACKEND, 2));

            List<LogEntry> merged = aggregator.mergeLogs(previous, incoming);

            Set<String> unique = new HashSet<>(ids(merged));
            assertEquals(unique.size(), merged.size());
            assertEquals(List.of("1", "4"), ids(merged));
            assertEquals(LogSource.DEPLOYMENT_PLATFORM, merged.get(0).source());
        }

        @Test
        @DisplayName("ties keep their order and entries without timestamp go last")
        void stableOrderingAndNullsLast() {
            LogEntry undated = new LogEntry("u", LogSource.BACKEND, "no time", null, null);
            List<LogEntry> incoming = List.of(
                    undated,
                    entry("a", LogSource.BACKEND, 7),
                    entry("b", LogSource.FRONTEND, 7),
                    entry("c", LogSource.BACKEND, 9));

            assertEquals(List.of("c", "a", "b", "u"), ids(aggregator.mergeLogs(List.of(), incoming)));
        }

        @Test
        @DisplayName("result is unmodifiable and tolerates null inputs")
        void unmodifiable() {
            List<LogEntry> merged = aggregator.mergeLogs(null, null);
            assertTrue(merged.isEmpty());
            assertThrows(UnsupportedOperationException.class,
                    () -> merged.add(entry("x", LogSource.BACKEND, 1)));
        }
    }

    @Test
    @DisplayName("jobLogs flattens the logs of every job")
    void jobLogs() {
        var project = project("p1",
                job("j1", JobType.SETUP_PROJECT, JobStatus.COMPLETED, 1, JobData.EMPTY,
                        entry("a", LogSource.BACKEND, 1), entry("b", LogSource.BACKEND, 3)),
                job("j2", JobType.UPDATE_CODE, JobStatus.RUNNING, 2, JobData.EMPTY,
                        entry("c", LogSource.FRONTEND, 2)));

        assertEquals(List.of("b", "c", "a"), ids(aggregator.jobLogs(project)));
        assertTrue(aggregator.jobLogs(null).isEmpty());
    }

    @Test
    @DisplayName("statusChangeEntry is a deployment entry carrying status and build lines")
    void statusChangeEntry() {
        Instant now = Instant.parse("2026-03-01T12:00:00Z");
        BuildLogLine line = stderr("l1", "Module not found");
        var report = new DeploymentStatusReport(DeploymentBuildStatus.ERROR, List.of(line));

        LogEntry first = aggregator.statusChangeEntry(report, now);
        LogEntry second = aggregator.statusChangeEntry(report, now);

        assertEquals(LogSource.DEPLOYMENT_PLATFORM, first.source());
        assertEquals("Deployment status: ERROR", first.text());
        assertEquals(now, first.createdAt());
        assertEquals("ERROR", first.data().status());
        assertEquals(List.of(line), first.buildLines());
        assertNotEquals(first.id(), second.id());
    }

    @Test
    @DisplayName("prepend puts the entry first without duplicating it")
    void prepend() {
        LogEntry fresh = entry("n", LogSource.DEPLOYMENT_PLATFORM, 20);
        List<LogEntry> logs = List.of(entry("a", LogSource.BACKEND, 5), fresh);

        assertEquals(List.of("n", "a"), ids(aggregator.prepend(fresh, logs)));
    }

    @Test
    @DisplayName("prepend keeps entries that have no id")
    void prependWithoutIds() {
        LogEntry anonymous = new LogEntry(null, LogSource.BACKEND, "no id", at(5), null);
        LogEntry fresh = entry("n", LogSource.DEPLOYMENT_PLATFORM, 20);

        List<LogEntry> result = aggregator.prepend(fresh, List.of(anonymous));

        assertEquals(2, result.size());
        assertSame(fresh, result.get(0));
        assertSame(anonymous, result.get(1));
    }

    @Test
    @DisplayName("prepend keeps the timeline newest first when backend clocks run ahead")
    void prependReordersByTimestamp() {
        LogEntry ahead = entry("ahead", LogSource.BACKEND, 50);
        LogEntry older = entry("older", LogSource.BACKEND, 5);
        LogEntry fresh = entry("n", LogSource.DEPLOYMENT_PLATFORM, 20);

        assertEquals(List.of("ahead", "n", "older"), ids(aggregator.prepend(fresh, List.of(ahead, older))));
    }

    @Test
    @DisplayName("latestBuildReport picks the newest deployment entry with build lines")
    void latestBuildReport() {
        LogEntry older = buildReport("r1", 10, stderr("l1", "old"));
        LogEntry newer = buildReport("r2", 20, stderr("l2", "new"));
        LogEntry statusOnly = entry("s", LogSource.DEPLOYMENT_PLATFORM, 30);

        assertEquals("r2", aggregator.latestBuildReport(List.of(statusOnly, newer, older)).orElseThrow().id());
        assertTrue(aggregator.latestBuildReport(List.of(statusOnly)).isEmpty());
    }
}
