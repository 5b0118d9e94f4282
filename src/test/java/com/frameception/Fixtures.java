package com.frameception;

import com.frameception.core.model.BuildLogLine;
import com.frameception.core.model.BuildStream;
import com.frameception.core.model.Job;
import com.frameception.core.model.JobData;
import com.frameception.core.model.JobStatus;
import com.frameception.core.model.JobType;
import com.frameception.core.model.LogData;
import com.frameception.core.model.LogEntry;
import com.frameception.core.model.LogSource;
import com.frameception.core.model.Project;
import com.frameception.core.model.UserContext;

import java.time.Instant;
import java.util.List;

/**
 * Builders for test data shared across test classes.
 */
public final class Fixtures {

    public static final UserContext USER = new UserContext(4242L, "alice", "Alice");

    private Fixtures() {}

    public static Instant at(long epochSecond) {
        return Instant.ofEpochSecond(epochSecond);
    }

    public static Project project(String id, Job... jobs) {
        return new Project(id, "Project " + id, at(1), null, null, null, List.of(jobs));
    }

    public static Project deployedProject(String id, String frontendUrl, Job... jobs) {
        return new Project(id, "Project " + id, at(1), frontendUrl, "https://github.com/acme/" + id,
                "prj_" + id, List.of(jobs));
    }

    public static Job job(String id, JobType type, JobStatus status, long createdAt) {
        return new Job(id, type, status, at(createdAt), JobData.EMPTY, List.of());
    }

    public static Job job(String id, JobType type, JobStatus status, long createdAt, JobData data, LogEntry... logs) {
        return new Job(id, type, status, at(createdAt), data, List.of(logs));
    }

    public static LogEntry entry(String id, LogSource source, long createdAt) {
        return new LogEntry(id, source, "entry " + id, at(createdAt), null);
    }

    public static LogEntry buildReport(String id, long createdAt, BuildLogLine... lines) {
        return new LogEntry(id, LogSource.DEPLOYMENT_PLATFORM, "Deployment status: ERROR", at(createdAt),
                new LogData("ERROR", List.of(lines)));
    }

    public static BuildLogLine stderr(String id, String text) {
        return BuildLogLine.of(id, BuildStream.STDERR, text, at(100));
    }

    public static BuildLogLine stdout(String id, String text) {
        return BuildLogLine.of(id, BuildStream.STDOUT, text, at(100));
    }
}
