package com.frameception.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * A unit of backend work (project setup, code update) and the log entries it produced.
 * Only the backend transitions a job; the dashboard never mutates one.
 *
 * @param id        job identifier
 * @param type      job type tag
 * @param status    backend status
 * @param createdAt creation timestamp
 * @param data      prompt plus result or error once finished
 * @param logs      log entries written while the job ran
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Job(
    String id,
    JobType type,
    JobStatus status,
    @JsonProperty("created_at") Instant createdAt,
    JobData data,
    List<LogEntry> logs
) implements Serializable {

    public Job {
        type = type == null ? JobType.UNKNOWN : type;
        status = status == null ? JobStatus.UNKNOWN : status;
        data = data == null ? JobData.EMPTY : data;
        logs = logs == null ? List.of() : List.copyOf(logs);
    }

    public boolean inProgress() {
        return status.inProgress();
    }

    /**
     * A job reports an error when the backend marked it failed or attached an error text.
     */
    public boolean reportsError() {
        return status == JobStatus.FAILED || data.hasError();
    }
}
