package com.frameception.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.io.Serializable;

/**
 * Payload of a job: the prompt it was created with and, once finished, either a result or an error.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JobData(
    String prompt,
    String result,
    String error
) implements Serializable {

    public static final JobData EMPTY = new JobData(null, null, null);

    public boolean hasError() {
        return error != null && !error.isBlank();
    }
}
