package com.frameception.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.io.Serializable;

/**
 * Identity of the user driving the dashboard, forwarded with every mutation.
 *
 * @param fid         numeric user identity; null when no user is signed in
 * @param username    handle
 * @param displayName display name; nullable
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record UserContext(
    Long fid,
    String username,
    String displayName
) implements Serializable {

    public boolean hasIdentity() {
        return fid != null;
    }
}
