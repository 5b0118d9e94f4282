package com.frameception.core.config;

import com.frameception.core.model.UserContext;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "frameception")
public class FrameceptionProperties {

    private Backend backend = new Backend();
    private Polling polling = new Polling();
    private User user = new User();

    // -- Backend accessors (delegate to nested) --
    public String getBaseUrl() { return backend.baseUrl; }
    public int getConnectTimeoutSeconds() { return backend.connectTimeoutSeconds; }
    public int getRequestTimeoutSeconds() { return backend.requestTimeoutSeconds; }

    // -- Polling accessors (delegate to nested) --
    public long getPollIntervalMillis() { return polling.intervalMillis; }
    public int getIoThreads() { return polling.ioThreads; }

    /**
     * User identity configured for CLI use, or null when no fid is set.
     */
    public UserContext getUserContext() {
        if (user.fid == null) {
            return null;
        }
        return new UserContext(user.fid, user.username, user.displayName);
    }

    public Backend getBackend() { return backend; }
    public void setBackend(Backend backend) { this.backend = backend; }
    public Polling getPolling() { return polling; }
    public void setPolling(Polling polling) { this.polling = polling; }
    public User getUser() { return user; }
    public void setUser(User user) { this.user = user; }

    public static class Backend {
        /** Base URL of the dashboard backend API, e.g. https://frameception.example.com */
        private String baseUrl = "http://localhost:3000";
        private int connectTimeoutSeconds = 10;
        /** No retry on timeout; the next poll tick retries. */
        private int requestTimeoutSeconds = 30;

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
        public int getConnectTimeoutSeconds() { return connectTimeoutSeconds; }
        public void setConnectTimeoutSeconds(int connectTimeoutSeconds) { this.connectTimeoutSeconds = connectTimeoutSeconds; }
        public int getRequestTimeoutSeconds() { return requestTimeoutSeconds; }
        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) { this.requestTimeoutSeconds = requestTimeoutSeconds; }
    }

    public static class Polling {
        private long intervalMillis = 5000;
        private int ioThreads = 4;

        public long getIntervalMillis() { return intervalMillis; }
        public void setIntervalMillis(long intervalMillis) { this.intervalMillis = intervalMillis; }
        public int getIoThreads() { return ioThreads; }
        public void setIoThreads(int ioThreads) { this.ioThreads = ioThreads; }
    }

    public static class User {
        private Long fid;
        private String username = "";
        private String displayName = "";

        public Long getFid() { return fid; }
        public void setFid(Long fid) { this.fid = fid; }
        public String getUsername() { return username; }
        public void setUsername(String username) { this.username = username; }
        public String getDisplayName() { return displayName; }
        public void setDisplayName(String displayName) { this.displayName = displayName; }
    }
}
