package com.frameception.core.notifications;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link NotificationPreferenceStore} held in process memory. Contents are lost on restart.
 */
@Component
public class InMemoryNotificationPreferenceStore implements NotificationPreferenceStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryNotificationPreferenceStore.class);

    private final ConcurrentHashMap<String, Object> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryNotificationPreferenceStore() {
        this(Clock.systemUTC());
    }

    InMemoryNotificationPreferenceStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<NotificationDetails> get(long fid) {
        return Optional.ofNullable((NotificationDetails) entries.get(NotificationPreferenceStore.notificationsKey(fid)));
    }

    @Override
    public void set(long fid, NotificationDetails details) {
        Objects.requireNonNull(details, "details");
        entries.put(NotificationPreferenceStore.notificationsKey(fid), details);
        log.debug("Stored notification details for user {}", fid);
    }

    @Override
    public boolean delete(long fid) {
        boolean removed = entries.remove(NotificationPreferenceStore.notificationsKey(fid)) != null;
        if (removed) {
            log.debug("Removed notification details for user {}", fid);
        }
        return removed;
    }

    @Override
    public UserRecord createOrUpdateUser(long fid, String username) {
        UserRecord user = new UserRecord(fid, username, clock.instant());
        entries.put(NotificationPreferenceStore.userKey(fid), user);
        return user;
    }

    @Override
    public Optional<UserRecord> findUser(long fid) {
        return Optional.ofNullable((UserRecord) entries.get(NotificationPreferenceStore.userKey(fid)));
    }

    public int size() {
        return entries.size();
    }
}
