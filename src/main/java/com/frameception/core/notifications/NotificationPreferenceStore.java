package com.frameception.core.notifications;

import java.util.Optional;

/**
 * Key-value access to per-user notification details and user records.
 * <p>
 * Values are stored and replaced whole; there is no merge. Keys follow the
 * {@code user:{fid}} and {@code user:{fid}:notifications} layout.
 */
public interface NotificationPreferenceStore {

    static String userKey(long fid) {
        return "user:" + fid;
    }

    static String notificationsKey(long fid) {
        return userKey(fid) + ":notifications";
    }

    Optional<NotificationDetails> get(long fid);

    void set(long fid, NotificationDetails details);

    /**
     * @return true when details existed and were removed
     */
    boolean delete(long fid);

    /**
     * Stores the user record, replacing any previous one for the same fid.
     */
    UserRecord createOrUpdateUser(long fid, String username);

    Optional<UserRecord> findUser(long fid);
}
