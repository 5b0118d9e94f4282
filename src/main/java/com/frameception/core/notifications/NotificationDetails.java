package com.frameception.core.notifications;

import java.io.Serializable;

/**
 * Where and how to deliver push notifications to a user's client.
 *
 * @param url   notification delivery endpoint
 * @param token client token for that endpoint
 */
public record NotificationDetails(String url, String token) implements Serializable {
}
