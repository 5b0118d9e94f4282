package com.frameception.dispatch.api;

import com.frameception.core.notifications.NotificationDetails;
import com.frameception.core.notifications.NotificationPreferenceStore;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * REST controller for per-user notification details.
 */
@RestController
@RequestMapping("/api/v1/users/{fid}/notifications")
public class NotificationController {

    private final NotificationPreferenceStore store;

    public NotificationController(NotificationPreferenceStore store) {
        this.store = store;
    }

    @GetMapping
    public ResponseEntity<NotificationDetails> get(@PathVariable long fid) {
        return store.get(fid)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PutMapping
    public ResponseEntity<Object> set(@PathVariable long fid, @RequestBody NotificationDetails details) {
        if (details.url() == null || details.url().isBlank() || details.token() == null || details.token().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Notification url and token are required"));
        }
        store.set(fid, details);
        return ResponseEntity.ok(details);
    }

    @DeleteMapping
    public ResponseEntity<Void> delete(@PathVariable long fid) {
        return store.delete(fid)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }
}
