package io.b2mash.b2b.digestengine.notification;

import io.b2mash.b2b.digestengine.history.NotificationLog;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/notification-logs")
public class NotificationLogController {

  private final NotificationLog notificationLog;

  public NotificationLogController(NotificationLog notificationLog) {
    this.notificationLog = notificationLog;
  }

  @GetMapping
  public ResponseEntity<List<NotificationLogResponse>> listLogs(
      @RequestParam(required = false) UUID ruleId, @RequestParam(defaultValue = "20") int limit) {
    int capped = Math.max(1, Math.min(limit, 100));
    var entries =
        ruleId != null ? notificationLog.forRule(ruleId, capped) : notificationLog.recent(capped);
    return ResponseEntity.ok(entries.stream().map(NotificationLogResponse::from).toList());
  }
}
