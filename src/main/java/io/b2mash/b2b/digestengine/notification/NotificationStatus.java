package io.b2mash.b2b.digestengine.notification;

public enum NotificationStatus {
  SENT,
  FAILED,
  /** The transport accepted the message but deferred delivery. */
  PENDING
}
