package io.b2mash.b2b.digestengine.integration.email;

/**
 * Port for the outbound mail transport. Implementations may block; callers wrap them in a timeout.
 */
public interface EmailProvider {

  /** Provider identifier (e.g., "smtp", "sendgrid", "noop"). */
  String providerId();

  /**
   * Sends one message to all of its recipients. Transport failures are reported through {@link
   * SendResult#failed}; an exception is treated the same way by callers.
   */
  SendResult send(EmailMessage message);
}
