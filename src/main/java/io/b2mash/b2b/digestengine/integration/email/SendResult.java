package io.b2mash.b2b.digestengine.integration.email;

import java.util.List;

/**
 * Outcome of handing a message to the transport.
 *
 * <p>{@code success} with a non-empty {@code rejectedRecipients} list is a partial delivery. {@code
 * deferred} means the transport accepted the message but has not delivered it yet.
 */
public record SendResult(
    boolean success,
    String providerMessageId,
    String errorMessage,
    List<String> rejectedRecipients,
    boolean deferred) {

  public SendResult {
    rejectedRecipients = rejectedRecipients == null ? List.of() : List.copyOf(rejectedRecipients);
  }

  public static SendResult sent(String providerMessageId) {
    return new SendResult(true, providerMessageId, null, List.of(), false);
  }

  public static SendResult failed(String errorMessage) {
    return new SendResult(false, null, errorMessage, List.of(), false);
  }

  public boolean isPartial() {
    return success && !rejectedRecipients.isEmpty();
  }
}
