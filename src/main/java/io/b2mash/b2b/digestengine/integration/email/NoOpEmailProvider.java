package io.b2mash.b2b.digestengine.integration.email;

import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.stereotype.Component;

/**
 * Fallback transport used when no real provider bean is registered. Logs the message instead of
 * sending it.
 */
@Component
@ConditionalOnMissingBean(value = EmailProvider.class, ignored = NoOpEmailProvider.class)
public class NoOpEmailProvider implements EmailProvider {

  private static final Logger log = LoggerFactory.getLogger(NoOpEmailProvider.class);

  @Override
  public String providerId() {
    return "noop";
  }

  @Override
  public SendResult send(EmailMessage message) {
    log.info(
        "NoOp email: would send to {} recipients with subject '{}'",
        message.recipients().size(),
        message.subject());
    return SendResult.sent("NOOP-" + UUID.randomUUID());
  }
}
