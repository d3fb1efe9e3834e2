package io.b2mash.b2b.digestengine.schedule.content;

import io.b2mash.b2b.digestengine.schedule.RecipientFilter;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * What a content generator knows about the run it is producing a digest for.
 *
 * @param since the previous run, or {@code null} on the first run
 * @param filters filters of the enabled recipient groups the digest goes to
 */
public record DigestContext(
    UUID scheduleId,
    String scheduleName,
    String scheduleDescription,
    Instant since,
    Instant until,
    List<RecipientFilter> filters) {

  public DigestContext {
    filters = filters == null ? List.of() : List.copyOf(filters);
  }
}
