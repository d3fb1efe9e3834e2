package io.b2mash.b2b.digestengine.notification;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** Unvalidated rule fields as supplied by a management caller. */
public record NotificationRuleDraft(
    String name,
    String description,
    boolean active,
    Set<TriggerKind> triggers,
    Set<String> platforms,
    List<String> recipients,
    String subject,
    String body,
    Integer minResources) {

  public NotificationRuleDraft {
    triggers =
        triggers == null
            ? Collections.<TriggerKind>emptySet()
            : Collections.unmodifiableSet(new LinkedHashSet<>(triggers));
    platforms =
        platforms == null
            ? Collections.<String>emptySet()
            : Collections.unmodifiableSet(new LinkedHashSet<>(platforms));
    recipients =
        recipients == null
            ? Collections.<String>emptyList()
            : Collections.unmodifiableList(new ArrayList<>(recipients));
  }
}
