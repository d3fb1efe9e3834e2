package io.b2mash.b2b.digestengine.notification.template;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Result of one render pass.
 *
 * @param unresolved token names that had no value and were left verbatim, in order of appearance
 */
public record RenderedTemplate(String subject, String body, Set<String> unresolved) {

  public RenderedTemplate {
    unresolved = Collections.unmodifiableSet(new LinkedHashSet<>(unresolved));
  }

  public boolean isFullyResolved() {
    return unresolved.isEmpty();
  }
}
