package io.b2mash.b2b.digestengine.schedule;

import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Narrows which digest items a recipient group cares about. Empty sets mean "no restriction" for
 * that dimension. Null and blank values are dropped.
 */
public record RecipientFilter(
    Set<String> severityLevels, Set<String> regulatoryAuthorities, Set<String> updateTypes) {

  public RecipientFilter {
    severityLevels = clean(severityLevels);
    regulatoryAuthorities = clean(regulatoryAuthorities);
    updateTypes = clean(updateTypes);
  }

  public static RecipientFilter none() {
    return new RecipientFilter(Set.of(), Set.of(), Set.of());
  }

  private static Set<String> clean(Set<String> values) {
    if (values == null) {
      return Set.of();
    }
    return values.stream()
        .filter(Objects::nonNull)
        .map(String::trim)
        .filter(v -> !v.isEmpty())
        .collect(Collectors.toUnmodifiableSet());
  }
}
