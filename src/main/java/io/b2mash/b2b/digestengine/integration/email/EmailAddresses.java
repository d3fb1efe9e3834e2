package io.b2mash.b2b.digestengine.integration.email;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/** Recipient address normalization shared by recipient groups and rule dispatch. */
public final class EmailAddresses {

  private EmailAddresses() {}

  /**
   * Trims, lowercases and de-duplicates addresses, dropping blanks. First-seen order is kept.
   *
   * @param addresses raw addresses, may contain nulls
   * @return distinct normalized addresses
   */
  public static List<String> normalize(Collection<String> addresses) {
    if (addresses == null || addresses.isEmpty()) {
      return List.of();
    }
    var distinct = new LinkedHashSet<String>();
    addresses.stream()
        .filter(Objects::nonNull)
        .map(a -> a.trim().toLowerCase(Locale.ROOT))
        .filter(a -> !a.isEmpty())
        .forEach(distinct::add);
    return List.copyOf(distinct);
  }
}
