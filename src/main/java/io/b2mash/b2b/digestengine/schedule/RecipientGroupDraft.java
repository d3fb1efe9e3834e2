package io.b2mash.b2b.digestengine.schedule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public record RecipientGroupDraft(
    String name,
    String description,
    List<String> recipients,
    RecipientFilter filter,
    boolean enabled) {

  public RecipientGroupDraft {
    // Null elements are kept so validation can report them
    recipients =
        recipients == null
            ? Collections.<String>emptyList()
            : Collections.unmodifiableList(new ArrayList<>(recipients));
  }
}
