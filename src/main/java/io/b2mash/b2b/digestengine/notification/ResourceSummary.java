package io.b2mash.b2b.digestengine.notification;

/** A learning resource carried by an event, listed in notification bodies as "title (type)". */
public record ResourceSummary(String title, String type) {

  public String displayText() {
    if (type == null || type.isBlank()) {
      return title;
    }
    return title + " (" + type + ")";
  }
}
