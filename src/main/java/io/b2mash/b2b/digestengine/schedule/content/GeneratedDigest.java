package io.b2mash.b2b.digestengine.schedule.content;

public record GeneratedDigest(String body, int itemsIncluded, int criticalItems) {

  public GeneratedDigest {
    if (body == null) {
      body = "";
    }
    if (itemsIncluded < 0 || criticalItems < 0 || criticalItems > itemsIncluded) {
      throw new IllegalArgumentException(
          "invalid item counts: included=" + itemsIncluded + ", critical=" + criticalItems);
    }
  }

  public static GeneratedDigest empty() {
    return new GeneratedDigest("", 0, 0);
  }
}
