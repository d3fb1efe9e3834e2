package io.b2mash.b2b.digestengine.config;

import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration for the event-driven notification path.
 *
 * @param dispatchThreads maximum concurrent outbound sends
 * @param dispatchQueueCapacity matched rules waiting for a dispatch thread before caller-runs
 * @param platforms platform id to display name, used for {@code {PLATFORM_NAME}}
 */
@ConfigurationProperties(prefix = "digest-engine.notifications")
public record NotificationProperties(
    int dispatchThreads, int dispatchQueueCapacity, Map<String, String> platforms) {

  public NotificationProperties {
    if (dispatchThreads <= 0) {
      dispatchThreads = 4;
    }
    if (dispatchQueueCapacity <= 0) {
      dispatchQueueCapacity = 100;
    }
    platforms = platforms == null ? Map.of() : Map.copyOf(platforms);
  }

  /** Display name for a platform id, falling back to the id itself. */
  public String platformName(String platformId) {
    if (platformId == null) {
      return null;
    }
    return platforms.getOrDefault(platformId, platformId);
  }
}
