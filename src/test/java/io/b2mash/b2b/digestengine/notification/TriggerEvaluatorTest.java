package io.b2mash.b2b.digestengine.notification;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class TriggerEvaluatorTest {

  private static final Instant NOW = Instant.parse("2024-01-10T09:00:00Z");

  private final TriggerEvaluator evaluator = new TriggerEvaluator();

  @Test
  void matches_emptyPlatformFilterAcceptsEveryPlatform() {
    var rule = rule(true, Set.of(TriggerKind.NEW_RESOURCES), Set.of(), null);

    assertThat(evaluator.matches(event(TriggerKind.NEW_RESOURCES, "coursera", 1), rule)).isTrue();
    assertThat(evaluator.matches(event(TriggerKind.NEW_RESOURCES, "iapp", 1), rule)).isTrue();
  }

  @Test
  void matches_platformFilterRestrictsPlatforms() {
    var rule = rule(true, Set.of(TriggerKind.NEW_RESOURCES), Set.of("coursera"), null);

    assertThat(evaluator.matches(event(TriggerKind.NEW_RESOURCES, "coursera", 1), rule)).isTrue();
    assertThat(evaluator.matches(event(TriggerKind.NEW_RESOURCES, "linkedin", 1), rule)).isFalse();
  }

  @Test
  void matches_minResourcesComparesAddedCount() {
    var rule = rule(true, Set.of(TriggerKind.NEW_RESOURCES), Set.of(), 5);

    assertThat(evaluator.matches(event(TriggerKind.NEW_RESOURCES, "coursera", 3), rule)).isFalse();
    assertThat(evaluator.matches(event(TriggerKind.NEW_RESOURCES, "coursera", 5), rule)).isTrue();
    assertThat(evaluator.matches(event(TriggerKind.NEW_RESOURCES, "coursera", null), rule))
        .isFalse();
  }

  @Test
  void matches_inactiveRuleNeverFires() {
    var rule = rule(false, Set.of(TriggerKind.SYNC_FAILURE), Set.of(), null);

    assertThat(evaluator.matches(event(TriggerKind.SYNC_FAILURE, "coursera", null), rule))
        .isFalse();
  }

  @Test
  void matches_ruleWithoutTriggersNeverFires() {
    var rule = rule(true, Set.of(), Set.of(), null);

    for (var kind : TriggerKind.values()) {
      assertThat(evaluator.matches(event(kind, "coursera", 10), rule)).isFalse();
    }
  }

  @Test
  void matches_keepsRegistrationOrderAndReturnsEveryMatch() {
    var first = rule(true, Set.of(TriggerKind.SYNC_SUCCESS), Set.of(), null);
    var other = rule(true, Set.of(TriggerKind.SYNC_FAILURE), Set.of(), null);
    var second =
        rule(true, Set.of(TriggerKind.SYNC_SUCCESS, TriggerKind.NEW_RESOURCES), Set.of(), null);

    var matches =
        evaluator.matches(
            event(TriggerKind.SYNC_SUCCESS, "coursera", 2), List.of(first, other, second));

    assertThat(matches).containsExactly(first, second);
  }

  private static NotificationRule rule(
      boolean active, Set<TriggerKind> triggers, Set<String> platforms, Integer minResources) {
    return NotificationRule.create(
        new NotificationRuleDraft(
            "Rule",
            null,
            active,
            triggers,
            platforms,
            List.of("ops@example.com"),
            "{PLATFORM_NAME}",
            "{RESOURCE_COUNT}",
            minResources),
        NOW);
  }

  private static ResourceEvent event(TriggerKind kind, String platform, Integer added) {
    return new ResourceEvent(kind, platform, added, null, List.of(), null, NOW);
  }
}
