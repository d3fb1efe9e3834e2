package io.b2mash.b2b.digestengine.schedule.content;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Default generator until a real content source is wired in. Produces an empty digest. */
@Component
public class PlaceholderDigestContentGenerator implements DigestContentGenerator {

  private static final Logger log =
      LoggerFactory.getLogger(PlaceholderDigestContentGenerator.class);

  @Override
  public String generatorId() {
    return "placeholder";
  }

  @Override
  public GeneratedDigest generate(DigestContext context) {
    log.info(
        "Placeholder digest: would generate content for schedule {} covering {} to {}",
        context.scheduleId(),
        context.since(),
        context.until());
    return GeneratedDigest.empty();
  }
}
