package io.b2mash.b2b.digestengine.schedule.content;

/**
 * Port for producing the body of a scheduled digest (regulatory updates, summaries). Calls may be
 * slow or hang; the runner bounds them with a timeout and records a failure instead of retrying.
 */
public interface DigestContentGenerator {

  /** Generator identifier (e.g., "llm", "placeholder"). */
  String generatorId();

  GeneratedDigest generate(DigestContext context);
}
