package io.b2mash.b2b.digestengine.schedule;

/** Outcome of one digest run. */
public enum ExecutionStatus {

  /** Digest generated and accepted by the transport for every recipient. */
  SUCCESS,

  /** Nothing was delivered: rate limit, generator failure or transport failure. */
  FAILED,

  /** Transport accepted the digest but rejected some recipients. */
  PARTIAL
}
