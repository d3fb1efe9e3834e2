package io.b2mash.b2b.digestengine.schedule;

/** What started a run. Timer runs re-check due-ness under the schedule lock; manual runs do not. */
public enum ExecutionTrigger {
  TIMER,
  MANUAL
}
