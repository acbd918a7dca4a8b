package io.b2mash.meetings.pointtracker.permission;

/** Outcome of one {@link PolicyEvaluator}. {@link #ABSTAIN} defers to the next evaluator. */
public enum PolicyDecision {
  ALLOW,
  DENY,
  ABSTAIN
}
