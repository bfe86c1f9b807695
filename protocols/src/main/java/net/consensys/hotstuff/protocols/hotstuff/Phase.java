package net.consensys.hotstuff.protocols.hotstuff;

/** The phases of a run, in execution order. A run never goes back to a previous phase. */
public enum Phase {
  PROPOSAL,
  VOTING,
  QC_FORMATION,
  EVIDENCE_REPORT,
  VIEW_CHANGE,
  SAFE_ROUND,
  COMMIT,
  COMPLETE
}
