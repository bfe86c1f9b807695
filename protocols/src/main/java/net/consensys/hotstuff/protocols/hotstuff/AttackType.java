package net.consensys.hotstuff.protocols.hotstuff;

/** The byzantine behavior of the faulty leader. */
public enum AttackType {
  /** The leader sends two different blocks to two disjoint groups of validators. */
  EQUIVOCATION(true),
  /** The leader collects the votes but never publishes the QC. */
  WITHHOLD_QC(false),
  /** The leader stays silent towards some validators. */
  DROP_MESSAGES(false);

  private final boolean implemented;

  AttackType(boolean implemented) {
    this.implemented = implemented;
  }

  /** @return false if the driver has no round script for this attack. */
  public boolean isImplemented() {
    return implemented;
  }
}
