package net.consensys.hotstuff.protocols.hotstuff;

import java.util.Objects;

/**
 * Proof that a voter signed two different blocks proposed by the same proposer in the same view.
 * The two proposal ids are kept in lexicographic order, so the evidence does not depend on which
 * vote was seen first.
 */
public final class EquivocationEvidence implements Comparable<EquivocationEvidence> {
  public final String accused;
  public final String conflictA;
  public final String conflictB;

  public EquivocationEvidence(String accused, String proposalId1, String proposalId2) {
    if (accused == null || proposalId1 == null || proposalId2 == null) {
      throw new IllegalArgumentException(
          "accused=" + accused + ", proposals=" + proposalId1 + "/" + proposalId2);
    }
    if (proposalId1.equals(proposalId2)) {
      throw new IllegalArgumentException("Not a conflict: " + proposalId1);
    }
    this.accused = accused;
    boolean ordered = proposalId1.compareTo(proposalId2) < 0;
    this.conflictA = ordered ? proposalId1 : proposalId2;
    this.conflictB = ordered ? proposalId2 : proposalId1;
  }

  public boolean involves(String proposalId) {
    return conflictA.equals(proposalId) || conflictB.equals(proposalId);
  }

  @Override
  public int compareTo(EquivocationEvidence o) {
    int c = accused.compareTo(o.accused);
    if (c == 0) {
      c = conflictA.compareTo(o.conflictA);
    }
    return c != 0 ? c : conflictB.compareTo(o.conflictB);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    EquivocationEvidence that = (EquivocationEvidence) o;
    return accused.equals(that.accused)
        && conflictA.equals(that.conflictA)
        && conflictB.equals(that.conflictB);
  }

  @Override
  public int hashCode() {
    return Objects.hash(accused, conflictA, conflictB);
  }

  @Override
  public String toString() {
    return accused + " signed conflicting proposals: " + conflictA + " vs " + conflictB;
  }
}
