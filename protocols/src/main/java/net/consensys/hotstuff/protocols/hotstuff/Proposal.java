package net.consensys.hotstuff.protocols.hotstuff;

import java.util.Objects;

/**
 * A block proposed by a leader in a given view. Two proposals with the same block id and the same
 * view are the same proposal, whoever the proposer and the parent: a leader proposing two
 * different blocks in the same view is what makes an equivocation.
 */
public final class Proposal {
  public static final String GENESIS = "GENESIS";

  public final String blockId;
  public final String parentId;
  public final int view;
  public final String proposer;

  public Proposal(String blockId, String parentId, int view, String proposer) {
    if (blockId == null || parentId == null || proposer == null) {
      throw new IllegalArgumentException(
          "blockId=" + blockId + ", parentId=" + parentId + ", proposer=" + proposer);
    }
    if (view < 0) {
      throw new IllegalArgumentException("view=" + view);
    }
    this.blockId = blockId;
    this.parentId = parentId;
    this.view = view;
    this.proposer = proposer;
  }

  /** The proposal identity, e.g. X@v1 */
  public String id() {
    return blockId + "@v" + view;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    Proposal proposal = (Proposal) o;
    return view == proposal.view && blockId.equals(proposal.blockId);
  }

  @Override
  public int hashCode() {
    return Objects.hash(blockId, view);
  }

  @Override
  public String toString() {
    return "Proposal{"
        + id()
        + ", parent="
        + parentId
        + ", proposer="
        + proposer
        + '}';
  }
}
