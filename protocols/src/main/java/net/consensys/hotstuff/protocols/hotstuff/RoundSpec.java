package net.consensys.hotstuff.protocols.hotstuff;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A round, described as data: which blocks the leader proposes and to whom. The leader, the view
 * and the parent block are decided by the driver when the round is played.
 */
public final class RoundSpec {

  public enum Kind {
    /** A faulty leader round: any QC is unexpected, evidence is collected. */
    ATTACK,
    /** An honest round: a QC is expected and committed. */
    SAFE
  }

  /** A block and the validators it is shown to. */
  public static final class ProposalTarget {
    public final String blockId;
    public final List<String> targets;

    public ProposalTarget(String blockId, List<String> targets) {
      if (blockId == null || targets == null || targets.isEmpty()) {
        throw new IllegalArgumentException("blockId=" + blockId + ", targets=" + targets);
      }
      this.blockId = blockId;
      this.targets = Collections.unmodifiableList(new ArrayList<>(targets));
    }

    @Override
    public String toString() {
      return blockId + "->" + targets;
    }
  }

  public final Kind kind;
  public final List<ProposalTarget> proposals;

  public RoundSpec(Kind kind, List<ProposalTarget> proposals) {
    if (kind == null || proposals == null || proposals.isEmpty()) {
      throw new IllegalArgumentException("kind=" + kind + ", proposals=" + proposals);
    }
    if (kind == Kind.SAFE && proposals.size() != 1) {
      throw new IllegalArgumentException("An honest leader proposes a single block: " + proposals);
    }
    this.kind = kind;
    this.proposals = Collections.unmodifiableList(new ArrayList<>(proposals));
  }

  /**
   * The equivocation attack followed by an honest round: X to the first half of the validators, Y
   * to the others, then Z to everybody.
   *
   * @param doubleVoters - how many validators of the second half are shown X as well.
   */
  public static List<RoundSpec> equivocation(List<String> validators, int doubleVoters) {
    int half = validators.size() / 2;
    List<String> toX = new ArrayList<>(validators.subList(0, half));
    List<String> toY = new ArrayList<>(validators.subList(half, validators.size()));
    if (doubleVoters < 0 || doubleVoters > toY.size()) {
      throw new IllegalArgumentException("doubleVoters=" + doubleVoters + ", max=" + toY.size());
    }
    toX.addAll(toY.subList(0, doubleVoters));

    List<RoundSpec> res = new ArrayList<>();
    res.add(
        new RoundSpec(
            Kind.ATTACK,
            List.of(new ProposalTarget("X", toX), new ProposalTarget("Y", toY))));
    res.add(new RoundSpec(Kind.SAFE, List.of(new ProposalTarget("Z", validators))));
    return res;
  }

  @Override
  public String toString() {
    return "RoundSpec{" + kind + ", " + proposals + '}';
  }
}
