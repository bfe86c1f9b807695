package net.consensys.hotstuff.protocols.hotstuff;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/** A proposal with enough votes to be committed. The voters are sorted. */
public final class QuorumCertificate {
  public final Proposal proposal;
  public final List<String> voters;

  public QuorumCertificate(Proposal proposal, List<String> voters) {
    if (proposal == null || voters == null || voters.isEmpty()) {
      throw new IllegalArgumentException("proposal=" + proposal + ", voters=" + voters);
    }
    List<String> sorted = new ArrayList<>(voters);
    Collections.sort(sorted);
    for (int i = 1; i < sorted.size(); i++) {
      if (sorted.get(i).equals(sorted.get(i - 1))) {
        throw new IllegalArgumentException("Duplicate voter " + sorted.get(i) + " in " + voters);
      }
    }
    this.proposal = proposal;
    this.voters = Collections.unmodifiableList(sorted);
  }

  public int view() {
    return proposal.view;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    QuorumCertificate that = (QuorumCertificate) o;
    return proposal.equals(that.proposal) && voters.equals(that.voters);
  }

  @Override
  public int hashCode() {
    return Objects.hash(proposal, voters);
  }

  @Override
  public String toString() {
    return "QC{" + proposal.id() + ", voters=" + voters + '}';
  }
}
