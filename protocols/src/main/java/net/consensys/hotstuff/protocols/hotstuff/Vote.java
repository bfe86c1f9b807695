package net.consensys.hotstuff.protocols.hotstuff;

import java.util.Objects;

/** A voter endorsing a proposal in the proposal's view. */
public final class Vote {
  public final String voter;
  public final Proposal proposal;
  public final String signature;

  public Vote(String voter, Proposal proposal, String signature) {
    if (voter == null || proposal == null || signature == null) {
      throw new IllegalArgumentException(
          "voter=" + voter + ", proposal=" + proposal + ", signature=" + signature);
    }
    this.voter = voter;
    this.proposal = proposal;
    this.signature = signature;
  }

  /** A vote signed by the voter itself. */
  public static Vote cast(String voter, Proposal proposal) {
    return new Vote(voter, proposal, Signatures.sign(voter, proposal.id()));
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    Vote vote = (Vote) o;
    return voter.equals(vote.voter)
        && proposal.equals(vote.proposal)
        && signature.equals(vote.signature);
  }

  @Override
  public int hashCode() {
    return Objects.hash(voter, proposal, signature);
  }

  @Override
  public String toString() {
    return "Vote{" + voter + " for " + proposal.id() + ", " + signature + '}';
  }
}
