package net.consensys.hotstuff.protocols.hotstuff;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * What a validator knows: the votes it has seen, the equivocations it has detected, the QCs it
 * has formed and the blocks it has committed.
 *
 * <p>All the methods are synchronized on the instance: a vote is ingested atomically, a QC is
 * built from a consistent set of votes, and the evidence and commit lists only grow.
 */
public class ReplicaState {
  public final String owner;

  /** Votes by proposal id. A voter is counted once per proposal, in arrival order. */
  private final Map<String, LinkedHashMap<String, Vote>> votesByProposal = new HashMap<>();

  /**
   * The proposals a voter endorsed, indexed by (voter, view, proposer). Two different blocks in
   * the same slot are an equivocation.
   */
  private final ListMultimap<VoteSlot, Proposal> endorsedBySlot = ArrayListMultimap.create();

  private final Set<EquivocationEvidence> evidence = new TreeSet<>();
  private final List<String> committed = new ArrayList<>();
  private QuorumCertificate highestQC;

  public ReplicaState(String owner) {
    this.owner = Objects.requireNonNull(owner, "owner");
  }

  private static final class VoteSlot {
    final String voter;
    final int view;
    final String proposer;

    VoteSlot(Vote v) {
      this.voter = v.voter;
      this.view = v.proposal.view;
      this.proposer = v.proposal.proposer;
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) return true;
      if (o == null || getClass() != o.getClass()) return false;
      VoteSlot that = (VoteSlot) o;
      return view == that.view && voter.equals(that.voter) && proposer.equals(that.proposer);
    }

    @Override
    public int hashCode() {
      return Objects.hash(voter, view, proposer);
    }
  }

  /**
   * Checks the vote against the other proposals endorsed by the same voter in the same view for the
   * same proposer, then stores it. The conflict check runs for every vote, duplicates included:
   * two proposers can issue the same block id in the same view. Signatures are not checked.
   *
   * @return false if this voter had already voted for this proposal id: the vote is then not
   *     counted again for the quorum.
   */
  public synchronized boolean recordVote(Vote vote) {
    List<Proposal> endorsed = endorsedBySlot.get(new VoteSlot(vote));
    boolean known = false;
    for (Proposal p : endorsed) {
      if (p.blockId.equals(vote.proposal.blockId)) {
        known = true;
      } else {
        evidence.add(new EquivocationEvidence(vote.voter, p.id(), vote.proposal.id()));
      }
    }
    if (!known) {
      endorsed.add(vote.proposal);
    }

    Map<String, Vote> votes =
        votesByProposal.computeIfAbsent(vote.proposal.id(), k -> new LinkedHashMap<>());
    return votes.putIfAbsent(vote.voter, vote) == null;
  }

  /**
   * Builds a QC if at least 'quorum' different validators voted for this proposal. The QC takes
   * the first 'quorum' voters in alphabetical order, so calling this again with the same votes
   * gives the same QC.
   *
   * @return the QC, null if there is no quorum.
   */
  public synchronized QuorumCertificate tryFormQC(Proposal proposal, int quorum) {
    if (quorum <= 0) {
      throw new IllegalArgumentException("quorum=" + quorum);
    }
    Map<String, Vote> votes = votesByProposal.get(proposal.id());
    if (votes == null || votes.size() < quorum) {
      return null;
    }

    List<String> voters = new ArrayList<>(votes.keySet());
    Collections.sort(voters);
    QuorumCertificate qc = new QuorumCertificate(proposal, voters.subList(0, quorum));
    if (highestQC == null || qc.view() > highestQC.view()) {
      highestQC = qc;
    }
    return qc;
  }

  /**
   * Commits the block certified by this QC. There is no check on the parent chain.
   *
   * @return false if the block was already committed.
   */
  public synchronized boolean applyQCCommit(QuorumCertificate qc) {
    String blockId = qc.proposal.blockId;
    if (committed.contains(blockId)) {
      return false;
    }
    committed.add(blockId);
    return true;
  }

  public synchronized List<Vote> votesFor(Proposal proposal) {
    Map<String, Vote> votes = votesByProposal.get(proposal.id());
    return votes == null
        ? Collections.emptyList()
        : Collections.unmodifiableList(new ArrayList<>(votes.values()));
  }

  public synchronized int voteCount(Proposal proposal) {
    Map<String, Vote> votes = votesByProposal.get(proposal.id());
    return votes == null ? 0 : votes.size();
  }

  /** The evidence found so far, sorted by accused then proposals. */
  public synchronized Set<EquivocationEvidence> evidence() {
    return Collections.unmodifiableSet(new TreeSet<>(evidence));
  }

  /** The committed block ids, in commit order. */
  public synchronized List<String> committed() {
    return Collections.unmodifiableList(new ArrayList<>(committed));
  }

  public synchronized QuorumCertificate highestQC() {
    return highestQC;
  }

  @Override
  public synchronized String toString() {
    return "ReplicaState{"
        + "owner="
        + owner
        + ", proposals="
        + votesByProposal.keySet()
        + ", evidence="
        + evidence.size()
        + ", committed="
        + committed
        + ", highestQC="
        + highestQC
        + '}';
  }
}
