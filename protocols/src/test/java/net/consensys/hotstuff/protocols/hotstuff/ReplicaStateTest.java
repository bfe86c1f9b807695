package net.consensys.hotstuff.protocols.hotstuff;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import org.junit.Assert;
import org.junit.Test;

public class ReplicaStateTest {
  private final ReplicaState state = new ReplicaState("A");
  private final Proposal x = new Proposal("X", Proposal.GENESIS, 1, "A");
  private final Proposal y = new Proposal("Y", Proposal.GENESIS, 1, "A");
  private final Proposal z = new Proposal("Z", Proposal.GENESIS, 2, "B");

  private void voteAll(Proposal p, String... voters) {
    for (String v : voters) {
      state.recordVote(Vote.cast(v, p));
    }
  }

  @Test
  public void testSplitVoteHasNoQuorum() {
    // N=7, f=2: 3 votes for X, 4 for Y, quorum is 5
    voteAll(x, "A", "B", "C");
    voteAll(y, "D", "E", "F", "G");

    Assert.assertNull(state.tryFormQC(x, 5));
    Assert.assertNull(state.tryFormQC(y, 5));
    Assert.assertNull(state.highestQC());
    Assert.assertTrue(state.evidence().isEmpty());
  }

  @Test
  public void testEquivocationDetected() {
    state.recordVote(Vote.cast("D", x));
    Assert.assertTrue(state.evidence().isEmpty());
    state.recordVote(Vote.cast("D", y));

    Assert.assertEquals(
        Collections.singleton(new EquivocationEvidence("D", "X@v1", "Y@v1")), state.evidence());
  }

  @Test
  public void testEquivocationDetectedInAnyOrder() {
    ReplicaState other = new ReplicaState("B");
    state.recordVote(Vote.cast("D", x));
    state.recordVote(Vote.cast("D", y));
    other.recordVote(Vote.cast("D", y));
    other.recordVote(Vote.cast("D", x));

    Assert.assertEquals(1, state.evidence().size());
    Assert.assertEquals(state.evidence(), other.evidence());
  }

  @Test
  public void testEvidenceForEachConflict() {
    Proposal w = new Proposal("W", Proposal.GENESIS, 1, "A");
    state.recordVote(Vote.cast("D", x));
    state.recordVote(Vote.cast("D", y));
    state.recordVote(Vote.cast("D", w));
    state.recordVote(Vote.cast("E", x));
    state.recordVote(Vote.cast("E", w));

    Set<EquivocationEvidence> e = state.evidence();
    Assert.assertEquals(4, e.size());
    Assert.assertTrue(e.contains(new EquivocationEvidence("D", "X@v1", "Y@v1")));
    Assert.assertTrue(e.contains(new EquivocationEvidence("D", "W@v1", "X@v1")));
    Assert.assertTrue(e.contains(new EquivocationEvidence("D", "W@v1", "Y@v1")));
    Assert.assertTrue(e.contains(new EquivocationEvidence("E", "W@v1", "X@v1")));
  }

  @Test
  public void testNoFalseEquivocation() {
    // Different views
    state.recordVote(Vote.cast("D", x));
    state.recordVote(Vote.cast("D", z));
    // Same block, different proposers
    state.recordVote(Vote.cast("E", new Proposal("Q", Proposal.GENESIS, 3, "B")));
    state.recordVote(Vote.cast("E", new Proposal("Q", Proposal.GENESIS, 3, "C")));
    // Different blocks, different proposers
    state.recordVote(Vote.cast("E", new Proposal("R", Proposal.GENESIS, 3, "C")));
    // Same view, different voters
    state.recordVote(Vote.cast("F", x));
    state.recordVote(Vote.cast("G", y));
    // Twice the same vote
    state.recordVote(Vote.cast("H", y));
    state.recordVote(Vote.cast("H", y));

    Assert.assertTrue(state.evidence().isEmpty());
  }

  @Test
  public void testSameBlockIdFromTwoProposers() {
    Proposal qFromB = new Proposal("Q", Proposal.GENESIS, 3, "B");
    Proposal qFromC = new Proposal("Q", Proposal.GENESIS, 3, "C");
    Proposal rFromC = new Proposal("R", Proposal.GENESIS, 3, "C");
    EquivocationEvidence expected = new EquivocationEvidence("E", "Q@v3", "R@v3");

    state.recordVote(Vote.cast("E", qFromB));
    state.recordVote(Vote.cast("E", qFromC));
    state.recordVote(Vote.cast("E", rFromC));
    Assert.assertEquals(Collections.singleton(expected), state.evidence());
    Assert.assertEquals(1, state.voteCount(qFromC));

    ReplicaState other = new ReplicaState("B");
    other.recordVote(Vote.cast("E", qFromC));
    other.recordVote(Vote.cast("E", qFromB));
    other.recordVote(Vote.cast("E", rFromC));
    Assert.assertEquals(state.evidence(), other.evidence());

    ReplicaState third = new ReplicaState("C");
    third.recordVote(Vote.cast("E", rFromC));
    third.recordVote(Vote.cast("E", qFromB));
    third.recordVote(Vote.cast("E", qFromC));
    Assert.assertEquals(state.evidence(), third.evidence());
  }

  @Test
  public void testDuplicateVotesCountOnce() {
    Assert.assertTrue(state.recordVote(Vote.cast("B", x)));
    Assert.assertFalse(state.recordVote(Vote.cast("B", x)));
    Assert.assertFalse(state.recordVote(new Vote("B", x, "SIG(forged)")));
    Assert.assertEquals(1, state.voteCount(x));
    Assert.assertNull(state.tryFormQC(x, 2));

    Assert.assertTrue(state.recordVote(Vote.cast("C", x)));
    Assert.assertNotNull(state.tryFormQC(x, 2));
  }

  @Test
  public void testQcTakesSortedVoters() {
    voteAll(z, "G", "C", "E", "A", "F", "B", "D");

    QuorumCertificate qc = state.tryFormQC(z, 5);
    Assert.assertNotNull(qc);
    Assert.assertEquals(z, qc.proposal);
    Assert.assertEquals(Arrays.asList("A", "B", "C", "D", "E"), qc.voters);
    Assert.assertEquals(qc, state.tryFormQC(z, 5));
    Assert.assertEquals(qc, state.highestQC());
  }

  @Test
  public void testQcDeterminism() {
    ReplicaState other = new ReplicaState("B");
    List<String> voters = Arrays.asList("F", "A", "D", "B", "G", "C");
    for (String v : voters) {
      state.recordVote(Vote.cast(v, z));
      other.recordVote(Vote.cast(v, z));
    }

    QuorumCertificate qc1 = state.tryFormQC(z, 5);
    QuorumCertificate qc2 = state.tryFormQC(z, 5);
    Assert.assertEquals(qc1.voters, qc2.voters);
    Assert.assertEquals(qc1, other.tryFormQC(z, 5));
  }

  @Test
  public void testHighestQcOnlyMovesForward() {
    voteAll(x, "A", "B", "C");
    voteAll(y, "A", "B", "C");
    voteAll(z, "A", "B", "C");

    QuorumCertificate qcX = state.tryFormQC(x, 3);
    Assert.assertEquals(qcX, state.highestQC());

    // Same view: no change
    state.tryFormQC(y, 3);
    Assert.assertEquals(qcX, state.highestQC());

    QuorumCertificate qcZ = state.tryFormQC(z, 3);
    Assert.assertEquals(qcZ, state.highestQC());

    // Older view: no change
    state.tryFormQC(x, 3);
    Assert.assertEquals(qcZ, state.highestQC());
  }

  @Test
  public void testCommitIsIdempotent() {
    voteAll(z, "A", "B", "C", "D", "E");
    QuorumCertificate qc = state.tryFormQC(z, 5);

    Assert.assertTrue(state.applyQCCommit(qc));
    Assert.assertFalse(state.applyQCCommit(qc));
    Assert.assertFalse(state.applyQCCommit(state.tryFormQC(z, 5)));
    Assert.assertEquals(Collections.singletonList("Z"), state.committed());
  }

  @Test
  public void testCommitOrder() {
    voteAll(x, "A", "B", "C");
    voteAll(z, "A", "B", "C");
    state.applyQCCommit(state.tryFormQC(z, 3));
    state.applyQCCommit(state.tryFormQC(x, 3));
    Assert.assertEquals(Arrays.asList("Z", "X"), state.committed());
  }

  @Test
  public void testVotesFor() {
    Assert.assertTrue(state.votesFor(x).isEmpty());
    voteAll(x, "C", "A");
    List<Vote> votes = state.votesFor(x);
    Assert.assertEquals(2, votes.size());
    Assert.assertEquals("C", votes.get(0).voter);
    Assert.assertEquals("A", votes.get(1).voter);
  }

  @Test(expected = UnsupportedOperationException.class)
  public void testEvidenceIsReadOnly() {
    state.evidence().add(new EquivocationEvidence("D", "X@v1", "Y@v1"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testBadQuorum() {
    state.tryFormQC(x, 0);
  }
}
