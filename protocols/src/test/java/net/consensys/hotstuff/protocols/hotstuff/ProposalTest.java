package net.consensys.hotstuff.protocols.hotstuff;

import org.junit.Assert;
import org.junit.Test;

public class ProposalTest {

  @Test
  public void testIdentity() {
    Proposal x = new Proposal("X", Proposal.GENESIS, 1, "A");
    Assert.assertEquals("X@v1", x.id());

    Proposal sameFromOther = new Proposal("X", "W", 1, "B");
    Assert.assertEquals(x, sameFromOther);
    Assert.assertEquals(x.hashCode(), sameFromOther.hashCode());

    Assert.assertNotEquals(x, new Proposal("X", Proposal.GENESIS, 2, "A"));
    Assert.assertNotEquals(x, new Proposal("Y", Proposal.GENESIS, 1, "A"));
  }

  @Test
  public void testVote() {
    Proposal x = new Proposal("X", Proposal.GENESIS, 1, "A");
    Vote v = Vote.cast("C", x);
    Assert.assertEquals("C", v.voter);
    Assert.assertSame(x, v.proposal);
    Assert.assertEquals(Signatures.sign("C", "X@v1"), v.signature);
    Assert.assertEquals(v, Vote.cast("C", x));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNegativeView() {
    new Proposal("X", Proposal.GENESIS, -1, "A");
  }
}
