package net.consensys.hotstuff.protocols.hotstuff;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.Assert;
import org.junit.Test;

public class RoundSpecTest {
  private final List<String> ids = Arrays.asList("A", "B", "C", "D", "E", "F", "G");

  @Test
  public void testEquivocationScript() {
    List<RoundSpec> rounds = RoundSpec.equivocation(ids, 0);
    Assert.assertEquals(2, rounds.size());

    RoundSpec attack = rounds.get(0);
    Assert.assertEquals(RoundSpec.Kind.ATTACK, attack.kind);
    Assert.assertEquals("X", attack.proposals.get(0).blockId);
    Assert.assertEquals(Arrays.asList("A", "B", "C"), attack.proposals.get(0).targets);
    Assert.assertEquals("Y", attack.proposals.get(1).blockId);
    Assert.assertEquals(Arrays.asList("D", "E", "F", "G"), attack.proposals.get(1).targets);

    RoundSpec safe = rounds.get(1);
    Assert.assertEquals(RoundSpec.Kind.SAFE, safe.kind);
    Assert.assertEquals("Z", safe.proposals.get(0).blockId);
    Assert.assertEquals(ids, safe.proposals.get(0).targets);
  }

  @Test
  public void testDoubleVoters() {
    RoundSpec attack = RoundSpec.equivocation(ids, 2).get(0);
    Assert.assertEquals(
        Arrays.asList("A", "B", "C", "D", "E"), attack.proposals.get(0).targets);
    Assert.assertEquals(Arrays.asList("D", "E", "F", "G"), attack.proposals.get(1).targets);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testTooManyDoubleVoters() {
    RoundSpec.equivocation(ids, 5);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testHonestLeaderProposesOnce() {
    new RoundSpec(
        RoundSpec.Kind.SAFE,
        Arrays.asList(
            new RoundSpec.ProposalTarget("Z", ids), new RoundSpec.ProposalTarget("W", ids)));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNoTarget() {
    new RoundSpec.ProposalTarget("Z", Collections.emptyList());
  }
}
