package net.consensys.hotstuff.core.messages;

import net.consensys.hotstuff.core.Network;
import net.consensys.hotstuff.core.Node;
import net.consensys.hotstuff.core.utils.Strings;

/**
 * A message carried by the simulated network. The network calls 'action' when the message reaches
 * its destination.
 *
 * <p>A broadcast puts the same instance in all its envelopes, so messages must be immutable.
 */
public abstract class Message<TN extends Node> {

  /** What the destination node does with this message. */
  public abstract void action(Network<TN> network, TN from, TN to);

  @Override
  public String toString() {
    return Strings.toString(this);
  }
}
