package net.consensys.hotstuff.core;

/**
 * The interface to implement when you implement a protocol. A protocol owns its network and its
 * nodes; a run starts with init() and can be replayed from scratch with copy(). A protocol must
 * have a public constructor taking its WParameters as the unique parameter.
 */
public interface Protocol {

  Network<?> network();

  /** A fresh protocol with the same parameters, with its own network and nodes. */
  Protocol copy();

  /** Creates the nodes, byzantine or not, and adds them to the network. */
  void init();
}
