package net.consensys.hotstuff.core;

/**
 * A validator of the simulated network. Protocols extend this class to add their own state; the
 * network only needs the id, the name and the message counters.
 */
@SuppressWarnings({"WeakerAccess"})
public class Node {

  /** Sequence without any holes; starts at zero. */
  public final int nodeId;

  /** Human readable identifier: A, B, C... This is the id used by the protocols in their logs. */
  public final String name;

  /** Reporting only: the protocol decides what a byzantine node does differently. */
  public final boolean byzantine;

  /** The time when the protocol ended for this node, 0 if it has not ended yet. */
  public long doneAt = 0;

  /** Updated by the network. */
  protected long msgReceived = 0;

  protected long msgSent = 0;

  public Node(NodeBuilder nb, boolean byzantine) {
    this.nodeId = nb.allocateNodeId();
    if (this.nodeId < 0) {
      throw new IllegalArgumentException("bad nodeId:" + nodeId);
    }
    this.name = nb.getName(nodeId);
    this.byzantine = byzantine;
  }

  public Node(NodeBuilder nb) {
    this(nb, false);
  }

  public long getMsgReceived() {
    return msgReceived;
  }

  public long getMsgSent() {
    return msgSent;
  }

  public long getDoneAt() {
    return doneAt;
  }

  @Override
  public String toString() {
    return "Node{" + "nodeId=" + nodeId + ", name=" + name + '}';
  }
}
