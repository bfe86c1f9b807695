package net.consensys.hotstuff.core;

import java.util.ArrayList;
import java.util.List;

/** Allocates the node ids of a network, in sequence, and names the nodes. */
@SuppressWarnings("WeakerAccess")
public class NodeBuilder {
  /** Names are single letters while we have letters, then Node26, Node27... */
  private static final int LETTERS = 26;

  /** Last node id allocated. */
  private int nodeIds = 0;

  int allocateNodeId() {
    return nodeIds++;
  }

  /** The name the node with this id will get. */
  public String getName(int nodeId) {
    if (nodeId < 0) {
      throw new IllegalArgumentException("bad nodeId:" + nodeId);
    }
    return nodeId < LETTERS ? String.valueOf((char) ('A' + nodeId)) : "Node" + nodeId;
  }

  /** The names of the first nodeCount nodes, in node id order. */
  public List<String> getNames(int nodeCount) {
    List<String> res = new ArrayList<>(nodeCount);
    for (int i = 0; i < nodeCount; i++) {
      res.add(getName(i));
    }
    return res;
  }
}
