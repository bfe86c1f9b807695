package net.consensys.hotstuff.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.PriorityQueue;
import java.util.Random;
import net.consensys.hotstuff.core.messages.Message;

/**
 * There is a single network for a simulation.
 *
 * <p>Nothing is executed in parallel, so the code does not have to be multithread safe. Messages
 * are delivered one at a time, in arrival time order; messages arriving at the same millisecond
 * are delivered in the order they were sent.
 */
@SuppressWarnings({"WeakerAccess", "UnusedReturnValue"})
public class Network<TN extends Node> {

  /** The messages in transit. Sorted by their arrival time. */
  public final PriorityQueue<Envelope<TN>> msgs = new PriorityQueue<>();

  /**
   * Internal variable. Nodes id are sequential & start at zero, so we can we index them in an
   * array.
   */
  public final List<TN> allNodes = new ArrayList<>();

  /** By using a single random generator, we have repeatable runs. */
  public final Random rd = new Random(0);

  /** The network latency. By default all messages take 1ms. */
  public NetworkLatency networkLatency = new NetworkLatency.NetworkFixedLatency(1);

  /** Time in ms. */
  public int time = 0;

  /** Incremented for each envelope posted, to keep the sending order between equal arrivals. */
  private long envelopeSeq = 0;

  public TN getNodeById(int id) {
    if (id < 0 || id >= allNodes.size()) {
      throw new IllegalArgumentException("No node with id " + id);
    }
    return allNodes.get(id);
  }

  public TN getNodeByName(String name) {
    for (TN n : allNodes) {
      if (n.name.equals(name)) {
        return n;
      }
    }
    throw new IllegalArgumentException("No node named " + name);
  }

  public void addNode(TN node) {
    while (allNodes.size() <= node.nodeId) {
      allNodes.add(null);
    }
    if (allNodes.get(node.nodeId) != null) {
      throw new IllegalStateException("There is already a node with this id (" + node.nodeId + ")");
    }
    allNodes.set(node.nodeId, node);
  }

  public Network<TN> setNetworkLatency(NetworkLatency networkLatency) {
    if (!msgs.isEmpty()) {
      throw new IllegalStateException(
          "You can't change the latency while the system as on going messages");
    }
    this.networkLatency = networkLatency;
    return this;
  }

  public boolean hasMessage() {
    return !msgs.isEmpty();
  }

  /** Send a message to all nodes, the sender included. */
  public void sendAll(Message<TN> m, TN fromNode) {
    send(m, fromNode, allNodes);
  }

  public void send(Message<TN> m, TN fromNode, TN toNode) {
    send(m, fromNode, Collections.singletonList(toNode));
  }

  /**
   * Send a message to a collection of nodes. The message is considered as sent immediately, and
   * will arrive at a time depending on the network latency.
   */
  public void send(Message<TN> m, TN fromNode, List<TN> dests) {
    checkInNetwork(fromNode);
    for (TN to : dests) {
      checkInNetwork(to);
      int arrival = time + networkLatency.getLatency(fromNode, to, rd.nextInt(100));
      fromNode.msgSent++;
      msgs.add(new Envelope<>(m, fromNode, to, arrival, envelopeSeq++));
    }
  }

  private void checkInNetwork(TN n) {
    if (n.nodeId >= allNodes.size() || allNodes.get(n.nodeId) != n) {
      throw new IllegalArgumentException("The node is not in the network: " + n);
    }
  }

  /**
   * Deliver all the messages arriving in the next ms milliseconds, including the messages sent
   * while doing so.
   *
   * @return true if at least one message was delivered.
   */
  public boolean runMs(int ms) {
    if (ms <= 0) {
      throw new IllegalArgumentException("Should be greater than 0. ms=" + ms);
    }
    int endAt = time + ms;
    if (endAt <= 0) {
      throw new IllegalStateException("Maximum time reached!");
    }

    boolean didSomething = false;
    while (!msgs.isEmpty() && msgs.peek().getArrivalTime() <= endAt) {
      Envelope<TN> e = msgs.poll();
      if (e.getArrivalTime() < time) {
        throw new IllegalStateException("time:" + time + ", arrival in the past: " + e);
      }
      time = e.getArrivalTime();
      e.getTo().msgReceived++;
      e.getMessage().action(this, e.getFrom(), e.getTo());
      didSomething = true;
    }
    time = endAt;
    return didSomething;
  }

  /**
   * Run until there is no message in transit.
   *
   * @param maxMs - the maximum simulated duration; the network must be idle before.
   * @return the time spent, in ms.
   */
  public int runUntilIdle(int maxMs) {
    int start = time;
    while (!msgs.isEmpty()) {
      int next = msgs.peek().getArrivalTime();
      if (next - start > maxMs) {
        throw new IllegalStateException(
            "Network still busy after " + maxMs + "ms, " + msgs.size() + " messages in transit");
      }
      runMs(Math.max(1, next - time));
    }
    return time - start;
  }
}
