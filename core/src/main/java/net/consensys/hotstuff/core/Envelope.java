package net.consensys.hotstuff.core;

import net.consensys.hotstuff.core.messages.Message;

/**
 * A message in transit to a single destination. Envelopes are ordered by arrival time, then by the
 * order in which they were posted: a message sent to several nodes is posted for all of them
 * before the next message is posted, so at equal latency every node sees the same order.
 */
public final class Envelope<TN extends Node> implements Comparable<Envelope<?>> {
  private final Message<TN> message;
  private final TN from;
  private final TN to;
  private final int arrivalTime;
  private final long seq;

  Envelope(Message<TN> message, TN from, TN to, int arrivalTime, long seq) {
    this.message = message;
    this.from = from;
    this.to = to;
    this.arrivalTime = arrivalTime;
    this.seq = seq;
  }

  public Message<TN> getMessage() {
    return message;
  }

  public TN getFrom() {
    return from;
  }

  public TN getTo() {
    return to;
  }

  public int getArrivalTime() {
    return arrivalTime;
  }

  @Override
  public int compareTo(Envelope<?> o) {
    int c = Integer.compare(arrivalTime, o.arrivalTime);
    return c != 0 ? c : Long.compare(seq, o.seq);
  }

  @Override
  public String toString() {
    return "Envelope{"
        + "message="
        + message
        + ", from="
        + from.name
        + ", to="
        + to.name
        + ", arrivalTime="
        + arrivalTime
        + '}';
  }
}
