package net.consensys.hotstuff.core;

/** One-way delay, in milliseconds, between two nodes of the network. */
@SuppressWarnings("WeakerAccess")
public abstract class NetworkLatency {
  /** @param delta - a random number in [0, 99] drawn by the network for each envelope */
  protected abstract int getExtendedLatency(Node from, Node to, int delta);

  @Override
  public String toString() {
    return this.getClass().getSimpleName();
  }

  protected void checkDelta(int delta) {
    if (delta < 0 || delta > 99) {
      throw new IllegalArgumentException("delta=" + delta);
    }
  }

  /** Never less than 1ms: a message can't arrive at the time it was sent. */
  protected int getLatency(Node from, Node to, int delta) {
    checkDelta(delta);
    if (from == to) {
      return 1;
    }
    return Math.max(1, getExtendedLatency(from, to, delta));
  }

  /**
   * The same latency for every link. With this model the network delivers a broadcast to all its
   * destinations before the next broadcast.
   */
  public static class NetworkFixedLatency extends NetworkLatency {
    final int fixedLatency;

    public NetworkFixedLatency(int fixedLatency) {
      this.fixedLatency = Math.max(1, fixedLatency);
    }

    @Override
    public int getExtendedLatency(Node from, Node to, int delta) {
      return fixedLatency;
    }

    @Override
    public String toString() {
      return "fixedLatency:" + fixedLatency;
    }
  }

  /**
   * Uniformly distributed between 0 and maxLatency. Shuffles the delivery order, so a test can
   * check that a result does not depend on it.
   */
  public static class NetworkUniformLatency extends NetworkLatency {
    final int maxLatency;

    public NetworkUniformLatency(int maxLatency) {
      this.maxLatency = Math.max(1, maxLatency);
    }

    @Override
    public int getExtendedLatency(Node from, Node to, int delta) {
      return (int) ((delta / 99.0) * maxLatency);
    }

    @Override
    public String toString() {
      return "NetworkUniformLatency:" + maxLatency;
    }
  }
}
