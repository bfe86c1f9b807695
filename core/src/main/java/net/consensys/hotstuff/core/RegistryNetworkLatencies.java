package net.consensys.hotstuff.core;

import java.util.HashMap;
import java.util.Map;

public class RegistryNetworkLatencies {
  private final Map<String, NetworkLatency> registry = new HashMap<>();

  public static final RegistryNetworkLatencies singleton = new RegistryNetworkLatencies();

  public enum Type {
    FIXED,
    UNIFORM
  }

  public static String name(Type t, int latency) {
    switch (t) {
      case FIXED:
        return NetworkLatency.NetworkFixedLatency.class.getSimpleName() + "(" + latency + ")";
      case UNIFORM:
        return NetworkLatency.NetworkUniformLatency.class.getSimpleName() + "(" + latency + ")";
    }
    throw new IllegalStateException();
  }

  private RegistryNetworkLatencies() {
    for (int l : new int[] {1, 10, 50, 100, 200, 500, 1000}) {
      registry.put(name(Type.FIXED, l), new NetworkLatency.NetworkFixedLatency(l));
      registry.put(name(Type.UNIFORM, l), new NetworkLatency.NetworkUniformLatency(l));
    }
  }

  /** @param name - the registry name; null or empty means a fixed latency of 1ms. */
  public NetworkLatency getByName(String name) {
    if (name == null || name.trim().isEmpty()) {
      name = name(Type.FIXED, 1);
    }

    NetworkLatency nl = registry.get(name);
    if (nl == null) {
      throw new IllegalArgumentException(name + " not in the registry " + registry.keySet());
    }
    return nl;
  }
}
