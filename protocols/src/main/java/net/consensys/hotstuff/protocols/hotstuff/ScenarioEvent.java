package net.consensys.hotstuff.protocols.hotstuff;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Something that happened during a run, as data. The payload keys depend on the kind; rendering
 * is left to the caller.
 */
public final class ScenarioEvent {

  public enum Kind {
    PHASE,
    LEADER,
    PROPOSAL_SENT,
    VOTE_CAST,
    NO_QUORUM,
    UNEXPECTED_QC,
    SAFETY_VIOLATION,
    EVIDENCE,
    VIEW_CHANGE,
    COMMITTED,
    COMMIT_FAILED,
    COMMIT_LOG,
    NOT_IMPLEMENTED,
    ROUND_FAILED,
    COMPLETE
  }

  /** A hint for the presentation layer. */
  public enum Severity {
    INFO,
    SUCCESS,
    WARNING,
    ERROR
  }

  public final int seq;
  public final int view;
  public final Kind kind;
  public final Severity severity;
  public final Map<String, Object> payload;

  ScenarioEvent(int seq, int view, Kind kind, Severity severity, Map<String, Object> payload) {
    this.seq = seq;
    this.view = view;
    this.kind = kind;
    this.severity = severity;
    this.payload = Collections.unmodifiableMap(new LinkedHashMap<>(payload));
  }

  /** @return the payload value, null if absent. */
  @SuppressWarnings("unchecked")
  public <T> T get(String key) {
    return (T) payload.get(key);
  }

  @Override
  public String toString() {
    return "#" + seq + " v" + view + " " + severity + " " + kind + " " + payload;
  }
}
