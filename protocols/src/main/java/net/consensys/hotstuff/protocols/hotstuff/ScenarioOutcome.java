package net.consensys.hotstuff.protocols.hotstuff;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import net.consensys.hotstuff.core.json.ObjectMapperFactory;

/** The result of a run: the event log plus the final global state. */
public final class ScenarioOutcome {

  public enum Status {
    /** All the rounds were played. */
    COMPLETED,
    /** The attack has no round script: nothing was played. */
    NOT_IMPLEMENTED,
    /** A round threw an exception; the log ends with a ROUND_FAILED event. */
    FAILED
  }

  public final Status status;
  public final List<ScenarioEvent> events;
  /** The QCs formed during the attack rounds. Should be empty. */
  public final List<QuorumCertificate> attackRoundQcs;
  /** The evidence collected by all the nodes. */
  public final Set<EquivocationEvidence> evidence;
  /** The committed blocks, per validator. */
  public final Map<String, List<String>> commitLogs;
  /** True if QCs were formed for two conflicting proposals of the same view. */
  public final boolean safetyViolation;

  ScenarioOutcome(
      Status status,
      List<ScenarioEvent> events,
      List<QuorumCertificate> attackRoundQcs,
      Set<EquivocationEvidence> evidence,
      Map<String, List<String>> commitLogs,
      boolean safetyViolation) {
    this.status = status;
    this.events = Collections.unmodifiableList(new ArrayList<>(events));
    this.attackRoundQcs = Collections.unmodifiableList(new ArrayList<>(attackRoundQcs));
    this.evidence = Collections.unmodifiableSet(new TreeSet<>(evidence));
    this.commitLogs = Collections.unmodifiableMap(new LinkedHashMap<>(commitLogs));
    this.safetyViolation = safetyViolation;
  }

  public List<ScenarioEvent> eventsOf(ScenarioEvent.Kind kind) {
    List<ScenarioEvent> res = new ArrayList<>();
    for (ScenarioEvent e : events) {
      if (e.kind == kind) {
        res.add(e);
      }
    }
    return res;
  }

  public boolean hasEvent(ScenarioEvent.Kind kind) {
    return !eventsOf(kind).isEmpty();
  }

  public String toJson() {
    return ObjectMapperFactory.toJson(this);
  }

  @Override
  public String toString() {
    return "ScenarioOutcome{"
        + "status="
        + status
        + ", events="
        + events.size()
        + ", attackRoundQcs="
        + attackRoundQcs
        + ", evidence="
        + evidence
        + ", commitLogs="
        + commitLogs
        + ", safetyViolation="
        + safetyViolation
        + '}';
  }
}
