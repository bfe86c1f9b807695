package net.consensys.hotstuff.protocols.hotstuff;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Consumer;
import net.consensys.hotstuff.core.Network;
import net.consensys.hotstuff.core.Node;
import net.consensys.hotstuff.core.NodeBuilder;
import net.consensys.hotstuff.core.Protocol;
import net.consensys.hotstuff.core.RegistryNetworkLatencies;
import net.consensys.hotstuff.core.WParameters;
import net.consensys.hotstuff.core.json.ObjectMapperFactory;
import net.consensys.hotstuff.core.messages.Message;
import net.consensys.hotstuff.protocols.hotstuff.ScenarioEvent.Kind;
import net.consensys.hotstuff.protocols.hotstuff.ScenarioEvent.Severity;

/**
 * The safety core of HotStuff under a byzantine leader: a single proposal per view, votes
 * broadcast to every validator, quorum certificates of 2f+1 votes, equivocation evidence and
 * commit on QC.
 *
 * <p>A run is a script of rounds. For the equivocation attack the faulty leader sends a block X to
 * half of the validators and a block Y to the other half in view 1. With N=3f+1 neither half can
 * reach 2f+1 votes, so no QC is formed. Then the view changes, the next validator proposes Z to
 * everybody, the QC is formed and every validator commits Z.
 *
 * <p>Votes are messages on the simulated network: a validator receiving a proposal signs a vote
 * and sends it to every validator, itself included. Each validator keeps its own {@link
 * ReplicaState}. Signatures are not verified.
 */
public class HotStuff implements Protocol {
  /** A round must be over after this simulated time. */
  static final int MAX_ROUND_MS = 60_000;

  final HotStuffParameters params;
  private final Network<HotStuffNode> network = new Network<>();
  private final NodeBuilder nb = new NodeBuilder();
  private final List<String> validatorIds;

  // The state of the current run
  private final List<ScenarioEvent> events = new ArrayList<>();
  private final List<QuorumCertificate> attackRoundQcs = new ArrayList<>();
  private Consumer<ScenarioEvent> listener = e -> {};
  private boolean played = false;
  private boolean safetyViolation = false;
  private int view = 0;
  private HotStuffNode leader;

  public HotStuff(HotStuffParameters params) {
    params.validate();
    this.params = params;
    this.validatorIds = nb.getNames(params.validatorCount);
    this.network.setNetworkLatency(
        RegistryNetworkLatencies.singleton.getByName(params.networkLatencyName));
  }

  /** Sent by the leader to the validators it chose for this block. */
  static class Propose extends Message<HotStuffNode> {
    final Proposal proposal;

    Propose(Proposal proposal) {
      this.proposal = proposal;
    }

    @Override
    public void action(Network<HotStuffNode> network, HotStuffNode from, HotStuffNode to) {
      to.onPropose(proposal);
    }
  }

  /** Sent by a voter to all the validators. */
  static class VoteMessage extends Message<HotStuffNode> {
    final Vote vote;

    VoteMessage(Vote vote) {
      this.vote = vote;
    }

    @Override
    public void action(Network<HotStuffNode> network, HotStuffNode from, HotStuffNode to) {
      to.onVote(vote);
    }
  }

  public class HotStuffNode extends Node {
    final ReplicaState state;

    HotStuffNode(boolean byzantine) {
      super(nb, byzantine);
      this.state = new ReplicaState(name);
    }

    /** An honest validator votes once for each proposal it is shown. */
    void onPropose(Proposal p) {
      Vote v = Vote.cast(name, p);
      emit(Kind.VOTE_CAST, Severity.INFO, "voter", name, "proposal", p.id(), "signature", v.signature);
      network.sendAll(new VoteMessage(v), this);
    }

    void onVote(Vote v) {
      state.recordVote(v);
    }

    public ReplicaState state() {
      return state;
    }
  }

  @Override
  public Network<HotStuffNode> network() {
    return network;
  }

  @Override
  public HotStuff copy() {
    return new HotStuff(params);
  }

  @Override
  public void init() {
    if (!network.allNodes.isEmpty()) {
      throw new IllegalStateException("Already initialized, use copy() for another run");
    }
    String faulty = faultyLeader();
    for (String id : validatorIds) {
      network.addNode(new HotStuffNode(id.equals(faulty)));
    }
  }

  /** The validator ids, in the order used for the leader rotation. */
  public List<String> validatorIds() {
    return validatorIds;
  }

  /** @return the faulty leader, null if there is none. */
  public String faultyLeader() {
    return params.hasFaultyLeader() ? params.faultyLeader.trim() : null;
  }

  public HotStuffNode node(String id) {
    return network.getNodeByName(id);
  }

  /** Plays the run without listener. */
  public ScenarioOutcome run() {
    return run(e -> {});
  }

  /**
   * Plays all the rounds. Can be called only once: use copy() to start again with fresh nodes.
   *
   * @param listener - called for each event, when it happens.
   */
  public ScenarioOutcome run(Consumer<ScenarioEvent> listener) {
    if (played) {
      throw new IllegalStateException("Already played, use copy() for another run");
    }
    played = true;
    if (network.allNodes.isEmpty()) {
      init();
    }
    this.listener = listener;

    if (!params.attackType.isImplemented()) {
      return finish(
          ScenarioOutcome.Status.NOT_IMPLEMENTED,
          Kind.NOT_IMPLEMENTED,
          Severity.WARNING,
          "attack",
          params.attackType.name(),
          "message",
          "No round script for " + params.attackType + ", nothing was played");
    }

    List<RoundSpec> rounds = RoundSpec.equivocation(validatorIds, params.equivocatingVoters);
    view = 1;
    String faulty = faultyLeader();
    leader = faulty != null ? node(faulty) : network.getNodeById(0);

    for (int i = 0; i < rounds.size(); i++) {
      RoundSpec round = rounds.get(i);
      try {
        if (i > 0) {
          viewChange();
        }
        if (round.kind == RoundSpec.Kind.ATTACK) {
          playAttackRound(round);
        } else {
          playSafeRound(round);
        }
      } catch (RuntimeException e) {
        return finish(
            ScenarioOutcome.Status.FAILED,
            Kind.ROUND_FAILED,
            Severity.ERROR,
            "round",
            round.toString(),
            "error",
            String.valueOf(e));
      }
    }

    try {
      phase(Phase.COMPLETE);
    } catch (RuntimeException e) {
      return finish(
          ScenarioOutcome.Status.FAILED,
          Kind.ROUND_FAILED,
          Severity.ERROR,
          "round",
          Phase.COMPLETE.name(),
          "error",
          String.valueOf(e));
    }
    return finish(ScenarioOutcome.Status.COMPLETED, Kind.COMPLETE, Severity.INFO);
  }

  /**
   * Emits the last event of the run and builds the outcome. If the listener throws on this event,
   * the error is appended to the log without calling the listener again, and the run is FAILED.
   */
  private ScenarioOutcome finish(
      ScenarioOutcome.Status status, Kind kind, Severity severity, Object... keyValues) {
    ScenarioEvent last = record(kind, severity, keyValues);
    try {
      listener.accept(last);
    } catch (RuntimeException e) {
      record(
          Kind.ROUND_FAILED,
          Severity.ERROR,
          "round",
          "listener on " + kind,
          "error",
          String.valueOf(e));
      return outcome(ScenarioOutcome.Status.FAILED);
    }
    return outcome(status);
  }

  private void playAttackRound(RoundSpec round) {
    phase(Phase.PROPOSAL);
    announceLeader();
    List<Proposal> proposals = sendProposals(round);

    phase(Phase.VOTING);
    network.runUntilIdle(MAX_ROUND_MS);

    phase(Phase.QC_FORMATION);
    Map<String, QuorumCertificate> certified = new LinkedHashMap<>();
    Map<String, Integer> votes = new LinkedHashMap<>();
    for (Proposal p : proposals) {
      int maxVotes = 0;
      for (HotStuffNode n : network.allNodes) {
        maxVotes = Math.max(maxVotes, n.state.voteCount(p));
        QuorumCertificate qc = n.state.tryFormQC(p, params.quorum());
        if (qc != null) {
          attackRoundQcs.add(qc);
          certified.putIfAbsent(p.id(), qc);
        }
      }
      votes.put(p.id(), maxVotes);
    }

    if (certified.isEmpty()) {
      emit(
          Kind.NO_QUORUM,
          Severity.SUCCESS,
          "proposals",
          ids(proposals),
          "quorum",
          params.quorum(),
          "votes",
          votes);
    } else {
      for (QuorumCertificate qc : certified.values()) {
        emit(
            Kind.UNEXPECTED_QC,
            Severity.WARNING,
            "proposal",
            qc.proposal.id(),
            "voters",
            qc.voters,
            "quorum",
            params.quorum());
      }
      if (certified.size() > 1) {
        safetyViolation = true;
        emit(
            Kind.SAFETY_VIOLATION,
            Severity.WARNING,
            "proposals",
            new ArrayList<>(certified.keySet()),
            "quorum",
            params.quorum(),
            "validators",
            validatorIds.size());
      }
    }

    phase(Phase.EVIDENCE_REPORT);
    Set<EquivocationEvidence> evidence = collectEvidence();
    List<Map<String, Object>> report = new ArrayList<>();
    for (EquivocationEvidence e : evidence) {
      report.add(payload("accused", e.accused, "conflictA", e.conflictA, "conflictB", e.conflictB));
    }
    emit(
        Kind.EVIDENCE,
        evidence.isEmpty() ? Severity.INFO : Severity.WARNING,
        "evidence",
        report);
  }

  /** The next validator in the fixed ordering becomes the leader of the next view. */
  private void viewChange() {
    phase(Phase.VIEW_CHANGE);
    HotStuffNode previous = leader;
    view++;
    leader = network.getNodeById((previous.nodeId + 1) % network.allNodes.size());
    emit(Kind.VIEW_CHANGE, Severity.INFO, "previousLeader", previous.name, "leader", leader.name);
  }

  private void playSafeRound(RoundSpec round) {
    phase(Phase.SAFE_ROUND);
    announceLeader();
    Proposal proposal = sendProposals(round).get(0);
    network.runUntilIdle(MAX_ROUND_MS);

    phase(Phase.COMMIT);
    QuorumCertificate first = null;
    List<String> missing = new ArrayList<>();
    for (HotStuffNode n : network.allNodes) {
      QuorumCertificate qc = n.state.tryFormQC(proposal, params.quorum());
      if (qc == null) {
        missing.add(n.name);
        continue;
      }
      if (first == null) {
        first = qc;
      }
      if (n.state.applyQCCommit(qc)) {
        n.doneAt = network.time;
      }
    }

    if (missing.isEmpty()) {
      emit(
          Kind.COMMITTED,
          Severity.SUCCESS,
          "proposal",
          proposal.id(),
          "block",
          proposal.blockId,
          "voters",
          first.voters);
    } else {
      emit(
          Kind.COMMIT_FAILED,
          Severity.ERROR,
          "proposal",
          proposal.id(),
          "withoutQc",
          missing);
    }
    emit(Kind.COMMIT_LOG, Severity.INFO, "commits", commitLogs());
  }

  private void announceLeader() {
    emit(Kind.LEADER, Severity.INFO, "leader", leader.name, "byzantine", leader.byzantine);
  }

  /** No chain state is tracked: the blocks of every round extend genesis. */
  private List<Proposal> sendProposals(RoundSpec round) {
    String parent = Proposal.GENESIS;

    List<Proposal> res = new ArrayList<>();
    for (RoundSpec.ProposalTarget pt : round.proposals) {
      Proposal p = new Proposal(pt.blockId, parent, view, leader.name);
      List<HotStuffNode> dests = new ArrayList<>();
      for (String t : pt.targets) {
        dests.add(node(t));
      }
      emit(
          Kind.PROPOSAL_SENT,
          Severity.INFO,
          "proposal",
          p.id(),
          "parent",
          p.parentId,
          "proposer",
          p.proposer,
          "targets",
          pt.targets);
      network.send(new Propose(p), leader, dests);
      res.add(p);
    }
    return res;
  }

  private Set<EquivocationEvidence> collectEvidence() {
    Set<EquivocationEvidence> res = new TreeSet<>();
    for (HotStuffNode n : network.allNodes) {
      res.addAll(n.state.evidence());
    }
    return res;
  }

  private Map<String, List<String>> commitLogs() {
    Map<String, List<String>> res = new LinkedHashMap<>();
    for (HotStuffNode n : network.allNodes) {
      res.put(n.name, n.state.committed());
    }
    return res;
  }

  private ScenarioOutcome outcome(ScenarioOutcome.Status status) {
    return new ScenarioOutcome(
        status, events, attackRoundQcs, collectEvidence(), commitLogs(), safetyViolation);
  }

  private void phase(Phase p) {
    emit(Kind.PHASE, Severity.INFO, "phase", p.name());
  }

  /** Logs the event and calls the listener. A listener exception fails the current round. */
  private void emit(Kind kind, Severity severity, Object... keyValues) {
    listener.accept(record(kind, severity, keyValues));
  }

  private ScenarioEvent record(Kind kind, Severity severity, Object... keyValues) {
    ScenarioEvent e = new ScenarioEvent(events.size(), view, kind, severity, payload(keyValues));
    events.add(e);
    return e;
  }

  private static Map<String, Object> payload(Object... keyValues) {
    if (keyValues.length % 2 != 0) {
      throw new IllegalArgumentException("keys and values should come by pairs");
    }
    Map<String, Object> res = new LinkedHashMap<>();
    for (int i = 0; i < keyValues.length; i += 2) {
      res.put((String) keyValues[i], keyValues[i + 1]);
    }
    return res;
  }

  private static List<String> ids(List<Proposal> ps) {
    Set<String> res = new LinkedHashSet<>();
    for (Proposal p : ps) {
      res.add(p.id());
    }
    return new ArrayList<>(res);
  }

  @SuppressWarnings("WeakerAccess")
  public static class HotStuffParameters extends WParameters {
    public static final String NO_FAULTY_LEADER = "None";
    public static final int MIN_VALIDATORS = 4;
    public static final int MAX_VALIDATORS = 13;

    final int validatorCount;
    final int faultBound;
    /** A validator id, or "None"/null for a run where the first validator leads. */
    final String faultyLeader;

    final AttackType attackType;
    /** Used only by the console output, to pace the display between phases. */
    final int stepDelayMs;
    /** Validators shown both conflicting blocks; they vote for both. */
    final int equivocatingVoters;

    final String networkLatencyName;

    public HotStuffParameters() {
      this(7, 2, "A", AttackType.EQUIVOCATION, 900, 0, null);
    }

    public HotStuffParameters(
        int validatorCount, int faultBound, String faultyLeader, AttackType attackType) {
      this(validatorCount, faultBound, faultyLeader, attackType, 0, 0, null);
    }

    public HotStuffParameters(
        int validatorCount,
        int faultBound,
        String faultyLeader,
        AttackType attackType,
        int stepDelayMs,
        int equivocatingVoters,
        String networkLatencyName) {
      this.validatorCount = validatorCount;
      this.faultBound = faultBound;
      this.faultyLeader = faultyLeader;
      this.attackType = attackType;
      this.stepDelayMs = stepDelayMs;
      this.equivocatingVoters = equivocatingVoters;
      this.networkLatencyName = networkLatencyName;
    }

    /** 2f+1 */
    public int quorum() {
      return 2 * faultBound + 1;
    }

    /** floor((n-1)/3): the largest f such as n >= 3f+1 */
    public static int maxFaultBound(int validatorCount) {
      return (validatorCount - 1) / 3;
    }

    boolean hasFaultyLeader() {
      return faultyLeader != null
          && !faultyLeader.trim().isEmpty()
          && !NO_FAULTY_LEADER.equalsIgnoreCase(faultyLeader.trim());
    }

    @Override
    public void validate() {
      if (validatorCount < MIN_VALIDATORS || validatorCount > MAX_VALIDATORS) {
        throw new IllegalArgumentException(
            "validatorCount="
                + validatorCount
                + ", should be between "
                + MIN_VALIDATORS
                + " and "
                + MAX_VALIDATORS);
      }
      if (faultBound < 0 || faultBound > maxFaultBound(validatorCount)) {
        throw new IllegalArgumentException(
            "faultBound="
                + faultBound
                + ", should be between 0 and "
                + maxFaultBound(validatorCount)
                + " for "
                + validatorCount
                + " validators");
      }
      if (quorum() > validatorCount) {
        throw new IllegalArgumentException(
            "quorum=" + quorum() + " greater than validatorCount=" + validatorCount);
      }
      if (attackType == null) {
        throw new IllegalArgumentException("attackType is missing");
      }
      if (stepDelayMs < 0) {
        throw new IllegalArgumentException("stepDelayMs=" + stepDelayMs);
      }
      int maxDoubleVoters = validatorCount - validatorCount / 2;
      if (equivocatingVoters < 0 || equivocatingVoters > maxDoubleVoters) {
        throw new IllegalArgumentException(
            "equivocatingVoters=" + equivocatingVoters + ", max is " + maxDoubleVoters);
      }
      if (hasFaultyLeader()) {
        List<String> ids = new NodeBuilder().getNames(validatorCount);
        if (!ids.contains(faultyLeader.trim())) {
          throw new IllegalArgumentException(
              "faultyLeader=" + faultyLeader + " is not one of " + ids);
        }
      }
    }

    public static HotStuffParameters fromJson(InputStream is) {
      return ObjectMapperFactory.readParameters(is, HotStuffParameters.class);
    }
  }

  private static void pause(int ms) {
    if (ms <= 0) {
      return;
    }
    try {
      Thread.sleep(ms);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while pacing the output", e);
    }
  }

  /** Plays a run and prints the events. The optional argument is a json parameters file. */
  public static void main(String... args) {
    HotStuffParameters params;
    if (args.length > 0) {
      try (InputStream is = Files.newInputStream(Paths.get(args[0]))) {
        params = HotStuffParameters.fromJson(is);
      } catch (IOException e) {
        throw new UncheckedIOException(e);
      }
    } else {
      params = new HotStuffParameters();
    }

    HotStuff hs = new HotStuff(params);
    hs.init();
    System.out.println(
        "Validators "
            + hs.validatorIds()
            + ", faulty leader="
            + hs.faultyLeader()
            + ", quorum="
            + params.quorum()
            + ", attack="
            + params.attackType);

    ScenarioOutcome res =
        hs.run(
            e -> {
              if (e.kind == Kind.PHASE) {
                pause(params.stepDelayMs);
              }
              System.out.println(e);
            });
    System.out.println(res);
    for (HotStuffNode n : hs.network().allNodes) {
      System.out.println(
          n.name
              + ": msgSent="
              + n.getMsgSent()
              + ", msgReceived="
              + n.getMsgReceived()
              + ", doneAt="
              + n.getDoneAt());
    }
  }

  @Override
  public String toString() {
    return "HotStuff{" + "params=" + params + '}';
  }
}
