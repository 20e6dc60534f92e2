package ai.bombbuster.belief;

import ai.bombbuster.action.ActionContext;
import ai.bombbuster.action.ActionRecord;
import ai.bombbuster.action.ActionValidator;
import ai.bombbuster.action.AdjacentSignalRecord;
import ai.bombbuster.action.CallRecord;
import ai.bombbuster.action.CopyCountSignalRecord;
import ai.bombbuster.action.DoubleRevealRecord;
import ai.bombbuster.action.HasValueRecord;
import ai.bombbuster.action.InvalidActionException;
import ai.bombbuster.action.NotPresentRecord;
import ai.bombbuster.action.RevealRecord;
import ai.bombbuster.action.SignalRecord;
import ai.bombbuster.action.SwapRecord;
import ai.bombbuster.game.AdjacentConstraint;
import ai.bombbuster.game.CandidateSet;
import ai.bombbuster.game.CopyCountConstraint;
import ai.bombbuster.game.GameConfig;
import ai.bombbuster.game.SlotKey;
import ai.bombbuster.game.ValueDomain;
import ai.bombbuster.game.ValueTracker;
import ai.bombbuster.solver.GlobalConsistencySolver;
import ai.bombbuster.solver.PlayerProblem;
import ai.bombbuster.solver.ResourceVector;
import ai.bombbuster.solver.SolveResult;
import ai.bombbuster.solver.SolverException;
import ai.bombbuster.solver.SolverInput;
import ai.bombbuster.solver.SolverTimeoutException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One player's private knowledge of every hand in the game.
 * <p>
 * <strong>Model:</strong>
 * <ul>
 *   <li><strong>Grid:</strong> a candidate mask per (player, position). The owner's own slots are
 *       pinned to their true values for the whole game.</li>
 *   <li><strong>Trackers:</strong> one {@link ValueTracker} per value, recording which copies are
 *       revealed, deduced or known to be held.</li>
 *   <li><strong>Slot constraints:</strong> copy-count and adjacent signals per player.</li>
 * </ul>
 * <p>
 * <strong>Updates:</strong> every public event goes through a {@code process*} method. The record
 * is validated first ({@link InvalidActionException} leaves the state untouched), then translated
 * into direct grid and tracker edits, then {@link #applyFilters()} propagates the consequences.
 * <p>
 * <strong>Propagation:</strong> the local filters (ordering, distance, subset, threshold, slot
 * constraints) run to a fixed point and always run. When a {@link GlobalConsistencySolver} is
 * attached it refines the result exactly; a timeout or worker failure only costs precision.
 * Contradictions are logged and visible through {@link #isConsistent()}.
 * <p>
 * Instances are not thread-safe; each belongs to one player and is fed from one thread.
 * Simulations work on {@link #copy()}.
 */
public class BeliefState implements ActionContext {
    private static final Logger log = LoggerFactory.getLogger(BeliefState.class);

    private final GameConfig config;
    private final ValueDomain domain;
    private final int owner;
    private final int players;
    private final int handSize;
    private final long[][] grid;
    private final ValueTracker[] trackers;
    private final List<List<CopyCountConstraint>> copyCountConstraints;
    private final List<List<AdjacentConstraint>> adjacentConstraints;
    private final FilterSettings settings;
    private final GlobalConsistencySolver solver;
    private final List<BeliefFilter> filters;

    /**
     * Local-filter-only belief state with default settings.
     *
     * @see #BeliefState(GameConfig, int, List, FilterSettings, GlobalConsistencySolver)
     */
    public BeliefState(GameConfig config, int owner, List<Double> ownHand) {
        this(config, owner, ownHand, FilterSettings.DEFAULTS, null);
    }

    /**
     * Creates the belief state of {@code owner} at the start of a game.
     *
     * @param config the game
     * @param owner player id of the observer
     * @param ownHand the observer's sorted hand
     * @param settings local filter tuning
     * @param solver global solver, or {@code null} for local filters only
     * @throws IllegalArgumentException if the owner id or hand does not fit the game
     */
    public BeliefState(GameConfig config, int owner, List<Double> ownHand, FilterSettings settings,
                       GlobalConsistencySolver solver) {
        this(config, owner, settings, solver);
        Objects.requireNonNull(ownHand, "ownHand");
        if (ownHand.size() != handSize) {
            throw new IllegalArgumentException("Own hand has " + ownHand.size() + " wires, expected " + handSize);
        }
        int[] counts = new int[domain.size()];
        double previous = Double.NEGATIVE_INFINITY;
        for (int pos = 0; pos < handSize; pos++) {
            double value = Objects.requireNonNull(ownHand.get(pos), "ownHand[" + pos + "]");
            int rank = domain.requireRank(value);
            if (value < previous) {
                throw new IllegalArgumentException("Own hand must be sorted: " + ownHand);
            }
            if (++counts[rank] > domain.copies(rank)) {
                throw new IllegalArgumentException("Own hand holds more copies of " + ValueDomain.format(value)
                        + " than exist");
            }
            previous = value;
            grid[owner][pos] = Masks.bit(rank);
            trackers[rank].addCertain(owner, pos);
        }
        long full = domain.fullMask();
        for (int player = 0; player < players; player++) {
            if (player != owner) {
                for (int pos = 0; pos < handSize; pos++) {
                    grid[player][pos] = full;
                }
            }
        }
        applyFilters();
    }

    private BeliefState(GameConfig config, int owner, FilterSettings settings, GlobalConsistencySolver solver) {
        this.config = Objects.requireNonNull(config, "config");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.solver = solver;
        this.domain = config.getDomain();
        this.players = config.getPlayers();
        this.handSize = config.getHandSize();
        if (owner < 0 || owner >= players) {
            throw new IllegalArgumentException("Owner " + owner + " is not a player of a " + players + "-player game");
        }
        this.owner = owner;
        this.grid = new long[players][handSize];
        this.trackers = new ValueTracker[domain.size()];
        for (int rank = 0; rank < domain.size(); rank++) {
            trackers[rank] = new ValueTracker(domain.value(rank), domain.copies(rank));
        }
        this.copyCountConstraints = new ArrayList<>(players);
        this.adjacentConstraints = new ArrayList<>(players);
        for (int player = 0; player < players; player++) {
            copyCountConstraints.add(new ArrayList<>());
            adjacentConstraints.add(new ArrayList<>());
        }
        this.filters = List.of(
                new OrderingFilter(),
                new DistanceFilter(),
                new SubsetCardinalityFilter(settings.subsetMaxSize()),
                new ThresholdFilter(),
                new SlotConstraintFilter());
    }

    /**
     * Creates a belief state and replays a history of public events in order.
     *
     * @throws InvalidActionException if a record of the history is rejected
     */
    public static BeliefState fromHistory(GameConfig config, int owner, List<Double> ownHand, FilterSettings settings,
                                          GlobalConsistencySolver solver, List<? extends ActionRecord> history) {
        BeliefState state = new BeliefState(config, owner, ownHand, settings, solver);
        for (ActionRecord action : history) {
            state.process(action);
        }
        return state;
    }

    /**
     * Rebuilds a belief state from saved parts without re-running any filter, so the result is
     * set-equal to what was saved.
     *
     * @param beliefs candidate sets indexed {@code [player][position]}
     * @param savedTrackers one tracker per value of the domain
     * @param copyCounts copy-count constraints per player (may be empty)
     * @param adjacents adjacent constraints per player (may be empty)
     * @throws IllegalArgumentException if the parts do not fit the game
     */
    public static BeliefState restore(GameConfig config, int owner, List<List<CandidateSet>> beliefs,
                                      Collection<ValueTracker> savedTrackers,
                                      Map<Integer, List<CopyCountConstraint>> copyCounts,
                                      Map<Integer, List<AdjacentConstraint>> adjacents,
                                      FilterSettings settings, GlobalConsistencySolver solver) {
        BeliefState state = new BeliefState(config, owner, settings, solver);
        if (beliefs.size() != state.players) {
            throw new IllegalArgumentException("Beliefs cover " + beliefs.size() + " players, expected " + state.players);
        }
        for (int player = 0; player < state.players; player++) {
            List<CandidateSet> row = beliefs.get(player);
            if (row == null || row.size() != state.handSize) {
                throw new IllegalArgumentException("Beliefs for player " + player + " must have " + state.handSize
                        + " slots");
            }
            for (int pos = 0; pos < state.handSize; pos++) {
                state.grid[player][pos] = row.get(pos).mask();
            }
        }
        for (ValueTracker saved : savedTrackers) {
            int rank = state.domain.requireRank(saved.getValue());
            if (saved.getTotal() != state.domain.copies(rank)) {
                throw new IllegalArgumentException("Tracker for " + ValueDomain.format(saved.getValue()) + " has total "
                        + saved.getTotal() + " but the game has " + state.domain.copies(rank) + " copies");
            }
            state.trackers[rank] = saved.copy();
        }
        copyCounts.forEach((player, list) -> {
            state.requireRestoredPlayer(player);
            for (CopyCountConstraint constraint : list) {
                state.requireRestoredPosition(player, constraint.position());
            }
            state.copyCountConstraints.get(player).addAll(list);
        });
        adjacents.forEach((player, list) -> {
            state.requireRestoredPlayer(player);
            for (AdjacentConstraint constraint : list) {
                state.requireRestoredPosition(player, constraint.left());
                state.requireRestoredPosition(player, constraint.right());
            }
            state.adjacentConstraints.get(player).addAll(list);
        });
        return state;
    }

    private void requireRestoredPlayer(int player) {
        if (player < 0 || player >= players) {
            throw new IllegalArgumentException("Constraints name player " + player + ", expected 0.." + (players - 1));
        }
    }

    private void requireRestoredPosition(int player, int position) {
        if (position < 0 || position >= handSize) {
            throw new IllegalArgumentException("Constraint on player " + player + " names position " + position);
        }
    }

    /**
     * Deep copy sharing the configuration and the solver (and through it the signature cache).
     */
    public BeliefState copy() {
        return copyWith(solver);
    }

    /**
     * Deep copy that uses another solver, e.g. {@link GlobalConsistencySolver#sequential()} for
     * simulations already running on worker threads.
     */
    public BeliefState copyWith(GlobalConsistencySolver otherSolver) {
        BeliefState clone = new BeliefState(config, owner, settings, otherSolver);
        for (int player = 0; player < players; player++) {
            System.arraycopy(grid[player], 0, clone.grid[player], 0, handSize);
            clone.copyCountConstraints.get(player).addAll(copyCountConstraints.get(player));
            clone.adjacentConstraints.get(player).addAll(adjacentConstraints.get(player));
        }
        for (int rank = 0; rank < trackers.length; rank++) {
            clone.trackers[rank] = trackers[rank].copy();
        }
        return clone;
    }

    // ---------------------------------------------------------------------------------------------
    // Processing of public events
    // ---------------------------------------------------------------------------------------------

    /**
     * Applies any action record.
     *
     * @throws InvalidActionException if the record is rejected
     */
    public void process(ActionRecord action) {
        if (action instanceof CallRecord call) {
            processCall(call);
        } else if (action instanceof DoubleRevealRecord doubleReveal) {
            processDoubleReveal(doubleReveal);
        } else if (action instanceof SignalRecord signal) {
            processSignal(signal);
        } else if (action instanceof RevealRecord reveal) {
            processReveal(reveal);
        } else if (action instanceof NotPresentRecord notPresent) {
            processNotPresent(notPresent);
        } else if (action instanceof HasValueRecord hasValue) {
            processHasValue(hasValue);
        } else if (action instanceof CopyCountSignalRecord copyCount) {
            processCopyCountSignal(copyCount);
        } else if (action instanceof AdjacentSignalRecord adjacent) {
            processAdjacentSignal(adjacent);
        } else if (action instanceof SwapRecord swap) {
            processSwap(swap);
        } else {
            ActionValidator.validate(action, this);
        }
    }

    /**
     * A call: success reveals the target slot (and the caller's slot when known); failure removes
     * the value from the target slot and marks the caller as holding it.
     */
    public void processCall(CallRecord call) {
        ActionValidator.validate(call, this);
        int rank = domain.requireRank(call.value());
        if (call.success()) {
            pin(call.target(), call.position(), rank);
            trackers[rank].addRevealed(call.target(), call.position());
            if (call.callerPosition() != null) {
                pin(call.caller(), call.callerPosition(), rank);
                trackers[rank].addRevealed(call.caller(), call.callerPosition());
            }
        } else {
            exclude(call.target(), call.position(), rank);
            if (call.caller() != owner) {
                trackers[rank].addCalled(call.caller());
            }
        }
        if (log.isDebugEnabled()) {
            log.debug("Player {} processed {}", owner, call);
        }
        applyFilters();
    }

    /** The last two copies of a value were revealed from one hand. */
    public void processDoubleReveal(DoubleRevealRecord record) {
        ActionValidator.validate(record, this);
        int rank = domain.requireRank(record.value());
        pin(record.player(), record.position1(), rank);
        pin(record.player(), record.position2(), rank);
        trackers[rank].addRevealed(record.player(), record.position1());
        trackers[rank].addRevealed(record.player(), record.position2());
        applyFilters();
    }

    /** A player announced the value at one of their slots. */
    public void processSignal(SignalRecord signal) {
        ActionValidator.validate(signal, this);
        int rank = domain.requireRank(signal.value());
        pin(signal.player(), signal.position(), rank);
        trackers[rank].addCertain(signal.player(), signal.position());
        applyFilters();
    }

    /** A wire was turned face up outside a call. */
    public void processReveal(RevealRecord reveal) {
        ActionValidator.validate(reveal, this);
        int rank = domain.requireRank(reveal.value());
        pin(reveal.player(), reveal.position(), rank);
        trackers[rank].addRevealed(reveal.player(), reveal.position());
        applyFilters();
    }

    /** A value is absent from a hand, or from one slot. */
    public void processNotPresent(NotPresentRecord record) {
        ActionValidator.validate(record, this);
        int rank = domain.requireRank(record.value());
        if (record.position() != null) {
            exclude(record.player(), record.position(), rank);
        } else {
            for (int pos = 0; pos < handSize; pos++) {
                exclude(record.player(), pos, rank);
            }
        }
        applyFilters();
    }

    /** A player holds a value somewhere. */
    public void processHasValue(HasValueRecord record) {
        ActionValidator.validate(record, this);
        if (record.player() != owner) {
            trackers[domain.requireRank(record.value())].addCalled(record.player());
        }
        applyFilters();
    }

    /** The value at a slot has a given total copy count. */
    public void processCopyCountSignal(CopyCountSignalRecord record) {
        ActionValidator.validate(record, this);
        CopyCountConstraint constraint = new CopyCountConstraint(record.position(), record.copyCount());
        List<CopyCountConstraint> constraints = copyCountConstraints.get(record.player());
        if (!constraints.contains(constraint)) {
            constraints.add(constraint);
        }
        grid[record.player()][record.position()] &= domain.maskWithCopies(record.copyCount());
        applyFilters();
    }

    /** Two neighbouring slots hold equal or different values. */
    public void processAdjacentSignal(AdjacentSignalRecord record) {
        ActionValidator.validate(record, this);
        AdjacentConstraint constraint = AdjacentConstraint.between(record.position1(), record.position2(),
                record.equal());
        List<AdjacentConstraint> constraints = adjacentConstraints.get(record.player());
        if (!constraints.contains(constraint)) {
            constraints.add(constraint);
        }
        applyFilters();
    }

    /**
     * Two players exchanged a wire each.
     * <p>
     * Candidate sets travel with their wires. Tracker entries of both hands are re-indexed through
     * {@link SwapRemap}; a certain copy on a swapped wire follows it into the other hand. A player
     * who gave away a wire that could carry a value they were known to hold loses that knowledge.
     * When the observer took part, the received value is pinned and recorded.
     */
    public void processSwap(SwapRecord swap) {
        ActionValidator.validate(swap, this);
        int p1 = swap.player1();
        int p2 = swap.player2();
        int init1 = swap.initPosition1();
        int init2 = swap.initPosition2();
        int fin1 = swap.landingPosition1();
        int fin2 = swap.landingPosition2();

        long given1 = grid[p1][init1];
        long given2 = grid[p2][init2];
        Double known1 = p1 == owner ? swap.receivedValue1() : null;
        Double known2 = p2 == owner ? swap.receivedValue2() : null;
        long incoming1 = known1 != null ? Masks.bit(domain.requireRank(known1)) : given2;
        long incoming2 = known2 != null ? Masks.bit(domain.requireRank(known2)) : given1;

        SlotKey from1 = new SlotKey(p1, init1);
        SlotKey from2 = new SlotKey(p2, init2);
        for (int rank = 0; rank < trackers.length; rank++) {
            ValueTracker tracker = trackers[rank];
            boolean movedFrom1 = tracker.removeCertain(from1);
            boolean movedFrom2 = tracker.removeCertain(from2);
            tracker.remapSlots(slot -> {
                if (slot.player() == p1) {
                    return new SlotKey(p1, SwapRemap.remap(slot.position(), init1, fin1));
                }
                if (slot.player() == p2) {
                    return new SlotKey(p2, SwapRemap.remap(slot.position(), init2, fin2));
                }
                return slot;
            });
            if (movedFrom1 && known2 == null) {
                tracker.placeCertain(new SlotKey(p2, fin2));
            }
            if (movedFrom2 && known1 == null) {
                tracker.placeCertain(new SlotKey(p1, fin1));
            }
            if ((given1 & Masks.bit(rank)) != 0) {
                tracker.removeCalled(p1);
            }
            if ((given2 & Masks.bit(rank)) != 0) {
                tracker.removeCalled(p2);
            }
        }

        reinsert(p1, init1, fin1, incoming1);
        reinsert(p2, init2, fin2, incoming2);
        remapConstraints(p1, init1, fin1);
        remapConstraints(p2, init2, fin2);

        if (known1 != null) {
            trackers[domain.requireRank(known1)].addCertain(p1, fin1);
        }
        if (known2 != null) {
            trackers[domain.requireRank(known2)].addCertain(p2, fin2);
        }
        if (log.isDebugEnabled()) {
            log.debug("Player {} processed {}", owner, swap);
        }
        applyFilters();
    }

    private void reinsert(int player, int init, int fin, long incoming) {
        long[] row = grid[player];
        List<Long> slots = new ArrayList<>(handSize);
        for (int pos = 0; pos < handSize; pos++) {
            if (pos != init) {
                slots.add(row[pos]);
            }
        }
        slots.add(fin, incoming);
        for (int pos = 0; pos < handSize; pos++) {
            row[pos] = slots.get(pos);
        }
    }

    private void remapConstraints(int player, int init, int fin) {
        List<CopyCountConstraint> copyCounts = copyCountConstraints.get(player);
        List<CopyCountConstraint> remappedCounts = new ArrayList<>();
        for (CopyCountConstraint constraint : copyCounts) {
            if (constraint.position() != init) {
                remappedCounts.add(constraint.at(SwapRemap.remap(constraint.position(), init, fin)));
            }
        }
        copyCounts.clear();
        copyCounts.addAll(remappedCounts);

        List<AdjacentConstraint> adjacents = adjacentConstraints.get(player);
        List<AdjacentConstraint> remappedAdjacents = new ArrayList<>();
        for (AdjacentConstraint constraint : adjacents) {
            if (constraint.left() == init || constraint.right() == init) {
                continue;
            }
            int left = SwapRemap.remap(constraint.left(), init, fin);
            int right = SwapRemap.remap(constraint.right(), init, fin);
            if (right == left + 1) {
                remappedAdjacents.add(new AdjacentConstraint(left, right, constraint.equal()));
            }
        }
        adjacents.clear();
        adjacents.addAll(remappedAdjacents);
    }

    /**
     * Hypothesis for simulations: the slot holds {@code value}. Runs the filters afterwards.
     * Meant for copies; the live state only changes through {@code process*}.
     */
    public void assume(int player, int position, double value) {
        pin(player, position, domain.requireRank(value));
        applyFilters();
    }

    /**
     * Hypothesis for simulations: the slot does not hold {@code value}. Runs the filters afterwards.
     */
    public void assumeNot(int player, int position, double value) {
        exclude(player, position, domain.requireRank(value));
        applyFilters();
    }

    private void pin(int player, int position, int rank) {
        long before = grid[player][position];
        grid[player][position] = before & Masks.bit(rank);
        if (grid[player][position] == 0L) {
            log.warn("Contradiction: {} is not a candidate at {} (candidates were {})",
                    ValueDomain.format(domain.value(rank)), new SlotKey(player, position),
                    new CandidateSet(domain, before));
        }
    }

    private void exclude(int player, int position, int rank) {
        grid[player][position] &= ~Masks.bit(rank);
        if (grid[player][position] == 0L) {
            log.warn("Contradiction: removing {} emptied {}", ValueDomain.format(domain.value(rank)),
                    new SlotKey(player, position));
        }
    }

    // ---------------------------------------------------------------------------------------------
    // Propagation
    // ---------------------------------------------------------------------------------------------

    /**
     * Runs the local filters to a fixed point, registers new deductions with the trackers and, when
     * a global solver is attached, refines the result exactly.
     *
     * @return {@code true} if any candidate set shrank
     */
    public boolean applyFilters() {
        long[][] before = snapshotGrid();
        runLocalFilters();
        if (solver != null) {
            int rounds = 0;
            while (runGlobalSolver() && ++rounds < settings.maxIterations()) {
                if (log.isDebugEnabled()) {
                    log.debug("Global round {} narrowed beliefs of player {}", rounds, owner);
                }
            }
        }
        if (!isConsistent()) {
            log.warn("Player {} holds contradictory beliefs:\n{}", owner, describe());
        }
        for (int player = 0; player < players; player++) {
            for (int pos = 0; pos < handSize; pos++) {
                if (before[player][pos] != grid[player][pos]) {
                    return true;
                }
            }
        }
        return false;
    }

    private void runLocalFilters() {
        int iteration = 0;
        boolean changed;
        do {
            changed = false;
            for (BeliefFilter filter : filters) {
                boolean filterChanged = filter.apply(this);
                if (filterChanged && log.isTraceEnabled()) {
                    log.trace("Filter {} narrowed beliefs of player {} (iteration {})", filter.name(), owner, iteration);
                }
                changed |= filterChanged;
            }
            changed |= registerDeductions();
            iteration++;
        } while (changed && iteration < settings.maxIterations());
        if (changed) {
            log.warn("Local filters still changing after {} iterations; stopping", settings.maxIterations());
        } else if (log.isDebugEnabled()) {
            log.debug("Local filters converged after {} iterations", iteration);
        }
    }

    /** Records every singleton non-owner slot that no tracker knows about yet. */
    private boolean registerDeductions() {
        boolean changed = false;
        for (int player = 0; player < players; player++) {
            if (player == owner) {
                continue;
            }
            for (int pos = 0; pos < handSize; pos++) {
                long mask = grid[player][pos];
                if (Masks.isSingleton(mask)) {
                    ValueTracker tracker = trackers[Masks.lowest(mask)];
                    if (!tracker.isRevealed(player, pos) && !tracker.isCertain(player, pos)) {
                        changed |= tracker.addCertain(player, pos);
                    }
                }
            }
        }
        return changed;
    }

    /** @return {@code true} if the solver narrowed some slot (local filters have then re-run) */
    private boolean runGlobalSolver() {
        if (!isConsistent()) {
            return false;
        }
        try {
            SolveResult result = solver.solve(toSolverInput());
            if (!result.consistent()) {
                log.warn("Global solver found the beliefs of player {} contradictory; keeping local deductions", owner);
                return false;
            }
            boolean changed = false;
            long[][] domains = result.domains();
            for (int player = 0; player < players; player++) {
                for (int pos = 0; pos < handSize; pos++) {
                    changed |= narrow(player, pos, domains[player][pos]);
                }
            }
            if (changed) {
                runLocalFilters();
            }
            return changed;
        } catch (SolverTimeoutException e) {
            log.warn("{}; falling back to local filters", e.getMessage());
        } catch (SolverException e) {
            log.warn("Global solver unavailable, falling back to local filters: {}", e.getMessage(), e);
        }
        return false;
    }

    /**
     * Snapshot of the current beliefs in the global solver's terms. Copy-count constraints are
     * folded into the slot masks; {@code min_counts} are pinned slots plus one per called value.
     */
    public SolverInput toSolverInput() {
        List<PlayerProblem> problems = new ArrayList<>(players);
        int[] deck = domain.deckVector();
        for (int player = 0; player < players; player++) {
            long[] masks = grid[player].clone();
            for (CopyCountConstraint constraint : copyCountConstraints.get(player)) {
                masks[constraint.position()] &= domain.maskWithCopies(constraint.copyCount());
            }
            int[] minCounts = new int[domain.size()];
            for (long mask : masks) {
                if (Masks.isSingleton(mask)) {
                    minCounts[Masks.lowest(mask)]++;
                }
            }
            for (int rank = 0; rank < trackers.length; rank++) {
                if (trackers[rank].isCalled(player)) {
                    minCounts[rank]++;
                }
            }
            problems.add(new PlayerProblem(player, masks, adjacentConstraints.get(player), minCounts, deck));
        }
        return new SolverInput(problems, ResourceVector.of(deck), handSize);
    }

    // ---------------------------------------------------------------------------------------------
    // Package-private access for filters
    // ---------------------------------------------------------------------------------------------

    int players() {
        return players;
    }

    int handSize() {
        return handSize;
    }

    ValueDomain domain() {
        return domain;
    }

    long mask(int player, int position) {
        return grid[player][position];
    }

    ValueTracker tracker(int rank) {
        return trackers[rank];
    }

    List<CopyCountConstraint> copyCountConstraints(int player) {
        return copyCountConstraints.get(player);
    }

    List<AdjacentConstraint> adjacentConstraints(int player) {
        return adjacentConstraints.get(player);
    }

    /**
     * Intersects a slot with {@code keep}, unless that would empty it.
     *
     * @return {@code true} if the slot shrank
     */
    boolean narrow(int player, int position, long keep) {
        long current = grid[player][position];
        long next = current & keep;
        if (next == current || next == 0L) {
            return false;
        }
        grid[player][position] = next;
        return true;
    }

    private long[][] snapshotGrid() {
        long[][] copy = new long[players][];
        for (int player = 0; player < players; player++) {
            copy[player] = grid[player].clone();
        }
        return copy;
    }

    // ---------------------------------------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------------------------------------

    @Override
    public GameConfig config() {
        return config;
    }

    @Override
    public int owner() {
        return owner;
    }

    /**
     * @throws IllegalStateException if the owner's slot is no longer pinned (informal desync)
     */
    @Override
    public double ownValue(int position) {
        return candidates(owner, position).pinnedValue();
    }

    @Override
    public boolean isRevealed(int player, int position) {
        for (ValueTracker tracker : trackers) {
            if (tracker.isRevealed(player, position)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public int revealedCount(double value) {
        return trackers[domain.requireRank(value)].getRevealed().size();
    }

    public GameConfig getConfig() {
        return config;
    }

    public int getOwner() {
        return owner;
    }

    public FilterSettings getSettings() {
        return settings;
    }

    /** The attached global solver, or {@code null}. */
    public GlobalConsistencySolver getSolver() {
        return solver;
    }

    public CandidateSet candidates(int player, int position) {
        return new CandidateSet(domain, grid[player][position]);
    }

    /** Candidate sets of one hand, left to right. */
    public List<CandidateSet> hand(int player) {
        List<CandidateSet> hand = new ArrayList<>(handSize);
        for (int pos = 0; pos < handSize; pos++) {
            hand.add(candidates(player, pos));
        }
        return hand;
    }

    /** Snapshot (copy) of the tracker of one value. */
    public ValueTracker tracker(double value) {
        return trackers[domain.requireRank(value)].copy();
    }

    /** Snapshots of all trackers in ascending value order. */
    public List<ValueTracker> trackers() {
        List<ValueTracker> list = new ArrayList<>(trackers.length);
        for (ValueTracker tracker : trackers) {
            list.add(tracker.copy());
        }
        return list;
    }

    /** Copy-count constraints per player (only players that have some). */
    public Map<Integer, List<CopyCountConstraint>> getCopyCountConstraints() {
        Map<Integer, List<CopyCountConstraint>> map = new TreeMap<>();
        for (int player = 0; player < players; player++) {
            if (!copyCountConstraints.get(player).isEmpty()) {
                map.put(player, List.copyOf(copyCountConstraints.get(player)));
            }
        }
        return map;
    }

    /** Adjacent constraints per player (only players that have some). */
    public Map<Integer, List<AdjacentConstraint>> getAdjacentConstraints() {
        Map<Integer, List<AdjacentConstraint>> map = new TreeMap<>();
        for (int player = 0; player < players; player++) {
            if (!adjacentConstraints.get(player).isEmpty()) {
                map.put(player, List.copyOf(adjacentConstraints.get(player)));
            }
        }
        return map;
    }

    /** Whether every candidate set is non-empty. */
    public boolean isConsistent() {
        for (long[] row : grid) {
            for (long mask : row) {
                if (mask == 0L) {
                    return false;
                }
            }
        }
        return true;
    }

    /** Positions of a hand whose value is pinned. */
    public List<Integer> certainPositions(int player) {
        List<Integer> positions = new ArrayList<>();
        for (int pos = 0; pos < handSize; pos++) {
            if (Masks.isSingleton(grid[player][pos])) {
                positions.add(pos);
            }
        }
        return positions;
    }

    /** Positions of a hand with more than one candidate. */
    public List<Integer> uncertainPositions(int player) {
        List<Integer> positions = new ArrayList<>();
        for (int pos = 0; pos < handSize; pos++) {
            if (Long.bitCount(grid[player][pos]) > 1) {
                positions.add(pos);
            }
        }
        return positions;
    }

    public boolean isFullyDeduced(int player) {
        return certainPositions(player).size() == handSize;
    }

    /** Distinct values the owner can still call: values at the owner's unrevealed slots. */
    public List<Double> playableValues() {
        TreeSet<Double> values = new TreeSet<>();
        for (int pos = 0; pos < handSize; pos++) {
            long mask = grid[owner][pos];
            if (Masks.isSingleton(mask) && !isRevealed(owner, pos)) {
                values.add(domain.value(Masks.lowest(mask)));
            }
        }
        return Collections.unmodifiableList(new ArrayList<>(values));
    }

    /** Multi-line dump of the grid, one line per player. */
    public String describe() {
        StringBuilder sb = new StringBuilder();
        for (int player = 0; player < players; player++) {
            sb.append(player == owner ? "* P" : "  P").append(player).append(':');
            for (int pos = 0; pos < handSize; pos++) {
                CandidateSet set = candidates(player, pos);
                sb.append(' ');
                if (isRevealed(player, pos)) {
                    sb.append('!');
                }
                sb.append(set.isPinned() ? ValueDomain.format(set.pinnedValue()) : set.toString());
            }
            if (player < players - 1) {
                sb.append('\n');
            }
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "BeliefState{owner=" + owner + ", consistent=" + isConsistent() + "}";
    }
}
