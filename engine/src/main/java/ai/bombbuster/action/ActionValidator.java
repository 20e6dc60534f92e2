package ai.bombbuster.action;

import ai.bombbuster.game.GameConfig;
import ai.bombbuster.game.ValueDomain;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Precondition checks applied to every action record before it touches a belief state.
 * <p>
 * <strong>Always checked</strong> (public information):
 * <ul>
 *   <li>Player ids and positions are in range; values belong to the domain.</li>
 *   <li>Nobody calls or swaps with themselves; double reveals name two distinct slots.</li>
 *   <li>Revealed slots are not called, revealed again or swapped away.</li>
 *   <li>Adjacent signals name neighbouring slots; copy-count signals name an existing copy count.</li>
 * </ul>
 * <strong>Checked outside informal mode</strong> (the observer's private knowledge):
 * <ul>
 *   <li>When the observer is the actor, their own hand must agree with the record.</li>
 *   <li>When the observer is a call target, the outcome must agree with their hand.</li>
 *   <li>A double reveal must concern the last two unrevealed copies.</li>
 * </ul>
 */
public final class ActionValidator {

    private ActionValidator() {
    }

    /**
     * Validates a record against the observer's context.
     *
     * @throws InvalidActionException if the record is rejected
     */
    public static void validate(ActionRecord action, ActionContext context) {
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(context, "context");
        if (action instanceof CallRecord call) {
            validateCall(call, context);
        } else if (action instanceof DoubleRevealRecord doubleReveal) {
            validateDoubleReveal(doubleReveal, context);
        } else if (action instanceof SignalRecord signal) {
            validatePinned(signal, signal.player(), signal.position(), signal.value(), context);
        } else if (action instanceof RevealRecord reveal) {
            validatePinned(reveal, reveal.player(), reveal.position(), reveal.value(), context);
            if (context.isRevealed(reveal.player(), reveal.position())) {
                throw new InvalidActionException(action, "Slot is already revealed");
            }
        } else if (action instanceof NotPresentRecord notPresent) {
            validateNotPresent(notPresent, context);
        } else if (action instanceof HasValueRecord hasValue) {
            validateHasValue(hasValue, context);
        } else if (action instanceof CopyCountSignalRecord copyCount) {
            validateCopyCount(copyCount, context);
        } else if (action instanceof AdjacentSignalRecord adjacent) {
            validateAdjacent(adjacent, context);
        } else if (action instanceof SwapRecord swap) {
            validateSwap(swap, context);
        } else {
            throw new InvalidActionException(action, "Unsupported action type " + action.getClass().getSimpleName());
        }
    }

    private static void validateCall(CallRecord call, ActionContext context) {
        requirePlayer(call, call.caller(), context);
        requirePlayer(call, call.target(), context);
        requirePosition(call, call.position(), context);
        requireValue(call, call.value(), context);
        if (call.caller() == call.target()) {
            throw new InvalidActionException(call, "A player cannot call their own wire");
        }
        if (context.isRevealed(call.target(), call.position())) {
            throw new InvalidActionException(call, "Target slot is already revealed");
        }
        if (call.callerPosition() != null) {
            requirePosition(call, call.callerPosition(), context);
            if (context.isRevealed(call.caller(), call.callerPosition())) {
                throw new InvalidActionException(call, "Caller slot is already revealed");
            }
        }
        if (context.config().isInformal()) {
            return;
        }
        int owner = context.owner();
        if (call.caller() == owner) {
            if (!holdsUnrevealed(context, call.value())) {
                throw new InvalidActionException(call, "Caller does not hold an unrevealed "
                        + ValueDomain.format(call.value()));
            }
            if (call.callerPosition() != null && context.ownValue(call.callerPosition()) != call.value()) {
                throw new InvalidActionException(call, "Caller position does not hold the called value");
            }
        }
        if (call.target() == owner) {
            boolean matches = context.ownValue(call.position()) == call.value();
            if (matches != call.success()) {
                throw new InvalidActionException(call, "Call outcome contradicts the observer's own hand");
            }
        }
    }

    private static void validateDoubleReveal(DoubleRevealRecord record, ActionContext context) {
        requirePlayer(record, record.player(), context);
        requirePosition(record, record.position1(), context);
        requirePosition(record, record.position2(), context);
        requireValue(record, record.value(), context);
        if (record.position1() == record.position2()) {
            throw new InvalidActionException(record, "Double reveal needs two distinct positions");
        }
        if (context.isRevealed(record.player(), record.position1())
                || context.isRevealed(record.player(), record.position2())) {
            throw new InvalidActionException(record, "Double reveal names an already revealed slot");
        }
        if (context.config().isInformal()) {
            return;
        }
        int copies = context.config().getDomain().copiesOf(record.value());
        if (context.revealedCount(record.value()) != copies - 2) {
            throw new InvalidActionException(record, "Double reveal is only allowed for the last two copies");
        }
        if (record.player() == context.owner()
                && (context.ownValue(record.position1()) != record.value()
                || context.ownValue(record.position2()) != record.value())) {
            throw new InvalidActionException(record, "Revealed slots do not hold the value");
        }
    }

    private static void validatePinned(ActionRecord record, int player, int position, double value,
                                       ActionContext context) {
        requirePlayer(record, player, context);
        requirePosition(record, position, context);
        requireValue(record, value, context);
        if (!context.config().isInformal() && player == context.owner() && context.ownValue(position) != value) {
            throw new InvalidActionException(record, "Observer's slot does not hold the announced value");
        }
    }

    private static void validateNotPresent(NotPresentRecord record, ActionContext context) {
        requirePlayer(record, record.player(), context);
        requireValue(record, record.value(), context);
        if (record.position() != null) {
            requirePosition(record, record.position(), context);
        }
        if (context.config().isInformal() || record.player() != context.owner()) {
            return;
        }
        int handSize = context.config().getHandSize();
        for (int pos = 0; pos < handSize; pos++) {
            boolean inScope = record.position() == null || record.position() == pos;
            if (inScope && context.ownValue(pos) == record.value()) {
                throw new InvalidActionException(record, "Observer holds the value announced as absent");
            }
        }
    }

    private static void validateHasValue(HasValueRecord record, ActionContext context) {
        requirePlayer(record, record.player(), context);
        requireValue(record, record.value(), context);
        if (!context.config().isInformal() && record.player() == context.owner()
                && !holdsUnrevealed(context, record.value())) {
            throw new InvalidActionException(record, "Observer does not hold the announced value");
        }
    }

    private static void validateCopyCount(CopyCountSignalRecord record, ActionContext context) {
        requirePlayer(record, record.player(), context);
        requirePosition(record, record.position(), context);
        ValueDomain domain = context.config().getDomain();
        if (record.copyCount() < 1 || domain.maskWithCopies(record.copyCount()) == 0L) {
            throw new InvalidActionException(record, "No value has " + record.copyCount() + " copies");
        }
        if (!context.config().isInformal() && record.player() == context.owner()
                && domain.copiesOf(context.ownValue(record.position())) != record.copyCount()) {
            throw new InvalidActionException(record, "Copy count does not match the observer's wire");
        }
    }

    private static void validateAdjacent(AdjacentSignalRecord record, ActionContext context) {
        requirePlayer(record, record.player(), context);
        requirePosition(record, record.position1(), context);
        requirePosition(record, record.position2(), context);
        if (Math.abs(record.position1() - record.position2()) != 1) {
            throw new InvalidActionException(record, "Adjacent signal needs neighbouring positions");
        }
        if (!context.config().isInformal() && record.player() == context.owner()) {
            boolean equal = context.ownValue(record.position1()) == context.ownValue(record.position2());
            if (equal != record.equal()) {
                throw new InvalidActionException(record, "Adjacent signal contradicts the observer's hand");
            }
        }
    }

    private static void validateSwap(SwapRecord swap, ActionContext context) {
        requirePlayer(swap, swap.player1(), context);
        requirePlayer(swap, swap.player2(), context);
        if (swap.player1() == swap.player2()) {
            throw new InvalidActionException(swap, "A player cannot swap with themselves");
        }
        requirePosition(swap, swap.initPosition1(), context);
        requirePosition(swap, swap.initPosition2(), context);
        requireInsertionPoint(swap, swap.finalPosition1(), context);
        requireInsertionPoint(swap, swap.finalPosition2(), context);
        if (swap.receivedValue1() != null) {
            requireValue(swap, swap.receivedValue1(), context);
        }
        if (swap.receivedValue2() != null) {
            requireValue(swap, swap.receivedValue2(), context);
        }
        if (context.isRevealed(swap.player1(), swap.initPosition1())
                || context.isRevealed(swap.player2(), swap.initPosition2())) {
            throw new InvalidActionException(swap, "Revealed wires cannot be swapped");
        }
        if (context.config().isInformal()) {
            return;
        }
        int owner = context.owner();
        if (owner == swap.player1()) {
            requireSortedAfterSwap(swap, context, swap.initPosition1(), swap.landingPosition1(), swap.receivedValue1());
        } else if (owner == swap.player2()) {
            requireSortedAfterSwap(swap, context, swap.initPosition2(), swap.landingPosition2(), swap.receivedValue2());
        }
    }

    private static void requireSortedAfterSwap(SwapRecord swap, ActionContext context, int init, int landing,
                                               Double received) {
        if (received == null) {
            throw new InvalidActionException(swap, "Observer took part in the swap but the received value is missing");
        }
        List<Double> hand = new ArrayList<>();
        for (int pos = 0; pos < context.config().getHandSize(); pos++) {
            if (pos != init) {
                hand.add(context.ownValue(pos));
            }
        }
        hand.add(landing, received);
        for (int i = 1; i < hand.size(); i++) {
            if (hand.get(i - 1) > hand.get(i)) {
                throw new InvalidActionException(swap, "Received wire does not fit the observer's sorted hand at "
                        + landing);
            }
        }
    }

    private static boolean holdsUnrevealed(ActionContext context, double value) {
        for (int pos = 0; pos < context.config().getHandSize(); pos++) {
            if (context.ownValue(pos) == value && !context.isRevealed(context.owner(), pos)) {
                return true;
            }
        }
        return false;
    }

    private static void requirePlayer(ActionRecord record, int player, ActionContext context) {
        GameConfig config = context.config();
        if (player < 0 || player >= config.getPlayers()) {
            throw new InvalidActionException(record, "Player " + player + " is out of range [0, "
                    + config.getPlayers() + ")");
        }
    }

    private static void requirePosition(ActionRecord record, int position, ActionContext context) {
        GameConfig config = context.config();
        if (position < 0 || position >= config.getHandSize()) {
            throw new InvalidActionException(record, "Position " + position + " is out of range [0, "
                    + config.getHandSize() + ")");
        }
    }

    /** Swap insertion points may also name the slot just past the last wire. */
    private static void requireInsertionPoint(ActionRecord record, int position, ActionContext context) {
        GameConfig config = context.config();
        if (position < 0 || position > config.getHandSize()) {
            throw new InvalidActionException(record, "Insertion point " + position + " is out of range [0, "
                    + config.getHandSize() + "]");
        }
    }

    private static void requireValue(ActionRecord record, double value, ActionContext context) {
        if (!context.config().getDomain().contains(value)) {
            throw new InvalidActionException(record, "Value " + ValueDomain.format(value) + " is not in the domain");
        }
    }
}
