package ai.bombbuster.unit.helpers;

import ai.bombbuster.action.ActionRecord;
import ai.bombbuster.action.CallRecord;
import ai.bombbuster.action.CopyCountSignalRecord;
import ai.bombbuster.action.DoubleRevealRecord;
import ai.bombbuster.action.HasValueRecord;
import ai.bombbuster.action.NotPresentRecord;
import ai.bombbuster.action.RevealRecord;
import ai.bombbuster.action.SignalRecord;
import ai.bombbuster.action.SwapRecord;
import ai.bombbuster.game.GameConfig;
import ai.bombbuster.game.ValueDomain;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

/**
 * A concrete random deal that tests can query and draw truthful public events from.
 *
 * <p><strong>Why this exists</strong>
 * <ul>
 *   <li><strong>Soundness checks:</strong> whatever the engine deduces, the true value of every
 *       slot must stay among its candidates. Tests need the truth to check that.</li>
 *   <li><strong>Reproducibility:</strong> deals and event streams come from a seeded
 *       {@link Random}, so a failing seed can be replayed.</li>
 * </ul>
 *
 * <p>Events produced here are always consistent with the deal and with one another. Revealed
 * slots are tracked so no event ever reveals or calls a slot twice. Swaps change the deal: both
 * hands are re-sorted and revealed slots move with their wires. A swap tells only the observer
 * what they received.
 */
public final class HiddenDeal {

    private final GameConfig config;
    private final List<List<Double>> hands;
    private final Random random;
    private final int observer;
    private final Set<String> revealed = new HashSet<>();

    private HiddenDeal(GameConfig config, List<List<Double>> hands, Random random, int observer) {
        this.config = config;
        this.hands = hands;
        this.random = random;
        this.observer = observer;
    }

    /** Deal watched by player 0. */
    public static HiddenDeal deal(GameConfig config, long seed) {
        return deal(config, seed, 0);
    }

    /** Shuffles the full deck and deals sorted hands; leftover cards stay undealt. */
    public static HiddenDeal deal(GameConfig config, long seed, int observer) {
        Random random = new Random(seed);
        ValueDomain domain = config.getDomain();
        List<Double> deck = new ArrayList<>();
        for (int rank = 0; rank < domain.size(); rank++) {
            for (int copy = 0; copy < domain.copies(rank); copy++) {
                deck.add(domain.value(rank));
            }
        }
        Collections.shuffle(deck, random);
        List<List<Double>> hands = new ArrayList<>();
        int handSize = config.getHandSize();
        for (int player = 0; player < config.getPlayers(); player++) {
            List<Double> hand = new ArrayList<>(deck.subList(player * handSize, (player + 1) * handSize));
            Collections.sort(hand);
            hands.add(hand);
        }
        return new HiddenDeal(config, hands, random, observer);
    }

    public List<Double> hand(int player) {
        return Collections.unmodifiableList(hands.get(player));
    }

    public double valueAt(int player, int position) {
        return hands.get(player).get(position);
    }

    /**
     * Draws a random truthful event. Calls are made by a player who really holds the value;
     * their outcome follows the deal.
     */
    public ActionRecord nextEvent() {
        int players = config.getPlayers();
        int handSize = config.getHandSize();
        while (true) {
            int kind = random.nextInt(8);
            int player = random.nextInt(players);
            int position = random.nextInt(handSize);
            double value = valueAt(player, position);
            switch (kind) {
                case 0, 1 -> {
                    int target = (player + 1 + random.nextInt(players - 1)) % players;
                    int targetPos = random.nextInt(handSize);
                    if (isRevealed(target, targetPos) || isRevealed(player, position)) {
                        continue;
                    }
                    boolean success = valueAt(target, targetPos) == value;
                    if (success) {
                        markRevealed(target, targetPos);
                        markRevealed(player, position);
                        return new CallRecord(player, target, targetPos, value, true, position);
                    }
                    return CallRecord.of(player, target, targetPos, value, false);
                }
                case 2 -> {
                    if (isRevealed(player, position)) {
                        continue;
                    }
                    markRevealed(player, position);
                    return new RevealRecord(player, value, position);
                }
                case 3 -> {
                    return new SignalRecord(player, value, position);
                }
                case 4 -> {
                    double other = config.getDomain().value(random.nextInt(config.getDomain().size()));
                    if (!hands.get(player).contains(other)) {
                        return NotPresentRecord.inHand(player, other);
                    }
                    if (holdsUnrevealed(player, other)) {
                        return new HasValueRecord(player, other);
                    }
                    continue;
                }
                case 5 -> {
                    return new CopyCountSignalRecord(player, position, config.getDomain().copiesOf(value));
                }
                case 6 -> {
                    int partner = (player + 1 + random.nextInt(players - 1)) % players;
                    int partnerPos = random.nextInt(handSize);
                    if (isRevealed(player, position) || isRevealed(partner, partnerPos)) {
                        continue;
                    }
                    return swap(player, partner, position, partnerPos);
                }
                default -> {
                    DoubleRevealRecord lastTwo = lastTwoCopies(player, value);
                    if (lastTwo == null) {
                        continue;
                    }
                    return lastTwo;
                }
            }
        }
    }

    private SwapRecord swap(int player1, int player2, int init1, int init2) {
        double given1 = valueAt(player1, init1);
        double given2 = valueAt(player2, init2);
        int landing1 = exchange(player1, init1, given2);
        int landing2 = exchange(player2, init2, given1);
        return new SwapRecord(player1, player2, init1, init2,
                insertionPoint(init1, landing1), insertionPoint(init2, landing2),
                player1 == observer ? given2 : null, player2 == observer ? given1 : null);
    }

    /** Replaces the wire at {@code init}, keeps the hand sorted and returns where the new wire sits. */
    private int exchange(int player, int init, double incoming) {
        List<Double> hand = hands.get(player);
        hand.remove(init);
        int landing = 0;
        while (landing < hand.size() && hand.get(landing) <= incoming) {
            landing++;
        }
        hand.add(landing, incoming);

        List<Integer> moved = new ArrayList<>();
        for (int pos = 0; pos < config.getHandSize(); pos++) {
            if (revealed.remove(player + ":" + pos)) {
                int closed = pos < init ? pos : pos - 1;
                moved.add(closed < landing ? closed : closed + 1);
            }
        }
        for (int pos : moved) {
            markRevealed(player, pos);
        }
        return landing;
    }

    /** Insertion point counted while the given wire still holds its slot. */
    private static int insertionPoint(int init, int landing) {
        return landing >= init ? landing + 1 : landing;
    }

    /** Both remaining copies of {@code value}, when {@code player} holds them unrevealed. */
    private DoubleRevealRecord lastTwoCopies(int player, double value) {
        int revealedCopies = 0;
        List<Integer> open = new ArrayList<>();
        for (int p = 0; p < config.getPlayers(); p++) {
            for (int pos = 0; pos < config.getHandSize(); pos++) {
                if (valueAt(p, pos) != value) {
                    continue;
                }
                if (isRevealed(p, pos)) {
                    revealedCopies++;
                } else if (p == player) {
                    open.add(pos);
                }
            }
        }
        if (config.getDomain().copiesOf(value) - revealedCopies != 2 || open.size() != 2) {
            return null;
        }
        markRevealed(player, open.get(0));
        markRevealed(player, open.get(1));
        return new DoubleRevealRecord(player, value, open.get(0), open.get(1));
    }

    private boolean holdsUnrevealed(int player, double value) {
        for (int pos = 0; pos < config.getHandSize(); pos++) {
            if (valueAt(player, pos) == value && !isRevealed(player, pos)) {
                return true;
            }
        }
        return false;
    }

    private boolean isRevealed(int player, int position) {
        return revealed.contains(player + ":" + position);
    }

    private void markRevealed(int player, int position) {
        revealed.add(player + ":" + position);
    }
}
