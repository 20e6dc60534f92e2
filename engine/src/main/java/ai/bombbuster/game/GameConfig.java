package ai.bombbuster.game;

import java.util.Objects;

/**
 * Static facts of one game: the value domain, the number of players, the hand size and whether
 * the game is played informally with physical wires.
 * <p>
 * In informal mode the engine cannot trust that the owner's hand was entered correctly, so
 * possession and truthfulness checks against the owner's hand are skipped.
 */
public final class GameConfig {
    private final ValueDomain domain;
    private final int players;
    private final int handSize;
    private final boolean informal;

    /**
     * @param domain the value domain
     * @param players number of players, at least 2
     * @param handSize wires per player; {@code 0} deals the whole deck evenly
     * @param informal whether possession checks are skipped
     * @throws IllegalArgumentException if the deck cannot be dealt into the requested hands
     */
    public GameConfig(ValueDomain domain, int players, int handSize, boolean informal) {
        this.domain = Objects.requireNonNull(domain, "domain");
        if (players < 2) {
            throw new IllegalArgumentException("At least two players are required, got " + players);
        }
        int deck = domain.deckSize();
        if (handSize == 0) {
            if (deck % players != 0) {
                throw new IllegalArgumentException("Deck of " + deck + " wires cannot be split evenly between "
                        + players + " players");
            }
            handSize = deck / players;
        }
        if (handSize < 1) {
            throw new IllegalArgumentException("Hand size must be positive, got " + handSize);
        }
        if ((long) handSize * players > deck) {
            throw new IllegalArgumentException(players + " hands of " + handSize + " need more than the "
                    + deck + " wires in the deck");
        }
        this.players = players;
        this.handSize = handSize;
        this.informal = informal;
    }

    public GameConfig(ValueDomain domain, int players) {
        this(domain, players, 0, false);
    }

    public ValueDomain getDomain() {
        return domain;
    }

    public int getPlayers() {
        return players;
    }

    public int getHandSize() {
        return handSize;
    }

    public boolean isInformal() {
        return informal;
    }

    /** Wires that are not in any hand. */
    public int undealt() {
        return domain.deckSize() - players * handSize;
    }

    public GameConfig withInformal(boolean informalMode) {
        return new GameConfig(domain, players, handSize, informalMode);
    }

    @Override
    public String toString() {
        return "GameConfig{domain=" + domain + ", players=" + players + ", handSize=" + handSize
                + (informal ? ", informal" : "") + '}';
    }
}
