package ai.bombbuster.action;

import ai.bombbuster.game.GameConfig;

/**
 * What the validator may know about the observer: the game, who the observer is, their own hand
 * and the public reveals so far.
 */
public interface ActionContext {

    GameConfig config();

    /** Player id of the observer owning the belief state. */
    int owner();

    /** Current value at one of the owner's own slots. */
    double ownValue(int position);

    boolean isRevealed(int player, int position);

    /** Number of publicly revealed copies of a value. */
    int revealedCount(double value);
}
