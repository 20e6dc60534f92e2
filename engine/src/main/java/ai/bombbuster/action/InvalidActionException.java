package ai.bombbuster.action;

/**
 * Thrown when an action record is malformed or breaks the game rules as far as the observer can
 * tell. The record is rejected as a whole; the belief state it was aimed at is unchanged.
 */
public class InvalidActionException extends IllegalArgumentException {
    private final transient ActionRecord action;

    public InvalidActionException(ActionRecord action, String message) {
        super(message + " [" + action + "]");
        this.action = action;
    }

    /** The rejected record. */
    public ActionRecord getAction() {
        return action;
    }
}
