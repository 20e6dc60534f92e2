package ai.bombbuster.action;

/**
 * A player pointed at another player's wire and named a value.
 * <p>
 * On success the target slot is publicly revealed; when {@code callerPosition} is given, the
 * caller's matching wire is revealed too. On failure the value is removed from the target slot
 * and the caller is known to hold the value somewhere.
 *
 * @param caller player making the call
 * @param target player whose wire is pointed at
 * @param position slot in the target's hand
 * @param value named value
 * @param success whether the named value was correct
 * @param callerPosition slot of the caller's matching wire, or {@code null} when unknown
 */
public record CallRecord(int caller, int target, int position, double value, boolean success,
                         Integer callerPosition) implements ActionRecord {

    public static CallRecord of(int caller, int target, int position, double value, boolean success) {
        return new CallRecord(caller, target, position, value, success, null);
    }

    @Override
    public int actor() {
        return caller;
    }
}
