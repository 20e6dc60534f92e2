package ai.bombbuster.action;

/**
 * One public game event, as emitted by the game orchestrator.
 * <p>
 * Records are immutable and are the only channel through which a belief state changes. Each
 * variant is validated by {@link ActionValidator} before it is applied; a rejected record leaves
 * the state untouched.
 */
public interface ActionRecord {

    /** Player whose action (or hand) the record is about. */
    int actor();
}
