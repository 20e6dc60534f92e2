package ai.bombbuster.persist;

/**
 * Saving or loading a belief state failed: I/O error, missing file or malformed JSON.
 */
public class BeliefStoreException extends RuntimeException {

    public BeliefStoreException(String message) {
        super(message);
    }

    public BeliefStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
