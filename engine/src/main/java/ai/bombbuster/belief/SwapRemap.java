package ai.bombbuster.belief;

/**
 * Where a slot of a swapping player ends up.
 * <p>
 * The player removes the wire at {@code init} and inserts the received wire so that it ends at
 * {@code fin}, its index in the finished hand ({@link ai.bombbuster.action.SwapRecord#landingPosition1()}).
 * Every other wire keeps its relative order.
 */
final class SwapRemap {

    private SwapRemap() {
    }

    /**
     * @param old position before the swap
     * @param init position of the wire given away
     * @param fin final position of the wire received
     * @return position of the same wire after the swap; for {@code old == init} the received
     *         wire's position
     */
    static int remap(int old, int init, int fin) {
        if (old == init) {
            // exchanged
            return fin;
        }
        if (old < init && old < fin) {
            return old;
        }
        if (old > init && old > fin) {
            return old;
        }
        if (old < init) {
            // received wire lands at or before this one
            return old + 1;
        }
        // old > init && old <= fin: the gap left at init closes
        return old - 1;
    }
}
