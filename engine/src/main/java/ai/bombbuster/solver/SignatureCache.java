package ai.bombbuster.solver;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Signature sets keyed by the exact {@link PlayerProblem} that produced them.
 * <p>
 * Keys are full content snapshots, so an entry can never be stale and the cache may be shared by
 * every clone of a belief state (and by concurrent workers). When the cache grows past its
 * capacity it is emptied wholesale.
 */
public class SignatureCache {
    private static final Logger log = LoggerFactory.getLogger(SignatureCache.class);

    private final int capacity;
    private final Map<PlayerProblem, Set<ResourceVector>> entries = new ConcurrentHashMap<>();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    /**
     * @param capacity maximum number of cached signature sets; {@code 0} disables caching
     */
    public SignatureCache(int capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException("Cache capacity must not be negative, got " + capacity);
        }
        this.capacity = capacity;
    }

    /** Cached signatures, or {@code null} on a miss. */
    public Set<ResourceVector> get(PlayerProblem problem) {
        Set<ResourceVector> cached = entries.get(problem);
        if (cached == null) {
            misses.incrementAndGet();
        } else {
            hits.incrementAndGet();
        }
        return cached;
    }

    public void put(PlayerProblem problem, Set<ResourceVector> signatures) {
        if (capacity == 0) {
            return;
        }
        if (entries.size() >= capacity) {
            if (log.isDebugEnabled()) {
                log.debug("Signature cache reached {} entries; clearing", entries.size());
            }
            entries.clear();
        }
        entries.put(problem, Set.copyOf(signatures));
    }

    public int size() {
        return entries.size();
    }

    public long hits() {
        return hits.get();
    }

    public long misses() {
        return misses.get();
    }
}
