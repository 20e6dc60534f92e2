package ai.bombbuster.config;

import ai.bombbuster.belief.BeliefState;
import ai.bombbuster.belief.FilterSettings;
import ai.bombbuster.game.GameConfig;
import ai.bombbuster.persist.BeliefStore;
import ai.bombbuster.persist.PlayerNames;
import ai.bombbuster.solver.GlobalConsistencySolver;
import ai.bombbuster.solver.SignatureCache;
import ai.bombbuster.solver.SolverWorkerPool;
import ai.bombbuster.suggest.DoubleChanceAdvisor;
import ai.bombbuster.suggest.EntropySuggester;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Wires the configuration properties into engine objects.
 * <p>
 * Owns the worker pool and the signature cache shared by every solver it hands out. The pool is
 * created on first use and shut down when the Spring context closes.
 */
@Component
public class EngineFactory implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(EngineFactory.class);

    private final SolverProperties solverProperties;
    private final GameProperties gameProperties;
    private final SignatureCache cache;
    private SolverWorkerPool pool;

    public EngineFactory(SolverProperties solverProperties, GameProperties gameProperties) {
        this.solverProperties = solverProperties;
        this.gameProperties = gameProperties;
        this.cache = new SignatureCache(solverProperties.getSignatureCacheSize());
    }

    public GameConfig gameConfig() {
        return gameProperties.toGameConfig();
    }

    public PlayerNames playerNames() {
        return PlayerNames.of(gameProperties.getPlayerNames());
    }

    public FilterSettings filterSettings() {
        return new FilterSettings(solverProperties.getMaxFilterIterations(), solverProperties.getSubsetMaxSize());
    }

    /** Global solver, or {@code null} when global solving is disabled. */
    public GlobalConsistencySolver solver() {
        if (!solverProperties.isGlobalEnabled()) {
            return null;
        }
        return new GlobalConsistencySolver(solverProperties.getTimeout(), workerPool(), cache);
    }

    public BeliefState newBeliefState(int owner, List<Double> ownHand) {
        return new BeliefState(gameConfig(), owner, ownHand, filterSettings(), solver());
    }

    public EntropySuggester entropySuggester() {
        return new EntropySuggester(solverProperties.getMaxUncertainty(), workerPool());
    }

    public DoubleChanceAdvisor doubleChanceAdvisor() {
        return new DoubleChanceAdvisor(solverProperties.getDoubleChanceMaxHands());
    }

    public BeliefStore beliefStore() {
        return new BeliefStore();
    }

    /** Loads a saved session with the configured game and solver. */
    public BeliefState load(Path sessionDir, int player) {
        return beliefStore().load(sessionDir, player, gameConfig(), playerNames(), filterSettings(), solver());
    }

    public SignatureCache getCache() {
        return cache;
    }

    private synchronized SolverWorkerPool workerPool() {
        if (!solverProperties.isParallel()) {
            return null;
        }
        if (pool == null) {
            pool = new SolverWorkerPool(solverProperties.getWorkerThreads());
        }
        return pool;
    }

    @Override
    public synchronized void close() {
        if (pool != null) {
            log.debug("Shutting down solver worker pool");
            pool.close();
            pool = null;
        }
    }
}
