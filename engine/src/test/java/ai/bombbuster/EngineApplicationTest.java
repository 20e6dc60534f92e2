package ai.bombbuster;

import static org.junit.jupiter.api.Assertions.*;

import ai.bombbuster.belief.BeliefState;
import ai.bombbuster.config.EngineFactory;
import ai.bombbuster.config.EngineProperties;
import ai.bombbuster.config.GameProperties;
import ai.bombbuster.config.SolverProperties;
import ai.bombbuster.persist.BeliefStoreException;
import ai.bombbuster.suggest.SuggestionReport;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * The command-line runner on a saved session.
 *
 * <p><b>Tests and their intentions:</b>
 * <ul>
 *   <li><b>analysesSavedSession</b> - A saved belief state is loaded and a call is suggested</li>
 *   <li><b>runWithoutSessionDoesNothing</b> - Starting without a session directory is not an error</li>
 *   <li><b>missingSessionFails</b> - An empty session directory is reported</li>
 * </ul>
 */
class EngineApplicationTest {

    @TempDir
    Path sessionDir;

    private EngineFactory factory;
    private EngineProperties engineProperties;

    @BeforeEach
    void setUp() {
        GameProperties game = new GameProperties();
        game.setDistribution("1:2,2:2,3:2,4:2");
        game.setPlayers(2);
        game.setHandSize(3);
        SolverProperties solver = new SolverProperties();
        solver.setWorkerThreads(2);
        factory = new EngineFactory(solver, game);
        engineProperties = new EngineProperties();
    }

    @AfterEach
    void tearDown() {
        factory.close();
    }

    @Test
    void analysesSavedSession() {
        BeliefState state = factory.newBeliefState(0, List.of(1.0, 2.0, 4.0));
        factory.beliefStore().save(state, sessionDir);

        SuggestionReport report = new EngineApplication(factory, engineProperties).analyse(sessionDir, 0);

        assertTrue(report.hasSuggestion());
        assertEquals(4, report.candidatesAnalyzed());
        assertTrue(report.best().informationGain() > 0);
    }

    @Test
    void runWithoutSessionDoesNothing() {
        assertDoesNotThrow(() -> new EngineApplication(factory, engineProperties).run());
    }

    @Test
    void missingSessionFails() {
        engineProperties.setSessionDir(sessionDir.toString());
        EngineApplication app = new EngineApplication(factory, engineProperties);
        assertThrows(BeliefStoreException.class, () -> app.run());
    }
}
