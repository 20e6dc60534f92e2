package ai.bombbuster;

import ai.bombbuster.belief.BeliefState;
import ai.bombbuster.config.EngineFactory;
import ai.bombbuster.config.EngineProperties;
import ai.bombbuster.game.ValueDomain;
import ai.bombbuster.suggest.BeliefStatistics;
import ai.bombbuster.suggest.DoubleChanceEstimate;
import ai.bombbuster.suggest.SuggestionReport;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EngineApplication implements CommandLineRunner {
    private static final Logger log = LoggerFactory.getLogger(EngineApplication.class);

    private final EngineFactory factory;
    private final EngineProperties properties;

    public EngineApplication(EngineFactory factory, EngineProperties properties) {
        this.factory = factory;
        this.properties = properties;
    }

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(EngineApplication.class);
        app.setWebApplicationType(WebApplicationType.NONE);
        app.run(args);
    }

    @Override
    public void run(String... args) {
        if (properties.getSessionDir() == null || properties.getSessionDir().isBlank()) {
            log.info("No engine.session-dir configured; nothing to analyse");
            return;
        }
        analyse(Path.of(properties.getSessionDir()), properties.getPlayerId());
    }

    /**
     * Loads the saved beliefs of {@code player} and reports where the table stands.
     *
     * <p>Used by the CLI runner and by tests, which inspect the returned report.
     *
     * @return the entropy suggestion for the loaded state
     */
    public SuggestionReport analyse(Path sessionDir, int player) {
        BeliefState state = factory.load(sessionDir, player);
        if (log.isDebugEnabled()) {
            log.debug("Loaded beliefs of player {}:\n{}", player, state.describe());
        }
        BeliefStatistics.SystemSummary summary = BeliefStatistics.summarize(state);
        for (BeliefStatistics.PlayerSummary playerSummary : summary.players()) {
            log.info("Player {}: {} certain, {} uncertain, {}% deduced, {} bits",
                    playerSummary.player(), playerSummary.certain(), playerSummary.uncertain(),
                    String.format("%.0f", playerSummary.progressPercent()),
                    String.format("%.2f", playerSummary.entropy()));
        }
        log.info("Table entropy {} bits ({} of maximum)", String.format("%.2f", summary.totalEntropy()),
                String.format("%.2f", summary.normalizedEntropy()));

        SuggestionReport report = factory.entropySuggester().suggest(state);
        List<DoubleChanceEstimate> doubleChances = factory.doubleChanceAdvisor().rank(state);
        if (!doubleChances.isEmpty()) {
            DoubleChanceEstimate best = doubleChances.get(0);
            log.info("Best double chance: P{}[{}] or P{}[{}] = {} (p={}{})", best.target(), best.position1(),
                    best.target(), best.position2(), ValueDomain.format(best.value()), String.format("%.2f", best.probability()),
                    best.exact() ? "" : ", approximate");
        }
        return report;
    }
}
