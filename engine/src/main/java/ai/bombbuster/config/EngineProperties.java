package ai.bombbuster.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Spring Boot configuration properties for the command-line runner.
 *
 * When {@code engine.session-dir} is set, the runner loads the saved beliefs of
 * {@code engine.player-id} from that directory and reports statistics and a suggested call.
 *
 * Usage:
 * {@code java -jar engine.jar --engine.session-dir=/tmp/game --engine.player-id=2}
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "engine")
public class EngineProperties {
  private String sessionDir;
  private int playerId = 0;

  /**
   * Returns the directory holding {@code player_<id>} folders.
   * @return the session directory, or null when the runner should do nothing
   */
  public String getSessionDir() {
    return sessionDir;
  }

  public void setSessionDir(String sessionDir) {
    this.sessionDir = sessionDir;
  }

  public int getPlayerId() {
    return playerId;
  }

  public void setPlayerId(int playerId) {
    this.playerId = playerId;
  }
}
