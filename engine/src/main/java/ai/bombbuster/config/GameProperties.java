package ai.bombbuster.config;

import ai.bombbuster.game.GameConfig;
import ai.bombbuster.game.ValueDomain;
import java.util.Map;
import java.util.TreeMap;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Spring Boot configuration properties describing the table: value distribution, player count,
 * hand size and rule variant.
 *
 * The distribution is written as {@code value:copies} pairs, for example
 * {@code game.distribution=1:4,2:4,6.5:1}.
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "game")
public class GameProperties {
  private int players = 5;
  private int handSize = 0;
  private boolean informal = false;
  private String distribution = "";
  private Map<Integer, String> playerNames = new TreeMap<>();

  public int getPlayers() {
    return players;
  }

  public void setPlayers(int players) {
    this.players = players;
  }

  /**
   * Returns the hand size.
   * @return cards per player, 0 to split the deck evenly
   */
  public int getHandSize() {
    return handSize;
  }

  public void setHandSize(int handSize) {
    this.handSize = handSize;
  }

  /**
   * Returns whether the informal rule variant is played (no possession checks on calls).
   * @return true for informal mode
   */
  public boolean isInformal() {
    return informal;
  }

  public void setInformal(boolean informal) {
    this.informal = informal;
  }

  public String getDistribution() {
    return distribution;
  }

  public void setDistribution(String distribution) {
    this.distribution = distribution;
  }

  public Map<Integer, String> getPlayerNames() {
    return playerNames;
  }

  public void setPlayerNames(Map<Integer, String> playerNames) {
    this.playerNames = playerNames;
  }

  /**
   * Builds the immutable game configuration.
   * @return the configuration described by these properties
   * @throws IllegalArgumentException if the distribution is missing or inconsistent
   */
  public GameConfig toGameConfig() {
    if (distribution == null || distribution.isBlank()) {
      throw new IllegalArgumentException("game.distribution is not set");
    }
    return new GameConfig(ValueDomain.parse(distribution), players, handSize, informal);
  }
}
