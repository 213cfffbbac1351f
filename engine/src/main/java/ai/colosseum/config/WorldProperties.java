package ai.colosseum.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Spring Boot configuration properties for the game world.
 *
 * Usage:
 * {@code java -jar engine.jar --world.player-one=greedy_agent --world.board-size=8 --world.seed=42}
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "world")
public class WorldProperties {
  /** Registered name of player A. */
  private String playerOne = "random_agent";

  /** Registered name of player B. */
  private String playerTwo = "random_agent";

  /** Board size; {@code null} draws a random size. */
  private Integer boardSize;

  /** Seed for every random decision; {@code null} for an unseeded game. */
  private Long seed;

  /** When true, both players must be able to play unattended. */
  private boolean autoplay = false;

  /** When true, the board is logged at INFO after every turn. */
  private boolean debug = false;

  public String getPlayerOne() {
    return playerOne;
  }

  public void setPlayerOne(String playerOne) {
    this.playerOne = playerOne;
  }

  public String getPlayerTwo() {
    return playerTwo;
  }

  public void setPlayerTwo(String playerTwo) {
    this.playerTwo = playerTwo;
  }

  public Integer getBoardSize() {
    return boardSize;
  }

  public void setBoardSize(Integer boardSize) {
    this.boardSize = boardSize;
  }

  public Long getSeed() {
    return seed;
  }

  public void setSeed(Long seed) {
    this.seed = seed;
  }

  /**
   * Returns whether autoplay mode is requested.
   * @return true if both players must run unattended
   */
  public boolean isAutoplay() {
    return autoplay;
  }

  public void setAutoplay(boolean autoplay) {
    this.autoplay = autoplay;
  }

  public boolean isDebug() {
    return debug;
  }

  public void setDebug(boolean debug) {
    this.debug = debug;
  }
}
