package ai.bombbuster.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Spring Boot configuration properties for the deduction engine.
 *
 * Controls the global consistency solver, the local filter loop and the call suggesters.
 *
 * Usage:
 * {@code mvn -pl engine spring-boot:run -Dspring-boot.run.arguments=--solver.timeout=2s}
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "solver")
public class SolverProperties {
  private boolean globalEnabled = true;
  private Duration timeout = Duration.ofMillis(5000);
  private boolean parallel = true;
  private int workerThreads = 0;
  private int maxFilterIterations = 100;
  private int subsetMaxSize = 0;
  private int signatureCacheSize = 4096;
  private int maxUncertainty = 3;
  private int doubleChanceMaxHands = 1_000_000;

  /**
   * Returns whether the global consistency solver runs after the local filters.
   * @return true when global solving is enabled
   */
  public boolean isGlobalEnabled() {
    return globalEnabled;
  }

  public void setGlobalEnabled(boolean globalEnabled) {
    this.globalEnabled = globalEnabled;
  }

  /**
   * Returns the wall-clock budget of one global solve.
   * @return the timeout, {@link Duration#ZERO} for none
   */
  public Duration getTimeout() {
    return timeout;
  }

  public void setTimeout(Duration timeout) {
    this.timeout = timeout;
  }

  /**
   * Returns whether signature generation and call simulations use the worker pool.
   * @return true to fan out on worker threads
   */
  public boolean isParallel() {
    return parallel;
  }

  public void setParallel(boolean parallel) {
    this.parallel = parallel;
  }

  /**
   * Returns the worker pool size.
   * @return thread count, 0 for the number of available processors
   */
  public int getWorkerThreads() {
    return workerThreads;
  }

  public void setWorkerThreads(int workerThreads) {
    this.workerThreads = workerThreads;
  }

  public int getMaxFilterIterations() {
    return maxFilterIterations;
  }

  public void setMaxFilterIterations(int maxFilterIterations) {
    this.maxFilterIterations = maxFilterIterations;
  }

  /**
   * Returns the largest value subset the subset-cardinality filter enumerates.
   * @return subset size cap, 0 for uncapped
   */
  public int getSubsetMaxSize() {
    return subsetMaxSize;
  }

  public void setSubsetMaxSize(int subsetMaxSize) {
    this.subsetMaxSize = subsetMaxSize;
  }

  public int getSignatureCacheSize() {
    return signatureCacheSize;
  }

  public void setSignatureCacheSize(int signatureCacheSize) {
    this.signatureCacheSize = signatureCacheSize;
  }

  /**
   * Returns the largest candidate set the entropy suggester simulates calls on.
   * @return candidate count limit
   */
  public int getMaxUncertainty() {
    return maxUncertainty;
  }

  public void setMaxUncertainty(int maxUncertainty) {
    this.maxUncertainty = maxUncertainty;
  }

  public int getDoubleChanceMaxHands() {
    return doubleChanceMaxHands;
  }

  public void setDoubleChanceMaxHands(int doubleChanceMaxHands) {
    this.doubleChanceMaxHands = doubleChanceMaxHands;
  }
}
