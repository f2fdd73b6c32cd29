package io.replicapacker.planning;

import io.replicapacker.allocation.FirstFitDecreasingPacker;
import io.replicapacker.allocation.OrderingSearchOptimizer;
import io.replicapacker.allocation.PackingException;
import io.replicapacker.allocation.SearchResult;
import io.replicapacker.allocation.ordering.DimensionOrderingStrategy;
import io.replicapacker.allocation.ordering.ExhaustiveOrderingStrategy;
import io.replicapacker.allocation.ordering.RandomSampleOrderingStrategy;
import io.replicapacker.config.PackerConfig;
import io.replicapacker.metrics.MetricsProvider;
import io.replicapacker.models.Replica;
import io.replicapacker.models.ResourceVector;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static io.replicapacker.config.Constants.SEARCH_STRATEGY_EXHAUSTIVE;

/**
 * Entry point for planning requests from the REST API and the command line.
 * 
 * Fills in the configured seed and sample budget when the caller leaves them out,
 * runs the ordering search and records the outcome as metrics. Owns the worker
 * pool that runs packing trials when parallelism is above 1.
 */
@Slf4j
public class PlanManager {
    
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 10L;
    
    private final PackerConfig config;
    private final MetricsProvider metricsProvider;
    private final DimensionOrderingStrategy orderingStrategy;
    private final ExecutorService trialExecutor;
    private final OrderingSearchOptimizer optimizer;
    
    public PlanManager(PackerConfig config, MetricsProvider metricsProvider) {
        this.config = config;
        this.metricsProvider = metricsProvider;
        this.orderingStrategy = SEARCH_STRATEGY_EXHAUSTIVE.equals(config.getSearchStrategy())
            ? new ExhaustiveOrderingStrategy()
            : new RandomSampleOrderingStrategy();
        
        if (config.getParallelism() > 1) {
            this.trialExecutor = Executors.newFixedThreadPool(config.getParallelism(), r -> {
                Thread t = new Thread(r);
                t.setName("packing-trial-" + t.getId());
                t.setDaemon(true);
                return t;
            });
        } else {
            this.trialExecutor = null;
        }
        
        this.optimizer = new OrderingSearchOptimizer(
            new FirstFitDecreasingPacker(), orderingStrategy, config.getMaxTrials(), trialExecutor);
        
        log.info("PlanManager initialized: strategy={}, maxTrials={}, parallelism={}", 
                orderingStrategy.getStrategyName(), config.getMaxTrials(), config.getParallelism());
    }
    
    /**
     * Find the best plan for the given replicas.
     *
     * @param replicas replicas to place
     * @param capacity capacity of every server
     * @param seed generator seed, or null for the configured default
     * @param sampleBudget number of random orderings to try, or null for the configured default
     * @return the winning plan with search details
     * @throws PackingException if the instance cannot be packed
     */
    public SearchResult createPlan(List<Replica> replicas, ResourceVector capacity, Long seed, Integer sampleBudget)
            throws PackingException {
        long effectiveSeed = seed != null ? seed : config.getSeed();
        int effectiveBudget = sampleBudget != null ? sampleBudget : config.getSampleBudget();
        
        log.info("Planning {} replicas (seed={}, sampleBudget={})", replicas.size(), effectiveSeed, effectiveBudget);
        long start = System.nanoTime();
        try {
            SearchResult result = optimizer.search(replicas, capacity, effectiveBudget, effectiveSeed);
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            metricsProvider.recordPlan(orderingStrategy.getStrategyName(), 
                result.getBestPlan().getServerCount(), result.getTrialsEvaluated(), elapsed);
            log.info("Plan ready: {} servers after {} trials in {} ms", 
                    result.getBestPlan().getServerCount(), result.getTrialsEvaluated(), elapsed.toMillis());
            return result;
        } catch (PackingException | RuntimeException e) {
            metricsProvider.recordFailure(e.getClass().getSimpleName());
            log.warn("Planning failed for {} replicas: {}", replicas.size(), e.getMessage());
            throw e;
        }
    }
    
    /**
     * Graceful shutdown of the trial pool.
     */
    @PreDestroy
    public void shutdown() {
        if (trialExecutor == null) {
            return;
        }
        log.debug("Stopping packing trial pool...");
        trialExecutor.shutdown();
        try {
            if (!trialExecutor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Packing trial pool did not terminate in time, forcing shutdown");
                trialExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            trialExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
