package io.replicapacker.allocation;

import io.replicapacker.allocation.ordering.DimensionOrderingStrategy;
import io.replicapacker.allocation.ordering.RandomSampleOrderingStrategy;
import io.replicapacker.enums.ResourceDimension;
import io.replicapacker.models.Plan;
import io.replicapacker.models.Replica;
import io.replicapacker.models.ResourceVector;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Searches over dimension orderings for the best First-Fit Decreasing plan.
 * 
 * Flow:
 * 1. Validate the instance once
 * 2. Rank dimensions by criticality (aggregate demand / capacity), scarcest first.
 *    This canonical order is always the first candidate
 * 3. Ask the ordering strategy for further candidates, using a generator seeded by the caller
 * 4. Cap the candidate list at {@code maxTrials}
 * 5. Pack once per candidate, inline or on the executor
 * 6. Reduce in candidate order with {@link PlanComparator}, keeping the earlier plan on ties
 * 
 * Sampling happens before any trial runs and the reduction order is fixed, so the
 * result does not depend on whether trials ran in parallel.
 */
@Slf4j
public class OrderingSearchOptimizer {
    
    public static final int DEFAULT_SAMPLE_BUDGET = 100;
    
    private final FirstFitDecreasingPacker packer;
    private final DimensionOrderingStrategy orderingStrategy;
    private final PlanComparator planComparator = new PlanComparator();
    private final int maxTrials;
    private final ExecutorService executor;
    
    public OrderingSearchOptimizer() {
        this(new FirstFitDecreasingPacker(), new RandomSampleOrderingStrategy(), Integer.MAX_VALUE, null);
    }
    
    /**
     * @param packer packer run once per candidate ordering
     * @param orderingStrategy source of candidates besides the canonical order
     * @param maxTrials ceiling on packer runs per search, canonical run included; at least 1
     * @param executor runs trials concurrently when non-null; owned by the caller
     */
    public OrderingSearchOptimizer(FirstFitDecreasingPacker packer, DimensionOrderingStrategy orderingStrategy,
                                   int maxTrials, ExecutorService executor) {
        if (maxTrials < 1) {
            throw new IllegalArgumentException("maxTrials must be at least 1, got " + maxTrials);
        }
        this.packer = Objects.requireNonNull(packer, "packer");
        this.orderingStrategy = Objects.requireNonNull(orderingStrategy, "orderingStrategy");
        this.maxTrials = maxTrials;
        this.executor = executor;
    }
    
    public Plan optimize(List<Replica> replicas, ResourceVector capacity, int sampleBudget, long seed)
            throws PackingException {
        return search(replicas, capacity, sampleBudget, seed).getBestPlan();
    }
    
    /**
     * Same as {@link #optimize} but also reports the canonical order, criticality and trial count.
     */
    public SearchResult search(List<Replica> replicas, ResourceVector capacity, int sampleBudget, long seed)
            throws PackingException {
        Objects.requireNonNull(replicas, "replicas");
        Objects.requireNonNull(capacity, "capacity");
        PackingValidator.validate(replicas, capacity);
        
        Map<ResourceDimension, Double> criticality = criticality(replicas, capacity);
        List<ResourceDimension> canonicalOrder = rankByCriticality(criticality);
        
        if (replicas.isEmpty()) {
            log.info("No replicas to place, returning empty plan");
            return new SearchResult(Plan.empty(capacity, canonicalOrder), canonicalOrder, criticality, 0);
        }
        
        List<List<ResourceDimension>> candidates = buildCandidates(canonicalOrder, sampleBudget, seed);
        log.info("Searching {} orderings for {} replicas using {} strategy (canonical order {}, criticality {})", 
                candidates.size(), replicas.size(), orderingStrategy.getStrategyName(), canonicalOrder, criticality);
        
        List<Plan> plans = executor == null
            ? runInline(replicas, capacity, candidates)
            : runOnExecutor(replicas, capacity, candidates);
        
        Plan best = null;
        for (Plan plan : plans) {
            if (planComparator.isBetter(plan, best)) {
                best = plan;
            }
        }
        
        log.info("Best plan uses {} servers (spare capacity {}) with order {}", 
                best.getServerCount(), best.getTotalSpareCapacity(), best.getDimensionOrder());
        return new SearchResult(best, canonicalOrder, criticality, plans.size());
    }
    
    /**
     * Aggregate demand divided by capacity, per dimension. Dimensions with zero capacity score 0.
     */
    public Map<ResourceDimension, Double> criticality(List<Replica> replicas, ResourceVector capacity) {
        ResourceVector aggregate = ResourceVector.zero();
        for (Replica replica : replicas) {
            aggregate = aggregate.plus(replica.getDemand());
        }
        
        Map<ResourceDimension, Double> criticality = new EnumMap<>(ResourceDimension.class);
        for (ResourceDimension dimension : ResourceDimension.values()) {
            double cap = capacity.get(dimension);
            criticality.put(dimension, cap > 0 ? aggregate.get(dimension) / cap : 0.0);
        }
        return criticality;
    }
    
    /**
     * Dimensions by descending criticality; equal scores keep declaration order.
     */
    public List<ResourceDimension> canonicalOrder(List<Replica> replicas, ResourceVector capacity) {
        return rankByCriticality(criticality(replicas, capacity));
    }
    
    /**
     * Orderings a search would evaluate, canonical first, already capped at {@code maxTrials}.
     */
    public List<List<ResourceDimension>> candidateOrderings(List<Replica> replicas, ResourceVector capacity,
                                                            int sampleBudget, long seed) {
        return buildCandidates(canonicalOrder(replicas, capacity), sampleBudget, seed);
    }
    
    private List<List<ResourceDimension>> buildCandidates(List<ResourceDimension> canonicalOrder, int sampleBudget, long seed) {
        if (sampleBudget < 0) {
            throw new IllegalArgumentException("Sample budget must not be negative, got " + sampleBudget);
        }
        Random random = new Random(seed);
        
        List<List<ResourceDimension>> candidates = new ArrayList<>();
        candidates.add(canonicalOrder);
        for (List<ResourceDimension> ordering : orderingStrategy.candidateOrderings(canonicalOrder, sampleBudget, random)) {
            if (candidates.size() >= maxTrials) {
                log.debug("Trial ceiling {} reached, skipping remaining orderings", maxTrials);
                break;
            }
            if (!ordering.equals(canonicalOrder)) {
                candidates.add(ordering);
            }
        }
        return candidates;
    }
    
    private List<ResourceDimension> rankByCriticality(Map<ResourceDimension, Double> criticality) {
        List<ResourceDimension> order = new ArrayList<>(Arrays.asList(ResourceDimension.values()));
        order.sort(Comparator.comparing((ResourceDimension dimension) -> criticality.get(dimension), Comparator.reverseOrder()));
        return Collections.unmodifiableList(order);
    }
    
    private List<Plan> runInline(List<Replica> replicas, ResourceVector capacity,
                                 List<List<ResourceDimension>> candidates) throws PackingException {
        List<Plan> plans = new ArrayList<>(candidates.size());
        for (List<ResourceDimension> ordering : candidates) {
            plans.add(packer.pack(replicas, capacity, ordering));
        }
        return plans;
    }
    
    private List<Plan> runOnExecutor(List<Replica> replicas, ResourceVector capacity,
                                     List<List<ResourceDimension>> candidates) throws PackingException {
        List<Replica> shared = List.copyOf(replicas);
        List<Future<Plan>> futures = new ArrayList<>(candidates.size());
        for (List<ResourceDimension> ordering : candidates) {
            futures.add(executor.submit(() -> packer.pack(shared, capacity, ordering)));
        }
        
        List<Plan> plans = new ArrayList<>(futures.size());
        try {
            for (Future<Plan> future : futures) {
                plans.add(future.get());
            }
        } catch (InterruptedException e) {
            futures.forEach(future -> future.cancel(true));
            Thread.currentThread().interrupt();
            throw new PackingException("Interrupted while waiting for packing trials", e);
        } catch (ExecutionException e) {
            futures.forEach(future -> future.cancel(true));
            Throwable cause = e.getCause();
            if (cause instanceof PackingException) {
                throw (PackingException) cause;
            }
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new PackingException("Packing trial failed: " + cause.getMessage(), cause);
        }
        return plans;
    }
}
