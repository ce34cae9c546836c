package com.di.chunkpilot.agent.planner;

import com.di.chunkpilot.agent.estimator.Bottleneck;
import com.di.chunkpilot.agent.estimator.BottleneckAnalysis;
import com.di.chunkpilot.agent.estimator.BottleneckAnalyzer;
import com.di.chunkpilot.agent.estimator.CostEstimate;
import com.di.chunkpilot.agent.estimator.CostModel;
import com.di.chunkpilot.agent.profiler.SystemProfile;
import com.di.chunkpilot.agent.profiler.SystemProfiler;
import com.di.chunkpilot.agent.sampler.SampleResult;
import com.di.chunkpilot.agent.sampler.WorkloadClass;
import com.di.chunkpilot.agent.sampler.WorkloadSampler;
import com.di.chunkpilot.exception.SamplingFailureException;
import com.di.chunkpilot.util.MetricsCollector;
import com.di.chunkpilot.worker.BackendType;
import com.di.chunkpilot.worker.SerializableFunction;
import com.di.chunkpilot.worker.WorkerCreationStrategy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Turns a function and a dataset into a {@link Decision}: profile the machine, sample the
 * workload, evaluate every (workerCount, batchSize) candidate with the {@link CostModel} and
 * pick the best one that fits in memory and clears the minimum speedup.
 *
 * <p>Stateless across calls. The optional advisor, decision cache and record store are consulted
 * first; any failure there is logged and treated as a miss.
 */
@Slf4j
@Service
public class PlannerService {

    static final String PROVENANCE_MEASURED = "measured";
    static final String PROVENANCE_ADVISOR = "advisor";
    static final String PROVENANCE_CACHE = "cache";
    static final String PROVENANCE_RESTORED = "restored";
    static final double MIN_HETEROGENEOUS_SCALE = 0.25;

    private final SystemProfiler systemProfiler;
    private final WorkloadSampler workloadSampler;
    private final CostModel costModel;
    private final BottleneckAnalyzer bottleneckAnalyzer;
    private final PlannerProperties properties;
    private final MetricsCollector metricsCollector;
    private final ExecutionAdvisor advisor;
    private final DecisionCache decisionCache;
    private final DecisionRecordStore recordStore;

    public PlannerService(SystemProfiler systemProfiler, WorkloadSampler workloadSampler, CostModel costModel,
                          BottleneckAnalyzer bottleneckAnalyzer, PlannerProperties properties,
                          MetricsCollector metricsCollector, @Nullable ExecutionAdvisor advisor,
                          @Nullable DecisionCache decisionCache, @Nullable DecisionRecordStore recordStore) {
        this.systemProfiler = systemProfiler;
        this.workloadSampler = workloadSampler;
        this.costModel = costModel;
        this.bottleneckAnalyzer = bottleneckAnalyzer;
        this.properties = properties;
        this.metricsCollector = metricsCollector;
        this.advisor = advisor;
        this.decisionCache = decisionCache;
        this.recordStore = recordStore;
    }

    /** Builder seeded from {@code chunkpilot.planner.*}. */
    public PlanningConstraints.PlanningConstraintsBuilder defaultConstraints() {
        return PlanningConstraints.builder()
                .targetChunkSeconds(properties.getTargetChunkSeconds())
                .minSpeedup(properties.getMinSpeedup())
                .memoryFraction(properties.getMemoryFraction())
                .variabilityThreshold(properties.getVariabilityThreshold())
                .advisorConfidenceThreshold(properties.getAdvisorConfidenceThreshold())
                .preferredBackend(properties.getPreferredBackend());
    }

    public <T, R> Decision decide(SerializableFunction<T, R> fn, Iterable<T> dataset) {
        return decide(fn, dataset, defaultConstraints().build());
    }

    /**
     * Full planning path: cache, record store, advisor, then measurement.
     */
    public <T, R> Decision decide(SerializableFunction<T, R> fn, Iterable<T> dataset, PlanningConstraints constraints) {
        long startMs = System.currentTimeMillis();
        String cacheIdentity = cacheIdentity(fn, constraints);
        String functionId = cacheIdentity != null ? cacheIdentity : fn.getClass().getName();
        long knownSize = knownSize(dataset, constraints);
        DecisionCacheKey key = knownSize >= 0 && cacheIdentity != null
                ? DecisionCacheKey.of(cacheIdentity, knownSize, constraints) : null;
        if (cacheIdentity == null) {
            log.debug("[PLANNER] {} carries captured state and no functionId; skipping cache", functionId);
        }

        Decision decision = lookupCached(key, knownSize, dataset, constraints)
                .or(() -> lookupStored(key, knownSize, dataset, constraints))
                .or(() -> consultAdvisor(functionId, knownSize, dataset, constraints))
                .orElse(null);

        if (decision == null) {
            decision = measureAndPlan(fn, dataset, constraints);
            remember(key, decision);
        }

        long durationMs = System.currentTimeMillis() - startMs;
        metricsCollector.recordDecision(decision.getReason().name(), decision.getWorkerCount(),
                decision.getBatchSize(), decision.getEstimatedSpeedup(), durationMs);
        log.info("[PLANNER] fn={} reason={} workers={} batch={} backend={} speedup={} in {}ms",
                functionId, decision.getReason(), decision.getWorkerCount(), decision.getBatchSize(),
                decision.getBackend(), String.format("%.2f", decision.getEstimatedSpeedup()), durationMs);
        return decision;
    }

    private <T, R> Decision measureAndPlan(SerializableFunction<T, R> fn, Iterable<T> dataset,
                                           PlanningConstraints constraints) {
        SystemProfile profile = systemProfiler.profile(constraints.getCreationStrategy());
        int sampleSize = constraints.getSampleSize() != null
                ? constraints.getSampleSize() : workloadSampler.defaultSampleSize();
        SampleResult sample;
        try {
            sample = workloadSampler.sample(fn, dataset, sampleSize, constraints.getExpectedItemCount());
        } catch (SamplingFailureException e) {
            log.warn("[PLANNER] every sampled item failed; running serially: {}", e.getMessage());
            BackendType backend = classifyBackend(WorkloadClass.MIXED, constraints);
            return Decision.builder()
                    .workerCount(1)
                    .batchSize(1)
                    .backend(backend)
                    .creationStrategy(profile.getCreationStrategy())
                    .estimatedSpeedup(1.0)
                    .reason(DecisionReason.SAMPLING_FAILED)
                    .explanation("All " + e.getFailures().size() + " sampled items raised: " + e.getMessage())
                    .targetChunkSeconds(constraints.getTargetChunkSeconds())
                    .diagnostics(DiagnosticProfile.unmeasured(backend))
                    .provenance(PROVENANCE_MEASURED)
                    .data(e.getDataset() != null ? e.getDataset() : dataset)
                    .build();
        }
        return plan(sample, profile, constraints);
    }

    /**
     * Pure planning stage over measured inputs. Deterministic: the same sample and profile always
     * produce the same decision.
     *
     * <p>A sample of unknown size is planned over {@code unknownSizeHorizonItems} items; the
     * too-small check and the result memory warning need a real size and are skipped.
     */
    public Decision plan(SampleResult measured, SystemProfile profile, PlanningConstraints constraints) {
        boolean sizeKnown = measured.isSizeKnown();
        SampleResult sample = sizeKnown ? measured
                : measured.toBuilder().totalItems(properties.getUnknownSizeHorizonItems()).build();
        long n = sample.getTotalItems();
        double perItem = sample.getMeanItemSeconds();
        BackendType backend = classifyBackend(sample.getWorkloadClass(), constraints);
        Decision.DecisionBuilder base = Decision.builder()
                .backend(backend)
                .creationStrategy(profile.getCreationStrategy())
                .targetChunkSeconds(constraints.getTargetChunkSeconds())
                .provenance(PROVENANCE_MEASURED)
                .data(sample.getDataset());
        if (!sizeKnown) {
            base.warning("Dataset size unknown; estimates assume " + n + " items");
        }

        if (n == 0) {
            return serial(base, 1, DecisionReason.EMPTY_DATASET, "Dataset is empty; nothing to parallelize",
                    diagnostics(sample, profile, backend, null));
        }
        int serialBatch = batchSizeFor(perItem, n, 1, constraints.getTargetChunkSeconds());

        if (!sample.isTransferable() && backend == BackendType.ISOLATED_WORKER) {
            return serial(base, serialBatch, DecisionReason.NOT_TRANSFERABLE,
                    sample.getTransferError() != null ? sample.getTransferError().getMessage()
                            : "Function or data cannot cross the worker isolation boundary",
                    diagnostics(sample, profile, backend, null));
        }

        double serialSeconds = sample.serialSeconds();
        if (sizeKnown && serialSeconds < 2 * profile.getSpawnCostSeconds()) {
            return serial(base, serialBatch, DecisionReason.WORKLOAD_TOO_SMALL,
                    String.format("Total work %.4fs is below twice the worker creation cost %.4fs",
                            serialSeconds, profile.getSpawnCostSeconds()),
                    diagnostics(sample, profile, backend, costModel.computeSpeedup(1, serialBatch, sample, profile, backend)));
        }

        int internal = constraints.getInternalThreads() != null
                ? Math.max(1, constraints.getInternalThreads()) : Math.max(1, sample.getInternalThreads());
        int cores = Math.max(1, profile.getPhysicalCores());
        int maxWorkers = (int) Math.min(Math.max(1, cores / internal), n);
        if (constraints.getMaxWorkers() != null) {
            maxWorkers = Math.max(1, Math.min(maxWorkers, constraints.getMaxWorkers()));
        }
        if (internal > 1) {
            log.info("[PLANNER] function uses {} threads internally; capping workers at {}", internal, maxWorkers);
        }

        double memoryBudget = constraints.getMemoryFraction() * profile.getAvailableMemoryBytes();
        List<CostEstimate> fitting = new ArrayList<>();
        CostEstimate bestOverall = null;
        for (int w = 1; w <= maxWorkers; w++) {
            int b = batchSizeFor(perItem, n, w, constraints.getTargetChunkSeconds());
            CostEstimate estimate = costModel.computeSpeedup(w, b, sample, profile, backend);
            if (bestOverall == null || estimate.getEstimatedSpeedup() > bestOverall.getEstimatedSpeedup()) {
                bestOverall = estimate;
            }
            if (memoryPerWorker(sample, profile, backend, b) * w <= memoryBudget || w == 1) {
                fitting.add(estimate);
            }
        }

        List<String> warnings = new ArrayList<>();
        boolean memoryConstrained = maxWorkers > 1 && fitting.stream().noneMatch(e -> e.getWorkerCount() > 1);
        CostEstimate best;
        if (memoryConstrained) {
            best = degradeForMemory(sample, profile, backend, maxWorkers, memoryBudget);
            if (best == null || best.getEstimatedSpeedup() < constraints.getMinSpeedup()) {
                CostEstimate single = costModel.computeSpeedup(1, serialBatch, sample, profile, backend);
                return serial(base.warnings(warnings), serialBatch, DecisionReason.MEMORY_CONSTRAINED,
                        String.format("No worker count above 1 fits in %.0f%% of %d available bytes",
                                constraints.getMemoryFraction() * 100, profile.getAvailableMemoryBytes()),
                        diagnostics(sample, profile, backend, single));
            }
            warnings.add("Memory limits the pool to " + best.getWorkerCount() + " workers with single-item batches");
        } else {
            best = fitting.get(0);
            for (CostEstimate e : fitting) {
                if (e.getEstimatedSpeedup() > best.getEstimatedSpeedup()) {
                    best = e;
                }
            }
            if (best.getWorkerCount() < bestOverall.getWorkerCount()) {
                warnings.add("Memory limits the pool to " + best.getWorkerCount() + " workers");
            }
        }

        if (!memoryConstrained && best.getEstimatedSpeedup() < constraints.getMinSpeedup()) {
            return serial(base, serialBatch, DecisionReason.SERIAL_OPTIMAL,
                    String.format("Best candidate (%d workers, batch %d) only reaches %.2fx, below %.2fx",
                            best.getWorkerCount(), best.getBatchSize(), best.getEstimatedSpeedup(),
                            constraints.getMinSpeedup()),
                    diagnostics(sample, profile, backend, best));
        }

        boolean adaptive = false;
        double cv = sample.getCoefficientOfVariation();
        if (constraints.isAdaptive() && cv > constraints.getVariabilityThreshold()) {
            double scale = Math.max(MIN_HETEROGENEOUS_SCALE, 1.0 - 0.5 * cv);
            int shrunk = Math.max(1, (int) Math.round(best.getBatchSize() * scale));
            best = costModel.computeSpeedup(best.getWorkerCount(), shrunk, sample, profile, backend);
            adaptive = true;
            warnings.add(String.format("Item times vary (CV=%.2f); batch shrunk by %.2f and adaptive batching enabled",
                    cv, scale));
        }

        double resultBytes = sample.getAvgResultBytes() * n;
        if (sizeKnown && resultBytes > properties.getResultMemoryWarningFraction() * profile.getAvailableMemoryBytes()) {
            warnings.add(String.format("Collected results need ~%.0f bytes, over %.0f%% of available memory",
                    resultBytes, properties.getResultMemoryWarningFraction() * 100));
        }

        DecisionReason reason = memoryConstrained ? DecisionReason.MEMORY_CONSTRAINED : DecisionReason.PARALLEL_BENEFICIAL;
        return base.workerCount(best.getWorkerCount())
                .batchSize(best.getBatchSize())
                .estimatedSpeedup(best.getEstimatedSpeedup())
                .reason(reason)
                .explanation(String.format("%d %s workers, batch %d: estimated %.2fx (%s)",
                        best.getWorkerCount(), backend, best.getBatchSize(), best.getEstimatedSpeedup(),
                        best.getRationale()))
                .adaptiveChunking(adaptive)
                .warnings(warnings)
                .diagnostics(diagnostics(sample, profile, backend, best))
                .build();
    }

    /**
     * Rebuilds a decision from a persisted record. The dataset is not part of the record.
     */
    public Decision fromRecord(DecisionRecord record) {
        return fromRecord(record, DecisionReason.RESTORED, PROVENANCE_RESTORED, null,
                properties.getTargetChunkSeconds());
    }

    /**
     * Wait-bound work goes to shared-memory workers; everything else is isolated. The caller's
     * preference wins.
     */
    public BackendType classifyBackend(WorkloadClass workloadClass, PlanningConstraints constraints) {
        if (constraints.getPreferredBackend() != null) {
            return constraints.getPreferredBackend();
        }
        return workloadClass == WorkloadClass.WAIT_BOUND ? BackendType.SHARED_MEMORY_WORKER : BackendType.ISOLATED_WORKER;
    }

    /**
     * Cache identity of a function: the caller's id, else the class name when instances of the
     * class carry no fields. Capturing lambdas share one class whatever they captured, so they get
     * no default identity and never hit the cache.
     */
    static String cacheIdentity(SerializableFunction<?, ?> fn, PlanningConstraints constraints) {
        if (constraints.getFunctionId() != null) {
            return constraints.getFunctionId();
        }
        return isStateless(fn.getClass()) ? fn.getClass().getName() : null;
    }

    private static boolean isStateless(Class<?> type) {
        for (Class<?> k = type; k != null && k != Object.class; k = k.getSuperclass()) {
            for (Field field : k.getDeclaredFields()) {
                if (!Modifier.isStatic(field.getModifiers())) {
                    return false;
                }
            }
        }
        return true;
    }

    // ============================================================================
    // Candidate helpers
    // ============================================================================

    static int batchSizeFor(double perItemSeconds, long totalItems, int workerCount, double targetChunkSeconds) {
        long upper = Math.max(1, (totalItems + workerCount - 1) / workerCount);
        long raw = perItemSeconds > 0 ? Math.round(targetChunkSeconds / perItemSeconds) : upper;
        return (int) Math.min(Integer.MAX_VALUE, Math.max(1, Math.min(raw, upper)));
    }

    double memoryPerWorker(SampleResult sample, SystemProfile profile, BackendType backend, int batchSize) {
        boolean isolated = backend == BackendType.ISOLATED_WORKER;
        long baseBytes = isolated && profile.getCreationStrategy() == WorkerCreationStrategy.CHILD_JVM
                ? properties.getChildJvmWorkerBaseBytes() : properties.getThreadWorkerBaseBytes();
        double perItem = sample.getAllocatedBytesPerItem()
                + (isolated ? sample.getAvgItemBytes() + sample.getAvgResultBytes() : 0.0);
        return baseBytes + batchSize * perItem;
    }

    private CostEstimate degradeForMemory(SampleResult sample, SystemProfile profile, BackendType backend,
                                          int maxWorkers, double memoryBudget) {
        double perWorker = memoryPerWorker(sample, profile, backend, 1);
        for (int w = maxWorkers; w > 1; w--) {
            if (perWorker * w <= memoryBudget) {
                log.warn("[PLANNER] memory-constrained: degrading to {} workers with batch 1", w);
                return costModel.computeSpeedup(w, 1, sample, profile, backend);
            }
        }
        return null;
    }

    private DiagnosticProfile diagnostics(SampleResult sample, SystemProfile profile, BackendType backend,
                                          CostEstimate estimate) {
        DiagnosticProfile.DiagnosticProfileBuilder d = DiagnosticProfile.builder()
                .physicalCores(profile.getPhysicalCores())
                .logicalCores(profile.getLogicalCores())
                .availableMemoryBytes(profile.getAvailableMemoryBytes())
                .creationStrategy(profile.getCreationStrategy())
                .spawnCostSeconds(profile.getSpawnCostSeconds())
                .spawnCostMeasured(profile.isSpawnCostMeasured())
                .meanItemSeconds(sample.getMeanItemSeconds())
                .coefficientOfVariation(sample.getCoefficientOfVariation())
                .workloadClass(sample.getWorkloadClass())
                .backend(backend);
        if (estimate == null) {
            return d.bottleneck(Bottleneck.NONE).build();
        }
        BottleneckAnalysis analysis = bottleneckAnalyzer.analyze(estimate, sample.getMeanItemSeconds(),
                sample.getCoefficientOfVariation(), profile.getPhysicalCores(), profile.getAvailableMemoryBytes(),
                memoryPerWorker(sample, profile, backend, estimate.getBatchSize()));
        return d.bottleneck(analysis.getPrimary())
                .bottleneckSeverity(analysis.getSeverity())
                .efficiencyScore(analysis.getEfficiencyScore())
                .overheadBreakdown(analysis.getOverheadBreakdown())
                .recommendations(analysis.getRecommendations())
                .build();
    }

    private static Decision serial(Decision.DecisionBuilder base, int batchSize, DecisionReason reason,
                                   String explanation, DiagnosticProfile diagnostics) {
        return base.workerCount(1)
                .batchSize(Math.max(1, batchSize))
                .estimatedSpeedup(1.0)
                .reason(reason)
                .explanation(explanation)
                .adaptiveChunking(false)
                .diagnostics(diagnostics)
                .build();
    }

    // ============================================================================
    // Advisor, cache and persistence
    // ============================================================================

    private Optional<Decision> lookupCached(DecisionCacheKey key, long size, Iterable<?> dataset, PlanningConstraints c) {
        if (key == null || decisionCache == null) return Optional.empty();
        try {
            return decisionCache.get(key)
                    .map(r -> fromRecord(clamp(r, size, c), DecisionReason.CACHED, PROVENANCE_CACHE, dataset,
                            c.getTargetChunkSeconds()));
        } catch (RuntimeException e) {
            log.warn("[PLANNER] decision cache lookup failed, treating as miss: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<Decision> lookupStored(DecisionCacheKey key, long size, Iterable<?> dataset, PlanningConstraints c) {
        if (key == null || recordStore == null) return Optional.empty();
        try {
            return recordStore.load(key)
                    .filter(r -> r.schemaVersion() == key.schemaVersion())
                    .map(r -> fromRecord(clamp(r, size, c), DecisionReason.RESTORED, PROVENANCE_RESTORED, dataset,
                            c.getTargetChunkSeconds()));
        } catch (RuntimeException e) {
            log.warn("[PLANNER] decision record load failed, treating as miss: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<Decision> consultAdvisor(String functionId, long size, Iterable<?> dataset, PlanningConstraints c) {
        if (advisor == null) return Optional.empty();
        Optional<AdvisorHint> hint;
        try {
            hint = advisor.advise(functionId, size);
        } catch (RuntimeException e) {
            log.warn("[PLANNER] advisor failed, measuring instead: {}", e.getMessage());
            return Optional.empty();
        }
        if (hint.isEmpty()) return Optional.empty();
        AdvisorHint h = hint.get();
        if (h.confidence() < c.getAdvisorConfidenceThreshold()) {
            log.debug("[PLANNER] advisor confidence {} below {}; measuring", h.confidence(), c.getAdvisorConfidenceThreshold());
            return Optional.empty();
        }
        int workers = Math.max(1, Math.min(h.workerCount(), workerCap(size, c)));
        int batch = Math.max(1, h.batchSize());
        if (size > 0) {
            batch = (int) Math.min(batch, size);
        }
        BackendType backend = c.getPreferredBackend() != null ? c.getPreferredBackend() : BackendType.ISOLATED_WORKER;
        return Optional.of(Decision.builder()
                .workerCount(workers)
                .batchSize(batch)
                .backend(backend)
                .creationStrategy(c.getCreationStrategy() != null ? c.getCreationStrategy()
                        : WorkerCreationStrategy.PLATFORM_THREAD)
                .estimatedSpeedup(1.0)
                .reason(DecisionReason.ADVISOR)
                .explanation(String.format("Advisor hint accepted with confidence %.2f; speedup not estimated",
                        h.confidence()))
                .targetChunkSeconds(c.getTargetChunkSeconds())
                .diagnostics(DiagnosticProfile.unmeasured(backend))
                .provenance(PROVENANCE_ADVISOR)
                .data(dataset)
                .build());
    }

    /** Upper bound on workers for this call: cores, the caller's limits and the dataset size. */
    private int workerCap(long size, PlanningConstraints c) {
        int cap = Math.max(1, systemProfiler.detectPhysicalCores());
        if (c.getInternalThreads() != null) {
            cap = Math.max(1, cap / Math.max(1, c.getInternalThreads()));
        }
        if (c.getMaxWorkers() != null) {
            cap = Math.min(cap, Math.max(1, c.getMaxWorkers()));
        }
        if (size > 0) {
            cap = (int) Math.min(cap, size);
        }
        return cap;
    }

    /** Fits a reused record to this machine and call; records from other machines may be larger. */
    private DecisionRecord clamp(DecisionRecord record, long size, PlanningConstraints c) {
        int workers = Math.max(1, Math.min(record.workerCount(), workerCap(size, c)));
        int batch = Math.max(1, record.batchSize());
        if (size > 0) {
            batch = (int) Math.min(batch, size);
        }
        if (workers == record.workerCount() && batch == record.batchSize()) {
            return record;
        }
        log.info("[PLANNER] reused decision {}x{} clamped to {}x{}", record.workerCount(), record.batchSize(),
                workers, batch);
        return new DecisionRecord(workers, batch, record.backend(), record.creationStrategy(),
                Math.min(record.estimatedSpeedup(), workers), record.adaptiveChunking(), record.provenance(),
                record.schemaVersion(), record.createdAt());
    }

    private void remember(DecisionCacheKey key, Decision decision) {
        if (key == null || decision.getReason() == DecisionReason.SAMPLING_FAILED) return;
        DecisionRecord record = decision.toRecord();
        if (decisionCache != null) {
            try {
                decisionCache.put(key, record);
            } catch (RuntimeException e) {
                log.warn("[PLANNER] decision cache put failed: {}", e.getMessage());
            }
        }
        if (recordStore != null) {
            try {
                recordStore.save(key, record);
            } catch (RuntimeException e) {
                log.warn("[PLANNER] decision record save failed: {}", e.getMessage());
            }
        }
    }

    private static Decision fromRecord(DecisionRecord record, DecisionReason reason, String provenance,
                                       Iterable<?> dataset, double targetChunkSeconds) {
        return Decision.builder()
                .workerCount(Math.max(1, record.workerCount()))
                .batchSize(Math.max(1, record.batchSize()))
                .backend(record.backend() != null ? record.backend() : BackendType.ISOLATED_WORKER)
                .creationStrategy(record.creationStrategy() != null ? record.creationStrategy()
                        : WorkerCreationStrategy.PLATFORM_THREAD)
                .estimatedSpeedup(record.estimatedSpeedup())
                .reason(reason)
                .explanation("Reused " + record.provenance() + " decision from " + record.createdAt())
                .adaptiveChunking(record.adaptiveChunking())
                .targetChunkSeconds(targetChunkSeconds)
                .diagnostics(DiagnosticProfile.unmeasured(record.backend()))
                .provenance(provenance)
                .data(dataset)
                .build();
    }

    private static long knownSize(Iterable<?> dataset, PlanningConstraints constraints) {
        if (dataset instanceof Collection<?> collection) {
            return collection.size();
        }
        return constraints.getExpectedItemCount() != null ? constraints.getExpectedItemCount() : -1;
    }
}
