package com.devflow.engine.accumulate;

import com.devflow.engine.config.AnalysisProperties;
import com.devflow.engine.dfg.DfgBuilder;
import com.devflow.process.error.AnalysisFaultException;
import com.devflow.process.model.Case;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Runs the single pass over all cases, either on the calling thread or split into contiguous partitions on a
 * fixed worker pool. Each partition fills its own {@link CaseLogAccumulator}; the partials are merged only after
 * every worker has finished, and a failing worker aborts the whole pass.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CaseAccumulationExecutor {

    private final AnalysisProperties properties;
    private final DfgBuilder dfgBuilder;

    private ExecutorService executor;
    private int workers = 1;

    @PostConstruct
    public void start() {
        init(properties.getParallel().getWorkers());
    }

    void init(int workerCount) {
        this.workers = Math.max(1, workerCount);
        if (workers > 1) {
            AtomicInteger sequence = new AtomicInteger();
            executor = Executors.newFixedThreadPool(workers, r -> {
                Thread thread = new Thread(r, "devflow-accumulate-" + sequence.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            });
        }
        log.info(
                "Case accumulation executor started workers={}, threshold={}",
                workers,
                properties.getParallel().getThreshold());
    }

    @PreDestroy
    public void stop() {
        if (executor != null) {
            executor.shutdownNow();
            executor = null;
        }
    }

    public CaseLogAccumulator accumulate(List<Case> cases) {
        if (executor == null || cases.size() < properties.getParallel().getThreshold()) {
            return accumulateRange(cases, 0, cases.size());
        }
        int partitionSize = (cases.size() + workers - 1) / workers;
        List<Future<CaseLogAccumulator>> partials = new ArrayList<>(workers);
        for (int from = 0; from < cases.size(); from += partitionSize) {
            int start = from;
            int end = Math.min(cases.size(), from + partitionSize);
            partials.add(executor.submit(() -> accumulateRange(cases, start, end)));
        }
        log.debug("Accumulating cases={} across partitions={}", cases.size(), partials.size());

        CaseLogAccumulator merged = null;
        try {
            for (Future<CaseLogAccumulator> partial : partials) {
                CaseLogAccumulator result = partial.get();
                merged = merged == null ? result : merged.merge(result);
            }
        } catch (InterruptedException ie) {
            cancelAll(partials);
            Thread.currentThread().interrupt();
            throw new AnalysisFaultException("Interrupted while accumulating cases", ie);
        } catch (ExecutionException ee) {
            cancelAll(partials);
            Throwable cause = ee.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new AnalysisFaultException("Case accumulation worker failed", cause);
        }
        return merged;
    }

    private CaseLogAccumulator accumulateRange(List<Case> cases, int from, int to) {
        CaseLogAccumulator accumulator = new CaseLogAccumulator(dfgBuilder);
        for (int ordinal = from; ordinal < to; ordinal++) {
            accumulator.accept(ordinal, cases.get(ordinal));
        }
        return accumulator;
    }

    private static void cancelAll(List<Future<CaseLogAccumulator>> partials) {
        for (Future<CaseLogAccumulator> partial : partials) {
            partial.cancel(true);
        }
    }

    public int workers() {
        return workers;
    }
}
