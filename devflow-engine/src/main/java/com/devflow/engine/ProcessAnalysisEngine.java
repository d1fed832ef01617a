package com.devflow.engine;

import com.devflow.engine.accumulate.CaseAccumulationExecutor;
import com.devflow.engine.accumulate.CaseLogAccumulator;
import com.devflow.engine.assemble.MetricsAssembler;
import com.devflow.engine.bottleneck.BottleneckRanker;
import com.devflow.engine.dfg.DfgBuilder;
import com.devflow.engine.dfg.DirectlyFollowsGraph;
import com.devflow.engine.index.CaseIndexer;
import com.devflow.engine.rework.ReworkSummary;
import com.devflow.engine.session.AnalysisSession;
import com.devflow.engine.stats.DurationStatistics;
import com.devflow.engine.stats.DurationStatisticsCalculator;
import com.devflow.engine.variant.VariantAnalyzer;
import com.devflow.engine.variant.VariantSummary;
import com.devflow.process.error.EmptyEventLogException;
import com.devflow.process.model.AnalysisResult;
import com.devflow.process.model.Bottleneck;
import com.devflow.process.model.Case;
import com.devflow.process.model.Event;
import java.time.Clock;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Entry point of the process analysis: raw events in, one {@link AnalysisResult} out, or a
 * {@link com.devflow.process.error.ProcessAnalysisFailure}. Stateless; concurrent calls share nothing.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProcessAnalysisEngine {

    private final CaseIndexer caseIndexer;
    private final DfgBuilder dfgBuilder;
    private final CaseAccumulationExecutor accumulationExecutor;
    private final DurationStatisticsCalculator durationCalculator;
    private final VariantAnalyzer variantAnalyzer;
    private final BottleneckRanker bottleneckRanker;
    private final MetricsAssembler metricsAssembler;
    private final Clock clock;

    public AnalysisResult analyze(Collection<Event> events) {
        long startedAt = clock.millis();
        List<Case> cases = indexNonEmpty(events);

        CaseLogAccumulator accumulated = accumulationExecutor.accumulate(cases);
        DurationStatistics durations = durationCalculator.summarize(accumulated.durations());
        VariantSummary variants = variantAnalyzer.rank(accumulated.variants());
        List<Bottleneck> bottlenecks = bottleneckRanker.rank(accumulated.graph());
        ReworkSummary rework = accumulated.rework().summary();
        AnalysisResult result =
                metricsAssembler.assemble(accumulated.counts(), durations, variants, bottlenecks, rework);

        log.info(
                "Process analysis complete cases={} events={} variants={} bottlenecks={} elapsedMs={}",
                result.caseCount(),
                result.eventCount(),
                result.variantCount(),
                result.bottlenecks().size(),
                clock.millis() - startedAt);
        return result;
    }

    /** Every variant of the log, ranked as for the dominant variant. */
    public VariantSummary variants(Collection<Event> events) {
        return variantAnalyzer.analyze(indexNonEmpty(events));
    }

    public DirectlyFollowsGraph directlyFollowsGraph(Collection<Event> events) {
        return dfgBuilder.build(indexNonEmpty(events));
    }

    public AnalysisSession openSession() {
        return new AnalysisSession(this, clock);
    }

    private List<Case> indexNonEmpty(Collection<Event> events) {
        Map<String, Case> indexed = caseIndexer.index(events);
        if (indexed.isEmpty()) {
            throw new EmptyEventLogException();
        }
        return List.copyOf(indexed.values());
    }
}
