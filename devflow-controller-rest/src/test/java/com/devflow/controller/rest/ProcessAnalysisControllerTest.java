package com.devflow.controller.rest;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.startsWith;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.devflow.engine.ProcessAnalysisEngine;
import com.devflow.engine.accumulate.CaseAccumulationExecutor;
import com.devflow.engine.assemble.MetricsAssembler;
import com.devflow.engine.bottleneck.BottleneckRanker;
import com.devflow.engine.config.AnalysisProperties;
import com.devflow.engine.dfg.DfgBuilder;
import com.devflow.engine.index.CaseIndexer;
import com.devflow.engine.report.AnalysisContextRenderer;
import com.devflow.engine.stats.DurationStatisticsCalculator;
import com.devflow.engine.variant.VariantAnalyzer;
import com.devflow.ingest.csv.CsvEventLogLoader;
import com.devflow.ingest.csv.CsvIngestProperties;
import com.devflow.process.error.AnalysisFaultException;
import java.time.Clock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class ProcessAnalysisControllerTest {

    private static final String LOG = """
            {"events":[
              {"caseId":"c-1","activity":"A","timestamp":"2024-01-01T00:00:00Z"},
              {"caseId":"c-1","activity":"B","timestamp":"2024-01-01T10:00:00Z"},
              {"caseId":"c-2","activity":"A","timestamp":"2024-01-01T00:00:00Z"},
              {"caseId":"c-2","activity":"B","timestamp":"2024-01-01T20:00:00Z"},
              {"caseId":"c-2","activity":"A","timestamp":"2024-01-01T21:00:00Z"}
            ]}
            """;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        AnalysisProperties properties = new AnalysisProperties();
        ProcessAnalysisEngine engine = new ProcessAnalysisEngine(
                new CaseIndexer(),
                new DfgBuilder(),
                new CaseAccumulationExecutor(properties, new DfgBuilder()),
                new DurationStatisticsCalculator(),
                new VariantAnalyzer(),
                new BottleneckRanker(properties),
                new MetricsAssembler(),
                Clock.systemUTC());
        ProcessAnalysisController controller = new ProcessAnalysisController(
                engine, new AnalysisContextRenderer(), new CsvEventLogLoader(new CsvIngestProperties()));
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new RestErrorHandler())
                .build();
    }

    @Test
    void analyzeReturnsCanonicalReport() throws Exception {
        mockMvc.perform(post("/api/process/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(LOG))
                .andExpect(status().isOk())
                .andExpect(content().string(startsWith("{\"n_cases\":2,\"n_events\":5")))
                .andExpect(jsonPath("$.bottlenecks[0].from_activity").value("A"))
                .andExpect(jsonPath("$.bottlenecks[0].avg_wait_hours").value(15.0))
                .andExpect(jsonPath("$.bottlenecks[0].frequency").value(2))
                .andExpect(jsonPath("$.rework_activities[0]").value("A"))
                .andExpect(jsonPath("$.rework_rate").value(0.5));
    }

    @Test
    void analyzeAcceptsCsvBody() throws Exception {
        String csv = "case_id,activity,timestamp\nc-1,A,2024-01-01T00:00:00Z\nc-1,B,2024-01-01T02:00:00Z\n";

        mockMvc.perform(post("/api/process/analyze")
                        .contentType(ProcessAnalysisController.TEXT_CSV)
                        .content(csv))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.n_cases").value(1))
                .andExpect(jsonPath("$.max_duration_hours").value(2.0));
    }

    @Test
    void analyzeAcceptsCsvWithByteOrderMark() throws Exception {
        String csv = "\uFEFFcase_id,activity,timestamp\n"
                + "c-1,Prüfung,2024-01-01T00:00:00Z\n"
                + "c-1,Freigabe,2024-01-01T03:00:00Z\n";

        mockMvc.perform(post("/api/process/analyze")
                        .contentType(ProcessAnalysisController.TEXT_CSV)
                        .content(csv))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.n_events").value(2))
                .andExpect(jsonPath("$.max_duration_hours").value(3.0))
                .andExpect(jsonPath("$.top_variant[0]").value("Prüfung"));
    }

    @Test
    void contextRendersMarkdown() throws Exception {
        mockMvc.perform(post("/api/process/context")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(LOG))
                .andExpect(status().isOk())
                .andExpect(content().string(containsString("## Dominant Path")))
                .andExpect(content().string(containsString("- A -> B: avg wait 15.00h")));
    }

    @Test
    void variantsListsEveryVariant() throws Exception {
        mockMvc.perform(post("/api/process/variants")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(LOG))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.variantCount").value(2))
                .andExpect(jsonPath("$.variants[0].activities[0]").value("A"))
                .andExpect(jsonPath("$.variants[0].caseIds[0]").value("c-1"));
    }

    @Test
    void emptyLogIsUnprocessable() throws Exception {
        mockMvc.perform(post("/api/process/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"events\":[]}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("analysis.empty-log"))
                .andExpect(jsonPath("$.path").value("/api/process/analyze"));
    }

    @Test
    void invalidTimestampIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/process/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"events\":[{\"caseId\":\"c-1\",\"activity\":\"A\",\"timestamp\":\"soon\"}]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("analysis.invalid-event"));
    }

    @Test
    void malformedBodyIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/process/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"events\":"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value(RestErrorHandler.CODE_UNREADABLE));
    }

    @Test
    void engineFaultIsServerError() throws Exception {
        ProcessAnalysisEngine failing = mock(ProcessAnalysisEngine.class);
        when(failing.analyze(any())).thenThrow(new AnalysisFaultException("Non-finite value for rework_rate: NaN"));
        MockMvc failingMvc = MockMvcBuilders.standaloneSetup(new ProcessAnalysisController(
                        failing, new AnalysisContextRenderer(), new CsvEventLogLoader(new CsvIngestProperties())))
                .setControllerAdvice(new RestErrorHandler())
                .build();

        failingMvc
                .perform(post("/api/process/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(LOG))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.code").value(AnalysisFaultException.CODE));
    }
}
