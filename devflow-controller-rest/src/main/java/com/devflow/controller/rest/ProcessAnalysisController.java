package com.devflow.controller.rest;

import com.devflow.api.dto.AnalyzeRequest;
import com.devflow.api.dto.VariantListResponse;
import com.devflow.engine.ProcessAnalysisEngine;
import com.devflow.engine.report.AnalysisContextRenderer;
import com.devflow.ingest.csv.CsvEventLogLoader;
import com.devflow.process.model.AnalysisResult;
import com.devflow.process.model.Event;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.List;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Stateless REST wrapper around {@link ProcessAnalysisEngine}. Each request carries its full event stream;
 * nothing is retained between calls.
 */
@RestController
@RequestMapping(ProcessAnalysisController.BASE_PATH)
public class ProcessAnalysisController {

    public static final String BASE_PATH = "/api/process";
    public static final String TEXT_CSV = "text/csv";
    public static final String TEXT_MARKDOWN = "text/markdown";

    private final ProcessAnalysisEngine engine;
    private final AnalysisContextRenderer renderer;
    private final CsvEventLogLoader csvLoader;

    public ProcessAnalysisController(
            ProcessAnalysisEngine engine, AnalysisContextRenderer renderer, CsvEventLogLoader csvLoader) {
        this.engine = engine;
        this.renderer = renderer;
        this.csvLoader = csvLoader;
    }

    @PostMapping(
            path = "/analyze",
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public AnalysisResult analyze(@RequestBody AnalyzeRequest request) {
        return engine.analyze(request.toEvents());
    }

    @PostMapping(path = "/analyze", consumes = TEXT_CSV, produces = MediaType.APPLICATION_JSON_VALUE)
    public AnalysisResult analyzeCsv(@RequestBody byte[] body) throws IOException {
        // decoded as UTF-8 regardless of the declared charset
        List<Event> events = csvLoader.load(new ByteArrayInputStream(body));
        return engine.analyze(events);
    }

    @PostMapping(path = "/context", consumes = MediaType.APPLICATION_JSON_VALUE, produces = TEXT_MARKDOWN)
    public String context(@RequestBody AnalyzeRequest request) {
        return renderer.render(engine.analyze(request.toEvents()));
    }

    @PostMapping(
            path = "/variants",
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public VariantListResponse variants(@RequestBody AnalyzeRequest request) {
        return VariantListResponse.from(engine.variants(request.toEvents()));
    }
}
