package com.devflow.process.json;

import com.devflow.process.model.AnalysisResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;

/** Canonical JSON encoding of {@link AnalysisResult}. */
public final class AnalysisResultJson {
    private static final ObjectMapper M = new ObjectMapper();
    private static final ObjectWriter PRETTY;

    static {
        M.findAndRegisterModules();
        PRETTY = M.writerWithDefaultPrettyPrinter();
    }

    private AnalysisResultJson() {}

    public static String toCanonicalJson(AnalysisResult result) {
        try {
            return M.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("AnalysisResult JSON encode failed", e);
        }
    }

    public static String toPrettyJson(AnalysisResult result) {
        try {
            return PRETTY.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("AnalysisResult pretty JSON encode failed", e);
        }
    }
}
