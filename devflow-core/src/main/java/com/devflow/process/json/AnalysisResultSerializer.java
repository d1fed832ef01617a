package com.devflow.process.json;

import com.devflow.process.model.AnalysisResult;
import com.devflow.process.model.Bottleneck;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Writes {@link AnalysisResult} in its canonical form. Field order is fixed, floating-point values are rounded
 * HALF_EVEN to {@link #DECIMAL_SCALE} places, and map keys and the rework activity set are written in lexical
 * order, so identical input yields byte-identical output regardless of the {@code ObjectMapper} in use.
 */
public class AnalysisResultSerializer extends StdSerializer<AnalysisResult> {

    public static final int DECIMAL_SCALE = 6;

    public AnalysisResultSerializer() {
        super(AnalysisResult.class);
    }

    @Override
    public void serialize(AnalysisResult value, JsonGenerator gen, SerializerProvider provider) throws IOException {
        gen.writeStartObject();
        gen.writeNumberField("n_cases", value.caseCount());
        gen.writeNumberField("n_events", value.eventCount());
        gen.writeNumberField("n_activities", value.activityCount());
        gen.writeNumberField("n_variants", value.variantCount());
        writeDecimal(gen, "median_duration_hours", value.medianDurationHours());
        writeDecimal(gen, "mean_duration_hours", value.meanDurationHours());
        writeDecimal(gen, "p90_duration_hours", value.p90DurationHours());
        writeDecimal(gen, "min_duration_hours", value.minDurationHours());
        writeDecimal(gen, "max_duration_hours", value.maxDurationHours());
        writeStrings(gen, "top_variant", value.topVariant());
        writeDecimal(gen, "top_variant_frequency", value.topVariantFrequency());

        gen.writeArrayFieldStart("bottlenecks");
        for (Bottleneck bottleneck : value.bottlenecks()) {
            gen.writeStartObject();
            gen.writeStringField("from_activity", bottleneck.fromActivity());
            gen.writeStringField("to_activity", bottleneck.toActivity());
            writeDecimal(gen, "avg_wait_hours", bottleneck.avgWaitHours());
            gen.writeNumberField("frequency", bottleneck.frequency());
            gen.writeEndObject();
        }
        gen.writeEndArray();

        writeStrings(gen, "rework_activities", value.reworkActivities().stream().sorted().toList());
        writeDecimal(gen, "rework_rate", value.reworkRate());

        gen.writeObjectFieldStart("activity_frequencies");
        for (Map.Entry<String, Long> entry : new TreeMap<>(value.activityFrequencies()).entrySet()) {
            gen.writeNumberField(entry.getKey(), entry.getValue());
        }
        gen.writeEndObject();

        writeInstant(gen, "date_range_start", value.dateRangeStart());
        writeInstant(gen, "date_range_end", value.dateRangeEnd());
        gen.writeEndObject();
    }

    static BigDecimal canonical(double value) {
        return BigDecimal.valueOf(value).setScale(DECIMAL_SCALE, RoundingMode.HALF_EVEN);
    }

    private static void writeDecimal(JsonGenerator gen, String name, double value) throws IOException {
        gen.writeFieldName(name);
        // plain notation keeps 0.000000 from turning into 0E-6
        gen.writeNumber(canonical(value).toPlainString());
    }

    private static void writeStrings(JsonGenerator gen, String name, List<String> values) throws IOException {
        gen.writeArrayFieldStart(name);
        for (String v : values) {
            gen.writeString(v);
        }
        gen.writeEndArray();
    }

    private static void writeInstant(JsonGenerator gen, String name, Instant value) throws IOException {
        if (value == null) {
            gen.writeNullField(name);
        } else {
            gen.writeStringField(name, value.toString());
        }
    }
}
