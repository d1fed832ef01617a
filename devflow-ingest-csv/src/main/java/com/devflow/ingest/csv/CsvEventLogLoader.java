package com.devflow.ingest.csv;

import com.devflow.process.error.EventValidationException;
import com.devflow.process.model.Event;
import com.devflow.process.validation.TimestampParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.RuntimeJsonMappingException;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PushbackReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads a header-bearing CSV event log into {@link Event}s, one per data row, in file order. Only the configured
 * case, activity and timestamp columns are read; any other column is ignored.
 */
public class CsvEventLogLoader {

    private static final Logger log = LoggerFactory.getLogger(CsvEventLogLoader.class);
    private static final int BYTE_ORDER_MARK = '\uFEFF';

    private final CsvMapper mapper = new CsvMapper();
    private final CsvIngestProperties props;

    public CsvEventLogLoader(CsvIngestProperties props) {
        this.props = props;
    }

    public List<Event> load(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            List<Event> events = load(reader);
            log.info("Loaded event log path={} events={}", path, events.size());
            return events;
        }
    }

    public List<Event> load(InputStream in) throws IOException {
        return load(new InputStreamReader(in, StandardCharsets.UTF_8));
    }

    /**
     * A leading byte order mark, as written by spreadsheet UTF-8 exports, is skipped before the header is read.
     *
     * @throws EventValidationException if a configured column is absent from the header, or a row has a blank case
     *     id or activity or an unparsable timestamp; the index reported is the 0-based data row
     */
    public List<Event> load(Reader reader) throws IOException {
        CsvSchema schema = CsvSchema.emptySchema().withHeader().withColumnSeparator(props.getSeparator());
        List<Event> events = new ArrayList<>();
        try (MappingIterator<Map<String, String>> rows =
                mapper.readerForMapOf(String.class).with(schema).readValues(skipByteOrderMark(reader))) {
            boolean hasRows = rows.hasNext();
            CsvSchema header = (CsvSchema) rows.getParserSchema();
            if (header == null || header.size() == 0) {
                return events;
            }
            requireColumns(header);
            int index = 0;
            while (hasRows) {
                events.add(toEvent(nextRow(rows, index), index));
                index++;
                hasRows = rows.hasNext();
            }
        } catch (RuntimeJsonMappingException e) {
            throw new EventValidationException(
                    events.size(), "row", "Malformed CSV row #" + events.size() + ": " + e.getMessage(), e);
        } catch (JsonProcessingException e) {
            throw new EventValidationException(
                    events.size(), "row", "Malformed CSV row #" + events.size() + ": " + e.getOriginalMessage(), e);
        }
        return events;
    }

    private static Reader skipByteOrderMark(Reader reader) throws IOException {
        PushbackReader pushback = new PushbackReader(reader, 1);
        int first = pushback.read();
        if (first != -1 && first != BYTE_ORDER_MARK) {
            pushback.unread(first);
        }
        return pushback;
    }

    private static Map<String, String> nextRow(MappingIterator<Map<String, String>> rows, int index) {
        Map<String, String> row = rows.next();
        if (row == null) {
            throw new EventValidationException(index, "row", "CSV row #" + index + " is empty");
        }
        return row;
    }

    private Event toEvent(Map<String, String> row, int index) {
        String caseId = trimToNull(row.get(props.getCaseColumn()));
        String activity = trimToNull(row.get(props.getActivityColumn()));
        if (caseId == null) {
            throw EventValidationException.missingField(index, props.getCaseColumn());
        }
        if (activity == null) {
            throw EventValidationException.missingField(index, props.getActivityColumn());
        }
        return new Event(caseId, activity, TimestampParser.parse(row.get(props.getTimestampColumn()), index));
    }

    private void requireColumns(CsvSchema header) {
        for (String column : List.of(props.getCaseColumn(), props.getActivityColumn(), props.getTimestampColumn())) {
            if (header.column(column) == null) {
                throw new EventValidationException(
                        EventValidationException.UNKNOWN_INDEX,
                        column,
                        "CSV header is missing required column '" + column + "'");
            }
        }
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
