package org.promoharvest.pipeline.utils.jsonl;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.type.MapType;
import org.promoharvest.pipeline.api.records.HarvestRecord;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Line-delimited JSON encoding of records.
 * <p>
 * Reading is lenient: invalid UTF-8 is replaced rather than rejected, and {@link #extract(String)}
 * recovers every well-formed object from a line, including several objects concatenated onto one
 * line and objects that follow a truncated one.
 */
public final class JsonLinesCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
        .disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);

    private static final MapType DOCUMENT_TYPE =
        MAPPER.getTypeFactory().constructMapType(LinkedHashMap.class, String.class, Object.class);

    private JsonLinesCodec() {
    }

    /**
     * Result of scanning one physical line.
     *
     * @param documents        the objects recovered, in line order
     * @param invalidFragments number of non-blank fragments that did not parse as an object
     */
    public record LineExtraction(List<Map<String, Object>> documents, int invalidFragments) {

        static final LineExtraction BLANK = new LineExtraction(Collections.emptyList(), 0);

        public boolean isBlank() {
            return documents.isEmpty() && invalidFragments == 0;
        }
    }

    @FunctionalInterface
    public interface LineVisitor {
        void visit(long lineNumber, String line) throws IOException;
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * Jackson type of a decoded document: an insertion-ordered {@code Map<String, Object>}.
     */
    public static MapType documentType() {
        return DOCUMENT_TYPE;
    }

    public static String encode(HarvestRecord record) {
        try {
            return MAPPER.writeValueAsString(record.fields());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Record is not serializable as JSON: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Writes one record per line, each terminated by {@code '\n'}.
     */
    public static void write(OutputStream out, Iterable<HarvestRecord> records) throws IOException {
        for (HarvestRecord record : records) {
            out.write(encode(record).getBytes(StandardCharsets.UTF_8));
            out.write('\n');
        }
    }

    /**
     * Parses a single JSON object.
     *
     * @throws IOException if the text is not exactly one JSON object
     */
    public static Map<String, Object> decodeObject(String json) throws IOException {
        return MAPPER.readValue(json, DOCUMENT_TYPE);
    }

    /**
     * Recovers all JSON objects from one line.
     * <p>
     * After a fragment fails to parse, scanning resumes at the next {@code '{'} that does not sit in a
     * value position (preceded by {@code ':'}, {@code ','} or {@code '['}), so nested objects of a broken
     * document are not mistaken for documents. If none of the skipped value-position candidates is
     * accepted that way, the first one that parses as a complete object ending at a document boundary
     * (only separators, then another {@code '{'} or the end of the line) and opening with the same field
     * name as the broken fragment is recovered, since a document truncated right after a {@code ':'} or
     * {@code ','} leaves its appended successor in value position.
     * Commas and whitespace between objects are ignored.
     */
    public static LineExtraction extract(String line) {
        if (line == null || line.isBlank()) {
            return LineExtraction.BLANK;
        }
        List<Map<String, Object>> documents = new ArrayList<>(1);
        int invalid = 0;
        int pos = 0;
        int length = line.length();
        while (pos < length) {
            pos = skipSeparators(line, pos);
            if (pos >= length) {
                break;
            }
            int end = line.charAt(pos) == '{' ? tryParseObject(line, pos, documents) : -1;
            if (end >= 0) {
                pos = end;
                continue;
            }
            invalid++;
            int next = nextDocumentStart(line, pos + 1);
            int recovered = recoverAtBoundary(line, pos + 1, next, documents);
            pos = recovered >= 0 ? recovered : next;
        }
        return new LineExtraction(documents, invalid);
    }

    /**
     * Reads a file line by line, decoding UTF-8 leniently.
     */
    public static void forEachLine(Path file, LineVisitor visitor) throws IOException {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(Files.newInputStream(file), StandardCharsets.UTF_8))) {
            String line;
            long lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                visitor.visit(lineNumber, line);
            }
        }
    }

    /**
     * Reads every recoverable record of a file, in file order.
     */
    public static List<HarvestRecord> readAll(Path file) throws IOException {
        List<HarvestRecord> records = new ArrayList<>();
        forEachLine(file, (lineNumber, line) -> {
            for (Map<String, Object> document : extract(line).documents()) {
                records.add(HarvestRecord.of(document));
            }
        });
        return records;
    }

    private static int tryParseObject(String line, int start, List<Map<String, Object>> sink) {
        try (JsonParser parser = MAPPER.getFactory().createParser(line.substring(start))) {
            if (parser.nextToken() != JsonToken.START_OBJECT) {
                return -1;
            }
            Map<String, Object> document = MAPPER.readValue(parser, DOCUMENT_TYPE);
            // the closing brace is the current token
            long consumed = parser.currentTokenLocation().getCharOffset() + 1;
            sink.add(document);
            return start + (int) consumed;
        } catch (JsonProcessingException e) {
            return -1;
        } catch (IOException e) {
            throw new UncheckedIOException("Unexpected I/O error parsing an in-memory string", e);
        }
    }

    /**
     * Tries the value-position {@code '{'} candidates in {@code [from, limit)} in order.
     *
     * @return end offset of the first candidate recovered, or -1
     */
    private static int recoverAtBoundary(String line, int from, int limit, List<Map<String, Object>> sink) {
        String expectedFirstField = firstFieldName(line, from - 1);
        for (int i = line.indexOf('{', from); i >= 0 && i < limit; i = line.indexOf('{', i + 1)) {
            List<Map<String, Object>> candidate = new ArrayList<>(1);
            int end = tryParseObject(line, i, candidate);
            if (end >= 0 && isDocumentBoundary(line, end)
                    && (expectedFirstField == null || expectedFirstField.equals(firstKey(candidate.get(0))))) {
                sink.addAll(candidate);
                return end;
            }
        }
        return -1;
    }

    /**
     * Name of the first field of the (possibly broken) object at {@code start}, or null if there is none.
     */
    private static String firstFieldName(String line, int start) {
        if (line.charAt(start) != '{') {
            return null;
        }
        try (JsonParser parser = MAPPER.getFactory().createParser(line.substring(start))) {
            if (parser.nextToken() == JsonToken.START_OBJECT && parser.nextToken() == JsonToken.FIELD_NAME) {
                return parser.currentName();
            }
            return null;
        } catch (JsonProcessingException e) {
            return null;
        } catch (IOException e) {
            throw new UncheckedIOException("Unexpected I/O error parsing an in-memory string", e);
        }
    }

    private static String firstKey(Map<String, Object> document) {
        return document.isEmpty() ? null : document.keySet().iterator().next();
    }

    private static boolean isDocumentBoundary(String line, int pos) {
        int next = skipSeparators(line, pos);
        return next >= line.length() || line.charAt(next) == '{';
    }

    private static int skipSeparators(String line, int pos) {
        while (pos < line.length()) {
            char c = line.charAt(pos);
            if (!Character.isWhitespace(c) && c != ',') {
                break;
            }
            pos++;
        }
        return pos;
    }

    private static int nextDocumentStart(String line, int from) {
        for (int i = from; i < line.length(); i++) {
            if (line.charAt(i) != '{') {
                continue;
            }
            int j = i - 1;
            while (j >= 0 && Character.isWhitespace(line.charAt(j))) {
                j--;
            }
            if (j < 0) {
                return i;
            }
            char before = line.charAt(j);
            if (before != ':' && before != ',' && before != '[') {
                return i;
            }
        }
        return line.length();
    }
}
