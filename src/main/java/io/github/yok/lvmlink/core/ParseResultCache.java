package io.github.yok.lvmlink.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.github.yok.lvmlink.model.ChannelData;
import io.github.yok.lvmlink.model.FileHeader;
import io.github.yok.lvmlink.model.ParseResult;
import io.github.yok.lvmlink.model.Segment;
import io.github.yok.lvmlink.model.SegmentHeader;
import io.github.yok.lvmlink.parser.FieldSpec;
import io.github.yok.lvmlink.parser.FieldType;
import io.github.yok.lvmlink.parser.HeaderSchema;
import io.github.yok.lvmlink.util.LogPathUtil;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;

/**
 * Persists a {@link ParseResult} next to its source file as JSON so that later reads can skip
 * parsing.
 *
 * <p>
 * The cache file is {@code <source file name><suffix>}. It is considered fresh when it is newer
 * than the source, or when the source no longer exists. Header values are written in their
 * natural JSON form (ISO-8601 for dates and times) and restored using the types declared in
 * {@link HeaderSchema}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ParseResultCache {

    private static final String FILE_HEADER = "fileHeader";
    private static final String SEGMENTS = "segments";
    private static final String HEADER = "header";
    private static final String COLUMNS = "columns";
    private static final String Y_LABELS = "yLabels";
    private static final String CHANNELS = "channels";
    private static final String COMMENTS = "comments";
    private static final String X = "x";
    private static final String Y = "y";

    private final ObjectMapper mapper = new ObjectMapper().registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private final String suffix;

    /**
     * Creates a cache.
     *
     * @param suffix appended to the source file name to form the cache file name
     */
    public ParseResultCache(String suffix) {
        this.suffix = suffix;
    }

    /**
     * Returns the cache file for a source file.
     *
     * @param source LVM file
     * @return sibling path with the cache suffix appended
     */
    public Path cachePath(Path source) {
        return source.resolveSibling(source.getFileName().toString() + suffix);
    }

    /**
     * Returns whether a usable cache exists for the source file.
     *
     * @param source LVM file
     * @return {@code true} if the cache exists and is newer than the source, or the source is gone
     */
    public boolean isFresh(Path source) {
        File cache = cachePath(source).toFile();
        if (!cache.isFile()) {
            return false;
        }
        File original = source.toFile();
        return !original.exists() || FileUtils.isFileNewer(cache, original);
    }

    /**
     * Loads the cached result of a source file.
     *
     * @param source LVM file
     * @return the cached result, or empty if the cache is missing or cannot be decoded
     */
    public Optional<ParseResult> load(Path source) {
        Path cache = cachePath(source);
        if (!Files.isRegularFile(cache)) {
            return Optional.empty();
        }
        try {
            JsonNode root = mapper.readTree(cache.toFile());
            ParseResult result = fromJson(root);
            log.info("Loaded cached parse result: {}", LogPathUtil.renderPathForLog(cache));
            return Optional.of(result);
        } catch (IOException | RuntimeException e) {
            log.warn("Ignoring unreadable cache file: {}", LogPathUtil.renderPathForLog(cache), e);
            return Optional.empty();
        }
    }

    /**
     * Writes the cache file of a source file. Failures are logged and otherwise ignored.
     *
     * @param source LVM file
     * @param result parse result of that file
     * @return {@code true} if the cache was written
     */
    public boolean store(Path source, ParseResult result) {
        Path cache = cachePath(source);
        try {
            mapper.writeValue(cache.toFile(), toJson(result));
            log.info("Wrote parse result cache: {}", LogPathUtil.renderPathForLog(cache));
            return true;
        } catch (IOException e) {
            log.warn("Failed to write cache file: {}", LogPathUtil.renderPathForLog(cache), e);
            return false;
        }
    }

    Map<String, Object> toJson(ParseResult result) {
        List<Object> segments = new ArrayList<>();
        for (Segment segment : result.getSegments()) {
            List<Object> channels = new ArrayList<>();
            for (ChannelData channel : segment.getChannels()) {
                Map<String, Object> node = new LinkedHashMap<>();
                node.put(X, channel.getX());
                node.put(Y, channel.getY());
                channels.add(node);
            }
            Map<String, Object> node = new LinkedHashMap<>();
            node.put(HEADER, segment.getHeader().getValues());
            node.put(COLUMNS, segment.getHeader().getColumns());
            node.put(Y_LABELS, segment.getHeader().getYLabels());
            node.put(CHANNELS, channels);
            node.put(COMMENTS, segment.getComments());
            segments.add(node);
        }
        Map<String, Object> root = new LinkedHashMap<>();
        root.put(FILE_HEADER, result.getFileHeader().getValues());
        root.put(SEGMENTS, segments);
        return root;
    }

    ParseResult fromJson(JsonNode root) throws IOException {
        FileHeader fileHeader =
                new FileHeader(restoreValues(root.get(FILE_HEADER), HeaderSchema.FILE_HEADERS));

        List<Segment> segments = new ArrayList<>();
        for (JsonNode node : root.get(SEGMENTS)) {
            SegmentHeader header = new SegmentHeader(
                    restoreValues(node.get(HEADER), HeaderSchema.SEGMENT_HEADERS),
                    textList(node.get(COLUMNS)), textList(node.get(Y_LABELS)));
            List<ChannelData> channels = new ArrayList<>();
            for (JsonNode channel : node.get(CHANNELS)) {
                channels.add(new ChannelData(mapper.treeToValue(channel.get(X), double[].class),
                        mapper.treeToValue(channel.get(Y), double[].class)));
            }
            segments.add(new Segment(header, channels, textList(node.get(COMMENTS))));
        }
        return new ParseResult(fileHeader, segments);
    }

    private static Map<String, Object> restoreValues(JsonNode node,
            Map<String, FieldSpec> schema) {
        Map<String, Object> values = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            FieldSpec spec = schema.get(field.getKey());
            FieldType type = spec != null ? spec.getType() : FieldType.TEXT;
            JsonNode value = field.getValue();
            if (value.isArray()) {
                List<Object> list = new ArrayList<>();
                for (JsonNode element : value) {
                    list.add(restoreValue(element, type));
                }
                values.put(field.getKey(), list);
            } else {
                values.put(field.getKey(), restoreValue(value, type));
            }
        }
        return values;
    }

    private static Object restoreValue(JsonNode node, FieldType type) {
        if (node.isNull()) {
            return null;
        }
        switch (type) {
            case NUMBER:
                return node.isIntegralNumber() ? (Object) node.asLong() : node.asDouble();
            case INTEGER:
                return node.asInt();
            case FLOAT:
                return node.asDouble();
            case DATE:
                return LocalDate.parse(node.asText());
            case TIME:
                return LocalTime.parse(node.asText());
            case BOOL:
                return node.asBoolean();
            default:
                return node.asText();
        }
    }

    private static List<String> textList(JsonNode node) {
        List<String> list = new ArrayList<>();
        for (JsonNode element : node) {
            list.add(element.asText());
        }
        return list;
    }
}
