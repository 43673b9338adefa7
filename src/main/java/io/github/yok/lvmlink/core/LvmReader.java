package io.github.yok.lvmlink.core;

import io.github.yok.lvmlink.config.LvmReadConfig;
import io.github.yok.lvmlink.model.ParseResult;
import io.github.yok.lvmlink.parser.LvmFormatException;
import io.github.yok.lvmlink.parser.LvmParser;
import io.github.yok.lvmlink.util.LogPathUtil;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Entry point for reading LVM content from a file, a string or a list of lines.
 *
 * <p>
 * File reads may be served from, and refreshed into, a {@link ParseResultCache}. Whether the cache
 * is consulted and written defaults to {@link LvmReadConfig} and can be overridden per call.
 * </p>
 *
 * <p>
 * Files are decoded as UTF-8; byte sequences that are not valid UTF-8 are dropped, and a leading
 * byte order mark is ignored.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class LvmReader {

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private final LvmReadConfig config;
    private final LvmParser parser;
    private final ParseResultCache cache;

    /**
     * Creates a reader with the default parser and a cache using the configured suffix.
     *
     * @param config read settings
     */
    public LvmReader(LvmReadConfig config) {
        this(config, new LvmParser(), new ParseResultCache(config.getCacheSuffix()));
    }

    /**
     * Creates a reader with explicit collaborators.
     *
     * @param config read settings
     * @param parser LVM parser
     * @param cache parse result cache
     */
    public LvmReader(LvmReadConfig config, LvmParser parser, ParseResultCache cache) {
        this.config = config;
        this.parser = parser;
        this.cache = cache;
    }

    /**
     * Reads a file using the configured cache behavior.
     *
     * @param file LVM file
     * @return the parse result
     * @throws IOException if the file cannot be read
     * @throws LvmFormatException if the file is malformed
     */
    public ParseResult read(Path file) throws IOException, LvmFormatException {
        return read(file, config.isReadFromCache(), config.isDumpCache());
    }

    /**
     * Reads a file.
     *
     * @param file LVM file
     * @param readFromCache reuse a fresh cache file instead of parsing
     * @param dumpCache write the cache file after parsing
     * @return the parse result
     * @throws IOException if the file cannot be read
     * @throws LvmFormatException if the file is malformed
     */
    public ParseResult read(Path file, boolean readFromCache, boolean dumpCache)
            throws IOException, LvmFormatException {
        String rendered = LogPathUtil.renderPathForLog(file);
        if (readFromCache && cache.isFresh(file)) {
            Optional<ParseResult> cached = cache.load(file);
            if (cached.isPresent()) {
                return cached.get();
            }
        }

        log.info("Parsing LVM file: {}", rendered);
        ParseResult result = readString(decode(Files.readAllBytes(file)));
        log.info("Parsed LVM file: {} ({} segments)", rendered, result.getSegments().size());

        if (dumpCache) {
            cache.store(file, result);
        }
        return result;
    }

    /**
     * Parses LVM content held in memory.
     *
     * @param content file content
     * @return the parse result
     * @throws LvmFormatException if the content is malformed
     */
    public ParseResult readString(String content) throws LvmFormatException {
        if (!content.isEmpty() && content.charAt(0) == BYTE_ORDER_MARK) {
            return parser.parse(content.substring(1));
        }
        return parser.parse(content);
    }

    /**
     * Parses LVM lines.
     *
     * @param lines file lines, with or without terminators
     * @return the parse result
     * @throws LvmFormatException if the lines are malformed
     */
    public ParseResult readLines(List<String> lines) throws LvmFormatException {
        return parser.parse(lines);
    }

    /**
     * Decodes UTF-8 bytes, dropping malformed sequences.
     *
     * @param bytes raw file content
     * @return decoded text
     * @throws CharacterCodingException never in practice, since errors are ignored
     */
    static String decode(byte[] bytes) throws CharacterCodingException {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.IGNORE)
                .onUnmappableCharacter(CodingErrorAction.IGNORE);
        return decoder.decode(ByteBuffer.wrap(bytes)).toString();
    }
}
