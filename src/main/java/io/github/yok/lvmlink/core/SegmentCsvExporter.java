package io.github.yok.lvmlink.core;

import io.github.yok.lvmlink.model.ChannelData;
import io.github.yok.lvmlink.model.ParseResult;
import io.github.yok.lvmlink.model.Segment;
import io.github.yok.lvmlink.util.LogPathUtil;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.QuoteMode;
import org.apache.commons.io.FilenameUtils;

/**
 * Writes each segment of a {@link ParseResult} to its own CSV file.
 *
 * <p>
 * Files are named {@code <base>_segment<N>.csv} (N starting at 1) and encoded in UTF-8. The header
 * row holds {@code X_<label>} and {@code <label>} for every channel followed by {@code Comment}.
 * Channels that ended early leave their cells empty on later rows.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class SegmentCsvExporter {

    /**
     * Exports every segment.
     *
     * @param result parse result
     * @param sourceName name of the LVM file; its base name prefixes the CSV files
     * @param outputDir destination directory (created if missing)
     * @return written files in segment order
     * @throws IOException if a file cannot be written
     */
    public List<Path> export(ParseResult result, String sourceName, Path outputDir)
            throws IOException {
        Files.createDirectories(outputDir);
        String base = FilenameUtils.getBaseName(sourceName);

        List<Path> written = new ArrayList<>();
        List<Segment> segments = result.getSegments();
        for (int i = 0; i < segments.size(); i++) {
            Path csv = outputDir.resolve(base + "_segment" + (i + 1) + ".csv");
            writeSegment(csv, segments.get(i));
            log.info("Exported segment {} to {}", i + 1, LogPathUtil.renderPathForLog(csv));
            written.add(csv);
        }
        return written;
    }

    /**
     * Writes one segment.
     *
     * @param csv destination file (overwritten)
     * @param segment segment to write
     * @throws IOException if the file cannot be written
     */
    void writeSegment(Path csv, Segment segment) throws IOException {
        List<ChannelData> channels = segment.getChannels();
        List<String> labels = segment.getHeader().getYLabels();

        List<String> headers = new ArrayList<>();
        for (int ch = 0; ch < channels.size(); ch++) {
            String label = ch < labels.size() ? labels.get(ch) : "Channel" + ch;
            headers.add("X_" + label);
            headers.add(label);
        }
        headers.add("Comment");

        int rows = segment.getRowCount();
        for (ChannelData channel : channels) {
            rows = Math.max(rows, channel.size());
        }

        CSVFormat fmt = CSVFormat.DEFAULT.builder().setHeader(headers.toArray(new String[0]))
                .setQuoteMode(QuoteMode.MINIMAL).setRecordSeparator(System.lineSeparator())
                .build();
        try (Writer w = Files.newBufferedWriter(csv, StandardCharsets.UTF_8);
                CSVPrinter printer = new CSVPrinter(w, fmt)) {
            for (int row = 0; row < rows; row++) {
                List<String> record = new ArrayList<>();
                for (ChannelData channel : channels) {
                    if (row < channel.size()) {
                        record.add(Double.toString(channel.getX(row)));
                        record.add(Double.toString(channel.getY(row)));
                    } else {
                        record.add("");
                        record.add("");
                    }
                }
                record.add(row < segment.getComments().size() ? segment.getComments().get(row)
                        : "");
                printer.printRecord(record);
            }
        }
    }
}
