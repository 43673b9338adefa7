package io.github.yok.lvmlink;

import io.github.yok.lvmlink.config.LvmReadConfig;
import io.github.yok.lvmlink.config.PathsConfig;
import io.github.yok.lvmlink.core.LvmReader;
import io.github.yok.lvmlink.core.SegmentCsvExporter;
import io.github.yok.lvmlink.model.ParseResult;
import io.github.yok.lvmlink.model.Segment;
import io.github.yok.lvmlink.util.ErrorHandler;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Provides the application entry point.
 *
 * <p>
 * Supported arguments:
 * </p>
 * <ul>
 * <li>{@code --read <file>} or {@code -r <file>} parses the file and logs a summary of every
 * segment.</li>
 * <li>{@code --export <file>} or {@code -e <file>} parses the file and writes one CSV per segment
 * under {@code <data-path>/export}.</li>
 * <li>{@code --no-cache} or {@code -n} neither reads nor writes the parse result cache.</li>
 * </ul>
 *
 * <p>
 * Spring Boot loads {@link PathsConfig} and {@link LvmReadConfig} from {@code application.yml}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 * @see LvmReader
 * @see SegmentCsvExporter
 */
@Slf4j
@SpringBootApplication
@EnableConfigurationProperties({PathsConfig.class, LvmReadConfig.class})
@RequiredArgsConstructor
public class Main implements CommandLineRunner {

    private final PathsConfig pathsConfig;
    private final LvmReadConfig lvmReadConfig;

    /**
     * Bootstraps the application.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Main.class);
        app.setAddCommandLineProperties(false);
        app.run(args);
    }

    /**
     * Entry point invoked after Spring Boot starts.
     *
     * @param args command-line arguments array
     */
    @Override
    public void run(String... args) {
        log.info("Application started. Args: {}", Arrays.toString(args));

        String mode = null;
        String file = null;
        boolean useCache = true;
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--read":
                case "-r":
                    mode = "read";
                    file = (i + 1 < args.length ? args[++i] : null);
                    break;
                case "--export":
                case "-e":
                    mode = "export";
                    file = (i + 1 < args.length ? args[++i] : null);
                    break;
                case "--no-cache":
                case "-n":
                    useCache = false;
                    break;
                default:
                    log.warn("Unknown argument: {}", args[i]);
            }
        }

        if (mode == null) {
            mode = "read";
        }
        if (file == null || file.isEmpty()) {
            ErrorHandler.errorAndExit("An LVM file is required in " + mode + " mode.");
            return;
        }

        log.info("Mode: {}, File: {}, Cache: {}", mode, file, useCache);

        try {
            LvmReader reader = new LvmReader(lvmReadConfig);
            Path path = Paths.get(file);
            ParseResult result = useCache ? reader.read(path) : reader.read(path, false, false);
            logSummary(result);

            if ("export".equals(mode)) {
                Path outputDir = Paths.get(pathsConfig.getExport());
                List<Path> written =
                        new SegmentCsvExporter().export(result, path.getFileName().toString(),
                                outputDir);
                log.info("Export completed. {} file(s) written", written.size());
            }
        } catch (Exception e) {
            log.error("Fatal error occurred (mode={}): {}", mode, e.getMessage(), e);
            ErrorHandler.errorAndExit("Fatal error: " + e.getMessage(), e);
        }
    }

    private void logSummary(ParseResult result) {
        log.info("File header: date={}, time={}, writerVersion={}, xColumns={}",
                result.getFileHeader().getDate(), result.getFileHeader().getTime(),
                result.getFileHeader().getWriterVersion(), result.getFileHeader().getXColumns());
        List<Segment> segments = result.getSegments();
        for (int i = 0; i < segments.size(); i++) {
            Segment segment = segments.get(i);
            log.info("Segment {}: channels={}, rows={}, labels={}", i + 1,
                    segment.getChannels().size(), segment.getRowCount(),
                    segment.getHeader().getYLabels());
        }
    }
}
