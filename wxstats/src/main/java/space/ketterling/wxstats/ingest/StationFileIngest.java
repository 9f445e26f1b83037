package space.ketterling.wxstats.ingest;

import java.io.BufferedInputStream;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import space.ketterling.wxstats.model.DailyRecord;

/**
 * Ingests a directory of station daily files into {@code daily_weather}.
 *
 * <p>
 * One file per station; the file name without {@code .txt} or {@code .txt.gz}
 * is the station id. Bad lines and unreadable files are logged and counted,
 * never fatal. Only a missing directory stops the run.
 * </p>
 */
public class StationFileIngest {
    private static final Logger log = LoggerFactory.getLogger(StationFileIngest.class);

    private static final String TXT = ".txt";
    private static final String TXT_GZ = ".txt.gz";
    private static final String BOM = "\uFEFF";

    private final BatchLoader loader;

    public StationFileIngest(BatchLoader loader) {
        this.loader = loader;
    }

    /**
     * Ingests every station file in {@code dir}, in file name order.
     *
     * @throws DirectoryNotFoundException if {@code dir} is missing or not a
     *                                    directory
     * @throws IOException                if the directory cannot be listed
     */
    public IngestResult ingestDirectory(Path dir) throws IOException {
        if (!Files.isDirectory(dir))
            throw new DirectoryNotFoundException(dir);

        Instant start = Instant.now();
        log.info("Starting ingestion from {}", dir);

        List<Path> files = listStationFiles(dir);
        log.info("Found {} station files", files.size());

        IngestResult total = IngestResult.EMPTY;
        for (Path file : files) {
            total = total.plus(ingestFile(file));
        }

        log.info("Completed ingestion in {} ms: files={} ingested={} skipped={} errors={}",
                Duration.between(start, Instant.now()).toMillis(), total.filesProcessed(),
                total.recordsIngested(), total.recordsSkipped(), total.errors());
        return total;
    }

    /**
     * Ingests one station file. Batches flushed before a read failure stay
     * committed; the failure itself adds one error.
     */
    public IngestResult ingestFile(Path file) {
        String stationId = stationIdOf(file);
        MDC.put("station", stationId);
        IngestResult result = IngestResult.EMPTY;
        int lines = 0;
        try (BufferedReader br = open(file)) {
            log.info("Processing {} (station {})", file.getFileName(), stationId);
            List<DailyRecord> buffer = new ArrayList<>(loader.batchSize());
            String line = br.readLine();
            if (line != null && line.startsWith(BOM))
                line = line.substring(BOM.length());
            for (; line != null; line = br.readLine()) {
                if (line.isBlank())
                    continue;
                lines++;
                try {
                    buffer.add(DailyLineParser.parse(line.strip(), stationId));
                } catch (LineParseException e) {
                    log.warn("Skipping line {} of {}: {} [{}]", lines, file.getFileName(), e.getMessage(), e.line());
                    result = result.plusErrors(1);
                    continue;
                }
                if (buffer.size() >= loader.batchSize()) {
                    result = result.plus(loader.loadBatch(buffer));
                    buffer.clear();
                }
            }
            if (!buffer.isEmpty())
                result = result.plus(loader.loadBatch(buffer));

            log.info("Processed {} lines from {}: ingested={} skipped={} errors={}", lines, file.getFileName(),
                    result.recordsIngested(), result.recordsSkipped(), result.errors());
            return result.plusFile();
        } catch (IOException e) {
            log.error("Error reading {} after {} lines: {}", file, lines, e.getMessage(), e);
            return result.plusErrors(1);
        } finally {
            MDC.remove("station");
        }
    }

    /**
     * Lists regular {@code .txt} / {@code .txt.gz} files directly under
     * {@code dir}, sorted by name.
     */
    static List<Path> listStationFiles(Path dir) throws IOException {
        try (Stream<Path> stream = Files.list(dir)) {
            return stream
                    .filter(Files::isRegularFile)
                    .filter(p -> isStationFile(p.getFileName().toString()))
                    .sorted()
                    .toList();
        }
    }

    static boolean isStationFile(String fileName) {
        String lower = fileName.toLowerCase(Locale.ROOT);
        return (lower.endsWith(TXT) && lower.length() > TXT.length())
                || (lower.endsWith(TXT_GZ) && lower.length() > TXT_GZ.length());
    }

    /**
     * Station id from a file name: {@code USC00110072.txt} -> {@code USC00110072}.
     */
    static String stationIdOf(Path file) {
        String name = file.getFileName().toString();
        String lower = name.toLowerCase(Locale.ROOT);
        if (lower.endsWith(TXT_GZ))
            return name.substring(0, name.length() - TXT_GZ.length());
        if (lower.endsWith(TXT))
            return name.substring(0, name.length() - TXT.length());
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private static BufferedReader open(Path file) throws IOException {
        InputStream in = new BufferedInputStream(Files.newInputStream(file));
        try {
            if (file.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(TXT_GZ))
                in = new GzipCompressorInputStream(in);
        } catch (IOException e) {
            in.close();
            throw e;
        }
        return new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
    }
}
