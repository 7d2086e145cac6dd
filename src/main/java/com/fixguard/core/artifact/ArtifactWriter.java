package com.fixguard.core.artifact;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Writes the audit trail of a fix pass and locates reviewer material.
 *
 * Audit files are write-once: an existing file is never overwritten, a numeric
 * suffix is added instead. Relative directories resolve against the workspace root.
 */
@Component
public class ArtifactWriter {

    private static final Logger log = LoggerFactory.getLogger(ArtifactWriter.class);

    static final int MAX_SCREENSHOTS = 5;

    private static final DateTimeFormatter FILE_TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

    private final Path         artifactsDir;
    private final Path         logsDir;
    private final ObjectMapper objectMapper;
    private final Clock        clock;

    public ArtifactWriter(
            @Value("${fixguard.workspace.path:.}")      String workspacePath,
            @Value("${fixguard.artifacts.dir:artifacts}") String artifactsDir,
            @Value("${fixguard.logs.dir:logs}")         String logsDir,
            ObjectMapper objectMapper,
            Clock        clock
    ) {
        Path workspace    = Paths.get(workspacePath).toAbsolutePath().normalize();
        this.artifactsDir = workspace.resolve(artifactsDir).normalize();
        this.logsDir      = workspace.resolve(logsDir).normalize();
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
        this.clock        = clock;
    }

    public ArtifactPaths write(String diff, RegressionReport report) throws IOException {
        Files.createDirectories(artifactsDir);
        String stamp = FILE_TIMESTAMP.format(clock.instant());

        Path diffPath   = writeOnce("fix_" + stamp, ".diff", diff.getBytes(StandardCharsets.UTF_8));
        Path reportPath = writeOnce("regression_report_" + stamp, ".json",
                objectMapper.writeValueAsBytes(report));

        log.info("[Artifacts] Wrote {} and {}", diffPath.getFileName(), reportPath.getFileName());
        return new ArtifactPaths(diffPath.toString(), reportPath.toString());
    }

    /** Up to five *&lt;stem&gt;*.png files from the artifacts directory, newest first. */
    public List<String> findScreenshots(String testPath) {
        if (!Files.isDirectory(artifactsDir)) return List.of();
        String stem = stemOf(testPath).toLowerCase(Locale.ROOT);

        try (Stream<Path> files = Files.list(artifactsDir)) {
            return files.filter(Files::isRegularFile)
                        .filter(p -> {
                            String name = p.getFileName().toString().toLowerCase(Locale.ROOT);
                            return name.endsWith(".png") && name.contains(stem);
                        })
                        .sorted((a, b) -> Long.compare(lastModified(b), lastModified(a)))
                        .limit(MAX_SCREENSHOTS)
                        .map(Path::toString)
                        .collect(Collectors.toList());
        } catch (IOException e) {
            log.warn("[Artifacts] Screenshot lookup failed for {}: {}", testPath, e.getMessage());
            return List.of();
        }
    }

    /** Path of the task's log file, or null when there is no logs directory. */
    public String logsPathFor(String taskId) {
        if (!Files.isDirectory(logsDir)) return null;
        return logsDir.resolve(taskId + ".log").toString();
    }

    public static String stemOf(String testPath) {
        String name = Paths.get(testPath).getFileName().toString();
        // foo.spec.ts -> foo.spec, like a file stem
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private Path writeOnce(String baseName, String extension, byte[] content) throws IOException {
        for (int suffix = 0; ; suffix++) {
            Path target = artifactsDir.resolve(suffix == 0
                    ? baseName + extension
                    : baseName + "_" + suffix + extension);
            try {
                return Files.write(target, content, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            } catch (FileAlreadyExistsException e) {
                log.debug("[Artifacts] {} exists, trying next suffix", target.getFileName());
            }
        }
    }

    private static long lastModified(Path path) {
        try {
            return Files.getLastModifiedTime(path).toMillis();
        } catch (IOException e) {
            return 0L;
        }
    }
}
