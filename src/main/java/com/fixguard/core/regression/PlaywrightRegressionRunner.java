package com.fixguard.core.regression;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs the regression suite through the Playwright CLI as a subprocess.
 *
 * Command = configured prefix (default {@code npx playwright test}) + suite files,
 * executed in the workspace root. stderr is merged into stdout so the summary and
 * the error lines stay in chronological order for the parser.
 */
@Component
public class PlaywrightRegressionRunner implements RegressionRunner {

    private static final Logger log = LoggerFactory.getLogger(PlaywrightRegressionRunner.class);

    private final Path                   workingDirectory;
    private final List<String>           commandPrefix;
    private final long                   timeoutSeconds;
    private final PlaywrightOutputParser parser;

    public PlaywrightRegressionRunner(
            @Value("${fixguard.workspace.path:.}") String workspacePath,
            @Value("${fixguard.regression.command:npx,playwright,test}") List<String> commandPrefix,
            @Value("${fixguard.regression.timeout-seconds:120}") long timeoutSeconds,
            PlaywrightOutputParser parser
    ) {
        this.workingDirectory = Path.of(workspacePath).toAbsolutePath().normalize();
        this.commandPrefix    = List.copyOf(commandPrefix);
        this.timeoutSeconds   = timeoutSeconds;
        this.parser           = parser;

        log.info("[Regression] Workspace: {}", workingDirectory);
        log.info("[Regression] Command: {} (timeout {}s)", String.join(" ", this.commandPrefix), timeoutSeconds);
    }

    @Override
    public RegressionSnapshot run(List<String> suite) {

        List<String> command = new ArrayList<>(commandPrefix);
        command.addAll(suite);

        long startTime = System.currentTimeMillis();
        log.info("[Regression] Executing: {}", String.join(" ", command));

        Process process;
        try {
            ProcessBuilder builder = new ProcessBuilder(command);
            builder.directory(workingDirectory.toFile());
            builder.redirectErrorStream(true);
            process = builder.start();
        } catch (IOException e) {
            log.error("[Regression] Failed to start runner: {}", e.getMessage());
            return RegressionSnapshot.notRun("Failed to run regression tests: " + e.getMessage());
        }

        StringBuffer output = new StringBuffer();
        Thread reader = new Thread(() -> {
            try (BufferedReader in = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = in.readLine()) != null) {
                    output.append(line).append("\n");
                }
            } catch (IOException e) {
                log.warn("[Regression] Error reading runner output: {}", e.getMessage());
            }
        }, "regression-output");
        reader.setDaemon(true);
        reader.start();

        try {
            boolean finished = process.waitFor(timeoutSeconds, TimeUnit.SECONDS);

            if (!finished) {
                process.destroyForcibly();
                log.warn("[Regression] Runner timed out after {} seconds", timeoutSeconds);
                return RegressionSnapshot.timedOut(output.toString(), timeoutSeconds);
            }

            reader.join(1000);
            int exitCode = process.exitValue();

            log.info("[Regression] Exit code: {}, output: {} chars, elapsed: {} ms",
                    exitCode, output.length(), System.currentTimeMillis() - startTime);

            return parser.parse(output.toString(), exitCode);

        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            log.error("[Regression] Interrupted while waiting for runner");
            return RegressionSnapshot.notRun("Regression run interrupted");
        }
    }
}
