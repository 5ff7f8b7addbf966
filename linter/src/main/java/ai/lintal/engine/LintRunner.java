package ai.lintal.engine;

import ai.lintal.treesitter.JavaSourceParser;
import ai.lintal.util.ExecutorServiceUtil;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Lints many files in parallel. Each worker thread parses with its own parser; results come back in input order and a
 * file that cannot be read or parsed never affects the others.
 */
public final class LintRunner {
    private static final Logger logger = LogManager.getLogger(LintRunner.class);

    private final LintEngine engine;
    private final int parallelism;

    public LintRunner(LintEngine engine, int parallelism) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be >= 1");
        }
        this.engine = engine;
        this.parallelism = parallelism;
    }

    public LintRunner(LintEngine engine) {
        this(engine, ExecutorServiceUtil.defaultParallelism());
    }

    public List<FileLintResult> lintFiles(List<Path> files) {
        if (files.isEmpty()) {
            return List.of();
        }
        var executor = ExecutorServiceUtil.newFixedThreadExecutor(Math.min(parallelism, files.size()), "lint-worker-");
        try {
            var futures = new ArrayList<CompletableFuture<FileLintResult>>(files.size());
            for (var file : files) {
                futures.add(CompletableFuture.supplyAsync(() -> lintFile(file), executor)
                        .exceptionally(ex -> {
                            logger.error("Unexpected failure linting {}", file, ex);
                            return FileLintResult.unanalyzable(file.toString(), String.valueOf(ex.getMessage()));
                        }));
            }
            return futures.stream().map(CompletableFuture::join).toList();
        } finally {
            executor.shutdownNow();
        }
    }

    public FileLintResult lintFile(Path file) {
        String text;
        try {
            text = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        } catch (IOException e) {
            logger.warn("Cannot read {}: {}", file, e.getMessage());
            return FileLintResult.unanalyzable(file.toString(), "cannot read file: " + e.getMessage());
        }
        return engine.lint(file.toString(), JavaSourceParser.stripBom(text));
    }
}
