package de.mirkosertic.docconsolidator.pipeline;

import de.mirkosertic.docconsolidator.table.TableFormatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects what went wrong during a run.
 * <p>
 * Every error and open issue is written to the {@code docconsolidator.errors} logger,
 * which feeds the error report, and kept in memory for the run summary.
 */
public class RunJournal {

    public static final String ERROR_LOGGER = "docconsolidator.errors";

    private static final Logger errors = LoggerFactory.getLogger(ERROR_LOGGER);

    public enum ErrorKind {
        LOOKUP,
        IO,
        FORMAT
    }

    private final Map<ErrorKind, Integer> errorCounts = new LinkedHashMap<>();
    private final List<String> issues = new ArrayList<>();
    private final List<StageResult> stageResults = new ArrayList<>();

    public void lookupError(final String stage, final String message) {
        count(ErrorKind.LOOKUP);
        errors.error("{}: MISSING {}", stage, message);
    }

    public void ioError(final String stage, final String message, final Throwable cause) {
        count(ErrorKind.IO);
        errors.error("{}: {}: {}", stage, message, cause.toString());
    }

    public void ioError(final String stage, final String message) {
        count(ErrorKind.IO);
        errors.error("{}: {}", stage, message);
    }

    public void formatError(final String stage, final Path table, final TableFormatException problem) {
        count(ErrorKind.FORMAT);
        errors.error("{}: {} in {}", stage, problem.getMessage(), table);
    }

    /**
     * Something an operator has to look at; the run itself carries on.
     */
    public void issue(final String stage, final String message) {
        issues.add(message);
        errors.warn("{}: ISSUE {}", stage, message);
    }

    void stageFinished(final StageResult result) {
        stageResults.add(result);
    }

    private void count(final ErrorKind kind) {
        errorCounts.merge(kind, 1, Integer::sum);
    }

    public int errorCount(final ErrorKind kind) {
        return errorCounts.getOrDefault(kind, 0);
    }

    public int totalErrors() {
        return errorCounts.values().stream().mapToInt(Integer::intValue).sum();
    }

    public List<String> issues() {
        return List.copyOf(issues);
    }

    public List<StageResult> stageResults() {
        return List.copyOf(stageResults);
    }
}
