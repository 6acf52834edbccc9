package com.partialspec.cli;

import com.partialspec.dto.request.GenerateRequest;
import com.partialspec.dto.response.CommandResponse;
import com.partialspec.dto.response.GenerateReport;
import com.partialspec.model.Decision;
import com.partialspec.service.api.PartialSpecWorkflow;
import org.slf4j.LoggerFactory;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

/**
 * A Spring Shell component that builds the partial spec for a change set.
 * <p>
 * It is meant to run non-interactively in a pipeline ({@code java -jar app.jar generate ...}),
 * after the before/after documents and the structural diff have been produced. The decision
 * log is printed one line per evaluated operation so the pipeline output shows why each
 * operation was or was not strictly checked.
 */
@ShellComponent
public class GenerateCommand {

    public static final String ANSI_RESET = "\u001B[0m";
    public static final String ANSI_GREEN = "\u001B[32m";
    public static final String ANSI_YELLOW = "\u001B[33m";
    public static final String ANSI_PURPLE = "\u001B[35m";
    public static final String ANSI_CYAN = "\u001B[36m";

    private final PartialSpecWorkflow workflow;

    public GenerateCommand(PartialSpecWorkflow workflow) {
        this.workflow = workflow;
    }

    /**
     * Detects the changed operations, drops the legacy ones and writes the minimal partial spec
     * in JSON and YAML form.
     *
     * @param artifactDir Directory holding the diff and the before/after documents.
     * @param baseline    The legacy-operations document.
     * @param diff        The structural diff artifact.
     * @param before      Base name or file name of the previous version's document.
     * @param after       Base name or file name of the new version's document.
     * @param outputDir   Where to write the partial spec.
     * @param verbose     If true, enables debug logging for the duration of the command.
     */
    @ShellMethod(key = "generate", value = "Builds a partial spec holding only the non-legacy changed operations.")
    public void generate(
            @ShellOption(value = {"--artifact-dir", "-d"}, help = "Directory holding the diff and the before/after documents.", defaultValue = ShellOption.NULL) String artifactDir,
            @ShellOption(value = {"--baseline", "-b"}, help = "The legacy baseline document.", defaultValue = ShellOption.NULL) String baseline,
            @ShellOption(value = "--diff", help = "The structural diff artifact.", defaultValue = ShellOption.NULL) String diff,
            @ShellOption(value = "--before", help = "Base name or file of the previous version's document.", defaultValue = ShellOption.NULL) String before,
            @ShellOption(value = "--after", help = "Base name or file of the new version's document.", defaultValue = ShellOption.NULL) String after,
            @ShellOption(value = {"--output-dir", "-o"}, help = "Where to write the partial spec.", defaultValue = ShellOption.NULL) String outputDir,
            @ShellOption(value = {"--verbose", "-v"}, help = "Enable verbose debug logging.", defaultValue = "false", arity = 0) boolean verbose
    ) {
        ch.qos.logback.classic.Logger rootLogger = (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        ch.qos.logback.classic.Level originalLevel = rootLogger.getLevel();
        if (verbose) {
            rootLogger.setLevel(ch.qos.logback.classic.Level.DEBUG);
            System.out.println(ANSI_PURPLE + "-- Verbose mode enabled --" + ANSI_RESET);
        }

        try {
            GenerateReport report = workflow.generate(new GenerateRequest(artifactDir, baseline, diff, before, after, outputDir));

            System.out.println(ANSI_CYAN + "Decisions:" + ANSI_RESET);
            if (report.result().decisions().isEmpty()) {
                System.out.println("  No changed operations found.");
            }
            report.result().decisions().forEach(decision -> System.out.println("  " + colorOf(decision) + decision.toLogLine() + ANSI_RESET));

            report.warnings().forEach(warning -> System.out.println(ANSI_YELLOW + "WARNING: " + warning + ANSI_RESET));

            System.out.println(ANSI_CYAN + "Kept: " + ANSI_RESET + report.summary());
            System.out.println(new CommandResponse(true, "Partial spec written to " + report.files().json()
                    + " and " + report.files().yaml()).toAnsiString());
        } catch (Exception e) {
            System.out.println(new CommandResponse(false, "Failed to generate partial spec: " + e.getMessage()).toAnsiString());
        } finally {
            if (verbose) {
                rootLogger.setLevel(originalLevel);
                System.out.println(ANSI_PURPLE + "-- Verbose mode disabled --" + ANSI_RESET);
            }
        }
    }

    private String colorOf(Decision decision) {
        switch (decision.type()) {
            case INCLUDE:
                return ANSI_GREEN;
            case IGNORE:
                return ANSI_YELLOW;
            default:
                return ANSI_PURPLE;
        }
    }
}
