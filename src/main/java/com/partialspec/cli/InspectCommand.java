package com.partialspec.cli;

import com.partialspec.dto.request.GenerateRequest;
import com.partialspec.dto.response.CommandResponse;
import com.partialspec.dto.response.DetectionReport;
import com.partialspec.model.Baseline;
import com.partialspec.model.OperationKey;
import com.partialspec.service.api.PartialSpecWorkflow;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

/**
 * Commands for looking at the inputs of a run without writing anything: the legacy baseline
 * and the operations the change detector flags.
 */
@ShellComponent
public class InspectCommand {

    public static final String ANSI_RESET = "\u001B[0m";
    public static final String ANSI_CYAN = "\u001B[36m";
    public static final String ANSI_YELLOW = "\u001B[33m";
    public static final String ANSI_GREEN = "\u001B[32m";

    private final PartialSpecWorkflow workflow;

    public InspectCommand(PartialSpecWorkflow workflow) {
        this.workflow = workflow;
    }

    /**
     * Lists the legacy operations of a baseline document.
     */
    @ShellMethod(key = "baseline", value = "List the legacy operations of a baseline document.")
    public void baseline(
            @ShellOption(value = {"--artifact-dir", "-d"}, help = "Directory the baseline path is relative to.", defaultValue = ShellOption.NULL) String artifactDir,
            @ShellOption(value = {"--file", "-f"}, help = "The baseline document.", defaultValue = ShellOption.NULL) String file
    ) {
        try {
            Baseline baseline = workflow.loadBaseline(new GenerateRequest(artifactDir, file, null, null, null, null));
            if (!baseline.present()) {
                System.out.println(new CommandResponse(false, "No baseline found. Every changed operation would be strictly checked.").toAnsiString());
                return;
            }
            System.out.println(ANSI_CYAN + "Legacy operations (" + baseline.size() + "):" + ANSI_RESET);
            baseline.operations().forEach(key -> System.out.println("  " + key));
        } catch (Exception e) {
            System.out.println(new CommandResponse(false, "Failed to load baseline: " + e.getMessage()).toAnsiString());
        }
    }

    /**
     * Runs change detection only and lists each affected operation with what flagged it.
     */
    @ShellMethod(key = "affected", value = "List the operations detected as changed, and whether they are legacy.")
    public void affected(
            @ShellOption(value = {"--artifact-dir", "-d"}, help = "Directory holding the diff and the before/after documents.", defaultValue = ShellOption.NULL) String artifactDir,
            @ShellOption(value = {"--baseline", "-b"}, help = "The legacy baseline document.", defaultValue = ShellOption.NULL) String baseline,
            @ShellOption(value = "--diff", help = "The structural diff artifact.", defaultValue = ShellOption.NULL) String diff,
            @ShellOption(value = "--before", help = "Base name or file of the previous version's document.", defaultValue = ShellOption.NULL) String before,
            @ShellOption(value = "--after", help = "Base name or file of the new version's document.", defaultValue = ShellOption.NULL) String after
    ) {
        try {
            DetectionReport report = workflow.detect(new GenerateRequest(artifactDir, baseline, diff, before, after, null));
            if (report.affected().isEmpty()) {
                System.out.println(ANSI_YELLOW + "No changed operations found." + ANSI_RESET);
                return;
            }
            System.out.println(ANSI_CYAN + "Affected operations (" + report.affected().size() + "):" + ANSI_RESET);
            for (OperationKey key : report.affected().keys()) {
                String marker = report.baseline().contains(key)
                        ? ANSI_YELLOW + " [legacy]" + ANSI_RESET
                        : ANSI_GREEN + " [strict]" + ANSI_RESET;
                System.out.println("  " + key + marker + " - " + report.affected().describeSources(key));
            }
        } catch (Exception e) {
            System.out.println(new CommandResponse(false, "Failed to detect changes: " + e.getMessage()).toAnsiString());
        }
    }
}
