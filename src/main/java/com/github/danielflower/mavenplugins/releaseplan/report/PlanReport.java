package com.github.danielflower.mavenplugins.releaseplan.report;

import com.github.danielflower.mavenplugins.releaseplan.plan.UpdatePlan;
import com.github.danielflower.mavenplugins.releaseplan.plan.UpdateResult;
import org.apache.maven.plugin.logging.Log;

import java.util.ArrayList;
import java.util.List;

/**
 * Prints a plan to the Maven log.
 */
public class PlanReport {

    private final Log log;

    public PlanReport(Log log) {
        this.log = log;
    }

    public void print(UpdatePlan plan) {
        for (String line : lines(plan)) {
            log.info(line);
        }
        for (UpdatePlan.PackageFailure failure : plan.getFailures()) {
            log.error("Could not plan " + failure.getPackageName() + " (" + failure.getStage() + "):");
            for (String message : failure.getMessages()) {
                log.error("  " + message);
            }
        }
    }

    public List<String> lines(UpdatePlan plan) {
        List<String> lines = new ArrayList<>();
        if (plan.isEmpty()) {
            lines.add("All packages are up to date.");
            return lines;
        }
        if (plan.getWorkspaceVersion().isPresent()) {
            lines.add("New workspace version: " + plan.getWorkspaceVersion().get().getValue());
        }
        for (UpdatePlan.Entry entry : plan.getUpdates()) {
            UpdateResult result = entry.getResult();
            String from = result.getLastPublishedVersion() == null ? "never published" : "from " + result.getLastPublishedVersion().getValue();
            lines.add("Going to release " + entry.getPackage().getName() + " " + result.getNextVersion().getValue()
                + " (" + from + ")" + result.getCompatibilityCheck().describe());
            if (result.getCompatibilityCheck().getDetails() != null) {
                lines.add("    " + result.getCompatibilityCheck().getDetails());
            }
        }
        if (plan.getPropagationWaves() > 0) {
            lines.add("Dependency updates took " + plan.getPropagationWaves() + " round(s) to propagate.");
        }
        return lines;
    }
}
