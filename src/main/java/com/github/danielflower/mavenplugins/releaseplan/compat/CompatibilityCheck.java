package com.github.danielflower.mavenplugins.releaseplan.compat;

/**
 * Outcome of comparing the API of a package with its last published version. Reported to the user only; it never
 * changes the computed version.
 */
public final class CompatibilityCheck {

    public enum Outcome {
        COMPATIBLE, INCOMPATIBLE, SKIPPED
    }

    private static final CompatibilityCheck COMPATIBLE = new CompatibilityCheck(Outcome.COMPATIBLE, null);
    private static final CompatibilityCheck SKIPPED = new CompatibilityCheck(Outcome.SKIPPED, null);

    private final Outcome outcome;
    private final String details;

    private CompatibilityCheck(Outcome outcome, String details) {
        this.outcome = outcome;
        this.details = details;
    }

    public static CompatibilityCheck compatible() {
        return COMPATIBLE;
    }

    public static CompatibilityCheck incompatible(String details) {
        return new CompatibilityCheck(Outcome.INCOMPATIBLE, details);
    }

    public static CompatibilityCheck skipped() {
        return SKIPPED;
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public String getDetails() {
        return details;
    }

    /**
     * @return a short suffix for log lines, empty when the check did not run
     */
    public String describe() {
        switch (outcome) {
            case COMPATIBLE:
                return " (API compatible)";
            case INCOMPATIBLE:
                return " (API incompatible)";
            default:
                return "";
        }
    }

    @Override
    public String toString() {
        return details == null ? outcome.toString() : outcome + ": " + details;
    }
}
