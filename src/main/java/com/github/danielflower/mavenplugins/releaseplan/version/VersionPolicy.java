package com.github.danielflower.mavenplugins.releaseplan.version;

import com.github.danielflower.mavenplugins.releaseplan.ValidationException;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import static java.util.Arrays.asList;

/**
 * Knobs that change how commits map to version increments. Instances are immutable; the {@code with} methods
 * return modified copies.
 */
public class VersionPolicy {

    public static final VersionPolicy DEFAULT = new VersionPolicy(false, false, null, null);

    private final boolean featuresAlwaysIncrementMinor;
    private final boolean breakingAlwaysIncrementMajor;
    private final Pattern customMajorIncrement;
    private final Pattern customMinorIncrement;

    private VersionPolicy(boolean featuresAlwaysIncrementMinor, boolean breakingAlwaysIncrementMajor,
                          Pattern customMajorIncrement, Pattern customMinorIncrement) {
        this.featuresAlwaysIncrementMinor = featuresAlwaysIncrementMinor;
        this.breakingAlwaysIncrementMajor = breakingAlwaysIncrementMajor;
        this.customMajorIncrement = customMajorIncrement;
        this.customMinorIncrement = customMinorIncrement;
    }

    /**
     * If true, feature commits bump the minor version even before 1.0.0.
     */
    public VersionPolicy withFeaturesAlwaysIncrementMinor(boolean value) {
        return new VersionPolicy(value, breakingAlwaysIncrementMajor, customMajorIncrement, customMinorIncrement);
    }

    /**
     * If true, breaking changes bump the major version even before 1.0.0.
     */
    public VersionPolicy withBreakingAlwaysIncrementMajor(boolean value) {
        return new VersionPolicy(featuresAlwaysIncrementMinor, value, customMajorIncrement, customMinorIncrement);
    }

    public VersionPolicy withCustomMajorIncrementRegex(String regex) throws ValidationException {
        return new VersionPolicy(featuresAlwaysIncrementMinor, breakingAlwaysIncrementMajor, compile("customMajorIncrementRegex", regex), customMinorIncrement);
    }

    public VersionPolicy withCustomMinorIncrementRegex(String regex) throws ValidationException {
        return new VersionPolicy(featuresAlwaysIncrementMinor, breakingAlwaysIncrementMajor, customMajorIncrement, compile("customMinorIncrementRegex", regex));
    }

    private static Pattern compile(String setting, String regex) throws ValidationException {
        if (regex == null || regex.isEmpty()) {
            return null;
        }
        try {
            return Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            String summary = "The " + setting + " setting is not a valid regular expression";
            throw new ValidationException(summary, asList(summary, " * " + regex, e.getDescription()), e);
        }
    }

    public boolean isFeaturesAlwaysIncrementMinor() {
        return featuresAlwaysIncrementMinor;
    }

    public boolean isBreakingAlwaysIncrementMajor() {
        return breakingAlwaysIncrementMajor;
    }

    public boolean isCustomMajor(ConventionalCommit commit) {
        return customMajorIncrement != null && customMajorIncrement.matcher(commit.getType()).find();
    }

    public boolean isCustomMinor(ConventionalCommit commit) {
        return customMinorIncrement != null && customMinorIncrement.matcher(commit.getType()).find();
    }
}
