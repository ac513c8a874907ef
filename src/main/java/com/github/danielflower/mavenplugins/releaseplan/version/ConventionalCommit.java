package com.github.danielflower.mavenplugins.releaseplan.version;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A commit message of the form <code>type(scope)!: subject</code>, optionally followed by a body and footers.
 * See https://www.conventionalcommits.org/
 */
public class ConventionalCommit {

    public static final String FEATURE = "feat";
    public static final String FIX = "fix";

    private static final Pattern HEADER = Pattern.compile("^(?<type>[A-Za-z][\\w-]*)(?:\\((?<scope>[^()\\r\\n]+)\\))?(?<breaking>!)?: (?<subject>\\S.*)$");
    private static final Pattern BREAKING_FOOTER = Pattern.compile("(?m)^BREAKING[ -]CHANGE: \\S");

    private final String type;
    private final String scope;
    private final boolean breaking;
    private final String subject;

    private ConventionalCommit(String type, String scope, boolean breaking, String subject) {
        this.type = type;
        this.scope = scope;
        this.breaking = breaking;
        this.subject = subject;
    }

    /**
     * @return the parsed commit, or empty if the first line does not follow the convention
     */
    public static Optional<ConventionalCommit> parse(String message) {
        if (message == null) {
            return Optional.empty();
        }
        String trimmed = message.trim();
        String firstLine = trimmed.split("\\r?\\n", 2)[0];
        Matcher matcher = HEADER.matcher(firstLine);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        boolean breaking = matcher.group("breaking") != null || BREAKING_FOOTER.matcher(trimmed).find();
        String scope = matcher.group("scope");
        return Optional.of(new ConventionalCommit(matcher.group("type").toLowerCase(), scope == null ? null : scope.trim(), breaking, matcher.group("subject").trim()));
    }

    public String getType() {
        return type;
    }

    public String getScope() {
        return scope;
    }

    public boolean isBreaking() {
        return breaking;
    }

    public String getSubject() {
        return subject;
    }

    public boolean isFeature() {
        return FEATURE.equals(type);
    }

    public boolean isFix() {
        return FIX.equals(type);
    }
}
