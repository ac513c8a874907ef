package com.github.danielflower.mavenplugins.releaseplan.diff;

import com.github.danielflower.mavenplugins.releaseplan.version.Versions;
import com.vdurmont.semver4j.Semver;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Names release tags from a template with <code>{package}</code> and <code>{version}</code> placeholders, and
 * recognises tags made from the same template.
 */
public class ReleaseTagPattern {

    public static final String PACKAGE_PLACEHOLDER = "{package}";
    public static final String VERSION_PLACEHOLDER = "{version}";
    public static final String MULTI_PACKAGE_TEMPLATE = PACKAGE_PLACEHOLDER + "-v" + VERSION_PLACEHOLDER;
    public static final String SINGLE_PACKAGE_TEMPLATE = "v" + VERSION_PLACEHOLDER;

    // https://semver.org/#is-there-a-suggested-regular-expression-regex-to-check-a-semver-string
    private static final String SEMVER_REGEX = "((?:0|[1-9]\\d*)\\.(?:0|[1-9]\\d*)\\.(?:0|[1-9]\\d*)"
        + "(?:-(?:0|[1-9]\\d*|\\d*[a-zA-Z-][0-9a-zA-Z-]*)(?:\\.(?:0|[1-9]\\d*|\\d*[a-zA-Z-][0-9a-zA-Z-]*))*)?"
        + "(?:\\+[0-9A-Za-z-]+(?:\\.[0-9A-Za-z-]+)*)?)";

    private final String template;
    private final String packageName;
    private final Pattern pattern;

    public ReleaseTagPattern(String template, String packageName) {
        this.template = template;
        this.packageName = packageName;
        String withPackage = template.replace(PACKAGE_PLACEHOLDER, packageName);
        int versionIndex = withPackage.indexOf(VERSION_PLACEHOLDER);
        String regex;
        if (versionIndex < 0) {
            regex = Pattern.quote(withPackage);
        } else {
            String before = withPackage.substring(0, versionIndex);
            String after = withPackage.substring(versionIndex + VERSION_PLACEHOLDER.length());
            regex = quote(before) + SEMVER_REGEX + quote(after);
        }
        this.pattern = Pattern.compile("^" + regex + "$");
    }

    public static String defaultTemplate(boolean multiPackage) {
        return multiPackage ? MULTI_PACKAGE_TEMPLATE : SINGLE_PACKAGE_TEMPLATE;
    }

    private static String quote(String s) {
        return s.isEmpty() ? "" : Pattern.quote(s);
    }

    public String tagName(Semver version) {
        return template.replace(PACKAGE_PLACEHOLDER, packageName).replace(VERSION_PLACEHOLDER, version.getValue());
    }

    /**
     * @return the version in the tag, or empty if the tag was not made from this pattern
     */
    public Optional<Semver> versionOf(String tagName) {
        Matcher matcher = pattern.matcher(tagName);
        if (!matcher.matches() || matcher.groupCount() < 1) {
            return Optional.empty();
        }
        return Versions.tryParse(matcher.group(1));
    }

    @Override
    public String toString() {
        return pattern.pattern();
    }
}
