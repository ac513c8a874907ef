package com.github.danielflower.mavenplugins.releaseplan.report;

import org.apache.commons.lang3.text.StrLookup;

/**
 * Turns issue references in commit messages into markdown links. The URL template uses <code>{issue}</code> where
 * the issue id goes.
 */
public class IssueLinkLookup extends StrLookup<String> {

    public static final String ISSUE_PLACEHOLDER = "{issue}";

    private final String urlTemplate;

    public IssueLinkLookup(String urlTemplate) {
        this.urlTemplate = urlTemplate;
    }

    @Override
    public String lookup(String key) {
        if (urlTemplate == null || key == null || key.trim().isEmpty()) {
            return null;
        }
        String url = urlTemplate.replace(ISSUE_PLACEHOLDER, key.trim());
        return "[" + key.trim() + "](" + url + ")";
    }
}
