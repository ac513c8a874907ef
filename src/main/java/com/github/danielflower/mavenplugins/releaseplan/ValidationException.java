package com.github.danielflower.mavenplugins.releaseplan;

import java.util.Collections;
import java.util.List;

/**
 * A problem the user has to fix before a release can be planned. The summary is a single line; the messages are
 * printed line by line in the big error box.
 */
public class ValidationException extends Exception {

    private final List<String> messages;

    public ValidationException(String summary, List<String> messages) {
        super(summary);
        this.messages = messages;
    }

    public ValidationException(String summary, List<String> messages, Throwable cause) {
        super(summary, cause);
        this.messages = messages;
    }

    public ValidationException(String summary, Throwable cause) {
        super(summary, cause);
        this.messages = Collections.singletonList(summary);
    }

    public List<String> getMessages() {
        return messages;
    }
}
