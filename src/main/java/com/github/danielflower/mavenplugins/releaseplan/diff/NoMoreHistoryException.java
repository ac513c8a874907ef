package com.github.danielflower.mavenplugins.releaseplan.diff;

public class NoMoreHistoryException extends Exception {
    public NoMoreHistoryException(String message) {
        super(message);
    }
}
