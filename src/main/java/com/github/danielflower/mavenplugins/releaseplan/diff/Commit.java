package com.github.danielflower.mavenplugins.releaseplan.diff;

import java.util.Date;
import java.util.Objects;

/**
 * A change that contributes to the next release of a package. Synthetic entries, such as dependency updates, have
 * {@link #NO_COMMIT_ID} as their id.
 */
public final class Commit {

    public static final String NO_COMMIT_ID = "0000000";

    private final String id;
    private final String message;
    private final Person author;
    private final Person committer;
    private final String remoteUsername;

    public Commit(String id, String message) {
        this(id, message, null, null, null);
    }

    public Commit(String id, String message, Person author, Person committer, String remoteUsername) {
        this.id = id;
        this.message = message;
        this.author = author;
        this.committer = committer;
        this.remoteUsername = remoteUsername;
    }

    public static Commit synthetic(String message) {
        return new Commit(NO_COMMIT_ID, message);
    }

    public String getId() {
        return id;
    }

    public String getMessage() {
        return message;
    }

    public String getShortMessage() {
        return message.split("\\r?\\n", 2)[0];
    }

    public Person getAuthor() {
        return author;
    }

    public Person getCommitter() {
        return committer;
    }

    /**
     * @return the user name of the author on the git forge, or null if unknown
     */
    public String getRemoteUsername() {
        return remoteUsername;
    }

    public boolean isSynthetic() {
        return NO_COMMIT_ID.equals(id);
    }

    public Commit withMessage(String newMessage) {
        return new Commit(id, newMessage, author, committer, remoteUsername);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Commit commit = (Commit) o;
        return id.equals(commit.id) && message.equals(commit.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, message);
    }

    @Override
    public String toString() {
        return (id.length() > 7 ? id.substring(0, 7) : id) + " " + getShortMessage();
    }

    public static final class Person {
        private final String name;
        private final String email;
        private final Date time;

        public Person(String name, String email, Date time) {
            this.name = name;
            this.email = email;
            this.time = time;
        }

        public String getName() {
            return name;
        }

        public String getEmail() {
            return email;
        }

        public Date getTime() {
            return time;
        }
    }
}
