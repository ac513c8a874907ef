package com.github.danielflower.mavenplugins.releaseplan.diff;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * A linear history kept in memory. Checking out a commit rewrites the files of the working directory.
 */
class InMemorySourceControl implements SourceControlGateway {

    private final Path workDir;
    private final List<String> ids = new ArrayList<>();
    private final List<String> messages = new ArrayList<>();
    private final List<Map<String, String>> trees = new ArrayList<>();
    private final List<Set<String>> changes = new ArrayList<>();
    private final Map<String, String> tags = new LinkedHashMap<>();
    private int current = -1;
    private int headCheckouts;

    InMemorySourceControl(Path workDir) {
        this.workDir = workDir;
    }

    /**
     * @param changed file contents keyed by path; a null content deletes the file
     */
    String commit(String message, Map<String, String> changed) {
        Map<String, String> tree = new TreeMap<>(trees.isEmpty() ? new HashMap<>() : trees.get(trees.size() - 1));
        for (Map.Entry<String, String> entry : changed.entrySet()) {
            if (entry.getValue() == null) {
                tree.remove(entry.getKey());
            } else {
                tree.put(entry.getKey(), entry.getValue());
            }
        }
        String id = "c" + ids.size() + "abcdef0123456789";
        ids.add(id);
        messages.add(message);
        trees.add(tree);
        changes.add(changed.keySet());
        current = ids.size() - 1;
        writeTree(tree);
        return id;
    }

    void tag(String name, String commitId) {
        tags.put(name, commitId);
    }

    int headCheckouts() {
        return headCheckouts;
    }

    boolean isAtHead() {
        return current == ids.size() - 1;
    }

    @Override
    public Path workingDirectory() {
        return workDir;
    }

    @Override
    public boolean isClean() {
        return true;
    }

    @Override
    public void errorIfNotClean() {
    }

    @Override
    public void checkoutHead() {
        headCheckouts++;
        moveTo(ids.size() - 1);
    }

    @Override
    public void checkout(String commitId) {
        moveTo(ids.indexOf(commitId));
    }

    @Override
    public String checkoutLastCommitAt(Collection<String> paths) throws NoMoreHistoryException {
        return checkoutFrom(current, paths);
    }

    @Override
    public String checkoutPreviousCommitAt(Collection<String> paths) throws NoMoreHistoryException {
        return checkoutFrom(current - 1, paths);
    }

    private String checkoutFrom(int start, Collection<String> paths) throws NoMoreHistoryException {
        for (int i = start; i >= 0; i--) {
            if (touches(changes.get(i), paths)) {
                moveTo(i);
                return ids.get(i);
            }
        }
        throw new NoMoreHistoryException("No commit touches " + paths);
    }

    private static boolean touches(Set<String> changed, Collection<String> paths) {
        for (String file : changed) {
            for (String path : paths) {
                if (path.isEmpty() || file.equals(path) || file.startsWith(path + "/")) {
                    return true;
                }
            }
        }
        return false;
    }

    @Override
    public String currentCommit() {
        return ids.get(current);
    }

    @Override
    public Commit readCommit(String commitId) {
        return new Commit(commitId, messages.get(ids.indexOf(commitId)));
    }

    @Override
    public Set<String> filesChangedIn(String commitId) {
        return changes.get(ids.indexOf(commitId));
    }

    @Override
    public boolean isAncestor(String ancestor, String descendant) {
        return ids.indexOf(ancestor) <= ids.indexOf(descendant);
    }

    @Override
    public Optional<String> tagCommit(String tagName) {
        return Optional.ofNullable(tags.get(tagName));
    }

    @Override
    public List<String> tagNames() {
        return new ArrayList<>(tags.keySet());
    }

    @Override
    public void exportTree(String commitId, String path, Path target) throws IOException {
        for (Map.Entry<String, String> file : trees.get(ids.indexOf(commitId)).entrySet()) {
            String name = file.getKey();
            String relative;
            if (name.equals(path)) {
                relative = name.substring(name.lastIndexOf('/') + 1);
            } else if (path.isEmpty()) {
                relative = name;
            } else if (name.startsWith(path + "/")) {
                relative = name.substring(path.length() + 1);
            } else {
                continue;
            }
            write(target.resolve(relative), file.getValue());
        }
    }

    private void moveTo(int index) {
        current = index;
        writeTree(trees.get(index));
    }

    private void writeTree(Map<String, String> tree) {
        try {
            List<Path> existing;
            try (Stream<Path> files = Files.walk(workDir)) {
                existing = files.filter(Files::isRegularFile).sorted(Comparator.reverseOrder()).collect(Collectors.toList());
            }
            for (Path file : existing) {
                Files.delete(file);
            }
            for (Map.Entry<String, String> file : tree.entrySet()) {
                write(workDir.resolve(file.getKey()), file.getValue());
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    static void write(Path file, String content) throws IOException {
        Files.createDirectories(file.getParent());
        Files.write(file, content.getBytes(StandardCharsets.UTF_8));
    }
}
