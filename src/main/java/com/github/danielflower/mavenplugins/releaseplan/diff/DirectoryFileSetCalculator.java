package com.github.danielflower.mavenplugins.releaseplan.diff;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.security.DigestInputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Lists every file below a package directory except build output, VCS metadata and nested packages (directories
 * with a manifest of their own).
 */
public class DirectoryFileSetCalculator implements PackagedFileSetCalculator {

    public static final Set<String> DEFAULT_EXCLUDED_DIRECTORIES = Collections.unmodifiableSet(
        new HashSet<>(Arrays.asList("target", ".git", ".idea")));

    private final Set<String> excludedDirectories;

    public DirectoryFileSetCalculator() {
        this(DEFAULT_EXCLUDED_DIRECTORIES);
    }

    public DirectoryFileSetCalculator(Collection<String> excludedDirectories) {
        this.excludedDirectories = new HashSet<>(excludedDirectories);
    }

    @Override
    public SortedSet<String> filesFor(final Path packageDir, final String manifestName) throws IOException {
        if (!Files.isRegularFile(packageDir.resolve(manifestName))) {
            throw new NoSuchFileException(packageDir.resolve(manifestName).toString(), null, "no package manifest");
        }
        final SortedSet<String> files = new TreeSet<>();
        Files.walkFileTree(packageDir, new SimpleFileVisitor<Path>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (dir.equals(packageDir)) {
                    return FileVisitResult.CONTINUE;
                }
                if (excludedDirectories.contains(dir.getFileName().toString()) || Files.isRegularFile(dir.resolve(manifestName))) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (!file.getFileName().toString().equals(DirectoryRegistryResolver.VCS_INFO_FILE)) {
                    files.add(packageDir.relativize(file).toString().replace('\\', '/'));
                }
                return FileVisitResult.CONTINUE;
            }
        });
        return files;
    }

    @Override
    public String hashOf(Path file) throws IOException {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
        try (InputStream in = new DigestInputStream(Files.newInputStream(file), digest)) {
            byte[] buffer = new byte[8192];
            while (in.read(buffer) != -1) {
                // the digest sees every byte read
            }
        }
        StringBuilder hex = new StringBuilder();
        for (byte b : digest.digest()) {
            hex.append(String.format("%02x", b));
        }
        return hex.toString();
    }
}
