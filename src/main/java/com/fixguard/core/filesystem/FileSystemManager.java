package com.fixguard.core.filesystem;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Workspace-scoped file access for the fix engine.
 *
 * Every path is resolved relative to the workspace root and rejected if it escapes it.
 * Rollback works on raw bytes ({@link #snapshotFile} / {@link #restoreFile}) so a
 * restored file is byte-identical to the snapshot, independent of its encoding.
 */
@Component
public class FileSystemManager {

    private static final Logger log = LoggerFactory.getLogger(FileSystemManager.class);

    private static final long MAX_FILE_SIZE      = 10 * 1024 * 1024;
    private static final int  MAX_SEARCH_RESULTS = 100;
    private static final int  MAX_TREE_DEPTH     = 10;

    private final Path workspaceRoot;

    public FileSystemManager(
            @Value("${fixguard.workspace.path:.}") String workspacePath
    ) {
        this.workspaceRoot = Paths.get(workspacePath).toAbsolutePath().normalize();
        try {
            if (!Files.exists(workspaceRoot)) {
                Files.createDirectories(workspaceRoot);
                log.info("[FileSystem] Created workspace: {}", workspaceRoot);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to initialize workspace: " + workspacePath, e);
        }
        log.info("[FileSystem] Workspace initialized: {}", workspaceRoot);
    }

    public String getWorkspacePath() {
        return workspaceRoot.toString();
    }

    // ================================================================
    // Snapshot / Restore
    // ================================================================

    public FileSnapshot snapshotFile(String relativePath) throws FileSystemException {
        byte[] content = readBytes(relativePath);
        log.info("[FileSystem] Snapshot taken: {} ({} bytes)", relativePath, content.length);
        return new FileSnapshot(relativePath, content);
    }

    public void restoreFile(FileSnapshot snapshot) throws FileSystemException {
        writeBytes(snapshot.getRelativePath(), snapshot.getContent());
        log.info("[FileSystem] Restored {} to snapshot ({} bytes)",
                snapshot.getRelativePath(), snapshot.size());
    }

    // ================================================================
    // Standard File Operations
    // ================================================================

    public String readFile(String relativePath) throws FileSystemException {
        return new String(readBytes(relativePath), StandardCharsets.UTF_8);
    }

    public byte[] readBytes(String relativePath) throws FileSystemException {
        Path targetPath = resolveSafePath(relativePath);
        log.info("[FileSystem] Reading file: {}", relativePath);
        try {
            long fileSize = Files.size(targetPath);
            if (fileSize > MAX_FILE_SIZE)
                throw new FileSystemException("File too large: " + fileSize + " bytes");
            return Files.readAllBytes(targetPath);
        } catch (IOException e) {
            throw new FileSystemException("Failed to read file: " + relativePath, e);
        }
    }

    public void writeFile(String relativePath, String content) throws FileSystemException {
        writeBytes(relativePath, content.getBytes(StandardCharsets.UTF_8));
    }

    public void writeBytes(String relativePath, byte[] content) throws FileSystemException {
        Path targetPath = resolveSafePath(relativePath);
        log.info("[FileSystem] Writing {} bytes to {}", content.length, relativePath);
        try {
            Path parent = targetPath.getParent();
            if (parent != null && !Files.exists(parent)) Files.createDirectories(parent);
            Files.write(targetPath, content);
        } catch (IOException e) {
            throw new FileSystemException("Failed to write file: " + relativePath, e);
        }
    }

    public List<SearchResult> grep(String pattern, String relativePath, int maxResults)
            throws FileSystemException {
        Path targetPath = resolveSafePath(relativePath);
        log.info("[FileSystem] Searching for '{}' in {}", pattern, relativePath);
        List<SearchResult> results     = new ArrayList<>();
        Pattern            compiled    = Pattern.compile(pattern);
        int                limit       = Math.min(maxResults, MAX_SEARCH_RESULTS);
        try {
            if (Files.isDirectory(targetPath)) {
                try (Stream<Path> paths = Files.walk(targetPath, MAX_TREE_DEPTH)) {
                    List<Path> files = paths.filter(Files::isRegularFile)
                                            .filter(p -> !isIgnoredFile(p))
                                            .sorted()
                                            .collect(Collectors.toList());
                    for (Path file : files) {
                        try { results.addAll(searchInFile(file, compiled)); }
                        catch (IOException e) {
                            log.warn("[FileSystem] Failed to search {}: {}", file, e.getMessage());
                        }
                        if (results.size() >= limit) break;
                    }
                }
            } else {
                results.addAll(searchInFile(targetPath, compiled));
            }
            log.info("[FileSystem] Found {} matches", results.size());
            return results.stream().limit(limit).collect(Collectors.toList());
        } catch (IOException e) {
            throw new FileSystemException("Failed to search in: " + relativePath, e);
        }
    }

    public boolean fileExists(String relativePath) {
        try { return Files.exists(resolveSafePath(relativePath)); }
        catch (FileSystemException e) { return false; }
    }

    public boolean isDirectory(String relativePath) {
        try { return Files.isDirectory(resolveSafePath(relativePath)); }
        catch (FileSystemException e) { return false; }
    }

    // ================================================================
    // Private helpers
    // ================================================================

    private Path resolveSafePath(String relativePath) throws FileSystemException {
        if (relativePath == null || relativePath.trim().isEmpty())
            throw new FileSystemException("Path cannot be empty");
        Path resolved = workspaceRoot.resolve(relativePath).normalize();
        if (!resolved.startsWith(workspaceRoot))
            throw new FileSystemException("Path traversal attempt detected: " + relativePath);
        return resolved;
    }

    private List<SearchResult> searchInFile(Path file, Pattern pattern) throws IOException {
        List<SearchResult> results     = new ArrayList<>();
        List<String>       lines       = Files.readAllLines(file, StandardCharsets.UTF_8);
        String             relFilePath = workspaceRoot.relativize(file).toString();
        for (int i = 0; i < lines.size(); i++) {
            if (pattern.matcher(lines.get(i)).find())
                results.add(new SearchResult(relFilePath, i + 1, lines.get(i)));
        }
        return results;
    }

    private boolean isIgnoredFile(Path path) {
        for (Path part : workspaceRoot.relativize(path)) {
            String name = part.toString();
            if (name.startsWith(".") || name.equals("node_modules")) return true;
        }
        return path.getFileName().toString().endsWith(".png");
    }

    // ================================================================
    // Inner classes
    // ================================================================

    public static final class FileSnapshot {
        private final String relativePath;
        private final byte[] content;

        private FileSnapshot(String relativePath, byte[] content) {
            this.relativePath = relativePath;
            this.content      = content;
        }

        public String getRelativePath() { return relativePath; }
        public byte[] getContent()      { return Arrays.copyOf(content, content.length); }
        public int    size()            { return content.length; }

        public String asText() { return new String(content, StandardCharsets.UTF_8); }

        @Override public String toString() { return "FileSnapshot{" + relativePath + ", " + content.length + " bytes}"; }
    }

    public static class SearchResult {
        private final String filePath;
        private final int    lineNumber;
        private final String lineContent;

        public SearchResult(String filePath, int lineNumber, String lineContent) {
            this.filePath    = filePath;
            this.lineNumber  = lineNumber;
            this.lineContent = lineContent;
        }

        public String getFilePath()    { return filePath; }
        public int    getLineNumber()  { return lineNumber; }
        public String getLineContent() { return lineContent; }

        @Override public String toString() {
            return String.format("%s:%d: %s", filePath, lineNumber, lineContent);
        }
    }

    public static class FileSystemException extends Exception {
        public FileSystemException(String message)                  { super(message); }
        public FileSystemException(String message, Throwable cause) { super(message, cause); }
    }
}
