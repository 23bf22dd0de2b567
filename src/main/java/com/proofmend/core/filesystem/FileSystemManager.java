package com.proofmend.core.filesystem;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.FileTime;
import java.time.Instant;

/**
 * File access for the working file and the run directory.
 *
 * Every write refreshes the modification time afterwards, so Lake never skips a
 * rebuild because the timestamp looked unchanged.
 */
@Component
public class FileSystemManager {

    private static final Logger log = LoggerFactory.getLogger(FileSystemManager.class);

    private static final long MAX_FILE_SIZE = 10 * 1024 * 1024;
    private static final int  MAX_UNIQUE_SUFFIX = 1000;

    public String readFile(Path path) throws FileSystemException {
        try {
            long fileSize = Files.size(path);
            if (fileSize > MAX_FILE_SIZE)
                throw new FileSystemException("File too large: " + path + " (" + fileSize + " bytes, max: " + MAX_FILE_SIZE + ")");
            String content = Files.readString(path, StandardCharsets.UTF_8);
            log.debug("[FileSystem] Read {} chars from {}", content.length(), path);
            return content;
        } catch (IOException e) {
            throw new FileSystemException("Failed to read file: " + path, e);
        }
    }

    public void writeFile(Path path, String content) throws FileSystemException {
        try {
            Path parent = path.getParent();
            if (parent != null && !Files.exists(parent)) Files.createDirectories(parent);
            Files.writeString(path, content, StandardCharsets.UTF_8);
            touch(path);
            log.info("[FileSystem] Wrote {} chars to {}", content.length(), path.getFileName());
        } catch (IOException e) {
            throw new FileSystemException("Failed to write file: " + path, e);
        }
    }

    /**
     * Writes a file that must not exist yet. Used for append-only records.
     */
    public void writeNewFile(Path path, String content) throws FileSystemException {
        try {
            Path parent = path.getParent();
            if (parent != null && !Files.exists(parent)) Files.createDirectories(parent);
            Files.writeString(path, content, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        } catch (FileAlreadyExistsException e) {
            throw new FileSystemException("Refusing to overwrite existing file: " + path, e);
        } catch (IOException e) {
            throw new FileSystemException("Failed to write file: " + path, e);
        }
    }

    public void touch(Path path) throws FileSystemException {
        try {
            Files.setLastModifiedTime(path, FileTime.from(Instant.now()));
        } catch (IOException e) {
            throw new FileSystemException("Failed to refresh timestamp: " + path, e);
        }
    }

    public boolean fileExists(Path path) {
        return Files.isRegularFile(path);
    }

    /**
     * Creates {@code parent/baseName}, or {@code baseName-2}, {@code baseName-3}, ...
     * when an earlier run already took the name.
     */
    public Path createUniqueDirectory(Path parent, String baseName) throws FileSystemException {
        try {
            Files.createDirectories(parent);
            for (int i = 1; i <= MAX_UNIQUE_SUFFIX; i++) {
                Path candidate = parent.resolve(i == 1 ? baseName : baseName + "-" + i);
                try {
                    Files.createDirectory(candidate);
                    log.info("[FileSystem] Created directory {}", candidate);
                    return candidate;
                } catch (FileAlreadyExistsException e) {
                    log.debug("[FileSystem] {} exists, trying next suffix", candidate.getFileName());
                }
            }
        } catch (IOException e) {
            throw new FileSystemException("Failed to create directory under " + parent, e);
        }
        throw new FileSystemException("No free directory name for " + baseName + " under " + parent);
    }

    public static class FileSystemException extends Exception {
        public FileSystemException(String message)                  { super(message); }
        public FileSystemException(String message, Throwable cause) { super(message, cause); }
    }
}
