package com.ledgerradar.ingestion.store;

import com.ledgerradar.ingestion.config.IntakeProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Filesystem-backed store: {storageDir}/{accountId}/{checksum}-{fileName}.
 */
@Component
@Slf4j
public class LocalStatementFileStore implements StatementFileStore {

    private final Path root;

    public LocalStatementFileStore(IntakeProperties intakeProperties) {
        this.root = Paths.get(intakeProperties.getStorageDir()).toAbsolutePath().normalize();
    }

    @Override
    public String store(String accountId, String checksum, String fileName, byte[] content) {
        String key = sanitize(accountId) + "/" + checksum + "-" + sanitize(fileName);
        Path target = resolve(key);
        try {
            Files.createDirectories(target.getParent());
            Files.write(target, content);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot store upload " + key, e);
        }
        return key;
    }

    @Override
    public byte[] load(String storageKey) {
        try {
            return Files.readAllBytes(resolve(storageKey));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read upload " + storageKey, e);
        }
    }

    @Override
    public void delete(String storageKey) {
        if (storageKey == null) {
            return;
        }
        try {
            Files.deleteIfExists(resolve(storageKey));
        } catch (IOException e) {
            log.warn("Could not delete stored upload {}: {}", storageKey, e.getMessage());
        }
    }

    private Path resolve(String key) {
        Path p = root.resolve(key).normalize();
        if (!p.startsWith(root)) {
            throw new IllegalArgumentException("Storage key escapes upload directory: " + key);
        }
        return p;
    }

    private static String sanitize(String name) {
        String s = name == null ? "upload" : name.replaceAll("[^A-Za-z0-9._-]", "_");
        return s.isBlank() || s.startsWith(".") ? "_" + s : s;
    }
}
