package com.example.f30.infrastructure.storage;

import com.example.f30.application.port.OfficialCopyStore;
import com.example.f30.infrastructure.config.F30Properties;
import com.example.f30.infrastructure.exception.OfficialCopyStorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Clock;

/**
 * Stores official copies as PDF files under the configured directory. The reference is the file path.
 */
@Component
public class FileSystemOfficialCopyStore implements OfficialCopyStore {

    private static final Logger log = LoggerFactory.getLogger(FileSystemOfficialCopyStore.class);

    private final Path directory;
    private final Clock clock;

    public FileSystemOfficialCopyStore(F30Properties properties, Clock clock) {
        this.directory = Path.of(properties.verification().copyDirectory());
        this.clock = clock;
    }

    @Override
    public String store(String documentId, byte[] content) {
        String safeId = documentId.replaceAll("[^A-Za-z0-9._-]", "_");
        Path target = directory.resolve("official_" + safeId + "_" + clock.millis() + ".pdf");
        try {
            Files.createDirectories(directory);
            Files.write(target, content);
        } catch (IOException e) {
            throw new OfficialCopyStorageException("Unable to store official copy at " + target, e);
        }
        log.info("Stored official copy of {} at {}", documentId, target);
        return target.toString();
    }

    @Override
    public byte[] load(String reference) {
        try {
            return Files.readAllBytes(Path.of(reference));
        } catch (IOException | InvalidPathException e) {
            throw new OfficialCopyStorageException("Unable to read official copy " + reference, e);
        }
    }
}
