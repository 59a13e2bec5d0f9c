package com.loanrecon.ingestion.content;

import com.loanrecon.domain.LoanDocument;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Reads {@code <storageKey>.txt} and {@code <storageKey>.png} under a base directory.
 */
@Slf4j
public class FileSystemDocumentContentStore implements DocumentContentStore {

    private final Path baseDir;

    public FileSystemDocumentContentStore(Path baseDir) {
        this.baseDir = baseDir;
    }

    @Override
    public Optional<DocumentContent> load(LoanDocument document) {
        String key = document.getStorageKey() != null ? document.getStorageKey() : document.getId();
        Path text = resolve(key + ".txt");
        Path image = resolve(key + ".png");
        try {
            String t = Files.isRegularFile(text) ? Files.readString(text, StandardCharsets.UTF_8) : null;
            byte[] img = Files.isRegularFile(image) ? Files.readAllBytes(image) : null;
            if (t == null && img == null) {
                log.debug("No content files for document {} under {}", document.getId(), baseDir);
                return Optional.empty();
            }
            return Optional.of(new DocumentContent(t, img));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read content for document " + document.getId(), e);
        }
    }

    private Path resolve(String name) {
        Path p = baseDir.resolve(name).normalize();
        if (!p.startsWith(baseDir.normalize())) {
            throw new IllegalArgumentException("Storage key escapes content directory: " + name);
        }
        return p;
    }
}
