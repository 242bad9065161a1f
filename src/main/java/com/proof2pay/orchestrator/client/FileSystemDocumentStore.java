package com.proof2pay.orchestrator.client;

import com.proof2pay.orchestrator.exception.DocumentFetchException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.stream.Stream;

/**
 * Document store backed by a local folder. Refs are paths relative to the root.
 */
@Component
public class FileSystemDocumentStore implements DocumentStore {

    @Value("${agent.documents.path:documents}")
    private String documentsPath = "documents";

    public void setDocumentsPath(String path) {
        this.documentsPath = path;
    }

    @Override
    public byte[] fetch(String ref) {
        Path file = resolve(ref);
        if (!Files.isRegularFile(file)) {
            throw new DocumentFetchException("Document not found: " + ref);
        }
        try {
            return Files.readAllBytes(file);
        } catch (IOException e) {
            throw new DocumentFetchException("Failed to read document " + ref + ": " + e.getMessage(), e);
        }
    }

    @Override
    public List<String> list(String folder) {
        Path dir = resolve(folder == null ? "" : folder);
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        Path root = root();
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(Files::isRegularFile)
                .map(file -> root.relativize(file.toAbsolutePath().normalize()).toString().replace('\\', '/'))
                .sorted()
                .toList();
        } catch (IOException e) {
            throw new DocumentFetchException("Failed to list folder " + folder + ": " + e.getMessage(), e);
        }
    }

    private Path resolve(String ref) {
        Path root = root();
        Path resolved = root.resolve(ref).normalize();
        if (!resolved.startsWith(root)) {
            throw new DocumentFetchException("Document ref escapes the document root: " + ref);
        }
        return resolved;
    }

    private Path root() {
        return Paths.get(documentsPath).toAbsolutePath().normalize();
    }
}
