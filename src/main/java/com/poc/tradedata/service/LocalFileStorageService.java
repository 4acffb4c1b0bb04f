package com.poc.tradedata.service;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

@Service
public class LocalFileStorageService implements FileStorageService {

    private final String storagePath;

    public LocalFileStorageService(@Value("${ingest.storage.path:./storage/}") String storagePath) {
        this.storagePath = storagePath.endsWith("/") ? storagePath : storagePath + "/";
    }

    @Override
    public String saveFile(byte[] content, String fileName) throws IOException {
        Path path = resolve(fileName);
        if (!Files.exists(path.getParent())) {
            Files.createDirectories(path.getParent());
        }
        Files.write(path, content);
        return path.toAbsolutePath().toString();
    }

    @Override
    public byte[] loadFile(String fileName) throws IOException {
        return Files.readAllBytes(resolve(fileName));
    }

    @Override
    public Path resolve(String fileName) {
        Path root = Paths.get(storagePath).toAbsolutePath().normalize();
        Path path = root.resolve(fileName).normalize();
        if (!path.startsWith(root)) {
            throw new IllegalArgumentException("File name escapes the storage root: " + fileName);
        }
        return path;
    }
}
