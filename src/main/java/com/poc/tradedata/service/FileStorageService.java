package com.poc.tradedata.service;

import java.io.IOException;
import java.nio.file.Path;

public interface FileStorageService {
    /**
     * Saves byte content to the storage system.
     * @param content The file data.
     * @param fileName The desired filename, relative to the storage root (may include a folder).
     * @return The absolute path where the file is stored.
     */
    String saveFile(byte[] content, String fileName) throws IOException;

    /**
     * Loads a file from storage.
     * @param fileName The name of the file to load, relative to the storage root.
     * @return The file data as a byte array.
     */
    byte[] loadFile(String fileName) throws IOException;

    /**
     * Resolves a stored file name to its location on disk.
     */
    Path resolve(String fileName);
}
