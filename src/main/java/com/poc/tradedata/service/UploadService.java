package com.poc.tradedata.service;

import com.poc.tradedata.entity.JobType;
import com.poc.tradedata.entity.ProcessingRun;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Slf4j
@Service
@RequiredArgsConstructor
public class UploadService {

    static final String ORIGINAL_FOLDER = "Original/";

    private final FileStorageService fileStorageService;
    private final RunLedgerService runLedgerService;

    private static final Pattern TIMESTAMP_PATTERN = Pattern.compile("(_\\d{14})$");

    /**
     * Stores the raw upload under a timestamped name and registers a PENDING run for it.
     */
    public ProcessingRun processUpload(InputStream fileStream, String originalFilename, JobType jobType) throws IOException {

        // 1. Read and fingerprint the payload
        byte[] content = fileStream.readAllBytes();
        String contentHash = DigestUtils.sha256Hex(content);

        runLedgerService.findLatestByHash(contentHash, jobType).ifPresent(previous ->
                log.warn("Same {} content was already uploaded as run {} ({})",
                        jobType, previous.getId(), previous.getStatus()));

        // 2. Save under a fresh timestamp
        String newTimestamp = LocalDateTime.now().format(DateTimeFormatter.ofPattern("yyyyMMddHHmmss"));
        String storedName = generateCleanFileName(originalFilename, "", newTimestamp);
        String storedPath = fileStorageService.saveFile(content, ORIGINAL_FOLDER + storedName);
        Path path = Paths.get(storedPath);

        // 3. Register the run
        ProcessingRun run = new ProcessingRun();
        run.setJobType(jobType);
        run.setFileName(storedName);
        run.setFilePath(String.valueOf(path.getParent()));
        run.setFileExtension(extensionOf(storedName));
        run.setFileSize((long) content.length);
        run.setContentHash(contentHash);

        log.info("Upload stored: {} ({} bytes, sha256 {})", storedPath, content.length, contentHash);
        return runLedgerService.register(run);
    }

    String generateCleanFileName(String originalFilename, String prefix, String newTimestamp) {
        if (originalFilename == null || originalFilename.isBlank()) originalFilename = "Unknown_File.xlsx";
        originalFilename = Paths.get(originalFilename).getFileName().toString();

        int dotIndex = originalFilename.lastIndexOf('.');
        String baseName = (dotIndex == -1) ? originalFilename : originalFilename.substring(0, dotIndex);
        String extension = (dotIndex == -1) ? ".xlsx" : originalFilename.substring(dotIndex);

        Matcher matcher = TIMESTAMP_PATTERN.matcher(baseName);
        if (matcher.find()) {
            baseName = baseName.substring(0, matcher.start());
        }

        return prefix + baseName + "_" + newTimestamp + extension;
    }

    static String extensionOf(String fileName) {
        int dotIndex = fileName.lastIndexOf('.');
        return dotIndex == -1 ? "" : fileName.substring(dotIndex + 1).toUpperCase(Locale.ROOT);
    }
}
