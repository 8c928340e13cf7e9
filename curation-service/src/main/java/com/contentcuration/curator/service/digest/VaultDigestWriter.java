package com.contentcuration.curator.service.digest;

import com.contentcuration.curator.config.CuratorProperties;
import com.contentcuration.curator.exception.CuratorException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Set;

/**
 * Writes digests into the vault's reading-list folder.
 *
 * <p>The file is {@code <prefix> yyyy-MM-dd.md}; when taken, {@code (1)}, {@code (2)} and so on
 * are appended to the stem until a free name is found. Existing files are never overwritten.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class VaultDigestWriter implements DigestWriter {

    private static final String EXTENSION = ".md";
    private static final Set<PosixFilePermission> RW_R_R = PosixFilePermissions.fromString("rw-r--r--");

    private final CuratorProperties properties;

    @Override
    public Path write(String content, LocalDate date) {
        Path dir = properties.getVault().readingListPath();
        String stem = properties.getDigest().getFilePrefix() + " " + date.format(DateTimeFormatter.ISO_LOCAL_DATE);
        try {
            Files.createDirectories(dir);
            Path target = dir.resolve(stem + EXTENSION);
            int counter = 1;
            while (true) {
                try {
                    Files.writeString(target, content, StandardCharsets.UTF_8,
                            StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
                    break;
                } catch (FileAlreadyExistsException e) {
                    target = dir.resolve(stem + " (" + counter++ + ")" + EXTENSION);
                }
            }
            restrictPermissions(target);
            log.info("Digest written to {}", target);
            return target;
        } catch (IOException e) {
            throw new CuratorException("VAULT_WRITE_FAILED", "Cannot write digest into " + dir + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void discard(Path artifact) {
        try {
            if (Files.deleteIfExists(artifact)) {
                log.info("Discarded unpublished digest {}", artifact);
            }
        } catch (IOException e) {
            log.error("Could not remove unpublished digest {}: {}", artifact, e.getMessage());
        }
    }

    private void restrictPermissions(Path file) throws IOException {
        if (file.getFileSystem().supportedFileAttributeViews().contains("posix")) {
            Files.setPosixFilePermissions(file, RW_R_R);
        }
    }
}
