package com.contentcuration.curator.service.digest;

import java.nio.file.Path;
import java.time.LocalDate;

/**
 * Stores a rendered digest and can take it back if publication fails.
 */
public interface DigestWriter {

    Path write(String content, LocalDate date);

    void discard(Path artifact);
}
