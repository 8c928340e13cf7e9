package com.contentcuration.curator.dto;

import java.nio.file.Path;

public record DigestReport(Long digestId, Path path, int itemCount, int sTierCount, int aTierCount) {}
