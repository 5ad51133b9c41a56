package com.procureagent.history.dto;

import java.util.List;

/** Ids assigned to the records of one archive call. */
public record ArchiveReceipt(String runId, List<Long> ids) {}
