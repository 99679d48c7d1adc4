package com.gentoro.medrag.ingest;

import java.util.List;

/** Totals of one corpus import. {@code failedPaperIds} keeps corpus order. */
public record ImportReport(int total, int imported, int failed, List<String> failedPaperIds) {
  public ImportReport {
    failedPaperIds = failedPaperIds == null ? List.of() : List.copyOf(failedPaperIds);
  }
}
