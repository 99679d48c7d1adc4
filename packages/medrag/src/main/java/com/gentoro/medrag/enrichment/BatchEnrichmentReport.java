package com.gentoro.medrag.enrichment;

/** Totals for {@link EnrichmentEngine#enrichAll(String, int)}. */
public record BatchEnrichmentReport(
    int processed, int enriched, int noOp, int failedNodes, int linked, int skipped, int failed) {

  static BatchEnrichmentReport empty() {
    return new BatchEnrichmentReport(0, 0, 0, 0, 0, 0, 0);
  }

  BatchEnrichmentReport plus(EnrichmentReport r) {
    boolean wasNoOp = r.isNoOp();
    return new BatchEnrichmentReport(
        processed + 1,
        enriched + (!wasNoOp && r.linked() > 0 ? 1 : 0),
        noOp + (wasNoOp ? 1 : 0),
        failedNodes,
        linked + r.linked(),
        skipped + r.skipped(),
        failed + r.failed());
  }

  BatchEnrichmentReport plusFailedNode() {
    return new BatchEnrichmentReport(
        processed + 1, enriched, noOp, failedNodes + 1, linked, skipped, failed);
  }
}
