package com.gentoro.medrag.enrichment;

/**
 * Outcome of enriching one node.
 *
 * @param mentions distinct concepts extracted from the text
 * @param linked concepts upserted and linked to the node
 * @param skipped concepts without details from the terminology service
 * @param failed concepts whose upsert or link raised an error
 */
public record EnrichmentReport(
    String nodeId, Status status, int mentions, int linked, int skipped, int failed) {

  public enum Status {
    /** No mentions were found; nothing was written. */
    NO_OP,
    COMPLETED
  }

  public static EnrichmentReport noOp(String nodeId) {
    return new EnrichmentReport(nodeId, Status.NO_OP, 0, 0, 0, 0);
  }

  public boolean isNoOp() {
    return status == Status.NO_OP;
  }
}
