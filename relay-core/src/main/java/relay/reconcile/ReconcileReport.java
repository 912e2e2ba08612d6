package relay.reconcile;

/**
 * Outcome of one catch-up run for one source.
 *
 * @param sourceId        internal source id
 * @param fetched         events fetched inside the window and above the watermark
 * @param deliveredChunks chunks accepted by the sink
 * @param failedChunks    chunks rejected after any retry
 * @param watermark       cursor after the run, or the cursor read before it when nothing
 *                        was fetched
 * @param skippedReason   why the source was skipped, {@code null} if it was processed
 */
public record ReconcileReport(long sourceId, int fetched, int deliveredChunks, int failedChunks,
    long watermark, String skippedReason) {

  static ReconcileReport skipped(long sourceId, String reason) {
    return new ReconcileReport(sourceId, 0, 0, 0, 0L, reason);
  }

  public boolean isSkipped() {
    return skippedReason != null;
  }
}
