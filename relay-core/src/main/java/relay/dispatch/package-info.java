/**
 * Real-time path: per-source debounce batching and ordered delivery.
 *
 * <p>{@link relay.dispatch.BatchDispatcher} coalesces events within a quiet period, caps
 * batch age at a max-wait bound and delivers popped batches off the caller's thread.
 *
 * @see relay.dispatch.BatchDispatcher
 * @see relay.dispatch.PendingBatch
 */
package relay.dispatch;
