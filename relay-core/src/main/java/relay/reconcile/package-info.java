/**
 * Catch-up path: watermark-driven, window-bounded backfill of events missed while the
 * real-time stream was down.
 *
 * @see relay.reconcile.CatchUpReconciler
 */
package relay.reconcile;
