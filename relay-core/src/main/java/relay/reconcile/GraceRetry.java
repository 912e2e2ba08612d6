package relay.reconcile;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One-shot allowance for a single extra delivery attempt.
 *
 * <p>The allowance is shared by every source: the first failed catch-up chunk anywhere
 * consumes it, and later failures are not retried. It covers a sink that is still starting
 * when the relay runs its first catch-up.
 */
public final class GraceRetry {
  private static final GraceRetry PROCESS_WIDE = new GraceRetry();

  private final AtomicBoolean used = new AtomicBoolean();

  /** The allowance shared by all reconcilers in this JVM. */
  public static GraceRetry processWide() {
    return PROCESS_WIDE;
  }

  /**
   * Consumes the allowance.
   *
   * @return {@code true} exactly once
   */
  public boolean tryConsume() {
    return used.compareAndSet(false, true);
  }

  public boolean isUsed() {
    return used.get();
  }
}
