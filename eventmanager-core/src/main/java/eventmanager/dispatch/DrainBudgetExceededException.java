package eventmanager.dispatch;

/**
 * Thrown when a single {@link EventDispatcher#processEvents()} call has dispatched the
 * configured maximum number of events while more are still pending.
 *
 * <p>Usually means handlers keep re-enqueueing events. The undrained events remain queued.
 */
public class DrainBudgetExceededException extends RuntimeException {

  private final int budget;
  private final int remaining;

  public DrainBudgetExceededException(int budget, int remaining) {
    super("Drain budget of " + budget + " events exceeded; " + remaining + " events still pending");
    this.budget = budget;
    this.remaining = remaining;
  }

  public int budget() {
    return budget;
  }

  public int remaining() {
    return remaining;
  }
}
