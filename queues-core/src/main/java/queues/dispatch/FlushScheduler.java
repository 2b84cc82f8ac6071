package queues.dispatch;

import queues.QueueConsumer;
import queues.spi.FlushTimers;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Decides when a queue's pending messages become a dispatchable batch.
 *
 * <p>At most one timer is outstanding per queue. A full batch is flushed on the
 * next tick; a partial batch waits for the consumer's batch timeout. Ingress only
 * ever arms or tightens the timer, it never dispatches.
 *
 * <pre>
 *   IDLE --append--&gt; DELAYED (pending &lt; maxBatchSize)
 *   IDLE --append--&gt; IMMEDIATE (pending &gt;= maxBatchSize)
 *   DELAYED --append, batch full--&gt; IMMEDIATE (delayed timer cancelled)
 *   DELAYED | IMMEDIATE --timer fires--&gt; IDLE, then flush
 * </pre>
 *
 * <p>Not thread-safe: every method must be called while holding the owning
 * queue's lock. The fire callback receives the {@link PendingFlush} it was armed
 * with and must {@linkplain #claim claim} it under that lock before flushing, so a
 * timer that was superseded or cancelled while firing does nothing.
 */
public final class FlushScheduler {

  /** Scheduling state of one queue. */
  public enum State {
    IDLE,
    DELAYED,
    IMMEDIATE
  }

  private final FlushTimers timers;
  private final Consumer<PendingFlush> onFire;
  private PendingFlush pendingFlush;

  /**
   * @param timers timer source
   * @param onFire invoked on a timer thread when an armed flush fires
   */
  public FlushScheduler(FlushTimers timers, Consumer<PendingFlush> onFire) {
    this.timers = Objects.requireNonNull(timers, "timers");
    this.onFire = Objects.requireNonNull(onFire, "onFire");
  }

  public State state() {
    if (pendingFlush == null) {
      return State.IDLE;
    }
    return pendingFlush.immediate ? State.IMMEDIATE : State.DELAYED;
  }

  /**
   * Arms or tightens the flush timer after messages were appended.
   *
   * @param pendingCount number of messages now pending
   * @param consumer the queue's consumer
   */
  public void ensurePendingFlush(int pendingCount, QueueConsumer consumer) {
    boolean batchHasSpace = pendingCount < consumer.effectiveBatchSize();

    if (pendingFlush != null) {
      // An immediate flush is about to run; a delayed one still has room
      if (pendingFlush.immediate || batchHasSpace) {
        return;
      }
      cancel();
    }

    long delayMs = batchHasSpace ? consumer.maxBatchTimeoutMs() : 0L;
    PendingFlush flush = new PendingFlush(delayMs == 0L);
    pendingFlush = flush;
    flush.handle = timers.schedule(() -> onFire.accept(flush), delayMs);
  }

  /**
   * Marks {@code flush} as fired and returns the scheduler to {@link State#IDLE}.
   *
   * @return {@code false} if {@code flush} is no longer the armed timer
   */
  public boolean claim(PendingFlush flush) {
    if (pendingFlush != flush) {
      return false;
    }
    pendingFlush = null;
    return true;
  }

  /** Cancels the outstanding timer, if any, without flushing. */
  public void cancel() {
    PendingFlush flush = pendingFlush;
    pendingFlush = null;
    if (flush != null && flush.handle != null) {
      flush.handle.cancel();
    }
  }

  /** One armed timer. */
  public static final class PendingFlush {
    private final boolean immediate;
    private FlushTimers.TimerHandle handle;

    private PendingFlush(boolean immediate) {
      this.immediate = immediate;
    }

    public boolean immediate() {
      return immediate;
    }
  }
}
