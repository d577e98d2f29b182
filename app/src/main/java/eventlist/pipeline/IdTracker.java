package eventlist.pipeline;

/**
 * Strictly increasing id source for one generation call. Pass the same instance through the whole
 * traversal; never share one between concurrent calls.
 */
public final class IdTracker {
  private int next;

  public IdTracker() {
    this(0);
  }

  public IdTracker(int first) {
    if (first < 0) {
      throw new IllegalArgumentException("first id must be non-negative: " + first);
    }
    this.next = first;
  }

  public int next() {
    if (next == Integer.MAX_VALUE) {
      throw new IllegalStateException("Event id space exhausted");
    }
    return next++;
  }

  /** The id the next call to {@link #next()} returns. */
  public int peek() {
    return next;
  }
}
