package eventlist.feedback;

import java.util.Objects;

/**
 * A scheduled acquisition registered under a handle.
 *
 * @param signalId signal the acquisition runs on
 * @param absoluteStart start in tinysamples, {@code null} while it may still move
 * @param length integration length in tinysamples
 */
public record AcquirePulse(String signalId, Long absoluteStart, long length) {

  public AcquirePulse {
    Objects.requireNonNull(signalId, "signalId");
    if (length < 0) {
      throw new IllegalArgumentException("length must be non-negative: " + length);
    }
  }
}
