package eventlist.core.model;

import java.util.Objects;

/** A digital trigger line raised for the duration of a section. */
public record TriggerOutput(String signal, int bit) {

  public TriggerOutput {
    Objects.requireNonNull(signal, "signal");
    if (bit < 0) {
      throw new IllegalArgumentException("trigger bit must be non-negative: " + bit);
    }
  }
}
