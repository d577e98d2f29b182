package eventlist.core.model;

import java.util.List;
import java.util.Objects;

/** A parameter swept by a loop, with one value per iteration. */
public record SweepParameter(String uid, List<Double> values) {

  public SweepParameter {
    Objects.requireNonNull(uid, "uid");
    values = List.copyOf(values);
  }

  public double valueAt(int iteration) {
    if (iteration < 0 || iteration >= values.size()) {
      throw new IllegalStateException(
          "Sweep parameter '" + uid + "' has no value for iteration " + iteration);
    }
    return values.get(iteration);
  }
}
