package eventlist.util;

/** Time-base constants and grid rounding. */
public final class TimeGrid {
  /** Duration of one tinysample in seconds. */
  public static final double TINYSAMPLE = 1 / 3_600_000e6;

  private TimeGrid() {}

  /** Smallest multiple of {@code grid} that is {@code >= value}. */
  public static long ceilToGrid(long value, long grid) {
    if (grid <= 0) {
      throw new IllegalArgumentException("grid must be positive: " + grid);
    }
    return Math.floorDiv(value + grid - 1, grid) * grid;
  }

  /** Converts seconds to the nearest whole number of tinysamples. */
  public static long toTinysamples(double seconds) {
    return (long) Math.rint(seconds / TINYSAMPLE);
  }

  /**
   * Sums port delays (seconds) in device samples and rounds the total up to the device's sample
   * granularity. The half-sample bias before truncation keeps the true edge inside the result.
   */
  public static long totalRoundedDelaySamples(
      double samplingRate, int granularitySamples, double... portDelays) {
    if (granularitySamples <= 0) {
      throw new IllegalArgumentException(
          "granularity must be positive: " + granularitySamples);
    }
    long delay = 0;
    for (double portDelay : portDelays) {
      delay += (long) Math.rint(portDelay * samplingRate);
    }
    return ((long) Math.ceil((double) delay / granularitySamples + 0.5) - 1) * granularitySamples;
  }
}
