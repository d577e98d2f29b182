package eventlist.feedback;

import eventlist.util.TimeGrid;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * What the branch timing resolver needs to know about the rest of the program: the acquisitions
 * registered per handle, the signal table and the sequencer rate of each device.
 */
public final class ScheduleData {
  private final Map<String, List<AcquirePulse>> acquisitions;
  private final Map<String, SignalInfo> signals;
  private final Map<String, Double> sequencerRates;
  private final FeedbackLatencyModel latencyModel;

  private ScheduleData(Builder builder) {
    this.acquisitions = new HashMap<>();
    builder.acquisitions.forEach((handle, pulses) -> acquisitions.put(handle, List.copyOf(pulses)));
    this.signals = Map.copyOf(builder.signals);
    this.sequencerRates = Map.copyOf(builder.sequencerRates);
    this.latencyModel = Objects.requireNonNull(builder.latencyModel, "latencyModel");
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Acquisitions registered under {@code handle} in program order, most recent last. */
  public List<AcquirePulse> acquisitions(String handle) {
    return acquisitions.getOrDefault(handle, List.of());
  }

  public SignalInfo signal(String signalId) {
    SignalInfo info = signals.get(signalId);
    if (info == null) {
      throw new IllegalStateException("Unknown signal '" + signalId + "'");
    }
    return info;
  }

  /** Sequencer clock rate of {@code deviceId} in Hz. */
  public double sequencerRate(String deviceId) {
    Double rate = sequencerRates.get(deviceId);
    if (rate == null) {
      throw new IllegalStateException("No sequencer rate known for device '" + deviceId + "'");
    }
    return rate;
  }

  public FeedbackLatencyModel latencyModel() {
    return latencyModel;
  }

  /** Length of one latency unit of the given device, in tinysamples. */
  long latencyUnitTinysamples(String deviceId) {
    return (long) Math.rint(1 / (2 * sequencerRate(deviceId) * TimeGrid.TINYSAMPLE));
  }

  public static final class Builder {
    private final Map<String, List<AcquirePulse>> acquisitions = new LinkedHashMap<>();
    private final Map<String, SignalInfo> signals = new LinkedHashMap<>();
    private final Map<String, Double> sequencerRates = new LinkedHashMap<>();
    private FeedbackLatencyModel latencyModel = LinearFeedbackLatencyModel.qccsDefaults();

    private Builder() {}

    public Builder acquisition(String handle, AcquirePulse pulse) {
      Objects.requireNonNull(handle, "handle");
      Objects.requireNonNull(pulse, "pulse");
      acquisitions.computeIfAbsent(handle, h -> new ArrayList<>()).add(pulse);
      return this;
    }

    public Builder signal(SignalInfo signal) {
      signals.put(signal.signalId(), signal);
      return this;
    }

    public Builder sequencerRate(String deviceId, double rate) {
      if (rate <= 0) {
        throw new IllegalArgumentException("sequencer rate must be positive: " + rate);
      }
      sequencerRates.put(deviceId, rate);
      return this;
    }

    public Builder latencyModel(FeedbackLatencyModel latencyModel) {
      this.latencyModel = latencyModel;
      return this;
    }

    public ScheduleData build() {
      return new ScheduleData(this);
    }
  }
}
