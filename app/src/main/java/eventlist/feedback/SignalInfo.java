package eventlist.feedback;

import java.util.Objects;

/**
 * Hardware metadata of one logical signal. Delays are in seconds, the sampling rate in Hz.
 *
 * @param combinedDevice whether the signal lives on a combined generator/analyzer instrument
 */
public record SignalInfo(
    String signalId,
    String deviceId,
    DeviceType deviceType,
    double samplingRate,
    double startDelay,
    double delaySignal,
    double portDelay,
    double baseDelaySignal,
    double basePortDelay,
    boolean combinedDevice) {

  public SignalInfo {
    Objects.requireNonNull(signalId, "signalId");
    Objects.requireNonNull(deviceId, "deviceId");
    Objects.requireNonNull(deviceType, "deviceType");
    if (samplingRate <= 0) {
      throw new IllegalArgumentException("samplingRate must be positive: " + samplingRate);
    }
  }

  public static Builder builder(String signalId, String deviceId, DeviceType deviceType) {
    return new Builder(signalId, deviceId, deviceType);
  }

  public static final class Builder {
    private final String signalId;
    private final String deviceId;
    private final DeviceType deviceType;
    private double samplingRate = 2.0e9;
    private double startDelay;
    private double delaySignal;
    private double portDelay;
    private double baseDelaySignal;
    private double basePortDelay;
    private boolean combinedDevice;

    private Builder(String signalId, String deviceId, DeviceType deviceType) {
      this.signalId = signalId;
      this.deviceId = deviceId;
      this.deviceType = deviceType;
    }

    public Builder samplingRate(double samplingRate) {
      this.samplingRate = samplingRate;
      return this;
    }

    public Builder startDelay(double startDelay) {
      this.startDelay = startDelay;
      return this;
    }

    public Builder delaySignal(double delaySignal) {
      this.delaySignal = delaySignal;
      return this;
    }

    public Builder portDelay(double portDelay) {
      this.portDelay = portDelay;
      return this;
    }

    public Builder baseDelaySignal(double baseDelaySignal) {
      this.baseDelaySignal = baseDelaySignal;
      return this;
    }

    public Builder basePortDelay(double basePortDelay) {
      this.basePortDelay = basePortDelay;
      return this;
    }

    public Builder combinedDevice(boolean combinedDevice) {
      this.combinedDevice = combinedDevice;
      return this;
    }

    public SignalInfo build() {
      return new SignalInfo(
          signalId,
          deviceId,
          deviceType,
          samplingRate,
          startDelay,
          delaySignal,
          portDelay,
          baseDelaySignal,
          basePortDelay,
          combinedDevice);
    }
  }
}
