package eventlist.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/** A single pulse, delay or acquisition on one signal. */
public record PulseIr(
    String section,
    Long length,
    SectionPulse pulse,
    long offset,
    Double amplitude,
    Double phase,
    String amplitudeParameter,
    List<Marker> markers,
    Double oscillatorFrequency,
    Map<String, Object> pulsePulseParameters,
    Map<String, Object> playPulseParameters,
    Double incrementOscillatorPhase,
    Double setOscillatorPhase,
    boolean acquire)
    implements IrNode {

  public PulseIr {
    Objects.requireNonNull(section, "section");
    Objects.requireNonNull(pulse, "pulse");
    markers = markers == null ? List.of() : List.copyOf(markers);
    pulsePulseParameters = copyParameters(pulsePulseParameters);
    playPulseParameters = copyParameters(playPulseParameters);
  }

  public static Builder builder(String section, SectionPulse pulse) {
    return new Builder(section, pulse);
  }

  @Override
  public Set<String> signals() {
    return Set.of(pulse.signal());
  }

  @Override
  public List<IrChild> children() {
    return List.of();
  }

  @Override
  public <A, R> R accept(IrVisitor<A, R> visitor, A arg) {
    return visitor.visitPulse(this, arg);
  }

  private static Map<String, Object> copyParameters(Map<String, Object> parameters) {
    if (parameters == null || parameters.isEmpty()) {
      return Map.of();
    }
    return Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
  }

  public static final class Builder {
    private final String section;
    private final SectionPulse pulse;
    private Long length;
    private long offset;
    private Double amplitude;
    private Double phase;
    private String amplitudeParameter;
    private List<Marker> markers = List.of();
    private Double oscillatorFrequency;
    private Map<String, Object> pulsePulseParameters = Map.of();
    private Map<String, Object> playPulseParameters = Map.of();
    private Double incrementOscillatorPhase;
    private Double setOscillatorPhase;
    private boolean acquire;

    private Builder(String section, SectionPulse pulse) {
      this.section = section;
      this.pulse = pulse;
      this.acquire = pulse.acquireParams() != null;
    }

    public Builder length(Long length) {
      this.length = length;
      return this;
    }

    public Builder offset(long offset) {
      this.offset = offset;
      return this;
    }

    public Builder amplitude(Double amplitude) {
      this.amplitude = amplitude;
      return this;
    }

    public Builder phase(Double phase) {
      this.phase = phase;
      return this;
    }

    public Builder amplitudeParameter(String amplitudeParameter) {
      this.amplitudeParameter = amplitudeParameter;
      return this;
    }

    public Builder markers(List<Marker> markers) {
      this.markers = markers;
      return this;
    }

    public Builder oscillatorFrequency(Double oscillatorFrequency) {
      this.oscillatorFrequency = oscillatorFrequency;
      return this;
    }

    public Builder pulsePulseParameters(Map<String, Object> pulsePulseParameters) {
      this.pulsePulseParameters = pulsePulseParameters;
      return this;
    }

    public Builder playPulseParameters(Map<String, Object> playPulseParameters) {
      this.playPulseParameters = playPulseParameters;
      return this;
    }

    public Builder incrementOscillatorPhase(Double incrementOscillatorPhase) {
      this.incrementOscillatorPhase = incrementOscillatorPhase;
      return this;
    }

    public Builder setOscillatorPhase(Double setOscillatorPhase) {
      this.setOscillatorPhase = setOscillatorPhase;
      return this;
    }

    public Builder acquire(boolean acquire) {
      this.acquire = acquire;
      return this;
    }

    public PulseIr build() {
      return new PulseIr(
          section,
          length,
          pulse,
          offset,
          amplitude,
          phase,
          amplitudeParameter,
          markers,
          oscillatorFrequency,
          pulsePulseParameters,
          playPulseParameters,
          incrementOscillatorPhase,
          setOscillatorPhase,
          acquire);
    }
  }
}
