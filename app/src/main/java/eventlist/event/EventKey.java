package eventlist.event;

import eventlist.core.model.Marker;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Typed name of an optional event payload field.
 *
 * <p>Keys compare by identity. Several keys may share a wire name when the same field carries a
 * scalar for single pulses and a per-member list for acquire groups; an event holds at most one
 * key per wire name.
 */
public final class EventKey<T> {
  public static final EventKey<String> SECTION_NAME = of("section_name", String.class);
  public static final EventKey<String> SUBSECTION_NAME = of("subsection_name", String.class);
  public static final EventKey<String> SIGNAL = of("signal", String.class);
  public static final EventKey<String> SIGNAL_ID = of("signal_id", String.class);

  public static final EventKey<String> PLAY_WAVE_ID = of("play_wave_id", String.class);
  public static final EventKey<PlayWaveType> PLAY_WAVE_TYPE =
      of("play_wave_type", PlayWaveType.class);
  public static final EventKey<List<String>> PARAMETRIZED_WITH = list("parametrized_with");
  public static final EventKey<Double> AMPLITUDE = of("amplitude", Double.class);
  public static final EventKey<Double> PHASE = of("phase", Double.class);
  public static final EventKey<String> AMPLITUDE_PARAMETER =
      of("amplitude_parameter", String.class);
  public static final EventKey<List<Marker>> MARKERS = list("markers");
  public static final EventKey<Double> OSCILLATOR_FREQUENCY =
      of("oscillator_frequency", Double.class);
  public static final EventKey<Map<String, Object>> PULSE_PULSE_PARAMETERS =
      map("pulse_pulse_parameters");
  public static final EventKey<Map<String, Object>> PLAY_PULSE_PARAMETERS =
      map("play_pulse_parameters");
  public static final EventKey<Double> INCREMENT_OSCILLATOR_PHASE =
      of("increment_oscillator_phase", Double.class);
  public static final EventKey<Double> SET_OSCILLATOR_PHASE =
      of("set_oscillator_phase", Double.class);
  public static final EventKey<List<String>> ACQUISITION_TYPE = list("acquisition_type");
  public static final EventKey<String> ACQUIRE_HANDLE = of("acquire_handle", String.class);

  // acquire groups: one entry per member pulse
  public static final EventKey<List<String>> PLAY_WAVE_IDS = list("play_wave_id");
  public static final EventKey<List<List<String>>> PARAMETRIZED_WITH_PER_PULSE =
      list("parametrized_with");
  public static final EventKey<List<Double>> AMPLITUDES = list("amplitude");
  public static final EventKey<List<Double>> PHASES = list("phase");
  public static final EventKey<List<Double>> OSCILLATOR_FREQUENCIES =
      list("oscillator_frequency");
  public static final EventKey<List<Map<String, Object>>> PULSE_PULSE_PARAMETERS_PER_PULSE =
      list("pulse_pulse_parameters");
  public static final EventKey<List<Map<String, Object>>> PLAY_PULSE_PARAMETERS_PER_PULSE =
      list("play_pulse_parameters");

  public static final EventKey<List<TriggerSignal>> TRIGGER_OUTPUT = list("trigger_output");
  public static final EventKey<Integer> BIT = of("bit", Integer.class);
  public static final EventKey<DigitalChange> CHANGE = of("change", DigitalChange.class);

  public static final EventKey<Integer> RANGE = of("range", Integer.class);
  public static final EventKey<Integer> SEED = of("seed", Integer.class);
  public static final EventKey<String> SAMPLE_NAME = of("sample_name", String.class);

  public static final EventKey<Integer> ITERATIONS = of("iterations", Integer.class);
  public static final EventKey<Boolean> COMPRESSED = of("compressed", Boolean.class);
  public static final EventKey<Integer> ITERATION = of("iteration", Integer.class);
  public static final EventKey<Integer> NUM_REPEATS = of("num_repeats", Integer.class);
  public static final EventKey<Integer> NESTING_LEVEL = of("nesting_level", Integer.class);
  public static final EventKey<ParameterRef> PARAMETER = of("parameter", ParameterRef.class);
  public static final EventKey<Double> VALUE = of("value", Double.class);

  public static final EventKey<String> DEVICE_ID = of("device_id", String.class);
  public static final EventKey<String> OSCILLATOR_ID = of("oscillator_id", String.class);
  public static final EventKey<Double> DURATION = of("duration", Double.class);

  public static final EventKey<String> HANDLE = of("handle", String.class);
  public static final EventKey<Boolean> LOCAL = of("local", Boolean.class);
  public static final EventKey<Integer> USER_REGISTER = of("user_register", Integer.class);
  public static final EventKey<String> PRNG_SAMPLE = of("prng_sample", String.class);

  public static final EventKey<Long> STATE = of("state", Long.class);
  public static final EventKey<Boolean> SHADOW = of("shadow", Boolean.class);

  private final String wireName;
  private final Class<?> valueType;

  private EventKey(String wireName, Class<?> valueType) {
    this.wireName = Objects.requireNonNull(wireName, "wireName");
    this.valueType = Objects.requireNonNull(valueType, "valueType");
  }

  private static <T> EventKey<T> of(String wireName, Class<T> valueType) {
    return new EventKey<>(wireName, valueType);
  }

  private static <T extends List<?>> EventKey<T> list(String wireName) {
    return new EventKey<>(wireName, List.class);
  }

  private static <T extends Map<?, ?>> EventKey<T> map(String wireName) {
    return new EventKey<>(wireName, Map.class);
  }

  /** Field name in the serialized event. */
  public String wireName() {
    return wireName;
  }

  @SuppressWarnings("unchecked")
  T cast(Object value) {
    if (!valueType.isInstance(value)) {
      throw new IllegalArgumentException(
          "Value for '" + wireName + "' must be a " + valueType.getSimpleName() + ": " + value);
    }
    return (T) value;
  }

  @Override
  public String toString() {
    return wireName;
  }
}
