package eventlist.event;

import static eventlist.event.EventKey.ACQUIRE_HANDLE;
import static eventlist.event.EventKey.ACQUISITION_TYPE;
import static eventlist.event.EventKey.AMPLITUDE;
import static eventlist.event.EventKey.AMPLITUDES;
import static eventlist.event.EventKey.AMPLITUDE_PARAMETER;
import static eventlist.event.EventKey.BIT;
import static eventlist.event.EventKey.CHANGE;
import static eventlist.event.EventKey.COMPRESSED;
import static eventlist.event.EventKey.DEVICE_ID;
import static eventlist.event.EventKey.DURATION;
import static eventlist.event.EventKey.HANDLE;
import static eventlist.event.EventKey.INCREMENT_OSCILLATOR_PHASE;
import static eventlist.event.EventKey.ITERATION;
import static eventlist.event.EventKey.ITERATIONS;
import static eventlist.event.EventKey.LOCAL;
import static eventlist.event.EventKey.MARKERS;
import static eventlist.event.EventKey.NESTING_LEVEL;
import static eventlist.event.EventKey.NUM_REPEATS;
import static eventlist.event.EventKey.OSCILLATOR_FREQUENCIES;
import static eventlist.event.EventKey.OSCILLATOR_FREQUENCY;
import static eventlist.event.EventKey.OSCILLATOR_ID;
import static eventlist.event.EventKey.PARAMETER;
import static eventlist.event.EventKey.PARAMETRIZED_WITH;
import static eventlist.event.EventKey.PARAMETRIZED_WITH_PER_PULSE;
import static eventlist.event.EventKey.PHASE;
import static eventlist.event.EventKey.PHASES;
import static eventlist.event.EventKey.PLAY_PULSE_PARAMETERS;
import static eventlist.event.EventKey.PLAY_PULSE_PARAMETERS_PER_PULSE;
import static eventlist.event.EventKey.PLAY_WAVE_ID;
import static eventlist.event.EventKey.PLAY_WAVE_IDS;
import static eventlist.event.EventKey.PLAY_WAVE_TYPE;
import static eventlist.event.EventKey.PRNG_SAMPLE;
import static eventlist.event.EventKey.PULSE_PULSE_PARAMETERS;
import static eventlist.event.EventKey.PULSE_PULSE_PARAMETERS_PER_PULSE;
import static eventlist.event.EventKey.RANGE;
import static eventlist.event.EventKey.SAMPLE_NAME;
import static eventlist.event.EventKey.SECTION_NAME;
import static eventlist.event.EventKey.SEED;
import static eventlist.event.EventKey.SET_OSCILLATOR_PHASE;
import static eventlist.event.EventKey.SHADOW;
import static eventlist.event.EventKey.SIGNAL;
import static eventlist.event.EventKey.SIGNAL_ID;
import static eventlist.event.EventKey.STATE;
import static eventlist.event.EventKey.SUBSECTION_NAME;
import static eventlist.event.EventKey.TRIGGER_OUTPUT;
import static eventlist.event.EventKey.USER_REGISTER;
import static eventlist.event.EventKey.VALUE;

import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/** Closed set of event kinds, each with the optional payload fields it may carry. */
public enum EventType {
  SECTION_START(
      SECTION_NAME, TRIGGER_OUTPUT, NESTING_LEVEL, HANDLE, LOCAL, USER_REGISTER, PRNG_SAMPLE),
  SECTION_END(SECTION_NAME, TRIGGER_OUTPUT, NESTING_LEVEL),
  SUBSECTION_START(SECTION_NAME, SUBSECTION_NAME),
  SUBSECTION_END(SECTION_NAME, SUBSECTION_NAME),

  LOOP_START(SECTION_NAME, NESTING_LEVEL, ITERATIONS, COMPRESSED),
  LOOP_END(SECTION_NAME, NESTING_LEVEL),
  LOOP_STEP_START(SECTION_NAME, ITERATION, NUM_REPEATS, NESTING_LEVEL),
  LOOP_STEP_END(SECTION_NAME, ITERATION, NUM_REPEATS, NESTING_LEVEL),
  LOOP_ITERATION_END(SECTION_NAME, ITERATION, NUM_REPEATS, NESTING_LEVEL, COMPRESSED),
  PARAMETER_SET(SECTION_NAME, PARAMETER, ITERATION, VALUE),

  PLAY_START(Fields.PULSE_START),
  PLAY_END(Fields.PULSE_END),
  DELAY_START(Fields.PULSE_START, PLAY_WAVE_TYPE),
  DELAY_END(Fields.PULSE_END, PLAY_WAVE_TYPE),
  ACQUIRE_START(Fields.PULSE_START, Fields.ACQUIRE),
  ACQUIRE_END(Fields.PULSE_END, Fields.ACQUIRE),

  DIGITAL_SIGNAL_STATE_CHANGE(SECTION_NAME, SIGNAL, BIT, CHANGE),
  PRNG_SETUP(SECTION_NAME, RANGE, SEED),
  DROP_PRNG_SETUP(SECTION_NAME),
  DRAW_PRNG_SAMPLE(SECTION_NAME, SAMPLE_NAME, ITERATION, NUM_REPEATS, NESTING_LEVEL),
  DROP_PRNG_SAMPLE(SECTION_NAME, SAMPLE_NAME, ITERATION, NUM_REPEATS, NESTING_LEVEL),

  SET_OSCILLATOR_FREQUENCY_START(
      SECTION_NAME, PARAMETER, ITERATION, VALUE, DEVICE_ID, SIGNAL, OSCILLATOR_ID),
  SET_OSCILLATOR_FREQUENCY_END(),
  RESET_HW_OSCILLATOR_PHASE(SECTION_NAME, DURATION, DEVICE_ID),
  RESET_SW_OSCILLATOR_PHASE(SECTION_NAME),
  RESET_PRECOMPENSATION_FILTERS(SECTION_NAME, SIGNAL_ID);

  private final Set<EventKey<?>> allowedKeys;

  EventType(EventKey<?>... keys) {
    this(Set.of(), keys);
  }

  EventType(Set<EventKey<?>> group, EventKey<?>... keys) {
    this(group, Set.of(), keys);
  }

  EventType(Set<EventKey<?>> group, Set<EventKey<?>> extraGroup, EventKey<?>... keys) {
    this.allowedKeys =
        Stream.of(group.stream(), extraGroup.stream(), Stream.of(keys), Stream.of(STATE, SHADOW))
            .flatMap(s -> s)
            .collect(Collectors.toUnmodifiableSet());
  }

  /** Whether events of this type may carry {@code key}. */
  public boolean accepts(EventKey<?> key) {
    return allowedKeys.contains(key);
  }

  /** The event type closing a pair opened by this type, or {@code null} if this opens none. */
  public EventType closingType() {
    return switch (this) {
      case SECTION_START -> SECTION_END;
      case SUBSECTION_START -> SUBSECTION_END;
      case LOOP_START -> LOOP_END;
      case LOOP_STEP_START -> LOOP_STEP_END;
      case PLAY_START -> PLAY_END;
      case DELAY_START -> DELAY_END;
      case ACQUIRE_START -> ACQUIRE_END;
      case PRNG_SETUP -> DROP_PRNG_SETUP;
      case DRAW_PRNG_SAMPLE -> DROP_PRNG_SAMPLE;
      case SET_OSCILLATOR_FREQUENCY_START -> SET_OSCILLATOR_FREQUENCY_END;
      default -> null;
    };
  }

  public boolean opensPair() {
    return closingType() != null;
  }

  public boolean closesPair() {
    for (EventType type : values()) {
      if (type.closingType() == this) {
        return true;
      }
    }
    return false;
  }

  private static final class Fields {
    static final Set<EventKey<?>> PULSE_END =
        Set.of(SECTION_NAME, SIGNAL, PLAY_WAVE_ID, PARAMETRIZED_WITH);
    static final Set<EventKey<?>> PULSE_START =
        Set.of(
            SECTION_NAME,
            SIGNAL,
            PLAY_WAVE_ID,
            PARAMETRIZED_WITH,
            AMPLITUDE,
            PHASE,
            AMPLITUDE_PARAMETER,
            MARKERS,
            OSCILLATOR_FREQUENCY,
            PULSE_PULSE_PARAMETERS,
            PLAY_PULSE_PARAMETERS,
            INCREMENT_OSCILLATOR_PHASE,
            SET_OSCILLATOR_PHASE);
    static final Set<EventKey<?>> ACQUIRE =
        Set.of(
            ACQUISITION_TYPE,
            ACQUIRE_HANDLE,
            PLAY_WAVE_IDS,
            PARAMETRIZED_WITH_PER_PULSE,
            AMPLITUDES,
            PHASES,
            OSCILLATOR_FREQUENCIES,
            PULSE_PULSE_PARAMETERS_PER_PULSE,
            PLAY_PULSE_PARAMETERS_PER_PULSE);

    private Fields() {}
  }
}
