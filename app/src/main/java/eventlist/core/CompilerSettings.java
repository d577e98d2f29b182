package eventlist.core;

import java.util.Map;

/**
 * Compiler configuration seen by event-list generation.
 *
 * <p>Generation itself only reads the two pipeline defaults; everything in {@code extra} is passed
 * through untouched for later stages.
 *
 * @param maxEventsToPublish event budget used when the caller does not pass one
 * @param expandLoopsForSchedule whether compressed loops are expanded into shadow iterations
 * @param extra additional settings owned by other compiler stages
 */
public record CompilerSettings(
    int maxEventsToPublish, boolean expandLoopsForSchedule, Map<String, String> extra) {

  public static final int DEFAULT_MAX_EVENTS_TO_PUBLISH = 1000;

  public CompilerSettings {
    extra = extra == null ? Map.of() : Map.copyOf(extra);
  }

  public static CompilerSettings defaults() {
    return new CompilerSettings(DEFAULT_MAX_EVENTS_TO_PUBLISH, true, Map.of());
  }

  public static CompilerSettings normalize(CompilerSettings settings) {
    if (settings == null) {
      return defaults();
    }
    int maxEvents =
        settings.maxEventsToPublish() > 0
            ? settings.maxEventsToPublish()
            : DEFAULT_MAX_EVENTS_TO_PUBLISH;
    return new CompilerSettings(maxEvents, settings.expandLoopsForSchedule(), settings.extra());
  }

  public CompilerSettings withMaxEventsToPublish(int maxEventsToPublish) {
    return new CompilerSettings(maxEventsToPublish, expandLoopsForSchedule, extra);
  }

  public CompilerSettings withExpandLoopsForSchedule(boolean expandLoopsForSchedule) {
    return new CompilerSettings(maxEventsToPublish, expandLoopsForSchedule, extra);
  }
}
