package eventlist.pipeline;

import com.google.common.base.Stopwatch;
import eventlist.core.CompilerSettings;
import eventlist.core.model.IrNode;
import eventlist.event.Event;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Top-level entry point of event-list generation. Every call gets a fresh id tracker, so
 * independent programs can be generated concurrently on separate threads.
 */
public final class EventListPipeline {
  private static final Logger LOG = LoggerFactory.getLogger(EventListPipeline.class);

  private final CompilerSettings settings;

  public EventListPipeline(CompilerSettings settings) {
    this.settings = CompilerSettings.normalize(settings);
  }

  public CompilerSettings settings() {
    return settings;
  }

  /** Generates from time 0 with the configured budget and loop expansion. */
  public EventListResult generate(IrNode root) {
    return generate(root, 0, settings.maxEventsToPublish(), settings.expandLoopsForSchedule());
  }

  public EventListResult generate(IrNode root, long start, int maxEvents, boolean expandLoops) {
    Objects.requireNonNull(root, "root");
    LOG.info(
        "Generating event list (budget: {} events, loop expansion: {})...", maxEvents, expandLoops);
    Stopwatch stopwatch = Stopwatch.createStarted();

    EventListGenerator generator = new EventListGenerator(new IdTracker(), expandLoops, settings);
    List<Event> events = generator.generate(root, start, maxEvents);

    long elapsed = stopwatch.elapsed(TimeUnit.MILLISECONDS);
    LOG.info("Event list complete. Emitted {} event(s) in {} ms.", events.size(), elapsed);
    if (generator.truncated()) {
      LOG.warn("Event budget of {} exhausted; event list was truncated.", maxEvents);
    }
    return new EventListResult(events, elapsed);
  }
}
