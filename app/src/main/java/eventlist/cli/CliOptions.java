package eventlist.cli;

import eventlist.core.CompilerSettings;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Parsed command line of the {@code generate} command.
 *
 * @param output file to write the JSON event list to, {@code null} for standard output
 * @param extra settings handed through to later compiler stages
 */
record CliOptions(
    String exampleName,
    int maxEvents,
    boolean expandLoops,
    Path output,
    boolean validate,
    Map<String, String> extra) {

  CliOptions {
    Objects.requireNonNull(exampleName, "exampleName");
    if (maxEvents <= 0) {
      throw new IllegalArgumentException("max events must be positive: " + maxEvents);
    }
    extra = extra == null ? Map.of() : Map.copyOf(extra);
  }

  CompilerSettings settings() {
    return new CompilerSettings(maxEvents, expandLoops, extra);
  }

  static Builder builder() {
    return new Builder();
  }

  static final class Builder {
    private String exampleName;
    private int maxEvents = CompilerSettings.defaults().maxEventsToPublish();
    private boolean expandLoops = CompilerSettings.defaults().expandLoopsForSchedule();
    private Path output;
    private boolean validate;
    private final Map<String, String> extra = new LinkedHashMap<>();

    Builder exampleName(String exampleName) {
      this.exampleName = exampleName;
      return this;
    }

    Builder maxEvents(int maxEvents) {
      this.maxEvents = maxEvents;
      return this;
    }

    Builder expandLoops(boolean expandLoops) {
      this.expandLoops = expandLoops;
      return this;
    }

    Builder output(Path output) {
      this.output = output;
      return this;
    }

    Builder validate(boolean validate) {
      this.validate = validate;
      return this;
    }

    Builder extra(Map<String, String> extra) {
      this.extra.putAll(extra);
      return this;
    }

    CliOptions build() {
      if (exampleName == null || exampleName.isBlank()) {
        throw new IllegalArgumentException("Provide an example with --example");
      }
      return new CliOptions(exampleName, maxEvents, expandLoops, output, validate, extra);
    }
  }
}
