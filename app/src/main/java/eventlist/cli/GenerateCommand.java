package eventlist.cli;

import eventlist.core.model.IrNode;
import eventlist.pipeline.EventListPipeline;
import eventlist.pipeline.EventListResult;
import eventlist.util.EventListValidator;
import eventlist.util.EventListValidator.ValidationResult;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Generates the event list of a built-in example and prints it as JSON. */
final class GenerateCommand {
  private static final Logger LOG = LoggerFactory.getLogger(GenerateCommand.class);

  private final PrintStream out;

  GenerateCommand(PrintStream out) {
    this.out = out;
  }

  int execute(String[] args) throws IOException {
    CliOptions options = parseArgs(args);
    IrNode program = ExamplePrograms.load(options.exampleName());

    EventListPipeline pipeline = new EventListPipeline(options.settings());
    EventListResult result =
        pipeline.generate(program, 0, options.maxEvents(), options.expandLoops());

    if (options.validate()) {
      ValidationResult validation = new EventListValidator().validate(result.events());
      if (!validation.isValid()) {
        for (String violation : validation.violations()) {
          LOG.error("Invalid event list: {}", violation);
        }
        return Main.EXIT_FAILED;
      }
      LOG.info("Event list valid: {} paired event(s).", validation.pairCount());
    }

    String json = new EventListJsonWriter().write(result.events());
    if (options.output() == null) {
      out.println(json);
    } else {
      Files.writeString(options.output(), json, StandardCharsets.UTF_8);
      LOG.info("Wrote {} event(s) to {}", result.size(), options.output());
    }
    return Main.EXIT_OK;
  }

  CliOptions parseArgs(String[] args) {
    CliOptions.Builder builder = CliOptions.builder();
    Map<String, OptionSpec> specs = optionSpecs();

    for (int i = 0; i < args.length; i++) {
      ParsedArg parsed = ParsedArg.parse(args[i]);
      OptionSpec spec = specs.get(parsed.option());
      if (spec == null) {
        throw new IllegalArgumentException("Unknown option: " + args[i]);
      }

      String value = parsed.value();
      if (spec.requiresValue() && (value == null || value.isBlank())) {
        if (i + 1 >= args.length) {
          throw new IllegalArgumentException("Missing value for " + parsed.option());
        }
        value = args[++i];
      }
      spec.apply(builder, value);
    }
    return builder.build();
  }

  private Map<String, OptionSpec> optionSpecs() {
    Map<String, OptionSpec> specs = new LinkedHashMap<>();
    specs.put("--example", OptionSpec.withValue(CliOptions.Builder::exampleName));
    specs.put(
        "--max-events",
        OptionSpec.withValue(
            (b, raw) -> b.maxEvents(CliParsers.parseInt(raw, 0, "--max-events"))));
    specs.put(
        "--expand-loops",
        OptionSpec.withValue(
            (b, raw) -> b.expandLoops(CliParsers.parseBoolean(raw, "--expand-loops"))));
    specs.put("--output", OptionSpec.withValue((b, raw) -> b.output(Path.of(raw))));
    specs.put("--validate", OptionSpec.flag(b -> b.validate(true)));
    specs.put(
        "--extra",
        OptionSpec.withValue((b, raw) -> b.extra(CliParsers.parseSettings(raw, "--extra"))));
    return specs;
  }

  private record ParsedArg(String option, String value) {
    static ParsedArg parse(String raw) {
      if (raw == null || raw.isBlank()) {
        throw new IllegalArgumentException("Unknown option: " + raw);
      }
      if (raw.startsWith("--")) {
        int equalsIndex = raw.indexOf('=');
        if (equalsIndex > 0) {
          String option = raw.substring(0, equalsIndex);
          String value = raw.substring(equalsIndex + 1);
          return new ParsedArg(option, value.isEmpty() ? null : value);
        }
      }
      return new ParsedArg(raw, null);
    }
  }

  private record OptionSpec(boolean requiresValue, BiConsumer<CliOptions.Builder, String> apply) {
    static OptionSpec withValue(BiConsumer<CliOptions.Builder, String> consumer) {
      return new OptionSpec(true, consumer);
    }

    static OptionSpec flag(Consumer<CliOptions.Builder> consumer) {
      return new OptionSpec(false, (builder, ignored) -> consumer.accept(builder));
    }

    void apply(CliOptions.Builder builder, String value) {
      apply.accept(builder, value);
    }
  }
}
