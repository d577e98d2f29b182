package eventlist.cli;

import eventlist.core.EventListException;
import java.io.IOException;
import java.io.PrintStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line entry point.
 *
 * <p>Usage: {@code Main --example NAME [--max-events N] [--expand-loops true|false] [--output
 * FILE] [--validate] [--extra key=value,...]}
 *
 * <p>Exit codes: 0 on success, 1 when generation fails or the list does not validate, 2 on
 * invalid arguments.
 */
public final class Main {
  private static final Logger LOG = LoggerFactory.getLogger(Main.class);

  static final int EXIT_OK = 0;
  static final int EXIT_FAILED = 1;
  static final int EXIT_USAGE = 2;

  private Main() {}

  public static void main(String[] args) {
    System.exit(run(args, System.out, System.err));
  }

  static int run(String[] args, PrintStream out, PrintStream err) {
    GenerateCommand command = new GenerateCommand(out);
    try {
      return command.execute(args == null ? new String[0] : args);
    } catch (IllegalArgumentException ex) {
      err.println(ex.getMessage());
      err.println(
          "Usage: --example "
              + String.join("|", ExamplePrograms.names())
              + " [--max-events N] [--expand-loops true|false] [--output FILE] [--validate]"
              + " [--extra key=value,...]");
      return EXIT_USAGE;
    } catch (EventListException ex) {
      LOG.error("Event list generation failed in section '{}': {}", ex.section(), ex.getMessage());
      return EXIT_FAILED;
    } catch (IllegalStateException | IOException ex) {
      LOG.error("Event list generation failed", ex);
      return EXIT_FAILED;
    }
  }
}
