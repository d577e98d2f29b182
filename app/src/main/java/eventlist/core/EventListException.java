package eventlist.core;

/**
 * Thrown when a program cannot be turned into an event list: a branch that cannot be scheduled,
 * or a feedback configuration the hardware does not support.
 *
 * <p>Carries the offending section, and the acquisition handle or signal when there is one.
 */
public final class EventListException extends RuntimeException {

  private final String section;
  private final String subject;

  public EventListException(String message, String section, String subject) {
    super(message);
    this.section = section;
    this.subject = subject;
  }

  public EventListException(String message, String section) {
    this(message, section, null);
  }

  /** Section the failure was raised for. */
  public String section() {
    return section;
  }

  /** Handle or signal involved, {@code null} if not applicable. */
  public String subject() {
    return subject;
  }
}
