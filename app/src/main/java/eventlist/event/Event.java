package eventlist.event;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One timestamped entry of an event list.
 *
 * <p>Base fields are the type, the absolute time in tinysamples, the id and, for paired events, the
 * chain element id shared by START and END. Everything else lives in a typed payload restricted to
 * the keys the {@link EventType} accepts. Events are immutable; annotating returns a copy with the
 * same id.
 */
public final class Event {
  private final EventType type;
  private final long time;
  private final int id;
  private final Integer chainElementId;
  private final Map<EventKey<?>, Object> payload;

  private Event(
      EventType type, long time, int id, Integer chainElementId, Map<EventKey<?>, Object> payload) {
    this.type = type;
    this.time = time;
    this.id = id;
    this.chainElementId = chainElementId;
    this.payload = payload;
  }

  public static Builder builder(EventType type, long time) {
    return new Builder(type, time);
  }

  public EventType type() {
    return type;
  }

  public long time() {
    return time;
  }

  public int id() {
    return id;
  }

  /** Id of the START event this event is paired with, {@code null} for unpaired events. */
  public Integer chainElementId() {
    return chainElementId;
  }

  public <T> T get(EventKey<T> key) {
    Object value = payload.get(key);
    return value == null ? null : key.cast(value);
  }

  public boolean has(EventKey<?> key) {
    return payload.containsKey(key);
  }

  /** Payload fields in insertion order. */
  public Map<EventKey<?>, Object> payload() {
    return payload;
  }

  /** Returns a copy of this event with {@code key} set to {@code value}. */
  public <T> Event with(EventKey<T> key, T value) {
    Builder builder = toBuilder();
    builder.put(key, value);
    return builder.build();
  }

  public Builder toBuilder() {
    Builder builder = new Builder(type, time).id(id);
    if (chainElementId != null) {
      builder.chainElementId(chainElementId);
    }
    builder.payload.putAll(payload);
    return builder;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Event other)) {
      return false;
    }
    return type == other.type
        && time == other.time
        && id == other.id
        && Objects.equals(chainElementId, other.chainElementId)
        && payload.equals(other.payload);
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, time, id, chainElementId, payload);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(type).append("(t=").append(time).append(", id=").append(id);
    if (chainElementId != null) {
      sb.append(", chain=").append(chainElementId);
    }
    for (Map.Entry<EventKey<?>, Object> entry : payload.entrySet()) {
      sb.append(", ").append(entry.getKey().wireName()).append('=').append(entry.getValue());
    }
    return sb.append(')').toString();
  }

  public static final class Builder {
    private final EventType type;
    private final long time;
    private int id = -1;
    private Integer chainElementId;
    private final Map<EventKey<?>, Object> payload = new LinkedHashMap<>();

    private Builder(EventType type, long time) {
      this.type = Objects.requireNonNull(type, "type");
      this.time = time;
    }

    public Builder id(int id) {
      this.id = id;
      return this;
    }

    public Builder chainElementId(int chainElementId) {
      this.chainElementId = chainElementId;
      return this;
    }

    /** Sets a payload field. {@code null} values are left out. */
    public <T> Builder put(EventKey<T> key, T value) {
      Objects.requireNonNull(key, "key");
      if (value == null) {
        return this;
      }
      if (!type.accepts(key)) {
        throw new IllegalStateException(type + " events do not carry '" + key.wireName() + "'");
      }
      for (EventKey<?> existing : payload.keySet()) {
        if (existing != key && existing.wireName().equals(key.wireName())) {
          throw new IllegalStateException(
              type + " event already carries a '" + key.wireName() + "' field");
        }
      }
      payload.put(key, key.cast(value));
      return this;
    }

    public Event build() {
      if (id < 0) {
        throw new IllegalStateException(type + " event built without an id");
      }
      Map<EventKey<?>, Object> fields = Collections.unmodifiableMap(new LinkedHashMap<>(payload));
      return new Event(type, time, id, chainElementId, fields);
    }
  }
}
