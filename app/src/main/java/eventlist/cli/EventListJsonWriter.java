package eventlist.cli;

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import eventlist.event.Event;
import eventlist.event.EventKey;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Renders event lists as pretty-printed JSON arrays with snake_case keys. */
final class EventListJsonWriter {
  private final Gson gson =
      new GsonBuilder()
          .setPrettyPrinting()
          .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
          .create();

  String write(List<Event> events) {
    List<Map<String, Object>> entries = new ArrayList<>(events.size());
    for (Event event : events) {
      entries.add(entry(event));
    }
    return gson.toJson(entries);
  }

  static Map<String, Object> entry(Event event) {
    Map<String, Object> entry = new LinkedHashMap<>();
    entry.put("event_type", event.type().name());
    entry.put("time", event.time());
    entry.put("id", event.id());
    if (event.chainElementId() != null) {
      entry.put("chain_element_id", event.chainElementId());
    }
    for (Map.Entry<EventKey<?>, Object> field : event.payload().entrySet()) {
      entry.put(field.getKey().wireName(), field.getValue());
    }
    return entry;
  }
}
