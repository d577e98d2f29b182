package eventlist.pipeline;

import eventlist.core.model.IrChild;
import eventlist.core.model.IrNode;
import eventlist.core.model.SectionNode;
import eventlist.event.Event;
import eventlist.event.EventKey;
import eventlist.event.EventType;
import java.util.ArrayList;
import java.util.List;

/**
 * Emits the children of a node in order, one event list per child, within the node's budget.
 *
 * <p>Once the budget runs out the remaining children are not visited, but each still gets a slot
 * so the result always has one entry per child. Below a section, every section-typed child is
 * wrapped in a SUBSECTION_START/END pair, including the empty slots.
 */
final class ChildEventCollector {
  private final EventListGenerator generator;

  ChildEventCollector(EventListGenerator generator) {
    this.generator = generator;
  }

  List<List<Event>> collect(IrNode parent, long start, int maxEvents, boolean subsectionEvents) {
    EventListGenerator.requireLength(parent);
    List<IrChild> children = parent.children();
    boolean wrap = subsectionEvents && parent instanceof SectionNode;

    EventBudget budget = EventBudget.of(maxEvents);
    if (wrap) {
      budget.reserve(2 * children.size());
    }

    List<List<Event>> nested = new ArrayList<>(children.size());
    for (IrChild child : children) {
      if (budget.isExhausted()) {
        generator.markTruncated();
        break;
      }
      boolean wrapChild = wrap && child.node() instanceof SectionNode;
      Event subsectionStart = wrapChild ? subsectionStart(parent, child, start) : null;
      List<Event> events =
          generator.generate(child.node(), start + child.start(), budget.remaining());
      budget.charge(events);
      nested.add(wrapChild ? wrap(subsectionStart, events, parent, child, start) : events);
    }

    // Downstream validation expects a slot, and a subsection pair, for every child.
    for (int i = nested.size(); i < children.size(); i++) {
      IrChild child = children.get(i);
      if (wrap && child.node() instanceof SectionNode) {
        nested.add(wrap(subsectionStart(parent, child, start), List.of(), parent, child, start));
      } else {
        nested.add(List.of());
      }
    }
    return nested;
  }

  private Event subsectionStart(IrNode parent, IrChild child, long start) {
    int id = generator.ids().next();
    return Event.builder(EventType.SUBSECTION_START, start + child.start())
        .id(id)
        .chainElementId(id)
        .put(EventKey.SECTION_NAME, parent.section())
        .put(EventKey.SUBSECTION_NAME, child.node().section())
        .build();
  }

  private List<Event> wrap(
      Event subsectionStart, List<Event> events, IrNode parent, IrChild child, long start) {
    long childLength = EventListGenerator.requireLength(child.node());
    List<Event> wrapped = new ArrayList<>(events.size() + 2);
    wrapped.add(subsectionStart);
    wrapped.addAll(events);
    wrapped.add(
        Event.builder(EventType.SUBSECTION_END, start + child.start() + childLength)
            .id(generator.ids().next())
            .chainElementId(subsectionStart.id())
            .put(EventKey.SECTION_NAME, parent.section())
            .put(EventKey.SUBSECTION_NAME, child.node().section())
            .build());
    return wrapped;
  }
}
