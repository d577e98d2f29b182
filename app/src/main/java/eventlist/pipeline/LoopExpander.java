package eventlist.pipeline;

import eventlist.core.model.IrChild;
import eventlist.core.model.LoopIr;
import eventlist.core.model.LoopIterationIr;
import eventlist.event.Event;
import eventlist.event.EventKey;
import eventlist.event.EventType;
import java.util.ArrayList;
import java.util.List;

/**
 * Emits the iterations of a compressed loop.
 *
 * <p>The prototype iteration is always emitted and its LOOP_ITERATION_END is marked compressed.
 * With loop expansion on, shadows of the prototype follow back to back, each starting one
 * prototype length after the previous one, until all iterations are out or the budget left after
 * the last emitted iteration is used up.
 */
final class LoopExpander {
  private final EventListGenerator generator;

  LoopExpander(EventListGenerator generator) {
    this.generator = generator;
  }

  List<List<Event>> expand(LoopIr loop, long start, int maxEvents) {
    if (loop.children().isEmpty()) {
      throw new IllegalStateException(
          "Compressed loop '" + loop.section() + "' has no prototype iteration");
    }
    IrChild first = loop.children().get(0);
    if (!(first.node() instanceof LoopIterationIr prototype)) {
      throw new IllegalStateException(
          "Prototype of compressed loop '"
              + loop.section()
              + "' is a "
              + first.node().getClass().getSimpleName()
              + ", not a loop iteration");
    }

    List<List<Event>> iterations = new ArrayList<>();
    List<Event> prototypeEvents =
        new ArrayList<>(generator.generate(prototype, start + first.start(), maxEvents));
    int last = prototypeEvents.size() - 1;
    if (last < 0 || prototypeEvents.get(last).type() != EventType.LOOP_ITERATION_END) {
      throw new IllegalStateException(
          "Prototype of compressed loop '"
              + loop.section()
              + "' does not end with "
              + EventType.LOOP_ITERATION_END);
    }
    prototypeEvents.set(last, prototypeEvents.get(last).with(EventKey.COMPRESSED, true));
    iterations.add(prototypeEvents);

    if (!generator.expandLoops()) {
      return iterations;
    }

    long prototypeLength = EventListGenerator.requireLength(prototype);
    EventBudget budget = EventBudget.of(maxEvents);
    long iterationStart = start;
    for (int iteration = 1; iteration < loop.iterations(); iteration++) {
      budget.charge(iterations.get(iterations.size() - 1));
      if (budget.isExhausted()) {
        generator.markTruncated();
        break;
      }
      iterationStart += prototypeLength;
      LoopIterationIr shadow = prototype.compressedIteration(iteration);
      iterations.add(generator.generate(shadow, iterationStart, budget.remaining()));
    }
    return iterations;
  }
}
