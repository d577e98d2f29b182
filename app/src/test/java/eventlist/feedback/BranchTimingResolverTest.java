package eventlist.feedback;

import static eventlist.testing.IrFixtures.at;
import static eventlist.testing.IrFixtures.section;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import eventlist.core.EventListException;
import eventlist.core.model.CaseIr;
import eventlist.core.model.IrChild;
import eventlist.core.model.MatchIr;
import eventlist.core.model.SectionIr;
import eventlist.util.TimeGrid;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

final class BranchTimingResolverTest {
  private static final long NS = 3_600;
  private static final double SEQUENCER_RATE = 250e6;
  /** One generator latency unit at 250 MHz, in tinysamples. */
  private static final long UNIT = 7_200;

  private static MatchIr match(String handle, boolean local, long grid) {
    SectionIr body =
        SectionIr.of(
            "m", 20 * NS, Set.of("drive"), List.of(at(0, new CaseIr(section("c0", 20 * NS), 0))));
    return new MatchIr(body, handle, local, null, null, grid);
  }

  private static ScheduleData.Builder schedule(
      SignalInfo readout, SignalInfo drive, FeedbackLatencyModel model) {
    return ScheduleData.builder()
        .acquisition("h1", new AcquirePulse("acq", 0L, 500 * NS))
        .signal(readout)
        .signal(drive)
        .sequencerRate(drive.deviceId(), SEQUENCER_RATE)
        .latencyModel(model);
  }

  private static SignalInfo readout() {
    return SignalInfo.builder("acq", "qa0", DeviceType.SHFQA).samplingRate(2e9).build();
  }

  private static SignalInfo drive() {
    return SignalInfo.builder("drive", "sg0", DeviceType.SHFSG).build();
  }

  @Test
  void resolvesToLatencyRoundedUpToTheGrid() {
    List<Long> readoutEnds = new ArrayList<>();
    List<FeedbackPath> paths = new ArrayList<>();
    FeedbackLatencyModel model =
        (generator, analyzer, path, readoutEnd) -> {
          readoutEnds.add(readoutEnd);
          paths.add(path);
          assertEquals(GeneratorType.SHFSG, generator);
          assertEquals(AnalyzerType.SHFQA, analyzer);
          return 40;
        };
    BranchTimingResolver resolver =
        new BranchTimingResolver(schedule(readout(), drive(), model).build());

    long start = resolver.resolveStart(match("h1", false, 8), 0, false);

    assertEquals(List.of(1000L), readoutEnds, "Readout ends 500 ns after the trigger at 2 GS/s");
    assertEquals(List.of(FeedbackPath.ZSYNC), paths);
    assertEquals(TimeGrid.ceilToGrid(40 * UNIT, 8), start);
  }

  @Test
  void generatorDelaysShiftTheStartEarlier() {
    SignalInfo delayedDrive =
        SignalInfo.builder("drive", "sg0", DeviceType.SHFSG)
            .startDelay(10e-9)
            .delaySignal(5e-9)
            .build();
    BranchTimingResolver resolver =
        new BranchTimingResolver(schedule(readout(), delayedDrive, (g, a, p, end) -> 40).build());
    long grid = 4 * NS;

    long start = resolver.resolveStart(match("h1", true, grid), 0, false);

    assertEquals(TimeGrid.ceilToGrid(40 * UNIT - 15 * NS, grid), start);
    assertEquals(0, start % grid, "Start is on the grid");
  }

  @Test
  void proposedStartWinsWhenItIsLater() {
    BranchTimingResolver resolver =
        new BranchTimingResolver(schedule(readout(), drive(), (g, a, p, end) -> 40).build());

    assertEquals(1_000_003, resolver.resolveStart(match("h1", false, 8), 1_000_003, false));
  }

  @Test
  void localBranchesUseTheInternalPath() {
    List<FeedbackPath> paths = new ArrayList<>();
    BranchTimingResolver resolver =
        new BranchTimingResolver(
            schedule(
                    readout(),
                    drive(),
                    (g, a, path, end) -> {
                      paths.add(path);
                      return 1;
                    })
                .build());

    resolver.resolveStart(match("h1", true, 8), 0, false);

    assertEquals(List.of(FeedbackPath.INTERNAL), paths);
  }

  @Test
  void laterReadoutOrLongerLatencyNeverMovesTheStartEarlier() {
    FeedbackLatencyModel model = (g, a, p, readoutEnd) -> readoutEnd / 8 + 60;
    MatchIr match = match("h1", false, 4 * NS);
    long previous = Long.MIN_VALUE;
    for (int step = 0; step < 20; step++) {
      SignalInfo readout =
          SignalInfo.builder("acq", "qa0", DeviceType.SHFQA)
              .samplingRate(2e9)
              .startDelay(step * 3e-9)
              .delaySignal(step * 1e-9)
              .portDelay(step * 2e-9)
              .build();
      long start =
          new BranchTimingResolver(schedule(readout, drive(), model).build())
              .resolveStart(match, 0, false);
      assertTrue(start >= previous, "Start moved earlier at step " + step);
      assertEquals(0, start % (4 * NS));
      previous = start;
    }

    long previousLatency = Long.MIN_VALUE;
    for (long latency = 0; latency < 200; latency += 7) {
      long cycles = latency;
      long start =
          new BranchTimingResolver(schedule(readout(), drive(), (g, a, p, e) -> cycles).build())
              .resolveStart(match, 0, false);
      assertTrue(start >= previousLatency, "Start moved earlier at latency " + latency);
      previousLatency = start;
    }
  }

  @Test
  void combinedDevicesAreTreatedAsShfqc() {
    SignalInfo readout =
        SignalInfo.builder("acq", "qc0", DeviceType.SHFQA).combinedDevice(true).build();
    SignalInfo drive =
        SignalInfo.builder("drive", "qc0", DeviceType.SHFSG).combinedDevice(true).build();
    List<String> seen = new ArrayList<>();
    BranchTimingResolver resolver =
        new BranchTimingResolver(
            schedule(
                    readout,
                    drive,
                    (g, a, p, end) -> {
                      seen.add(g + "/" + a);
                      return 10;
                    })
                .build());

    resolver.resolveStart(match("h1", true, 8), 0, false);

    assertEquals(List.of("SHFQC/SHFQC"), seen);
  }

  @Test
  void matchWithoutHandleKeepsProposedStart() {
    BranchTimingResolver resolver =
        new BranchTimingResolver(schedule(readout(), drive(), (g, a, p, e) -> 1_000).build());

    assertEquals(123, resolver.resolveStart(match(null, false, 8), 123, true));
  }

  @Test
  void movableStartIsRejected() {
    BranchTimingResolver resolver =
        new BranchTimingResolver(schedule(readout(), drive(), (g, a, p, e) -> 1).build());

    EventListException ex =
        assertThrows(
            EventListException.class, () -> resolver.resolveStart(match("h1", false, 8), 0, true));
    assertEquals("m", ex.section());
    assertEquals("h1", ex.subject());
    assertTrue(ex.getMessage().contains("right-aligned"), ex.getMessage());
  }

  @Test
  void unknownHandleIsRejected() {
    BranchTimingResolver resolver =
        new BranchTimingResolver(schedule(readout(), drive(), (g, a, p, e) -> 1).build());

    EventListException ex =
        assertThrows(
            EventListException.class,
            () -> resolver.resolveStart(match("other", false, 8), 0, false));
    assertTrue(ex.getMessage().contains("No acquire found"), ex.getMessage());
  }

  @Test
  void unresolvedAcquisitionIsRejected() {
    ScheduleData schedule =
        ScheduleData.builder()
            .acquisition("h1", new AcquirePulse("acq", null, 100))
            .signal(readout())
            .signal(drive())
            .sequencerRate("sg0", SEQUENCER_RATE)
            .build();

    assertThrows(
        EventListException.class,
        () -> new BranchTimingResolver(schedule).resolveStart(match("h1", false, 8), 0, false));
  }

  @Test
  void uhfqaReadoutIsNotSupported() {
    SignalInfo uhfqa = SignalInfo.builder("acq", "uhf0", DeviceType.UHFQA).build();
    BranchTimingResolver resolver =
        new BranchTimingResolver(schedule(uhfqa, drive(), (g, a, p, e) -> 1).build());

    EventListException ex =
        assertThrows(
            EventListException.class, () -> resolver.resolveStart(match("h1", false, 8), 0, false));
    assertTrue(ex.getMessage().contains("UHFQA"), ex.getMessage());
    assertEquals("acq", ex.subject());
  }

  @Test
  void deviceClassesMapToFeedbackRoles() {
    SignalInfo shfqa = SignalInfo.builder("acq", "qa0", DeviceType.SHFQA).build();
    SignalInfo hdawg = SignalInfo.builder("drive", "hd0", DeviceType.HDAWG).build();
    SignalInfo qcDrive =
        SignalInfo.builder("drive", "qc0", DeviceType.SHFSG).combinedDevice(true).build();

    assertEquals(AnalyzerType.SHFQA, BranchTimingResolver.analyzerType(shfqa, "m"));
    assertEquals(GeneratorType.HDAWG, BranchTimingResolver.generatorType(hdawg, "m"));
    assertEquals(
        GeneratorType.SHFQC,
        BranchTimingResolver.generatorType(qcDrive, "m"),
        "Combined devices generate as SHFQC");
    EventListException ex =
        assertThrows(
            EventListException.class, () -> BranchTimingResolver.generatorType(shfqa, "m"));
    assertEquals("acq", ex.subject());
  }

  @Test
  void casesMustStartWithTheMatch() {
    SectionIr body =
        SectionIr.of(
            "m",
            20 * NS,
            Set.of("drive"),
            List.of(IrChild.at(NS, new CaseIr(section("late", 10 * NS), 0))));
    MatchIr match = new MatchIr(body, "h1", false, null, null, 8);
    BranchTimingResolver resolver =
        new BranchTimingResolver(schedule(readout(), drive(), (g, a, p, e) -> 1).build());

    assertThrows(IllegalStateException.class, () -> resolver.resolveStart(match, 0, false));
  }

  @Test
  void lastAcquisitionOnTheHandleCounts() {
    List<Long> readoutEnds = new ArrayList<>();
    ScheduleData schedule =
        ScheduleData.builder()
            .acquisition("h1", new AcquirePulse("acq", 0L, 500 * NS))
            .acquisition("h1", new AcquirePulse("acq", 1_000 * NS, 500 * NS))
            .signal(readout())
            .signal(drive())
            .sequencerRate("sg0", SEQUENCER_RATE)
            .latencyModel(
                (g, a, p, end) -> {
                  readoutEnds.add(end);
                  return 0;
                })
            .build();

    new BranchTimingResolver(schedule).resolveStart(match("h1", false, 8), 0, false);

    assertEquals(List.of(3000L), readoutEnds);
  }
}
