package eventlist.feedback;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;

final class LinearFeedbackLatencyModelTest {

  @Test
  void addsPathCostToReadoutCycles() {
    LinearFeedbackLatencyModel model =
        new LinearFeedbackLatencyModel(
            8, Map.of(FeedbackPath.INTERNAL, 10L, FeedbackPath.ZSYNC, 50L));
    GeneratorType qc = GeneratorType.SHFQC;

    assertEquals(10, model.latency(qc, AnalyzerType.SHFQC, FeedbackPath.INTERNAL, 0));
    assertEquals(11, model.latency(qc, AnalyzerType.SHFQC, FeedbackPath.INTERNAL, 1));
    assertEquals(51, model.latency(GeneratorType.HDAWG, AnalyzerType.SHFQA, FeedbackPath.ZSYNC, 8));
  }

  @Test
  void distributedFeedbackIsSlowerByDefault() {
    LinearFeedbackLatencyModel model = LinearFeedbackLatencyModel.qccsDefaults();

    assertTrue(
        model.latency(GeneratorType.HDAWG, AnalyzerType.SHFQA, FeedbackPath.ZSYNC, 1000)
            > model.latency(GeneratorType.SHFQC, AnalyzerType.SHFQC, FeedbackPath.INTERNAL, 1000));
  }

  @Test
  void everyPathNeedsACost() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new LinearFeedbackLatencyModel(8, Map.of(FeedbackPath.ZSYNC, 50L)));
  }
}
