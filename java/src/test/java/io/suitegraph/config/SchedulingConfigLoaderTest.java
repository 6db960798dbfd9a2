package io.suitegraph.config;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.suitegraph.CyclingMode;
import io.suitegraph.GraphLine;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Unit tests for reading scheduling sections from JSON. */
public class SchedulingConfigLoaderTest {

  @Test
  void testCyclingConfig() throws IOException {
    SchedulingConfig config =
        SchedulingConfigLoader.parse(
            "{\"scheduling\": {\"initial cycle point\": \"2015\","
                + " \"graph\": {\"R1\": \"prep => foo\", \"P1Y\": \"foo => bar\"}}}");
    assertEquals("2015", config.initialCyclePoint());
    assertEquals(CyclingMode.CYCLING, config.mode());
    assertEquals(
        List.of(new GraphEntry("R1", "prep => foo"), new GraphEntry("P1Y", "foo => bar")),
        config.graph());
  }

  @Test
  void testPlainGraphString() throws IOException {
    SchedulingConfig config = SchedulingConfigLoader.parse("{\"graph\": \"foo => bar\"}");
    assertEquals(CyclingMode.NON_CYCLING, config.mode());
    assertEquals(List.of(GraphEntry.of("foo => bar")), config.graph());
  }

  @Test
  void testLinesCarryRecurrenceAndMode() throws IOException {
    SchedulingConfig config =
        SchedulingConfigLoader.parse(
            "{\"initial cycle point\": \"2015\","
                + " \"graph\": {\"P1D\": \"a => b\\nb &\\n c => d\"}}");
    assertEquals(
        List.of(
            new GraphLine("a => b", "P1D", CyclingMode.CYCLING),
            new GraphLine("b & c => d", "P1D", CyclingMode.CYCLING)),
        config.lines());
  }

  @Test
  void testBlankInitialCyclePointIsNonCycling() throws IOException {
    SchedulingConfig config =
        SchedulingConfigLoader.parse("{\"initial cycle point\": \" \", \"graph\": \"a\"}");
    assertEquals(CyclingMode.NON_CYCLING, config.mode());
  }

  @Test
  void testLoadFromFile(@TempDir Path dir) throws IOException {
    Path file = dir.resolve("suite.json");
    Files.writeString(file, "{\"scheduling\": {\"graph\": {\"R1\": \"foo & bar => baz\"}}}");
    SchedulingConfig config = SchedulingConfigLoader.load(file);
    assertEquals(1, config.lines().size());
    assertEquals("R1", config.lines().get(0).recurrence());
  }

  @Test
  void testMissingGraph() {
    assertThrows(
        IllegalArgumentException.class,
        () -> SchedulingConfigLoader.parse("{\"scheduling\": {}}"));
  }

  @Test
  void testGraphOfWrongType() {
    assertThrows(
        IllegalArgumentException.class, () -> SchedulingConfigLoader.parse("{\"graph\": 3}"));
    assertThrows(
        IllegalArgumentException.class,
        () -> SchedulingConfigLoader.parse("{\"graph\": {\"R1\": [\"a\"]}}"));
  }

  @Test
  void testInvalidJson() {
    assertThrows(JsonProcessingException.class, () -> SchedulingConfigLoader.parse("{graph"));
  }
}
