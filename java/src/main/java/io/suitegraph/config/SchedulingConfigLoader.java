package io.suitegraph.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads a {@link SchedulingConfig} from JSON.
 *
 * <pre>{@code
 * {
 *   "scheduling": {
 *     "initial cycle point": "2015",
 *     "graph": {
 *       "R1": "prep => foo",
 *       "P1Y": "foo[-P1Y] => foo => bar"
 *     }
 *   }
 * }
 * }</pre>
 *
 * <p>The {@code scheduling} wrapper is optional, and {@code graph} may be a plain string when the
 * suite declares no recurrence.
 */
public final class SchedulingConfigLoader {
  private static final Logger log = LoggerFactory.getLogger(SchedulingConfigLoader.class);

  /** Key of the initial cycle point setting. */
  public static final String INITIAL_CYCLE_POINT = "initial cycle point";

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private SchedulingConfigLoader() {}

  /**
   * Loads a configuration file.
   *
   * @param path the JSON file
   * @return the scheduling configuration
   * @throws IOException if the file cannot be read or is not valid JSON
   */
  public static SchedulingConfig load(Path path) throws IOException {
    log.debug("Loading scheduling config from {}", path);
    return parse(Files.readString(path));
  }

  /**
   * Parses a configuration document.
   *
   * @param json the JSON text
   * @return the scheduling configuration
   * @throws IOException if the text is not valid JSON
   * @throws IllegalArgumentException if the document does not describe a graph
   */
  public static SchedulingConfig parse(String json) throws IOException {
    JsonNode root = MAPPER.readTree(json);
    if (root == null || !root.isObject()) {
      throw new IllegalArgumentException("scheduling config must be a JSON object");
    }
    JsonNode scheduling = root.has("scheduling") ? root.get("scheduling") : root;

    String initialCyclePoint = null;
    JsonNode icp = scheduling.get(INITIAL_CYCLE_POINT);
    if (icp != null && !icp.isNull()) {
      initialCyclePoint = icp.asText();
    }

    List<GraphEntry> entries = readGraph(scheduling.get("graph"));
    log.debug(
        "Read {} graph entr{} (initial cycle point: {})",
        entries.size(),
        entries.size() == 1 ? "y" : "ies",
        initialCyclePoint);
    return new SchedulingConfig(initialCyclePoint, entries);
  }

  private static List<GraphEntry> readGraph(JsonNode graph) {
    if (graph == null || graph.isNull()) {
      throw new IllegalArgumentException("scheduling config has no graph");
    }

    List<GraphEntry> entries = new ArrayList<>();
    if (graph.isTextual()) {
      entries.add(GraphEntry.of(graph.asText()));
      return entries;
    }
    if (!graph.isObject()) {
      throw new IllegalArgumentException("graph must be a string or an object of recurrences");
    }

    Iterator<Map.Entry<String, JsonNode>> fields = graph.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      if (!field.getValue().isTextual()) {
        throw new IllegalArgumentException(
            "graph for recurrence '" + field.getKey() + "' must be a string");
      }
      String recurrence = field.getKey().isBlank() ? null : field.getKey().trim();
      entries.add(new GraphEntry(recurrence, field.getValue().asText()));
    }
    return entries;
  }
}
