package io.gwswuse.input.grid;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads {@code *.json} grid files:
 * <pre>
 * { "variable": "ptotuse", "units": "m3/month",
 *   "lat": [...], "lon": [...], "time": ["1901-01-01", ...],
 *   "data": [time][lat][lon] }
 * </pre>
 * Static grids omit {@code time} and give {@code data} as [lat][lon].
 */
public class JsonGridFileReader implements GridFileReader {

  public static final String EXTENSION = ".json";

  private final ObjectMapper mapper;

  public JsonGridFileReader() {
    this(new ObjectMapper());
  }

  public JsonGridFileReader(ObjectMapper mapper) {
    this.mapper = mapper;
  }

  @Override
  public boolean accepts(Path file) {
    return file.getFileName().toString().endsWith(EXTENSION);
  }

  @Override
  public GridDataset read(Path file, DatasetKey key) throws IOException {
    JsonNode root;
    try {
      root = mapper.readTree(file.toFile());
    } catch (JsonProcessingException e) {
      throw new GridFileException(file, "not a valid grid document: " + e.getOriginalMessage(), e);
    }
    if (root == null || !root.isObject()) {
      throw new GridFileException(file, "grid document must be a JSON object");
    }

    String variable = text(root, "variable");
    if (variable == null) throw new GridFileException(file, "variable required");
    String units = text(root, "units");
    double[] lat = numbers(file, root, "lat");
    double[] lon = numbers(file, root, "lon");
    List<LocalDate> time = dates(file, root.get("time"));

    JsonNode data = root.get("data");
    if (data == null || !data.isArray()) throw new GridFileException(file, "data required");

    double[][][] values;
    if (time.isEmpty()) {
      values = new double[][][] {matrix(file, data, 0, lat.length, lon.length)};
    } else {
      if (data.size() != time.size()) {
        throw new GridFileException(file, "data has " + data.size() + " time slices, time has " + time.size());
      }
      values = new double[time.size()][][];
      for (int t = 0; t < time.size(); t++) {
        values[t] = matrix(file, data.get(t), t, lat.length, lon.length);
      }
    }
    return new GridDataset(key, variable, units, time, lat, lon, values);
  }

  private static String text(JsonNode root, String field) {
    JsonNode node = root.get(field);
    return node == null || node.isNull() ? null : node.asText();
  }

  private static double[] numbers(Path file, JsonNode root, String field) throws GridFileException {
    JsonNode node = root.get(field);
    if (node == null || !node.isArray()) throw new GridFileException(file, field + " required");
    double[] out = new double[node.size()];
    for (int i = 0; i < out.length; i++) {
      if (!node.get(i).isNumber()) throw new GridFileException(file, field + "[" + i + "] is not a number");
      out[i] = node.get(i).asDouble();
    }
    return out;
  }

  private static List<LocalDate> dates(Path file, JsonNode node) throws GridFileException {
    List<LocalDate> out = new ArrayList<>();
    if (node == null || node.isNull()) return out;
    if (!node.isArray()) throw new GridFileException(file, "time must be an array");
    for (JsonNode t : node) {
      try {
        out.add(LocalDate.parse(t.asText()));
      } catch (DateTimeParseException e) {
        throw new GridFileException(file, "bad timestamp " + t.asText(), e);
      }
    }
    return out;
  }

  private static double[][] matrix(Path file, JsonNode node, int index, int rows, int cols) throws GridFileException {
    if (node == null || !node.isArray() || node.size() != rows) {
      throw new GridFileException(file, "expected " + rows + " latitude rows in data");
    }
    double[][] out = new double[rows][cols];
    for (int i = 0; i < rows; i++) {
      JsonNode row = node.get(i);
      if (!row.isArray() || row.size() != cols) {
        throw new GridFileException(file, "expected " + cols + " longitude values in data row " + i);
      }
      for (int j = 0; j < cols; j++) {
        JsonNode cell = row.get(j);
        // null marks a missing cell
        if (cell.isNull()) {
          out[i][j] = Double.NaN;
        } else if (cell.isNumber()) {
          out[i][j] = cell.asDouble();
        } else {
          throw new GridFileException(file, "data[" + index + "][" + i + "][" + j + "] is not a number");
        }
      }
    }
    return out;
  }
}
