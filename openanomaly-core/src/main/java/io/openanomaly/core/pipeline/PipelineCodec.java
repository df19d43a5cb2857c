package io.openanomaly.core.pipeline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.openanomaly.core.common.JsonMappers;
import io.openanomaly.core.errors.ConfigValidationException;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * PipelineCodec reads and writes pipeline documents.
 *
 * <p>A document is a YAML or JSON object with a {@code pipelines} list. Every entry is decoded and
 * validated on its own: an invalid entry is reported in {@link LoadResult#getRejected()} and does
 * not affect the others.
 */
public final class PipelineCodec {
  static final String PIPELINES = "pipelines";
  private static final String UNNAMED = "<unnamed>";

  public enum Format {
    YAML,
    JSON;

    public static Format forPath(Path path) {
      String fileName = path.getFileName().toString().toLowerCase();
      return fileName.endsWith(".json") ? JSON : YAML;
    }
  }

  private final PipelineValidator validator;
  private final ObjectMapper yaml = JsonMappers.strictYaml();
  private final ObjectMapper json = JsonMappers.strictJson();

  public PipelineCodec(PipelineValidator validator) {
    this.validator = validator;
  }

  /**
   * Reads a document.
   *
   * @throws ConfigValidationException if the document itself cannot be parsed.
   */
  public LoadResult read(byte[] content, Format format) throws ConfigValidationException {
    ObjectMapper mapper = mapper(format);
    JsonNode root;
    try {
      root = mapper.readTree(content);
    } catch (IOException e) {
      throw new ConfigValidationException("pipeline document is not valid " + format, e);
    }
    if (root == null || root.isMissingNode() || root.isNull()) {
      return new LoadResult(List.of(), Map.of());
    }
    JsonNode entries = root.get(PIPELINES);
    if (!root.isObject() || entries == null || !entries.isArray()) {
      throw new ConfigValidationException("pipeline document must have a '" + PIPELINES + "' list");
    }
    List<Pipeline> pipelines = new ArrayList<>();
    Map<String, String> rejected = new LinkedHashMap<>();
    Map<String, Boolean> seen = new LinkedHashMap<>();
    int index = 0;
    for (JsonNode entry : entries) {
      String name = nameOf(entry, index++);
      try {
        Pipeline pipeline = decode(mapper, entry);
        if (seen.put(pipeline.getName(), Boolean.TRUE) != null) {
          throw new ConfigValidationException("duplicate pipeline name " + pipeline.getName());
        }
        pipelines.add(pipeline);
      } catch (ConfigValidationException e) {
        rejected.put(name, e.getMessage());
      }
    }
    return new LoadResult(pipelines, rejected);
  }

  /** Writes the pipelines as a document that {@link #read} accepts. */
  public byte[] write(Collection<Pipeline> pipelines, Format format) {
    ObjectMapper mapper = mapper(format);
    ObjectNode root = mapper.createObjectNode();
    ArrayNode entries = root.putArray(PIPELINES);
    for (Pipeline pipeline : pipelines) {
      entries.add(mapper.valueToTree(pipeline));
    }
    try {
      return mapper.writeValueAsBytes(root);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("failed to write pipeline document", e);
    }
  }

  /**
   * Replaces the entry with the same name in the document, or appends it. Other entries, valid or
   * not, are kept as they are.
   */
  public byte[] upsertInDocument(byte[] content, Pipeline pipeline, Format format)
      throws ConfigValidationException {
    validator.validate(pipeline);
    ObjectMapper mapper = mapper(format);
    ObjectNode root = documentRoot(mapper, content);
    ArrayNode entries = (ArrayNode) root.get(PIPELINES);
    JsonNode replacement = mapper.valueToTree(pipeline);
    for (int i = 0; i < entries.size(); i++) {
      JsonNode name = entries.get(i).get("name");
      if (name != null && pipeline.getName().equals(name.asText())) {
        entries.set(i, replacement);
        return toBytes(mapper, root);
      }
    }
    entries.add(replacement);
    return toBytes(mapper, root);
  }

  /** Removes the entries with the given name from the document. */
  public byte[] removeFromDocument(byte[] content, String name, Format format)
      throws ConfigValidationException {
    ObjectMapper mapper = mapper(format);
    ObjectNode root = documentRoot(mapper, content);
    ArrayNode entries = (ArrayNode) root.get(PIPELINES);
    for (int i = entries.size() - 1; i >= 0; i--) {
      JsonNode entryName = entries.get(i).get("name");
      if (entryName != null && name.equals(entryName.asText())) {
        entries.remove(i);
      }
    }
    return toBytes(mapper, root);
  }

  /** Reads a single JSON encoded pipeline. */
  public Pipeline readPipeline(byte[] content) throws ConfigValidationException {
    JsonNode node;
    try {
      node = json.readTree(content);
    } catch (IOException e) {
      throw new ConfigValidationException("pipeline is not valid json", e);
    }
    return decode(json, node);
  }

  public byte[] writePipeline(Pipeline pipeline) {
    try {
      return json.writeValueAsBytes(pipeline);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("failed to write pipeline " + pipeline.getName(), e);
    }
  }

  public PipelineValidator getValidator() {
    return validator;
  }

  private Pipeline decode(ObjectMapper mapper, JsonNode node) throws ConfigValidationException {
    Pipeline pipeline;
    try {
      pipeline = mapper.treeToValue(node, Pipeline.class);
    } catch (JsonProcessingException e) {
      throw new ConfigValidationException(e.getOriginalMessage(), e);
    } catch (IllegalArgumentException e) {
      throw new ConfigValidationException(e.getMessage(), e);
    }
    if (pipeline == null) {
      throw new ConfigValidationException("pipeline entry must not be empty");
    }
    validator.validate(pipeline);
    return pipeline;
  }

  private static ObjectNode documentRoot(ObjectMapper mapper, byte[] content)
      throws ConfigValidationException {
    JsonNode root;
    try {
      root = content.length == 0 ? null : mapper.readTree(content);
    } catch (IOException e) {
      throw new ConfigValidationException("pipeline document is not valid", e);
    }
    if (root == null || root.isMissingNode() || root.isNull()) {
      ObjectNode empty = mapper.createObjectNode();
      empty.putArray(PIPELINES);
      return empty;
    }
    if (!root.isObject() || root.get(PIPELINES) == null || !root.get(PIPELINES).isArray()) {
      throw new ConfigValidationException("pipeline document must have a '" + PIPELINES + "' list");
    }
    return (ObjectNode) root;
  }

  private static byte[] toBytes(ObjectMapper mapper, JsonNode root) {
    try {
      return mapper.writeValueAsBytes(root);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("failed to write pipeline document", e);
    }
  }

  private ObjectMapper mapper(Format format) {
    return format == Format.JSON ? json : yaml;
  }

  private static String nameOf(JsonNode entry, int index) {
    JsonNode name = entry == null ? null : entry.get("name");
    if (name != null && name.isTextual() && !name.asText().isBlank()) {
      return name.asText();
    }
    return UNNAMED + "[" + index + "]";
  }

  /** Pipelines that decoded and validated, plus the names and reasons of those that did not. */
  public static final class LoadResult {
    private final List<Pipeline> pipelines;
    private final Map<String, String> rejected;

    public LoadResult(List<Pipeline> pipelines, Map<String, String> rejected) {
      this.pipelines = ImmutableList.copyOf(pipelines);
      this.rejected = ImmutableMap.copyOf(rejected);
    }

    public List<Pipeline> getPipelines() {
      return pipelines;
    }

    public Map<String, String> getRejected() {
      return rejected;
    }
  }
}
