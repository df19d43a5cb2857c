package io.openanomaly.core.common;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.time.Duration;

/** Factory for the object mappers used for stored records and pipeline documents. */
public final class JsonMappers {
  private static final ObjectMapper LENIENT = configure(new ObjectMapper(), false);

  private JsonMappers() {}

  /** Mapper for internal records: unknown fields are ignored. */
  public static ObjectMapper lenient() {
    return LENIENT;
  }

  /** JSON mapper that rejects unknown fields. */
  public static ObjectMapper strictJson() {
    return configure(new ObjectMapper(), true);
  }

  /** YAML mapper that rejects unknown fields. */
  public static ObjectMapper strictYaml() {
    YAMLFactory yamlFactory =
        YAMLFactory.builder()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
            .build();
    return configure(new ObjectMapper(yamlFactory), true);
  }

  private static ObjectMapper configure(ObjectMapper mapper, boolean strict) {
    SimpleModule durations = new SimpleModule("prom-durations");
    durations.addSerializer(Duration.class, new PromDurationSerializer());
    durations.addDeserializer(Duration.class, new PromDurationDeserializer());
    mapper.registerModule(new JavaTimeModule());
    mapper.registerModule(durations);
    mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, strict);
    mapper.configure(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES, strict);
    return mapper;
  }

  static final class PromDurationSerializer extends JsonSerializer<Duration> {
    @Override
    public void serialize(Duration value, JsonGenerator gen, SerializerProvider serializers)
        throws IOException {
      gen.writeString(PromDurations.format(value));
    }
  }

  static final class PromDurationDeserializer extends JsonDeserializer<Duration> {
    @Override
    public Duration deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
      String text = p.getValueAsString();
      try {
        return PromDurations.parse(text);
      } catch (RuntimeException e) {
        return (Duration) ctxt.handleWeirdStringValue(Duration.class, text, e.getMessage());
      }
    }
  }
}
