package io.openanomaly.task;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableMap;
import io.openanomaly.common.StructuredLogging;
import io.openanomaly.core.common.CoreInfra;
import io.openanomaly.core.common.JsonMappers;
import io.openanomaly.core.common.PromDurations;
import io.openanomaly.core.pipeline.Pipeline;
import io.openanomaly.core.pipeline.TrainingConfig;
import io.openanomaly.instrumentation.Tags;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import javax.annotation.Nullable;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * TrainingEventPublisher sends training lifecycle events to Kafka for pipelines that enable it.
 *
 * <p>The message is the pipeline's {@code kafka_message_template} with {@code {event_type}},
 * {@code {pipeline_name}} and event field placeholders substituted in string values, plus the
 * event fields the template does not mention. Without a template the message carries {@code
 * event_type}, {@code timestamp}, {@code pipeline_name} and the event fields.
 *
 * <p>Publishing never fails the caller: errors are logged and counted. One producer is kept per
 * bootstrap server list.
 */
public class TrainingEventPublisher implements AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(TrainingEventPublisher.class);
  private static final Pattern PLACEHOLDER = Pattern.compile("\\{([A-Za-z0-9_]+)\\}");
  private static final ObjectMapper MAPPER = JsonMappers.lenient();

  public static final String TRAINING_STARTED = "training_started";
  public static final String TRAINING_COMPLETED = "training_completed";
  public static final String TRAINING_FAILED = "training_failed";

  private final Function<String, Producer<String, String>> producerFactory;
  private final Clock clock;
  private final CoreInfra infra;
  private final ConcurrentMap<String, Producer<String, String>> producers =
      new ConcurrentHashMap<>();

  @VisibleForTesting
  TrainingEventPublisher(
      Function<String, Producer<String, String>> producerFactory, Clock clock, CoreInfra infra) {
    this.producerFactory = producerFactory;
    this.clock = clock;
    this.infra = infra;
  }

  public TrainingEventPublisher(Clock clock, CoreInfra infra) {
    this(TrainingEventPublisher::newProducer, clock, infra);
  }

  /**
   * Publishes the event if the pipeline enables Kafka.
   *
   * @param fields event fields such as {@code model_id} or {@code error}.
   * @param flush whether to wait for delivery of buffered events.
   */
  public void publish(
      Pipeline pipeline, String eventType, Map<String, Object> fields, boolean flush) {
    TrainingConfig training = pipeline.getTraining();
    if (training == null || !training.isKafkaEnabled()) {
      return;
    }
    String topic = training.getKafkaTopic();
    try {
      String key =
          substitute(training.getKafkaMessageKey(), variables(pipeline, eventType, fields));
      String value = MAPPER.writeValueAsString(message(pipeline, eventType, fields));
      Producer<String, String> producer =
          producers.computeIfAbsent(training.getKafkaBootstrapServers(), producerFactory);
      producer.send(
          new ProducerRecord<>(topic, key, value),
          (metadata, e) -> {
            if (e != null) {
              failed(pipeline, topic, eventType, e);
            } else {
              infra
                  .scope()
                  .tagged(ImmutableMap.of(Tags.Key.result, "ok"))
                  .counter("training.event.publish")
                  .inc(1);
              logger.debug(
                  "training.event.published",
                  StructuredLogging.pipeline(pipeline.getName()),
                  StructuredLogging.kafkaTopic(topic),
                  StructuredLogging.eventType(eventType));
            }
          });
      if (flush) {
        producer.flush();
      }
    } catch (JsonProcessingException | RuntimeException e) {
      failed(pipeline, topic, eventType, e);
    }
  }

  @VisibleForTesting
  Map<String, Object> message(Pipeline pipeline, String eventType, Map<String, Object> fields) {
    Map<String, Object> template = pipeline.getTraining().getKafkaMessageTemplate();
    Map<String, Object> message = new LinkedHashMap<>();
    if (template == null || template.isEmpty()) {
      message.put("event_type", eventType);
      message.put("timestamp", clock.instant().toString());
      message.put("pipeline_name", pipeline.getName());
      message.putAll(fields);
      return message;
    }
    Map<String, String> variables = variables(pipeline, eventType, fields);
    template.forEach(
        (k, v) -> message.put(k, v instanceof String ? substitute((String) v, variables) : v));
    fields.forEach(message::putIfAbsent);
    return message;
  }

  private Map<String, String> variables(
      Pipeline pipeline, String eventType, Map<String, Object> fields) {
    Map<String, String> variables = new LinkedHashMap<>();
    fields.forEach((k, v) -> variables.put(k, render(v)));
    variables.put("event_type", eventType);
    variables.put("pipeline_name", pipeline.getName());
    variables.putIfAbsent("timestamp", clock.instant().toString());
    return variables;
  }

  /** Replaces known {@code {name}} placeholders, leaving unknown ones as written. */
  @VisibleForTesting
  static String substitute(String template, Map<String, String> variables) {
    Matcher matcher = PLACEHOLDER.matcher(template);
    StringBuilder out = new StringBuilder();
    while (matcher.find()) {
      String value = variables.get(matcher.group(1));
      matcher.appendReplacement(
          out, Matcher.quoteReplacement(value == null ? matcher.group() : value));
    }
    matcher.appendTail(out);
    return out.toString();
  }

  private static String render(@Nullable Object value) {
    if (value == null) {
      return "";
    }
    if (value instanceof Duration) {
      return PromDurations.format((Duration) value);
    }
    return value.toString();
  }

  private void failed(Pipeline pipeline, String topic, String eventType, Exception e) {
    infra
        .scope()
        .tagged(ImmutableMap.of(Tags.Key.result, "failure"))
        .counter("training.event.publish")
        .inc(1);
    logger.warn(
        "training.event.publish.failure",
        StructuredLogging.pipeline(pipeline.getName()),
        StructuredLogging.kafkaTopic(topic),
        StructuredLogging.eventType(eventType),
        StructuredLogging.reason(e.getClass().getSimpleName()));
    if (logger.isDebugEnabled()) {
      logger.debug(
          "training.event.publish.failure.cause",
          StructuredLogging.pipeline(pipeline.getName()),
          e);
    }
  }

  private static Producer<String, String> newProducer(String bootstrapServers) {
    Properties properties = new Properties();
    properties.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
    properties.put(ProducerConfig.CLIENT_ID_CONFIG, "openanomaly-training");
    properties.put(ProducerConfig.ACKS_CONFIG, "all");
    properties.put(ProducerConfig.RETRIES_CONFIG, 3);
    properties.put(ProducerConfig.MAX_IN_FLIGHT_REQUESTS_PER_CONNECTION, 1);
    properties.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
    properties.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
    return new KafkaProducer<>(properties);
  }

  @Override
  public void close() {
    producers.values().forEach(Producer::close);
    producers.clear();
  }
}
