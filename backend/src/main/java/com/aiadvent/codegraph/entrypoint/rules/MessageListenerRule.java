package com.aiadvent.codegraph.entrypoint.rules;

import com.aiadvent.codegraph.entrypoint.domain.EntryPointType;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/** Annotation-driven message consumers: the destination is read from the listed arguments. */
public class MessageListenerRule implements EntryPointRule {

  private final String pattern;
  private final String framework;
  private final Set<String> annotations;
  private final List<String> topicArguments;
  private final double confidence;

  public MessageListenerRule(
      String pattern,
      String framework,
      Set<String> annotations,
      List<String> topicArguments,
      double confidence) {
    this.pattern = pattern;
    this.framework = framework;
    this.annotations = Set.copyOf(annotations);
    this.topicArguments = List.copyOf(topicArguments);
    this.confidence = confidence;
  }

  public static MessageListenerRule kafka() {
    return new MessageListenerRule(
        "kafka_listener",
        "kafka",
        Set.of("KafkaListener", "KafkaHandler"),
        List.of("topics", "topicPattern", "value", "_0"),
        0.9d);
  }

  public static MessageListenerRule rabbit() {
    return new MessageListenerRule(
        "rabbit_listener",
        "rabbitmq",
        Set.of("RabbitListener", "RabbitHandler"),
        List.of("queues", "value", "_0"),
        0.9d);
  }

  public static MessageListenerRule pulsar() {
    return new MessageListenerRule(
        "pulsar_consumer",
        "pulsar",
        Set.of("PulsarListener", "PulsarConsumer"),
        List.of("topics", "topic", "topicPattern", "_0"),
        0.85d);
  }

  public static MessageListenerRule sqs() {
    return new MessageListenerRule(
        "sqs_listener",
        "aws-sqs",
        Set.of("SqsListener"),
        List.of("value", "queueNames", "_0"),
        0.85d);
  }

  @Override
  public String pattern() {
    return pattern;
  }

  @Override
  public Optional<RuleMatch> match(SymbolFacts facts) {
    if (!facts.callable()) {
      return Optional.empty();
    }
    return facts
        .annotation(annotations)
        .map(
            listener -> {
              Map<String, String> metadata = new LinkedHashMap<>();
              String[] keys = topicArguments.toArray(String[]::new);
              String raw = listener.argument(keys);
              if (raw == null) {
                raw = facts.parentAnnotation(annotations).map(a -> a.argument(keys)).orElse(null);
              }
              metadata.put("topic", RuleSupport.rawValue(raw));
              return new RuleMatch(pattern, EntryPointType.EVENT, framework, confidence, metadata);
            });
  }
}
