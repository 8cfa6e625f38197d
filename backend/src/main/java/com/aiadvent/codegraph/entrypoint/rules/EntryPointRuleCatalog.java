package com.aiadvent.codegraph.entrypoint.rules;

import java.util.List;

public final class EntryPointRuleCatalog {

  private EntryPointRuleCatalog() {}

  /** Built-in rules in evaluation order. Earlier rules win confidence ties. */
  public static List<EntryPointRule> defaultRules() {
    return List.of(
        new SpringRequestMappingRule(),
        new SpringRestControllerRule(),
        new JaxRsResourceMethodRule(),
        new KtorRoutingRule(),
        new FlaskRouteRule(),
        new FastApiRouteRule(),
        new ExpressRouteRule(),
        new RustWebRouteRule(),
        MessageListenerRule.kafka(),
        MessageListenerRule.rabbit(),
        MessageListenerRule.pulsar(),
        MessageListenerRule.sqs(),
        new CeleryTaskRule(),
        new CamelRouteBuilderRule(),
        new ScheduledAnnotationRule(),
        new ApSchedulerJobRule());
  }
}
