module dev.mars.alertflow.builder {
    requires transitive dev.mars.alertflow.workflow;
    requires org.slf4j;
    requires io.opentelemetry.api;

    exports dev.mars.alertflow.builder;
    exports dev.mars.alertflow.builder.graph;
    exports dev.mars.alertflow.builder.history;
    exports dev.mars.alertflow.builder.observability;
}
