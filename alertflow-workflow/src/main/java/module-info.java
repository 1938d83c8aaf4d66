module dev.mars.alertflow.workflow {
    requires transitive dev.mars.alertflow.core;
    requires org.slf4j;
    // Third-party libraries used in main sources
    requires org.yaml.snakeyaml;
    requires com.fasterxml.jackson.databind;
    requires io.opentelemetry.api;

    exports dev.mars.alertflow.workflow;
    exports dev.mars.alertflow.workflow.model;
    exports dev.mars.alertflow.workflow.validation;
    exports dev.mars.alertflow.workflow.toolbox;
    exports dev.mars.alertflow.workflow.observability;
}
