module dev.mars.alertflow.core {
    requires org.slf4j;
    requires com.fasterxml.jackson.annotation;
    requires com.fasterxml.jackson.databind;

    // Public API exports
    exports dev.mars.alertflow.config;
    exports dev.mars.alertflow.exceptions;
    exports dev.mars.alertflow.provider;

    // Provider catalog entries are bound by Jackson
    opens dev.mars.alertflow.provider to com.fasterxml.jackson.databind;
}
