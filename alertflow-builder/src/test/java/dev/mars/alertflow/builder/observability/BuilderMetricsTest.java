/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.alertflow.builder.observability;

import dev.mars.alertflow.builder.WorkflowBuilderStore;
import dev.mars.alertflow.config.AlertflowConfiguration;
import dev.mars.alertflow.provider.ProviderCatalog;
import dev.mars.alertflow.workflow.model.TriggerType;
import dev.mars.alertflow.workflow.toolbox.NodeTemplate;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Description for BuilderMetricsTest
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-02-19
 */
class BuilderMetricsTest {

    @Test
    void testSingleton() {
        assertSame(BuilderMetrics.getInstance(), BuilderMetrics.getInstance());
    }

    @Test
    void testStoreRecordsMutationsAndRejections() {
        Properties properties = new Properties();
        properties.setProperty(AlertflowConfiguration.METRICS_ENABLED, "true");
        WorkflowBuilderStore store = new WorkflowBuilderStore(ProviderCatalog.empty(),
                new AlertflowConfiguration(properties));
        BuilderMetrics metrics = BuilderMetrics.getInstance();
        long mutations = metrics.getMutationCount();
        long rejections = metrics.getRejectionCount();

        store.addNodeBetween("etrigger_start-trigger_end", NodeTemplate.trigger(TriggerType.MANUAL));
        store.addNodeBetween("etrigger_start-manual", NodeTemplate.trigger(TriggerType.MANUAL));

        assertEquals(mutations + 1, metrics.getMutationCount());
        assertEquals(rejections + 1, metrics.getRejectionCount());
    }
}
