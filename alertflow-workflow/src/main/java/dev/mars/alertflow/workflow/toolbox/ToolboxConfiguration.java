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

package dev.mars.alertflow.workflow.toolbox;

import dev.mars.alertflow.provider.InstalledProvider;
import dev.mars.alertflow.provider.ProviderCatalog;
import dev.mars.alertflow.provider.ProviderDescriptor;
import dev.mars.alertflow.workflow.model.ConditionType;
import dev.mars.alertflow.workflow.model.TaskRole;
import dev.mars.alertflow.workflow.model.TriggerType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Palette of node templates an editor offers, derived from the provider catalog.
 * <p>
 * Groups are, in order: {@code Triggers}, {@code Steps}, {@code Actions}, {@code Misc} and
 * {@code Conditions}. Providers with installed configurations contribute one template per
 * installation, named after it; other providers contribute a single {@code <type>-step} or
 * {@code <type>-action} template.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-02-19
 */
public class ToolboxConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(ToolboxConfiguration.class);

    public static final String TRIGGERS_GROUP = "Triggers";
    public static final String STEPS_GROUP = "Steps";
    public static final String ACTIONS_GROUP = "Actions";
    public static final String MISC_GROUP = "Misc";
    public static final String CONDITIONS_GROUP = "Conditions";

    private final List<ToolboxGroup> groups;

    private ToolboxConfiguration(List<ToolboxGroup> groups) {
        this.groups = List.copyOf(groups);
    }

    public static ToolboxConfiguration fromCatalog(ProviderCatalog catalog) {
        Objects.requireNonNull(catalog, "Provider catalog cannot be null");

        List<NodeTemplate> triggers = new ArrayList<>();
        for (TriggerType type : TriggerType.values()) {
            triggers.add(NodeTemplate.trigger(type));
        }

        List<NodeTemplate> steps = new ArrayList<>();
        for (ProviderDescriptor provider : catalog.getQueryProviders()) {
            steps.addAll(taskTemplates(catalog, provider, TaskRole.STEP));
        }

        List<NodeTemplate> actions = new ArrayList<>();
        for (ProviderDescriptor provider : catalog.getNotifyProviders()) {
            actions.addAll(taskTemplates(catalog, provider, TaskRole.ACTION));
        }

        List<NodeTemplate> conditions = new ArrayList<>();
        for (ConditionType type : ConditionType.values()) {
            conditions.add(NodeTemplate.condition(type));
        }

        List<ToolboxGroup> groups = List.of(
                new ToolboxGroup(TRIGGERS_GROUP, triggers),
                new ToolboxGroup(STEPS_GROUP, steps),
                new ToolboxGroup(ACTIONS_GROUP, actions),
                new ToolboxGroup(MISC_GROUP, List.of(NodeTemplate.foreach())),
                new ToolboxGroup(CONDITIONS_GROUP, conditions));

        logger.debug("Built toolbox with {} step and {} action templates", steps.size(), actions.size());
        return new ToolboxConfiguration(groups);
    }

    private static List<NodeTemplate> taskTemplates(ProviderCatalog catalog, ProviderDescriptor provider, TaskRole role) {
        List<NodeTemplate> templates = new ArrayList<>();
        for (InstalledProvider installed : catalog.getInstalled()) {
            if (provider.getType().equals(installed.type())) {
                templates.add(NodeTemplate.task(role, provider.getType(), installed.name(),
                        provider.getQueryParams(), provider.getNotifyParams(), installed.name()));
            }
        }
        if (templates.isEmpty()) {
            templates.add(NodeTemplate.task(role, provider.getType(),
                    provider.getType() + "-" + role.getPrefix(),
                    provider.getQueryParams(), provider.getNotifyParams(), null));
        }
        return templates;
    }

    public List<ToolboxGroup> getGroups() {
        return groups;
    }

    public Optional<ToolboxGroup> getGroup(String name) {
        return groups.stream().filter(g -> g.name().equals(name)).findFirst();
    }

    /**
     * First template of the given type name, e.g. {@code action-slack} or {@code interval}.
     */
    public Optional<NodeTemplate> findTemplate(String typeName) {
        return groups.stream()
                .flatMap(g -> g.templates().stream())
                .filter(t -> t.getTypeName().equals(typeName))
                .findFirst();
    }
}
