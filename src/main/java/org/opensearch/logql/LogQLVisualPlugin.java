/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logql;

import org.opensearch.cluster.metadata.IndexNameExpressionResolver;
import org.opensearch.cluster.node.DiscoveryNodes;
import org.opensearch.common.settings.ClusterSettings;
import org.opensearch.common.settings.IndexScopedSettings;
import org.opensearch.common.settings.Setting;
import org.opensearch.common.settings.Settings;
import org.opensearch.common.settings.SettingsFilter;
import org.opensearch.logql.rest.RestLogQLVisualQueryAction;
import org.opensearch.plugins.ActionPlugin;
import org.opensearch.plugins.Plugin;
import org.opensearch.rest.RestController;
import org.opensearch.rest.RestHandler;

import java.util.List;
import java.util.function.Supplier;

/**
 * Plugin exposing the LogQL to visual query translation over REST.
 */
public class LogQLVisualPlugin extends Plugin implements ActionPlugin {

    /**
     * Whether template variables such as {@code $__interval} are replaced before parsing and restored in the result.
     */
    public static final Setting<Boolean> INTERPOLATE_VARIABLES = Setting.boolSetting(
        "logql.visual_query.interpolate_variables",
        true,
        Setting.Property.NodeScope,
        Setting.Property.Dynamic
    );

    /**
     * Whether diagnostics are dropped when nothing could be extracted from a query, e.g. while it is being typed.
     */
    public static final Setting<Boolean> RESET_ERRORS_ON_EMPTY_QUERY = Setting.boolSetting(
        "logql.visual_query.reset_errors_on_empty_query",
        true,
        Setting.Property.NodeScope,
        Setting.Property.Dynamic
    );

    /**
     * Default constructor
     */
    public LogQLVisualPlugin() {}

    @Override
    public List<Setting<?>> getSettings() {
        return List.of(INTERPOLATE_VARIABLES, RESET_ERRORS_ON_EMPTY_QUERY);
    }

    @Override
    public List<RestHandler> getRestHandlers(
        Settings settings,
        RestController restController,
        ClusterSettings clusterSettings,
        IndexScopedSettings indexScopedSettings,
        SettingsFilter settingsFilter,
        IndexNameExpressionResolver indexNameExpressionResolver,
        Supplier<DiscoveryNodes> nodesInCluster
    ) {
        return List.of(new RestLogQLVisualQueryAction(clusterSettings));
    }
}
