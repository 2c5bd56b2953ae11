/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logql.rest;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.client.node.NodeClient;
import org.opensearch.common.settings.ClusterSettings;
import org.opensearch.core.rest.RestStatus;
import org.opensearch.core.xcontent.XContentBuilder;
import org.opensearch.core.xcontent.XContentParser;
import org.opensearch.logql.LogQLVisualPlugin;
import org.opensearch.logql.lang.builder.LogQLVisualTranslator;
import org.opensearch.logql.lang.visual.VisualQueryResult;
import org.opensearch.rest.BaseRestHandler;
import org.opensearch.rest.BytesRestResponse;
import org.opensearch.rest.RestRequest;

import java.io.IOException;
import java.util.List;

import static org.opensearch.rest.RestRequest.Method.GET;
import static org.opensearch.rest.RestRequest.Method.POST;

/**
 * REST: GET|POST /_logql/visual_query
 *
 * <p>Translates a LogQL query, given as the {@code query} URL parameter or the {@code query} field of a JSON body,
 * into a visual query. The response carries the visual query and the list of constructs it could not represent:</p>
 * <pre>
 * {"query": {"labels": [...], "operations": [...]}, "errors": [...]}
 * </pre>
 * <p>The optional {@code interpolate_variables} parameter overrides the cluster setting for one request.</p>
 */
public class RestLogQLVisualQueryAction extends BaseRestHandler {

    private static final Logger logger = LogManager.getLogger(RestLogQLVisualQueryAction.class);

    public static final String NAME = "logql_visual_query_action";

    // Route path
    private static final String VISUAL_QUERY_PATH = "/_logql/visual_query";

    // Request parameter names
    private static final String QUERY_PARAM = "query";
    private static final String INTERPOLATE_VARIABLES_PARAM = "interpolate_variables";

    // Response field names
    private static final String ERROR_FIELD = "error";

    private volatile boolean interpolateVariables;
    private volatile boolean resetErrorsOnEmptyQuery;

    /**
     * Constructs a new handler.
     *
     * @param clusterSettings cluster settings for accessing dynamic cluster configurations
     */
    public RestLogQLVisualQueryAction(ClusterSettings clusterSettings) {
        this.interpolateVariables = clusterSettings.get(LogQLVisualPlugin.INTERPOLATE_VARIABLES);
        this.resetErrorsOnEmptyQuery = clusterSettings.get(LogQLVisualPlugin.RESET_ERRORS_ON_EMPTY_QUERY);

        clusterSettings.addSettingsUpdateConsumer(LogQLVisualPlugin.INTERPOLATE_VARIABLES, newValue -> {
            this.interpolateVariables = newValue;
            logger.info("Updated interpolate_variables setting to: {}", newValue);
        });
        clusterSettings.addSettingsUpdateConsumer(LogQLVisualPlugin.RESET_ERRORS_ON_EMPTY_QUERY, newValue -> {
            this.resetErrorsOnEmptyQuery = newValue;
            logger.info("Updated reset_errors_on_empty_query setting to: {}", newValue);
        });
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public List<Route> routes() {
        return List.of(new Route(GET, VISUAL_QUERY_PATH), new Route(POST, VISUAL_QUERY_PATH));
    }

    @Override
    protected RestChannelConsumer prepareRequest(RestRequest request, NodeClient client) throws IOException {
        // Consumed first so a rejected request does not also report it as unrecognized
        boolean interpolate = request.paramAsBoolean(INTERPOLATE_VARIABLES_PARAM, interpolateVariables);

        final String query;
        try {
            query = parseQuery(request);
        } catch (IllegalArgumentException e) {
            return errorResponse(e.getMessage());
        }

        if (query == null || query.trim().isEmpty()) {
            return errorResponse("Query cannot be empty");
        }

        LogQLVisualTranslator.Params params = new LogQLVisualTranslator.Params(interpolate, resetErrorsOnEmptyQuery);
        VisualQueryResult result = LogQLVisualTranslator.translate(query, params);
        logger.debug("Visual query for [{}] has {} errors", query, result.errors().size());

        return channel -> {
            XContentBuilder response = channel.newBuilder();
            result.toXContent(response, request);
            channel.sendResponse(new BytesRestResponse(RestStatus.OK, response));
        };
    }

    /**
     * Reads the query from the body if there is one, falling back to the URL parameter.
     */
    private String parseQuery(RestRequest request) throws IOException {
        String urlQuery = request.param(QUERY_PARAM);
        if (!request.hasContent()) {
            return urlQuery;
        }

        String bodyQuery = null;
        try (XContentParser parser = request.contentParser()) {
            if (parser.nextToken() != XContentParser.Token.START_OBJECT) {
                throw new IllegalArgumentException("Request body must be a JSON object");
            }
            XContentParser.Token token;
            while ((token = parser.nextToken()) != XContentParser.Token.END_OBJECT) {
                if (token == XContentParser.Token.FIELD_NAME) {
                    String fieldName = parser.currentName();
                    parser.nextToken();
                    if (QUERY_PARAM.equals(fieldName)) {
                        bodyQuery = parser.textOrNull();
                    } else {
                        throw new IllegalArgumentException("Unknown field [" + fieldName + "] in request body");
                    }
                }
            }
        }
        return bodyQuery != null ? bodyQuery : urlQuery;
    }

    private static RestChannelConsumer errorResponse(String message) {
        return channel -> {
            XContentBuilder response = channel.newErrorBuilder();
            response.startObject();
            response.field(ERROR_FIELD, message);
            response.endObject();
            channel.sendResponse(new BytesRestResponse(RestStatus.BAD_REQUEST, response));
        };
    }
}
