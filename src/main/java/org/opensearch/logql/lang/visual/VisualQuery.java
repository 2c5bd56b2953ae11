/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logql.lang.visual;

import org.opensearch.core.xcontent.ToXContentObject;
import org.opensearch.core.xcontent.XContentBuilder;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Editable representation of a LogQL query: stream labels, a pipeline of operations in source order, and
 * queries joined to it by binary operators.
 *
 * <p>Instances are filled in while a query is translated and are not thread-safe.</p>
 */
public class VisualQuery implements ToXContentObject {

    private final List<LabelFilter> labels = new ArrayList<>();
    private final List<Operation> operations = new ArrayList<>();
    private final List<BinaryQuery> binaryQueries = new ArrayList<>();

    public VisualQuery() {}

    public void addLabel(LabelFilter label) {
        labels.add(label);
    }

    public void addOperation(Operation operation) {
        operations.add(operation);
    }

    public void addBinaryQuery(BinaryQuery binaryQuery) {
        binaryQueries.add(binaryQuery);
    }

    public List<LabelFilter> getLabels() {
        return Collections.unmodifiableList(labels);
    }

    public List<Operation> getOperations() {
        return Collections.unmodifiableList(operations);
    }

    public List<BinaryQuery> getBinaryQueries() {
        return Collections.unmodifiableList(binaryQueries);
    }

    /**
     * A query is empty when nothing could be extracted into labels or operations.
     * @return true if there are no labels and no operations
     */
    public boolean isEmpty() {
        return labels.isEmpty() && operations.isEmpty();
    }

    @Override
    public XContentBuilder toXContent(XContentBuilder builder, Params params) throws IOException {
        builder.startObject();
        builder.startArray("labels");
        for (LabelFilter label : labels) {
            label.toXContent(builder, params);
        }
        builder.endArray();
        builder.startArray("operations");
        for (Operation operation : operations) {
            operation.toXContent(builder, params);
        }
        builder.endArray();
        if (!binaryQueries.isEmpty()) {
            builder.startArray("binaryQueries");
            for (BinaryQuery binaryQuery : binaryQueries) {
                binaryQuery.toXContent(builder, params);
            }
            builder.endArray();
        }
        builder.endObject();
        return builder;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        VisualQuery that = (VisualQuery) o;
        return labels.equals(that.labels) && operations.equals(that.operations) && binaryQueries.equals(that.binaryQueries);
    }

    @Override
    public int hashCode() {
        return Objects.hash(labels, operations, binaryQueries);
    }

    @Override
    public String toString() {
        return "VisualQuery{labels=" + labels + ", operations=" + operations + ", binaryQueries=" + binaryQueries + "}";
    }
}
