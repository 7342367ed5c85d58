package com.purchasingpower.itemgraph.normalize;

import com.purchasingpower.itemgraph.core.NodeKind;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Field table of one ingested node kind.
 *
 * <p>{@code categoryField} names the field feeding the taxonomy; kinds without one
 * are never linked to a Category.
 *
 * @since 1.0.0
 */
@Value
@Builder
public class NodeSchema {

    NodeKind kind;
    String identifierField;
    String categoryField;

    @Singular
    List<FieldRule> fields;

    public boolean hasCategory() {
        return categoryField != null;
    }
}
