package com.rainmaker.schema.codegen.discovery;

import com.rainmaker.schema.codegen.model.Cardinality;
import com.rainmaker.schema.model.ArrayNode;
import com.rainmaker.schema.model.ObjectNode;
import com.rainmaker.schema.model.SchemaNode;
import com.rainmaker.schema.model.SchemaNodes;

/**
 * The object a field points at and how many of them it holds.
 *
 * A field points at an object when, after stripping Optional, Nullable and
 * Lazy layers, it is either an object or an array whose element is an
 * object. Deeper list nesting is stored as Json and is not a relation.
 */
public record RelationShape(ObjectNode target, Cardinality cardinality) {

    public static RelationShape of(SchemaNode field) {
        SchemaNode unwrapped = SchemaNodes.unwrap(field);
        if (unwrapped instanceof ObjectNode object) {
            return new RelationShape(object, Cardinality.ONE);
        }
        if (unwrapped instanceof ArrayNode array && SchemaNodes.unwrap(array.getElement()) instanceof ObjectNode element) {
            return new RelationShape(element, Cardinality.MANY);
        }
        return null;
    }
}
