package com.challenges.treenav.json;

import com.challenges.treenav.tree.ChildrenProducer;
import com.challenges.treenav.tree.NilParameterException;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * Object fields in document order, array elements by index. Scalars have no children.
 */
public class JsonChildren implements ChildrenProducer<JsonEntry> {

    @Override
    public MutableList<JsonEntry> childrenOf(JsonEntry entry) throws NilParameterException {
        if (entry == null) {
            throw new NilParameterException("element");
        }

        MutableList<JsonEntry> children = Lists.mutable.empty();
        if (entry.value() instanceof JsonNode.JsonObject obj) {
            obj.fields().forEachKeyValue((key, value) -> children.add(new JsonEntry(key, value)));
        } else if (entry.value() instanceof JsonNode.JsonArray arr) {
            arr.elements().forEachWithIndex((value, index) -> children.add(new JsonEntry(JsonEntry.indexName(index), value)));
        }
        return children;
    }
}
