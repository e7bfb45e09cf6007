package com.vigil.service.core.query;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Stable string encoding of a query, used as the result cache key. Properties are sorted by name, sets are
 * sorted by value, null filters are omitted and the query type prefixes the JSON, so equal queries always
 * produce the same key and different ones never collide.
 */
public final class QueryKeyCanonicalizer {

    private static final ObjectMapper CANONICAL_JSON = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .configure(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY, true)
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .serializationInclusion(JsonInclude.Include.NON_NULL)
            .build();

    private QueryKeyCanonicalizer() {}

    public static String toKey(DataQuery query) {
        JsonNode tree = CANONICAL_JSON.valueToTree(query);
        return query.type().name() + ":" + normalize(tree);
    }

    private static JsonNode normalize(JsonNode node) {
        if (node.isObject()) {
            ObjectNode sorted = CANONICAL_JSON.createObjectNode();
            List<Map.Entry<String, JsonNode>> fields = new ArrayList<>();
            node.fields().forEachRemaining(fields::add);
            fields.sort(Map.Entry.comparingByKey());
            for (Map.Entry<String, JsonNode> field : fields) {
                sorted.set(field.getKey(), normalize(field.getValue()));
            }
            return sorted;
        }
        if (node.isArray()) {
            List<JsonNode> elements = new ArrayList<>();
            for (Iterator<JsonNode> it = node.elements(); it.hasNext(); ) {
                elements.add(normalize(it.next()));
            }
            elements.sort(Comparator.comparing(JsonNode::toString));
            ArrayNode array = CANONICAL_JSON.createArrayNode();
            elements.forEach(array::add);
            return array;
        }
        return node;
    }
}
