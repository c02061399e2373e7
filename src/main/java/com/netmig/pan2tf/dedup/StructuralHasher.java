package com.netmig.pan2tf.dedup;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.netmig.pan2tf.model.Category;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Order-independent SHA-256 over an object's category, name, content fields and
 * resolved references. Metadata fields are left out; map keys and list
 * elements are sorted before hashing, so source ordering never changes the result.
 */
public class StructuralHasher {

    private final ObjectMapper mapper;

    public StructuralHasher() {
        this.mapper = new ObjectMapper();
        this.mapper.configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
    }

    public String hash(Category category, String name, Map<String, Object> fields, List<String> references) {
        Map<String, Object> content = new TreeMap<>(fields);
        content.keySet().removeAll(Category.METADATA_FIELDS);

        Map<String, Object> document = new TreeMap<>();
        document.put("category", category.name());
        document.put("name", name);
        document.put("fields", canonical(content));
        List<String> sortedReferences = new ArrayList<>(references);
        sortedReferences.sort(Comparator.naturalOrder());
        document.put("references", sortedReferences);

        try {
            byte[] json = mapper.writeValueAsBytes(document);
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(json));
        } catch (JsonProcessingException | NoSuchAlgorithmException e) {
            throw new IllegalStateException("Cannot hash " + category.getToken() + " '" + name + "'", e);
        }
    }

    @SuppressWarnings("unchecked")
    private Object canonical(Object value) {
        if (value instanceof Map) {
            Map<String, Object> sorted = new TreeMap<>();
            for (Map.Entry<String, Object> entry : ((Map<String, Object>) value).entrySet()) {
                sorted.put(entry.getKey(), canonical(entry.getValue()));
            }
            return sorted;
        }
        if (value instanceof List) {
            List<Object> elements = new ArrayList<>();
            for (Object element : (List<Object>) value) {
                elements.add(canonical(element));
            }
            elements.sort(Comparator.comparing(this::sortKey));
            return elements;
        }
        return value;
    }

    private String sortKey(Object element) {
        if (element instanceof String) {
            return (String) element;
        }
        try {
            return mapper.writeValueAsString(element);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot order list element " + element, e);
        }
    }
}
