package com.e2eq.cnl.schema;

import com.e2eq.cnl.schema.SchemaRegistry.*;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.*;

/**
 * Computes a stable hash of a set of type definitions by canonicalizing to sorted JSON.
 * Used as the schema version reported to clients.
 */
public final class SchemaHasher {
    private SchemaHasher() {}

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

    public static String computeHash(SchemaDefs defs) {
        try {
            String json = MAPPER.writeValueAsString(canonicalize(defs));
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] hash = md.digest(json.getBytes(StandardCharsets.UTF_8));
            return bytesToHex(hash);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to compute schema hash", e);
        }
    }

    private static Map<String, Object> canonicalize(SchemaDefs defs) {
        Map<String, Object> result = new TreeMap<>();

        Map<String, Object> nodeTypes = new TreeMap<>();
        for (NodeTypeDef t : defs.nodeTypes().values()) {
            Map<String, Object> data = new TreeMap<>();
            data.put("description", t.description());
            data.put("parentTypes", new TreeSet<>(t.parentTypes()));
            nodeTypes.put(t.name(), data);
        }
        result.put("nodeTypes", nodeTypes);

        Map<String, Object> relationTypes = new TreeMap<>();
        for (RelationTypeDef r : defs.relationTypes().values()) {
            Map<String, Object> data = new TreeMap<>();
            data.put("description", r.description());
            data.put("domain", new TreeSet<>(r.domain()));
            data.put("range", new TreeSet<>(r.range()));
            data.put("symmetric", r.symmetric());
            data.put("transitive", r.transitive());
            data.put("inverseName", r.inverseName().orElse(null));
            relationTypes.put(r.name(), data);
        }
        result.put("relationTypes", relationTypes);

        Map<String, Object> attributeTypes = new TreeMap<>();
        for (AttributeTypeDef a : defs.attributeTypes().values()) {
            Map<String, Object> data = new TreeMap<>();
            data.put("description", a.description());
            data.put("dataType", a.dataType().jsonName());
            data.put("unit", a.unit().orElse(null));
            data.put("allowedValues", new TreeSet<>(a.allowedValues()));
            attributeTypes.put(a.name(), data);
        }
        result.put("attributeTypes", attributeTypes);

        return result;
    }

    private static String bytesToHex(byte[] bytes) {
        StringBuilder sb = new StringBuilder();
        for (byte b : bytes) {
            sb.append(String.format("%02x", b));
        }
        return sb.toString();
    }
}
