package com.afsun.schemagraph.export;

import com.afsun.schemagraph.SchemaFixtures;
import com.afsun.schemagraph.core.inference.DefaultRelationshipInferenceEngine;
import com.afsun.schemagraph.core.model.InferenceResult;
import com.afsun.schemagraph.source.SchemaModelFactory;
import com.afsun.schemagraph.source.dto.SchemaDescription;
import com.afsun.schemagraph.source.dto.TableDescription;
import org.junit.jupiter.api.Test;
import org.yaml.snakeyaml.Yaml;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RelationshipYamlWriterTest {

    @Test
    @SuppressWarnings("unchecked")
    void testWriteRelationshipDocument() {
        InferenceResult result = new DefaultRelationshipInferenceEngine()
                .infer(SchemaModelFactory.create(SchemaFixtures.shop()));

        String yaml = new RelationshipYamlWriter().write(result);
        assertTrue(yaml.startsWith("customers:"));

        Map<String, Object> doc = new Yaml().load(yaml);
        assertEquals(4, doc.size());

        Map<String, Object> customers = (Map<String, Object>) doc.get("customers");
        assertEquals("customer_id", customers.get("primary_key"));
        assertTrue(((List<Object>) customers.get("foreign_keys")).isEmpty());

        Map<String, Object> orders = (Map<String, Object>) doc.get("orders");
        List<Map<String, Object>> fks = (List<Map<String, Object>>) orders.get("foreign_keys");
        assertEquals(1, fks.size());
        assertEquals("customer_id", fks.get(0).get("column"));
        assertEquals("customers.customer_id", fks.get(0).get("references"));
        assertEquals(0.98, (Double) fks.get(0).get("confidence"), 1e-9);
    }

    @Test
    void testNullPrimaryKey() {
        SchemaDescription description = new SchemaDescription("db", Collections.singletonList(
                new TableDescription("logs").column("message", "text", true, false)));
        String yaml = new RelationshipYamlWriter().write(new DefaultRelationshipInferenceEngine()
                .infer(SchemaModelFactory.create(description)));
        assertTrue(yaml.contains("primary_key: null"));
    }
}
