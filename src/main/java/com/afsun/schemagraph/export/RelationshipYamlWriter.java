package com.afsun.schemagraph.export;

import com.afsun.schemagraph.core.model.InferenceResult;
import com.afsun.schemagraph.core.model.Relationship;
import com.afsun.schemagraph.core.model.TableRelationships;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 将推断结果输出为YAML：
 * <pre>
 * orders:
 *   primary_key: order_id
 *   foreign_keys:
 *   - column: customer_id
 *     references: customers.customer_id
 *     confidence: 0.98
 * </pre>
 *
 * @author afsun
 */
public class RelationshipYamlWriter {

    public String write(InferenceResult result) {
        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        options.setIndent(2);
        options.setPrettyFlow(true);
        return new Yaml(options).dump(toDocument(result));
    }

    public Map<String, Object> toDocument(InferenceResult result) {
        Map<String, Object> doc = new LinkedHashMap<>();
        for (TableRelationships tr : result.getTables().values()) {
            Map<String, Object> table = new LinkedHashMap<>();
            table.put("primary_key", tr.getPrimaryKey());
            List<Map<String, Object>> fks = new ArrayList<>();
            for (Relationship r : tr.getForeignKeys()) {
                Map<String, Object> fk = new LinkedHashMap<>();
                fk.put("column", r.getSourceColumn());
                fk.put("references", r.references());
                fk.put("confidence", r.getConfidence());
                fks.add(fk);
            }
            table.put("foreign_keys", fks);
            doc.put(tr.getTable(), table);
        }
        return doc;
    }
}
