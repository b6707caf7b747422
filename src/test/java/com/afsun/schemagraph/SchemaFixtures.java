package com.afsun.schemagraph;

import com.afsun.schemagraph.source.dto.SchemaDescription;
import com.afsun.schemagraph.source.dto.TableDescription;

import java.util.ArrayList;
import java.util.Arrays;

/**
 * 测试用Schema描述
 */
public final class SchemaFixtures {

    private SchemaFixtures() {
    }

    /**
     * customers / orders / products / order_items，无声明外键
     */
    public static SchemaDescription shop() {
        return new SchemaDescription("shop", new ArrayList<>(Arrays.asList(
                new TableDescription("customers")
                        .column("customer_id", "int", false, true)
                        .column("name", "varchar(64)", true, false),
                new TableDescription("orders")
                        .column("order_id", "int", false, true)
                        .column("customer_id", "int", true, false)
                        .column("status", "varchar(16)", true, false),
                new TableDescription("products")
                        .column("product_id", "int", false, true)
                        .column("title", "varchar(128)", true, false),
                new TableDescription("order_items")
                        .column("item_id", "int", false, true)
                        .column("order_id", "int", true, false)
                        .column("product_id", "int", true, false))));
    }
}
