package com.order.consolidation.catalog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.order.consolidation.core.model.CatalogEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Imports catalog entries from a JSON array of product records.
 *
 * <pre>
 * [
 *   {"id": "p1", "name": "Leche", "unit_price": "25.00", "aliases": ["leches"]},
 *   {"id": "p2", "name": "Coca Cola 600ml", "unit_price": 18.5, "in_stock": true}
 * ]
 * </pre>
 *
 * <p>Field names are snake_case. A record that fails validation is reported in the
 * result and the import continues with the next one.</p>
 */
public class JsonCatalogImporter {
    private static final Logger log = LoggerFactory.getLogger(JsonCatalogImporter.class);

    private final ObjectMapper objectMapper;

    public JsonCatalogImporter() {
        this(new ObjectMapper());
    }

    public JsonCatalogImporter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public CatalogImportResult importCatalog(InputStream input) {
        try {
            return importTree(objectMapper.readTree(input));
        } catch (IOException e) {
            throw new CatalogImportException("Unable to read catalog: " + e.getMessage(), e);
        }
    }

    public CatalogImportResult importCatalog(Reader reader) {
        try {
            return importTree(objectMapper.readTree(reader));
        } catch (IOException e) {
            throw new CatalogImportException("Unable to read catalog: " + e.getMessage(), e);
        }
    }

    public CatalogImportResult importCatalog(String json) {
        try {
            return importTree(objectMapper.readTree(json));
        } catch (JsonProcessingException e) {
            throw new CatalogImportException("Unable to parse catalog: " + e.getOriginalMessage(), e);
        }
    }

    private CatalogImportResult importTree(JsonNode root) {
        if (root == null || !root.isArray()) {
            throw new CatalogImportException("Catalog document must be a JSON array");
        }
        List<CatalogEntry> entries = new ArrayList<>();
        List<CatalogImportResult.ImportError> errors = new ArrayList<>();

        for (int i = 0; i < root.size(); i++) {
            JsonNode record = root.get(i);
            String recordId = text(record, "id");
            try {
                entries.add(toEntry(record));
            } catch (RuntimeException e) {
                errors.add(new CatalogImportResult.ImportError(i, recordId, e.getMessage()));
                log.warn("catalog.import.rejected index={} id={} error={}", i, recordId, e.getMessage());
            }
        }

        CatalogImportResult result = new CatalogImportResult(entries, errors);
        log.info("catalog.import.completed result={}", result);
        return result;
    }

    private CatalogEntry toEntry(JsonNode record) {
        if (!record.isObject()) {
            throw new IllegalArgumentException("record must be a JSON object");
        }
        CatalogEntry.Builder builder = CatalogEntry.builder()
                .id(text(record, "id"))
                .name(text(record, "name"))
                .sku(text(record, "sku"))
                .brand(text(record, "brand"))
                .price(decimal(record, "unit_price"))
                .aliases(strings(record, "aliases"))
                .keywords(strings(record, "keywords"))
                .trainingPhrases(strings(record, "ai_training_examples"))
                .misspellings(strings(record, "common_misspellings"))
                .sizeVariants(strings(record, "size_variants"));

        String unit = text(record, "unit");
        if (unit != null) {
            builder.unit(unit);
        }
        String category = text(record, "category");
        if (category != null) {
            builder.category(category);
        }
        if (record.hasNonNull("stock_quantity")) {
            builder.stockQuantity(integer(record, "stock_quantity"));
        }
        if (record.hasNonNull("in_stock")) {
            builder.inStock(bool(record, "in_stock"));
        }
        if (record.hasNonNull("active")) {
            builder.active(bool(record, "active"));
        }
        if (record.hasNonNull("minimum_order_quantity")) {
            builder.minimumOrderQuantity(integer(record, "minimum_order_quantity"));
        }
        return builder.build();
    }

    private static String text(JsonNode record, String field) {
        JsonNode node = record.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isContainerNode()) {
            throw new IllegalArgumentException(field + " must be a scalar");
        }
        return node.asText();
    }

    private static BigDecimal decimal(JsonNode record, String field) {
        JsonNode node = record.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.decimalValue();
        }
        if (node.isTextual()) {
            try {
                return new BigDecimal(node.asText().trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(field + " is not a number: " + node.asText(), e);
            }
        }
        throw new IllegalArgumentException(field + " must be a number");
    }

    private static int integer(JsonNode record, String field) {
        JsonNode node = record.get(field);
        if (node.isTextual()) {
            try {
                return Integer.parseInt(node.asText().trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(field + " must be an integer", e);
            }
        }
        if (!node.isIntegralNumber() || !node.canConvertToInt()) {
            throw new IllegalArgumentException(field + " must be an integer");
        }
        return node.intValue();
    }

    private static boolean bool(JsonNode record, String field) {
        JsonNode node = record.get(field);
        if (!node.isBoolean()) {
            throw new IllegalArgumentException(field + " must be a boolean");
        }
        return node.booleanValue();
    }

    private static List<String> strings(JsonNode record, String field) {
        JsonNode node = record.get(field);
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new IllegalArgumentException(field + " must be an array of strings");
        }
        List<String> values = new ArrayList<>();
        for (JsonNode element : node) {
            if (!element.isNull()) {
                values.add(element.asText());
            }
        }
        return values;
    }
}
