package com.order.consolidation.core.model;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

/**
 * Immutable snapshot of one sellable catalog product.
 * Built once at the ingress boundary; matching code reads only these fields.
 */
public record CatalogEntry(
        String id,
        String name,
        String sku,
        String unit,
        BigDecimal price,
        int stockQuantity,
        boolean inStock,
        boolean active,
        String brand,
        String category,
        int minimumOrderQuantity,
        List<String> aliases,
        List<String> keywords,
        List<String> trainingPhrases,
        List<String> misspellings,
        List<String> sizeVariants
) {
    public CatalogEntry {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(name, "name is required");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        if (price != null && price.signum() < 0) {
            throw new IllegalArgumentException("price must be non-negative");
        }
        if (stockQuantity < 0) {
            throw new IllegalArgumentException("stockQuantity must be non-negative");
        }
        unit = unit != null ? unit : "units";
        category = category != null ? category : "";
        aliases = copyOf(aliases);
        keywords = copyOf(keywords);
        trainingPhrases = copyOf(trainingPhrases);
        misspellings = copyOf(misspellings);
        sizeVariants = copyOf(sizeVariants);
    }

    /**
     * Returns true if the entry can be offered to a customer.
     */
    public boolean isAvailable() {
        return active && inStock;
    }

    private static List<String> copyOf(List<String> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream().filter(Objects::nonNull).toList();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String name;
        private String sku;
        private String unit;
        private BigDecimal price;
        private int stockQuantity;
        private boolean inStock = true;
        private boolean active = true;
        private String brand;
        private String category;
        private int minimumOrderQuantity = 1;
        private List<String> aliases;
        private List<String> keywords;
        private List<String> trainingPhrases;
        private List<String> misspellings;
        private List<String> sizeVariants;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder sku(String sku) {
            this.sku = sku;
            return this;
        }

        public Builder unit(String unit) {
            this.unit = unit;
            return this;
        }

        public Builder price(BigDecimal price) {
            this.price = price;
            return this;
        }

        public Builder price(String price) {
            this.price = new BigDecimal(price);
            return this;
        }

        public Builder stockQuantity(int stockQuantity) {
            this.stockQuantity = stockQuantity;
            return this;
        }

        public Builder inStock(boolean inStock) {
            this.inStock = inStock;
            return this;
        }

        public Builder active(boolean active) {
            this.active = active;
            return this;
        }

        public Builder brand(String brand) {
            this.brand = brand;
            return this;
        }

        public Builder category(String category) {
            this.category = category;
            return this;
        }

        public Builder minimumOrderQuantity(int minimumOrderQuantity) {
            this.minimumOrderQuantity = minimumOrderQuantity;
            return this;
        }

        public Builder aliases(List<String> aliases) {
            this.aliases = aliases;
            return this;
        }

        public Builder aliases(String... aliases) {
            this.aliases = List.of(aliases);
            return this;
        }

        public Builder keywords(List<String> keywords) {
            this.keywords = keywords;
            return this;
        }

        public Builder keywords(String... keywords) {
            this.keywords = List.of(keywords);
            return this;
        }

        public Builder trainingPhrases(List<String> trainingPhrases) {
            this.trainingPhrases = trainingPhrases;
            return this;
        }

        public Builder trainingPhrases(String... trainingPhrases) {
            this.trainingPhrases = List.of(trainingPhrases);
            return this;
        }

        public Builder misspellings(List<String> misspellings) {
            this.misspellings = misspellings;
            return this;
        }

        public Builder misspellings(String... misspellings) {
            this.misspellings = List.of(misspellings);
            return this;
        }

        public Builder sizeVariants(List<String> sizeVariants) {
            this.sizeVariants = sizeVariants;
            return this;
        }

        public Builder sizeVariants(String... sizeVariants) {
            this.sizeVariants = List.of(sizeVariants);
            return this;
        }

        public CatalogEntry build() {
            return new CatalogEntry(id, name, sku, unit, price, stockQuantity, inStock, active,
                    brand, category, minimumOrderQuantity, aliases, keywords, trainingPhrases,
                    misspellings, sizeVariants);
        }
    }
}
