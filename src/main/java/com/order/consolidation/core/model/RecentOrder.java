package com.order.consolidation.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A recently created order of a customer.
 *
 * @param id           order id
 * @param orderNumber  human-facing order number, may be null
 * @param status       current order status
 * @param createdAt    creation instant
 * @param productNames names of the ordered products, in line order
 */
public record RecentOrder(
        String id,
        String orderNumber,
        OrderStatus status,
        Instant createdAt,
        List<String> productNames
) {
    public RecentOrder {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(status, "status is required");
        Objects.requireNonNull(createdAt, "createdAt is required");
        productNames = productNames != null ? List.copyOf(productNames) : List.of();
    }

    public boolean isPending() {
        return status == OrderStatus.PENDING;
    }

    public int lineCount() {
        return productNames.size();
    }

    /**
     * Age of the order at the given instant. Orders stamped in the future have zero age.
     */
    public Duration ageAt(Instant now) {
        Duration age = Duration.between(createdAt, now);
        return age.isNegative() ? Duration.ZERO : age;
    }
}
