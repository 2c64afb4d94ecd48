package com.order.consolidation.api;

import com.order.consolidation.core.model.OrderRequest;

/**
 * Creates the real order from a consolidated session.
 */
@FunctionalInterface
public interface OrderGateway {

    /**
     * Creates the order.
     *
     * @return the id of the created order, or null if none was created
     */
    String createOrder(OrderRequest request);
}
