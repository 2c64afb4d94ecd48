package com.order.consolidation.continuation;

import com.order.consolidation.core.model.RecentOrder;

import java.time.Duration;
import java.util.List;

/**
 * Source of a customer's recently created orders.
 */
@FunctionalInterface
public interface RecentOrdersLookup {

    /**
     * Returns the customer's orders created within the lookback window, in any order and any status.
     *
     * @param customerId the customer
     * @param lookback   how far back to look
     */
    List<RecentOrder> findRecentOrders(String customerId, Duration lookback);
}
