package com.ethnicthv.domain.sample;

import com.ethnicthv.domain.annotation.EnumerationType;
import com.ethnicthv.domain.enumeration.Enumeration;

@EnumerationType
public class OrderStatus extends Enumeration {
    public static final OrderStatus SHIPPED = new OrderStatus(3, "Shipped");
    public static final OrderStatus PENDING = new OrderStatus(1, "Pending");
    public static final OrderStatus PAID = new OrderStatus(2, "Paid");
    public static final OrderStatus CANCELLED = new OrderStatus(-1, "Cancelled");

    public static final OrderStatus DEFAULT = PENDING;

    // kept for reading old records only
    private static final OrderStatus ARCHIVED = new OrderStatus(9, "Archived");

    private OrderStatus(int value, String name) {
        super(value, name);
    }

    public boolean isTerminal() {
        return this == SHIPPED || this == CANCELLED || this == ARCHIVED;
    }
}
