package com.tracura.plm.domain;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Itemised budget line of a department.
 */
public record DepartmentLineItem(
    String itemType,
    String item,
    String spec,
    BigDecimal quantity,
    String uom,
    BigDecimal unitPrice
) {
    public DepartmentLineItem {
        itemType = Objects.requireNonNullElse(itemType, "");
        item = Objects.requireNonNullElse(item, "");
        spec = Objects.requireNonNullElse(spec, "");
        uom = Objects.requireNonNullElse(uom, "");
        quantity = Objects.requireNonNullElse(quantity, BigDecimal.ZERO);
        unitPrice = Objects.requireNonNullElse(unitPrice, BigDecimal.ZERO);
    }

    public static DepartmentLineItem of(String item, BigDecimal quantity, String uom, BigDecimal unitPrice) {
        return new DepartmentLineItem("", item, "", quantity, uom, unitPrice);
    }

    public BigDecimal total() {
        return quantity.multiply(unitPrice);
    }
}
