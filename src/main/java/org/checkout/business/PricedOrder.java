package org.checkout.business;

import lombok.AllArgsConstructor;
import lombok.Data;
import org.checkout.domain.OrderLineItem;

import java.math.BigDecimal;
import java.util.List;

/**
 * 计价结果
 */
@Data
@AllArgsConstructor
public class PricedOrder {

    /**
     * 已计价的订单行（不含 orderId）
     */
    private List<OrderLineItem> lineItems;

    private BigDecimal total;

    /**
     * 因商品不存在而被剔除的商品ID
     */
    private List<String> droppedProductIds;

    public boolean isEmpty() {
        return lineItems.isEmpty();
    }
}
