package org.checkout.business;

import lombok.extern.slf4j.Slf4j;
import org.checkout.domain.CartLine;
import org.checkout.domain.OrderLineItem;
import org.checkout.domain.Product;
import org.checkout.service.ICatalogService;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 订单计价
 * <p>
 * 规则：
 * 1. 逐行读取商品当前价格并快照到订单行
 * 2. 商品已不在目录中的行直接剔除（记录WARN日志），不中断结算
 * 3. 全程使用 BigDecimal 定点计算，total = Σ(unitPrice × quantity)
 */
@Slf4j
@Component
public class OrderPricer {

    public static final int MONEY_SCALE = 2;

    private final ICatalogService catalogService;

    public OrderPricer(ICatalogService catalogService) {
        this.catalogService = catalogService;
    }

    public PricedOrder price(String userId, List<CartLine> lines) {
        List<OrderLineItem> lineItems = new ArrayList<>();
        List<String> droppedProductIds = new ArrayList<>();
        BigDecimal total = BigDecimal.ZERO.setScale(MONEY_SCALE);

        for (CartLine line : lines) {
            Optional<Product> product = catalogService.findProduct(line.getProductId());
            if (product.isEmpty() || !isSellable(product.get())) {
                log.warn("[商品不存在，剔除购物车行] userId={}, productId={}, quantity={}",
                        userId, line.getProductId(), line.getQuantity());
                droppedProductIds.add(line.getProductId());
                continue;
            }

            BigDecimal unitPrice = normalize(product.get().getPrice());
            BigDecimal subtotal = unitPrice.multiply(BigDecimal.valueOf(line.getQuantity()));
            lineItems.add(OrderLineItem.builder()
                    .lineNo(lineItems.size() + 1)
                    .productId(line.getProductId())
                    .productName(product.get().getName())
                    .quantity(line.getQuantity())
                    .unitPrice(unitPrice)
                    .subtotal(subtotal)
                    .build());
            total = total.add(subtotal);
        }

        log.debug("[计价完成] userId={}, lines={}, dropped={}, total={}",
                userId, lineItems.size(), droppedProductIds.size(), total);
        return new PricedOrder(lineItems, total, droppedProductIds);
    }

    private boolean isSellable(Product product) {
        return product.getPrice() != null && product.getPrice().signum() >= 0;
    }

    /**
     * 金额至少保留两位小数，只补零不舍入
     */
    static BigDecimal normalize(BigDecimal amount) {
        return amount.scale() < MONEY_SCALE ? amount.setScale(MONEY_SCALE) : amount;
    }
}
