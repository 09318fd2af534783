package org.checkout.support;

import org.checkout.domain.Order;
import org.checkout.domain.OrderLineItem;
import org.checkout.domain.OrderStatus;
import org.checkout.service.IOrderService;
import org.springframework.dao.DuplicateKeyException;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 内存版订单存储，读写都做拷贝，行为与数据库一致
 */
public class InMemoryOrderService implements IOrderService {

    private final Map<String, Order> orders = new LinkedHashMap<>();
    private RuntimeException nextStatusFlipFailure;

    /**
     * 下一次状态更新抛出指定异常，模拟写入订单后崩溃
     */
    public synchronized void failNextStatusFlipWith(RuntimeException failure) {
        this.nextStatusFlipFailure = failure;
    }

    public synchronized int count() {
        return orders.size();
    }

    public synchronized long countWithStatus(OrderStatus status) {
        return orders.values().stream().filter(o -> o.getStatus() == status).count();
    }

    @Override
    public synchronized void createPendingOrder(Order order) {
        if (orders.containsKey(order.getOrderId())) {
            throw new DuplicateKeyException("duplicate order_id " + order.getOrderId());
        }
        orders.put(order.getOrderId(), copy(order));
    }

    @Override
    public synchronized Optional<Order> findOrder(String orderId) {
        return Optional.ofNullable(orders.get(orderId)).map(InMemoryOrderService::copy);
    }

    @Override
    public synchronized boolean compareAndSetStatus(String orderId, OrderStatus expected, OrderStatus target) {
        if (nextStatusFlipFailure != null) {
            RuntimeException failure = nextStatusFlipFailure;
            nextStatusFlipFailure = null;
            throw failure;
        }
        Order order = orders.get(orderId);
        if (order == null || order.getStatus() != expected) {
            return false;
        }
        order.setStatus(target);
        return true;
    }

    @Override
    public synchronized List<Order> listCompletedSince(LocalDateTime since) {
        return orders.values().stream()
                .filter(o -> o.getStatus() == OrderStatus.COMPLETED && !o.getCreateTime().isBefore(since))
                .map(InMemoryOrderService::copy)
                .collect(Collectors.toList());
    }

    @Override
    public synchronized List<Order> listPendingBefore(LocalDateTime before) {
        return orders.values().stream()
                .filter(o -> o.getStatus() == OrderStatus.PENDING && o.getCreateTime().isBefore(before))
                .map(InMemoryOrderService::copy)
                .collect(Collectors.toList());
    }

    private static Order copy(Order order) {
        List<OrderLineItem> items = new ArrayList<>();
        if (order.getLineItems() != null) {
            for (OrderLineItem item : order.getLineItems()) {
                items.add(OrderLineItem.builder()
                        .orderId(order.getOrderId())
                        .lineNo(item.getLineNo())
                        .productId(item.getProductId())
                        .productName(item.getProductName())
                        .quantity(item.getQuantity())
                        .unitPrice(item.getUnitPrice())
                        .subtotal(item.getSubtotal())
                        .build());
            }
        }
        return Order.builder()
                .orderId(order.getOrderId())
                .userId(order.getUserId())
                .total(order.getTotal())
                .status(order.getStatus())
                .idempotencyKey(order.getIdempotencyKey())
                .droppedProductIds(order.getDroppedProductIds() == null
                        ? null : new ArrayList<>(order.getDroppedProductIds()))
                .traceId(order.getTraceId())
                .createTime(order.getCreateTime())
                .updateTime(order.getUpdateTime())
                .lineItems(items)
                .build();
    }
}
