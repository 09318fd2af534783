package org.checkout.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import lombok.extern.slf4j.Slf4j;
import org.checkout.domain.Order;
import org.checkout.domain.OrderLineItem;
import org.checkout.domain.OrderStatus;
import org.checkout.mapper.OrderLineItemMapper;
import org.checkout.mapper.OrderMapper;
import org.checkout.service.IOrderService;
import org.checkout.util.TimeUtil;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Slf4j
@Service
public class OrderServiceImpl extends ServiceImpl<OrderMapper, Order> implements IOrderService {

    private final OrderLineItemMapper orderLineItemMapper;
    private final Clock clock;

    public OrderServiceImpl(OrderLineItemMapper orderLineItemMapper, Clock clock) {
        this.orderLineItemMapper = orderLineItemMapper;
        this.clock = clock;
    }

    /**
     * 订单头和订单行在同一个本地事务中写入，对外表现为一条订单记录
     */
    @Override
    @Transactional(rollbackFor = Exception.class)
    public void createPendingOrder(Order order) {
        baseMapper.insert(order);
        for (OrderLineItem item : order.getLineItems()) {
            item.setOrderId(order.getOrderId());
            orderLineItemMapper.insert(item);
        }
        log.info("[订单已写入] orderId={}, status={}, lines={}, total={}",
                order.getOrderId(), order.getStatus(), order.getLineItems().size(), order.getTotal());
    }

    @Override
    public Optional<Order> findOrder(String orderId) {
        Order order = baseMapper.selectById(orderId);
        if (order == null) {
            return Optional.empty();
        }
        order.setLineItems(orderLineItemMapper.selectList(new LambdaQueryWrapper<OrderLineItem>()
                .eq(OrderLineItem::getOrderId, orderId)
                .orderByAsc(OrderLineItem::getLineNo)));
        return Optional.of(order);
    }

    @Override
    public boolean compareAndSetStatus(String orderId, OrderStatus expected, OrderStatus target) {
        int updated = baseMapper.compareAndSetStatus(orderId, expected, target, TimeUtil.now(clock));
        log.debug("[订单状态更新] orderId={}, {}->{}, updated={}", orderId, expected, target, updated);
        return updated == 1;
    }

    @Override
    public List<Order> listCompletedSince(LocalDateTime since) {
        return this.lambdaQuery()
                .eq(Order::getStatus, OrderStatus.COMPLETED)
                .ge(Order::getCreateTime, since)
                .list();
    }

    @Override
    public List<Order> listPendingBefore(LocalDateTime before) {
        return this.lambdaQuery()
                .eq(Order::getStatus, OrderStatus.PENDING)
                .lt(Order::getCreateTime, before)
                .list();
    }
}
