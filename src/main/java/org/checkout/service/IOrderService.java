package org.checkout.service;

import org.checkout.domain.Order;
import org.checkout.domain.OrderStatus;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * 订单服务接口（只追加）
 */
public interface IOrderService {

    /**
     * 写入PENDING订单（订单头 + 订单行）
     *
     * @param order 订单，lineItems 不能为空
     * @throws org.springframework.dao.DuplicateKeyException orderId 已存在
     */
    void createPendingOrder(Order order);

    /**
     * 查询订单（含订单行）
     */
    Optional<Order> findOrder(String orderId);

    /**
     * 订单状态条件更新
     *
     * @return true: 本次更新成功；false: 当前状态不是expected
     */
    boolean compareAndSetStatus(String orderId, OrderStatus expected, OrderStatus target);

    /**
     * 查询某时间之后创建的已完成订单（不含订单行）
     */
    List<Order> listCompletedSince(LocalDateTime since);

    /**
     * 查询某时间之前创建、仍为PENDING的订单（不含订单行）
     */
    List<Order> listPendingBefore(LocalDateTime before);
}
