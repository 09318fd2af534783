package org.checkout.controller;

import lombok.extern.slf4j.Slf4j;
import org.checkout.domain.Order;
import org.checkout.exception.NotFoundException;
import org.checkout.service.IOrderService;
import org.checkout.util.ResponseUtil;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * 订单查询控制器
 *
 * API：
 * - GET /orders/{orderId} - 查询订单（含订单行价格快照）
 */
@Slf4j
@RestController
@RequestMapping("/orders")
public class OrderController {

    private final IOrderService orderService;
    private final String defaultUserId;

    public OrderController(IOrderService orderService,
                           @Value("${checkout.default-user-id:demo-user}") String defaultUserId) {
        this.orderService = orderService;
        this.defaultUserId = defaultUserId;
    }

    /**
     * 查询订单
     *
     * 只能查询当前用户自己的订单，他人订单与不存在的订单一样返回 404
     */
    @GetMapping("/{orderId}")
    public ResponseEntity<Map<String, Object>> getOrder(
            @RequestHeader(value = UserContext.USER_ID_HEADER, required = false) String userHeader,
            @PathVariable String orderId) {
        String userId = UserContext.resolve(userHeader, defaultUserId);
        Order order = orderService.findOrder(orderId)
                .filter(o -> userId.equals(o.getUserId()))
                .orElseThrow(() -> new NotFoundException("订单", orderId));
        return ResponseEntity.ok(ResponseUtil.success("查询成功", order));
    }
}
