package org.checkout.business;

import lombok.extern.slf4j.Slf4j;
import org.checkout.domain.Order;
import org.checkout.domain.OrderStatus;
import org.checkout.service.ICartService;
import org.checkout.service.IOrderService;
import org.checkout.util.TimeUtil;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 购物车对账
 * <p>
 * 1. 对回溯窗口内有已完成订单的用户，删除最后修改时间不晚于其最新订单创建时间的购物车行
 * 2. 长时间停留在 PENDING 的订单置为 FAILED（条件更新，不会覆盖并发完成的订单）
 */
@Slf4j
@Service
public class CartReconciliationService {

    private final IOrderService orderService;
    private final ICartService cartService;
    private final Clock clock;
    private final long lookbackHours;
    private final long pendingExpiryMinutes;

    public CartReconciliationService(IOrderService orderService,
                                     ICartService cartService,
                                     Clock clock,
                                     @Value("${checkout.reconcile.lookback-hours:24}") long lookbackHours,
                                     @Value("${checkout.reconcile.pending-expiry-minutes:15}") long pendingExpiryMinutes) {
        this.orderService = orderService;
        this.cartService = cartService;
        this.clock = clock;
        this.lookbackHours = lookbackHours;
        this.pendingExpiryMinutes = pendingExpiryMinutes;
    }

    public ReconciliationResult reconcile() {
        LocalDateTime now = TimeUtil.now(clock);
        ReconciliationResult result = new ReconciliationResult();
        clearStaleCartLines(now, result);
        expireAbandonedOrders(now, result);
        log.info("[对账完成] usersScanned={}, clearedLines={}, failedUsers={}, expiredOrders={}",
                result.getUsersScanned(), result.getClearedLines(),
                result.getFailedUsers(), result.getExpiredOrders());
        return result;
    }

    private void clearStaleCartLines(LocalDateTime now, ReconciliationResult result) {
        List<Order> completedOrders = orderService.listCompletedSince(now.minusHours(lookbackHours));

        // 每个用户只需要最新一笔已完成订单的创建时间
        Map<String, LocalDateTime> latestOrderTimeByUser = completedOrders.stream()
                .collect(Collectors.toMap(Order::getUserId, Order::getCreateTime,
                        (a, b) -> a.isAfter(b) ? a : b));

        result.setUsersScanned(latestOrderTimeByUser.size());
        for (Map.Entry<String, LocalDateTime> entry : latestOrderTimeByUser.entrySet()) {
            String userId = entry.getKey();
            try {
                int deleted = cartService.deleteLinesNotModifiedAfter(userId, entry.getValue());
                if (deleted > 0) {
                    log.info("[对账清理购物车] userId={}, cutoff={}, deleted={}", userId, entry.getValue(), deleted);
                }
                result.setClearedLines(result.getClearedLines() + deleted);
            } catch (RuntimeException e) {
                result.setFailedUsers(result.getFailedUsers() + 1);
                log.error("[对账清理失败] userId={}, error={}", userId, e.getMessage(), e);
            }
        }
    }

    private void expireAbandonedOrders(LocalDateTime now, ReconciliationResult result) {
        List<Order> staleOrders = orderService.listPendingBefore(now.minusMinutes(pendingExpiryMinutes));
        for (Order order : staleOrders) {
            if (orderService.compareAndSetStatus(order.getOrderId(), OrderStatus.PENDING, OrderStatus.FAILED)) {
                result.setExpiredOrders(result.getExpiredOrders() + 1);
                log.warn("[订单超时未完成，置为FAILED] orderId={}, userId={}, createTime={}",
                        order.getOrderId(), order.getUserId(), order.getCreateTime());
            }
        }
    }
}
