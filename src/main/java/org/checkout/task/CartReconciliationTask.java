package org.checkout.task;

import lombok.extern.slf4j.Slf4j;
import org.checkout.business.CartReconciliationService;
import org.checkout.util.DistributedLockUtil;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * 购物车对账定时任务
 * 同一时刻只允许一个节点执行
 */
@Slf4j
@Component
@EnableScheduling
public class CartReconciliationTask {

    private static final String LOCK_KEY = "task:cart-reconcile";

    private final CartReconciliationService reconciliationService;

    public CartReconciliationTask(CartReconciliationService reconciliationService) {
        this.reconciliationService = reconciliationService;
    }

    @Scheduled(fixedDelayString = "${checkout.reconcile.fixed-delay-ms:60000}",
            initialDelayString = "${checkout.reconcile.initial-delay-ms:10000}")
    public void reconcile() {
        if (!DistributedLockUtil.tryLock(LOCK_KEY, 0, 5, TimeUnit.MINUTES)) {
            log.debug("[对账任务] 其他节点正在执行");
            return;
        }
        try {
            reconciliationService.reconcile();
        } catch (Exception e) {
            log.error("[对账任务异常] errorMsg={}", e.getMessage(), e);
        } finally {
            DistributedLockUtil.unlock(LOCK_KEY);
        }
    }
}
