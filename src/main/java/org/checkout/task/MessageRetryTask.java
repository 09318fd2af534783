package org.checkout.task;

import lombok.extern.slf4j.Slf4j;
import org.checkout.domain.MessageDelivery;
import org.checkout.mq.OrderEventPublisher;
import org.checkout.service.IMessageDeliveryService;
import org.checkout.util.DistributedLockUtil;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * 消息重试定时任务
 * - 定期查询到期未确认的消息
 * - 重新发送到MQ，失败则按指数退避安排下一次
 */
@Slf4j
@Component
@EnableScheduling
public class MessageRetryTask {

    private static final String LOCK_KEY = "task:message-retry";

    private final IMessageDeliveryService messageDeliveryService;
    private final OrderEventPublisher orderEventPublisher;

    public MessageRetryTask(IMessageDeliveryService messageDeliveryService,
                            OrderEventPublisher orderEventPublisher) {
        this.messageDeliveryService = messageDeliveryService;
        this.orderEventPublisher = orderEventPublisher;
    }

    @Scheduled(fixedDelayString = "${checkout.events.retry-fixed-delay-ms:30000}",
            initialDelayString = "${checkout.events.retry-initial-delay-ms:5000}")
    public void retryFailedMessages() {
        if (!orderEventPublisher.isEnabled()) {
            return;
        }
        if (!DistributedLockUtil.tryLock(LOCK_KEY, 0, 5, TimeUnit.MINUTES)) {
            log.debug("[消息重试任务] 其他节点正在执行");
            return;
        }
        try {
            List<MessageDelivery> pendingMessages = messageDeliveryService.getPendingRetryMessages();
            if (pendingMessages.isEmpty()) {
                log.debug("[消息重试任务] 没有待重试的消息");
                return;
            }

            for (MessageDelivery delivery : pendingMessages) {
                try {
                    log.info("[消息重试] messageId={}, messageType={}, deliveryCount={}, traceId={}",
                            delivery.getMessageId(), delivery.getMessageType(),
                            delivery.getDeliveryCount(), delivery.getTraceId());
                    orderEventPublisher.resend(delivery);
                } catch (Exception e) {
                    log.error("[消息重试失败] messageId={}, errorMsg={}, traceId={}",
                            delivery.getMessageId(), e.getMessage(), delivery.getTraceId(), e);
                    messageDeliveryService.markAsFailedAndRetry(delivery.getMessageId(), e.getMessage());
                }
            }

            log.debug("[消息重试任务] 执行完成，共处理{}条消息", pendingMessages.size());

        } catch (Exception e) {
            log.error("[消息重试任务异常] errorMsg={}", e.getMessage(), e);
        } finally {
            DistributedLockUtil.unlock(LOCK_KEY);
        }
    }
}
