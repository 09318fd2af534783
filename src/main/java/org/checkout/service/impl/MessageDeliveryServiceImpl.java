package org.checkout.service.impl;

import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import lombok.extern.slf4j.Slf4j;
import org.checkout.domain.MessageDelivery;
import org.checkout.mapper.MessageDeliveryMapper;
import org.checkout.service.IMessageDeliveryService;
import org.checkout.util.TimeUtil;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 消息投递服务实现
 * <p>
 * 消息状态机：PENDING -> SENT -> CONFIRMED，投递失败超过最大次数后为 FAILED
 * SENT 状态的消息若迟迟未被确认，到期后同样会被重发（消费方按幂等处理）
 */
@Slf4j
@Service
public class MessageDeliveryServiceImpl extends ServiceImpl<MessageDeliveryMapper, MessageDelivery>
        implements IMessageDeliveryService {

    private static final int MAX_RETRIES = 5;
    // 初始重试延迟（秒），按 2^n 指数退避
    private static final int INITIAL_RETRY_DELAY = 30;

    private final Clock clock;

    public MessageDeliveryServiceImpl(Clock clock) {
        this.clock = clock;
    }

    @Override
    public MessageDelivery savePendingMessage(String messageId, String messageType,
                                              String messageContent, String targetQueue, String traceId) {
        LocalDateTime now = TimeUtil.now(clock);
        MessageDelivery delivery = MessageDelivery.builder()
                .messageId(messageId)
                .messageType(messageType)
                .messageContent(messageContent)
                .targetQueue(targetQueue)
                .traceId(traceId)
                .status("PENDING")
                .deliveryCount(0)
                .maxRetries(MAX_RETRIES)
                .nextRetryTime(now)
                .createTime(now)
                .updateTime(now)
                .build();

        this.save(delivery);
        log.info("[消息保存] messageId={}, messageType={}, traceId={}", messageId, messageType, traceId);
        return delivery;
    }

    @Override
    public void markAsSent(String messageId) {
        MessageDelivery delivery = findByMessageId(messageId);
        if (delivery == null) {
            log.warn("[消息不存在] messageId={}", messageId);
            return;
        }
        // 消费方可能先于发送方完成确认
        if ("CONFIRMED".equals(delivery.getStatus())) {
            return;
        }
        LocalDateTime now = TimeUtil.now(clock);
        int deliveryCount = delivery.getDeliveryCount() + 1;
        delivery.setStatus("SENT");
        delivery.setDeliveryCount(deliveryCount);
        // 等待消费确认，超时未确认则重发
        delivery.setNextRetryTime(now.plusSeconds(backoffSeconds(deliveryCount)));
        delivery.setUpdateTime(now);
        this.updateById(delivery);
        log.info("[消息已发送] messageId={}, deliveryCount={}", messageId, deliveryCount);
    }

    @Override
    public void markAsConfirmed(String messageId) {
        MessageDelivery delivery = findByMessageId(messageId);
        if (delivery == null) {
            log.warn("[消息不存在] messageId={}", messageId);
            return;
        }
        delivery.setStatus("CONFIRMED");
        delivery.setUpdateTime(TimeUtil.now(clock));
        this.updateById(delivery);
        log.info("[消息已确认] messageId={}", messageId);
    }

    @Override
    public void markAsFailedAndRetry(String messageId, String errorMessage) {
        MessageDelivery delivery = findByMessageId(messageId);
        if (delivery == null) {
            log.warn("[消息不存在] messageId={}", messageId);
            return;
        }
        LocalDateTime now = TimeUtil.now(clock);
        int deliveryCount = delivery.getDeliveryCount() + 1;
        delivery.setDeliveryCount(deliveryCount);
        delivery.setErrorMessage(errorMessage);

        if (deliveryCount >= delivery.getMaxRetries()) {
            delivery.setStatus("FAILED");
            log.error("[消息投递失败，超过最大重试次数] messageId={}, deliveryCount={}, maxRetries={}, errorMsg={}",
                    messageId, deliveryCount, delivery.getMaxRetries(), errorMessage);
        } else {
            long delaySeconds = backoffSeconds(deliveryCount);
            delivery.setNextRetryTime(now.plusSeconds(delaySeconds));
            log.warn("[消息重试安排] messageId={}, nextRetryTime={}秒后, deliveryCount={}/{}",
                    messageId, delaySeconds, deliveryCount, delivery.getMaxRetries());
        }

        delivery.setUpdateTime(now);
        this.updateById(delivery);
    }

    @Override
    public List<MessageDelivery> getPendingRetryMessages() {
        return this.lambdaQuery()
                .in(MessageDelivery::getStatus, "PENDING", "SENT")
                .le(MessageDelivery::getNextRetryTime, TimeUtil.now(clock))
                .apply("delivery_count < max_retries")
                .list();
    }

    private MessageDelivery findByMessageId(String messageId) {
        return this.lambdaQuery()
                .eq(MessageDelivery::getMessageId, messageId)
                .one();
    }

    private long backoffSeconds(int deliveryCount) {
        return INITIAL_RETRY_DELAY * (long) Math.pow(2, Math.max(0, deliveryCount - 1));
    }
}
