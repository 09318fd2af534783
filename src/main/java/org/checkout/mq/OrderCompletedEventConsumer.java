package org.checkout.mq;

import lombok.extern.slf4j.Slf4j;
import org.checkout.config.RabbitMQConfig;
import org.checkout.event.OrderCompletedEvent;
import org.checkout.service.ICartService;
import org.checkout.service.IMessageDeliveryService;
import org.checkout.util.TraceIdUtil;
import org.springframework.amqp.AmqpRejectAndDontRequeueException;
import org.springframework.amqp.rabbit.annotation.RabbitListener;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;

/**
 * 订单完成事件消费者
 * - 按订单快照再次清理购物车行（条件删除，天然幂等）
 * - 处理失败的消息进入死信队列，延迟后回到主队列
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "spring.rabbitmq.listener.simple.enabled", havingValue = "true", matchIfMissing = false)
public class OrderCompletedEventConsumer {

    private final ICartService cartService;
    private final IMessageDeliveryService messageDeliveryService;

    public OrderCompletedEventConsumer(ICartService cartService,
                                       IMessageDeliveryService messageDeliveryService) {
        this.cartService = cartService;
        this.messageDeliveryService = messageDeliveryService;
    }

    @RabbitListener(queues = RabbitMQConfig.ORDER_COMPLETED_QUEUE)
    public void consumeOrderCompletedEvent(OrderCompletedEvent event,
                                           @Header(name = "messageId", required = false) String messageId) {
        String resolvedMessageId = messageId != null ? messageId : event.getMessageId();
        TraceIdUtil.setTraceId(event.getTraceId());

        log.info("[消费订单完成事件] messageId={}, orderId={}, userId={}",
                resolvedMessageId, event.getOrderId(), event.getUserId());

        try {
            LocalDateTime cutoff = LocalDateTime.parse(event.getOrderCreateTime());
            int cleared = 0;
            for (String productId : event.getProductIds()) {
                if (cartService.deleteLineIfNotModifiedAfter(event.getUserId(), productId, cutoff)) {
                    cleared++;
                }
            }
            log.info("[订单完成事件处理完成] orderId={}, cleared={}", event.getOrderId(), cleared);

            messageDeliveryService.markAsConfirmed(resolvedMessageId);

        } catch (Exception e) {
            log.error("[订单完成事件处理失败] messageId={}, orderId={}, errorMsg={}",
                    resolvedMessageId, event.getOrderId(), e.getMessage(), e);
            throw new AmqpRejectAndDontRequeueException("处理订单完成事件失败", e);
        } finally {
            TraceIdUtil.clearTraceId();
        }
    }
}
