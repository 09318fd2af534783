package org.checkout.mq;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.checkout.config.RabbitMQConfig;
import org.checkout.domain.MessageDelivery;
import org.checkout.domain.Order;
import org.checkout.event.OrderCompletedEvent;
import org.checkout.service.IMessageDeliveryService;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * 订单事件发布器
 * - 事务消息：先保存消息到 message_delivery，再发送到MQ
 * - MQ发送失败时消息保留在数据库中，由 MessageRetryTask 重发
 * - 发布失败只记录日志，不影响已完成的订单
 */
@Slf4j
@Component
public class OrderEventPublisher {

    public static final String ORDER_COMPLETED = "ORDER_COMPLETED";

    private final RabbitTemplate rabbitTemplate;
    private final IMessageDeliveryService messageDeliveryService;
    private final ObjectMapper objectMapper;
    private final boolean enabled;

    public OrderEventPublisher(@Autowired(required = false) RabbitTemplate rabbitTemplate,
                               IMessageDeliveryService messageDeliveryService,
                               ObjectMapper objectMapper,
                               @Value("${checkout.events.enabled:false}") boolean enabled) {
        this.rabbitTemplate = rabbitTemplate;
        this.messageDeliveryService = messageDeliveryService;
        this.objectMapper = objectMapper;
        this.enabled = enabled;
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * 发布订单完成事件
     * <p>
     * messageId 由 orderId 推导，续完订单时重复发布会命中唯一约束而被忽略
     *
     * @param order      已完成的订单
     * @param productIds 本次结算消耗的商品ID
     */
    public void publishOrderCompletedEvent(Order order, List<String> productIds) {
        if (!enabled) {
            log.debug("[订单事件未启用] orderId={}", order.getOrderId());
            return;
        }

        String messageId = buildMessageId(order.getOrderId());
        try {
            OrderCompletedEvent event = OrderCompletedEvent.builder()
                    .messageId(messageId)
                    .orderId(order.getOrderId())
                    .userId(order.getUserId())
                    .total(order.getTotal().toPlainString())
                    .productIds(new ArrayList<>(productIds))
                    .orderCreateTime(order.getCreateTime().toString())
                    .traceId(order.getTraceId())
                    .timestamp(System.currentTimeMillis())
                    .build();

            // ==================== 1. 保存消息到数据库 ====================
            messageDeliveryService.savePendingMessage(
                    messageId,
                    ORDER_COMPLETED,
                    objectMapper.writeValueAsString(event),
                    RabbitMQConfig.ORDER_COMPLETED_QUEUE,
                    order.getTraceId()
            );

            // ==================== 2. 发送消息到MQ ====================
            send(event);

        } catch (DuplicateKeyException e) {
            log.info("[订单完成事件已存在] messageId={}, orderId={}", messageId, order.getOrderId());
        } catch (Exception e) {
            log.error("[订单完成事件发布失败] 等待定时任务重试, orderId={}, messageId={}, errorMsg={}",
                    order.getOrderId(), messageId, e.getMessage(), e);
        }
    }

    /**
     * 重发一条已落库的消息，失败时抛出异常由调用方安排下一次重试
     */
    public void resend(MessageDelivery delivery) throws JsonProcessingException {
        OrderCompletedEvent event = objectMapper.readValue(delivery.getMessageContent(), OrderCompletedEvent.class);
        if (!send(event)) {
            throw new IllegalStateException("RabbitMQ 未启用，无法重发消息: " + delivery.getMessageId());
        }
    }

    private boolean send(OrderCompletedEvent event) {
        if (rabbitTemplate == null) {
            log.warn("[RabbitMQ 未启用] 消息已保存到数据库，等待后续处理, messageId={}, orderId={}",
                    event.getMessageId(), event.getOrderId());
            return false;
        }
        rabbitTemplate.convertAndSend(
                RabbitMQConfig.ORDER_COMPLETED_EXCHANGE,
                RabbitMQConfig.ORDER_COMPLETED_ROUTING_KEY,
                event,
                message -> {
                    message.getMessageProperties().setHeader("messageId", event.getMessageId());
                    return message;
                }
        );
        messageDeliveryService.markAsSent(event.getMessageId());
        log.info("[订单完成事件已发送] messageId={}, orderId={}, traceId={}",
                event.getMessageId(), event.getOrderId(), event.getTraceId());
        return true;
    }

    static String buildMessageId(String orderId) {
        return UUID.nameUUIDFromBytes((ORDER_COMPLETED + ":" + orderId).getBytes(StandardCharsets.UTF_8)).toString();
    }
}
