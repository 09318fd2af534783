package org.checkout.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.core.*;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.amqp.support.converter.Jackson2JsonMessageConverter;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * RabbitMQ 配置类
 * - 定义订单完成事件所需的Exchange、Queue、Binding
 * - 消费失败的消息进入死信队列，延迟后回到主队列重试
 * - 仅在 spring.rabbitmq.listener.simple.enabled=true 时启用
 */
@Slf4j
@Configuration
@ConditionalOnProperty(name = "spring.rabbitmq.listener.simple.enabled", havingValue = "true", matchIfMissing = false)
public class RabbitMQConfig {

    // ==================== 订单完成事件 ====================

    public static final String ORDER_COMPLETED_EXCHANGE = "order.completed.exchange";
    public static final String ORDER_COMPLETED_QUEUE = "order.completed.queue";
    public static final String ORDER_COMPLETED_ROUTING_KEY = "order.completed";

    // 死信交换机/队列（延迟重试）
    public static final String ORDER_COMPLETED_DLX_EXCHANGE = "order.completed.dlx.exchange";
    public static final String ORDER_COMPLETED_DLX_QUEUE = "order.completed.dlx.queue";
    public static final String ORDER_COMPLETED_DLX_ROUTING_KEY = "order.completed.dlx";

    @Bean
    public DirectExchange orderCompletedExchange() {
        return new DirectExchange(ORDER_COMPLETED_EXCHANGE, true, false);
    }

    @Bean
    public Queue orderCompletedQueue() {
        return QueueBuilder.durable(ORDER_COMPLETED_QUEUE)
                .deadLetterExchange(ORDER_COMPLETED_DLX_EXCHANGE)
                .deadLetterRoutingKey(ORDER_COMPLETED_DLX_ROUTING_KEY)
                .build();
    }

    @Bean
    public Binding orderCompletedBinding(Queue orderCompletedQueue, DirectExchange orderCompletedExchange) {
        return BindingBuilder.bind(orderCompletedQueue)
                .to(orderCompletedExchange)
                .with(ORDER_COMPLETED_ROUTING_KEY);
    }

    @Bean
    public DirectExchange orderCompletedDlxExchange() {
        return new DirectExchange(ORDER_COMPLETED_DLX_EXCHANGE, true, false);
    }

    @Bean
    public Queue orderCompletedDlxQueue() {
        return QueueBuilder.durable(ORDER_COMPLETED_DLX_QUEUE)
                // 10秒后回到主队列
                .deadLetterExchange(ORDER_COMPLETED_EXCHANGE)
                .deadLetterRoutingKey(ORDER_COMPLETED_ROUTING_KEY)
                .ttl(10000)
                .build();
    }

    @Bean
    public Binding orderCompletedDlxBinding(Queue orderCompletedDlxQueue, DirectExchange orderCompletedDlxExchange) {
        return BindingBuilder.bind(orderCompletedDlxQueue)
                .to(orderCompletedDlxExchange)
                .with(ORDER_COMPLETED_DLX_ROUTING_KEY);
    }

    @Bean
    public Jackson2JsonMessageConverter jsonMessageConverter() {
        return new Jackson2JsonMessageConverter();
    }

    /**
     * 配置RabbitTemplate：JSON消息体 + 发送者确认回调
     */
    @Bean
    public RabbitTemplate rabbitTemplate(ConnectionFactory connectionFactory,
                                         Jackson2JsonMessageConverter jsonMessageConverter) {
        RabbitTemplate rabbitTemplate = new RabbitTemplate(connectionFactory);
        rabbitTemplate.setMessageConverter(jsonMessageConverter);
        rabbitTemplate.setConfirmCallback((correlationData, ack, cause) -> {
            if (!ack) {
                log.warn("[消息发送未确认] correlationData={}, cause={}", correlationData, cause);
            }
        });
        return rabbitTemplate;
    }
}
