package org.checkout.service;

import org.checkout.domain.MessageDelivery;

import java.util.List;

/**
 * 消息投递服务接口
 */
public interface IMessageDeliveryService {

    /**
     * 保存待投递消息
     *
     * @param messageId      消息ID
     * @param messageType    消息类型
     * @param messageContent 消息内容
     * @param targetQueue    目标队列
     * @param traceId        追踪ID
     * @return MessageDelivery
     */
    MessageDelivery savePendingMessage(String messageId, String messageType,
                                       String messageContent, String targetQueue, String traceId);

    /**
     * 标记消息为已发送
     */
    void markAsSent(String messageId);

    /**
     * 标记消息为已确认（消费方处理完成）
     */
    void markAsConfirmed(String messageId);

    /**
     * 标记消息为失败并安排重试
     */
    void markAsFailedAndRetry(String messageId, String errorMessage);

    /**
     * 获取到期待重试的消息列表
     */
    List<MessageDelivery> getPendingRetryMessages();
}
