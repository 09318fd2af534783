package org.checkout.service;

import org.checkout.domain.IdempotencyRecord;

import java.util.Optional;

/**
 * 幂等记录服务接口
 */
public interface IIdempotencyRecordService {

    Optional<IdempotencyRecord> findRecord(String recordKey);

    /**
     * 占有幂等键（仅在键不存在时写入）
     *
     * @return true: 占有成功；false: 键已被占有，记录保持不变
     */
    boolean claim(IdempotencyRecord record);
}
