package org.checkout.service.impl;

import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import lombok.extern.slf4j.Slf4j;
import org.checkout.domain.IdempotencyRecord;
import org.checkout.mapper.IdempotencyRecordMapper;
import org.checkout.service.IIdempotencyRecordService;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Slf4j
@Service
public class IdempotencyRecordServiceImpl extends ServiceImpl<IdempotencyRecordMapper, IdempotencyRecord>
        implements IIdempotencyRecordService {

    @Override
    public Optional<IdempotencyRecord> findRecord(String recordKey) {
        return Optional.ofNullable(baseMapper.selectById(recordKey));
    }

    @Override
    public boolean claim(IdempotencyRecord record) {
        boolean claimed = baseMapper.insertIfAbsent(record) == 1;
        log.debug("[幂等键占有] recordKey={}, orderId={}, claimed={}",
                record.getRecordKey(), record.getOrderId(), claimed);
        return claimed;
    }
}
