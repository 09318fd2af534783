package org.checkout.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.checkout.domain.IdempotencyRecord;

@Mapper
public interface IdempotencyRecordMapper extends BaseMapper<IdempotencyRecord> {

    /**
     * 占有幂等键：键已存在时不做任何修改
     *
     * @return 1表示本次占有成功，0表示已被他人占有
     */
    @Insert("""
            INSERT INTO idempotency_record (record_key, user_id, idempotency_key, order_id, create_time)
            VALUES (#{recordKey}, #{userId}, #{idempotencyKey}, #{orderId}, #{createTime})
            ON CONFLICT (record_key) DO NOTHING
            """)
    int insertIfAbsent(IdempotencyRecord record);
}
