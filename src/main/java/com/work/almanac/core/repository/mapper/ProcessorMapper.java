package com.work.almanac.core.repository.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.work.almanac.core.repository.entity.ProcessorEntity;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

public interface ProcessorMapper extends BaseMapper<ProcessorEntity> {

    String COLUMNS = "id, chain, contract_address, owner, max_gas_per_message, message_timeout_blocks, " +
            "retry_interval_blocks, max_retry_count, paused, created_at_block, created_at_tx, last_updated_block, last_updated_tx";

    @Select("SELECT " + COLUMNS + " FROM processors WHERE id = #{id}")
    ProcessorEntity selectByProcessorId(@Param("id") String id);

    /**
     * 同一个处理器的事件按区块顺序应用；旧高度的事件不会覆盖新状态。
     */
    @Insert("INSERT INTO processors(" + COLUMNS + ") VALUES(#{id}, #{chain}, #{contractAddress}, #{owner}, " +
            "#{maxGasPerMessage}, #{messageTimeoutBlocks}, #{retryIntervalBlocks}, #{maxRetryCount}, #{paused}, " +
            "#{createdAtBlock}, #{createdAtTx}, #{lastUpdatedBlock}, #{lastUpdatedTx}) " +
            "ON CONFLICT(id) DO UPDATE SET owner = EXCLUDED.owner, max_gas_per_message = EXCLUDED.max_gas_per_message, " +
            "message_timeout_blocks = EXCLUDED.message_timeout_blocks, retry_interval_blocks = EXCLUDED.retry_interval_blocks, " +
            "max_retry_count = EXCLUDED.max_retry_count, paused = EXCLUDED.paused, " +
            "last_updated_block = EXCLUDED.last_updated_block, last_updated_tx = EXCLUDED.last_updated_tx " +
            "WHERE processors.last_updated_block <= EXCLUDED.last_updated_block")
    int upsert(ProcessorEntity entity);
}
