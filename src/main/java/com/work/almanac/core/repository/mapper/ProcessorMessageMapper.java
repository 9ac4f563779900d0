package com.work.almanac.core.repository.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.work.almanac.core.repository.entity.ProcessorMessageEntity;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.time.Instant;
import java.util.List;

/**
 * 跨链消息 Mapper。
 *
 * 所有状态迁移都是带前置状态条件的 UPDATE，返回 1 表示本次迁移生效，0 表示前置条件不满足（已被其他迁移抢先）。
 */
public interface ProcessorMessageMapper extends BaseMapper<ProcessorMessageEntity> {

    String COLUMNS = "id, processor_id, source_chain, target_chain, sender, payload, status, created_at_block, created_at_tx, " +
            "last_updated_block, processed_at_block, processed_at_tx, retry_count, next_retry_block, gas_used, error, created_at, updated_at";

    @Select("SELECT " + COLUMNS + " FROM processor_messages WHERE id = #{id}")
    ProcessorMessageEntity selectByMessageId(@Param("id") String id);

    @Insert("INSERT INTO processor_messages(" + COLUMNS + ") VALUES(#{id}, #{processorId}, #{sourceChain}, #{targetChain}, " +
            "#{sender}, #{payload}, 'pending', #{createdAtBlock}, #{createdAtTx}, #{createdAtBlock}, NULL, NULL, 0, NULL, NULL, NULL, " +
            "#{createdAt}, #{updatedAt}) ON CONFLICT(id) DO NOTHING")
    int insertIgnore(ProcessorMessageEntity entity);

    @Update("<script>" +
            "UPDATE processor_messages SET status = 'processing', last_updated_block = #{block}, updated_at = #{now} " +
            "WHERE id = #{id} AND (status = 'pending' " +
            "<if test='allowRetry'>OR (status = 'failed' AND next_retry_block IS NOT NULL)</if>)" +
            "</script>")
    int markProcessing(@Param("id") String id,
                       @Param("block") long block,
                       @Param("allowRetry") boolean allowRetry,
                       @Param("now") Instant now);

    @Update("UPDATE processor_messages SET status = 'completed', last_updated_block = #{block}, processed_at_block = #{block}, " +
            "processed_at_tx = #{txHash}, gas_used = #{gasUsed}, next_retry_block = NULL, error = NULL, updated_at = #{now} " +
            "WHERE id = #{id} AND status = 'processing'")
    int markCompleted(@Param("id") String id,
                      @Param("block") long block,
                      @Param("txHash") String txHash,
                      @Param("gasUsed") Long gasUsed,
                      @Param("now") Instant now);

    /**
     * expectedRetryCount 作为栅栏，防止同一失败事件被重复计数。
     */
    @Update("UPDATE processor_messages SET status = 'failed', retry_count = #{newRetryCount}, next_retry_block = #{nextRetryBlock}, " +
            "last_updated_block = #{block}, error = #{error}, updated_at = #{now} " +
            "WHERE id = #{id} AND status = 'processing' AND retry_count = #{expectedRetryCount}")
    int markFailed(@Param("id") String id,
                   @Param("expectedRetryCount") int expectedRetryCount,
                   @Param("newRetryCount") int newRetryCount,
                   @Param("nextRetryBlock") Long nextRetryBlock,
                   @Param("block") long block,
                   @Param("error") String error,
                   @Param("now") Instant now);

    /**
     * 强制超时：条件中重新检查非终态，与完成事件并发时完成事件胜出。
     */
    @Update("UPDATE processor_messages SET status = 'timed_out', next_retry_block = NULL, last_updated_block = #{block}, " +
            "error = #{reason}, updated_at = #{now} " +
            "WHERE id = #{id} AND status IN ('pending', 'processing', 'failed')")
    int markTimedOut(@Param("id") String id,
                     @Param("block") long block,
                     @Param("reason") String reason,
                     @Param("now") Instant now);

    @Select("SELECT " + COLUMNS + " FROM processor_messages " +
            "WHERE source_chain = #{sourceChain} AND status IN ('pending', 'processing', 'failed') AND id > #{afterId} " +
            "ORDER BY id ASC LIMIT #{limit}")
    List<ProcessorMessageEntity> selectNonTerminalBySource(@Param("sourceChain") String sourceChain,
                                                           @Param("afterId") String afterId,
                                                           @Param("limit") int limit);

    @Select("SELECT " + COLUMNS + " FROM processor_messages " +
            "WHERE target_chain = #{targetChain} AND status = 'failed' AND next_retry_block IS NOT NULL " +
            "AND next_retry_block <= #{currentHeight} ORDER BY next_retry_block ASC, id ASC LIMIT #{limit}")
    List<ProcessorMessageEntity> selectRetryable(@Param("targetChain") String targetChain,
                                                 @Param("currentHeight") long currentHeight,
                                                 @Param("limit") int limit);

    @Select("SELECT " + COLUMNS + " FROM processor_messages " +
            "WHERE target_chain = #{targetChain} AND status = #{status} ORDER BY created_at_block ASC, id ASC LIMIT #{limit}")
    List<ProcessorMessageEntity> selectByTargetAndStatus(@Param("targetChain") String targetChain,
                                                         @Param("status") String status,
                                                         @Param("limit") int limit);
}
