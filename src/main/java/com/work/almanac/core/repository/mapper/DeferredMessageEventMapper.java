package com.work.almanac.core.repository.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.work.almanac.core.repository.entity.DeferredMessageEventEntity;
import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.time.Instant;
import java.util.List;

public interface DeferredMessageEventMapper extends BaseMapper<DeferredMessageEventEntity> {

    @Insert("INSERT INTO message_deferred_events(event_id, message_id, chain, block_number, created_at) " +
            "VALUES(#{eventId}, #{messageId}, #{chain}, #{blockNumber}, #{now}) ON CONFLICT(event_id) DO NOTHING")
    int insertIgnore(@Param("eventId") String eventId,
                     @Param("messageId") String messageId,
                     @Param("chain") String chain,
                     @Param("blockNumber") long blockNumber,
                     @Param("now") Instant now);

    @Select("SELECT event_id, message_id, chain, block_number, created_at FROM message_deferred_events " +
            "WHERE message_id = #{messageId} ORDER BY block_number ASC, event_id ASC")
    List<DeferredMessageEventEntity> selectByMessageId(@Param("messageId") String messageId);

    @Delete("DELETE FROM message_deferred_events WHERE event_id = #{eventId}")
    int deleteByEventId(@Param("eventId") String eventId);

    @Delete("DELETE FROM message_deferred_events WHERE chain = #{chain} AND block_number >= #{fromHeight}")
    int deleteFromHeight(@Param("chain") String chain, @Param("fromHeight") long fromHeight);
}
