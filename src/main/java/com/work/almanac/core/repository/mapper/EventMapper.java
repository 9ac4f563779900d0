package com.work.almanac.core.repository.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.work.almanac.core.repository.entity.EventEntity;
import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

/**
 * 事件表 Mapper
 */
public interface EventMapper extends BaseMapper<EventEntity> {

    @Insert("INSERT INTO events(event_id, chain, block_number, block_hash, tx_hash, timestamp, event_type, raw_data) " +
            "VALUES(#{eventId}, #{chain}, #{blockNumber}, #{blockHash}, #{txHash}, #{timestamp}, #{eventType}, #{rawData}) " +
            "ON CONFLICT(event_id) DO NOTHING")
    int insertIgnore(EventEntity event);

    /**
     * 条件查询；statuses 为空表示不按区块状态过滤。
     */
    @Select("<script>" +
            "SELECT e.event_id, e.chain, e.block_number, e.block_hash, e.tx_hash, e.timestamp, e.event_type, e.raw_data " +
            "FROM events e " +
            "<if test='statuses != null and statuses.size() > 0'>" +
            "JOIN blocks b ON b.chain = e.chain AND b.block_number = e.block_number " +
            "</if>" +
            "WHERE e.chain = #{chain} " +
            "<if test='fromHeight != null'>AND e.block_number &gt;= #{fromHeight} </if>" +
            "<if test='toHeight != null'>AND e.block_number &lt;= #{toHeight} </if>" +
            "<if test='eventTypes != null and eventTypes.size() > 0'>AND e.event_type IN " +
            "<foreach collection='eventTypes' item='t' open='(' separator=',' close=')'>#{t}</foreach> " +
            "</if>" +
            "<if test='statuses != null and statuses.size() > 0'>AND b.status IN " +
            "<foreach collection='statuses' item='s' open='(' separator=',' close=')'>#{s}</foreach> " +
            "</if>" +
            "ORDER BY e.block_number ASC, e.event_id ASC LIMIT #{limit} OFFSET #{offset}" +
            "</script>")
    List<EventEntity> selectFiltered(@Param("chain") String chain,
                                     @Param("fromHeight") Long fromHeight,
                                     @Param("toHeight") Long toHeight,
                                     @Param("eventTypes") List<String> eventTypes,
                                     @Param("statuses") List<String> statuses,
                                     @Param("limit") int limit,
                                     @Param("offset") int offset);

    @Delete("DELETE FROM events WHERE chain = #{chain} AND block_number >= #{fromHeight}")
    int deleteFromHeight(@Param("chain") String chain, @Param("fromHeight") long fromHeight);
}
