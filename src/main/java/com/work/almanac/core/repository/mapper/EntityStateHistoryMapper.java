package com.work.almanac.core.repository.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.work.almanac.core.repository.entity.EntityStateHistoryEntity;
import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

public interface EntityStateHistoryMapper extends BaseMapper<EntityStateHistoryEntity> {

    @Insert("INSERT INTO entity_state_history(entity_kind, entity_id, chain, block_number, state_json) " +
            "VALUES(#{entityKind}, #{entityId}, #{chain}, #{blockNumber}, CAST(#{stateJson} AS jsonb)) " +
            "ON CONFLICT(entity_kind, entity_id, block_number) DO UPDATE SET state_json = EXCLUDED.state_json")
    int upsert(EntityStateHistoryEntity entity);

    @Select("SELECT entity_kind, entity_id, chain, block_number, state_json::text AS state_json " +
            "FROM entity_state_history WHERE chain = #{chain} AND block_number BETWEEN #{fromHeight} AND #{toHeight} " +
            "ORDER BY block_number ASC, entity_kind ASC, entity_id ASC")
    List<EntityStateHistoryEntity> selectByChainRange(@Param("chain") String chain,
                                                      @Param("fromHeight") long fromHeight,
                                                      @Param("toHeight") long toHeight);

    @Select("SELECT entity_kind, entity_id, chain, block_number, state_json::text AS state_json " +
            "FROM entity_state_history WHERE entity_kind = #{kind} AND entity_id = #{id} AND block_number <= #{height} " +
            "ORDER BY block_number DESC LIMIT 1")
    EntityStateHistoryEntity selectLatestAtOrBelow(@Param("kind") String kind,
                                                   @Param("id") String id,
                                                   @Param("height") long height);

    @Delete("DELETE FROM entity_state_history WHERE chain = #{chain} AND block_number >= #{fromHeight}")
    int deleteFromHeight(@Param("chain") String chain, @Param("fromHeight") long fromHeight);
}
