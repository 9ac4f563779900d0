package com.work.almanac.core.repository.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.work.almanac.core.repository.entity.ReorgLogEntity;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;
import java.util.Map;

public interface ReorgLogMapper extends BaseMapper<ReorgLogEntity> {

    @Insert("INSERT INTO reorg_log(chain, detected_at, ancestor_height, depth, blocks_retracted, events_retracted, created_at) " +
            "VALUES(#{chain}, #{detectedAt}, #{ancestorHeight}, #{depth}, #{blocksRetracted}, #{eventsRetracted}, #{createdAt})")
    int insertLog(ReorgLogEntity entity);

    @Select("SELECT id, chain, detected_at, ancestor_height, depth, blocks_retracted, events_retracted, created_at " +
            "FROM reorg_log WHERE chain = #{chain} ORDER BY id DESC LIMIT #{limit}")
    List<ReorgLogEntity> selectRecent(@Param("chain") String chain, @Param("limit") int limit);

    /**
     * 统计：次数、最大深度、累计撤回区块数、累计撤回事件数。
     */
    @Select("SELECT COUNT(*) AS total, COALESCE(MAX(depth), 0) AS max_depth, " +
            "COALESCE(SUM(blocks_retracted), 0) AS blocks, COALESCE(SUM(events_retracted), 0) AS events " +
            "FROM reorg_log WHERE chain = #{chain}")
    Map<String, Object> selectStats(@Param("chain") String chain);
}
