package com.work.almanac.core.repository.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.work.almanac.core.repository.entity.ChainCursorEntity;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.time.Instant;

public interface ChainCursorMapper extends BaseMapper<ChainCursorEntity> {

    @Select("SELECT last_indexed_height FROM chain_cursor WHERE chain = #{chain}")
    Long selectHeight(@Param("chain") String chain);

    @Insert("INSERT INTO chain_cursor(chain, last_indexed_height, updated_at) VALUES(#{chain}, #{height}, #{now}) " +
            "ON CONFLICT(chain) DO UPDATE SET last_indexed_height = EXCLUDED.last_indexed_height, updated_at = EXCLUDED.updated_at")
    int upsert(@Param("chain") String chain, @Param("height") long height, @Param("now") Instant now);

    /**
     * 撤回时回退游标：只在当前游标 &gt;= fromHeight 时生效。
     */
    @Update("UPDATE chain_cursor SET last_indexed_height = #{fromHeight} - 1, updated_at = #{now} " +
            "WHERE chain = #{chain} AND last_indexed_height >= #{fromHeight}")
    int rewind(@Param("chain") String chain, @Param("fromHeight") long fromHeight, @Param("now") Instant now);
}
