package com.work.almanac.core.repository.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.work.almanac.core.repository.entity.MessageCursorEntity;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.time.Instant;

public interface MessageCursorMapper extends BaseMapper<MessageCursorEntity> {

    @Select("SELECT last_applied_height FROM message_cursor WHERE chain = #{chain}")
    Long selectHeight(@Param("chain") String chain);

    @Insert("INSERT INTO message_cursor(chain, last_applied_height, updated_at) VALUES(#{chain}, #{height}, #{now}) " +
            "ON CONFLICT(chain) DO UPDATE SET last_applied_height = EXCLUDED.last_applied_height, updated_at = EXCLUDED.updated_at")
    int upsert(@Param("chain") String chain, @Param("height") long height, @Param("now") Instant now);

    @Update("UPDATE message_cursor SET last_applied_height = #{height}, updated_at = #{now} " +
            "WHERE chain = #{chain} AND last_applied_height > #{height}")
    int rewind(@Param("chain") String chain, @Param("height") long height, @Param("now") Instant now);
}
