package com.work.almanac.core.repository.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.work.almanac.core.repository.entity.BlockEntity;
import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.util.List;

/**
 * 区块表 Mapper
 */
public interface BlockMapper extends BaseMapper<BlockEntity> {

    /**
     * 幂等插入；已存在时只允许提升状态（不覆盖 hash）。
     */
    @Insert("<script>" +
            "INSERT INTO blocks(chain, block_number, block_hash, parent_hash, timestamp, status) " +
            "VALUES(#{chain}, #{blockNumber}, #{blockHash}, #{parentHash}, #{timestamp}, #{status}) " +
            "ON CONFLICT(chain, block_number) DO UPDATE SET status = EXCLUDED.status " +
            "WHERE blocks.block_hash = EXCLUDED.block_hash AND " +
            "<choose><when test='lowerStatuses.isEmpty()'>FALSE</when><otherwise>blocks.status IN " +
            "<foreach collection='lowerStatuses' item='s' open='(' separator=',' close=')'>#{s}</foreach>" +
            "</otherwise></choose>" +
            "</script>")
    int insertOrPromote(@Param("chain") String chain,
                        @Param("blockNumber") long blockNumber,
                        @Param("blockHash") String blockHash,
                        @Param("parentHash") String parentHash,
                        @Param("timestamp") long timestamp,
                        @Param("status") String status,
                        @Param("lowerStatuses") List<String> lowerStatuses);

    @Select("SELECT chain, block_number, block_hash, parent_hash, timestamp, status FROM blocks " +
            "WHERE chain = #{chain} AND block_number = #{blockNumber}")
    BlockEntity selectOne(@Param("chain") String chain, @Param("blockNumber") long blockNumber);

    @Select("SELECT chain, block_number, block_hash, parent_hash, timestamp, status FROM blocks " +
            "WHERE chain = #{chain} AND block_number BETWEEN #{fromHeight} AND #{toHeight} " +
            "ORDER BY block_number ASC")
    List<BlockEntity> selectRange(@Param("chain") String chain,
                                  @Param("fromHeight") long fromHeight,
                                  @Param("toHeight") long toHeight);

    /**
     * 只升不降：仅更新状态严格低于目标状态的区块。
     */
    @Update("<script>" +
            "UPDATE blocks SET status = #{target} " +
            "WHERE chain = #{chain} AND block_number &lt;= #{upToHeight} AND status IN " +
            "<foreach collection='lowerStatuses' item='s' open='(' separator=',' close=')'>#{s}</foreach>" +
            "</script>")
    int promote(@Param("chain") String chain,
                @Param("target") String target,
                @Param("upToHeight") long upToHeight,
                @Param("lowerStatuses") List<String> lowerStatuses);

    @Select("<script>" +
            "SELECT MAX(block_number) FROM blocks WHERE chain = #{chain} AND status IN " +
            "<foreach collection='statuses' item='s' open='(' separator=',' close=')'>#{s}</foreach>" +
            "</script>")
    Long selectLatestHeight(@Param("chain") String chain, @Param("statuses") List<String> statuses);

    @Select("SELECT MIN(block_number) FROM blocks WHERE chain = #{chain}")
    Long selectEarliestHeight(@Param("chain") String chain);

    @Delete("DELETE FROM blocks WHERE chain = #{chain} AND block_number >= #{fromHeight}")
    int deleteFromHeight(@Param("chain") String chain, @Param("fromHeight") long fromHeight);
}
