package com.work.almanac.core.store;

import com.work.almanac.core.model.EntityStateVersion;

import java.util.List;
import java.util.Optional;

/**
 * 实体状态版本的关系型记录（事实来源），keyed 历史状态由它重放得到。
 */
public interface StateHistoryRepository {

    /**
     * 幂等写入；(kind, id, blockNumber) 已存在时覆盖为最新快照。
     */
    void record(EntityStateVersion version);

    List<EntityStateVersion> listByChainRange(String chain, long fromHeight, long toHeight);

    /**
     * keyed 后端不可用时的兜底查询：高度 &lt;= height 的最新版本。
     */
    Optional<EntityStateVersion> findLatestAtOrBelow(String entityKind, String entityId, long height);
}
