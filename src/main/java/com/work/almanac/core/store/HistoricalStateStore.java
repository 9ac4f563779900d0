package com.work.almanac.core.store;

import com.work.almanac.core.model.EntityStateVersion;
import com.work.almanac.core.model.HistoricalState;

import java.util.List;
import java.util.Optional;

/**
 * 按区块高度查询的实体历史状态（keyed 后端）。
 *
 * 只接受已观测高度内的版本：version.blockNumber 大于该链已观测高度时拒绝写入并返回 false。
 */
public interface HistoricalStateStore {

    boolean putVersions(String chain, List<EntityStateVersion> versions);

    /**
     * 高度 &lt;= height 的最新版本。
     */
    Optional<HistoricalState> findAsOf(String chain, String entityKind, String entityId, long height);

    /**
     * 删除该链 height 及以上的全部版本。
     */
    int retractFromHeight(String chain, long height);
}
