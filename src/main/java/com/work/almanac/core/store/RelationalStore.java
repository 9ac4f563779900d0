package com.work.almanac.core.store;

/**
 * 关系型后端：区块/事件与实体状态版本的事实来源。
 *
 * 撤回区块时同一事务内一并撤回该链上同高度及以上的状态版本。
 */
public interface RelationalStore extends BlockEventStore, StateHistoryRepository {
}
