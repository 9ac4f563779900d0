package com.work.almanac.indexer.service.ingest;

/**
 * 单条链摄取循环所处的阶段。
 */
public enum SyncPhase {
    IDLE,
    FETCHING,
    VALIDATING,
    WRITING,
    /**
     * 运维暂停，循环不再拉取，可恢复。
     */
    PAUSED,
    /**
     * 致命错误（不可恢复 reorg / 终局违例），需要人工处理后 restart。
     */
    HALTED,
    STOPPED
}
