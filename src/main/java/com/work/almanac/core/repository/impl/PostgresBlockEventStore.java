package com.work.almanac.core.repository.impl;

import com.work.almanac.core.exception.StorageWriteException;
import com.work.almanac.core.model.Block;
import com.work.almanac.core.model.BlockStatus;
import com.work.almanac.core.model.ChainEvent;
import com.work.almanac.core.model.EntityStateVersion;
import com.work.almanac.core.model.FinalityPromotion;
import com.work.almanac.core.model.IngestionBatch;
import com.work.almanac.core.model.RetractionResult;
import com.work.almanac.core.repository.entity.BlockEntity;
import com.work.almanac.core.repository.entity.EntityStateHistoryEntity;
import com.work.almanac.core.repository.entity.EventEntity;
import com.work.almanac.core.repository.mapper.BlockMapper;
import com.work.almanac.core.repository.mapper.ChainCursorMapper;
import com.work.almanac.core.repository.mapper.EntityStateHistoryMapper;
import com.work.almanac.core.repository.mapper.EventMapper;
import com.work.almanac.core.store.EventFilter;
import com.work.almanac.core.store.RelationalStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

import static com.work.almanac.core.support.ValidationUtils.requireNonEmpty;
import static com.work.almanac.core.support.ValidationUtils.requireNonNegative;
import static com.work.almanac.core.support.ValidationUtils.requireNonNull;

/**
 * 基于 PostgreSQL + MyBatis-Plus 的关系型存储（事实来源）。
 *
 * 写入与撤回都在一个数据库事务内完成；数据库异常统一转换为 {@link StorageWriteException}，
 * 由编排器整批重试。
 */
@Repository
public class PostgresBlockEventStore implements RelationalStore {

    private static final Logger log = LoggerFactory.getLogger(PostgresBlockEventStore.class);

    private final BlockMapper blockMapper;
    private final EventMapper eventMapper;
    private final ChainCursorMapper cursorMapper;
    private final EntityStateHistoryMapper stateHistoryMapper;
    private final TransactionOperations tx;

    public PostgresBlockEventStore(BlockMapper blockMapper,
                                   EventMapper eventMapper,
                                   ChainCursorMapper cursorMapper,
                                   EntityStateHistoryMapper stateHistoryMapper,
                                   TransactionOperations tx) {
        this.blockMapper = blockMapper;
        this.eventMapper = eventMapper;
        this.cursorMapper = cursorMapper;
        this.stateHistoryMapper = stateHistoryMapper;
        this.tx = tx;
    }

    @Override
    public void putBlocksAndEvents(IngestionBatch batch) {
        requireNonNull(batch, "batch");
        String chain = batch.getChain();
        try {
            tx.executeWithoutResult(status -> {
                for (Block b : batch.getBlocks()) {
                    insertBlock(b);
                }
                for (ChainEvent e : batch.getEvents()) {
                    eventMapper.insertIgnore(toEntity(e));
                }
                for (FinalityPromotion p : batch.getPromotions()) {
                    blockMapper.promote(chain, p.getTarget().getValue(), p.getUpToHeight(), BlockStatus.valuesBelow(p.getTarget()));
                }
                cursorMapper.upsert(chain, batch.getCursorHeight(), Instant.now());
            });
        } catch (DataAccessException e) {
            throw new StorageWriteException("relational write failed chain=" + chain + " batch=" + batch, e);
        }
    }

    private void insertBlock(Block b) {
        int n = blockMapper.insertOrPromote(b.getChain(), b.getNumber(), b.getHash(), b.getParentHash(),
                b.getTimestamp(), b.getStatus().getValue(), BlockStatus.valuesBelow(b.getStatus()));
        if (n == 1) {
            return;
        }
        // 未插入也未提升：要么是重复写入（同 hash，状态不低于本次），要么同高度已有不同 hash 的区块
        BlockEntity existing = blockMapper.selectOne(b.getChain(), b.getNumber());
        if (existing != null && !b.getHash().equals(existing.getBlockHash())) {
            throw new StorageWriteException("conflicting block chain=" + b.getChain() + " height=" + b.getNumber()
                    + " stored=" + existing.getBlockHash() + " incoming=" + b.getHash());
        }
    }

    @Override
    public RetractionResult retractFromHeight(String chain, long height) {
        requireNonEmpty(chain, "chain");
        requireNonNegative(height, "height");
        try {
            RetractionResult result = tx.execute(status -> {
                int events = eventMapper.deleteFromHeight(chain, height);
                int blocks = blockMapper.deleteFromHeight(chain, height);
                stateHistoryMapper.deleteFromHeight(chain, height);
                cursorMapper.rewind(chain, height, Instant.now());
                return new RetractionResult(height, blocks, events);
            });
            log.info("relational retract chain={} fromHeight={} result={}", chain, height, result);
            return result;
        } catch (DataAccessException e) {
            throw new StorageWriteException("relational retract failed chain=" + chain + " fromHeight=" + height, e);
        }
    }

    @Override
    public int promoteStatus(String chain, FinalityPromotion promotion) {
        requireNonEmpty(chain, "chain");
        requireNonNull(promotion, "promotion");
        try {
            return blockMapper.promote(chain, promotion.getTarget().getValue(), promotion.getUpToHeight(),
                    BlockStatus.valuesBelow(promotion.getTarget()));
        } catch (DataAccessException e) {
            throw new StorageWriteException("relational promote failed chain=" + chain + " promotion=" + promotion, e);
        }
    }

    @Override
    public OptionalLong getLatestBlock(String chain, BlockStatus minStatus) {
        Long h = blockMapper.selectLatestHeight(chain, BlockStatus.valuesAtLeast(minStatus == null ? BlockStatus.PENDING : minStatus));
        return h == null ? OptionalLong.empty() : OptionalLong.of(h);
    }

    @Override
    public OptionalLong getEarliestBlock(String chain) {
        Long h = blockMapper.selectEarliestHeight(chain);
        return h == null ? OptionalLong.empty() : OptionalLong.of(h);
    }

    @Override
    public Optional<Block> getBlock(String chain, long height) {
        BlockEntity e = blockMapper.selectOne(chain, height);
        return e == null ? Optional.empty() : Optional.of(toBlock(e));
    }

    @Override
    public List<Block> getBlocks(String chain, long fromHeight, long toHeight) {
        if (fromHeight > toHeight) {
            return Collections.emptyList();
        }
        List<BlockEntity> rows = blockMapper.selectRange(chain, fromHeight, toHeight);
        List<Block> out = new ArrayList<>(rows.size());
        for (BlockEntity e : rows) {
            out.add(toBlock(e));
        }
        return out;
    }

    @Override
    public List<ChainEvent> getEvents(EventFilter filter) {
        requireNonNull(filter, "filter");
        List<String> statuses = filter.getMinStatus() == null || filter.getMinStatus() == BlockStatus.PENDING
                ? Collections.emptyList()
                : BlockStatus.valuesAtLeast(filter.getMinStatus());
        List<EventEntity> rows = eventMapper.selectFiltered(filter.getChain(), filter.getFromHeight(), filter.getToHeight(),
                filter.getEventTypes(), statuses, filter.getLimit(), filter.getOffset());
        List<ChainEvent> out = new ArrayList<>(rows.size());
        for (EventEntity e : rows) {
            out.add(toEvent(e));
        }
        return out;
    }

    @Override
    public OptionalLong getCursor(String chain) {
        Long h = cursorMapper.selectHeight(chain);
        return h == null ? OptionalLong.empty() : OptionalLong.of(h);
    }

    @Override
    public void record(EntityStateVersion version) {
        requireNonNull(version, "version");
        EntityStateHistoryEntity e = new EntityStateHistoryEntity();
        e.setEntityKind(version.getEntityKind());
        e.setEntityId(version.getEntityId());
        e.setChain(version.getChain());
        e.setBlockNumber(version.getBlockNumber());
        e.setStateJson(version.getStateJson());
        try {
            stateHistoryMapper.upsert(e);
        } catch (DataAccessException ex) {
            throw new StorageWriteException("state history write failed " + version, ex);
        }
    }

    @Override
    public List<EntityStateVersion> listByChainRange(String chain, long fromHeight, long toHeight) {
        List<EntityStateHistoryEntity> rows = stateHistoryMapper.selectByChainRange(chain, fromHeight, toHeight);
        List<EntityStateVersion> out = new ArrayList<>(rows.size());
        for (EntityStateHistoryEntity e : rows) {
            out.add(toVersion(e));
        }
        return out;
    }

    @Override
    public Optional<EntityStateVersion> findLatestAtOrBelow(String entityKind, String entityId, long height) {
        EntityStateHistoryEntity e = stateHistoryMapper.selectLatestAtOrBelow(entityKind, entityId, height);
        return e == null ? Optional.empty() : Optional.of(toVersion(e));
    }

    private static EntityStateVersion toVersion(EntityStateHistoryEntity e) {
        return new EntityStateVersion(e.getEntityKind(), e.getEntityId(), e.getChain(), e.getBlockNumber(), e.getStateJson());
    }

    private static Block toBlock(BlockEntity e) {
        return new Block(e.getChain(), e.getBlockNumber(), e.getBlockHash(), e.getParentHash(),
                e.getTimestamp() == null ? 0L : e.getTimestamp(), BlockStatus.fromValue(e.getStatus()));
    }

    private static ChainEvent toEvent(EventEntity e) {
        return new ChainEvent(e.getEventId(), e.getChain(), e.getBlockNumber(), e.getBlockHash(), e.getTxHash(),
                e.getTimestamp() == null ? 0L : e.getTimestamp(), e.getEventType(), e.getRawData());
    }

    private static EventEntity toEntity(ChainEvent ev) {
        EventEntity e = new EventEntity();
        e.setEventId(ev.getEventId());
        e.setChain(ev.getChain());
        e.setBlockNumber(ev.getBlockNumber());
        e.setBlockHash(ev.getBlockHash());
        e.setTxHash(ev.getTxHash());
        e.setTimestamp(ev.getTimestamp());
        e.setEventType(ev.getEventType());
        e.setRawData(ev.getRawData());
        return e;
    }
}
