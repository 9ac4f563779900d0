package com.work.almanac.indexer.chain;

import com.work.almanac.core.chain.ChainAdapter;
import com.work.almanac.core.chain.FetchedBlock;
import com.work.almanac.core.exception.TransientFetchException;
import com.work.almanac.core.model.Block;
import com.work.almanac.core.model.BlockStatus;
import com.work.almanac.core.model.ChainEvent;
import com.work.almanac.core.model.FinalitySignals;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static com.work.almanac.core.support.ValidationUtils.requireValidChainId;

/**
 * Demo / 测试用的内存模拟链：可以出块、挂事件、制造 reorg、注入临时错误、设置终局信号。
 *
 * 区块 hash 由 (链, 高度, 分叉代数) 决定，reorg 后同高度的 hash 必然不同。
 * autoMine 打开时每次查询链头都会出一个新块，用于本地演示。
 */
public class MockChainAdapter implements ChainAdapter {

    private final String chainId;
    private final List<MockBlock> canonical = new ArrayList<>();
    private final List<PendingEvent> nextBlockEvents = new ArrayList<>();
    private final AtomicInteger failuresToInject = new AtomicInteger();
    private int generation;
    private final long genesisTimestamp = 1_700_000_000L;
    private boolean autoMine;
    private FinalitySignals signals;

    private static final class MockBlock {
        final Block block;
        final List<ChainEvent> events;

        MockBlock(Block block, List<ChainEvent> events) {
            this.block = block;
            this.events = events;
        }
    }

    private static final class PendingEvent {
        final String eventType;
        final byte[] rawData;

        PendingEvent(String eventType, byte[] rawData) {
            this.eventType = eventType;
            this.rawData = rawData;
        }
    }

    public MockChainAdapter(String chainId) {
        this.chainId = requireValidChainId(chainId);
    }

    @Override
    public String chainId() {
        return chainId;
    }

    public synchronized void setAutoMine(boolean autoMine) {
        this.autoMine = autoMine;
    }

    /**
     * 挂一个事件到下一个出的块上。
     */
    public synchronized void emit(String eventType, String jsonPayload) {
        nextBlockEvents.add(new PendingEvent(eventType, jsonPayload == null ? new byte[0] : jsonPayload.getBytes(StandardCharsets.UTF_8)));
    }

    /**
     * 出 n 个块，返回新的链头高度。第一个块是高度 0。
     */
    public synchronized long mine(int n) {
        for (int i = 0; i < n; i++) {
            appendBlock();
        }
        return head();
    }

    /**
     * 从 fromHeight 开始替换为新分叉，并保证新链长度不短于旧链。
     */
    public synchronized void reorg(long fromHeight) {
        reorg(fromHeight, head());
    }

    /**
     * 从 fromHeight 开始替换为新分叉，新链头为 newHead。newHead 可以低于旧链头，
     * newHead 等于 fromHeight - 1 时只截断不出新块。
     */
    public synchronized void reorg(long fromHeight, long newHead) {
        if (fromHeight <= 0 || fromHeight > head()) {
            throw new IllegalArgumentException("reorg 起点非法: " + fromHeight);
        }
        if (newHead < fromHeight - 1) {
            throw new IllegalArgumentException("新链头低于分叉点: newHead=" + newHead + " fromHeight=" + fromHeight);
        }
        while (canonical.size() > fromHeight) {
            canonical.remove(canonical.size() - 1);
        }
        generation++;
        while (head() < newHead) {
            appendBlock();
        }
    }

    /**
     * 接下来 n 次 fetchBlocks / currentHead 调用抛出临时错误。
     */
    public void failNext(int n) {
        failuresToInject.set(n);
    }

    public synchronized void setSignals(FinalitySignals signals) {
        this.signals = signals;
    }

    public synchronized String hashAt(long height) {
        return canonical.get((int) height).block.getHash();
    }

    @Override
    public synchronized List<FetchedBlock> fetchBlocks(long fromHeight, long toHeight) {
        maybeFail("fetchBlocks");
        List<FetchedBlock> out = new ArrayList<>();
        for (long h = Math.max(0, fromHeight); h <= toHeight && h <= head(); h++) {
            MockBlock mb = canonical.get((int) h);
            out.add(new FetchedBlock(mb.block, mb.events));
        }
        return out;
    }

    @Override
    public synchronized long currentHead() {
        maybeFail("currentHead");
        if (autoMine) {
            appendBlock();
        }
        return head();
    }

    @Override
    public synchronized Optional<FinalitySignals> finalitySignals() {
        return Optional.ofNullable(signals);
    }

    private long head() {
        return canonical.size() - 1L;
    }

    private void appendBlock() {
        long h = canonical.size();
        String parent = h == 0 ? null : canonical.get((int) h - 1).block.getHash();
        String hash = "0x" + chainId + "-" + h + "-g" + generation;
        long ts = genesisTimestamp + h;
        Block block = new Block(chainId, h, hash, parent, ts, BlockStatus.PENDING);
        List<ChainEvent> events = new ArrayList<>();
        int logIndex = 0;
        for (PendingEvent pe : nextBlockEvents) {
            String txHash = "0xtx-" + chainId + "-" + h + "-" + logIndex;
            events.add(new ChainEvent(chainId + ":" + txHash + ":" + logIndex, chainId, h, hash, txHash, ts, pe.eventType, pe.rawData));
            logIndex++;
        }
        nextBlockEvents.clear();
        canonical.add(new MockBlock(block, events));
    }

    private void maybeFail(String op) {
        int left = failuresToInject.get();
        if (left > 0 && failuresToInject.compareAndSet(left, left - 1)) {
            throw new TransientFetchException("injected transient failure op=" + op + " chain=" + chainId);
        }
    }
}
