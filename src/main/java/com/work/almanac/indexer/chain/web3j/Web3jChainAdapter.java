package com.work.almanac.indexer.chain.web3j;

import com.work.almanac.core.chain.ChainAdapter;
import com.work.almanac.core.chain.ChainBlockTag;
import com.work.almanac.core.chain.FetchedBlock;
import com.work.almanac.core.exception.TransientFetchException;
import com.work.almanac.core.model.Block;
import com.work.almanac.core.model.BlockStatus;
import com.work.almanac.core.model.ChainEvent;
import com.work.almanac.core.model.FinalitySignals;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameter;
import org.web3j.protocol.core.methods.request.EthFilter;
import org.web3j.protocol.core.methods.response.EthBlock;
import org.web3j.protocol.core.methods.response.EthBlockNumber;
import org.web3j.protocol.core.methods.response.EthLog;
import org.web3j.protocol.core.methods.response.Log;
import org.web3j.utils.Numeric;

import java.io.IOException;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 基于 Web3j 的 progressive 链适配器（EVM JSON-RPC）：
 * - 区块 eth_getBlockByNumber
 * - 事件 eth_getLogs（可按合约地址过滤）
 * - 终局信号 "safe" / "finalized" block tag，节点不支持时退化为确认深度
 *
 * 事件 id = chain:txHash:logIndex；eventType 取 topic0。
 */
public class Web3jChainAdapter implements ChainAdapter {

    private static final Logger log = LoggerFactory.getLogger(Web3jChainAdapter.class);

    private final String chainId;
    private final Web3j web3j;
    private final List<String> contractAddresses;
    private volatile boolean signalsSupported = true;

    public Web3jChainAdapter(String chainId, Web3j web3j, List<String> contractAddresses) {
        this.chainId = chainId;
        this.web3j = web3j;
        this.contractAddresses = contractAddresses == null ? Collections.emptyList() : new ArrayList<>(contractAddresses);
    }

    @Override
    public String chainId() {
        return chainId;
    }

    @Override
    public List<FetchedBlock> fetchBlocks(long fromHeight, long toHeight) {
        if (fromHeight > toHeight) {
            return Collections.emptyList();
        }
        Map<Long, Block> blocks = new LinkedHashMap<>();
        for (long h = fromHeight; h <= toHeight; h++) {
            EthBlock.Block b = getBlock(DefaultBlockParameter.valueOf(BigInteger.valueOf(h)));
            if (b == null) {
                break;
            }
            blocks.put(h, new Block(chainId, h, b.getHash(), b.getParentHash(), b.getTimestamp().longValue(), BlockStatus.PENDING));
        }
        if (blocks.isEmpty()) {
            return Collections.emptyList();
        }
        long last = fromHeight + blocks.size() - 1;
        Map<Long, List<ChainEvent>> events = fetchLogs(fromHeight, last, blocks);

        List<FetchedBlock> out = new ArrayList<>(blocks.size());
        for (Map.Entry<Long, Block> e : blocks.entrySet()) {
            out.add(new FetchedBlock(e.getValue(), events.getOrDefault(e.getKey(), Collections.emptyList())));
        }
        return out;
    }

    @Override
    public long currentHead() {
        try {
            EthBlockNumber resp = web3j.ethBlockNumber().send();
            if (resp.hasError()) {
                throw new TransientFetchException("eth_blockNumber error chain=" + chainId + " err=" + resp.getError().getMessage());
            }
            return resp.getBlockNumber().longValue();
        } catch (IOException e) {
            throw new TransientFetchException("eth_blockNumber failed chain=" + chainId, e);
        }
    }

    @Override
    public Optional<FinalitySignals> finalitySignals() {
        if (!signalsSupported) {
            return Optional.empty();
        }
        try {
            Map<BlockStatus, Long> heights = new EnumMap<>(BlockStatus.class);
            for (ChainBlockTag tag : ChainBlockTag.values()) {
                Long h = tagHeight(tag);
                if (h != null) {
                    heights.put(tag.getTier(), h);
                }
            }
            if (heights.isEmpty()) {
                signalsSupported = false;
                log.info("node does not report safe/finalized tags, fallback to confirmation depth chain={}", chainId);
                return Optional.empty();
            }
            return Optional.of(new FinalitySignals(heights.get(BlockStatus.SAFE), heights.get(BlockStatus.JUSTIFIED),
                    heights.get(BlockStatus.FINALIZED)));
        } catch (TransientFetchException e) {
            log.warn("finality signals unavailable chain={} err={}", chainId, e.getMessage());
            return Optional.empty();
        }
    }

    private Long tagHeight(ChainBlockTag tag) {
        DefaultBlockParameter param = tag::getValue;
        try {
            EthBlock resp = web3j.ethGetBlockByNumber(param, false).send();
            if (resp.hasError() || resp.getBlock() == null) {
                return null;
            }
            return resp.getBlock().getNumber().longValue();
        } catch (IOException e) {
            throw new TransientFetchException("eth_getBlockByNumber(" + tag.getValue() + ") failed chain=" + chainId, e);
        }
    }

    private EthBlock.Block getBlock(DefaultBlockParameter param) {
        try {
            EthBlock resp = web3j.ethGetBlockByNumber(param, false).send();
            if (resp.hasError()) {
                throw new TransientFetchException("eth_getBlockByNumber error chain=" + chainId + " err=" + resp.getError().getMessage());
            }
            return resp.getBlock();
        } catch (IOException e) {
            throw new TransientFetchException("eth_getBlockByNumber failed chain=" + chainId + " block=" + param.getValue(), e);
        }
    }

    private Map<Long, List<ChainEvent>> fetchLogs(long from, long to, Map<Long, Block> blocks) {
        EthFilter filter = new EthFilter(
                DefaultBlockParameter.valueOf(BigInteger.valueOf(from)),
                DefaultBlockParameter.valueOf(BigInteger.valueOf(to)),
                contractAddresses);
        EthLog resp;
        try {
            resp = web3j.ethGetLogs(filter).send();
        } catch (IOException e) {
            throw new TransientFetchException("eth_getLogs failed chain=" + chainId + " range=" + from + ".." + to, e);
        }
        if (resp.hasError()) {
            throw new TransientFetchException("eth_getLogs error chain=" + chainId + " err=" + resp.getError().getMessage());
        }
        Map<Long, List<ChainEvent>> out = new LinkedHashMap<>();
        for (EthLog.LogResult<?> r : resp.getLogs()) {
            if (!(r.get() instanceof Log)) {
                continue;
            }
            Log l = (Log) r.get();
            if (l.isRemoved()) {
                continue;
            }
            long h = l.getBlockNumber().longValue();
            Block b = blocks.get(h);
            if (b == null || !b.getHash().equalsIgnoreCase(l.getBlockHash())) {
                // 区块与日志来自不同视图（拉取期间发生了 reorg），整批重拉
                throw new TransientFetchException("log/block view mismatch chain=" + chainId + " height=" + h);
            }
            String eventType = l.getTopics() == null || l.getTopics().isEmpty() ? "anonymous" : l.getTopics().get(0);
            String eventId = chainId + ":" + l.getTransactionHash() + ":" + l.getLogIndex();
            out.computeIfAbsent(h, k -> new ArrayList<>()).add(new ChainEvent(eventId, chainId, h, b.getHash(),
                    l.getTransactionHash(), b.getTimestamp(), eventType, Numeric.hexStringToByteArray(l.getData())));
        }
        return out;
    }
}
