package com.work.almanac.indexer.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.work.almanac.core.model.Block;
import com.work.almanac.core.model.BlockStatus;
import com.work.almanac.core.model.ChainEvent;
import com.work.almanac.core.model.HistoricalState;
import com.work.almanac.core.repository.entity.ReorgLogEntity;
import com.work.almanac.core.store.DualBlockEventStore;
import com.work.almanac.core.store.EventFilter;
import com.work.almanac.indexer.service.ingest.ChainSyncState;
import com.work.almanac.indexer.service.ingest.IngestionSupervisor;
import com.work.almanac.indexer.service.reorg.ReorgRecoveryService;
import com.work.almanac.indexer.service.reorg.ReorgStats;
import com.work.almanac.indexer.web.dto.BlockView;
import com.work.almanac.indexer.web.dto.ChainStatusView;
import com.work.almanac.indexer.web.dto.EventView;
import com.work.almanac.indexer.web.dto.HistoricalStateView;
import com.work.almanac.indexer.web.dto.ReorgView;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import javax.validation.constraints.Max;
import javax.validation.constraints.Min;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * poll-only 的链状态与查询接口。
 */
@RestController
@Validated
@RequestMapping("/api/v1/chains")
public class IndexerStatusController {

    private final IngestionSupervisor supervisor;
    private final DualBlockEventStore store;
    private final ReorgRecoveryService reorgService;
    private final ObjectMapper objectMapper;

    public IndexerStatusController(IngestionSupervisor supervisor,
                                   DualBlockEventStore store,
                                   ReorgRecoveryService reorgService,
                                   ObjectMapper objectMapper) {
        this.supervisor = supervisor;
        this.store = store;
        this.reorgService = reorgService;
        this.objectMapper = objectMapper;
    }

    @GetMapping
    public List<ChainStatusView> list() {
        List<ChainStatusView> out = new ArrayList<>();
        for (ChainSyncState s : supervisor.states()) {
            out.add(toView(s));
        }
        return out;
    }

    @GetMapping("/{chain}")
    public ResponseEntity<ChainStatusView> get(@PathVariable String chain) {
        Optional<ChainSyncState> s = supervisor.state(chain);
        return s.map(state -> ResponseEntity.ok(toView(state))).orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PostMapping("/{chain}/pause")
    public ResponseEntity<ChainStatusView> pause(@PathVariable String chain) {
        return supervisor.pause(chain) ? get(chain) : ResponseEntity.notFound().build();
    }

    @PostMapping("/{chain}/resume")
    public ResponseEntity<ChainStatusView> resume(@PathVariable String chain) {
        return supervisor.resume(chain) ? get(chain) : ResponseEntity.notFound().build();
    }

    /**
     * 人工处理终局违例 / 不可恢复 reorg 后重新启用本链。
     */
    @PostMapping("/{chain}/restart")
    public ResponseEntity<ChainStatusView> restart(@PathVariable String chain) {
        return supervisor.restart(chain) ? get(chain) : ResponseEntity.notFound().build();
    }

    @GetMapping("/{chain}/blocks/latest")
    public ResponseEntity<BlockView> latestBlock(@PathVariable String chain,
                                                 @RequestParam(value = "minStatus", defaultValue = "pending") String minStatus) {
        OptionalLong h = store.getLatestBlock(chain, BlockStatus.fromValue(minStatus));
        if (!h.isPresent()) {
            return ResponseEntity.notFound().build();
        }
        Optional<Block> b = store.getBlock(chain, h.getAsLong());
        return b.map(block -> ResponseEntity.ok(toView(block))).orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/{chain}/blocks/{height}")
    public ResponseEntity<BlockView> block(@PathVariable String chain, @PathVariable long height) {
        return store.getBlock(chain, height).map(b -> ResponseEntity.ok(toView(b))).orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/{chain}/events")
    public List<EventView> events(@PathVariable String chain,
                                  @RequestParam(value = "fromHeight", required = false) Long fromHeight,
                                  @RequestParam(value = "toHeight", required = false) Long toHeight,
                                  @RequestParam(value = "types", required = false) List<String> types,
                                  @RequestParam(value = "minStatus", required = false) String minStatus,
                                  @RequestParam(value = "limit", defaultValue = "100") @Min(1) @Max(EventFilter.MAX_LIMIT) int limit,
                                  @RequestParam(value = "offset", defaultValue = "0") @Min(0) int offset) {
        EventFilter.Builder f = EventFilter.forChain(chain).fromHeight(fromHeight).toHeight(toHeight)
                .eventTypes(types).limit(limit).offset(offset);
        if (minStatus != null) {
            f.minStatus(BlockStatus.fromValue(minStatus));
        }
        List<EventView> out = new ArrayList<>();
        for (ChainEvent e : store.getEvents(f.build())) {
            out.add(toView(e));
        }
        return out;
    }

    @GetMapping("/{chain}/reorgs")
    public List<ReorgView> reorgs(@PathVariable String chain,
                                  @RequestParam(value = "limit", defaultValue = "20") @Min(1) @Max(500) int limit) {
        List<ReorgView> out = new ArrayList<>();
        for (ReorgLogEntity e : reorgService.recentReorgs(chain, limit)) {
            ReorgView v = new ReorgView();
            v.setDetectedAt(e.getDetectedAt());
            v.setAncestorHeight(e.getAncestorHeight());
            v.setDepth(e.getDepth());
            v.setBlocksRetracted(e.getBlocksRetracted());
            v.setEventsRetracted(e.getEventsRetracted());
            v.setCreatedAt(e.getCreatedAt());
            out.add(v);
        }
        return out;
    }

    @GetMapping("/{chain}/reorgs/stats")
    public ReorgStats reorgStats(@PathVariable String chain) {
        return reorgService.stats(chain);
    }

    /**
     * 截至 height 的实体状态（如 kind=processor）。结果带 keyed 后端已观测高度，调用方自行判断是否滞后。
     */
    @GetMapping("/{chain}/state/{kind}/{id}")
    public ResponseEntity<HistoricalStateView> stateAsOf(@PathVariable String chain,
                                                         @PathVariable String kind,
                                                         @PathVariable String id,
                                                         @RequestParam("height") @Min(0) long height) throws IOException {
        Optional<HistoricalState> s = store.findStateAsOf(chain, kind, id, height);
        if (!s.isPresent()) {
            return ResponseEntity.notFound().build();
        }
        HistoricalState hs = s.get();
        HistoricalStateView v = new HistoricalStateView();
        v.setEntityKind(kind);
        v.setEntityId(id);
        v.setChain(chain);
        v.setRequestedHeight(hs.getRequestedHeight());
        v.setReflectedHeight(hs.getReflectedHeight());
        v.setObservedHeight(hs.getObservedHeight());
        v.setPossiblyStale(hs.isPossiblyStale());
        v.setState(objectMapper.readTree(hs.getVersion().getStateJson()));
        return ResponseEntity.ok(v);
    }

    private ChainStatusView toView(ChainSyncState s) {
        ChainStatusView v = new ChainStatusView();
        v.setChain(s.getChain());
        v.setPhase(s.getPhase().name());
        v.setLastIndexedHeight(s.getLastIndexedHeight());
        v.setChainHead(s.getChainHead());
        v.setBlocksBehind(s.getBlocksBehind());
        OptionalLong finalized = store.getLatestBlock(s.getChain(), BlockStatus.FINALIZED);
        v.setLatestFinalizedHeight(finalized.isPresent() ? finalized.getAsLong() : null);
        v.setBlocksProcessed(s.getBlocksProcessed());
        v.setEventsExtracted(s.getEventsExtracted());
        v.setReorgsRecovered(s.getReorgsRecovered());
        v.setLastError(s.getLastError());
        v.setConsecutiveErrors(s.getConsecutiveErrors());
        v.setLastSuccessAt(s.getLastSuccessAt());
        OptionalLong keyed = store.getKeyedObservedHeight(s.getChain());
        v.setKeyedObservedHeight(keyed.isPresent() ? keyed.getAsLong() : null);
        v.setKeyedLagging(store.isLagging(s.getChain()));
        return v;
    }

    private BlockView toView(Block b) {
        BlockView v = new BlockView();
        v.setChain(b.getChain());
        v.setNumber(b.getNumber());
        v.setHash(b.getHash());
        v.setParentHash(b.getParentHash());
        v.setTimestamp(b.getTimestamp());
        v.setStatus(b.getStatus().getValue());
        return v;
    }

    private EventView toView(ChainEvent e) {
        EventView v = new EventView();
        v.setEventId(e.getEventId());
        v.setChain(e.getChain());
        v.setBlockNumber(e.getBlockNumber());
        v.setBlockHash(e.getBlockHash());
        v.setTxHash(e.getTxHash());
        v.setTimestamp(e.getTimestamp());
        v.setEventType(e.getEventType());
        v.setRawData(e.getRawData());
        return v;
    }
}
