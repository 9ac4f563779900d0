package com.work.almanac.indexer.web;

import com.work.almanac.core.model.MessageStatus;
import com.work.almanac.core.repository.entity.ProcessorMessageEntity;
import com.work.almanac.core.store.BlockEventStore;
import com.work.almanac.core.store.MessageRepository;
import com.work.almanac.indexer.web.dto.MessageView;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import javax.validation.constraints.Max;
import javax.validation.constraints.Min;
import java.util.ArrayList;
import java.util.List;

/**
 * relayer 轮询接口：按目标链取待重试 / 待处理消息，按 id 查单条消息。
 */
@RestController
@Validated
@RequestMapping("/api/v1/messages")
public class MessageController {

    private final MessageRepository repository;
    private final BlockEventStore store;

    public MessageController(MessageRepository repository, BlockEventStore store) {
        this.repository = repository;
        this.store = store;
    }

    @GetMapping("/{messageId}")
    public ResponseEntity<MessageView> get(@PathVariable String messageId) {
        ProcessorMessageEntity m = repository.findMessage(messageId);
        if (m == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(toView(m));
    }

    /**
     * failed 且 next_retry_block &lt;= 目标链当前高度的消息。
     */
    @GetMapping("/retryable")
    public List<MessageView> retryable(@RequestParam("targetChain") String targetChain,
                                       @RequestParam(value = "limit", defaultValue = "100") @Min(1) @Max(1000) int limit) {
        long current = store.getCursor(targetChain).orElse(-1L);
        if (current < 0) {
            return new ArrayList<>();
        }
        return toViews(repository.listRetryable(targetChain, current, limit));
    }

    @GetMapping
    public List<MessageView> byStatus(@RequestParam("targetChain") String targetChain,
                                      @RequestParam(value = "status", defaultValue = "pending") String status,
                                      @RequestParam(value = "limit", defaultValue = "100") @Min(1) @Max(1000) int limit) {
        MessageStatus s = MessageStatus.fromValue(status);
        return toViews(repository.listByTargetAndStatus(targetChain, s.getValue(), limit));
    }

    private List<MessageView> toViews(List<ProcessorMessageEntity> list) {
        List<MessageView> out = new ArrayList<>(list.size());
        for (ProcessorMessageEntity m : list) {
            out.add(toView(m));
        }
        return out;
    }

    private MessageView toView(ProcessorMessageEntity m) {
        MessageView v = new MessageView();
        v.setId(m.getId());
        v.setProcessorId(m.getProcessorId());
        v.setSourceChain(m.getSourceChain());
        v.setTargetChain(m.getTargetChain());
        v.setSender(m.getSender());
        v.setPayload(m.getPayload());
        v.setStatus(m.getStatus());
        v.setCreatedAtBlock(m.getCreatedAtBlock());
        v.setCreatedAtTx(m.getCreatedAtTx());
        v.setLastUpdatedBlock(m.getLastUpdatedBlock());
        v.setProcessedAtBlock(m.getProcessedAtBlock());
        v.setProcessedAtTx(m.getProcessedAtTx());
        v.setRetryCount(m.getRetryCount());
        v.setNextRetryBlock(m.getNextRetryBlock());
        v.setGasUsed(m.getGasUsed());
        v.setError(m.getError());
        v.setUpdatedAt(m.getUpdatedAt());
        return v;
    }
}
