package com.work.almanac.indexer.service.message;

import com.work.almanac.core.model.ChainEvent;

import java.util.Optional;

/**
 * 把链上事件解释为处理器事件。与处理器无关的事件返回 {@link Optional#empty()}。
 */
public interface ProcessorEventDecoder {

    Optional<ProcessorEvent> decode(ChainEvent event);
}
