package com.work.almanac.indexer.chain;

import com.work.almanac.core.chain.ChainAdapter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 链 id -&gt; 适配器。
 */
public class ChainAdapterRegistry {

    private final Map<String, ChainAdapter> adapters = new LinkedHashMap<>();

    public ChainAdapterRegistry register(ChainAdapter adapter) {
        if (adapters.putIfAbsent(adapter.chainId(), adapter) != null) {
            throw new IllegalArgumentException("duplicate chain adapter: " + adapter.chainId());
        }
        return this;
    }

    public Optional<ChainAdapter> find(String chain) {
        return Optional.ofNullable(adapters.get(chain));
    }

    public ChainAdapter get(String chain) {
        ChainAdapter a = adapters.get(chain);
        if (a == null) {
            throw new IllegalArgumentException("no chain adapter configured for chain=" + chain);
        }
        return a;
    }

    public Map<String, ChainAdapter> all() {
        return Collections.unmodifiableMap(adapters);
    }
}
