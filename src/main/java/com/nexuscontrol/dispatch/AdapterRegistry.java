package com.nexuscontrol.dispatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Adapters available to the router, looked up by id first and by kind second.
 */
public class AdapterRegistry {

    private static final Logger log = LoggerFactory.getLogger(AdapterRegistry.class);

    private final Map<String, DispatchAdapter> adapters = new ConcurrentHashMap<>();

    public AdapterRegistry(List<DispatchAdapter> initial) {
        initial.forEach(this::register);
    }

    /**
     * @throws IllegalStateException if another adapter already uses the id
     */
    public void register(DispatchAdapter adapter) {
        DispatchAdapter previous = adapters.putIfAbsent(adapter.adapterId(), adapter);
        if (previous != null) {
            throw new IllegalStateException("Adapter id already registered: " + adapter.adapterId());
        }
        log.info("Registered adapter id={} kind={} capabilities={}",
            adapter.adapterId(), adapter.adapterKind(), adapter.capabilities());
    }

    /**
     * When several adapters share the requested kind, the one with the
     * lexicographically smallest id wins.
     *
     * @throws AdapterNotFoundException if neither an id nor a kind matches
     */
    public DispatchAdapter resolve(String idOrKind) {
        if (idOrKind == null) {
            throw new AdapterNotFoundException(null);
        }
        DispatchAdapter byId = adapters.get(idOrKind);
        if (byId != null) {
            return byId;
        }
        return adapters.values().stream()
            .filter(adapter -> idOrKind.equals(adapter.adapterKind()))
            .min((a, b) -> a.adapterId().compareTo(b.adapterId()))
            .orElseThrow(() -> new AdapterNotFoundException(idOrKind));
    }

    public List<DispatchAdapter> list() {
        return adapters.values().stream()
            .sorted((a, b) -> a.adapterId().compareTo(b.adapterId()))
            .toList();
    }
}
