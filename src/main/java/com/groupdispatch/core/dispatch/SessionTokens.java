package com.groupdispatch.core.dispatch;

import com.groupdispatch.core.persistence.DispatchStore;
import com.groupdispatch.core.persistence.StoreException;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Continuation tokens keyed by conversation folder. They outlive sandbox processes.
 */
@Service
public class SessionTokens {

    private final DispatchStore store;
    private final Map<String, String> tokens = new ConcurrentHashMap<>();

    public SessionTokens(DispatchStore store) {
        this.store = store;
    }

    public void load() {
        tokens.clear();
        tokens.putAll(store.getAllSessions());
    }

    public Optional<String> get(String folder) {
        return Optional.ofNullable(tokens.get(folder));
    }

    /**
     * Persists the token, then makes it current.
     *
     * @throws StoreException if the token could not be persisted
     */
    public void update(String folder, String token) {
        store.setSession(folder, token);
        tokens.put(folder, token);
    }

    public Map<String, String> snapshot() {
        return Map.copyOf(tokens);
    }
}
