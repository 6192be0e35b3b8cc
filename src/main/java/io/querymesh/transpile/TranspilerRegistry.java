package io.querymesh.transpile;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class TranspilerRegistry {
    private final Map<String, Transpiler> transpilers = new ConcurrentHashMap<>();

    public void register(Transpiler transpiler) {
        transpilers.put(transpiler.id(), transpiler);
    }

    public Optional<Transpiler> findById(String transpilerId) {
        return Optional.ofNullable(transpilers.get(transpilerId));
    }

    public Transpiler require(String transpilerId) {
        return findById(transpilerId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown transpiler: " + transpilerId));
    }

    public Collection<String> listTranspilerIds() {
        return transpilers.keySet();
    }
}
