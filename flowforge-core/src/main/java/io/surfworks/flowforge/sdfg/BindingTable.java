package io.surfworks.flowforge.sdfg;

import io.surfworks.flowforge.ir.ProgramAst.Location;
import io.surfworks.flowforge.ir.ProgramAst.Value;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Per-scope map from value names to the connector providing the value.
 */
public final class BindingTable {

    private final Map<String, Connector> bindings = new LinkedHashMap<>();

    public boolean contains(Value value) {
        return bindings.containsKey(value.name());
    }

    public Optional<Connector> find(Value value) {
        return Optional.ofNullable(bindings.get(value.name()));
    }

    public Connector require(Value value, Location location) {
        Connector connector = bindings.get(value.name());
        if (connector == null) {
            throw TranslationException.structural("Tried to lookup nonexistent value " + value.toSourceString(),
                    location);
        }
        return connector;
    }

    public void bind(Value value, Connector connector) {
        bindings.put(value.name(), connector);
    }

    public int size() {
        return bindings.size();
    }
}
