package util.ir;

import ir.value.Value;
import ir.value.instructions.LoopInst;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Values defined by one loaded IR text, looked up by their {@code %name}.
 */
public class IRText {
    private final String sourceName;
    private final Map<String, Value> values;
    private final List<Value> nodes;

    IRText(String sourceName, LinkedHashMap<String, Value> values, List<Value> nodes) {
        this.sourceName = sourceName;
        this.values = Collections.unmodifiableMap(values);
        this.nodes = Collections.unmodifiableList(nodes);
    }

    public String getSourceName() {
        return sourceName;
    }

    /**
     * @param name the name with or without the leading {@code %}
     * @throws IllegalArgumentException if nothing of that name was defined
     */
    public Value get(String name) {
        String key = name.startsWith("%") ? name.substring(1) : name;
        Value value = values.get(key);
        if (value == null) {
            throw new IllegalArgumentException("no value %" + key + " in " + sourceName);
        }
        return value;
    }

    public LoopInst getLoop(String name) {
        Value value = get(name);
        if (!(value instanceof LoopInst loop)) {
            throw new IllegalArgumentException(value.getReference() + " is not a loop");
        }
        return loop;
    }

    public boolean contains(String name) {
        return values.containsKey(name.startsWith("%") ? name.substring(1) : name);
    }

    /**
     * Named values in definition order.
     */
    public Map<String, Value> getValues() {
        return values;
    }

    /**
     * Every node created while loading, constants included.
     */
    public List<Value> getNodes() {
        return nodes;
    }
}
