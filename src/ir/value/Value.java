package ir.value;

import ir.type.Type;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

public abstract class Value {
    private static final AtomicInteger NEXT_ID = new AtomicInteger();

    // stable for the whole lifetime of the node, analyses key their tables on it
    private final int id;
    private final Type type;
    private final String name;

    protected Value(Type type, String name) {
        this.id = NEXT_ID.getAndIncrement();
        this.type = Objects.requireNonNull(type, "type");
        this.name = name;
    }

    public abstract String toNLVM();

    /* getter */
    public int getId() { return this.id; }
    public String getName() { return this.name; }
    public Type getType() { return this.type; }
    public boolean isConstant() { return false; }

    /**
     * Number of parallel lanes this value carries.
     */
    public int getWidth() {
        return type.getLanes();
    }

    /**
     * 获取在指令中引用此值时的字符串表示
     * 对于常量：返回值部分（如 "42"）
     * 对于其它值：返回名字引用（如 "%ptr"）
     */
    public String getReference() {
        if (isConstant()) {
            String full = toNLVM();
            // composite constants: "<2 x i32> [1, 2]" -> "[1, 2]"
            int split = -1;
            for (int i = 0, depth = 0; i < full.length(); i++) {
                char c = full.charAt(i);
                if (c == '[' || c == '<')      depth++;
                else if (c == ']' || c == '>') depth--;
                else continue;

                if (depth == 0 && i + 1 < full.length() && full.charAt(i + 1) == ' ') {
                    split = i + 2;
                    break;
                }
            }

            // scalar constants: "i32 42" -> "42"
            if (split == -1) {
                split = full.indexOf(' ');
                if (split == -1)
                    throw new IllegalStateException("Bad constant encoding: " + full);
                split++;
            }

            return full.substring(split);
        }

        return "%" + getName();
    }

    @Override
    public String toString() {
        return getReference() + "#" + id;
    }
}
