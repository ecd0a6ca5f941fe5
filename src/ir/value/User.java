package ir.value;

import ir.type.Type;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

public abstract class User extends Value {

    // operands are references into the graph, the user never owns them
    private final ArrayList<Value> operands;

    protected User(Type type, String name) {
        super(type, name);
        this.operands = new ArrayList<>();
    }

    /* getter */
    public int getNumOperands() { return operands.size(); }
    public Value getOperand(int index) { return operands.get(index); }

    // to assure the consistency, you can only get a read only list
    public List<Value> getOperands() {
        return Collections.unmodifiableList(operands);
    }

    /* operands are fixed once the node is constructed */
    protected void addOperand(Value value) {
        Objects.requireNonNull(value, "Operand value cannot be null");
        this.operands.add(value);
    }

    /* check field */
    // identity check, two equal constants are still different operands
    public boolean usesValue(Value value) {
        for (var operand : operands) {
            if (operand == value) {
                return true;
            }
        }
        return false;
    }
}
