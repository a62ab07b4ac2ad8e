package net.katagaitai.tsurugi.evm.cfg;

import com.microsoft.z3.BoolExpr;
import lombok.Value;

// トランザクションのエッジに条件はない
@Value
public class Edge {
    private int nodeFrom;
    private int nodeTo;
    private JumpType type;
    private BoolExpr condition;

    public static Edge transaction(int nodeFrom, int nodeTo) {
        return new Edge(nodeFrom, nodeTo, JumpType.TRANSACTION, null);
    }

    @Override
    public String toString() {
        return nodeFrom + " -> " + nodeTo + " [" + type + (condition == null ? "" : ", " + condition) + "]";
    }
}
