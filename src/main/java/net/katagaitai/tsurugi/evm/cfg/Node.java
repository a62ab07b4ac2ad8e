package net.katagaitai.tsurugi.evm.cfg;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;
import lombok.Getter;
import net.katagaitai.tsurugi.evm.Constraints;
import net.katagaitai.tsurugi.evm.GlobalState;

import java.util.Collections;
import java.util.List;
import java.util.Set;

public class Node {
    @Getter
    private final int uid;
    @Getter
    private final String contractName;
    @Getter
    private final String functionName;
    @Getter
    private final int startAddress;
    private final List<GlobalState> states = Lists.newArrayList();
    private final Set<NodeFlag> flags = Sets.newEnumSet(Collections.emptySet(), NodeFlag.class);
    private Constraints constraints;

    Node(int uid, String contractName, String functionName, int startAddress) {
        this.uid = uid;
        this.contractName = contractName;
        this.functionName = functionName;
        this.startAddress = startAddress;
    }

    public void addState(GlobalState state) {
        states.add(state);
    }

    public List<GlobalState> getStates() {
        return ImmutableList.copyOf(states);
    }

    public void addFlag(NodeFlag flag) {
        flags.add(flag);
    }

    public Set<NodeFlag> getFlags() {
        return Collections.unmodifiableSet(flags);
    }

    public Constraints getConstraints() {
        return constraints;
    }

    // 一度だけ設定できる
    public void setConstraints(Constraints constraints) {
        if (this.constraints != null) {
            throw new IllegalStateException("制約は設定済みです: node " + uid);
        }
        this.constraints = constraints.copy();
    }

    @Override
    public String toString() {
        return "Node{" +
                "uid=" + uid +
                ", contractName=" + contractName +
                ", functionName=" + functionName +
                ", states=" + states.size() +
                '}';
    }
}
