package net.katagaitai.tsurugi.evm;

import com.google.common.collect.Lists;
import lombok.Getter;
import lombok.Setter;
import net.katagaitai.tsurugi.evm.cfg.Node;
import net.katagaitai.tsurugi.evm.transaction.BaseTransaction;
import org.apache.commons.lang3.tuple.Pair;

import java.math.BigInteger;
import java.util.List;

public class GlobalState {
    @Getter
    private final WorldState worldState;
    @Getter
    private final Environment environment;
    @Getter
    private final BigInteger gasLimit;
    // (トランザクション, 呼び出し元の状態)。呼び出し元がない場合はnull
    private final List<Pair<BaseTransaction, GlobalState>> transactionStack = Lists.newArrayList();
    @Getter
    @Setter
    private Node node;
    @Getter
    @Setter
    private int pc;
    @Getter
    @Setter
    private boolean reverted;

    public GlobalState(WorldState worldState, Environment environment, BigInteger gasLimit) {
        this.worldState = worldState;
        this.environment = environment;
        this.gasLimit = gasLimit;
    }

    public List<Pair<BaseTransaction, GlobalState>> getTransactionStack() {
        return transactionStack;
    }

    public BaseTransaction getCurrentTransaction() {
        if (transactionStack.isEmpty()) {
            return null;
        }
        return transactionStack.get(transactionStack.size() - 1).getLeft();
    }

    public Constraints getConstraints() {
        return worldState.getConstraints();
    }

    public Account getActiveAccount() {
        return environment.getActiveAccount();
    }

    @Override
    public String toString() {
        return "GlobalState{" +
                "account=" + environment.getActiveAccount().getAddressHex() +
                ", function=" + environment.getActiveFunctionName() +
                ", pc=" + pc +
                ", node=" + (node == null ? "null" : node.getUid()) +
                '}';
    }
}
