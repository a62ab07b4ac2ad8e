package net.katagaitai.tsurugi.evm.transaction;

import com.microsoft.z3.BitVecExpr;
import com.microsoft.z3.Context;
import lombok.Getter;
import net.katagaitai.tsurugi.evm.Account;
import net.katagaitai.tsurugi.evm.BaseCalldata;
import net.katagaitai.tsurugi.evm.Code;
import net.katagaitai.tsurugi.evm.Environment;
import net.katagaitai.tsurugi.evm.GlobalState;
import net.katagaitai.tsurugi.evm.WorldState;
import net.katagaitai.tsurugi.util.Z3Util;

import java.math.BigInteger;

@Getter
public abstract class BaseTransaction {
    private final long id;
    private final WorldState worldState;
    private final BigInteger gasPrice;
    private final BigInteger gasLimit;
    private final BitVecExpr origin;
    private final BitVecExpr caller;
    private final BigInteger callValue;
    private final Code code;
    private final BaseCalldata callData;
    protected Account calleeAccount;

    protected BaseTransaction(long id, WorldState worldState, BigInteger gasPrice, BigInteger gasLimit,
                              BitVecExpr origin, BitVecExpr caller, BigInteger callValue, Code code,
                              BaseCalldata callData, Account calleeAccount) {
        this.id = id;
        this.worldState = worldState;
        this.gasPrice = gasPrice;
        this.gasLimit = gasLimit;
        this.origin = origin;
        this.caller = caller;
        this.callValue = callValue;
        this.code = code;
        this.callData = callData;
        this.calleeAccount = calleeAccount;
    }

    public abstract TransactionType getTxType();

    public abstract GlobalState initialGlobalState();

    protected GlobalState initialGlobalStateFromEnvironment(Account activeAccount, String activeFunctionName) {
        Context context = worldState.getContext();
        Environment environment = Environment.builder()
                .activeAccount(activeAccount)
                .sender(caller)
                .origin(origin)
                .callData(callData)
                .gasPrice(Z3Util.mkWord(context, gasPrice))
                .callValue(Z3Util.mkWord(context, callValue))
                .code(code)
                .activeFunctionName(activeFunctionName)
                .build();
        return new GlobalState(worldState, environment, gasLimit);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" +
                "id=" + id +
                ", caller=" + caller +
                ", callee=" + (calleeAccount == null ? "null" : calleeAccount.getAddressHex()) +
                ", callValue=" + callValue +
                '}';
    }
}
