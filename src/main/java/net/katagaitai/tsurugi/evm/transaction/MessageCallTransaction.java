package net.katagaitai.tsurugi.evm.transaction;

import com.microsoft.z3.BitVecExpr;
import net.katagaitai.tsurugi.evm.Account;
import net.katagaitai.tsurugi.evm.BaseCalldata;
import net.katagaitai.tsurugi.evm.Code;
import net.katagaitai.tsurugi.evm.GlobalState;
import net.katagaitai.tsurugi.evm.WorldState;
import net.katagaitai.tsurugi.util.Constants;

import java.math.BigInteger;

public class MessageCallTransaction extends BaseTransaction {

    public MessageCallTransaction(long id, WorldState worldState, BigInteger gasPrice, BigInteger gasLimit,
                                  BitVecExpr origin, BitVecExpr caller, BigInteger callValue, Code code,
                                  BaseCalldata callData, Account calleeAccount) {
        super(id, worldState, gasPrice, gasLimit, origin, caller, callValue, code, callData, calleeAccount);
    }

    @Override
    public TransactionType getTxType() {
        return TransactionType.MESSAGE_CALL;
    }

    @Override
    public GlobalState initialGlobalState() {
        return initialGlobalStateFromEnvironment(calleeAccount, Constants.FALLBACK_FUNCTION_NAME);
    }
}
