package net.katagaitai.tsurugi.evm.transaction;

import com.microsoft.z3.BitVecExpr;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import net.katagaitai.tsurugi.evm.Account;
import net.katagaitai.tsurugi.evm.BaseCalldata;
import net.katagaitai.tsurugi.evm.Code;
import net.katagaitai.tsurugi.evm.GlobalState;
import net.katagaitai.tsurugi.evm.WorldState;
import net.katagaitai.tsurugi.util.Constants;
import net.katagaitai.tsurugi.util.Util;
import net.katagaitai.tsurugi.util.Z3Util;

import java.math.BigInteger;

// 新しいアカウントの登録は探索エンジンが行う
@Slf4j(topic = "tsurugi")
public class ContractCreationTransaction extends BaseTransaction {
    @Getter
    private final String contractName;

    public ContractCreationTransaction(long id, WorldState worldState, BigInteger gasPrice, BigInteger gasLimit,
                                       BitVecExpr origin, BitVecExpr caller, BigInteger callValue, Code code,
                                       BaseCalldata callData, String contractName) {
        super(id, worldState, gasPrice, gasLimit, origin, caller, callValue, code, callData, null);
        this.contractName = contractName;
    }

    @Override
    public TransactionType getTxType() {
        return TransactionType.CONTRACT_CREATION;
    }

    @Override
    public GlobalState initialGlobalState() {
        if (!Z3Util.isBVNum(getCaller())) {
            throw new IllegalStateException("callerが具体値ではありません: " + getCaller());
        }
        BigInteger creator = Z3Util.getBVNum(getCaller()).getBigInteger();
        BigInteger address = getWorldState().nextContractAddress(creator);
        log.debug("コントラクト作成: {} -> {}", Util.toAddressHex(creator), Util.toAddressHex(address));
        calleeAccount = new Account(address, Code.EMPTY,
                contractName == null ? Constants.UNKNOWN_CONTRACT_NAME : contractName);
        calleeAccount.setNonce(BigInteger.ONE);
        return initialGlobalStateFromEnvironment(calleeAccount, Constants.CONSTRUCTOR_FUNCTION_NAME);
    }
}
