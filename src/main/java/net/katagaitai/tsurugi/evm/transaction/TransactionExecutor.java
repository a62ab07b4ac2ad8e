package net.katagaitai.tsurugi.evm.transaction;

import com.microsoft.z3.BitVecNum;
import com.microsoft.z3.Context;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.katagaitai.tsurugi.evm.*;
import net.katagaitai.tsurugi.evm.cfg.Edge;
import net.katagaitai.tsurugi.evm.cfg.Node;
import net.katagaitai.tsurugi.evm.cfg.StateSpace;
import net.katagaitai.tsurugi.util.Constants;
import net.katagaitai.tsurugi.util.Util;
import net.katagaitai.tsurugi.util.Z3Util;
import org.apache.commons.lang3.tuple.Pair;

import java.math.BigInteger;
import java.util.List;

// 未探索の世界状態ごとにトランザクションを作り、状態空間につないで探索する
@Slf4j(topic = "tsurugi")
@RequiredArgsConstructor
public class TransactionExecutor {
    @Getter
    private final TransactionIdManager txIdManager;

    public List<GlobalState> executeTransaction(ExplorationEngine engine, TransactionParams params) {
        String calleeAddress = require(params.getCalleeAddress(), "calleeAddress");
        String callerAddress = require(params.getCallerAddress(), "callerAddress");
        String originAddress = require(params.getOriginAddress(), "originAddress");
        require(params.getData(), "data");
        require(params.getGasLimit(), "gasLimit");
        require(params.getGasPrice(), "gasPrice");
        require(params.getValue(), "value");

        Context context = engine.getContext();
        if (callerAddress.isEmpty()) {
            callerAddress = originAddress;
        }
        BitVecNum origin = toWord(context, originAddress, "originAddress");
        BitVecNum caller = toWord(context, callerAddress, "callerAddress");
        if (calleeAddress.isEmpty()) {
            return executeContractCreation(engine, params, caller, origin);
        }
        BitVecNum callee = toWord(context, calleeAddress, "calleeAddress");
        return executeMessageCall(engine, params, callee, caller, origin);
    }

    public List<GlobalState> executeContractCreation(ExplorationEngine engine, TransactionParams params,
                                                     BitVecNum caller, BitVecNum origin) {
        List<WorldState> openStates = engine.drainOpenStates();
        log.info("コントラクト作成: {} open states", openStates.size());
        Context context = engine.getContext();
        // 作成時はdataがinit codeになる
        Code initCode = new Code(params.getData());
        for (WorldState openWorldState : openStates) {
            long nextTransactionId = txIdManager.getNextTransactionId();
            ContractCreationTransaction transaction = new ContractCreationTransaction(
                    nextTransactionId,
                    openWorldState,
                    params.getGasPrice(),
                    params.getGasLimit(),
                    origin,
                    caller,
                    params.getValue(),
                    initCode,
                    new ConcreteCalldata(context, nextTransactionId, new byte[0]),
                    params.getContractName());
            setupGlobalStateForExecution(engine, transaction);
        }
        return engine.exec(true, params.isTrackGas());
    }

    public List<GlobalState> executeMessageCall(ExplorationEngine engine, TransactionParams params,
                                                BitVecNum callee, BitVecNum caller, BitVecNum origin) {
        List<WorldState> openStates = engine.drainOpenStates();
        log.info("メッセージコール: {} {} open states", Util.toAddressHex(callee.getBigInteger()), openStates.size());
        Context context = engine.getContext();
        for (WorldState openWorldState : openStates) {
            long nextTransactionId = txIdManager.getNextTransactionId();
            Account calleeAccount = openWorldState.findAccount(callee.getBigInteger());
            if (calleeAccount == null) {
                // ステージングでは世界状態に登録しない
                calleeAccount = new Account(callee.getBigInteger(), Code.EMPTY, null);
            }
            Code code = params.getCode() == null ? calleeAccount.getCode() : new Code(params.getCode());
            BaseCalldata callData = params.isSymbolicCalldata()
                    ? new SymbolicCalldata(context, nextTransactionId)
                    : new ConcreteCalldata(context, nextTransactionId, params.getData());
            MessageCallTransaction transaction = new MessageCallTransaction(
                    nextTransactionId,
                    openWorldState,
                    params.getGasPrice(),
                    params.getGasLimit(),
                    origin,
                    caller,
                    params.getValue(),
                    code,
                    callData,
                    calleeAccount);
            setupGlobalStateForExecution(engine, transaction);
        }
        return engine.exec(false, params.isTrackGas());
    }

    public void setupGlobalStateForExecution(ExplorationEngine engine, BaseTransaction transaction) {
        GlobalState globalState = transaction.initialGlobalState();
        // 戻り値はまだない
        globalState.getTransactionStack().add(Pair.of(transaction, null));

        Environment environment = globalState.getEnvironment();
        String contractName = environment.getActiveAccount().getContractName();
        StateSpace stateSpace = engine.getStateSpace();
        Node newNode = stateSpace.newNode(
                contractName == null ? Constants.UNKNOWN_CONTRACT_NAME : contractName,
                environment.getActiveFunctionName());

        WorldState worldState = transaction.getWorldState();
        if (engine.isRequiresStatespace()) {
            stateSpace.addNode(newNode);
            Node prevNode = worldState.getNode();
            if (prevNode != null) {
                stateSpace.addEdge(Edge.transaction(prevNode.getUid(), newNode.getUid()));
                newNode.setConstraints(globalState.getWorldState().getConstraints());
            }
        }

        worldState.addTransaction(transaction);
        globalState.setNode(newNode);
        newNode.addState(globalState);
        engine.enqueue(globalState);
        log.debug("ステージング: tx {} node {}", transaction.getId(), newNode.getUid());
    }

    private static <T> T require(T value, String name) {
        if (value == null) {
            throw InvalidArgumentException.notFound(name);
        }
        return value;
    }

    private static BitVecNum toWord(Context context, String hex, String name) {
        BigInteger value;
        try {
            value = Util.hexToBigInteger(hex);
        } catch (NumberFormatException e) {
            throw new InvalidArgumentException("Malformed argument: " + name + " = " + hex, e);
        }
        if (value.signum() < 0 || value.bitLength() > Constants.WORD_BITS) {
            throw new InvalidArgumentException("Malformed argument: " + name + " = " + hex);
        }
        return Z3Util.mkWord(context, value);
    }
}
