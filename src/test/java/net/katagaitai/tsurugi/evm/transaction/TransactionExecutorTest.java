package net.katagaitai.tsurugi.evm.transaction;

import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import net.katagaitai.tsurugi.evm.*;
import net.katagaitai.tsurugi.evm.cfg.Edge;
import net.katagaitai.tsurugi.evm.cfg.JumpType;
import net.katagaitai.tsurugi.evm.cfg.Node;
import net.katagaitai.tsurugi.evm.cfg.NodeIdManager;
import net.katagaitai.tsurugi.evm.cfg.StateSpace;
import net.katagaitai.tsurugi.util.Constants;
import net.katagaitai.tsurugi.util.Util;
import net.katagaitai.tsurugi.util.Z3Util;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.math.BigInteger;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static junit.framework.TestCase.*;

public class TransactionExecutorTest {
    private static final String ORIGIN = "0x6ac7ea33f8831ea9dcc53393aaa88b25a785dbf0";
    private static final String CALLER = "0x00000000000000000000000000000000deadbeef";
    private static final String CALLEE = "0x0000000000000000000000000000000000001234";

    private final NodeIdManager nodeIdManager = new NodeIdManager();
    private Context context;
    private RecordingEngine engine;
    private TransactionExecutor executor;

    /**
     * exec直前のワークリストと未探索の世界状態を記録する。
     */
    private static class RecordingEngine extends WorkListEngine {
        private List<GlobalState> staged;
        private int openStateCountAtExec = -1;
        private Boolean recordFullTrace;

        RecordingEngine(Context context, NodeIdManager nodeIdManager) {
            // 評価器は即座に正常終了する
            super(context, state -> Collections.emptyList(), nodeIdManager);
        }

        @Override
        public List<GlobalState> exec(boolean recordFullTrace, boolean trackGas) {
            this.staged = getWorkList();
            this.openStateCountAtExec = getOpenStates().size();
            this.recordFullTrace = recordFullTrace;
            return super.exec(recordFullTrace, trackGas);
        }
    }

    @Before
    public void setup() {
        context = Z3Util.mkContext();
        engine = new RecordingEngine(context, nodeIdManager);
        executor = new TransactionExecutor(new TransactionIdManager());
    }

    @After
    public void tearDown() {
        context.close();
    }

    private TransactionParams.TransactionParamsBuilder call() {
        return TransactionParams.builder()
                .calleeAddress(CALLEE)
                .callerAddress(CALLER)
                .originAddress(ORIGIN)
                .data(new byte[]{0x12, 0x34})
                .gasLimit(Constants.DEFAULT_GAS_LIMIT)
                .gasPrice(Constants.DEFAULT_GAS_PRICE)
                .value(BigInteger.ZERO);
    }

    private TransactionParams.TransactionParamsBuilder creation() {
        return call().calleeAddress("").callerAddress("").data(Util.hexToBytes("6001600055")).contractName("Token");
    }

    private WorldState openWorldState() {
        WorldState worldState = new WorldState(context);
        engine.addOpenState(worldState);
        return worldState;
    }

    private static BigInteger value(com.microsoft.z3.BitVecExpr e) {
        return Z3Util.getBVNum(e).getBigInteger();
    }

    @Test
    public void test_コントラクト作成_callerが空ならorigin() {
        WorldState worldState = openWorldState();
        List<GlobalState> finalStates = executor.executeTransaction(engine, creation().build());

        assertEquals(1, engine.staged.size());
        assertTrue(engine.recordFullTrace);
        assertNotNull(finalStates);
        assertEquals(1, finalStates.size());

        GlobalState state = engine.staged.get(0);
        BaseTransaction transaction = state.getCurrentTransaction();
        assertTrue(transaction instanceof ContractCreationTransaction);
        assertEquals(TransactionType.CONTRACT_CREATION, transaction.getTxType());
        assertEquals(Util.hexToBigInteger(ORIGIN), value(transaction.getCaller()));
        assertEquals(Util.hexToBigInteger(ORIGIN), value(transaction.getOrigin()));
        assertEquals("6001600055", transaction.getCode().getHex());
        assertTrue(transaction.getCallData() instanceof ConcreteCalldata);
        assertEquals(0, ((ConcreteCalldata) transaction.getCallData()).getConcreteBytes().length);

        Account created = state.getActiveAccount();
        assertEquals(Util.contractAddress(Util.hexToBigInteger(ORIGIN), BigInteger.ZERO), created.getAddress());
        assertEquals("Token", created.getContractName());
        assertEquals(BigInteger.ONE, created.getNonce());
        // 登録はエンジンが行う
        assertFalse(worldState.hasAccount(created.getAddress()));

        assertEquals("constructor", state.getEnvironment().getActiveFunctionName());
        assertEquals("Token", state.getNode().getContractName());
        assertEquals("constructor", state.getNode().getFunctionName());
    }

    @Test
    public void test_コントラクト作成_名前なし() {
        openWorldState();
        executor.executeTransaction(engine, creation().contractName(null).build());
        assertEquals("unknown", engine.staged.get(0).getNode().getContractName());
    }

    @Test
    public void test_メッセージコール() {
        WorldState worldState = openWorldState();
        List<GlobalState> finalStates = executor.executeTransaction(engine, call().build());

        assertFalse(engine.recordFullTrace);
        assertNull(finalStates);
        GlobalState state = engine.staged.get(0);
        BaseTransaction transaction = state.getCurrentTransaction();
        assertTrue(transaction instanceof MessageCallTransaction);
        assertEquals(TransactionType.MESSAGE_CALL, transaction.getTxType());
        assertEquals(Util.hexToBigInteger(CALLEE), transaction.getCalleeAccount().getAddress());
        assertEquals(Util.hexToBigInteger(CALLER), value(transaction.getCaller()));
        assertEquals(Util.hexToBigInteger(ORIGIN), value(transaction.getOrigin()));
        // 存在しないcalleeはステージングで登録されない
        assertFalse(worldState.hasAccount(Util.hexToBigInteger(CALLEE)));
        assertTrue(worldState.getAccounts().isEmpty());
        assertTrue(transaction.getCalleeAccount().getCode().isEmpty());
        assertEquals("fallback", state.getEnvironment().getActiveFunctionName());
        assertEquals(BigInteger.TEN, value(state.getEnvironment().getGasPrice()));
        assertEquals(BigInteger.valueOf(8_000_000), state.getGasLimit());

        ConcreteCalldata calldata = (ConcreteCalldata) transaction.getCallData();
        assertEquals(transaction.getId(), calldata.getTxId());
        assertEquals("1234", Util.bytesToHex(calldata.getConcreteBytes()));
    }

    @Test
    public void test_メッセージコール_callerが空ならorigin() {
        openWorldState();
        executor.executeTransaction(engine, call().callerAddress("").build());
        BaseTransaction transaction = engine.staged.get(0).getCurrentTransaction();
        assertEquals(Util.hexToBigInteger(ORIGIN), value(transaction.getCaller()));
    }

    @Test
    public void test_trackGasなら終了状態を返す() {
        openWorldState();
        openWorldState();
        List<GlobalState> finalStates = executor.executeTransaction(engine, call().trackGas(true).build());
        assertNotNull(finalStates);
        assertEquals(2, finalStates.size());
    }

    @Test
    public void test_コードの指定() {
        WorldState worldState = openWorldState();
        worldState.putAccount(new Account(Util.hexToBigInteger(CALLEE), new Code("6001"), "Callee"));
        executor.executeTransaction(engine, call().build());
        assertSame(worldState.findAccount(Util.hexToBigInteger(CALLEE)),
                engine.staged.get(0).getCurrentTransaction().getCalleeAccount());
        assertEquals("6001", engine.staged.get(0).getCurrentTransaction().getCode().getHex());
        assertEquals("Callee", engine.staged.get(0).getNode().getContractName());

        executor.executeTransaction(engine, call().code("0x6002").build());
        assertEquals("6002", engine.staged.get(0).getCurrentTransaction().getCode().getHex());
    }

    @Test
    public void test_シンボリックなcalldata() {
        openWorldState();
        openWorldState();
        executor.executeTransaction(engine, call().symbolicCalldata(true).build());
        assertEquals(2, engine.staged.size());
        for (GlobalState state : engine.staged) {
            BaseTransaction transaction = state.getCurrentTransaction();
            BaseCalldata calldata = transaction.getCallData();
            assertTrue(calldata instanceof SymbolicCalldata);
            assertEquals(transaction.getId(), calldata.getTxId());
            assertEquals(transaction.getId() + "_calldatasize",
                    calldata.getSize().getFuncDecl().getName().toString());
        }
    }

    @Test
    public void test_トランザクションスタック() {
        WorldState worldState = openWorldState();
        executor.executeTransaction(engine, call().build());
        GlobalState state = engine.staged.get(0);
        assertEquals(1, state.getTransactionStack().size());
        assertSame(state.getCurrentTransaction(), state.getTransactionStack().get(0).getLeft());
        assertNull(state.getTransactionStack().get(0).getRight());
        assertEquals(Collections.singletonList(state.getCurrentTransaction()), worldState.getTransactionSequence());
        assertSame(worldState, state.getWorldState());
        assertTrue(state.getNode().getStates().contains(state));
    }

    @Test
    public void test_未探索の状態はすべてステージングされる() {
        for (int i = 0; i < 3; i++) {
            openWorldState();
        }
        executor.executeTransaction(engine, call().build());
        assertEquals(3, engine.staged.size());
        assertEquals(0, engine.openStateCountAtExec);
        assertTrue(engine.getWorkList().isEmpty());
        // 正常終了した状態は次のトランザクションで再び使える
        assertEquals(3, engine.getOpenStates().size());

        long firstId = engine.staged.get(0).getCurrentTransaction().getId();
        for (int i = 1; i < 3; i++) {
            assertTrue(engine.staged.get(i).getCurrentTransaction().getId() > firstId);
        }
    }

    @Test
    public void test_未探索の状態がなければ何もしない() {
        List<GlobalState> finalStates = executor.executeTransaction(engine, call().trackGas(true).build());
        assertTrue(engine.staged.isEmpty());
        assertTrue(finalStates.isEmpty());
        assertEquals(0, engine.getStateSpace().nodeCount());
    }

    @Test
    public void test_前のノードからエッジを張る() {
        StateSpace stateSpace = engine.getStateSpace();
        WorldState worldState = openWorldState();
        Node prev = stateSpace.newNode("Token", "constructor");
        stateSpace.addNode(prev);
        worldState.setNode(prev);
        BoolExpr p = context.mkBoolConst("p");
        worldState.getConstraints().append(p);

        executor.executeTransaction(engine, call().build());

        assertEquals(2, stateSpace.nodeCount());
        List<Edge> edges = stateSpace.getEdges();
        assertEquals(1, edges.size());
        Edge edge = edges.get(0);
        Node newNode = engine.staged.get(0).getNode();
        assertEquals(prev.getUid(), edge.getNodeFrom());
        assertEquals(newNode.getUid(), edge.getNodeTo());
        assertEquals(JumpType.TRANSACTION, edge.getType());
        assertNull(edge.getCondition());

        assertEquals(worldState.getConstraints(), newNode.getConstraints());
        // 後から追加した制約はスナップショットに影響しない
        worldState.getConstraints().append(context.mkBoolConst("q"));
        assertEquals(1, newNode.getConstraints().size());
        assertEquals(2, worldState.getConstraints().size());

        // 終了時に世界状態のノードが進む
        assertSame(newNode, worldState.getNode());
    }

    @Test
    public void test_最初のトランザクションにはエッジがない() {
        openWorldState();
        executor.executeTransaction(engine, call().build());
        StateSpace stateSpace = engine.getStateSpace();
        assertEquals(1, stateSpace.nodeCount());
        assertEquals(0, stateSpace.edgeCount());
        assertNull(engine.staged.get(0).getNode().getConstraints());
    }

    @Test
    public void test_状態空間を記録しない() {
        engine.setRequiresStatespace(false);
        WorldState worldState = openWorldState();
        Node prev = engine.getStateSpace().newNode("Token", "constructor");
        worldState.setNode(prev);

        executor.executeTransaction(engine, call().build());

        assertEquals(0, engine.getStateSpace().nodeCount());
        assertEquals(0, engine.getStateSpace().edgeCount());
        GlobalState state = engine.staged.get(0);
        assertNotNull(state.getNode());
        assertNull(state.getNode().getConstraints());
    }

    @Test
    public void test_2層のトランザクション() {
        StateSpace stateSpace = engine.getStateSpace();
        List<WorldState> worldStates = Lists.newArrayList();
        for (int i = 0; i < 3; i++) {
            WorldState worldState = openWorldState();
            Node prev = stateSpace.newNode("Token", "constructor");
            stateSpace.addNode(prev);
            worldState.setNode(prev);
            worldStates.add(worldState);
        }

        executor.executeTransaction(engine, call().build());
        assertEquals(6, stateSpace.nodeCount());
        assertEquals(3, stateSpace.edgeCount());
        Map<WorldState, Node> layer1 = Maps.newIdentityHashMap();
        for (WorldState worldState : worldStates) {
            layer1.put(worldState, worldState.getNode());
        }

        executor.executeTransaction(engine, call().callerAddress(ORIGIN).build());
        assertEquals(9, stateSpace.nodeCount());
        assertEquals(6, stateSpace.edgeCount());
        List<Edge> layer2Edges = stateSpace.getEdges().subList(3, 6);
        for (WorldState worldState : worldStates) {
            Node from = layer1.get(worldState);
            Node to = worldState.getNode();
            assertNotSame(from, to);
            boolean found = false;
            for (Edge edge : layer2Edges) {
                if (edge.getNodeFrom() == from.getUid() && edge.getNodeTo() == to.getUid()) {
                    found = true;
                }
            }
            assertTrue(found);

            List<BaseTransaction> sequence = worldState.getTransactionSequence();
            assertEquals(2, sequence.size());
            assertTrue(sequence.get(0).getId() < sequence.get(1).getId());
        }
        assertEquals(3, engine.getOpenStates().size());
        assertEquals(6, executor.getTxIdManager().peek());
    }

    @Test
    public void test_引数がない() {
        openWorldState();
        try {
            executor.executeTransaction(engine, call().calleeAddress(null).build());
            fail();
        } catch (InvalidArgumentException e) {
            assertEquals("Argument not found: calleeAddress", e.getMessage());
        }
        try {
            executor.executeTransaction(engine, call().value(null).build());
            fail();
        } catch (InvalidArgumentException e) {
            assertEquals("Argument not found: value", e.getMessage());
        }
        try {
            executor.executeTransaction(engine, call().data(null).build());
            fail();
        } catch (InvalidArgumentException e) {
            assertTrue(e.getMessage().contains("data"));
        }
        // 未探索の状態は消費されない
        assertEquals(1, engine.getOpenStates().size());
        assertNull(engine.staged);
    }

    @Test
    public void test_不正なアドレス() {
        openWorldState();
        try {
            executor.executeTransaction(engine, call().callerAddress("0xzz").build());
            fail();
        } catch (InvalidArgumentException e) {
            assertTrue(e.getMessage().contains("callerAddress"));
        }
        try {
            executor.executeTransaction(engine, call().calleeAddress("0x1" + "0".repeat(64)).build());
            fail();
        } catch (InvalidArgumentException e) {
            assertTrue(e.getMessage().contains("calleeAddress"));
        }
        assertEquals(1, engine.getOpenStates().size());
    }
}
