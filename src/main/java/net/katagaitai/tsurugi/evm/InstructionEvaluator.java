package net.katagaitai.tsurugi.evm;

import java.util.List;

public interface InstructionEvaluator {
    // 空のリストは終了。revertしたかどうかはGlobalState#isReverted
    List<GlobalState> evaluate(GlobalState state);
}
