package net.katagaitai.tsurugi.evm;

import com.microsoft.z3.Context;
import net.katagaitai.tsurugi.evm.cfg.StateSpace;

import java.util.List;

public interface ExplorationEngine {
    Context getContext();

    // 取り出しと消去を一度に行う
    List<WorldState> drainOpenStates();

    void addOpenState(WorldState worldState);

    List<WorldState> getOpenStates();

    void enqueue(GlobalState state);

    List<GlobalState> getWorkList();

    StateSpace getStateSpace();

    boolean isRequiresStatespace();

    // どちらのフラグもなければnull
    List<GlobalState> exec(boolean recordFullTrace, boolean trackGas);
}
