package net.katagaitai.tsurugi.smt;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Params;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Status;
import net.katagaitai.tsurugi.util.Constants;

public class SmtSolver extends BaseSolver<Solver> {

    public SmtSolver(Context context) {
        this(context, null);
    }

    public SmtSolver(Context context, SolverStatistics statistics) {
        this(context, context.mkSolver(), statistics);
    }

    protected SmtSolver(Context context, Solver raw, SolverStatistics statistics) {
        super(context, raw, statistics);
        setTimeout(Constants.SOLVER_TIMEOUT_MILLS);
    }

    public void push() {
        raw.push();
    }

    public void pop(int num) {
        raw.pop(num);
    }

    // 追跡名も消える。timeoutとunsat coreの設定は残す
    public void reset() {
        raw.reset();
        forgetTrackedConstraints();
        setTimeout(getTimeoutMills());
        if (isUnsatCoreEnabled()) {
            setUnsatCore();
        }
    }

    public int getNumScopes() {
        return raw.getNumScopes();
    }

    @Override
    protected void rawSetParameters(Params params, boolean unsatCore) {
        if (unsatCore) {
            params.add("unsat_core", true);
        }
        raw.setParameters(params);
    }

    @Override
    protected void rawAdd(BoolExpr[] constraints) {
        raw.add(constraints);
    }

    @Override
    protected void rawAssertAndTrack(BoolExpr constraint, BoolExpr literal) {
        raw.assertAndTrack(constraint, literal);
    }

    @Override
    protected Status rawCheck(BoolExpr[] assumptions) {
        return raw.check(assumptions);
    }

    @Override
    protected com.microsoft.z3.Model rawModel() {
        return raw.getModel();
    }

    @Override
    protected BoolExpr[] rawUnsatCore() {
        return raw.getUnsatCore();
    }
}
