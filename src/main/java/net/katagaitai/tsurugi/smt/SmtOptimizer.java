package net.katagaitai.tsurugi.smt;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.Optimize;
import com.microsoft.z3.Params;
import com.microsoft.z3.Sort;
import com.microsoft.z3.Status;
import net.katagaitai.tsurugi.util.Constants;

import java.util.List;

// 目的関数は登録順にZ3へ渡す。スコープはない
public class SmtOptimizer extends BaseSolver<Optimize> {
    private final List<Optimize.Handle<?>> objectives = Lists.newArrayList();

    public SmtOptimizer(Context context) {
        this(context, null);
    }

    public SmtOptimizer(Context context, SolverStatistics statistics) {
        this(context, context.mkOptimize(), statistics);
    }

    protected SmtOptimizer(Context context, Optimize raw, SolverStatistics statistics) {
        super(context, raw, statistics);
        setTimeout(Constants.SOLVER_TIMEOUT_MILLS);
    }

    public <R extends Sort> Optimize.Handle<R> minimize(Expr<R> element) {
        Optimize.Handle<R> handle = raw.MkMinimize(element);
        objectives.add(handle);
        return handle;
    }

    public <R extends Sort> Optimize.Handle<R> maximize(Expr<R> element) {
        Optimize.Handle<R> handle = raw.MkMaximize(element);
        objectives.add(handle);
        return handle;
    }

    public List<Optimize.Handle<?>> getObjectives() {
        return ImmutableList.copyOf(objectives);
    }

    @Override
    protected void rawSetParameters(Params params, boolean unsatCore) {
        // Optimizeにunsat_coreパラメータはない。追跡は仮定リテラルで行う
        raw.setParameters(params);
    }

    @Override
    protected void rawAdd(BoolExpr[] constraints) {
        raw.Add(constraints);
    }

    @Override
    protected void rawAssertAndTrack(BoolExpr constraint, BoolExpr literal) {
        raw.Add(context.mkImplies(literal, constraint));
    }

    @Override
    protected Status rawCheck(BoolExpr[] assumptions) {
        List<BoolExpr> all = getTrackingLiterals();
        all.addAll(List.of(assumptions));
        return raw.Check(all.toArray(new BoolExpr[0]));
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
