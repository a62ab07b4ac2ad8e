package net.katagaitai.tsurugi.smt;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Params;
import com.microsoft.z3.Status;
import com.microsoft.z3.Z3Exception;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import net.katagaitai.tsurugi.util.Z3Util;

import java.util.Collections;
import java.util.List;
import java.util.Map;

// 1つのパス(またはワーカー)専用。スレッド間で共有しない
@Slf4j(topic = "tsurugi")
public abstract class BaseSolver<T> {
    @Getter
    protected final Context context;
    @Getter
    protected final T raw;
    private final SolverStatistics statistics;
    private final Map<String, BoolExpr> nameToLiteral = Maps.newLinkedHashMap();
    private final Map<BoolExpr, String> literalToName = Maps.newHashMap();
    @Getter
    private int timeoutMills;
    @Getter
    private boolean unsatCoreEnabled;
    // 直前のcheckがSATのときだけモデルを返す
    private boolean lastCheckSat;

    protected BaseSolver(Context context, T raw, SolverStatistics statistics) {
        this.context = context;
        this.raw = raw;
        this.statistics = statistics;
    }

    public void setTimeout(int timeoutMills) {
        this.timeoutMills = timeoutMills;
        applyParameters();
    }

    public void setUnsatCore() {
        this.unsatCoreEnabled = true;
        applyParameters();
    }

    private void applyParameters() {
        Params params = Z3Util.mkParams(context, timeoutMills);
        rawSetParameters(params, unsatCoreEnabled);
    }

    public void add(BoolExpr... constraints) {
        rawAdd(constraints);
    }

    public void append(BoolExpr... constraints) {
        add(constraints);
    }

    public void assertAndTrack(BoolExpr constraint, String name) {
        if (nameToLiteral.containsKey(name)) {
            throw new IllegalArgumentException("追跡名が重複しています: " + name);
        }
        BoolExpr literal = context.mkBoolConst(name);
        rawAssertAndTrack(constraint, literal);
        nameToLiteral.put(name, literal);
        literalToName.put(literal, name);
    }

    public SolverStatus check(BoolExpr... assumptions) {
        Stopwatch stopwatch = statistics == null ? null : statistics.start();
        SolverStatus status = invokeCheck(assumptions);
        lastCheckSat = status == SolverStatus.SAT;
        if (statistics != null) {
            statistics.record(stopwatch, status);
        }
        return status;
    }

    private SolverStatus invokeCheck(BoolExpr[] assumptions) {
        Status status;
        try {
            status = rawCheck(assumptions);
        } catch (Z3Exception e) {
            // 一部の制約でZ3がクラッシュする
            log.info("制約の検査中にZ3の例外が発生しました: {}", e.getMessage());
            return SolverStatus.UNKNOWN;
        }
        return SolverStatus.of(status);
    }

    public Model model() {
        if (!lastCheckSat) {
            // 未検査、UNSAT、UNKNOWN、クラッシュ後のモデルは証拠にならない
            return new Model();
        }
        com.microsoft.z3.Model model;
        try {
            model = rawModel();
        } catch (Z3Exception e) {
            log.info("モデルの取得中にZ3の例外が発生しました: {}", e.getMessage());
            return new Model();
        }
        if (model == null) {
            return new Model();
        }
        return new Model(Collections.singletonList(model));
    }

    // 直前のUNSATのcoreに含まれる追跡名
    public List<String> getUnsatCore() {
        BoolExpr[] core;
        try {
            core = rawUnsatCore();
        } catch (Z3Exception e) {
            log.info("unsat coreの取得中にZ3の例外が発生しました: {}", e.getMessage());
            return ImmutableList.of();
        }
        List<String> names = Lists.newArrayList();
        for (BoolExpr literal : core) {
            String name = literalToName.get(literal);
            if (name != null) {
                names.add(name);
            }
        }
        return names;
    }

    public String sexpr() {
        return raw.toString();
    }

    protected List<BoolExpr> getTrackingLiterals() {
        return Lists.newArrayList(nameToLiteral.values());
    }

    protected void forgetTrackedConstraints() {
        nameToLiteral.clear();
        literalToName.clear();
        lastCheckSat = false;
    }

    protected abstract void rawSetParameters(Params params, boolean unsatCore);

    protected abstract void rawAdd(BoolExpr[] constraints);

    protected abstract void rawAssertAndTrack(BoolExpr constraint, BoolExpr literal);

    protected abstract Status rawCheck(BoolExpr[] assumptions);

    protected abstract com.microsoft.z3.Model rawModel();

    protected abstract BoolExpr[] rawUnsatCore();
}
