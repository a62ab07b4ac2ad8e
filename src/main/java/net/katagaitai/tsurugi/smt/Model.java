package net.katagaitai.tsurugi.smt;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.microsoft.z3.BitVecExpr;
import com.microsoft.z3.BitVecNum;
import com.microsoft.z3.Expr;
import com.microsoft.z3.FuncDecl;
import com.microsoft.z3.Sort;
import lombok.EqualsAndHashCode;

import java.math.BigInteger;
import java.util.List;

// 空のモデルはエラーではなく、割り当てがないことを表す
@EqualsAndHashCode
public class Model {
    private final List<com.microsoft.z3.Model> raw;

    public Model() {
        this.raw = ImmutableList.of();
    }

    public Model(List<com.microsoft.z3.Model> raw) {
        this.raw = ImmutableList.copyOf(raw);
    }

    public boolean isEmpty() {
        return raw.isEmpty();
    }

    public List<com.microsoft.z3.Model> getRaw() {
        return raw;
    }

    public List<FuncDecl<?>> getDecls() {
        List<FuncDecl<?>> decls = Lists.newArrayList();
        for (com.microsoft.z3.Model m : raw) {
            decls.addAll(List.of(m.getDecls()));
        }
        return decls;
    }

    public <R extends Sort> Expr<R> eval(Expr<R> expr, boolean modelCompletion) {
        Expr<R> result = null;
        for (com.microsoft.z3.Model m : raw) {
            result = m.eval(expr, modelCompletion);
            if (result.isNumeral() || result.isTrue() || result.isFalse()) {
                return result;
            }
        }
        return result;
    }

    public BigInteger getBigInteger(BitVecExpr expr) {
        Expr<?> evaled = eval(expr, false);
        if (evaled instanceof BitVecNum) {
            return ((BitVecNum) evaled).getBigInteger();
        }
        // 制約に使用されていない場合。任意の値でよい。
        return BigInteger.ZERO;
    }

    @Override
    public String toString() {
        return "Model" + raw;
    }
}
