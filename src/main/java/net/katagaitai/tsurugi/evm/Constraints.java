package net.katagaitai.tsurugi.evm;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.microsoft.z3.BoolExpr;

import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

// 追加のみ
public class Constraints implements Iterable<BoolExpr> {
    private final List<BoolExpr> list;

    public Constraints() {
        this.list = Lists.newArrayList();
    }

    public Constraints(Collection<BoolExpr> constraints) {
        this.list = Lists.newArrayList(constraints);
    }

    public void append(BoolExpr constraint) {
        list.add(constraint);
    }

    public void appendAll(Collection<BoolExpr> constraints) {
        list.addAll(constraints);
    }

    public Constraints copy() {
        return new Constraints(list);
    }

    public List<BoolExpr> getAll() {
        return ImmutableList.copyOf(list);
    }

    public BoolExpr[] toArray() {
        return list.toArray(new BoolExpr[0]);
    }

    public int size() {
        return list.size();
    }

    public boolean isEmpty() {
        return list.isEmpty();
    }

    @Override
    public Iterator<BoolExpr> iterator() {
        return getAll().iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Constraints that = (Constraints) o;
        return Objects.equals(list, that.list);
    }

    @Override
    public int hashCode() {
        return Objects.hash(list);
    }

    @Override
    public String toString() {
        return "Constraints" + list;
    }
}
