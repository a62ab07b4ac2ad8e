package net.katagaitai.tsurugi.smt;

import com.google.common.base.Stopwatch;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

public class SolverStatistics {
    private final AtomicLong queryCount = new AtomicLong();
    private final AtomicLong solverTimeMills = new AtomicLong();
    private final AtomicLong unknownCount = new AtomicLong();

    Stopwatch start() {
        return Stopwatch.createStarted();
    }

    void record(Stopwatch stopwatch, SolverStatus status) {
        queryCount.incrementAndGet();
        solverTimeMills.addAndGet(stopwatch.elapsed(TimeUnit.MILLISECONDS));
        if (status == SolverStatus.UNKNOWN) {
            unknownCount.incrementAndGet();
        }
    }

    public long getQueryCount() {
        return queryCount.get();
    }

    public long getSolverTimeMills() {
        return solverTimeMills.get();
    }

    public long getUnknownCount() {
        return unknownCount.get();
    }

    @Override
    public String toString() {
        return String.format("Query count: %d, Solver time: %d ms, Unknown: %d",
                getQueryCount(), getSolverTimeMills(), getUnknownCount());
    }
}
