package net.katagaitai.tsurugi.evm;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.microsoft.z3.Context;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import net.katagaitai.tsurugi.evm.cfg.NodeIdManager;
import net.katagaitai.tsurugi.evm.cfg.StateSpace;
import net.katagaitai.tsurugi.util.Constants;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

// 同じ層の状態はこのエンジンのZ3 contextを共有する。
// 評価器がフォークごとにcontextを分けない限りスレッドは1つで動かす
@Slf4j(topic = "tsurugi")
public class WorkListEngine implements ExplorationEngine {
    @Getter
    private final Context context;
    private final InstructionEvaluator evaluator;
    @Getter
    private final StateSpace stateSpace;
    private final List<WorldState> openStates = Lists.newArrayList();
    private final Deque<GlobalState> workList = new ArrayDeque<>();
    private final AtomicInteger exceptionCount = new AtomicInteger();

    @Getter
    @Setter
    private boolean requiresStatespace = Constants.REQUIRES_STATESPACE;
    @Getter
    @Setter
    private long timeoutMills = Constants.ENGINE_TIMEOUT_MILLS;
    @Getter
    @Setter
    private int threadPoolSize = Constants.ENGINE_THREAD_POOL_SIZE;
    @Getter
    private volatile boolean timeout = false;

    public WorkListEngine(Context context, InstructionEvaluator evaluator, NodeIdManager nodeIdManager) {
        this.context = context;
        this.evaluator = evaluator;
        this.stateSpace = new StateSpace(nodeIdManager);
    }

    @Override
    public List<WorldState> drainOpenStates() {
        synchronized (openStates) {
            List<WorldState> drained = Lists.newArrayList(openStates);
            openStates.clear();
            return drained;
        }
    }

    @Override
    public void addOpenState(WorldState worldState) {
        synchronized (openStates) {
            openStates.add(worldState);
        }
    }

    @Override
    public List<WorldState> getOpenStates() {
        synchronized (openStates) {
            return ImmutableList.copyOf(openStates);
        }
    }

    @Override
    public void enqueue(GlobalState state) {
        synchronized (workList) {
            workList.addLast(state);
        }
    }

    @Override
    public List<GlobalState> getWorkList() {
        synchronized (workList) {
            return ImmutableList.copyOf(workList);
        }
    }

    private List<GlobalState> drainWorkList() {
        synchronized (workList) {
            List<GlobalState> drained = Lists.newArrayList(workList);
            workList.clear();
            return drained;
        }
    }

    public int getExceptionCount() {
        return exceptionCount.get();
    }

    public boolean isSuccess() {
        return exceptionCount.get() == 0;
    }

    @Override
    public List<GlobalState> exec(boolean recordFullTrace, boolean trackGas) {
        timeout = false;
        ThreadFactory namedThreadFactory = new ThreadFactoryBuilder().setNameFormat("engine-%d").build();
        ExecutorService executor = Executors.newFixedThreadPool(threadPoolSize, namedThreadFactory);
        Run run = new Run(executor);
        List<GlobalState> initialStates = drainWorkList();
        log.info("探索開始: {}状態", initialStates.size());
        for (GlobalState state : initialStates) {
            run.submit(state);
        }
        run.join();
        log.info("探索終了: 終了状態 {}, 継続可能 {}", run.finalStates.size(), getOpenStates().size());
        if (recordFullTrace || trackGas) {
            return Lists.newArrayList(run.finalStates);
        }
        return null;
    }

    private class Run {
        private final ExecutorService executor;
        private final List<Future<?>> futures = Lists.newCopyOnWriteArrayList();
        private final List<GlobalState> finalStates = Lists.newCopyOnWriteArrayList();

        Run(ExecutorService executor) {
            this.executor = executor;
        }

        void submit(GlobalState state) {
            try {
                Future<?> f = executor.submit(() -> step(state));
                futures.add(f);
            } catch (RejectedExecutionException e) {
                log.debug("タイムアウト済み", e);
            }
        }

        private void step(GlobalState state) {
            List<GlobalState> successors = evaluator.evaluate(state);
            if (successors.isEmpty()) {
                finish(state);
                return;
            }
            for (GlobalState successor : successors) {
                submit(successor);
            }
        }

        private void finish(GlobalState state) {
            finalStates.add(state);
            if (state.isReverted()) {
                log.debug("revert: {}", state);
                return;
            }
            WorldState worldState = state.getWorldState();
            worldState.setNode(state.getNode());
            addOpenState(worldState);
        }

        void join() {
            boolean interrupted = false;
            ScheduledExecutorService canceller = Executors.newSingleThreadScheduledExecutor();
            ScheduledFuture<?> cancellerFuture = canceller.schedule(() -> {
                log.info("タイムアウト");
                timeout = true;
                executor.shutdownNow();
                futures.forEach(f -> f.cancel(true));
            }, timeoutMills, TimeUnit.MILLISECONDS);

            for (int i = 0; i < futures.size(); i++) {
                Future<?> f = futures.get(i);
                if (interrupted || Thread.interrupted()) {
                    log.debug("割り込み");
                    interrupted = true;
                    f.cancel(true);
                    continue;
                }
                try {
                    f.get(1, TimeUnit.SECONDS);
                } catch (TimeoutException e) {
                    // 末尾に追加
                    futures.add(f);
                } catch (CancellationException e) {
                    log.debug("タイムアウト済み", e);
                } catch (InterruptedException e) {
                    log.debug("割り込み", e);
                    interrupted = true;
                    f.cancel(true);
                } catch (ExecutionException e) {
                    log.error("", e);
                    exceptionCount.incrementAndGet();
                }
            }

            cancellerFuture.cancel(true);
            canceller.shutdownNow();
            executor.shutdownNow();
            try {
                canceller.awaitTermination(1, TimeUnit.MINUTES);
                executor.awaitTermination(1, TimeUnit.MINUTES);
            } catch (InterruptedException e) {
                log.error("", e);
                exceptionCount.incrementAndGet();
                interrupted = true;
            }
            if (interrupted) {
                // 呼び出し元に割り込みを返す
                Thread.currentThread().interrupt();
            }
        }
    }
}
