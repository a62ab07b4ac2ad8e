package net.katagaitai.tsurugi.evm.cfg;

import java.util.concurrent.atomic.AtomicInteger;

// プロセスで1つだけ作り、すべてのStateSpaceで共有する
public class NodeIdManager {
    private final AtomicInteger nextUid = new AtomicInteger();

    public int getNextNodeId() {
        return nextUid.getAndIncrement();
    }
}
