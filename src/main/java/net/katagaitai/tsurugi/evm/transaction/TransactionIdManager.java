package net.katagaitai.tsurugi.evm.transaction;

import net.katagaitai.tsurugi.util.Constants;

import java.util.concurrent.atomic.AtomicLong;

// プロセスで1つだけ作り、共有する
public class TransactionIdManager {
    private final AtomicLong lastId = new AtomicLong(Constants.INITIAL_TRANSACTION_ID);

    public long getNextTransactionId() {
        return lastId.incrementAndGet();
    }

    public long peek() {
        return lastId.get();
    }
}
