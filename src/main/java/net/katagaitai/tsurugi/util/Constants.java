package net.katagaitai.tsurugi.util;

import java.math.BigInteger;

public class Constants {
    public static final int WORD_BITS = 256;
    public static final int BYTE_BITS = 8;
    public static final int SOLVER_TIMEOUT_MILLS = 10_000;
    public static final long ENGINE_TIMEOUT_MILLS = 180_000;
    // Z3のcontextはスレッドセーフではないので既定は1
    public static final int ENGINE_THREAD_POOL_SIZE = 1;
    public static final long INITIAL_TRANSACTION_ID = 0;
    public static final boolean REQUIRES_STATESPACE = true;
    public static final BigInteger DEFAULT_GAS_LIMIT = BigInteger.valueOf(8_000_000);
    public static final BigInteger DEFAULT_GAS_PRICE = BigInteger.valueOf(10);
    public static final BigInteger INITIAL_NONCE = BigInteger.ZERO;

    public static final String FALLBACK_FUNCTION_NAME = "fallback";
    public static final String CONSTRUCTOR_FUNCTION_NAME = "constructor";
    public static final String UNKNOWN_CONTRACT_NAME = "unknown";
}
