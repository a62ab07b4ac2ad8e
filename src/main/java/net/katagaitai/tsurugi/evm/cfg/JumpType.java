package net.katagaitai.tsurugi.evm.cfg;

public enum JumpType {
    CONDITIONAL,
    UNCONDITIONAL,
    CALL,
    RETURN,
    TRANSACTION
}
