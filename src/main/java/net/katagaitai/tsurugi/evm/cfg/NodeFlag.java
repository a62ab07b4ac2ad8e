package net.katagaitai.tsurugi.evm.cfg;

public enum NodeFlag {
    FUNC_ENTRY,
    CALL_RETURN
}
