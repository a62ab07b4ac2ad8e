package net.katagaitai.tsurugi.evm.transaction;

public enum TransactionType {
    MESSAGE_CALL,
    CONTRACT_CREATION
}
