package net.katagaitai.tsurugi.evm.transaction;

import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

// nullは引数なし。calleeが空なら作成、callerが空ならorigin
@Value
@Builder
public class TransactionParams {
    private String calleeAddress;
    private String callerAddress;
    private String originAddress;
    private byte[] data;
    private BigInteger gasLimit;
    private BigInteger gasPrice;
    private BigInteger value;
    // 指定がなければcalleeのコードを使う
    private String code;
    private String contractName;
    private boolean trackGas;
    private boolean symbolicCalldata;
}
