package net.katagaitai.tsurugi.evm;

import com.microsoft.z3.BitVecExpr;
import lombok.AllArgsConstructor;
import lombok.Data;
import net.katagaitai.tsurugi.util.Constants;
import net.katagaitai.tsurugi.util.Util;

import java.math.BigInteger;

@Data
@AllArgsConstructor
public class Account {
    private final BigInteger address;
    private BigInteger balance;
    private BigInteger nonce;
    private Storage storage;
    private Code code;
    private String contractName;

    public Account(BigInteger address, Code code, String contractName) {
        this(address, BigInteger.ZERO, Constants.INITIAL_NONCE, new Storage(), code, contractName);
    }

    public String getAddressHex() {
        return Util.toAddressHex(address);
    }

    public void incrementNonce() {
        nonce = nonce.add(BigInteger.ONE);
    }

    public void putStorageValue(BitVecExpr key, BitVecExpr value) {
        storage.put(key, value);
    }

    public BitVecExpr getStorageValue(BitVecExpr key) {
        return storage.get(key);
    }
}
