package net.katagaitai.tsurugi.evm;

import com.microsoft.z3.BitVecExpr;
import com.microsoft.z3.Context;
import net.katagaitai.tsurugi.util.Constants;
import net.katagaitai.tsurugi.util.Util;
import net.katagaitai.tsurugi.util.Z3Util;

public class ConcreteCalldata extends BaseCalldata {
    private final byte[] bytes;

    public ConcreteCalldata(Context context, long txId, byte[] bytes) {
        super(context, txId);
        this.bytes = bytes.clone();
    }

    @Override
    public BitVecExpr getByte(int index) {
        if (index < 0 || index >= bytes.length) {
            return Z3Util.mkBV(context, 0, Constants.BYTE_BITS);
        }
        return Z3Util.mkBV(context, bytes[index] & 0xff, Constants.BYTE_BITS);
    }

    @Override
    public BitVecExpr getSize() {
        return Z3Util.mkBV(context, bytes.length, Constants.WORD_BITS);
    }

    public byte[] getConcreteBytes() {
        return bytes.clone();
    }

    @Override
    public String toString() {
        return "ConcreteCalldata{" +
                "txId=" + txId +
                ", data=" + Util.addHexPrefix(Util.bytesToHex(bytes)) +
                '}';
    }
}
