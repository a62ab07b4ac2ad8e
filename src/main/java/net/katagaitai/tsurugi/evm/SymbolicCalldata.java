package net.katagaitai.tsurugi.evm;

import com.microsoft.z3.BitVecExpr;
import com.microsoft.z3.Context;
import net.katagaitai.tsurugi.util.Constants;
import net.katagaitai.tsurugi.util.Z3Util;

public class SymbolicCalldata extends BaseCalldata {

    public SymbolicCalldata(Context context, long txId) {
        super(context, txId);
    }

    @Override
    public BitVecExpr getByte(int index) {
        return Z3Util.mkBVConst(context, txId + "_calldata_" + index, Constants.BYTE_BITS);
    }

    @Override
    public BitVecExpr getSize() {
        return Z3Util.mkBVConst(context, txId + "_calldatasize", Constants.WORD_BITS);
    }

    @Override
    public String toString() {
        return "SymbolicCalldata{txId=" + txId + '}';
    }
}
