package net.katagaitai.tsurugi.evm;

import com.microsoft.z3.BitVecExpr;
import com.microsoft.z3.Context;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

// 変数名にトランザクションIDを含め、トランザクション間で衝突させない
@RequiredArgsConstructor
public abstract class BaseCalldata {
    @Getter
    protected final Context context;
    @Getter
    protected final long txId;

    public abstract BitVecExpr getByte(int index);

    public abstract BitVecExpr getSize();

    public BitVecExpr getWord(int offset) {
        BitVecExpr word = getByte(offset);
        for (int i = 1; i < 32; i++) {
            word = context.mkConcat(word, getByte(offset + i));
        }
        return word;
    }
}
