package net.katagaitai.tsurugi.util;

import com.microsoft.z3.*;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.math.BigInteger;
import java.util.concurrent.atomic.AtomicBoolean;

@Slf4j(topic = "tsurugi")
public class Z3Util {
    private static final AtomicBoolean configured = new AtomicBoolean(false);

    // 初回のみZ3の診断出力を止める
    public static Context mkContext() {
        if (configured.compareAndSet(false, true)) {
            Global.setParameter("verbose", "0");
            log.debug("Z3 {}", Version.getFullVersion());
        }
        return new Context();
    }

    public static BitVecExpr mkBVConst(Context context, String name, int bits) {
        if (StringUtils.isNumeric(name)) {
            throw new IllegalArgumentException("異常なシンボル: " + name);
        }
        return context.mkBVConst(name, bits);
    }

    public static BitVecNum mkBV(Context context, long i, int bits) {
        return context.mkBV(i, bits);
    }

    public static BitVecNum mkBV(Context context, BigInteger i, int bits) {
        if (i.signum() < 0) {
            throw new IllegalArgumentException("異常な数値: " + i);
        }
        return context.mkBV(i.toString(), bits);
    }

    public static BitVecNum mkWord(Context context, BigInteger i) {
        return mkBV(context, i, Constants.WORD_BITS);
    }

    public static boolean isBVNum(BitVecExpr a) {
        return a != null && a.simplify() instanceof BitVecNum;
    }

    public static BitVecNum getBVNum(BitVecExpr a) {
        return (BitVecNum) a.simplify();
    }

    public static Params mkParams(Context context, int timeoutMills) {
        Params params = context.mkParams();
        params.add("timeout", timeoutMills);
        return params;
    }
}
