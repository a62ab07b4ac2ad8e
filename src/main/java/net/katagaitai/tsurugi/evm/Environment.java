package net.katagaitai.tsurugi.evm;

import com.microsoft.z3.BitVecExpr;
import lombok.Builder;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

@Getter
@Builder
@ToString
public class Environment {
    private final Account activeAccount;
    private final BitVecExpr sender;
    private final BitVecExpr origin;
    private final BaseCalldata callData;
    private final BitVecExpr gasPrice;
    private final BitVecExpr callValue;
    private final Code code;
    @Setter
    private String activeFunctionName;
}
