package net.katagaitai.tsurugi.evm;

import lombok.Value;

@Value
public class Instruction {
    private int offset;
    private int opValue;
    private String argHex;

    public boolean isPush() {
        return 0x60 <= opValue && opValue <= 0x7f;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(offset).append(' ');
        if (isPush()) {
            sb.append("PUSH").append(opValue - 0x5f);
        } else {
            sb.append(String.format("OP(%02x)", opValue));
        }
        if (argHex != null && argHex.length() > 0) {
            sb.append(" 0x").append(argHex);
        }
        return sb.toString();
    }
}
