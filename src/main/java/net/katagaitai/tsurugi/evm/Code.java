package net.katagaitai.tsurugi.evm;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import net.katagaitai.tsurugi.util.Util;

import java.util.List;
import java.util.Map;

// PUSHの引数幅だけを解釈する
@Slf4j(topic = "tsurugi")
@EqualsAndHashCode(of = {"hex"})
public class Code {
    public static final Code EMPTY = new Code(new byte[0]);

    @Getter
    private final String hex;
    private final Map<Integer, Instruction> offsetToInstruction = Maps.newLinkedHashMap();

    public Code(byte[] bytes) {
        this.hex = Util.bytesToHex(bytes);
        parse(bytes);
    }

    public Code(String hex) {
        this(Util.hexToBytes(hex));
    }

    private void parse(byte[] bytes) {
        int offset = 0;
        while (offset < bytes.length) {
            offset = parseOne(bytes, offset);
        }
    }

    private int parseOne(byte[] bytes, int offset) {
        int i = bytes[offset] & 0xff;
        if (0x60 <= i && i <= 0x7f) {
            int size = i - 0x5f;
            if (size > bytes.length - (offset + 1)) {
                // 引数が途中で切れている
                final Instruction instruction = new Instruction(offset, i, null);
                offsetToInstruction.put(offset, instruction);
                log.trace("{}", instruction);
                return bytes.length;
            }
            byte[] arg = new byte[size];
            System.arraycopy(bytes, offset + 1, arg, 0, size);
            final Instruction instruction = new Instruction(offset, i, Util.bytesToHex(arg));
            offsetToInstruction.put(offset, instruction);
            log.trace("{}", instruction);
            return offset + 1 + size;
        }
        final Instruction instruction = new Instruction(offset, i, null);
        offsetToInstruction.put(offset, instruction);
        log.trace("{}", instruction);
        return offset + 1;
    }

    public Instruction getInstruction(int pc) {
        return offsetToInstruction.get(pc);
    }

    public List<Instruction> getInstructions() {
        return ImmutableList.copyOf(offsetToInstruction.values());
    }

    public byte[] getBytes() {
        return Util.hexToBytes(hex);
    }

    public boolean isEmpty() {
        return hex.isEmpty();
    }

    @Override
    public String toString() {
        return "Code{" +
                "hex=" + Util.addHexPrefix(hex) +
                ", instructions=" + offsetToInstruction.size() +
                '}';
    }
}
