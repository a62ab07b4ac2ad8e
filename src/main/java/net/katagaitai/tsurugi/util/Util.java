package net.katagaitai.tsurugi.util;

import com.google.common.io.BaseEncoding;
import org.apache.commons.lang3.StringUtils;
import org.bouncycastle.crypto.digests.KeccakDigest;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.util.Arrays;

public class Util {
    private static final BaseEncoding HEX = BaseEncoding.base16().lowerCase();

    public static String addHexPrefix(String hex) {
        if (hex == null || hex.length() == 0) {
            return "";
        }
        return hex.startsWith("0x") ? hex : "0x" + hex;
    }

    public static String removeHexPrefix(String hex) {
        if (hex == null) {
            return null;
        }
        return hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
    }

    public static byte[] hexToBytes(String hex) {
        String s = removeHexPrefix(hex);
        if (StringUtils.isEmpty(s)) {
            return new byte[0];
        }
        if (s.length() % 2 == 1) {
            s = "0" + s;
        }
        return HEX.decode(s.toLowerCase());
    }

    public static String bytesToHex(byte[] bytes) {
        return HEX.encode(bytes);
    }

    public static BigInteger hexToBigInteger(String hex) {
        return new BigInteger(removeHexPrefix(hex), 16);
    }

    public static String hexToDecimal(String hex) {
        return new BigInteger(1, hexToBytes(hex)).toString();
    }

    public static String normalizeAddress(String addressHex) {
        addressHex = removeHexPrefix(addressHex);
        if (addressHex.length() < 40) {
            addressHex = StringUtils.leftPad(addressHex, 40, '0');
        } else if (addressHex.length() > 40) {
            addressHex = addressHex.substring(addressHex.length() - 40);
        }
        return addressHex.toLowerCase();
    }

    public static String toAddressHex(BigInteger address) {
        return normalizeAddress(address.toString(16));
    }

    public static byte[] toFixedBytes(BigInteger value, int byteSize) {
        byte[] bytes = value.toByteArray();
        if (bytes.length < byteSize) {
            byte[] tmp = new byte[byteSize];
            System.arraycopy(bytes, 0, tmp, byteSize - bytes.length, bytes.length);
            bytes = tmp;
        } else if (bytes.length > byteSize) {
            bytes = Arrays.copyOfRange(bytes, bytes.length - byteSize, bytes.length);
        }
        return bytes;
    }

    public static byte[] keccak256(byte[] input) {
        KeccakDigest digest = new KeccakDigest(256);
        digest.update(input, 0, input.length);
        byte[] out = new byte[32];
        digest.doFinal(out, 0);
        return out;
    }

    // CREATEのアドレス。keccak256(rlp([sender, nonce]))の下位20バイト
    public static BigInteger contractAddress(BigInteger sender, BigInteger nonce) {
        byte[] senderBytes = toFixedBytes(sender, 20);
        ByteArrayOutputStream items = new ByteArrayOutputStream();
        items.write(0x80 + senderBytes.length);
        items.write(senderBytes, 0, senderBytes.length);
        if (nonce.signum() == 0) {
            items.write(0x80);
        } else {
            byte[] nonceBytes = toFixedBytes(nonce, (nonce.bitLength() + 7) / 8);
            if (nonceBytes.length == 1 && (nonceBytes[0] & 0xff) < 0x80) {
                items.write(nonceBytes[0]);
            } else {
                items.write(0x80 + nonceBytes.length);
                items.write(nonceBytes, 0, nonceBytes.length);
            }
        }
        byte[] payload = items.toByteArray();
        byte[] rlp = new byte[payload.length + 1];
        // 要素は常に56バイト未満
        rlp[0] = (byte) (0xc0 + payload.length);
        System.arraycopy(payload, 0, rlp, 1, payload.length);
        byte[] hash = keccak256(rlp);
        return new BigInteger(1, Arrays.copyOfRange(hash, 12, 32));
    }
}
