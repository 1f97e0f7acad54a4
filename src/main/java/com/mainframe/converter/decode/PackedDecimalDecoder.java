package com.mainframe.converter.decode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Packed decimal (COMP-3) decoding.
 *
 * Every byte carries two decimal digit nibbles, except the low nibble of the
 * last byte which carries the sign: 0xD is negative; 0xA, 0xB, 0xC, 0xE and
 * 0xF are positive. Any other sign value is reported and read as positive.
 */
public class PackedDecimalDecoder {
    private static final Logger log = LoggerFactory.getLogger(PackedDecimalDecoder.class);

    private static final int NEGATIVE_SIGN = 0x0D;

    /**
     * Scale value meaning "integer, no decimal point".
     */
    public static final int NO_DECIMAL_POINT = -1;

    public Optional<String> decodeInteger(byte[] bytes) {
        return decode(bytes, NO_DECIMAL_POINT);
    }

    /**
     * Decode packed bytes.
     *
     * @param scale number of digits after the decimal point, or {@link #NO_DECIMAL_POINT}
     * @return the decimal string, or empty when a digit nibble is not 0-9
     */
    public Optional<String> decode(byte[] bytes, int scale) {
        if (bytes == null || bytes.length == 0) {
            return Optional.empty();
        }

        int lastByte = bytes[bytes.length - 1] & 0xFF;
        int signNibble = lastByte & 0x0F;
        boolean negative = signNibble == NEGATIVE_SIGN;

        StringBuilder digits = new StringBuilder(bytes.length * 2);
        for (int i = 0; i < bytes.length; i++) {
            int b = bytes[i] & 0xFF;
            int high = b >> 4;
            if (high > 9) {
                log.warn("Invalid digit nibble in packed byte {} (data: {})", String.format("%02x", b), DecodeUtil.toHex(bytes));
                return Optional.empty();
            }
            digits.append((char) ('0' + high));

            if (i < bytes.length - 1) {
                int low = b & 0x0F;
                if (low > 9) {
                    log.warn("Invalid digit nibble in packed byte {} (data: {})", String.format("%02x", b), DecodeUtil.toHex(bytes));
                    return Optional.empty();
                }
                digits.append((char) ('0' + low));
            }
        }

        if (signNibble < 0x0A) {
            log.warn("Unusual sign nibble {} in packed data {}; treating as positive",
                    Integer.toHexString(signNibble), DecodeUtil.toHex(bytes));
        }

        String significant = DecodeUtil.stripLeadingZeros(digits.toString());

        if (significant.isEmpty()) {
            return Optional.of(scale > 0 ? "0." + "0".repeat(scale) : "0");
        }

        String number = scale > 0 ? DecodeUtil.insertDecimalPoint(significant, scale) : significant;
        return Optional.of(negative ? "-" + number : number);
    }
}
