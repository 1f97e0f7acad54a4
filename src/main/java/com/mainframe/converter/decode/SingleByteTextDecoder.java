package com.mainframe.converter.decode;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;

/**
 * Decodes single-byte legacy text (EBCDIC by default).
 * NUL bytes are dropped, bytes the charset cannot map are ignored, and the
 * result is trimmed.
 */
public class SingleByteTextDecoder {

    private final Charset charset;

    public SingleByteTextDecoder(Charset charset) {
        this.charset = charset;
    }

    public String decode(byte[] bytes) {
        byte[] withoutNulls = removeNulBytes(bytes);

        CharsetDecoder decoder = charset.newDecoder()
                .onMalformedInput(CodingErrorAction.IGNORE)
                .onUnmappableCharacter(CodingErrorAction.IGNORE);
        try {
            String text = decoder.decode(ByteBuffer.wrap(withoutNulls)).toString();
            return DecodeUtil.trimWhitespace(text);
        } catch (CharacterCodingException e) {
            throw new IllegalStateException("Could not decode bytes " + DecodeUtil.toHex(bytes)
                    + " with " + charset.name(), e);
        }
    }

    public Charset getCharset() {
        return charset;
    }

    private static byte[] removeNulBytes(byte[] bytes) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(bytes.length);
        for (byte b : bytes) {
            if (b != 0) {
                out.write(b);
            }
        }
        return out.toByteArray();
    }
}
