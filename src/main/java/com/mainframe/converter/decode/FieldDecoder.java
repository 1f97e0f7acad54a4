package com.mainframe.converter.decode;

import com.mainframe.converter.decode.DoubleByteTextDecoder.InvalidCodePointException;
import com.mainframe.converter.mapping.CodeMappingTable;
import com.mainframe.converter.model.FieldDefinition;
import com.mainframe.converter.model.FieldType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Decodes the bytes of one field according to its resolved {@link FieldType}.
 *
 * Never throws: every failure comes back as an error {@link FieldValue}, so a
 * bad field cannot stop the rest of the record. Stateless once constructed and
 * safe to reuse across files.
 */
public class FieldDecoder {
    private static final Logger log = LoggerFactory.getLogger(FieldDecoder.class);

    private final SingleByteTextDecoder textDecoder;
    private final ZonedDecimalDecoder zonedDecoder;
    private final PackedDecimalDecoder packedDecoder;
    private final DoubleByteTextDecoder doubleByteDecoder;

    public FieldDecoder(CodeMappingTable mappingTable, DecoderSettings settings) {
        this.textDecoder = new SingleByteTextDecoder(settings.getSingleByteCharset());
        this.zonedDecoder = new ZonedDecimalDecoder(textDecoder);
        this.packedDecoder = new PackedDecimalDecoder();
        this.doubleByteDecoder = new DoubleByteTextDecoder(mappingTable, settings);
    }

    public FieldValue decode(FieldDefinition field, byte[] bytes) {
        try {
            return switch (field.getFieldType()) {
                case ALPHANUMERIC -> FieldValue.ok(textDecoder.decode(bytes));
                case ZONED_INTEGER -> FieldValue.ok(zonedDecoder.decodeInteger(bytes));
                case DOUBLE_BYTE -> decodeDoubleByte(field, bytes);
                case ZONED_SCALED -> FieldValue.ok(zonedDecoder.decodeScaled(bytes, field.getPicture().getDecimalDigits()));
                case ZONED_LEADING_DECIMAL -> FieldValue.ok(zonedDecoder.decodeLeadingDecimal(bytes));
                case PACKED_DECIMAL -> decodePacked(field, bytes);
                case UNSUPPORTED -> unsupported(field, bytes);
            };
        } catch (RuntimeException e) {
            log.error("Exception during conversion for field '{}' (type {}). Data: {} - {}",
                    field.getName(), field.getTypeToken(), DecodeUtil.toHex(bytes), e.getMessage());
            return FieldValue.error(FieldErrorKind.CONVERSION_ERROR, e.getMessage(), bytes);
        }
    }

    private FieldValue decodeDoubleByte(FieldDefinition field, byte[] bytes) {
        try {
            return FieldValue.ok(doubleByteDecoder.decode(bytes));
        } catch (InvalidCodePointException e) {
            log.error("Field '{}': {}", field.getName(), e.getMessage());
            return FieldValue.error(FieldErrorKind.INVALID_CODE_POINT, e.getMessage(), bytes);
        }
    }

    private FieldValue decodePacked(FieldDefinition field, byte[] bytes) {
        String typeToken = field.getTypeToken();
        Optional<String> decoded;

        if (FieldType.isPackedScaleOnly(typeToken)) {
            // PV9 / PSV9 carry no digit count; the scale comes from the numeric attribute
            if (!field.hasNumericAttribute()) {
                log.error("{} type requires numeric attribute (decimal places) in layout (field {}). Data: {}",
                        typeToken, field.getName(), DecodeUtil.toHex(bytes));
                return FieldValue.error(FieldErrorKind.MISSING_SCALE_ATTRIBUTE, typeToken, bytes);
            }
            decoded = packedDecoder.decode(bytes, field.getNumericAttribute());
        } else if (typeToken.contains("V9")) {
            decoded = packedDecoder.decode(bytes, field.getPicture().getDecimalDigits());
        } else {
            decoded = packedDecoder.decodeInteger(bytes);
        }

        return decoded
                .map(FieldValue::ok)
                .orElseGet(() -> FieldValue.error(FieldErrorKind.INVALID_PACKED_DECIMAL, typeToken, bytes));
    }

    private FieldValue unsupported(FieldDefinition field, byte[] bytes) {
        log.warn("Unsupported data type '{}' for field '{}'. Outputting raw hex: {}",
                field.getTypeToken(), field.getName(), DecodeUtil.toHex(bytes));
        return FieldValue.error(FieldErrorKind.UNSUPPORTED_TYPE, field.getTypeToken(), bytes);
    }
}
