package json.message;

import json.message.schema.FieldKind;

/// Number rendering rules.
///
/// 32-bit integers are bare JSON numbers. 64-bit integers are quoted so that
/// consumers parsing JSON numbers as doubles keep every digit. Non-finite
/// floating point values have no JSON number form and are quoted by name.
final class JsonNumbers {

    private JsonNumbers() {}

    static String int32(FieldKind kind, int value) {
        return kind.isUnsigned() ? Integer.toUnsignedString(value) : Integer.toString(value);
    }

    static String int64(FieldKind kind, long value) {
        return kind.isUnsigned() ? Long.toUnsignedString(value) : Long.toString(value);
    }

    static void appendInt32(StringBuilder builder, FieldKind kind, int value) {
        builder.append(int32(kind, value));
    }

    static void appendInt64(StringBuilder builder, FieldKind kind, long value) {
        builder.append('"').append(int64(kind, value)).append('"');
    }

    static void appendDouble(StringBuilder builder, double value) {
        appendFloatingText(builder, Double.toString(value), Double.isFinite(value));
    }

    // Float.toString keeps the shortest float text; widening to double would add noise digits
    static void appendFloat(StringBuilder builder, float value) {
        appendFloatingText(builder, Float.toString(value), Float.isFinite(value));
    }

    private static void appendFloatingText(StringBuilder builder, String text, boolean finite) {
        if (finite) {
            builder.append(text);
        } else {
            // "NaN", "Infinity" and "-Infinity"
            builder.append('"').append(text).append('"');
        }
    }
}
