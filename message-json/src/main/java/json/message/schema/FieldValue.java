package json.message.schema;

import java.util.Arrays;
import java.util.Base64;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// The value of a message field, as a tagged union of the shapes a field can
/// hold.
///
/// | Shape | Field kinds |
/// |-------|-------------|
/// | [Bool] | `BOOL` |
/// | [Int32] | `INT32`, `UINT32`, `SINT32`, `FIXED32`, `SFIXED32` |
/// | [Int64] | `INT64`, `UINT64`, `SINT64`, `FIXED64`, `SFIXED64` |
/// | [Float32] | `FLOAT` |
/// | [Float64] | `DOUBLE` |
/// | [Text] | `STRING` |
/// | [Bytes] | `BYTES` |
/// | [EnumNumber] | `ENUM` |
/// | [Nested] | `MESSAGE`, `GROUP` |
/// | [Repeated] | any repeated field |
/// | [Mapped] | any map field |
///
/// Unsigned kinds keep their bit pattern in the signed Java primitive.
public sealed interface FieldValue
        permits FieldValue.Bool, FieldValue.Int32, FieldValue.Int64, FieldValue.Float32,
                FieldValue.Float64, FieldValue.Text, FieldValue.Bytes, FieldValue.EnumNumber,
                FieldValue.Nested, FieldValue.Repeated, FieldValue.Mapped {

    record Bool(boolean value) implements FieldValue {}

    record Int32(int value) implements FieldValue {}

    record Int64(long value) implements FieldValue {}

    record Float32(float value) implements FieldValue {}

    record Float64(double value) implements FieldValue {}

    record Text(String value) implements FieldValue {
        public Text {
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    /// An immutable byte sequence.
    record Bytes(byte[] value) implements FieldValue {
        public Bytes {
            Objects.requireNonNull(value, "value must not be null");
            value = value.clone();
        }

        @Override
        public byte[] value() {
            return value.clone();
        }

        /// {@return the number of bytes}
        public int size() {
            return value.length;
        }

        /// {@return the bytes in standard base64 with padding}
        public String toBase64() {
            return Base64.getEncoder().encodeToString(value);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Bytes other && Arrays.equals(value, other.value);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(value);
        }

        @Override
        public String toString() {
            return "Bytes[" + toBase64() + "]";
        }
    }

    record EnumNumber(int value) implements FieldValue {}

    /// A message-typed value; `message` is `null` when the field is unset.
    record Nested(Message message) implements FieldValue {}

    record Repeated(List<FieldValue> elements) implements FieldValue {
        public Repeated {
            Objects.requireNonNull(elements, "elements must not be null");
            elements = List.copyOf(elements);
        }
    }

    /// Map entries in the order they were inserted.
    record Mapped(Map<FieldValue, FieldValue> entries) implements FieldValue {
        public Mapped {
            Objects.requireNonNull(entries, "entries must not be null");
            final var copy = new LinkedHashMap<FieldValue, FieldValue>(entries.size());
            entries.forEach((k, v) -> copy.put(
                    Objects.requireNonNull(k, "map key must not be null"),
                    Objects.requireNonNull(v, "map value must not be null")));
            entries = Collections.unmodifiableMap(copy);
        }
    }

    static Bool of(boolean value) {
        return new Bool(value);
    }

    static Int32 of(int value) {
        return new Int32(value);
    }

    static Int64 of(long value) {
        return new Int64(value);
    }

    static Float32 of(float value) {
        return new Float32(value);
    }

    static Float64 of(double value) {
        return new Float64(value);
    }

    static Text of(String value) {
        return new Text(value);
    }

    static Bytes of(byte[] value) {
        return new Bytes(value);
    }

    static Nested of(Message message) {
        return new Nested(message);
    }

    static EnumNumber enumNumber(int number) {
        return new EnumNumber(number);
    }

    static Repeated list(List<? extends FieldValue> elements) {
        return new Repeated(List.copyOf(elements));
    }

    /// {@return the short shape name used in diagnostics}
    default String shape() {
        return getClass().getSimpleName();
    }
}
