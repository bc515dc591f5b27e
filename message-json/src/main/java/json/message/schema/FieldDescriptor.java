package json.message.schema;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Describes one declared field of a message type.
///
/// Map fields are repeated `MESSAGE` fields that carry a key descriptor
/// (number 1) and a value descriptor (number 2), mirroring the implicit entry
/// type a schema compiler generates for them.
///
/// @param name the declared name, usually `lower_snake_case`
/// @param number the field number, positive
/// @param kind the field kind; for map fields always [FieldKind#MESSAGE]
/// @param repeated whether the field holds a list (true for map fields too)
/// @param typeName full name of the message or enum type, `null` for scalars
/// @param enumType the enum type of an `ENUM` field, otherwise `null`
/// @param oneof the name of the containing oneof, `null` if none
/// @param mapKey the key descriptor of a map field, otherwise `null`
/// @param mapValue the value descriptor of a map field, otherwise `null`
public record FieldDescriptor(
        String name,
        int number,
        FieldKind kind,
        boolean repeated,
        String typeName,
        EnumDescriptor enumType,
        String oneof,
        FieldDescriptor mapKey,
        FieldDescriptor mapValue) {

    public FieldDescriptor {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        if (number <= 0) {
            throw new IllegalArgumentException("Field number must be positive: " + name + " = " + number);
        }
        if (kind == FieldKind.ENUM && enumType == null) {
            throw new IllegalArgumentException("Enum field requires an enum type: " + name);
        }
        if (kind == FieldKind.ENUM) {
            typeName = enumType.fullName();
        }
        if (kind.isMessage() && mapKey == null && typeName == null) {
            throw new IllegalArgumentException("Message field requires a type name: " + name);
        }
        if ((mapKey == null) != (mapValue == null)) {
            throw new IllegalArgumentException("Map field requires both key and value descriptors: " + name);
        }
        if (mapKey != null) {
            if (!mapKey.kind().isValidMapKey()) {
                throw new IllegalArgumentException("Invalid map key kind " + mapKey.kind() + " for field " + name);
            }
            if (!repeated || kind != FieldKind.MESSAGE) {
                throw new IllegalArgumentException("Map field must be a repeated message field: " + name);
            }
        }
        if (oneof != null && repeated) {
            throw new IllegalArgumentException("Repeated field cannot belong to a oneof: " + name);
        }
    }

    /// {@return a singular scalar field}
    public static FieldDescriptor of(String name, int number, FieldKind kind) {
        return new FieldDescriptor(name, number, kind, false, null, null, null, null, null);
    }

    /// {@return a repeated scalar field}
    public static FieldDescriptor repeated(String name, int number, FieldKind kind) {
        return new FieldDescriptor(name, number, kind, true, null, null, null, null, null);
    }

    /// {@return a singular enum field}
    public static FieldDescriptor ofEnum(String name, int number, EnumDescriptor enumType) {
        return new FieldDescriptor(name, number, FieldKind.ENUM, false, null, enumType, null, null, null);
    }

    /// {@return a repeated enum field}
    public static FieldDescriptor repeatedEnum(String name, int number, EnumDescriptor enumType) {
        return new FieldDescriptor(name, number, FieldKind.ENUM, true, null, enumType, null, null, null);
    }

    /// {@return a singular message field of the named type}
    public static FieldDescriptor ofMessage(String name, int number, String typeName) {
        return new FieldDescriptor(name, number, FieldKind.MESSAGE, false, typeName, null, null, null, null);
    }

    /// {@return a repeated message field of the named type}
    public static FieldDescriptor repeatedMessage(String name, int number, String typeName) {
        return new FieldDescriptor(name, number, FieldKind.MESSAGE, true, typeName, null, null, null, null);
    }

    /// Creates a map field.
    ///
    /// @param name the field name
    /// @param number the field number
    /// @param keyKind the key kind; string, bool or any integer kind
    /// @param value a template for the value; only its kind and type information are used
    /// @return the map field descriptor
    public static FieldDescriptor ofMap(String name, int number, FieldKind keyKind, FieldDescriptor value) {
        final var key = FieldDescriptor.of("key", 1, keyKind);
        final var entryValue = new FieldDescriptor("value", 2, value.kind(), false,
                value.typeName(), value.enumType(), null, null, null);
        return new FieldDescriptor(name, number, FieldKind.MESSAGE, true, null, null, null, key, entryValue);
    }

    /// {@return a copy of this field as a member of the named oneof}
    public FieldDescriptor inOneof(String oneofName) {
        Objects.requireNonNull(oneofName, "oneofName must not be null");
        return new FieldDescriptor(name, number, kind, repeated, typeName, enumType, oneofName, mapKey, mapValue);
    }

    /// {@return `true` if this is a map field}
    public boolean isMap() {
        return mapKey != null;
    }

    /// {@return the value an unset field reports}
    public FieldValue defaultValue() {
        if (isMap()) {
            return new FieldValue.Mapped(Map.of());
        }
        if (repeated) {
            return FieldValue.list(List.of());
        }
        return switch (kind) {
            case BOOL -> FieldValue.of(false);
            case STRING -> FieldValue.of("");
            case BYTES -> FieldValue.of(new byte[0]);
            case DOUBLE -> FieldValue.of(0.0d);
            case FLOAT -> FieldValue.of(0.0f);
            case INT32, UINT32, SINT32, FIXED32, SFIXED32 -> FieldValue.of(0);
            case INT64, UINT64, SINT64, FIXED64, SFIXED64 -> FieldValue.of(0L);
            case ENUM -> FieldValue.enumNumber(0);
            case MESSAGE, GROUP -> new FieldValue.Nested(null);
        };
    }

    /// {@return `true` if `value` has the shape this field's kind carries}
    public boolean accepts(FieldValue value) {
        if (isMap()) {
            if (!(value instanceof FieldValue.Mapped mapped)) {
                return false;
            }
            for (final var entry : mapped.entries().entrySet()) {
                if (!acceptsSingle(mapKey.kind(), entry.getKey()) || !acceptsSingle(mapValue.kind(), entry.getValue())) {
                    return false;
                }
            }
            return true;
        }
        if (repeated) {
            if (!(value instanceof FieldValue.Repeated list)) {
                return false;
            }
            for (final var element : list.elements()) {
                if (!acceptsSingle(kind, element)) {
                    return false;
                }
            }
            return true;
        }
        return acceptsSingle(kind, value);
    }

    /// {@return `true` if `value` is the singular shape carried by `kind`}
    public static boolean acceptsSingle(FieldKind kind, FieldValue value) {
        return switch (kind) {
            case BOOL -> value instanceof FieldValue.Bool;
            case STRING -> value instanceof FieldValue.Text;
            case BYTES -> value instanceof FieldValue.Bytes;
            case DOUBLE -> value instanceof FieldValue.Float64;
            case FLOAT -> value instanceof FieldValue.Float32;
            case INT32, UINT32, SINT32, FIXED32, SFIXED32 -> value instanceof FieldValue.Int32;
            case INT64, UINT64, SINT64, FIXED64, SFIXED64 -> value instanceof FieldValue.Int64;
            case ENUM -> value instanceof FieldValue.EnumNumber;
            case MESSAGE, GROUP -> value instanceof FieldValue.Nested;
        };
    }
}
