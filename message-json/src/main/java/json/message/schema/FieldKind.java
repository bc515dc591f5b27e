package json.message.schema;

/// The closed set of field kinds a schema can declare.
///
/// The kind decides both the Java shape of a field's [FieldValue] and the JSON
/// token the formatter writes for it.
public enum FieldKind {
    DOUBLE,
    FLOAT,
    INT64,
    UINT64,
    INT32,
    FIXED64,
    FIXED32,
    BOOL,
    STRING,
    GROUP,
    MESSAGE,
    BYTES,
    UINT32,
    ENUM,
    SFIXED32,
    SFIXED64,
    SINT32,
    SINT64;

    /// {@return `true` for kinds whose values are nested messages}
    public boolean isMessage() {
        return this == MESSAGE || this == GROUP;
    }

    /// {@return `true` for the integer kinds carried in a `long`}
    public boolean is64Bit() {
        return switch (this) {
            case INT64, UINT64, FIXED64, SFIXED64, SINT64 -> true;
            default -> false;
        };
    }

    /// {@return `true` for the integer kinds carried in an `int`}
    public boolean is32Bit() {
        return switch (this) {
            case INT32, UINT32, FIXED32, SFIXED32, SINT32 -> true;
            default -> false;
        };
    }

    /// {@return `true` for integer kinds whose bit pattern is read as unsigned}
    public boolean isUnsigned() {
        return switch (this) {
            case UINT32, FIXED32, UINT64, FIXED64 -> true;
            default -> false;
        };
    }

    /// {@return `true` for kinds that may be used as map keys}
    public boolean isValidMapKey() {
        return this == STRING || this == BOOL || is32Bit() || is64Bit();
    }
}
