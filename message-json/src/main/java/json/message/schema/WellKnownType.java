package json.message.schema;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/// Schema types with a standardized JSON form that differs from the generic
/// object encoding. Identity is the full type name.
public enum WellKnownType {
    DOUBLE_VALUE("google.protobuf.DoubleValue", true),
    FLOAT_VALUE("google.protobuf.FloatValue", true),
    INT64_VALUE("google.protobuf.Int64Value", true),
    UINT64_VALUE("google.protobuf.UInt64Value", true),
    INT32_VALUE("google.protobuf.Int32Value", true),
    UINT32_VALUE("google.protobuf.UInt32Value", true),
    BOOL_VALUE("google.protobuf.BoolValue", true),
    STRING_VALUE("google.protobuf.StringValue", true),
    BYTES_VALUE("google.protobuf.BytesValue", true),
    TIMESTAMP("google.protobuf.Timestamp", false),
    DURATION("google.protobuf.Duration", false),
    FIELD_MASK("google.protobuf.FieldMask", false),
    STRUCT("google.protobuf.Struct", false),
    VALUE("google.protobuf.Value", false),
    LIST_VALUE("google.protobuf.ListValue", false);

    private static final Map<String, WellKnownType> BY_NAME = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(WellKnownType::fullName, Function.identity()));

    private final String fullName;
    private final boolean wrapper;

    WellKnownType(String fullName, boolean wrapper) {
        this.fullName = fullName;
        this.wrapper = wrapper;
    }

    /// {@return the fully qualified type name}
    public String fullName() {
        return fullName;
    }

    /// {@return `true` for the single-field scalar wrapper types}
    public boolean isWrapper() {
        return wrapper;
    }

    /// {@return the well-known type with the given full name, if it is one}
    public static Optional<WellKnownType> forFullName(String fullName) {
        return fullName == null ? Optional.empty() : Optional.ofNullable(BY_NAME.get(fullName));
    }
}
