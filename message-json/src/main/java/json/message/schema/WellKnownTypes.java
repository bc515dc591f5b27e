package json.message.schema;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Descriptors for the well-known types, and factories that build instances
/// of them as [DynamicMessage]s.
public final class WellKnownTypes {

    public static final int SECONDS_FIELD_NUMBER = 1;
    public static final int NANOS_FIELD_NUMBER = 2;
    public static final int PATHS_FIELD_NUMBER = 1;
    public static final int FIELDS_FIELD_NUMBER = 1;
    public static final int VALUES_FIELD_NUMBER = 1;
    public static final int WRAPPED_VALUE_FIELD_NUMBER = 1;

    public static final int NULL_VALUE_FIELD_NUMBER = 1;
    public static final int NUMBER_VALUE_FIELD_NUMBER = 2;
    public static final int STRING_VALUE_FIELD_NUMBER = 3;
    public static final int BOOL_VALUE_FIELD_NUMBER = 4;
    public static final int STRUCT_VALUE_FIELD_NUMBER = 5;
    public static final int LIST_VALUE_FIELD_NUMBER = 6;

    /// Name of the oneof holding the kind of a `Value`.
    public static final String VALUE_KIND_ONEOF = "kind";

    public static final EnumDescriptor NULL_VALUE =
            EnumDescriptor.of("google.protobuf.NullValue", "NULL_VALUE", 0);

    public static final MessageDescriptor TIMESTAMP = MessageDescriptor.of(
            WellKnownType.TIMESTAMP.fullName(),
            FieldDescriptor.of("seconds", SECONDS_FIELD_NUMBER, FieldKind.INT64),
            FieldDescriptor.of("nanos", NANOS_FIELD_NUMBER, FieldKind.INT32));

    public static final MessageDescriptor DURATION = MessageDescriptor.of(
            WellKnownType.DURATION.fullName(),
            FieldDescriptor.of("seconds", SECONDS_FIELD_NUMBER, FieldKind.INT64),
            FieldDescriptor.of("nanos", NANOS_FIELD_NUMBER, FieldKind.INT32));

    public static final MessageDescriptor FIELD_MASK = MessageDescriptor.of(
            WellKnownType.FIELD_MASK.fullName(),
            FieldDescriptor.repeated("paths", PATHS_FIELD_NUMBER, FieldKind.STRING));

    public static final MessageDescriptor STRUCT = MessageDescriptor.of(
            WellKnownType.STRUCT.fullName(),
            FieldDescriptor.ofMap("fields", FIELDS_FIELD_NUMBER, FieldKind.STRING,
                    FieldDescriptor.ofMessage("value", 2, WellKnownType.VALUE.fullName())));

    public static final MessageDescriptor VALUE = MessageDescriptor.of(
            WellKnownType.VALUE.fullName(),
            FieldDescriptor.ofEnum("null_value", NULL_VALUE_FIELD_NUMBER, NULL_VALUE).inOneof(VALUE_KIND_ONEOF),
            FieldDescriptor.of("number_value", NUMBER_VALUE_FIELD_NUMBER, FieldKind.DOUBLE).inOneof(VALUE_KIND_ONEOF),
            FieldDescriptor.of("string_value", STRING_VALUE_FIELD_NUMBER, FieldKind.STRING).inOneof(VALUE_KIND_ONEOF),
            FieldDescriptor.of("bool_value", BOOL_VALUE_FIELD_NUMBER, FieldKind.BOOL).inOneof(VALUE_KIND_ONEOF),
            FieldDescriptor.ofMessage("struct_value", STRUCT_VALUE_FIELD_NUMBER, WellKnownType.STRUCT.fullName())
                    .inOneof(VALUE_KIND_ONEOF),
            FieldDescriptor.ofMessage("list_value", LIST_VALUE_FIELD_NUMBER, WellKnownType.LIST_VALUE.fullName())
                    .inOneof(VALUE_KIND_ONEOF));

    public static final MessageDescriptor LIST_VALUE = MessageDescriptor.of(
            WellKnownType.LIST_VALUE.fullName(),
            FieldDescriptor.repeatedMessage("values", VALUES_FIELD_NUMBER, WellKnownType.VALUE.fullName()));

    private static final Map<WellKnownType, MessageDescriptor> WRAPPERS = wrappers();

    private WellKnownTypes() {}

    private static Map<WellKnownType, MessageDescriptor> wrappers() {
        final var map = new EnumMap<WellKnownType, MessageDescriptor>(WellKnownType.class);
        wrapper(map, WellKnownType.DOUBLE_VALUE, FieldKind.DOUBLE);
        wrapper(map, WellKnownType.FLOAT_VALUE, FieldKind.FLOAT);
        wrapper(map, WellKnownType.INT64_VALUE, FieldKind.INT64);
        wrapper(map, WellKnownType.UINT64_VALUE, FieldKind.UINT64);
        wrapper(map, WellKnownType.INT32_VALUE, FieldKind.INT32);
        wrapper(map, WellKnownType.UINT32_VALUE, FieldKind.UINT32);
        wrapper(map, WellKnownType.BOOL_VALUE, FieldKind.BOOL);
        wrapper(map, WellKnownType.STRING_VALUE, FieldKind.STRING);
        wrapper(map, WellKnownType.BYTES_VALUE, FieldKind.BYTES);
        return map;
    }

    private static void wrapper(Map<WellKnownType, MessageDescriptor> map, WellKnownType type, FieldKind kind) {
        map.put(type, MessageDescriptor.of(type.fullName(),
                FieldDescriptor.of("value", WRAPPED_VALUE_FIELD_NUMBER, kind)));
    }

    /// {@return the descriptor of a scalar wrapper type}
    /// @throws IllegalArgumentException if `type` is not a wrapper
    public static MessageDescriptor wrapperDescriptor(WellKnownType type) {
        final var descriptor = WRAPPERS.get(type);
        if (descriptor == null) {
            throw new IllegalArgumentException(type + " is not a wrapper type");
        }
        return descriptor;
    }

    // ---- Timestamp / Duration ----

    public static DynamicMessage timestamp(long seconds, int nanos) {
        return secondsAndNanos(TIMESTAMP, seconds, nanos);
    }

    public static DynamicMessage timestamp(Instant instant) {
        return timestamp(instant.getEpochSecond(), instant.getNano());
    }

    public static DynamicMessage duration(long seconds, int nanos) {
        return secondsAndNanos(DURATION, seconds, nanos);
    }

    public static DynamicMessage duration(java.time.Duration duration) {
        // java.time keeps nanos positive; a message keeps them with the sign of seconds
        long seconds = duration.getSeconds();
        int nanos = duration.getNano();
        if (seconds < 0 && nanos > 0) {
            seconds += 1;
            nanos -= 1_000_000_000;
        }
        return duration(seconds, nanos);
    }

    private static DynamicMessage secondsAndNanos(MessageDescriptor descriptor, long seconds, int nanos) {
        return DynamicMessage.newBuilder(descriptor)
                .set("seconds", FieldValue.of(seconds))
                .set("nanos", FieldValue.of(nanos))
                .build();
    }

    // ---- FieldMask ----

    public static DynamicMessage fieldMask(String... paths) {
        return fieldMask(List.of(paths));
    }

    public static DynamicMessage fieldMask(List<String> paths) {
        final var elements = new ArrayList<FieldValue>(paths.size());
        for (final var path : paths) {
            elements.add(FieldValue.of(path));
        }
        return DynamicMessage.newBuilder(FIELD_MASK).set("paths", FieldValue.list(elements)).build();
    }

    // ---- Struct / Value / ListValue ----

    /// Creates a `Struct` from `Value` messages; entry order is the map's iteration order.
    public static DynamicMessage struct(Map<String, ? extends Message> fields) {
        final var builder = DynamicMessage.newBuilder(STRUCT);
        fields.forEach((key, value) -> builder.put("fields", FieldValue.of(key), FieldValue.of(value)));
        return builder.build();
    }

    public static DynamicMessage listValue(List<? extends Message> values) {
        final var builder = DynamicMessage.newBuilder(LIST_VALUE);
        for (final var value : values) {
            builder.add("values", FieldValue.of(Objects.requireNonNull(value, "value must not be null")));
        }
        return builder.build();
    }

    public static DynamicMessage nullValue() {
        return DynamicMessage.newBuilder(VALUE).set("null_value", FieldValue.enumNumber(0)).build();
    }

    public static DynamicMessage numberValue(double number) {
        return DynamicMessage.newBuilder(VALUE).set("number_value", FieldValue.of(number)).build();
    }

    public static DynamicMessage stringValue(String text) {
        return DynamicMessage.newBuilder(VALUE).set("string_value", FieldValue.of(text)).build();
    }

    public static DynamicMessage boolValue(boolean flag) {
        return DynamicMessage.newBuilder(VALUE).set("bool_value", FieldValue.of(flag)).build();
    }

    public static DynamicMessage structValue(Message struct) {
        return DynamicMessage.newBuilder(VALUE).set("struct_value", FieldValue.of(struct)).build();
    }

    public static DynamicMessage listValueValue(Message list) {
        return DynamicMessage.newBuilder(VALUE).set("list_value", FieldValue.of(list)).build();
    }

    // ---- Wrappers ----

    public static DynamicMessage wrapDouble(double value) {
        return wrap(WellKnownType.DOUBLE_VALUE, FieldValue.of(value));
    }

    public static DynamicMessage wrapFloat(float value) {
        return wrap(WellKnownType.FLOAT_VALUE, FieldValue.of(value));
    }

    public static DynamicMessage wrapInt64(long value) {
        return wrap(WellKnownType.INT64_VALUE, FieldValue.of(value));
    }

    public static DynamicMessage wrapUInt64(long value) {
        return wrap(WellKnownType.UINT64_VALUE, FieldValue.of(value));
    }

    public static DynamicMessage wrapInt32(int value) {
        return wrap(WellKnownType.INT32_VALUE, FieldValue.of(value));
    }

    public static DynamicMessage wrapUInt32(int value) {
        return wrap(WellKnownType.UINT32_VALUE, FieldValue.of(value));
    }

    public static DynamicMessage wrapBool(boolean value) {
        return wrap(WellKnownType.BOOL_VALUE, FieldValue.of(value));
    }

    public static DynamicMessage wrapString(String value) {
        return wrap(WellKnownType.STRING_VALUE, FieldValue.of(value));
    }

    public static DynamicMessage wrapBytes(byte[] value) {
        return wrap(WellKnownType.BYTES_VALUE, FieldValue.of(value));
    }

    private static DynamicMessage wrap(WellKnownType type, FieldValue value) {
        return DynamicMessage.newBuilder(wrapperDescriptor(type)).set("value", value).build();
    }
}
