package json.message;

import json.message.schema.FieldDescriptor;
import json.message.schema.FieldValue;
import json.message.schema.Message;
import json.message.schema.OneofCase;
import json.message.schema.WellKnownType;
import json.message.schema.WellKnownTypes;

import java.util.EnumMap;
import java.util.Map;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/// Writes the well-known types in their standardized JSON forms.
///
/// | Type | JSON |
/// |------|------|
/// | scalar wrappers | the wrapped scalar |
/// | `Timestamp` | `"2017-01-15T01:30:15.010Z"` |
/// | `Duration` | `"1.500s"` |
/// | `FieldMask` | `"fooBar,baz"` |
/// | `Struct` | object |
/// | `ListValue` | array |
/// | `Value` | whichever JSON value its `kind` holds |
///
/// Fields are looked up by number on the instance's own descriptor, so any
/// message carrying the standard layout under the standard name is accepted.
final class WellKnownTypeWriter {

    private static final Logger LOG = Logger.getLogger(WellKnownTypeWriter.class.getName());

    @FunctionalInterface
    private interface Handler {
        void write(StringBuilder builder, Message message);
    }

    private final JsonFormatter formatter;
    private final Map<WellKnownType, Handler> handlers;

    WellKnownTypeWriter(JsonFormatter formatter) {
        this.formatter = formatter;
        final var map = new EnumMap<WellKnownType, Handler>(WellKnownType.class);
        for (final var type : WellKnownType.values()) {
            if (type.isWrapper()) {
                map.put(type, this::writeWrapper);
            }
        }
        map.put(WellKnownType.TIMESTAMP, (b, m) -> writeQuoted(b, m, this::writeTimestamp));
        map.put(WellKnownType.DURATION, (b, m) -> writeQuoted(b, m, this::writeDuration));
        map.put(WellKnownType.FIELD_MASK, (b, m) -> writeQuoted(b, m, this::writeFieldMask));
        map.put(WellKnownType.STRUCT, this::writeStruct);
        map.put(WellKnownType.LIST_VALUE, this::writeListValue);
        map.put(WellKnownType.VALUE, this::writeStructFieldValue);
        this.handlers = map;
    }

    /// Writes `message` as the given well-known type; `null` is written as JSON `null`.
    void write(StringBuilder builder, WellKnownType type, Message message) {
        if (message == null) {
            JsonFormatter.writeNull(builder);
            return;
        }
        LOG.finer(() -> "Writing well-known type " + type.fullName());
        handlers.get(type).write(builder, message);
    }

    // Timestamp, Duration and FieldMask are JSON strings wherever they appear,
    // including as the message being formatted.
    private static void writeQuoted(StringBuilder builder, Message message, Handler handler) {
        builder.append('"');
        handler.write(builder, message);
        builder.append('"');
    }

    private void writeWrapper(StringBuilder builder, Message message) {
        final var field = field(message, WellKnownTypes.WRAPPED_VALUE_FIELD_NUMBER);
        formatter.writeSingleValue(builder, field, message.get(field));
    }

    private void writeTimestamp(StringBuilder builder, Message message) {
        TimeFormats.appendTimestamp(builder, seconds(message), nanos(message));
    }

    private void writeDuration(StringBuilder builder, Message message) {
        TimeFormats.appendDuration(builder, seconds(message), nanos(message));
    }

    private void writeFieldMask(StringBuilder builder, Message message) {
        final var field = field(message, WellKnownTypes.PATHS_FIELD_NUMBER);
        final var paths = JsonFormatter.expect(FieldValue.Repeated.class, field, message.get(field));
        final var joined = paths.elements().stream()
                .map(path -> FieldNames.toJsonName(JsonFormatter.expect(FieldValue.Text.class, field, path).value()))
                .collect(Collectors.joining(","));
        JsonStrings.appendEscaped(builder, joined);
    }

    private void writeStruct(StringBuilder builder, Message message) {
        final var field = field(message, WellKnownTypes.FIELDS_FIELD_NUMBER);
        final var fields = JsonFormatter.expect(FieldValue.Mapped.class, field, message.get(field));
        builder.append('{');
        boolean first = true;
        for (final var entry : fields.entries().entrySet()) {
            final var key = JsonFormatter.expect(FieldValue.Text.class, field.mapKey(), entry.getKey()).value();
            final var value = JsonFormatter.expect(FieldValue.Nested.class, field.mapValue(), entry.getValue()).message();
            if (key.isEmpty() || value == null) {
                throw new JsonFormatException(JsonFormatException.Error.MALFORMED_WELL_KNOWN_TYPE,
                        "Struct", "fields cannot have an empty key or a null value");
            }
            builder.append(first ? " " : ", ");
            JsonStrings.appendQuoted(builder, key);
            builder.append(": ");
            writeStructFieldValue(builder, value);
            first = false;
        }
        builder.append(first ? "}" : " }");
    }

    private void writeListValue(StringBuilder builder, Message message) {
        final var field = field(message, WellKnownTypes.VALUES_FIELD_NUMBER);
        formatter.writeList(builder, field, JsonFormatter.expect(FieldValue.Repeated.class, field, message.get(field)));
    }

    private void writeStructFieldValue(StringBuilder builder, Message message) {
        // the kind is the descriptor's only oneof, whatever it is named
        final var oneofs = message.descriptor().oneofs();
        final OneofCase oneofCase = oneofs.isEmpty()
                ? OneofCase.NONE
                : message.oneofCase(oneofs.iterator().next());
        if (!(oneofCase instanceof OneofCase.Set set)) {
            throw new JsonFormatException(JsonFormatException.Error.MALFORMED_WELL_KNOWN_TYPE,
                    "Value", "no kind is set");
        }
        final var field = set.field();
        switch (field.number()) {
            case WellKnownTypes.BOOL_VALUE_FIELD_NUMBER,
                 WellKnownTypes.STRING_VALUE_FIELD_NUMBER,
                 WellKnownTypes.NUMBER_VALUE_FIELD_NUMBER,
                 // Struct and ListValue go back through the dispatcher via the field's type
                 WellKnownTypes.STRUCT_VALUE_FIELD_NUMBER,
                 WellKnownTypes.LIST_VALUE_FIELD_NUMBER -> formatter.writeSingleValue(builder, field, set.value());
            case WellKnownTypes.NULL_VALUE_FIELD_NUMBER -> JsonFormatter.writeNull(builder);
            default -> throw new JsonFormatException(JsonFormatException.Error.MALFORMED_WELL_KNOWN_TYPE,
                    "Value", "unexpected kind field number " + field.number());
        }
    }

    private static long seconds(Message message) {
        final var field = field(message, WellKnownTypes.SECONDS_FIELD_NUMBER);
        return JsonFormatter.expect(FieldValue.Int64.class, field, message.get(field)).value();
    }

    private static int nanos(Message message) {
        final var field = field(message, WellKnownTypes.NANOS_FIELD_NUMBER);
        return JsonFormatter.expect(FieldValue.Int32.class, field, message.get(field)).value();
    }

    private static FieldDescriptor field(Message message, int number) {
        final var descriptor = message.descriptor();
        return descriptor.findFieldByNumber(number).orElseThrow(() ->
                new JsonFormatException(JsonFormatException.Error.MALFORMED_WELL_KNOWN_TYPE,
                        descriptor.fullName(), "no field number " + number));
    }
}
