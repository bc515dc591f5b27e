package json.message;

import json.message.schema.FieldDescriptor;
import json.message.schema.FieldKind;
import json.message.schema.FieldValue;
import json.message.schema.Message;
import json.message.schema.OneofCase;
import json.message.schema.WellKnownType;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Reflection-driven conversion of messages to canonical JSON text.
///
/// Fields are written in ascending field-number order under their JSON names
/// (see [FieldNames#toJsonName(String)]). Objects and arrays use a single
/// space inside the brackets and after separators, and are written bare
/// (`{}`, `[]`) when empty:
///
/// ```
/// { "displayName": "Alice", "luckyNumbers": [ 7, 13 ], "id": "9007199254740993" }
/// ```
///
/// ## Field mapping
/// | Kind | JSON |
/// |------|------|
/// | bool | `true` / `false` |
/// | string | string, escaped by [JsonStrings] |
/// | bytes | base64 string |
/// | 32-bit integers | number |
/// | 64-bit integers | decimal string |
/// | float, double | number, or `"NaN"`, `"Infinity"`, `"-Infinity"` |
/// | enum | member name as a string |
/// | message | object, or the well-known type's own form |
/// | repeated | array |
/// | map | object keyed by the key's text |
///
/// Fields holding their kind's default value are omitted unless
/// [Settings#formatDefaultValues()] is set; the active member of a oneof is
/// always written. Enum numbers with no declared name are omitted: the field
/// for a singular enum, the element for repeated and map fields.
///
/// Instances are immutable and may be shared across threads.
public final class JsonFormatter {

    private static final Logger LOG = Logger.getLogger(JsonFormatter.class.getName());

    /// A formatter using [Settings#DEFAULT].
    public static final JsonFormatter DEFAULT = new JsonFormatter(Settings.DEFAULT);

    private final Settings settings;
    private final WellKnownTypeWriter wellKnownTypes;

    /// Creates a formatter with the given settings.
    ///
    /// @param settings the settings, non-null
    public JsonFormatter(Settings settings) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.wellKnownTypes = new WellKnownTypeWriter(this);
    }

    /// {@return the settings this formatter was created with}
    public Settings settings() {
        return settings;
    }

    /// Formats a message as JSON.
    ///
    /// A message whose type is well-known is written in that type's own form,
    /// e.g. a `Timestamp` becomes `"1970-01-01T00:00:00Z"`.
    ///
    /// @param message the message, non-null
    /// @return the JSON text
    /// @throws NullPointerException if `message` is `null`
    /// @throws JsonFormatException if the message cannot be represented
    public String format(Message message) {
        Objects.requireNonNull(message, "message must not be null");
        LOG.fine(() -> "Formatting " + message.descriptor().fullName());
        final var builder = new StringBuilder();
        final var wellKnown = message.descriptor().wellKnownType();
        if (wellKnown.isPresent()) {
            wellKnownTypes.write(builder, wellKnown.get(), message);
        } else {
            writeMessage(builder, message);
        }
        return builder.toString();
    }

    void writeMessage(StringBuilder builder, Message message) {
        if (message == null) {
            writeNull(builder);
            return;
        }
        final var descriptor = message.descriptor();
        final Map<String, OneofCase> oneofCases = new HashMap<>();
        builder.append('{');
        boolean first = true;
        for (final var field : descriptor.fields()) {
            final FieldValue value;
            if (field.oneof() != null) {
                final var oneofCase = oneofCases.computeIfAbsent(field.oneof(), message::oneofCase);
                if (!oneofCase.isCase(field)) {
                    continue;
                }
                // the active member is written even at its default, to keep the case
                value = ((OneofCase.Set) oneofCase).value();
            } else {
                value = message.get(field);
                if (!settings.formatDefaultValues() && isDefaultValue(field, value)) {
                    LOG.finer(() -> "Omitting default " + descriptor.fullName() + "." + field.name());
                    continue;
                }
            }
            if (!field.repeated() && !canWriteSingleValue(field, value)) {
                LOG.finer(() -> "Omitting unrepresentable " + descriptor.fullName() + "." + field.name());
                continue;
            }
            builder.append(first ? " " : ", ");
            JsonStrings.appendQuoted(builder, FieldNames.toJsonName(field.name()));
            builder.append(": ");
            writeValue(builder, field, value);
            first = false;
        }
        builder.append(first ? "}" : " }");
    }

    static boolean isDefaultValue(FieldDescriptor field, FieldValue value) {
        if (field.isMap()) {
            return expect(FieldValue.Mapped.class, field, value).entries().isEmpty();
        }
        if (field.repeated()) {
            return expect(FieldValue.Repeated.class, field, value).elements().isEmpty();
        }
        return switch (field.kind()) {
            case BOOL -> !expect(FieldValue.Bool.class, field, value).value();
            case BYTES -> expect(FieldValue.Bytes.class, field, value).size() == 0;
            case STRING -> expect(FieldValue.Text.class, field, value).value().isEmpty();
            case DOUBLE -> expect(FieldValue.Float64.class, field, value).value() == 0.0d;
            case FLOAT -> expect(FieldValue.Float32.class, field, value).value() == 0.0f;
            case INT32, UINT32, SINT32, FIXED32, SFIXED32 -> expect(FieldValue.Int32.class, field, value).value() == 0;
            case INT64, UINT64, SINT64, FIXED64, SFIXED64 -> expect(FieldValue.Int64.class, field, value).value() == 0L;
            case ENUM -> expect(FieldValue.EnumNumber.class, field, value).value() == 0;
            case MESSAGE, GROUP -> expect(FieldValue.Nested.class, field, value).message() == null;
        };
    }

    void writeValue(StringBuilder builder, FieldDescriptor field, FieldValue value) {
        if (field.isMap()) {
            writeMap(builder, field, expect(FieldValue.Mapped.class, field, value));
        } else if (field.repeated()) {
            writeList(builder, field, expect(FieldValue.Repeated.class, field, value));
        } else {
            writeSingleValue(builder, field, value);
        }
    }

    /// Writes one value of the field's kind. For repeated fields this is one element.
    void writeSingleValue(StringBuilder builder, FieldDescriptor field, FieldValue value) {
        switch (field.kind()) {
            case BOOL -> builder.append(expect(FieldValue.Bool.class, field, value).value() ? "true" : "false");
            // base64 needs no escaping
            case BYTES -> builder.append('"').append(expect(FieldValue.Bytes.class, field, value).toBase64()).append('"');
            case STRING -> JsonStrings.appendQuoted(builder, expect(FieldValue.Text.class, field, value).value());
            case INT32, UINT32, SINT32, FIXED32, SFIXED32 ->
                    JsonNumbers.appendInt32(builder, field.kind(), expect(FieldValue.Int32.class, field, value).value());
            case INT64, UINT64, SINT64, FIXED64, SFIXED64 ->
                    JsonNumbers.appendInt64(builder, field.kind(), expect(FieldValue.Int64.class, field, value).value());
            case DOUBLE -> JsonNumbers.appendDouble(builder, expect(FieldValue.Float64.class, field, value).value());
            case FLOAT -> JsonNumbers.appendFloat(builder, expect(FieldValue.Float32.class, field, value).value());
            case ENUM -> {
                final int number = expect(FieldValue.EnumNumber.class, field, value).value();
                // callers have already checked canWriteSingleValue
                final var name = field.enumType().findNameByNumber(number).orElseThrow(() ->
                        new JsonFormatException(JsonFormatException.Error.INVALID_SCHEMA_STATE,
                                "enum " + field.typeName() + " has no member numbered " + number));
                JsonStrings.appendQuoted(builder, name);
            }
            case MESSAGE, GROUP -> {
                final var message = expect(FieldValue.Nested.class, field, value).message();
                final var wellKnown = WellKnownType.forFullName(field.typeName());
                if (message == null) {
                    writeNull(builder);
                } else if (wellKnown.isPresent()) {
                    wellKnownTypes.write(builder, wellKnown.get(), message);
                } else {
                    writeMessage(builder, message);
                }
            }
        }
    }

    void writeList(StringBuilder builder, FieldDescriptor field, FieldValue.Repeated list) {
        builder.append('[');
        boolean first = true;
        for (final var element : list.elements()) {
            if (!canWriteSingleValue(field, element)) {
                continue;
            }
            builder.append(first ? " " : ", ");
            writeSingleValue(builder, field, element);
            first = false;
        }
        builder.append(first ? "]" : " ]");
    }

    void writeMap(StringBuilder builder, FieldDescriptor field, FieldValue.Mapped map) {
        final var keyField = field.mapKey();
        final var valueField = field.mapValue();
        builder.append('{');
        boolean first = true;
        for (final var entry : map.entries().entrySet()) {
            if (!canWriteSingleValue(valueField, entry.getValue())) {
                continue;
            }
            builder.append(first ? " " : ", ");
            JsonStrings.appendQuoted(builder, mapKeyText(keyField, entry.getKey()));
            builder.append(": ");
            writeSingleValue(builder, valueField, entry.getValue());
            first = false;
        }
        builder.append(first ? "}" : " }");
    }

    static String mapKeyText(FieldDescriptor keyField, FieldValue key) {
        final FieldKind kind = keyField.kind();
        if (kind == FieldKind.STRING) {
            return expect(FieldValue.Text.class, keyField, key).value();
        }
        if (kind == FieldKind.BOOL) {
            return expect(FieldValue.Bool.class, keyField, key).value() ? "true" : "false";
        }
        if (kind.is32Bit()) {
            return JsonNumbers.int32(kind, expect(FieldValue.Int32.class, keyField, key).value());
        }
        if (kind.is64Bit()) {
            return JsonNumbers.int64(kind, expect(FieldValue.Int64.class, keyField, key).value());
        }
        throw new JsonFormatException(JsonFormatException.Error.INVALID_SCHEMA_STATE,
                "invalid map key kind " + kind);
    }

    /// Whether a singular value has a JSON form. Only enum numbers without a
    /// declared member have none.
    static boolean canWriteSingleValue(FieldDescriptor field, FieldValue value) {
        if (field.kind() == FieldKind.ENUM) {
            final int number = expect(FieldValue.EnumNumber.class, field, value).value();
            return field.enumType().findNameByNumber(number).isPresent();
        }
        return true;
    }

    static void writeNull(StringBuilder builder) {
        builder.append("null");
    }

    static <T extends FieldValue> T expect(Class<T> shape, FieldDescriptor field, FieldValue value) {
        if (shape.isInstance(value)) {
            return shape.cast(value);
        }
        throw new JsonFormatException(JsonFormatException.Error.INVALID_SCHEMA_STATE,
                "field " + field.name() + " of kind " + field.kind() + " holds "
                        + (value == null ? "null" : value.shape()) + ", expected " + shape.getSimpleName());
    }

    /// Formatting options.
    ///
    /// @param formatDefaultValues whether fields holding their kind's default
    ///        value (`0`, `""`, `false`, empty lists) are written
    public record Settings(boolean formatDefaultValues) {

        /// System property read by [#fromSystemProperties()].
        public static final String FORMAT_DEFAULT_VALUES_PROPERTY = "json.message.formatDefaultValues";

        /// Omits default values.
        public static final Settings DEFAULT = new Settings(false);

        /// {@return settings taken from system properties, defaulting to [#DEFAULT]}
        public static Settings fromSystemProperties() {
            final var property = System.getProperty(FORMAT_DEFAULT_VALUES_PROPERTY);
            if (property == null) {
                return DEFAULT;
            }
            final boolean formatDefaults = Boolean.parseBoolean(property.trim());
            LOG.fine(() -> "formatDefaultValues set to " + formatDefaults + " via system property");
            return new Settings(formatDefaults);
        }

        /// {@return a copy of these settings with the given default-value handling}
        public Settings withFormatDefaultValues(boolean formatDefaultValues) {
            return new Settings(formatDefaultValues);
        }
    }
}
