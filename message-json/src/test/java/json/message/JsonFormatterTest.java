package json.message;

import json.message.schema.DynamicMessage;
import json.message.schema.FieldDescriptor;
import json.message.schema.FieldKind;
import json.message.schema.FieldValue;
import json.message.schema.Message;
import json.message.schema.MessageDescriptor;
import json.message.schema.OneofCase;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.logging.Logger;
import java.util.stream.IntStream;

import static json.message.TestSchemas.allTypes;
import static json.message.TestSchemas.nested;
import static org.assertj.core.api.Assertions.*;

/// Unit tests for the generic message encoding of [JsonFormatter].
class JsonFormatterTest extends MessageJsonLoggingConfig {

    private static final Logger LOG = Logger.getLogger(JsonFormatterTest.class.getName());

    private static final JsonFormatter FORMATTER = JsonFormatter.DEFAULT;
    private static final JsonFormatter WITH_DEFAULTS = new JsonFormatter(new JsonFormatter.Settings(true));

    private static final MessageDescriptor DEFAULTS = MessageDescriptor.of("demo.Defaults",
            FieldDescriptor.of("int32_value", 1, FieldKind.INT32),
            FieldDescriptor.of("text", 2, FieldKind.STRING),
            FieldDescriptor.of("flag", 3, FieldKind.BOOL),
            FieldDescriptor.of("blob", 4, FieldKind.BYTES),
            FieldDescriptor.repeated("items", 5, FieldKind.INT32),
            FieldDescriptor.ofMap("lookup", 6, FieldKind.STRING, FieldDescriptor.of("value", 2, FieldKind.INT32)),
            FieldDescriptor.ofMessage("child", 7, TestSchemas.NESTED.fullName()),
            FieldDescriptor.ofEnum("color", 8, TestSchemas.FOREIGN_ENUM),
            FieldDescriptor.of("big", 9, FieldKind.INT64),
            FieldDescriptor.of("ratio", 10, FieldKind.DOUBLE),
            FieldDescriptor.of("choice_a", 11, FieldKind.INT32).inOneof("choice"),
            FieldDescriptor.of("choice_b", 12, FieldKind.STRING).inOneof("choice"));

    // ========== Objects and scalars ==========

    @Test
    void emptyMessage_isBareBraces() {
        LOG.info(() -> "TEST: emptyMessage_isBareBraces");
        assertThat(FORMATTER.format(allTypes().build())).isEqualTo("{}");
    }

    @Test
    void scalars_useKindSpecificTokens() {
        LOG.info(() -> "TEST: scalars_useKindSpecificTokens");

        final var message = allTypes()
                .set("single_int32", FieldValue.of(10))
                .set("single_int64", FieldValue.of(-1L))
                .set("single_uint32", FieldValue.of(-1))
                .set("single_uint64", FieldValue.of(-1L))
                .set("single_sint32", FieldValue.of(-5))
                .set("single_fixed64", FieldValue.of(Long.MIN_VALUE))
                .set("single_sfixed64", FieldValue.of(Long.MIN_VALUE))
                .set("single_float", FieldValue.of(1.5f))
                .set("single_double", FieldValue.of(0.25d))
                .set("single_bool", FieldValue.of(true))
                .set("single_string", FieldValue.of("foo"))
                .set("single_bytes", FieldValue.of(new byte[] {1, 2, 3}))
                .build();

        assertThat(FORMATTER.format(message)).isEqualTo("{ "
                + "\"singleInt32\": 10, "
                + "\"singleInt64\": \"-1\", "
                + "\"singleUint32\": 4294967295, "
                + "\"singleUint64\": \"18446744073709551615\", "
                + "\"singleSint32\": -5, "
                + "\"singleFixed64\": \"9223372036854775808\", "
                + "\"singleSfixed64\": \"-9223372036854775808\", "
                + "\"singleFloat\": 1.5, "
                + "\"singleDouble\": 0.25, "
                + "\"singleBool\": true, "
                + "\"singleString\": \"foo\", "
                + "\"singleBytes\": \"AQID\" }");
    }

    @Test
    void floatUsesShortestFloatText() {
        LOG.info(() -> "TEST: floatUsesShortestFloatText");
        final var message = allTypes().set("single_float", FieldValue.of(0.1f)).build();
        assertThat(FORMATTER.format(message)).isEqualTo("{ \"singleFloat\": 0.1 }");
    }

    @Test
    void nonFiniteFloatingPoint_isQuotedByName() {
        LOG.info(() -> "TEST: nonFiniteFloatingPoint_isQuotedByName");

        final var message = allTypes()
                .set("single_float", FieldValue.of(Float.NaN))
                .add("repeated_double", FieldValue.of(Double.NaN))
                .add("repeated_double", FieldValue.of(Double.POSITIVE_INFINITY))
                .add("repeated_double", FieldValue.of(Double.NEGATIVE_INFINITY))
                .add("repeated_double", FieldValue.of(1.0d))
                .build();

        assertThat(FORMATTER.format(message)).isEqualTo(
                "{ \"singleFloat\": \"NaN\", \"repeatedDouble\": [ \"NaN\", \"Infinity\", \"-Infinity\", 1.0 ] }");
    }

    @Test
    void stringValues_areEscaped() {
        LOG.info(() -> "TEST: stringValues_areEscaped");
        final var message = allTypes().set("single_string", FieldValue.of("<a href=\"x\">\n")).build();
        assertThat(FORMATTER.format(message))
                .isEqualTo("{ \"singleString\": \"\\u003ca href=\\\"x\\\"\\u003e\\n\" }");
    }

    @Test
    void fields_areWrittenInFieldNumberOrder() {
        LOG.info(() -> "TEST: fields_areWrittenInFieldNumberOrder");

        final var descriptor = MessageDescriptor.of("demo.Unordered",
                FieldDescriptor.of("third", 3, FieldKind.INT32),
                FieldDescriptor.of("first", 1, FieldKind.INT32),
                FieldDescriptor.of("second", 2, FieldKind.INT32));
        final var message = DynamicMessage.newBuilder(descriptor)
                .set("third", FieldValue.of(3))
                .set("second", FieldValue.of(2))
                .set("first", FieldValue.of(1))
                .build();

        assertThat(FORMATTER.format(message)).isEqualTo("{ \"first\": 1, \"second\": 2, \"third\": 3 }");
    }

    // ========== Default values ==========

    @Test
    void defaultValues_areOmittedByDefault() {
        LOG.info(() -> "TEST: defaultValues_areOmittedByDefault");

        final var message = DynamicMessage.newBuilder(DEFAULTS)
                .set("int32_value", FieldValue.of(0))
                .set("text", FieldValue.of(""))
                .set("ratio", FieldValue.of(-0.0d))
                .set("child", FieldValue.of((Message) null))
                .build();

        assertThat(FORMATTER.format(message)).isEqualTo("{}");
    }

    @Test
    void defaultValues_areWrittenWhenRequested() {
        LOG.info(() -> "TEST: defaultValues_areWrittenWhenRequested");

        assertThat(WITH_DEFAULTS.format(DynamicMessage.empty(DEFAULTS))).isEqualTo("{ "
                + "\"int32Value\": 0, "
                + "\"text\": \"\", "
                + "\"flag\": false, "
                + "\"blob\": \"\", "
                + "\"items\": [], "
                + "\"lookup\": {}, "
                + "\"child\": null, "
                + "\"color\": \"FOREIGN_UNSPECIFIED\", "
                + "\"big\": \"0\", "
                + "\"ratio\": 0.0 }");
    }

    @Test
    void nestedEmptyMessage_isWrittenAsEmptyObject() {
        LOG.info(() -> "TEST: nestedEmptyMessage_isWrittenAsEmptyObject");
        final var message = allTypes().set("single_nested_message", FieldValue.of(nested(0))).build();
        assertThat(FORMATTER.format(message)).isEqualTo("{ \"singleNestedMessage\": {} }");
    }

    // ========== Oneof ==========

    @Test
    void oneof_activeMemberAtDefault_isStillWritten() {
        LOG.info(() -> "TEST: oneof_activeMemberAtDefault_isStillWritten");

        assertThat(FORMATTER.format(allTypes().set("oneof_uint32", FieldValue.of(0)).build()))
                .isEqualTo("{ \"oneofUint32\": 0 }");
        assertThat(FORMATTER.format(allTypes().set("oneof_string", FieldValue.of("")).build()))
                .isEqualTo("{ \"oneofString\": \"\" }");
        assertThat(FORMATTER.format(allTypes().set("oneof_nested_message", FieldValue.of(nested(0))).build()))
                .isEqualTo("{ \"oneofNestedMessage\": {} }");
    }

    @Test
    void oneof_onlyTheCurrentCaseIsWritten() {
        LOG.info(() -> "TEST: oneof_onlyTheCurrentCaseIsWritten");

        final var message = allTypes()
                .set("oneof_uint32", FieldValue.of(5))
                .set("oneof_string", FieldValue.of("later"))
                .build();

        assertThat(FORMATTER.format(message)).isEqualTo("{ \"oneofString\": \"later\" }");
    }

    @Test
    void oneof_unsetIsOmittedEvenWithDefaults() {
        LOG.info(() -> "TEST: oneof_unsetIsOmittedEvenWithDefaults");
        assertThat(WITH_DEFAULTS.format(DynamicMessage.empty(DEFAULTS)))
                .doesNotContain("choiceA")
                .doesNotContain("choiceB");
    }

    @Test
    void oneof_caseIsResolvedOncePerMessage() {
        LOG.info(() -> "TEST: oneof_caseIsResolvedOncePerMessage");

        final var delegate = allTypes().set("oneof_string", FieldValue.of("x")).build();
        final int[] lookups = {0};
        final Message counting = new Message() {
            @Override
            public MessageDescriptor descriptor() {
                return delegate.descriptor();
            }

            @Override
            public FieldValue get(FieldDescriptor field) {
                return delegate.get(field);
            }

            @Override
            public OneofCase oneofCase(String oneofName) {
                lookups[0]++;
                return delegate.oneofCase(oneofName);
            }
        };

        assertThat(FORMATTER.format(counting)).isEqualTo("{ \"oneofString\": \"x\" }");
        assertThat(lookups[0]).isEqualTo(1);
    }

    // ========== Enums ==========

    @Test
    void enum_isWrittenByFirstDeclaredName() {
        LOG.info(() -> "TEST: enum_isWrittenByFirstDeclaredName");
        final var message = allTypes().set("single_foreign_enum", FieldValue.enumNumber(2)).build();
        assertThat(FORMATTER.format(message)).isEqualTo("{ \"singleForeignEnum\": \"FOREIGN_BAR\" }");
    }

    @Test
    void enum_unknownSingularValue_omitsTheField() {
        LOG.info(() -> "TEST: enum_unknownSingularValue_omitsTheField");

        final var message = allTypes()
                .set("single_int32", FieldValue.of(1))
                .set("single_foreign_enum", FieldValue.enumNumber(99))
                .build();

        assertThat(FORMATTER.format(message)).isEqualTo("{ \"singleInt32\": 1 }");
        assertThat(WITH_DEFAULTS.format(message)).doesNotContain("singleForeignEnum");
    }

    @Test
    void enum_unknownRepeatedElement_isSkipped() {
        LOG.info(() -> "TEST: enum_unknownRepeatedElement_isSkipped");

        final var message = allTypes()
                .add("repeated_foreign_enum", FieldValue.enumNumber(99))
                .add("repeated_foreign_enum", FieldValue.enumNumber(1))
                .build();
        assertThat(FORMATTER.format(message)).isEqualTo("{ \"repeatedForeignEnum\": [ \"FOREIGN_FOO\" ] }");

        final var onlyUnknown = allTypes().add("repeated_foreign_enum", FieldValue.enumNumber(99)).build();
        assertThat(FORMATTER.format(onlyUnknown)).isEqualTo("{ \"repeatedForeignEnum\": [] }");
    }

    // ========== Repeated and map fields ==========

    @Test
    void repeated_keepsElementOrder() {
        LOG.info(() -> "TEST: repeated_keepsElementOrder");

        final var message = allTypes()
                .set("repeated_int32", FieldValue.list(List.of(FieldValue.of(3), FieldValue.of(0), FieldValue.of(-1))))
                .add("repeated_string", FieldValue.of("b"))
                .add("repeated_string", FieldValue.of("a"))
                .add("repeated_nested_message", FieldValue.of(nested(1)))
                .add("repeated_nested_message", FieldValue.of(nested(0)))
                .build();

        assertThat(FORMATTER.format(message)).isEqualTo("{ "
                + "\"repeatedInt32\": [ 3, 0, -1 ], "
                + "\"repeatedString\": [ \"b\", \"a\" ], "
                + "\"repeatedNestedMessage\": [ { \"bb\": 1 }, {} ] }");
    }

    @Test
    void map_keysAreRenderedByKeyKind() {
        LOG.info(() -> "TEST: map_keysAreRenderedByKeyKind");

        final var message = allTypes()
                .put("map_string_string", FieldValue.of("b"), FieldValue.of("2"))
                .put("map_string_string", FieldValue.of("a"), FieldValue.of("1"))
                .put("map_bool_string", FieldValue.of(true), FieldValue.of("yes"))
                .put("map_bool_string", FieldValue.of(false), FieldValue.of("no"))
                .put("map_uint64_nested", FieldValue.of(-1L), FieldValue.of(nested(3)))
                .build();

        assertThat(FORMATTER.format(message)).isEqualTo("{ "
                + "\"mapStringString\": { \"b\": \"2\", \"a\": \"1\" }, "
                + "\"mapBoolString\": { \"true\": \"yes\", \"false\": \"no\" }, "
                + "\"mapUint64Nested\": { \"18446744073709551615\": { \"bb\": 3 } } }");
    }

    @Test
    void map_unknownEnumValues_areSkippedAndDefaultsKept() {
        LOG.info(() -> "TEST: map_unknownEnumValues_areSkippedAndDefaultsKept");

        final var message = allTypes()
                .put("map_int32_enum", FieldValue.of(-1), FieldValue.enumNumber(1))
                .put("map_int32_enum", FieldValue.of(5), FieldValue.enumNumber(99))
                .put("map_int32_enum", FieldValue.of(7), FieldValue.enumNumber(0))
                .build();

        assertThat(FORMATTER.format(message)).isEqualTo(
                "{ \"mapInt32Enum\": { \"-1\": \"FOREIGN_FOO\", \"7\": \"FOREIGN_UNSPECIFIED\" } }");
    }

    @Test
    void map_stringKeysAreEscaped() {
        LOG.info(() -> "TEST: map_stringKeysAreEscaped");
        final var message = allTypes().put("map_string_string", FieldValue.of("a\"b"), FieldValue.of("c")).build();
        assertThat(FORMATTER.format(message)).isEqualTo("{ \"mapStringString\": { \"a\\\"b\": \"c\" } }");
    }

    // ========== Errors and contracts ==========

    @Test
    void nullMessage_isRejected() {
        LOG.info(() -> "TEST: nullMessage_isRejected");
        assertThatThrownBy(() -> FORMATTER.format(null)).isInstanceOf(NullPointerException.class);
    }

    @Test
    void valueShapeMismatch_isInvalidSchemaState() {
        LOG.info(() -> "TEST: valueShapeMismatch_isInvalidSchemaState");

        final Message broken = new Message() {
            @Override
            public MessageDescriptor descriptor() {
                return TestSchemas.NESTED;
            }

            @Override
            public FieldValue get(FieldDescriptor field) {
                return FieldValue.of("not a number");
            }

            @Override
            public OneofCase oneofCase(String oneofName) {
                return OneofCase.NONE;
            }
        };

        assertThatThrownBy(() -> FORMATTER.format(broken))
                .isInstanceOf(JsonFormatException.class)
                .hasMessageContaining("invalid schema state")
                .satisfies(e -> assertThat(((JsonFormatException) e).error())
                        .isEqualTo(JsonFormatException.Error.INVALID_SCHEMA_STATE));
    }

    @Test
    void loneSurrogateInString_abortsTheWholeCall() {
        LOG.info(() -> "TEST: loneSurrogateInString_abortsTheWholeCall");
        final var message = allTypes().set("single_string", FieldValue.of("ok\ud800")).build();
        assertThatThrownBy(() -> FORMATTER.format(message))
                .isInstanceOf(JsonFormatException.class)
                .extracting(e -> ((JsonFormatException) e).error())
                .isEqualTo(JsonFormatException.Error.MALFORMED_TEXT);
    }

    @Test
    void formatter_isSafeToShareAcrossThreads() {
        LOG.info(() -> "TEST: formatter_isSafeToShareAcrossThreads");

        final var message = allTypes()
                .set("single_string", FieldValue.of("shared"))
                .put("map_string_string", FieldValue.of("k"), FieldValue.of("v"))
                .build();
        final var expected = FORMATTER.format(message);

        final var results = IntStream.range(0, 64).parallel()
                .mapToObj(i -> FORMATTER.format(message))
                .toList();

        assertThat(results).containsOnly(expected);
    }

    // ========== Settings ==========

    @Test
    void settings_fromSystemProperties() {
        LOG.info(() -> "TEST: settings_fromSystemProperties");

        final var property = JsonFormatter.Settings.FORMAT_DEFAULT_VALUES_PROPERTY;
        final var previous = System.getProperty(property);
        try {
            System.clearProperty(property);
            assertThat(JsonFormatter.Settings.fromSystemProperties()).isEqualTo(JsonFormatter.Settings.DEFAULT);

            System.setProperty(property, "true");
            assertThat(JsonFormatter.Settings.fromSystemProperties().formatDefaultValues()).isTrue();
        } finally {
            if (previous == null) {
                System.clearProperty(property);
            } else {
                System.setProperty(property, previous);
            }
        }
    }

    @Test
    void settings_withFormatDefaultValues() {
        LOG.info(() -> "TEST: settings_withFormatDefaultValues");
        final var settings = JsonFormatter.Settings.DEFAULT.withFormatDefaultValues(true);
        assertThat(settings.formatDefaultValues()).isTrue();
        assertThat(JsonFormatter.Settings.DEFAULT.formatDefaultValues()).isFalse();
        assertThat(new JsonFormatter(settings).settings()).isEqualTo(settings);
    }
}
