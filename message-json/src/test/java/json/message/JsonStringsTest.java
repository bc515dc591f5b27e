package json.message;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.*;

class JsonStringsTest extends MessageJsonLoggingConfig {

    private static final Logger LOG = Logger.getLogger(JsonStringsTest.class.getName());

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static String chars(int... codeUnits) {
        final var builder = new StringBuilder();
        for (final int c : codeUnits) {
            builder.append((char) c);
        }
        return builder.toString();
    }

    @Test
    void plainTextPassesThrough() {
        LOG.info(() -> "TEST: plainTextPassesThrough");
        assertThat(JsonStrings.escape("Hello, world! 123 ~`@#$%^&*()'")).isEqualTo("Hello, world! 123 ~`@#$%^&*()'");
        assertThat(JsonStrings.escape("")).isEmpty();
    }

    @Test
    void quoteAddsDelimiters() {
        LOG.info(() -> "TEST: quoteAddsDelimiters");
        assertThat(JsonStrings.quote("a")).isEqualTo("\"a\"");
        assertThat(JsonStrings.quote("")).isEqualTo("\"\"");
    }

    @Test
    void quoteAndBackslashAreEscaped() {
        LOG.info(() -> "TEST: quoteAndBackslashAreEscaped");
        assertThat(JsonStrings.escape("\"")).isEqualTo("\\\"");
        assertThat(JsonStrings.escape("\\")).isEqualTo("\\\\");
        assertThat(JsonStrings.escape("/")).isEqualTo("/");
    }

    @Test
    void shortEscapesForCommonControls() {
        LOG.info(() -> "TEST: shortEscapesForCommonControls");
        assertThat(JsonStrings.escape("\b\t\n\f\r")).isEqualTo("\\b\\t\\n\\f\\r");
    }

    @Test
    void otherControlsUseLowercaseHexEscapes() {
        LOG.info(() -> "TEST: otherControlsUseLowercaseHexEscapes");
        assertThat(JsonStrings.escape(chars(0x00))).isEqualTo("\\u0000");
        assertThat(JsonStrings.escape(chars(0x0b))).isEqualTo("\\u000b");
        assertThat(JsonStrings.escape(chars(0x1f))).isEqualTo("\\u001f");
        assertThat(JsonStrings.escape(chars(0x7f))).isEqualTo("\\u007f");
        assertThat(JsonStrings.escape(chars(0x85))).isEqualTo("\\u0085");
        assertThat(JsonStrings.escape(chars(0x9f))).isEqualTo("\\u009f");
    }

    @Test
    void angleBracketsAreEscapedForHtml() {
        LOG.info(() -> "TEST: angleBracketsAreEscapedForHtml");
        assertThat(JsonStrings.escape("<script>")).isEqualTo("\\u003cscript\\u003e");
    }

    @Test
    void nonBreakingSpaceAndLatinPassThrough() {
        LOG.info(() -> "TEST: nonBreakingSpaceAndLatinPassThrough");
        final var text = chars(0xa0, 0xe9, 0x4e2d);
        assertThat(JsonStrings.escape(text)).isEqualTo(text);
    }

    @Test
    void invisibleAndDirectionCharactersAreEscaped() {
        LOG.info(() -> "TEST: invisibleAndDirectionCharactersAreEscaped");
        assertThat(JsonStrings.escape(chars(0xad))).isEqualTo("\\u00ad");
        assertThat(JsonStrings.escape(chars(0x0600))).isEqualTo("\\u0600");
        assertThat(JsonStrings.escape(chars(0x0603))).isEqualTo("\\u0603");
        assertThat(JsonStrings.escape(chars(0x0604))).isEqualTo(chars(0x0604));
        assertThat(JsonStrings.escape(chars(0x06dd))).isEqualTo("\\u06dd");
        assertThat(JsonStrings.escape(chars(0x070f))).isEqualTo("\\u070f");
        assertThat(JsonStrings.escape(chars(0x17b4, 0x17b5))).isEqualTo("\\u17b4\\u17b5");
        assertThat(JsonStrings.escape(chars(0x200b))).isEqualTo("\\u200b");
        assertThat(JsonStrings.escape(chars(0x200f))).isEqualTo("\\u200f");
        assertThat(JsonStrings.escape(chars(0x2010))).isEqualTo(chars(0x2010));
        assertThat(JsonStrings.escape(chars(0x2028, 0x2029))).isEqualTo("\\u2028\\u2029");
        assertThat(JsonStrings.escape(chars(0x202e))).isEqualTo("\\u202e");
        assertThat(JsonStrings.escape(chars(0x2060))).isEqualTo("\\u2060");
        assertThat(JsonStrings.escape(chars(0x2065))).isEqualTo(chars(0x2065));
        assertThat(JsonStrings.escape(chars(0x206a))).isEqualTo("\\u206a");
        assertThat(JsonStrings.escape(chars(0x206f))).isEqualTo("\\u206f");
        assertThat(JsonStrings.escape(chars(0xfeff))).isEqualTo("\\ufeff");
        assertThat(JsonStrings.escape(chars(0xfff9, 0xfffb))).isEqualTo("\\ufff9\\ufffb");
        assertThat(JsonStrings.escape(chars(0xfffc))).isEqualTo(chars(0xfffc));
    }

    @Test
    void surrogatePairIsWrittenAsTwoEscapes() {
        LOG.info(() -> "TEST: surrogatePairIsWrittenAsTwoEscapes");
        final var grinning = new String(Character.toChars(0x1f600));
        assertThat(JsonStrings.escape(grinning)).isEqualTo("\\ud83d\\ude00");
        assertThat(JsonStrings.escape("a" + grinning + "b")).isEqualTo("a\\ud83d\\ude00b");
    }

    @Test
    void loneHighSurrogateIsRejected() {
        LOG.info(() -> "TEST: loneHighSurrogateIsRejected");
        assertThatThrownBy(() -> JsonStrings.escape(chars('a', 0xd800)))
                .isInstanceOf(JsonFormatException.class)
                .hasMessageContaining("index 1")
                .extracting(e -> ((JsonFormatException) e).error())
                .isEqualTo(JsonFormatException.Error.MALFORMED_TEXT);
        assertThatThrownBy(() -> JsonStrings.escape(chars(0xd800, 'a')))
                .isInstanceOf(JsonFormatException.class);
        assertThatThrownBy(() -> JsonStrings.escape(chars(0xd800, 0xd800)))
                .isInstanceOf(JsonFormatException.class);
    }

    @Test
    void loneLowSurrogateIsRejected() {
        LOG.info(() -> "TEST: loneLowSurrogateIsRejected");
        assertThatThrownBy(() -> JsonStrings.escape(chars(0xdc00)))
                .isInstanceOf(JsonFormatException.class)
                .hasMessageContaining("low surrogate")
                .extracting(e -> ((JsonFormatException) e).error())
                .isEqualTo(JsonFormatException.Error.MALFORMED_TEXT);
    }

    @Test
    void quotedOutputParsesBackToTheInput() throws Exception {
        LOG.info(() -> "TEST: quotedOutputParsesBackToTheInput");
        final var text = "tab\there " + chars(0x00, 0x1f, 0x7f, 0x2028, 0xfeff) + " <b>\"q\"</b> \\ "
                + new String(Character.toChars(0x1f600));
        final var quoted = JsonStrings.quote(text);
        LOG.fine(() -> "Quoted: " + quoted);
        assertThat(MAPPER.readValue(quoted, String.class)).isEqualTo(text);
    }
}
