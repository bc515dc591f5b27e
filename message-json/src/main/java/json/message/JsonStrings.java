package json.message;

/// Escaping of text into JSON string literals.
///
/// Beyond what RFC 8259 requires, `<`, `>` and a set of invisible or
/// direction-changing characters are written as six-character hex escapes so the output can be
/// embedded in HTML and script without being reinterpreted. Surrogate pairs
/// are written as two escapes.
public final class JsonStrings {

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    /// JSON form of each code unit below 0xA0.
    private static final String[] COMMON_REPRESENTATIONS = {
        // C0 (ASCII and derivatives) control characters
        "\\u0000", "\\u0001", "\\u0002", "\\u0003",  // 0x00
        "\\u0004", "\\u0005", "\\u0006", "\\u0007",
        "\\b",     "\\t",     "\\n",     "\\u000b",
        "\\f",     "\\r",     "\\u000e", "\\u000f",
        "\\u0010", "\\u0011", "\\u0012", "\\u0013",  // 0x10
        "\\u0014", "\\u0015", "\\u0016", "\\u0017",
        "\\u0018", "\\u0019", "\\u001a", "\\u001b",
        "\\u001c", "\\u001d", "\\u001e", "\\u001f",
        // " and \ by RFC 8259; < and > for HTML
        " ",  "!",  "\\\"", "#",  "$",       "%",  "&",       "'",   // 0x20
        "(",  ")",  "*",    "+",  ",",       "-",  ".",       "/",
        "0",  "1",  "2",    "3",  "4",       "5",  "6",       "7",   // 0x30
        "8",  "9",  ":",    ";",  "\\u003c", "=",  "\\u003e", "?",
        "@",  "A",  "B",    "C",  "D",       "E",  "F",       "G",   // 0x40
        "H",  "I",  "J",    "K",  "L",       "M",  "N",       "O",
        "P",  "Q",  "R",    "S",  "T",       "U",  "V",       "W",   // 0x50
        "X",  "Y",  "Z",    "[",  "\\\\",    "]",  "^",       "_",
        "`",  "a",  "b",    "c",  "d",       "e",  "f",       "g",   // 0x60
        "h",  "i",  "j",    "k",  "l",       "m",  "n",       "o",
        "p",  "q",  "r",    "s",  "t",       "u",  "v",       "w",   // 0x70
        "x",  "y",  "z",    "{",  "|",       "}",  "~",       "\\u007f",
        // C1 (ISO 8859 and Unicode) extended control characters
        "\\u0080", "\\u0081", "\\u0082", "\\u0083",  // 0x80
        "\\u0084", "\\u0085", "\\u0086", "\\u0087",
        "\\u0088", "\\u0089", "\\u008a", "\\u008b",
        "\\u008c", "\\u008d", "\\u008e", "\\u008f",
        "\\u0090", "\\u0091", "\\u0092", "\\u0093",  // 0x90
        "\\u0094", "\\u0095", "\\u0096", "\\u0097",
        "\\u0098", "\\u0099", "\\u009a", "\\u009b",
        "\\u009c", "\\u009d", "\\u009e", "\\u009f"
    };

    private JsonStrings() {}

    /// {@return `text` escaped as the body of a JSON string, without quotes}
    /// @throws JsonFormatException if `text` holds an unpaired surrogate
    public static String escape(String text) {
        final var builder = new StringBuilder(text.length() + 8);
        appendEscaped(builder, text);
        return builder.toString();
    }

    /// {@return `text` as a complete JSON string literal, quotes included}
    /// @throws JsonFormatException if `text` holds an unpaired surrogate
    public static String quote(String text) {
        final var builder = new StringBuilder(text.length() + 10);
        appendQuoted(builder, text);
        return builder.toString();
    }

    static void appendQuoted(StringBuilder builder, String text) {
        builder.append('"');
        appendEscaped(builder, text);
        builder.append('"');
    }

    static void appendEscaped(StringBuilder builder, String text) {
        for (int i = 0; i < text.length(); i++) {
            final char c = text.charAt(i);
            if (c < 0xa0) {
                builder.append(COMMON_REPRESENTATIONS[c]);
                continue;
            }
            if (Character.isHighSurrogate(c)) {
                i++;
                if (i == text.length() || !Character.isLowSurrogate(text.charAt(i))) {
                    throw new JsonFormatException(JsonFormatException.Error.MALFORMED_TEXT,
                            "high surrogate not followed by low surrogate at index " + (i - 1));
                }
                appendHex(builder, c);
                appendHex(builder, text.charAt(i));
                continue;
            }
            if (Character.isLowSurrogate(c)) {
                throw new JsonFormatException(JsonFormatException.Error.MALFORMED_TEXT,
                        "low surrogate not preceded by high surrogate at index " + i);
            }
            if (isUnsafe(c)) {
                appendHex(builder, c);
            } else {
                builder.append(c);
            }
        }
    }

    /// Characters JSON allows raw but that script engines and browsers may treat specially.
    static boolean isUnsafe(char c) {
        return switch (c) {
            case 0x00ad,  // soft hyphen
                 0x06dd,  // Arabic end of ayah
                 0x070f,  // Syriac abbreviation mark
                 0x17b4,  // Khmer vowel inherent Aq
                 0x17b5,  // Khmer vowel inherent Aa
                 0xfeff,  // zero width no-break space
                 0xfff9,  // interlinear annotation anchor
                 0xfffa,  // interlinear annotation separator
                 0xfffb   // interlinear annotation terminator
                    -> true;
            default -> (c >= 0x0600 && c <= 0x0603)     // Arabic signs
                    || (c >= 0x200b && c <= 0x200f)     // zero width, direction marks
                    || (c >= 0x2028 && c <= 0x202e)     // separators, embeddings
                    || (c >= 0x2060 && c <= 0x2064)     // invisible operators
                    || (c >= 0x206a && c <= 0x206f);    // deprecated format controls
        };
    }

    static void appendHex(StringBuilder builder, char c) {
        builder.append("\\u")
                .append(HEX[(c >> 12) & 0xf])
                .append(HEX[(c >> 8) & 0xf])
                .append(HEX[(c >> 4) & 0xf])
                .append(HEX[c & 0xf]);
    }
}
