package json.message;

/// Converts declared field names to their JSON names.
public final class FieldNames {

    private FieldNames() {}

    /// Converts a declared field name to its JSON name.
    ///
    /// Underscores are dropped and the letter after each one is upper-cased.
    /// Until the first word ends the name is lower-cased, where the first word
    /// ends at an underscore, at a capital that follows a lower-case letter
    /// (`"aB"`), or at a capital followed by a lower-case letter (`"ABc"`).
    ///
    /// | Declared | JSON |
    /// |----------|------|
    /// | `foo_bar` | `fooBar` |
    /// | `FooBar` | `fooBar` |
    /// | `HTTPServer` | `httpServer` |
    /// | `foo_bar_baz_` | `fooBarBaz` |
    ///
    /// @param name the declared name
    /// @return the JSON name
    public static String toJsonName(String name) {
        boolean capitalizeNext = false;
        boolean wasCap = true;
        boolean isCap = false;
        boolean firstWord = true;
        final var result = new StringBuilder(name.length());

        for (int i = 0; i < name.length(); i++, wasCap = isCap) {
            final char c = name.charAt(i);
            isCap = Character.isUpperCase(c);
            if (c == '_') {
                capitalizeNext = true;
                if (result.length() != 0) {
                    firstWord = false;
                }
                continue;
            } else if (firstWord) {
                if (result.length() != 0 && isCap
                        && (!wasCap || (i + 1 < name.length() && Character.isLowerCase(name.charAt(i + 1))))) {
                    firstWord = false;
                } else {
                    result.append(Character.toLowerCase(c));
                    continue;
                }
            } else if (capitalizeNext) {
                capitalizeNext = false;
                if (Character.isLowerCase(c)) {
                    result.append(Character.toUpperCase(c));
                    continue;
                }
            }
            result.append(c);
        }
        return result.toString();
    }
}
