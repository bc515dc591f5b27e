package json.message.schema;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// Describes an enum type: its full name and its declared members.
///
/// Lookup by number returns the first member declared with that number, so
/// aliases never change the JSON name of a value.
///
/// @param fullName the fully qualified type name
/// @param values the members in declaration order
public record EnumDescriptor(String fullName, List<Value> values) {

    /// A single enum member.
    ///
    /// @param name the declared member name
    /// @param number the member's numeric value
    public record Value(String name, int number) {
        public Value {
            Objects.requireNonNull(name, "name must not be null");
        }
    }

    public EnumDescriptor {
        Objects.requireNonNull(fullName, "fullName must not be null");
        Objects.requireNonNull(values, "values must not be null");
        values = List.copyOf(values);
    }

    /// Creates a descriptor from alternating name and number pairs.
    ///
    /// ```java
    /// EnumDescriptor color = EnumDescriptor.of("demo.Color", "RED", 0, "GREEN", 1);
    /// ```
    ///
    /// @param fullName the fully qualified type name
    /// @param namesAndNumbers `String` names each followed by an `Integer` number
    /// @return the descriptor
    /// @throws IllegalArgumentException if the pairs are malformed
    public static EnumDescriptor of(String fullName, Object... namesAndNumbers) {
        if (namesAndNumbers.length % 2 != 0) {
            throw new IllegalArgumentException("Expected name/number pairs for enum " + fullName);
        }
        final var members = new ArrayList<Value>(namesAndNumbers.length / 2);
        for (int i = 0; i < namesAndNumbers.length; i += 2) {
            if (!(namesAndNumbers[i] instanceof String name) || !(namesAndNumbers[i + 1] instanceof Integer number)) {
                throw new IllegalArgumentException("Expected name/number pair at index " + i + " for enum " + fullName);
            }
            members.add(new Value(name, number));
        }
        return new EnumDescriptor(fullName, members);
    }

    /// {@return the name of the first member with the given number, if any}
    public Optional<String> findNameByNumber(int number) {
        for (final var value : values) {
            if (value.number() == number) {
                return Optional.of(value.name());
            }
        }
        return Optional.empty();
    }
}
