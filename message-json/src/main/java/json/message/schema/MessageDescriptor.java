package json.message.schema;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/// Describes a message type: its full name and its declared fields.
///
/// Fields are held in ascending field-number order regardless of the order
/// they were supplied in.
///
/// @param fullName the fully qualified type name
/// @param fields the declared fields
public record MessageDescriptor(String fullName, List<FieldDescriptor> fields) {

    public MessageDescriptor {
        Objects.requireNonNull(fullName, "fullName must not be null");
        Objects.requireNonNull(fields, "fields must not be null");
        final var sorted = new ArrayList<>(fields);
        sorted.sort(Comparator.comparingInt(FieldDescriptor::number));
        final Set<Integer> numbers = new HashSet<>();
        final Set<String> names = new HashSet<>();
        for (final var field : sorted) {
            if (!numbers.add(field.number())) {
                throw new IllegalArgumentException("Duplicate field number " + field.number() + " in " + fullName);
            }
            if (!names.add(field.name())) {
                throw new IllegalArgumentException("Duplicate field name " + field.name() + " in " + fullName);
            }
        }
        fields = List.copyOf(sorted);
    }

    /// Creates a descriptor from the given fields.
    public static MessageDescriptor of(String fullName, FieldDescriptor... fields) {
        return new MessageDescriptor(fullName, List.of(fields));
    }

    /// {@return the field with the given number, if declared}
    public Optional<FieldDescriptor> findFieldByNumber(int number) {
        return fields.stream().filter(f -> f.number() == number).findFirst();
    }

    /// {@return the field with the given declared name, if declared}
    public Optional<FieldDescriptor> findFieldByName(String name) {
        return fields.stream().filter(f -> f.name().equals(name)).findFirst();
    }

    /// {@return the field with the given number}
    /// @throws IllegalArgumentException if no such field is declared
    public FieldDescriptor requireField(int number) {
        return findFieldByNumber(number).orElseThrow(() ->
                new IllegalArgumentException("No field number " + number + " in " + fullName));
    }

    /// {@return the names of the oneofs declared by this message, in field order}
    public Set<String> oneofs() {
        final var oneofs = new LinkedHashSet<String>();
        for (final var field : fields) {
            if (field.oneof() != null) {
                oneofs.add(field.oneof());
            }
        }
        return oneofs;
    }

    /// {@return the well-known type this descriptor names, if any}
    public Optional<WellKnownType> wellKnownType() {
        return WellKnownType.forFullName(fullName);
    }
}
