package json.message.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// An immutable [Message] whose fields are held in a map keyed by field
/// number.
///
/// ```java
/// MessageDescriptor person = MessageDescriptor.of("demo.Person",
///     FieldDescriptor.of("display_name", 1, FieldKind.STRING),
///     FieldDescriptor.repeated("lucky_numbers", 2, FieldKind.INT32));
/// Message alice = DynamicMessage.newBuilder(person)
///     .set("display_name", FieldValue.of("Alice"))
///     .add("lucky_numbers", FieldValue.of(7))
///     .build();
/// ```
public final class DynamicMessage implements Message {

    private final MessageDescriptor descriptor;
    private final Map<Integer, FieldValue> values;

    private DynamicMessage(MessageDescriptor descriptor, Map<Integer, FieldValue> values) {
        this.descriptor = descriptor;
        this.values = values;
    }

    /// {@return a new builder for messages of the given type}
    public static Builder newBuilder(MessageDescriptor descriptor) {
        return new Builder(descriptor);
    }

    /// {@return a message of the given type with every field unset}
    public static DynamicMessage empty(MessageDescriptor descriptor) {
        return newBuilder(descriptor).build();
    }

    @Override
    public MessageDescriptor descriptor() {
        return descriptor;
    }

    @Override
    public FieldValue get(FieldDescriptor field) {
        Objects.requireNonNull(field, "field must not be null");
        final var value = values.get(field.number());
        return value != null ? value : field.defaultValue();
    }

    /// {@return `true` if the field was explicitly set on the builder}
    public boolean has(FieldDescriptor field) {
        return values.containsKey(field.number());
    }

    @Override
    public OneofCase oneofCase(String oneofName) {
        for (final var field : descriptor.fields()) {
            if (oneofName.equals(field.oneof()) && values.containsKey(field.number())) {
                return new OneofCase.Set(field, values.get(field.number()));
            }
        }
        return OneofCase.NONE;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof DynamicMessage other
                && descriptor.equals(other.descriptor)
                && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(descriptor.fullName(), values);
    }

    @Override
    public String toString() {
        return "DynamicMessage[" + descriptor.fullName() + " " + values + "]";
    }

    /// Mutable builder for [DynamicMessage].
    ///
    /// Setting a member of a oneof clears the other members of that oneof.
    /// Values whose shape does not match the field kind are rejected.
    public static final class Builder {

        private final MessageDescriptor descriptor;
        private final Map<Integer, FieldValue> values = new LinkedHashMap<>();
        private final Map<Integer, List<FieldValue>> lists = new LinkedHashMap<>();
        private final Map<Integer, Map<FieldValue, FieldValue>> maps = new LinkedHashMap<>();

        private Builder(MessageDescriptor descriptor) {
            this.descriptor = Objects.requireNonNull(descriptor, "descriptor must not be null");
        }

        /// Sets a field to a complete value, replacing any previous value.
        ///
        /// @param name the declared field name
        /// @param value a value whose shape matches the field
        /// @return this builder
        /// @throws IllegalArgumentException if the field is unknown or the shape does not match
        public Builder set(String name, FieldValue value) {
            return set(field(name), value);
        }

        /// Sets a field to a complete value, replacing any previous value.
        public Builder set(FieldDescriptor field, FieldValue value) {
            Objects.requireNonNull(value, "value must not be null");
            requireOwnField(field);
            if (!field.accepts(value)) {
                throw new IllegalArgumentException("Field " + descriptor.fullName() + "." + field.name()
                        + " of kind " + field.kind() + " cannot hold " + value.shape());
            }
            clear(field);
            if (field.oneof() != null) {
                for (final var sibling : descriptor.fields()) {
                    if (field.oneof().equals(sibling.oneof())) {
                        clear(sibling);
                    }
                }
            }
            if (field.isMap()) {
                maps.put(field.number(), new LinkedHashMap<>(((FieldValue.Mapped) value).entries()));
            } else if (field.repeated()) {
                lists.put(field.number(), new ArrayList<>(((FieldValue.Repeated) value).elements()));
            } else {
                values.put(field.number(), value);
            }
            return this;
        }

        /// Appends an element to a repeated field.
        public Builder add(String name, FieldValue element) {
            final var field = field(name);
            if (!field.repeated() || field.isMap()) {
                throw new IllegalArgumentException("Field " + name + " is not a repeated field");
            }
            Objects.requireNonNull(element, "element must not be null");
            if (!FieldDescriptor.acceptsSingle(field.kind(), element)) {
                throw new IllegalArgumentException("Field " + name + " of kind " + field.kind()
                        + " cannot hold " + element.shape());
            }
            lists.computeIfAbsent(field.number(), n -> new ArrayList<>()).add(element);
            return this;
        }

        /// Puts an entry into a map field; re-putting a key keeps its original position.
        public Builder put(String name, FieldValue key, FieldValue value) {
            final var field = field(name);
            if (!field.isMap()) {
                throw new IllegalArgumentException("Field " + name + " is not a map field");
            }
            Objects.requireNonNull(key, "key must not be null");
            Objects.requireNonNull(value, "value must not be null");
            if (!FieldDescriptor.acceptsSingle(field.mapKey().kind(), key)
                    || !FieldDescriptor.acceptsSingle(field.mapValue().kind(), value)) {
                throw new IllegalArgumentException("Map field " + name + " cannot hold "
                        + key.shape() + " -> " + value.shape());
            }
            maps.computeIfAbsent(field.number(), n -> new LinkedHashMap<>()).put(key, value);
            return this;
        }

        /// Resets a field to unset.
        public Builder clear(String name) {
            clear(field(name));
            return this;
        }

        private void clear(FieldDescriptor field) {
            values.remove(field.number());
            lists.remove(field.number());
            maps.remove(field.number());
        }

        /// {@return the immutable message}
        public DynamicMessage build() {
            final var snapshot = new LinkedHashMap<Integer, FieldValue>(values);
            lists.forEach((number, elements) -> snapshot.put(number, FieldValue.list(elements)));
            maps.forEach((number, entries) -> snapshot.put(number, new FieldValue.Mapped(entries)));
            return new DynamicMessage(descriptor, Collections.unmodifiableMap(snapshot));
        }

        private FieldDescriptor field(String name) {
            return descriptor.findFieldByName(name).orElseThrow(() ->
                    new IllegalArgumentException("No field named " + name + " in " + descriptor.fullName()));
        }

        private void requireOwnField(FieldDescriptor field) {
            Objects.requireNonNull(field, "field must not be null");
            if (!descriptor.findFieldByNumber(field.number()).map(field::equals).orElse(false)) {
                throw new IllegalArgumentException("Field " + field.name() + " is not declared by " + descriptor.fullName());
            }
        }
    }
}
