package json.message.schema;

import java.util.Objects;

/// Which member of a oneof is currently set: either none, or exactly one field
/// together with its value.
public sealed interface OneofCase permits OneofCase.None, OneofCase.Set {

    /// No member of the oneof is set.
    record None() implements OneofCase {}

    /// The given member is set to the given value.
    record Set(FieldDescriptor field, FieldValue value) implements OneofCase {
        public Set {
            Objects.requireNonNull(field, "field must not be null");
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    OneofCase NONE = new None();

    /// {@return `true` if `field` is the member currently set}
    default boolean isCase(FieldDescriptor field) {
        return this instanceof Set set && set.field().number() == field.number();
    }
}
