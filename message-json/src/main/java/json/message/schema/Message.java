package json.message.schema;

/// Reflective read access to a message instance.
///
/// Implementations must be effectively immutable: the formatter reads a
/// message from any thread without coordination.
public interface Message {

    /// {@return the descriptor of this message's type}
    MessageDescriptor descriptor();

    /// Returns the current value of a declared field. Unset fields report
    /// [FieldDescriptor#defaultValue()].
    ///
    /// @param field a field of [#descriptor()]
    /// @return the field's value, never `null`
    FieldValue get(FieldDescriptor field);

    /// Resolves which member of the named oneof is set.
    ///
    /// @param oneofName a oneof declared by [#descriptor()]
    /// @return the current case, never `null`
    OneofCase oneofCase(String oneofName);
}
