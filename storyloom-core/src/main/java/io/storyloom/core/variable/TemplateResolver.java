package io.storyloom.core.variable;

/// Resolves `{{...}}` references in a template against a variable store.
///
/// Implementations must never throw for missing references; unknown names resolve
/// to the empty string.
public interface TemplateResolver {

    /// Resolves all references in one non-recursive pass.
    ///
    /// @param template text containing references, may be null
    /// @param store values to substitute, not null
    /// @return resolved text, empty for a null template, never null
    String resolve(String template, VariableStore store);
}
