package io.storyloom.core.ai;

/// Terminal result of one streaming call, merged from the completion path and the
/// error side channel.
public sealed interface AiOutcome {

    /// Text accumulated before the call ended.
    String text();

    /// The stream completed and no error was reported.
    record Success(String text) implements AiOutcome {}

    /// The provider reported an error, or the stream closed without completing.
    record Failure(String reason, String text) implements AiOutcome {}

    /// The run was cancelled or timed out while the call was in flight.
    record Cancelled(String text) implements AiOutcome {}
}
