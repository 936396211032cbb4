package io.storyloom.core.execution.parallel;

/// Outcome of one item-run of a parallel block or batch.
///
/// @param index 0-based position of the item in the split input
/// @param output final output of the item-run, null when failed
/// @param error failure reason, null when succeeded
/// @param attempts number of attempts made, at least 1 unless the item never started
public record ItemResult(int index, String output, String error, int attempts) {

    public static ItemResult success(int index, String output, int attempts) {
        return new ItemResult(index, output != null ? output : "", null, attempts);
    }

    public static ItemResult failure(int index, String error, int attempts) {
        return new ItemResult(index, null, error != null ? error : "item failed", attempts);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
