package io.storyloom.core.ai;

/// Control handle for one in-flight streaming call.
public interface AiStreamHandle {

    /// Requests the provider call to stop. Idempotent.
    void cancel();

    /// Returns false once the underlying stream has ended for any reason.
    boolean isOpen();
}
