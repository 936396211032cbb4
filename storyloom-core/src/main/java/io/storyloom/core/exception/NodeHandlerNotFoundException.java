package io.storyloom.core.exception;

import java.io.Serial;

public class NodeHandlerNotFoundException extends Exception {
    @Serial private static final long serialVersionUID = -2301457718843021654L;

    public NodeHandlerNotFoundException(String message) {
        super(message);
    }
}
