package io.storyloom.core.condition;

import java.util.Arrays;
import java.util.Optional;

public enum LengthOperator {
    GREATER(">") {
        @Override
        public boolean test(int length, int value) {
            return length > value;
        }
    },
    LESS("<") {
        @Override
        public boolean test(int length, int value) {
            return length < value;
        }
    },
    EQUAL("=") {
        @Override
        public boolean test(int length, int value) {
            return length == value;
        }
    },
    GREATER_OR_EQUAL(">=") {
        @Override
        public boolean test(int length, int value) {
            return length >= value;
        }
    },
    LESS_OR_EQUAL("<=") {
        @Override
        public boolean test(int length, int value) {
            return length <= value;
        }
    };

    private final String symbol;

    LengthOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public abstract boolean test(int length, int value);

    public static Optional<LengthOperator> fromSymbol(String symbol) {
        return Arrays.stream(values()).filter(o -> o.symbol.equals(symbol)).findFirst();
    }
}
