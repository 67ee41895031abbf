package com.obelisk.tool.calculator;

import java.util.Locale;

/** Calculator operations; {@code b} is ignored by {@link #SQRT}. */
enum Operation {

    ADD("+") {
        @Override
        double apply(double a, Double b) {
            return a + b;
        }
    },
    SUBTRACT("-") {
        @Override
        double apply(double a, Double b) {
            return a - b;
        }
    },
    MULTIPLY("*") {
        @Override
        double apply(double a, Double b) {
            return a * b;
        }
    },
    DIVIDE("/") {
        @Override
        double apply(double a, Double b) {
            return a / b;
        }
    },
    POWER("**") {
        @Override
        double apply(double a, Double b) {
            return Math.pow(a, b);
        }
    },
    SQRT("√") {
        @Override
        double apply(double a, Double b) {
            return Math.sqrt(a);
        }

        @Override
        boolean isBinary() {
            return false;
        }
    };

    private final String symbol;

    Operation(String symbol) {
        this.symbol = symbol;
    }

    abstract double apply(double a, Double b);

    boolean isBinary() {
        return true;
    }

    String symbol() {
        return symbol;
    }

    String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    static Operation fromWire(String value) {
        return Operation.valueOf(value.toUpperCase(Locale.ROOT));
    }

    static String[] wireNames() {
        Operation[] values = values();
        String[] names = new String[values.length];
        for (int i = 0; i < values.length; i++) {
            names[i] = values[i].wireName();
        }
        return names;
    }
}
