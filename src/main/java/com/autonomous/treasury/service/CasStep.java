package com.autonomous.treasury.service;

/**
 * What one pass of an optimistic update decided: write a new value, or leave the key alone.
 * Either way {@code result} is handed back to the caller once the step sticks.
 */
public final class CasStep<T> {

    private final String newValue;
    private final T result;

    private CasStep(String newValue, T result) {
        this.newValue = newValue;
        this.result = result;
    }

    public static <T> CasStep<T> write(String newValue, T result) {
        return new CasStep<>(newValue, result);
    }

    public static <T> CasStep<T> skip(T result) {
        return new CasStep<>(null, result);
    }

    public boolean isWrite() {
        return newValue != null;
    }

    public String getNewValue() {
        return newValue;
    }

    public T getResult() {
        return result;
    }
}
