package com.prediction.market.amm.result;

/**
 * Outcome of an engine operation: either a value or an {@link EngineError}.
 *
 * Expected failures (bad input, wrong market status, lock timeout, tied vote)
 * travel as values so callers have to look at them. Only invariant
 * violations are thrown, see {@link InvariantViolationException}.
 */
public final class EngineResult<T> {

    private final T value;
    private final EngineError error;

    private EngineResult(T value, EngineError error) {
        this.value = value;
        this.error = error;
    }

    public static <T> EngineResult<T> success(T value) {
        return new EngineResult<>(value, null);
    }

    public static <T> EngineResult<T> failure(EngineError error) {
        if (error == null) {
            throw new IllegalArgumentException("Error cannot be null");
        }
        return new EngineResult<>(null, error);
    }

    public static <T> EngineResult<T> failure(ErrorCode code, String message) {
        return failure(EngineError.of(code, message));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isFailure() {
        return error != null;
    }

    /**
     * @throws IllegalStateException when called on a failure
     */
    public T getValue() {
        if (error != null) {
            throw new IllegalStateException("No value on failed result: " + error.getCode() + " " + error.getMessage());
        }
        return value;
    }

    public EngineError getError() {
        return error;
    }

    /**
     * Re-type a failure; callers use this to forward an error from a nested step.
     */
    @SuppressWarnings("unchecked")
    public <U> EngineResult<U> propagate() {
        if (error == null) {
            throw new IllegalStateException("Cannot propagate a successful result");
        }
        return (EngineResult<U>) this;
    }

    @Override
    public String toString() {
        return error == null ? "EngineResult[success=" + value + "]" : "EngineResult[failure=" + error + "]";
    }
}
