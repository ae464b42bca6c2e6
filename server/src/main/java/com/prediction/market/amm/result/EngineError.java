package com.prediction.market.amm.result;

import lombok.Value;

/**
 * A reported, expected failure: what went wrong and why, in caller-facing words.
 */
@Value
public class EngineError {
    ErrorCode code;
    String message;

    public static EngineError of(ErrorCode code, String message) {
        return new EngineError(code, message);
    }

    public ErrorKind getKind() {
        return code.getKind();
    }
}
