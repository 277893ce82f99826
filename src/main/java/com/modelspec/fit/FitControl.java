package com.modelspec.fit;

import lombok.Builder;
import lombok.Value;

/**
 * Options governing a fit call.
 */
@Value
@Builder(toBuilder = true)
public class FitControl {

    /**
     * 0 is silent, 1 logs caught failures as warnings, 2 also logs every fit call.
     */
    @Builder.Default
    int verbosity = 1;

    /**
     * Whether a failing engine call is returned as a failed fit instead of thrown.
     */
    boolean catchErrors;

    public static FitControl defaults() {
        return FitControl.builder().build();
    }
}
