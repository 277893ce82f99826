package com.modelspec.registry.model;

import java.util.Map;

import com.modelspec.data.DataFrame;
import com.modelspec.expr.DeferredValue;
import com.modelspec.spec.ModelFit;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * How an engine produces one type of prediction.
 */
@Value
@Builder(toBuilder = true)
public class PredictModule {

    /**
     * Optional transform of the new data before the call; the result is bound to
     * {@code new_data}.
     */
    PreProcessor pre;

    /**
     * Optional transform of the raw engine output into the canonical shape for the type.
     */
    PostProcessor post;

    @NonNull
    FunctionRef function;

    /**
     * Call arguments; values refer symbolically to {@code object}, {@code new_data} and
     * {@code model_fit}.
     */
    @NonNull
    @Singular("argument")
    Map<String, DeferredValue> args;

    @FunctionalInterface
    public interface PreProcessor {
        Object apply(DataFrame newData, ModelFit modelFit);
    }

    @FunctionalInterface
    public interface PostProcessor {
        Object apply(Object rawOutput, ModelFit modelFit);
    }
}
