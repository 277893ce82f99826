package com.modelspec.spec;

import java.time.Duration;
import java.util.Set;

import com.modelspec.exception.FitExecutionException;
import com.modelspec.expr.MemberAccessible;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A fitted model: the engine's fitted object together with the specification that
 * produced it and what prediction needs to know about the training data.
 *
 * A fit that failed under a catching {@link com.modelspec.fit.FitControl} has {@link #getError()} set and
 * no {@link #getFit()}.
 */
@Value
@Builder(toBuilder = true)
public class ModelFit implements MemberAccessible {

    @NonNull
    ModelSpec spec;

    /**
     * Opaque object returned by the engine's fitting function.
     */
    Object fit;

    Preprocessing preproc;

    Duration elapsed;

    FitExecutionException error;

    public static ModelFit failure(ModelSpec spec, FitExecutionException error) {
        return ModelFit.builder().spec(spec).error(error).build();
    }

    public boolean isFailed() {
        return error != null;
    }

    @Override
    public Set<String> memberNames() {
        return Set.of("fit", "spec", "lvl", "preproc", "elapsed");
    }

    @Override
    public Object member(String name) {
        switch (name) {
            case "fit":
                return fit;
            case "spec":
                return spec;
            case "lvl":
                return preproc == null ? null : preproc.getOutcomeLevels();
            case "preproc":
                return preproc;
            case "elapsed":
                return elapsed;
            default:
                throw new IllegalArgumentException("Unknown member '" + name + "'");
        }
    }
}
