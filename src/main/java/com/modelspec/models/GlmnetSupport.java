package com.modelspec.models;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.modelspec.exception.ArgumentValidationException;
import com.modelspec.expr.DeferredValue;
import com.modelspec.registry.ModelRegistry;
import com.modelspec.registry.model.FunctionRef;
import com.modelspec.registry.model.PredictModule;
import com.modelspec.spec.ModelFit;
import com.modelspec.translate.TranslationHook;

import lombok.experimental.UtilityClass;

/**
 * Pieces shared by the glmnet engine of every model type.
 *
 * glmnet fits the whole regularization path in one call, so the penalty is not passed to
 * the fit; predictions select it through {@code s}. Its predictions come back with one
 * slice per value of {@code s}.
 */
@UtilityClass
class GlmnetSupport {

    static final String ENGINE = "glmnet";
    static final String PACKAGE = "glmnet";

    static final FunctionRef FIT = FunctionRef.of(PACKAGE, "glmnet");
    static final FunctionRef PREDICT = FunctionRef.of(PACKAGE, "predict.glmnet");

    static final String PENALTY = "penalty";
    static final String MIXTURE = "mixture";

    static void registerArguments(ModelRegistry registry, String model) {
        registry.registerArgument(model, ENGINE, PENALTY, "lambda", FunctionRef.of("dials", "penalty"), true);
        registry.registerArgument(model, ENGINE, MIXTURE, "alpha", FunctionRef.of("dials", "mixture"), false);
    }

    /**
     * Checks penalty and mixture values known at translation time and drops
     * {@code lambda} from the fit call.
     */
    static TranslationHook pathHook() {
        return (context, arguments) -> {
            if (!ENGINE.equals(context.getEngine())) {
                return arguments;
            }
            context.getSpec().getArg(PENALTY).filter(DeferredValue::isLiteral).ifPresent(value -> {
                for (Object v : asList(value.resolve())) {
                    if (!(v instanceof Number n) || n.doubleValue() < 0) {
                        throw new ArgumentValidationException(PENALTY, "The amount of regularization should be >= 0.");
                    }
                }
            });
            context.getSpec().getArg(MIXTURE).filter(DeferredValue::isLiteral).ifPresent(value -> {
                Object v = value.resolve();
                if (!(v instanceof Number n) || n.doubleValue() < 0 || n.doubleValue() > 1) {
                    throw new ArgumentValidationException(MIXTURE,
                            "The proportion of L1 regularization should be within [0,1].");
                }
            });

            Map<String, DeferredValue> rewritten = new LinkedHashMap<>(arguments);
            rewritten.remove("lambda");
            return rewritten;
        };
    }

    /**
     * Rejects prediction unless the fitted specification holds exactly one penalty.
     */
    static PredictModule.PreProcessor singlePenalty() {
        return (newData, fit) -> {
            Object penalty = penaltyOf(fit);
            if (penalty == null) {
                throw new ArgumentValidationException(PENALTY, "Please set a single value of 'penalty' to predict "
                        + "with glmnet, or use multi_predict().");
            }
            if (asList(penalty).size() != 1) {
                throw new ArgumentValidationException(PENALTY, "The glmnet model was fit with " + asList(penalty).size()
                        + " penalty values; 'penalty' should be a single number. Use multi_predict() for several.");
            }
            return newData;
        };
    }

    /**
     * Keeps the first slice of a label matrix: one label per row.
     */
    static PredictModule.PostProcessor firstClassColumn() {
        return (raw, fit) -> {
            if (raw instanceof String[][] labels) {
                List<String> column = new ArrayList<>(labels.length);
                for (String[] row : labels) {
                    column.add(row[0]);
                }
                return column;
            }
            return raw;
        };
    }

    /**
     * Keeps the first slice of a rows x columns x s array.
     */
    static PredictModule.PostProcessor firstResponseSlice() {
        return (raw, fit) -> {
            if (raw instanceof double[][][] cube) {
                double[][] slice = new double[cube.length][];
                for (int i = 0; i < cube.length; i++) {
                    slice[i] = new double[cube[i].length];
                    for (int j = 0; j < cube[i].length; j++) {
                        slice[i][j] = cube[i][j][0];
                    }
                }
                return slice;
            }
            return raw;
        };
    }

    /**
     * First column of a rows x s matrix, as a numeric vector.
     */
    static PredictModule.PostProcessor firstNumericColumn() {
        return (raw, fit) -> {
            if (raw instanceof double[][] matrix) {
                double[] column = new double[matrix.length];
                for (int i = 0; i < matrix.length; i++) {
                    column[i] = matrix[i][0];
                }
                return column;
            }
            return raw;
        };
    }

    static DeferredValue newx() {
        return DeferredValue.expression("as_matrix(new_data)");
    }

    static DeferredValue s() {
        return DeferredValue.expression("model_fit.spec.args.penalty");
    }

    static DeferredValue object() {
        return DeferredValue.expression("object");
    }

    private static Object penaltyOf(ModelFit fit) {
        return fit.getSpec().getArg(PENALTY).map(DeferredValue::resolve).orElse(null);
    }

    private static List<?> asList(Object value) {
        return value instanceof List<?> list ? list : Arrays.asList(value);
    }
}
