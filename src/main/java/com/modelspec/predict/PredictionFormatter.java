package com.modelspec.predict;

import java.util.List;

import com.modelspec.data.DataFrame;
import com.modelspec.exception.PredictionShapeException;
import com.modelspec.registry.model.PredictionType;
import com.modelspec.util.NamingUtil;

import lombok.experimental.UtilityClass;

/**
 * Names canonical predictions with the standard columns: {@code .pred_class},
 * {@code .pred_<level>}, {@code .pred} and {@code .pred_raw}.
 */
@UtilityClass
class PredictionFormatter {

    DataFrame format(Object canonical, PredictionType type) {
        if (canonical instanceof DataFrame frame) {
            if (type == PredictionType.PROB) {
                DataFrame.DataFrameBuilder builder = DataFrame.builder();
                frame.columns().forEach((level, values) ->
                        builder.column(NamingUtil.predictionColumn(type.getColumnPrefix(), level), values));
                return builder.build();
            }
            return frame;
        }
        if (canonical instanceof List<?> values) {
            return DataFrame.builder().column(type.getColumnPrefix(), values).build();
        }
        throw new PredictionShapeException("Predictions of type '" + type.getCode()
                + "' cannot be formatted as a frame; use the raw prediction instead");
    }
}
