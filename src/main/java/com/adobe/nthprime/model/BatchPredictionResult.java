package com.adobe.nthprime.model;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

/**
 * Response model for a range of predictions.
 * 
 * <pre>
 * {
 *     "predictions": [
 *         {"index": "25", "prime": "97", "method": "lookup", ...},
 *         {"index": "26", "prime": "89", "method": "closed_form", ...}
 *     ]
 * }
 * </pre>
 * 
 * @param predictions results in ascending index order
 * 
 * @author Adobe AEM Engineering Assessment
 * @version 1.0.0
 */
@Schema(description = "Predictions for a range of prime indices")
public record BatchPredictionResult(

    @Schema(description = "Predictions in ascending order by index")
    List<PredictionResult> predictions

) {
    public static BatchPredictionResult of(List<PredictionResult> predictions) {
        return new BatchPredictionResult(List.copyOf(predictions));
    }

    public int size() {
        return predictions != null ? predictions.size() : 0;
    }
}
