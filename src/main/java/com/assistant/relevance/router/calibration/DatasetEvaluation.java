package com.assistant.relevance.router.calibration;

/**
 * Routing accuracy over a labeled dataset.
 *
 * @param evaluated samples whose expected route is known
 * @param correct   samples whose accepted decision matched the expected route
 */
public record DatasetEvaluation(int evaluated, int correct) {

    public DatasetEvaluation {
        if (evaluated < 0 || correct < 0 || correct > evaluated) {
            throw new IllegalArgumentException("correct must be between 0 and evaluated");
        }
    }

    public double accuracy() {
        return evaluated == 0 ? 0.0 : (double) correct / evaluated;
    }
}
