package dev.opportunityfeed.model;

/**
 * Outcome of one classifier call.
 *
 * @param verdict    accept, reject, or indeterminate when the endpoint could not be used
 * @param confidence value in [0,1]
 * @param reasoning  short explanation, from the model or from the failure path
 * @param error      failure cause for indeterminate results, otherwise null
 */
public record ClassificationResult(
        Verdict verdict,
        double confidence,
        String reasoning,
        String error) {

    public enum Verdict {
        ACCEPT,
        REJECT,
        INDETERMINATE
    }

    public ClassificationResult {
        confidence = clamp(confidence);
    }

    public static ClassificationResult accept(double confidence, String reasoning) {
        return new ClassificationResult(Verdict.ACCEPT, confidence, reasoning, null);
    }

    public static ClassificationResult reject(double confidence, String reasoning) {
        return new ClassificationResult(Verdict.REJECT, confidence, reasoning, null);
    }

    public static ClassificationResult indeterminate(String reasoning, String error) {
        return new ClassificationResult(Verdict.INDETERMINATE, 0.0, reasoning, error);
    }

    public boolean isAccepted() {
        return verdict == Verdict.ACCEPT;
    }

    public boolean isIndeterminate() {
        return verdict == Verdict.INDETERMINATE;
    }

    public static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
