package tech.entragov.analyzer.exception;

/**
 * Analyzer input that cannot be evaluated.
 */
public class AnalysisException extends RuntimeException {

    public AnalysisException(String message) {
        super(message);
    }

    public AnalysisException(String message, Throwable cause) {
        super(message, cause);
    }

    public static AnalysisException missingField(String entity, String field, String ref) {
        return new AnalysisException(
            String.format("Malformed %s%s: missing %s", entity, ref != null ? " '" + ref + "'" : "", field));
    }
}
