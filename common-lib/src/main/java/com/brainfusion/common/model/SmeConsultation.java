package com.brainfusion.common.model;

/**
 * Outcome of consulting one subject-matter-expert brain.
 *
 * <p>The payload is resolved into one of three shapes at the SME boundary so that the
 * aggregators never have to inspect raw responses:
 * <ul>
 *   <li>{@link Structured}: a well-formed {@link BrainAnalysis}</li>
 *   <li>{@link FreeText}: the SME answered, but not with structured output (counts as 0.5)</li>
 *   <li>{@link Failed}: the SME errored, timed out or was cancelled (excluded from fusion)</li>
 * </ul>
 */
public sealed interface SmeConsultation
        permits SmeConsultation.Structured, SmeConsultation.FreeText, SmeConsultation.Failed {

    double FREE_TEXT_CONFIDENCE = 0.5;

    String domain();

    boolean isError();

    /** Confidence to feed into fusion; meaningless for {@link Failed}. */
    double confidence();

    RiskLevel riskLevel();

    record Structured(String domain, BrainAnalysis analysis) implements SmeConsultation {
        @Override public boolean isError()        { return false; }
        @Override public double confidence()      { return analysis.confidence(); }
        @Override public RiskLevel riskLevel()    { return analysis.riskLevel(); }
    }

    record FreeText(String domain, String text) implements SmeConsultation {
        @Override public boolean isError()        { return false; }
        @Override public double confidence()      { return FREE_TEXT_CONFIDENCE; }
        @Override public RiskLevel riskLevel()    { return RiskLevel.LOW; }
    }

    record Failed(String domain, String error) implements SmeConsultation {
        @Override public boolean isError()        { return true; }
        @Override public double confidence()      { return 0.0; }
        @Override public RiskLevel riskLevel()    { return RiskLevel.LOW; }
    }
}
