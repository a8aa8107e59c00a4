package com.querypilot.validation;

/**
 * One ordered, independently testable check over a generated statement.
 */
public interface ValidationLayer {

    /**
     * Rule id used on every issue this layer reports.
     */
    String ruleId();

    LayerResult check(ValidationInput input);
}
