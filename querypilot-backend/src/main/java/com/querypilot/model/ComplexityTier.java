package com.querypilot.model;

public enum ComplexityTier {
    SIMPLE,
    MODERATE,
    COMPLEX
}
