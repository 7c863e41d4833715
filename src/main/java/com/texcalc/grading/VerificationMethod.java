package com.texcalc.grading;

public enum VerificationMethod {
    EXACT,
    NUMERIC
}
