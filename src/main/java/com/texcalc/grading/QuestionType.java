package com.texcalc.grading;

public enum QuestionType {
    CHOICE,
    BLANK,
    ANSWER
}
