package com.texcalc.expression;

import org.eclipse.collections.api.map.ImmutableMap;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Maps;

/**
 * Every function the evaluator knows. The name is the canonical spelling produced by the
 * normalizer; {@link #NTHROOT} and {@link #LOG_BASE} take two arguments and have their own
 * surface forms ({@code nthroot[n]{x}}, {@code log_{b}{x}}), so they are not looked up by name.
 */
public enum MathFunction {
    SIN("sin", 1),
    COS("cos", 1),
    TAN("tan", 1),
    COT("cot", 1),
    SEC("sec", 1),
    CSC("csc", 1),
    ARCSIN("arcsin", 1),
    ARCCOS("arccos", 1),
    ARCTAN("arctan", 1),
    ARCCOT("arccot", 1),
    SINH("sinh", 1),
    COSH("cosh", 1),
    TANH("tanh", 1),
    LN("ln", 1),
    LOG("log", 1),
    EXP("exp", 1),
    SQRT("sqrt", 1),
    NTHROOT("nthroot", 2),
    LOG_BASE("log_", 2);

    private static final ImmutableMap<String, MathFunction> BY_NAME;

    static {
        MutableMap<String, MathFunction> byName = Maps.mutable.empty();
        for (MathFunction function : values()) {
            if (function.arity == 1) {
                byName.put(function.canonicalName, function);
            }
        }
        BY_NAME = byName.toImmutable();
    }

    private final String canonicalName;
    private final int arity;

    MathFunction(String canonicalName, int arity) {
        this.canonicalName = canonicalName;
        this.arity = arity;
    }

    public String canonicalName() {
        return canonicalName;
    }

    public int arity() {
        return arity;
    }

    /** Single-argument function called by name, or null. */
    public static MathFunction byName(String name) {
        return BY_NAME.get(name);
    }

    public static boolean isFunctionName(String name) {
        return BY_NAME.containsKey(name);
    }
}
