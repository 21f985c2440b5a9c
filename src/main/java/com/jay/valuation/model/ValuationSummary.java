package com.jay.valuation.model;

/** Statistics over the models that produced a usable value. */
public record ValuationSummary(double average, double min, double max, int modelsUsed, int totalModels) {}
