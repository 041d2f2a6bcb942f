package com.vesmooth.server.grid;

/**
 * One entry of a {@link Grid}: the value being smoothed plus the diagnostics
 * written by the individual pipeline stages.
 */
public class Cell {
    private double value;
    // max abs difference to cardinal neighbors, written by GradientEstimator only
    private double gradient;
    // round(weight * 10) of the last adaptive smoothing sweep
    private double adaptivePasses;
    // 0 when the cell was at or below the gradient threshold
    private double blendFactor;

    public Cell(double value) {
        this(value, 0.0, 0.0, 0.0);
    }

    public Cell(double value, double gradient, double adaptivePasses, double blendFactor) {
        this.value = value;
        this.gradient = gradient;
        this.adaptivePasses = adaptivePasses;
        this.blendFactor = blendFactor;
    }

    public Cell copy() {
        return new Cell(value, gradient, adaptivePasses, blendFactor);
    }

    public double getValue() {
        return value;
    }

    public void setValue(double value) {
        this.value = value;
    }

    public double getGradient() {
        return gradient;
    }

    public void setGradient(double gradient) {
        this.gradient = gradient;
    }

    public double getAdaptivePasses() {
        return adaptivePasses;
    }

    public void setAdaptivePasses(double adaptivePasses) {
        this.adaptivePasses = adaptivePasses;
    }

    public double getBlendFactor() {
        return blendFactor;
    }

    public void setBlendFactor(double blendFactor) {
        this.blendFactor = blendFactor;
    }

    @Override
    public String toString() {
        return "Cell{value=" + value + ", gradient=" + gradient + ", adaptivePasses=" + adaptivePasses
                + ", blendFactor=" + blendFactor + '}';
    }
}
