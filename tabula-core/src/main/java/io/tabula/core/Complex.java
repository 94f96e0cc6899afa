package io.tabula.core;

/**
 * Complex number with double precision parts.
 */
public record Complex(double real, double imaginary) {

    public static Complex of(double real, double imaginary) {
        return new Complex(real, imaginary);
    }

    public boolean isNaN() {
        return Double.isNaN(real) || Double.isNaN(imaginary);
    }

    /**
     * Infinite when either part is infinite, regardless of the other part.
     */
    public boolean isInfinite() {
        return Double.isInfinite(real) || Double.isInfinite(imaginary);
    }
}
