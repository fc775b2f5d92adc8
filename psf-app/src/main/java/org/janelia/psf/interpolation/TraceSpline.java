package org.janelia.psf.interpolation;

import java.io.Serializable;
import java.util.Arrays;

import org.apache.commons.math3.analysis.interpolation.SplineInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialFunction;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;
import org.apache.commons.math3.exception.MathIllegalArgumentException;

/**
 * Cubic spline through sampled trace values (e.g. x centroid as a function of wavelength).
 * Values outside the sampled range continue the first or last spline segment.
 *
 * @author Eric Trautman
 */
public class TraceSpline implements Serializable {

    private final double[] knots;
    private final PolynomialFunction[] polynomials;

    /**
     * @param  x  strictly ascending sample coordinates (at least 3).
     * @param  y  sample values.
     *
     * @throws IllegalArgumentException
     *   if the samples cannot be interpolated.
     */
    public TraceSpline(final double[] x,
                       final double[] y)
            throws IllegalArgumentException {

        final PolynomialSplineFunction spline;
        try {
            spline = new SplineInterpolator().interpolate(x, y);
        } catch (final MathIllegalArgumentException e) {
            throw new IllegalArgumentException("failed to build trace spline, " + e.getMessage(), e);
        }

        this.knots = spline.getKnots();
        this.polynomials = spline.getPolynomials();
    }

    public double getMin() {
        return knots[0];
    }

    public double getMax() {
        return knots[knots.length - 1];
    }

    public double value(final double x) {
        final int segment = findSegment(x);
        return polynomials[segment].value(x - knots[segment]);
    }

    /**
     * @return first derivative of the spline at x.
     */
    public double derivative(final double x) {
        final int segment = findSegment(x);
        return polynomials[segment].polynomialDerivative().value(x - knots[segment]);
    }

    private int findSegment(final double x) {
        final int lastSegment = polynomials.length - 1;
        if (x <= knots[0]) {
            return 0;
        } else if (x >= knots[lastSegment]) {
            return lastSegment;
        }
        int index = Arrays.binarySearch(knots, x);
        if (index < 0) {
            index = -index - 2;
        }
        return Math.min(index, lastSegment);
    }

}
