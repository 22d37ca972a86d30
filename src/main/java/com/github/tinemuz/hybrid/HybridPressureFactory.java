/*
 * MIT License
 *
 * Copyright (c) 2025 tinemuz
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */
package com.github.tinemuz.hybrid;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Hybrid-pressure coordinate factory with the formula
 * <pre>
 *     p = ap + b * ps
 * </pre>
 * or, when a reference pressure is given,
 * <pre>
 *     p = a * p0 + b * ps
 * </pre>
 * where {@code ap}/{@code a} is {@code delta}, {@code b} is {@code sigma},
 * {@code ps} is {@code surface_air_pressure} and {@code p0} is
 * {@code reference_air_pressure}.
 *
 * <p>At least one of {@code delta} or {@code surface_air_pressure} must be
 * given and {@code sigma} must be dimensionless. Without a reference
 * pressure, {@code delta} and {@code surface_air_pressure} must share units;
 * with one, {@code delta} must be dimensionless and the surface and reference
 * pressures must share units. Either way the output must be a pressure.</p>
 */
public final class HybridPressureFactory extends AuxCoordFactory {
    public static final String DELTA = "delta";
    public static final String SIGMA = "sigma";
    public static final String SURFACE_AIR_PRESSURE = "surface_air_pressure";
    public static final String REFERENCE_AIR_PRESSURE = "reference_air_pressure";

    /**
     * Three-term form, {@code p = ap + b * ps}.
     *
     * @throws IllegalArgumentException if the coordinates can't be combined
     */
    public HybridPressureFactory(Coordinate delta, Coordinate sigma, Coordinate surfaceAirPressure) {
        this(delta, sigma, surfaceAirPressure, null);
    }

    /**
     * @param delta                coordinate providing the {@code ap} or {@code a} term, or null
     * @param sigma                coordinate providing the {@code b} term, or null
     * @param surfaceAirPressure   coordinate providing the {@code ps} term, or null
     * @param referenceAirPressure coordinate providing the {@code p0} term, or null
     * @throws IllegalArgumentException if the coordinates can't be combined
     */
    public HybridPressureFactory(Coordinate delta, Coordinate sigma,
                                 Coordinate surfaceAirPressure, Coordinate referenceAirPressure) {
        this(dependencies(delta, sigma, surfaceAirPressure, referenceAirPressure));
    }

    private HybridPressureFactory(Map<String, Coordinate> dependencies) {
        super(dependencies, HybridPressureFactory::validate);
    }

    @Override
    public String standardName() {
        return "air_pressure";
    }

    @Override
    public Map<String, String> attributes() {
        return Collections.emptyMap();
    }

    public Coordinate delta() {
        return dependencies().get(DELTA);
    }

    public Coordinate sigma() {
        return dependencies().get(SIGMA);
    }

    public Coordinate surfaceAirPressure() {
        return dependencies().get(SURFACE_AIR_PRESSURE);
    }

    public Coordinate referenceAirPressure() {
        return dependencies().get(REFERENCE_AIR_PRESSURE);
    }

    @Override
    protected Set<String> boundsRoles() {
        return Set.of(DELTA, SIGMA);
    }

    // Without p0 the delta term is used as-is
    @Override
    protected NdArray absentValue(String role) {
        return REFERENCE_AIR_PRESSURE.equals(role) ? ONE : ZERO;
    }

    @Override
    protected NdArray derive(Map<String, NdArray> operands) {
        NdArray delta = operands.get(DELTA);
        NdArray sigma = operands.get(SIGMA);
        NdArray surface = operands.get(SURFACE_AIR_PRESSURE);
        NdArray reference = operands.get(REFERENCE_AIR_PRESSURE);
        return delta.multiply(reference).add(sigma.multiply(surface));
    }

    @Override
    protected AuxCoordFactory newInstance(Map<String, Coordinate> dependencies) {
        return new HybridPressureFactory(dependencies);
    }

    private static Units validate(Map<String, Coordinate> dependencies) {
        Coordinate delta = role(dependencies, DELTA);
        Coordinate sigma = role(dependencies, SIGMA);
        Coordinate surface = role(dependencies, SURFACE_AIR_PRESSURE);
        Coordinate reference = role(dependencies, REFERENCE_AIR_PRESSURE);

        if (delta == null && surface == null) {
            throw new IllegalArgumentException(
                    "Unable to construct hybrid pressure coordinate factory due to"
                            + " insufficient source coordinates: need delta or surface_air_pressure.");
        }

        checkBoundsCount(DELTA, delta);
        checkBoundsCount(SIGMA, sigma);

        if (sigma != null && !sigma.units().isDimensionless()) {
            throw new IllegalArgumentException("Invalid units: sigma must be dimensionless.");
        }
        if (reference == null) {
            if (delta != null && surface != null && !delta.units().equals(surface.units())) {
                throw new IllegalArgumentException(
                        "Incompatible units: delta and surface_air_pressure must have the same units.");
            }
        } else {
            if (surface != null && !surface.units().equals(reference.units())) {
                throw new IllegalArgumentException(
                        "Incompatible units: surface_air_pressure and reference_air_pressure"
                                + " must have the same units.");
            }
            if (delta != null && !delta.units().isDimensionless()) {
                throw new IllegalArgumentException(
                        "Incompatible units: delta must be dimensionless if"
                                + " reference_air_pressure is specified.");
            }
        }

        Units units;
        if (reference != null) {
            units = reference.units();
        } else if (delta != null) {
            units = delta.units();
        } else {
            units = surface.units();
        }
        if (!units.isConvertible(Units.PASCAL)) {
            throw new IllegalArgumentException(
                    "Invalid units: delta, surface_air_pressure and/or reference_air_pressure"
                            + " must have units of pressure.");
        }
        return units;
    }

    private static Map<String, Coordinate> dependencies(
            Coordinate delta, Coordinate sigma, Coordinate surface, Coordinate reference) {
        Map<String, Coordinate> deps = new LinkedHashMap<>();
        deps.put(DELTA, delta);
        deps.put(SIGMA, sigma);
        deps.put(SURFACE_AIR_PRESSURE, surface);
        deps.put(REFERENCE_AIR_PRESSURE, reference);
        return deps;
    }
}
