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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Hybrid-height coordinate factory with the formula
 * <pre>
 *     z = a + b * orog
 * </pre>
 * where {@code a} is {@code delta}, {@code b} is {@code sigma} and
 * {@code orog} is {@code orography}.
 *
 * <p>At least one of {@code delta} or {@code orography} must be given. When
 * both are, their units must be the same, and they must be length units.
 * The output takes the units of {@code delta}, else of {@code orography}.
 * Bounds on {@code orography} are ignored with a warning.</p>
 */
public final class HybridHeightFactory extends AuxCoordFactory {
    public static final String DELTA = "delta";
    public static final String SIGMA = "sigma";
    public static final String OROGRAPHY = "orography";

    private static final Map<String, String> ATTRIBUTES = Map.of("positive", "up");

    /**
     * @param delta     coordinate providing the {@code a} term, or null
     * @param sigma     coordinate providing the {@code b} term, or null
     * @param orography coordinate providing the {@code orog} term, or null
     * @throws IllegalArgumentException if the coordinates can't be combined
     */
    public HybridHeightFactory(Coordinate delta, Coordinate sigma, Coordinate orography) {
        this(dependencies(delta, sigma, orography));
    }

    private HybridHeightFactory(Map<String, Coordinate> dependencies) {
        super(dependencies, HybridHeightFactory::validate);
    }

    @Override
    public String standardName() {
        return "altitude";
    }

    @Override
    public Map<String, String> attributes() {
        return ATTRIBUTES;
    }

    public Coordinate delta() {
        return dependencies().get(DELTA);
    }

    public Coordinate sigma() {
        return dependencies().get(SIGMA);
    }

    public Coordinate orography() {
        return dependencies().get(OROGRAPHY);
    }

    @Override
    protected Set<String> boundsRoles() {
        return Set.of(DELTA, SIGMA);
    }

    @Override
    protected NdArray derive(Map<String, NdArray> operands) {
        return operands.get(DELTA).add(operands.get(SIGMA).multiply(operands.get(OROGRAPHY)));
    }

    @Override
    protected AuxCoordFactory newInstance(Map<String, Coordinate> dependencies) {
        return new HybridHeightFactory(dependencies);
    }

    private static Units validate(Map<String, Coordinate> dependencies) {
        Coordinate delta = role(dependencies, DELTA);
        Coordinate sigma = role(dependencies, SIGMA);
        Coordinate orography = role(dependencies, OROGRAPHY);

        checkBoundsCount(DELTA, delta);
        checkBoundsCount(SIGMA, sigma);

        if (delta == null && orography == null) {
            throw new IllegalArgumentException(
                    "Unable to determine units: no delta or orography available.");
        }
        if (delta != null && orography != null && !delta.units().equals(orography.units())) {
            throw new IllegalArgumentException(
                    "Incompatible units: delta and orography must have the same units.");
        }
        Units units = delta != null ? delta.units() : orography.units();
        if (!units.isConvertible(Units.METRE)) {
            throw new IllegalArgumentException(
                    "Invalid units: delta and/or orography must be expressed in length units.");
        }
        return units;
    }

    private static Map<String, Coordinate> dependencies(
            Coordinate delta, Coordinate sigma, Coordinate orography) {
        Map<String, Coordinate> deps = new LinkedHashMap<>();
        deps.put(DELTA, delta);
        deps.put(SIGMA, sigma);
        deps.put(OROGRAPHY, orography);
        return deps;
    }
}
