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

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Makes an auxiliary coordinate on demand by combining other coordinates.
 *
 * <p>Each subclass is one formula with a fixed set of named dependency
 * roles. A role holds a {@link Coordinate} or null when absent; absent roles
 * take part in the arithmetic as a neutral constant. The dependencies are
 * checked when the factory is built and on every {@link #update}.</p>
 *
 * <p>{@link #makeCoordinate} does no arithmetic. It lines up every
 * dependency with the host array's dimensions and returns a coordinate whose
 * points (and bounds, when a bounds-carrying role is bounded) are
 * {@link LazyArray}s; the formula runs the first time they are read.</p>
 *
 * <p>The long name, variable name and coordinate system may be changed at
 * any time and affect only coordinates made afterwards. {@code update} is
 * synchronized and swaps in a fully validated dependency set, so a
 * concurrent {@code makeCoordinate} sees either the old or the new set.</p>
 *
 * <p>The formulas are {@link HybridHeightFactory} and
 * {@link HybridPressureFactory}; the constructor is package-private.</p>
 */
public abstract class AuxCoordFactory {
    private static final Logger log = LoggerFactory.getLogger(AuxCoordFactory.class);

    /** Stand-in for an absent dependency. FLOAT16 so it never widens present operands. */
    protected static final NdArray ZERO = NdArray.scalar(NumericType.FLOAT16, 0.0);

    /** Multiplicative identity, same precision rule as {@link #ZERO}. */
    protected static final NdArray ONE = NdArray.scalar(NumericType.FLOAT16, 1.0);

    private final Function<Map<String, Coordinate>, Units> validator;
    private volatile State state;
    private volatile String longName;
    private volatile String varName;
    private volatile CoordSystem coordSystem;

    /**
     * @param dependencies every role of the formula, in a fixed order, mapped
     *                     to its coordinate or null
     * @param validator    checks a complete dependency set and derives the
     *                     output units from it, throwing
     *                     {@link IllegalArgumentException} if the set can't be used
     */
    AuxCoordFactory(Map<String, Coordinate> dependencies,
                    Function<Map<String, Coordinate>, Units> validator) {
        Map<String, Coordinate> deps = new LinkedHashMap<>(dependencies);
        Units units;
        try {
            units = validator.apply(deps);
        } catch (IllegalArgumentException e) {
            log.debug("Rejected dependencies {}: {}", describe(deps), e.getMessage());
            throw e;
        }
        this.validator = validator;
        this.state = new State(Collections.unmodifiableMap(deps), units);
        deps.forEach(this::warnIfPointsOnlyBounded);
    }

    /** CF standard name of the coordinates this factory makes. */
    public abstract String standardName();

    /** Fixed attributes of the coordinates this factory makes. */
    public abstract Map<String, String> attributes();

    /** Roles whose bounds contribute to the derived bounds. */
    protected abstract Set<String> boundsRoles();

    /** Value used for an absent role. */
    protected NdArray absentValue(String role) {
        return ZERO;
    }

    /**
     * Apply the formula elementwise. Every role is present in
     * {@code operands}; absent roles carry {@link #absentValue}.
     */
    protected abstract NdArray derive(Map<String, NdArray> operands);

    /** New factory of the same formula over {@code dependencies}. */
    protected abstract AuxCoordFactory newInstance(Map<String, Coordinate> dependencies);

    /**
     * Current role to coordinate mapping, absent roles mapped to null.
     * Read-only; change it through {@link #update}.
     */
    public Map<String, Coordinate> dependencies() {
        return state.dependencies;
    }

    public Units units() {
        return state.units;
    }

    public String longName() {
        return longName;
    }

    public void setLongName(String longName) {
        this.longName = longName;
    }

    public String varName() {
        return varName;
    }

    public void setVarName(String varName) {
        this.varName = varName;
    }

    public CoordSystem coordSystem() {
        return coordSystem;
    }

    public void setCoordSystem(CoordSystem coordSystem) {
        this.coordSystem = coordSystem;
    }

    /** Metadata copied onto every coordinate this factory makes. */
    public CoordMetadata definition() {
        return new CoordMetadata(
                standardName(), longName, varName, state.units, attributes(), coordSystem);
    }

    public String name() {
        return definition().name();
    }

    /**
     * Host dimensions spanned by the derived coordinate: the ascending union
     * of the dimensions of every present dependency.
     */
    public int[] derivedDimensions(CoordDimsLookup lookup) {
        return derivedDimensions(state.dependencies, lookup);
    }

    /**
     * Make a new derived coordinate. Nothing is computed until its points or
     * bounds are read.
     *
     * <p>Bounds are produced when a {@linkplain #boundsRoles() bounds role}
     * is bounded. Other bounded roles contribute their points only, with a
     * warning. Invalid bounds and inconsistent shapes are reported when the
     * values are read, not here.</p>
     */
    public AuxCoord makeCoordinate(CoordDimsLookup lookup) {
        State snapshot = state;
        Map<String, Coordinate> deps = snapshot.dependencies;
        int[] derivedDims = derivedDimensions(deps, lookup);
        int ndim = derivedDims.length > 0 ? derivedDims[derivedDims.length - 1] + 1 : 1;

        Map<String, int[]> dependencyDims = new LinkedHashMap<>();
        for (Map.Entry<String, Coordinate> e : deps.entrySet()) {
            if (e.getValue() != null) dependencyDims.put(e.getKey(), lookup.dimsOf(e.getValue()));
        }

        Map<String, LazyArray> ndPoints = new LinkedHashMap<>();
        for (Map.Entry<String, int[]> e : dependencyDims.entrySet()) {
            Coordinate coord = deps.get(e.getKey());
            ndPoints.put(e.getKey(),
                    DimensionRemapper.lazyPoints(coord.lazyPoints(), e.getValue(), ndim, derivedDims));
        }
        LazyArray points = new LazyArray(reconcile(ndPoints), new Combination(this, ndPoints, Set.of()));

        LazyArray bounds = null;
        if (hasBoundedBoundsRole(deps)) {
            Map<String, LazyArray> ndValues = new LinkedHashMap<>();
            Set<String> checked = new TreeSet<>();
            for (Map.Entry<String, int[]> e : dependencyDims.entrySet()) {
                String role = e.getKey();
                Coordinate coord = deps.get(role);
                LazyArray coordBounds = coord.lazyBounds();
                if (coordBounds != null && boundsRoles().contains(role)) {
                    ndValues.put(role, DimensionRemapper.lazyBounds(
                            coordBounds, e.getValue(), ndim, derivedDims));
                    checked.add(role);
                } else {
                    if (coordBounds != null) {
                        log.warn("{} coordinate {} has bounds. These are being disregarded.",
                                role, quoted(coord));
                    }
                    ndValues.put(role, DimensionRemapper.lazyPointsAsBounds(
                            coord.lazyPoints(), e.getValue(), ndim, derivedDims));
                }
            }
            bounds = new LazyArray(reconcile(ndValues), new Combination(this, ndValues, checked));
        }

        return new AuxCoord(points, bounds, definition());
    }

    /**
     * React to a dependency being removed ({@code newCoord} null) or
     * replaced. Every role holding {@code oldCoord} (by identity) is rebound
     * and the whole prospective set is validated before anything changes.
     * A coordinate that is not a dependency is ignored.
     *
     * @throws IllegalArgumentException if the resulting dependencies are
     *         invalid; the factory is left as it was
     */
    public synchronized void update(Coordinate oldCoord, Coordinate newCoord) {
        State current = state;
        Map<String, Coordinate> prospective = new LinkedHashMap<>(current.dependencies);
        List<String> rebound = new ArrayList<>();
        for (Map.Entry<String, Coordinate> e : prospective.entrySet()) {
            if (e.getValue() != null && e.getValue() == oldCoord) {
                e.setValue(newCoord);
                rebound.add(e.getKey());
            }
        }
        if (rebound.isEmpty()) return;

        Units units;
        try {
            units = validator.apply(prospective);
        } catch (IllegalArgumentException e) {
            log.debug("Rejected update of {}: {}", this, e.getMessage());
            throw new IllegalArgumentException("Failed to update dependencies. " + e.getMessage(), e);
        }
        state = new State(Collections.unmodifiableMap(prospective), units);
        // Unchanged roles were already reported
        for (String role : rebound) warnIfPointsOnlyBounded(role, newCoord);
    }

    /** Remove a dependency. Same as {@code update(oldCoord, null)}. */
    public void update(Coordinate oldCoord) {
        update(oldCoord, null);
    }

    /**
     * New factory of the same formula whose present dependencies are
     * replaced by their counterparts in {@code replacements} (keys compared
     * by identity), e.g. after the owning array was copied. Names and the
     * coordinate system are carried over.
     *
     * @throws IllegalArgumentException if a present dependency has no
     *         replacement, or the new dependencies are invalid
     */
    public AuxCoordFactory withRemappedDependencies(Map<Coordinate, Coordinate> replacements) {
        Map<Coordinate, Coordinate> byIdentity = new IdentityHashMap<>(replacements);
        Map<String, Coordinate> remapped = new LinkedHashMap<>();
        for (Map.Entry<String, Coordinate> e : state.dependencies.entrySet()) {
            Coordinate coord = e.getValue();
            if (coord != null) {
                coord = byIdentity.get(coord);
                if (coord == null) {
                    throw new IllegalArgumentException(
                            "No replacement given for " + e.getKey() + " coordinate " + quoted(e.getValue()));
                }
            }
            remapped.put(e.getKey(), coord);
        }
        AuxCoordFactory copy = newInstance(remapped);
        copy.setLongName(longName);
        copy.setVarName(varName);
        copy.setCoordSystem(coordSystem);
        return copy;
    }

    @Override
    public String toString() {
        return "<" + getClass().getSimpleName() + describe(state.dependencies) + ">";
    }

    /**
     * Fail unless a bounds-carrying coordinate has 0 or 2 bounds.
     *
     * @throws IllegalArgumentException if the bounds count is anything else
     */
    protected static void checkBoundsCount(String role, Coordinate coord) {
        if (coord != null && coord.nbounds() != 0 && coord.nbounds() != 2) {
            throw new IllegalArgumentException(
                    "Invalid " + role + " coordinate: must have either 0 or 2 bounds.");
        }
    }

    // Bounds on roles outside boundsRoles() never reach the derived bounds
    private void warnIfPointsOnlyBounded(String role, Coordinate coord) {
        if (coord != null && coord.nbounds() > 0 && !boundsRoles().contains(role)) {
            log.warn("{} coordinate {} has bounds. These will be disregarded.", role, quoted(coord));
        }
    }

    /** Dependency value or null, failing on roles the formula doesn't have. */
    protected static Coordinate role(Map<String, Coordinate> dependencies, String role) {
        if (!dependencies.containsKey(role)) {
            throw new IllegalArgumentException("Unknown dependency role '" + role + "'");
        }
        return dependencies.get(role);
    }

    private boolean hasBoundedBoundsRole(Map<String, Coordinate> deps) {
        for (String role : boundsRoles()) {
            Coordinate coord = deps.get(role);
            if (coord != null && coord.nbounds() > 0) return true;
        }
        return false;
    }

    private static int[] derivedDimensions(Map<String, Coordinate> deps, CoordDimsLookup lookup) {
        Set<Integer> dims = new TreeSet<>();
        for (Coordinate coord : deps.values()) {
            if (coord == null) continue;
            for (int dim : lookup.dimsOf(coord)) dims.add(dim);
        }
        return dims.stream().mapToInt(Integer::intValue).toArray();
    }

    private static int[] reconcile(Map<String, LazyArray> operands) {
        List<int[]> shapes = new ArrayList<>();
        for (LazyArray operand : operands.values()) shapes.add(operand.shape());
        return DimensionRemapper.reconcileShapes(shapes);
    }

    /** Roles in alphabetical order, e.g. {@code (delta='a', sigma=None)}. */
    private static String describe(Map<String, Coordinate> deps) {
        List<String> args = new ArrayList<>();
        new TreeSet<>(deps.keySet()).forEach(role -> {
            Coordinate coord = deps.get(role);
            args.add(role + "=" + (coord == null ? "None" : quoted(coord)));
        });
        return "(" + String.join(", ", args) + ")";
    }

    private static String quoted(Coordinate coord) {
        return "'" + coord.name() + "'";
    }

    // Dependencies and the units derived from them, replaced as a unit
    private record State(Map<String, Coordinate> dependencies, Units units) {}

    /**
     * Deferred evaluation of the formula over remapped operands captured when
     * the coordinate was made. Roles in {@code boundsChecked} must have a
     * trailing bounds axis of size 1 or 2 when read.
     */
    private static final class Combination implements Supplier<NdArray> {
        private final AuxCoordFactory formula;
        private final Map<String, LazyArray> operands;
        private final Set<String> boundsChecked;
        private final Set<String> roles;

        Combination(AuxCoordFactory formula, Map<String, LazyArray> operands, Set<String> boundsChecked) {
            this.formula = formula;
            this.operands = operands;
            this.boundsChecked = boundsChecked;
            this.roles = formula.dependencies().keySet();
        }

        @Override
        public NdArray get() {
            Map<String, NdArray> values = new LinkedHashMap<>();
            for (String role : roles) {
                LazyArray operand = operands.get(role);
                if (operand == null) {
                    values.put(role, formula.absentValue(role));
                    continue;
                }
                NdArray value = operand.materialize();
                if (boundsChecked.contains(role)) {
                    int[] s = value.shape();
                    int n = s[s.length - 1];
                    if (n != 1 && n != 2) {
                        throw new IllegalArgumentException("Invalid " + role + " coordinate bounds.");
                    }
                }
                values.put(role, value);
            }
            return formula.derive(values);
        }
    }
}
