/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.tripquery.query.calculate;

import org.tripquery.query.plan.PlanArgs;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Builds {@link FieldCalculation}s from plan entries of the form {@code {"name": ..., "operation": ...}}.
 */
public final class FieldCalculationFactory {

    /** Argument holding the target field name. */
    public static final String NAME_ARG = "name";
    /** Argument holding the operation name. */
    public static final String OPERATION_ARG = "operation";

    private static final Map<String, Function<String, FieldCalculation>> OPERATIONS = Map.of(
        DurationMinutesCalculation.NAME,
        DurationMinutesCalculation::new,
        HourOfDayCalculation.NAME,
        HourOfDayCalculation::new,
        IsRoundTripCalculation.NAME,
        IsRoundTripCalculation::new,
        DayOfWeekCalculation.NAME,
        DayOfWeekCalculation::new
    );

    private FieldCalculationFactory() {
        // Utility class - prevent instantiation
    }

    /**
     * Create a calculation for an operation name. Names outside the supported set yield an
     * {@link UnknownCalculation}.
     *
     * @param operation the operation name
     * @param targetField the field to write the result to
     * @return the calculation
     */
    public static FieldCalculation create(String operation, String targetField) {
        Function<String, FieldCalculation> constructor = operation == null ? null : OPERATIONS.get(operation);
        if (constructor == null) {
            return new UnknownCalculation(operation, targetField);
        }
        return constructor.apply(targetField);
    }

    /**
     * Create a calculation from a plan entry. An entry without a target field name has nowhere to write
     * its result; it is dropped with a diagnostic.
     *
     * @param args the plan entry
     * @param reader reads the entry's arguments and records their diagnostics
     * @return the calculation, or empty when the entry names no target field
     */
    public static Optional<FieldCalculation> fromArgs(Map<String, Object> args, PlanArgs reader) {
        if (args == null) {
            throw new IllegalArgumentException("Calculate entry cannot be null");
        }
        String targetField = reader.stringArg(args, NAME_ARG);
        String operation = reader.stringArg(args, OPERATION_ARG);
        if (targetField == null || targetField.isEmpty()) {
            reader.malformed("Calculate entry %s has no '%s'; skipped", args, NAME_ARG);
            return Optional.empty();
        }
        return Optional.of(create(operation, targetField));
    }

    /**
     * Operation names with a dedicated implementation.
     */
    public static Set<String> supportedOperations() {
        return OPERATIONS.keySet();
    }
}
