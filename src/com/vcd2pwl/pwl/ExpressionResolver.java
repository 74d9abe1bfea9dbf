/*
 * Copyright (c) 2025, Advanced Micro Devices, Inc.
 * All rights reserved.
 *
 * This file is part of VCD2PWL.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 */

package com.vcd2pwl.pwl;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Formats PWL time points. An expression is a sum of numeric literals and named
 * parameters, e.g. "12.5 + trf". Literals are added up, scaled and given a unit suffix;
 * parameters are replaced by their bound values and appended in the order written:
 * {@code resolve("12.5 + trf", {trf=1}, 1, "ns")} gives {@code "12.5ns+1"}.
 */
public class ExpressionResolver {

    private static final Pattern SYMBOL = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    /**
     * Formats a single time value: {@code resolve(5.0, 1, "ns")} gives {@code "5ns"}.
     * @param value The time value.
     * @param baseMultiplier Scale applied to the value.
     * @param unit Unit suffix, may be null for none.
     * @return The formatted time.
     */
    public static String resolve(double value, BigDecimal baseMultiplier, String unit) {
        return resolve(formatNumber(value), Collections.emptyMap(), baseMultiplier, unit);
    }

    /**
     * Evaluates a sum of literals and parameters.
     * @param expression The expression, only '+' is supported as operator.
     * @param bindings Values of the parameters that may appear in the expression.
     * @param baseMultiplier Scale applied to the literal part.
     * @param unit Unit suffix of the literal part, may be null for none.
     * @return The formatted expression without whitespace.
     * @throws IllegalArgumentException If a term is empty, is not a number or a bound
     * parameter.
     */
    public static String resolve(String expression, Map<String, BigDecimal> bindings, BigDecimal baseMultiplier,
                                 String unit) {
        BigDecimal literal = null;
        List<BigDecimal> parameters = new ArrayList<>();
        for (String term : expression.split("\\+", -1)) {
            term = term.trim();
            if (term.isEmpty()) {
                throw new IllegalArgumentException("ERROR: Empty term in expression '" + expression + "'");
            }
            if (SYMBOL.matcher(term).matches()) {
                BigDecimal value = bindings.get(term);
                if (value == null) {
                    throw new IllegalArgumentException("ERROR: Unbound parameter '" + term + "' in expression '"
                            + expression + "'");
                }
                parameters.add(value);
                continue;
            }
            BigDecimal value;
            try {
                value = new BigDecimal(term);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("ERROR: Unsupported term '" + term + "' in expression '"
                        + expression + "'", e);
            }
            literal = literal == null ? value : literal.add(value);
        }

        StringBuilder sb = new StringBuilder();
        if (literal != null) {
            sb.append(formatNumber(literal.multiply(baseMultiplier)));
            if (unit != null) {
                sb.append(unit);
            }
        }
        for (BigDecimal p : parameters) {
            if (sb.length() > 0) {
                sb.append('+');
            }
            sb.append(formatNumber(p));
        }
        return sb.toString();
    }

    /**
     * Renders a number with the fewest digits: trailing fractional zeros and a trailing
     * decimal point are dropped ({@code 5.0 -> "5"}, {@code 5.250 -> "5.25"}). Never uses
     * exponent notation.
     * @param value The number.
     * @return The text.
     */
    public static String formatNumber(BigDecimal value) {
        if (value.signum() == 0) {
            return "0";
        }
        return value.stripTrailingZeros().toPlainString();
    }

    public static String formatNumber(double value) {
        return formatNumber(BigDecimal.valueOf(value));
    }
}
