package com.stereoselect.model;

import lombok.Data;
import lombok.Builder;
import lombok.AllArgsConstructor;
import lombok.NoArgsConstructor;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.stereoselect.exception.ConfigurationException;

import java.util.List;

/**
 * Filter condition over footprint fields.
 * The key names a footprint column: id, strip_id and instrument resolve to
 * the fixed fields, anything else to an attribute (cloud_cover, off_nadir, ...).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FilterCondition {

    public enum Operator {
        EQUALS,          // ==
        NOT_EQUALS,      // !=
        GREATER_THAN,    // >
        GREATER_EQUAL,   // >=
        LESS_THAN,       // <
        LESS_EQUAL,      // <=
        IN,              // in (list)
        NOT_IN,          // not in (list)
        STARTS_WITH,     // string starts with
        EXISTS,          // key exists
        NOT_EXISTS       // key does not exist
    }

    public enum LogicalOperator {
        AND,
        OR
    }

    private String key;
    private Operator operator;
    private Object value;
    private List<Object> values;           // for IN/NOT_IN

    private List<FilterCondition> conditions;
    private LogicalOperator logicalOperator;

    /**
     * Check if the footprint matches this condition
     */
    public boolean matches(Footprint footprint) {
        if (footprint == null) {
            return false;
        }

        if (conditions != null && !conditions.isEmpty()) {
            return evaluateComplexCondition(footprint);
        }

        return evaluateSimpleCondition(footprint);
    }

    private boolean evaluateComplexCondition(Footprint footprint) {
        if (logicalOperator == LogicalOperator.OR) {
            return conditions.stream().anyMatch(condition -> condition.matches(footprint));
        }
        return conditions.stream().allMatch(condition -> condition.matches(footprint));
    }

    private boolean evaluateSimpleCondition(Footprint footprint) {
        if (operator == null) {
            throw new IllegalArgumentException("Filter on '" + key + "' has no operator");
        }
        Object actualValue = getActualValue(footprint);

        switch (operator) {
            case EXISTS:
                return actualValue != null;

            case NOT_EXISTS:
                return actualValue == null;

            case EQUALS:
                return objectsEqual(actualValue, value);

            case NOT_EQUALS:
                return !objectsEqual(actualValue, value);

            case GREATER_THAN:
                return comparable(actualValue) && compareNumbers(actualValue, value) > 0;

            case GREATER_EQUAL:
                return comparable(actualValue) && compareNumbers(actualValue, value) >= 0;

            case LESS_THAN:
                return comparable(actualValue) && compareNumbers(actualValue, value) < 0;

            case LESS_EQUAL:
                return comparable(actualValue) && compareNumbers(actualValue, value) <= 0;

            case IN:
                return values != null && values.stream().anyMatch(v -> objectsEqual(actualValue, v));

            case NOT_IN:
                return values == null || values.stream().noneMatch(v -> objectsEqual(actualValue, v));

            case STARTS_WITH:
                return actualValue != null && value != null &&
                       actualValue.toString().startsWith(value.toString());

            default:
                return false;
        }
    }

    /**
     * Reject a condition tree that could not be evaluated against any footprint.
     *
     * @throws ConfigurationException describing the first malformed condition
     */
    public void validate() {
        if (conditions != null && !conditions.isEmpty()) {
            for (FilterCondition condition : conditions) {
                if (condition == null) {
                    throw new ConfigurationException("Filter contains an empty condition");
                }
                condition.validate();
            }
            return;
        }

        if (key == null || key.isBlank()) {
            throw new ConfigurationException("Filter condition has no key");
        }
        if (operator == null) {
            throw new ConfigurationException("Filter on '" + key + "' has no operator");
        }
        switch (operator) {
            case GREATER_THAN:
            case GREATER_EQUAL:
            case LESS_THAN:
            case LESS_EQUAL:
                if (convertToNumber(value) == null) {
                    throw new ConfigurationException("Filter on '" + key + "' needs a numeric value for "
                                                     + operator + ", got " + value);
                }
                break;
            case IN:
            case NOT_IN:
                if (values == null) {
                    throw new ConfigurationException("Filter on '" + key + "' needs a values list for " + operator);
                }
                break;
            default:
                break;
        }
    }

    private Object getActualValue(Footprint footprint) {
        if (key == null) {
            return null;
        }
        switch (key) {
            case "id":
                return footprint.getId();
            case "strip_id":
                return footprint.getStripId();
            case "instrument":
                return footprint.getInstrument();
            default:
                return footprint.getAttribute(key);
        }
    }

    // a missing or non-numeric column never satisfies an ordering comparison
    private boolean comparable(Object actualValue) {
        return convertToNumber(actualValue) != null;
    }

    private boolean objectsEqual(Object a, Object b) {
        if (a == null && b == null) return true;
        if (a == null || b == null) return false;

        Number numA = convertToNumber(a);
        Number numB = convertToNumber(b);
        if (numA != null && numB != null && (a instanceof Number || b instanceof Number)) {
            return Double.compare(numA.doubleValue(), numB.doubleValue()) == 0;
        }

        return a.toString().equals(b.toString());
    }

    private int compareNumbers(Object a, Object b) {
        Number numA = convertToNumber(a);
        Number numB = convertToNumber(b);

        if (numA == null || numB == null) {
            throw new IllegalArgumentException("Cannot compare non-numeric values: " + a + ", " + b);
        }

        return Double.compare(numA.doubleValue(), numB.doubleValue());
    }

    private Number convertToNumber(Object obj) {
        if (obj instanceof Number) {
            return (Number) obj;
        }
        if (obj instanceof String) {
            try {
                return Double.parseDouble(((String) obj).trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    // Builder helper methods for common conditions

    public static FilterCondition equalTo(String key, Object value) {
        return FilterCondition.builder()
                .key(key)
                .operator(Operator.EQUALS)
                .value(value)
                .build();
    }

    public static FilterCondition lessThan(String key, Number value) {
        return FilterCondition.builder()
                .key(key)
                .operator(Operator.LESS_THAN)
                .value(value)
                .build();
    }

    public static FilterCondition greaterThan(String key, Number value) {
        return FilterCondition.builder()
                .key(key)
                .operator(Operator.GREATER_THAN)
                .value(value)
                .build();
    }

    public static FilterCondition in(String key, List<?> values) {
        return FilterCondition.builder()
                .key(key)
                .operator(Operator.IN)
                .values(List.copyOf(values))
                .build();
    }

    public static FilterCondition and(List<FilterCondition> conditions) {
        return FilterCondition.builder()
                .conditions(conditions)
                .logicalOperator(LogicalOperator.AND)
                .build();
    }

    public static FilterCondition or(List<FilterCondition> conditions) {
        return FilterCondition.builder()
                .conditions(conditions)
                .logicalOperator(LogicalOperator.OR)
                .build();
    }
}
