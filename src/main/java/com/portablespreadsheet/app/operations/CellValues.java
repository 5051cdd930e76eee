package com.portablespreadsheet.app.operations;

import com.portablespreadsheet.app.exceptions.InvalidTypeException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Arithmetic on cell values.
 * Integral operands give integral results (Integer while both operands are
 * Integer and the result fits, Long otherwise); any floating operand gives
 * a Double, as does an integral result that overflows a long. Values that cannot take part in arithmetic raise
 * {@link InvalidTypeException}.
 */
public final class CellValues {

    private static final int IRR_ITERATIONS = 100;
    private static final double IRR_TOLERANCE = 1e-10;

    private CellValues() {
    }

    public static Object add(Object left, Object right) {
        if (isIntegral(left) && isIntegral(right)) {
            try {
                return narrow(Math.addExact(toLong(left), toLong(right)), left, right);
            } catch (ArithmeticException e) {
                // falls through to floating point
            }
        }
        return toDouble(left, "add") + toDouble(right, "add");
    }

    public static Object subtract(Object left, Object right) {
        if (isIntegral(left) && isIntegral(right)) {
            try {
                return narrow(Math.subtractExact(toLong(left), toLong(right)), left, right);
            } catch (ArithmeticException e) {
                // falls through to floating point
            }
        }
        return toDouble(left, "subtract") - toDouble(right, "subtract");
    }

    public static Object multiply(Object left, Object right) {
        if (isIntegral(left) && isIntegral(right)) {
            try {
                return narrow(Math.multiplyExact(toLong(left), toLong(right)), left, right);
            } catch (ArithmeticException e) {
                // falls through to floating point
            }
        }
        return toDouble(left, "multiply") * toDouble(right, "multiply");
    }

    // Always a true division
    public static Object divide(Object left, Object right) {
        return toDouble(left, "divide") / toDouble(right, "divide");
    }

    /**
     * Modulo with the sign of the divisor, as spreadsheets and Python compute it.
     */
    public static Object modulo(Object left, Object right) {
        if (isIntegral(left) && isIntegral(right)) {
            long divisor = toLong(right);
            if (divisor == 0) {
                throw new InvalidTypeException("Modulo by zero");
            }
            return narrow(Math.floorMod(toLong(left), divisor), left, right);
        }
        double dividend = toDouble(left, "modulo");
        double divisor = toDouble(right, "modulo");
        return dividend - divisor * Math.floor(dividend / divisor);
    }

    public static Object power(Object left, Object right) {
        double result = Math.pow(toDouble(left, "power"), toDouble(right, "power"));
        if (isIntegral(left) && isIntegral(right) && toLong(right) >= 0 && Math.abs(result) < 0x1p53) {
            return narrow((long) result, left, right);
        }
        return result;
    }

    public static Object equalTo(Object left, Object right) {
        if (left instanceof Number && right instanceof Number) {
            return compareNumbers(left, right) == 0;
        }
        return Objects.equals(left, right);
    }

    public static Object notEqualTo(Object left, Object right) {
        return !((Boolean) equalTo(left, right));
    }

    public static Object greaterThan(Object left, Object right) {
        return compare(left, right, "compare") > 0;
    }

    public static Object greaterThanOrEqualTo(Object left, Object right) {
        return compare(left, right, "compare") >= 0;
    }

    public static Object lessThan(Object left, Object right) {
        return compare(left, right, "compare") < 0;
    }

    public static Object lessThanOrEqualTo(Object left, Object right) {
        return compare(left, right, "compare") <= 0;
    }

    public static Object logicalConjunction(Object left, Object right) {
        return isTruthy(left) && isTruthy(right);
    }

    public static Object logicalDisjunction(Object left, Object right) {
        return isTruthy(left) || isTruthy(right);
    }

    public static Object concatenate(Object left, Object right) {
        return Objects.toString(left, "") + Objects.toString(right, "");
    }

    public static Object logarithm(Object value) {
        return Math.log(toDouble(value, "logarithm"));
    }

    public static Object exponential(Object value) {
        return Math.exp(toDouble(value, "exponential"));
    }

    public static Object ceil(Object value) {
        return Math.ceil(toDouble(value, "ceil"));
    }

    public static Object floor(Object value) {
        return Math.floor(toDouble(value, "floor"));
    }

    // Halves go to the even neighbour
    public static Object round(Object value) {
        return Math.rint(toDouble(value, "round"));
    }

    public static Object abs(Object value) {
        if (isIntegral(value)) {
            try {
                return narrow(Math.absExact(toLong(value)), value, value);
            } catch (ArithmeticException e) {
                // falls through to floating point
            }
        }
        return Math.abs(toDouble(value, "abs"));
    }

    public static Object sqrt(Object value) {
        return Math.sqrt(toDouble(value, "sqrt"));
    }

    public static Object signum(Object value) {
        if (isIntegral(value)) {
            return Long.signum(toLong(value));
        }
        return Math.signum(toDouble(value, "signum"));
    }

    public static Object logicalNegation(Object value) {
        return !isTruthy(value);
    }

    // Aggregates

    public static Object sum(List<Object> values) {
        if (allIntegral(values)) {
            try {
                long total = 0;
                for (Object value : values) {
                    total = Math.addExact(total, toLong(value));
                }
                return narrow(total, values);
            } catch (ArithmeticException e) {
                // falls through to floating point
            }
        }
        double total = 0;
        for (Object value : values) {
            total += toDouble(value, "sum");
        }
        return total;
    }

    public static Object product(List<Object> values) {
        if (allIntegral(values)) {
            try {
                long total = 1;
                for (Object value : values) {
                    total = Math.multiplyExact(total, toLong(value));
                }
                return narrow(total, values);
            } catch (ArithmeticException e) {
                // falls through to floating point
            }
        }
        double total = 1;
        for (Object value : values) {
            total *= toDouble(value, "product");
        }
        return total;
    }

    public static Object mean(List<Object> values) {
        requireMembers(values, "mean");
        return toDouble(sum(values), "mean") / values.size();
    }

    public static Object minimum(List<Object> values) {
        requireMembers(values, "minimum");
        Object best = values.get(0);
        for (Object value : values) {
            if (compareNumbers(value, best) < 0) {
                best = value;
            }
        }
        return best;
    }

    public static Object maximum(List<Object> values) {
        requireMembers(values, "maximum");
        Object best = values.get(0);
        for (Object value : values) {
            if (compareNumbers(value, best) > 0) {
                best = value;
            }
        }
        return best;
    }

    /**
     * Population standard deviation.
     */
    public static Object stdev(List<Object> values) {
        double mean = (Double) mean(values);
        double squares = 0;
        for (Object value : values) {
            double deviation = toDouble(value, "stdev") - mean;
            squares += deviation * deviation;
        }
        return Math.sqrt(squares / values.size());
    }

    public static Object median(List<Object> values) {
        requireMembers(values, "median");
        List<Double> sorted = new ArrayList<>(values.size());
        for (Object value : values) {
            sorted.add(toDouble(value, "median"));
        }
        Collections.sort(sorted);
        int middle = sorted.size() / 2;
        if (sorted.size() % 2 == 1) {
            return sorted.get(middle);
        }
        return (sorted.get(middle - 1) + sorted.get(middle)) / 2;
    }

    public static Object count(List<Object> values) {
        return values.size();
    }

    /**
     * Internal rate of return of the cash flows, one per period, starting
     * with period zero. NaN when the flows have no sign change or no root
     * was found.
     */
    public static Object irr(List<Object> values) {
        requireMembers(values, "irr");
        double[] flows = new double[values.size()];
        boolean positive = false;
        boolean negative = false;
        for (int i = 0; i < flows.length; i++) {
            flows[i] = toDouble(values.get(i), "irr");
            positive |= flows[i] > 0;
            negative |= flows[i] < 0;
        }
        if (!positive || !negative) {
            return Double.NaN;
        }
        double rate = 0.1;
        for (int i = 0; i < IRR_ITERATIONS; i++) {
            double derivative = netPresentValueDerivative(flows, rate);
            if (derivative == 0 || Double.isNaN(derivative)) {
                break;
            }
            double next = rate - netPresentValue(flows, rate) / derivative;
            if (next <= -1 || Double.isNaN(next) || Double.isInfinite(next)) {
                break;
            }
            if (Math.abs(next - rate) < IRR_TOLERANCE) {
                return next;
            }
            rate = next;
        }
        return bisect(flows);
    }

    /**
     * Position of the first non-negative member, 0 if every member is negative.
     */
    public static Object matchNegativeBeforePositive(List<Object> values) {
        requireMembers(values, "matchNegativeBeforePositive");
        for (int i = 0; i < values.size(); i++) {
            if (toDouble(values.get(i), "matchNegativeBeforePositive") >= 0) {
                return i;
            }
        }
        return 0;
    }

    public static boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue() != 0;
        }
        if (value instanceof String) {
            return !((String) value).isEmpty();
        }
        return true;
    }

    /**
     * Whole-number value of a row or column skip.
     */
    public static int toIndex(Object value, String operation) {
        double number = toDouble(value, operation);
        if (number != Math.rint(number)) {
            throw new InvalidTypeException("Operation " + operation + " needs a whole number, got " + value);
        }
        return (int) number;
    }

    private static double netPresentValue(double[] flows, double rate) {
        double total = 0;
        for (int t = 0; t < flows.length; t++) {
            total += flows[t] / Math.pow(1 + rate, t);
        }
        return total;
    }

    private static double netPresentValueDerivative(double[] flows, double rate) {
        double total = 0;
        for (int t = 1; t < flows.length; t++) {
            total -= t * flows[t] / Math.pow(1 + rate, t + 1);
        }
        return total;
    }

    private static double bisect(double[] flows) {
        double low = -0.999999;
        double high = 10;
        double lowValue = netPresentValue(flows, low);
        if (Math.signum(lowValue) == Math.signum(netPresentValue(flows, high))) {
            return Double.NaN;
        }
        for (int i = 0; i < 200; i++) {
            double middle = (low + high) / 2;
            double middleValue = netPresentValue(flows, middle);
            if (Math.abs(high - low) < IRR_TOLERANCE) {
                return middle;
            }
            if (Math.signum(middleValue) == Math.signum(lowValue)) {
                low = middle;
                lowValue = middleValue;
            } else {
                high = middle;
            }
        }
        return (low + high) / 2;
    }

    private static void requireMembers(List<Object> values, String operation) {
        if (values.isEmpty()) {
            throw new InvalidTypeException("Operation " + operation + " needs at least one value");
        }
    }

    private static int compare(Object left, Object right, String operation) {
        if (left instanceof Number && right instanceof Number) {
            return compareNumbers(left, right);
        }
        if (left instanceof String && right instanceof String) {
            return ((String) left).compareTo((String) right);
        }
        if (left instanceof Boolean && right instanceof Boolean) {
            return Boolean.compare((Boolean) left, (Boolean) right);
        }
        throw new InvalidTypeException("Cannot " + operation + " " + describe(left) + " and " + describe(right));
    }

    private static int compareNumbers(Object left, Object right) {
        if (isIntegral(left) && isIntegral(right)) {
            return Long.compare(toLong(left), toLong(right));
        }
        return Double.compare(toDouble(left, "compare"), toDouble(right, "compare"));
    }

    private static boolean isIntegral(Object value) {
        return value instanceof Integer || value instanceof Long
                || value instanceof Short || value instanceof Byte;
    }

    private static boolean allIntegral(List<Object> values) {
        for (Object value : values) {
            if (!isIntegral(value)) {
                return false;
            }
        }
        return true;
    }

    private static long toLong(Object value) {
        return ((Number) value).longValue();
    }

    private static double toDouble(Object value, String operation) {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof Boolean) {
            return (Boolean) value ? 1 : 0;
        }
        throw new InvalidTypeException("Operation " + operation + " cannot use " + describe(value));
    }

    private static Number narrow(long result, Object left, Object right) {
        if (!(left instanceof Long) && !(right instanceof Long)
                && result >= Integer.MIN_VALUE && result <= Integer.MAX_VALUE) {
            return (int) result;
        }
        return result;
    }

    private static Number narrow(long result, List<Object> values) {
        for (Object value : values) {
            if (value instanceof Long) {
                return result;
            }
        }
        if (result >= Integer.MIN_VALUE && result <= Integer.MAX_VALUE) {
            return (int) result;
        }
        return result;
    }

    private static String describe(Object value) {
        return value == null ? "an empty value" : value.getClass().getSimpleName() + " " + value;
    }
}
