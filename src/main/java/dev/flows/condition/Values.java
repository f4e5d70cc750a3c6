package dev.flows.condition;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Value semantics of the condition language. Values are {@code null}, {@link #UNDEFINED},
 * {@link Boolean}, {@link Double}, {@link String}, {@link List}, {@link Map}, {@link ScriptObject}
 * or {@link ScriptFunction}. Truthiness, equality and comparison follow JavaScript.
 */
final class Values {

    static final Object UNDEFINED = new Object() {
        @Override
        public String toString() {
            return "undefined";
        }
    };

    private Values() {}

    static boolean isNullish(Object value) {
        return value == null || value == UNDEFINED;
    }

    static boolean truthy(Object value) {
        if (isNullish(value)) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Double d) {
            return d != 0 && !d.isNaN();
        }
        if (value instanceof String s) {
            return !s.isEmpty();
        }
        return true;
    }

    /**
     * Bring host values (e.g. parsed JSON) into the value domain: all numbers become doubles.
     */
    static Object normalize(Object value) {
        if (value instanceof Double) {
            return value;
        }
        if (value instanceof Number n) {
            if (n instanceof BigDecimal || n instanceof BigInteger) {
                return Double.parseDouble(n.toString());
            }
            return n.doubleValue();
        }
        return value;
    }

    static double toNumber(Object value) {
        if (value == null) {
            return 0;
        }
        if (value == UNDEFINED) {
            return Double.NaN;
        }
        if (value instanceof Double d) {
            return d;
        }
        if (value instanceof Boolean b) {
            return b ? 1 : 0;
        }
        if (value instanceof String s) {
            String trimmed = s.trim();
            if (trimmed.isEmpty()) {
                return 0;
            }
            try {
                return Double.parseDouble(trimmed);
            } catch (NumberFormatException e) {
                return Double.NaN;
            }
        }
        return Double.NaN;
    }

    static boolean strictEquals(Object a, Object b) {
        if (a instanceof Double x && b instanceof Double y) {
            return x.doubleValue() == y.doubleValue();
        }
        if (a instanceof String || a instanceof Boolean) {
            return a.equals(b);
        }
        return a == b;
    }

    static boolean looseEquals(Object a, Object b) {
        if (isNullish(a) || isNullish(b)) {
            return isNullish(a) && isNullish(b);
        }
        if (isPrimitive(a) && isPrimitive(b) && a.getClass() != b.getClass()) {
            return toNumber(a) == toNumber(b);
        }
        return strictEquals(a, b);
    }

    static boolean compare(String op, Object a, Object b) {
        if (a instanceof String x && b instanceof String y) {
            int c = x.compareTo(y);
            return switch (op) {
                case "<" -> c < 0;
                case "<=" -> c <= 0;
                case ">" -> c > 0;
                case ">=" -> c >= 0;
                default -> throw new IllegalStateException("Not a comparison: " + op);
            };
        }
        double x = toNumber(a);
        double y = toNumber(b);
        return switch (op) {
            case "<" -> x < y;
            case "<=" -> x <= y;
            case ">" -> x > y;
            case ">=" -> x >= y;
            default -> throw new IllegalStateException("Not a comparison: " + op);
        };
    }

    static Object arithmetic(String op, Object a, Object b) {
        if ("+".equals(op) && (a instanceof String || b instanceof String)) {
            return display(a) + display(b);
        }
        double x = toNumber(a);
        double y = toNumber(b);
        return switch (op) {
            case "+" -> x + y;
            case "-" -> x - y;
            case "*" -> x * y;
            case "/" -> x / y;
            case "%" -> x % y;
            default -> throw new IllegalStateException("Not an arithmetic operator: " + op);
        };
    }

    static String display(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Double d) {
            if (d == Math.rint(d) && !Double.isInfinite(d)) {
                return Long.toString(d.longValue());
            }
            return d.toString();
        }
        if (value instanceof List<?> list) {
            return list.stream()
                .map(v -> isNullish(v) ? "" : display(v))
                .collect(Collectors.joining(","));
        }
        if (value instanceof Map<?, ?> || value instanceof ScriptObject) {
            return "[object Object]";
        }
        return value.toString();
    }

    static Object member(Object target, String name, boolean optional) {
        if (isNullish(target)) {
            if (optional) {
                return UNDEFINED;
            }
            throw new ConditionRuntimeException(
                "Cannot read properties of %s (reading '%s')".formatted(display(target), name));
        }
        if (target instanceof ScriptObject obj) {
            return obj.property(name);
        }
        if (target instanceof Map<?, ?> map) {
            return map.containsKey(name) ? normalize(map.get(name)) : UNDEFINED;
        }
        if (target instanceof List<?> list) {
            if ("length".equals(name)) {
                return (double) list.size();
            }
            int index = arrayIndex(name);
            return index >= 0 && index < list.size() ? normalize(list.get(index)) : UNDEFINED;
        }
        if (target instanceof String s) {
            if ("length".equals(name)) {
                return (double) s.length();
            }
            int index = arrayIndex(name);
            return index >= 0 && index < s.length() ? String.valueOf(s.charAt(index)) : UNDEFINED;
        }
        return UNDEFINED;
    }

    static Object index(Object target, Object key, boolean optional) {
        return member(target, display(normalize(key)), optional);
    }

    static Object invoke(Object target, String method, List<Object> args, boolean optional) {
        if (isNullish(target)) {
            if (optional) {
                return UNDEFINED;
            }
            throw new ConditionRuntimeException(
                "Cannot read properties of %s (reading '%s')".formatted(display(target), method));
        }
        if (target instanceof List<?> list) {
            return invokeOnList(list, method, args);
        }
        if (target instanceof String s) {
            return invokeOnString(s, method, args);
        }
        throw new ConditionRuntimeException("'%s' is not a function".formatted(method));
    }

    private static Object invokeOnList(List<?> list, String method, List<Object> args) {
        switch (method) {
            case "every" -> {
                ScriptFunction fn = functionArg(method, args);
                for (Object item : list) {
                    if (!truthy(fn.call(normalize(item)))) {
                        return false;
                    }
                }
                return true;
            }
            case "some" -> {
                ScriptFunction fn = functionArg(method, args);
                for (Object item : list) {
                    if (truthy(fn.call(normalize(item)))) {
                        return true;
                    }
                }
                return false;
            }
            case "filter" -> {
                ScriptFunction fn = functionArg(method, args);
                List<Object> kept = new ArrayList<>();
                for (Object item : list) {
                    Object value = normalize(item);
                    if (truthy(fn.call(value))) {
                        kept.add(value);
                    }
                }
                return kept;
            }
            case "includes" -> {
                Object needle = args.isEmpty() ? UNDEFINED : args.get(0);
                for (Object item : list) {
                    if (strictEquals(normalize(item), needle)) {
                        return true;
                    }
                }
                return false;
            }
            default -> throw new ConditionRuntimeException("'%s' is not a function".formatted(method));
        }
    }

    private static Object invokeOnString(String s, String method, List<Object> args) {
        String arg = args.isEmpty() ? "undefined" : display(args.get(0));
        return switch (method) {
            case "includes" -> s.contains(arg);
            case "startsWith" -> s.startsWith(arg);
            case "endsWith" -> s.endsWith(arg);
            case "toLowerCase" -> s.toLowerCase(Locale.ROOT);
            case "toUpperCase" -> s.toUpperCase(Locale.ROOT);
            case "trim" -> s.trim();
            default -> throw new ConditionRuntimeException("'%s' is not a function".formatted(method));
        };
    }

    private static ScriptFunction functionArg(String method, List<Object> args) {
        if (args.isEmpty() || !(args.get(0) instanceof ScriptFunction fn)) {
            throw new ConditionRuntimeException("%s requires a function argument".formatted(method));
        }
        return fn;
    }

    private static boolean isPrimitive(Object value) {
        return value instanceof Double || value instanceof String || value instanceof Boolean;
    }

    private static int arrayIndex(String name) {
        if (name.isEmpty() || name.length() > 9) {
            return -1;
        }
        for (int i = 0; i < name.length(); i++) {
            if (!Character.isDigit(name.charAt(i))) {
                return -1;
            }
        }
        return Integer.parseInt(name);
    }
}
