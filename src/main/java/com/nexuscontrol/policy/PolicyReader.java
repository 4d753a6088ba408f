package com.nexuscontrol.policy;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;

/**
 * Permissive reader for policy data arriving from outside (request bodies,
 * stored snapshots).
 *
 * Type mismatches fall back to defaults instead of failing: min_approvals
 * becomes 1, allowed_modes becomes [dry_run], capability and label lists become
 * empty, max_steps becomes unbounded. Semantic checks are left to the
 * {@link Policy} constructor, which still rejects invalid values.
 */
public final class PolicyReader {

    private static final BigInteger INT_MAX = BigInteger.valueOf(Integer.MAX_VALUE);
    private static final BigInteger INT_MIN = BigInteger.valueOf(Integer.MIN_VALUE);

    private PolicyReader() {
    }

    public static Policy fromMap(Map<String, ?> data) {
        Map<String, ?> source = data == null ? Map.of() : data;
        return new Policy(
            intOrDefault(source.get("min_approvals"), Policy.DEFAULT_MIN_APPROVALS),
            stringListOr(source.get("allowed_modes"), Policy.DEFAULT_ALLOWED_MODES),
            stringListOr(source.get("require_adapter_capabilities"), List.of()),
            intOrNull(source.get("max_steps")),
            stringListOr(source.get("labels"), List.of())
        );
    }

    /**
     * Reads only the keys that are present; absent or mistyped keys mean
     * "no override" for that field.
     */
    public static PolicyOverrides overridesFromMap(Map<String, ?> data) {
        if (data == null) {
            return PolicyOverrides.none();
        }
        return new PolicyOverrides(
            intOrNull(data.get("min_approvals")),
            stringListOr(data.get("allowed_modes"), null),
            stringListOr(data.get("require_adapter_capabilities"), null),
            intOrNull(data.get("max_steps")),
            stringListOr(data.get("labels"), null)
        );
    }

    static int intOrDefault(Object raw, int fallback) {
        return raw instanceof Number number ? clampToInt(number) : fallback;
    }

    static Integer intOrNull(Object raw) {
        return raw instanceof Number number ? clampToInt(number) : null;
    }

    /** Saturates at the int bounds; never wraps. */
    static int clampToInt(Number number) {
        if (number instanceof BigInteger big) {
            if (big.compareTo(INT_MAX) > 0) {
                return Integer.MAX_VALUE;
            }
            if (big.compareTo(INT_MIN) < 0) {
                return Integer.MIN_VALUE;
            }
            return big.intValue();
        }
        if (number instanceof Double || number instanceof Float || number instanceof BigDecimal) {
            double value = number.doubleValue();
            if (value >= Integer.MAX_VALUE) {
                return Integer.MAX_VALUE;
            }
            if (value <= Integer.MIN_VALUE) {
                return Integer.MIN_VALUE;
            }
            return (int) value;
        }
        long value = number.longValue();
        return (int) Math.max(Integer.MIN_VALUE, Math.min(Integer.MAX_VALUE, value));
    }

    static List<String> stringListOr(Object raw, List<String> fallback) {
        if (!(raw instanceof List<?> list)) {
            return fallback;
        }
        return list.stream().map(String::valueOf).toList();
    }
}
