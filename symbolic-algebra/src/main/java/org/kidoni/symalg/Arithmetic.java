package org.kidoni.symalg;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAccumulator;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Numeric model shared by the {@link Evaluator} and the constant folding of the {@link Simplifier}.
 * <p>
 * Values are {@link BigDecimal}s. Sums, differences, products and integer powers are exact. A quotient
 * is exact when it terminates, otherwise it is rounded to {@link #CONTEXT}. The {@code *Exact} variants
 * return empty instead of rounding, which is what lets folding agree with evaluation.
 */
public final class Arithmetic {
    private static final Logger LOG = LoggerFactory.getLogger(Arithmetic.class);

    static final String PRECISION_PROPERTY = "symalg.precision";
    static final String PRECISION_ENV = "SYMALG_PRECISION";

    /**
     * Rounding applied to non-terminating quotients, fixed when the class loads.
     */
    public static final MathContext CONTEXT = resolveContext(System.getProperty(PRECISION_PROPERTY), System.getenv(PRECISION_ENV));

    // BigDecimal.pow accepts 0 through 999999999
    private static final int MAX_EXACT_EXPONENT = 999_999_999;

    private Arithmetic() {
    }

    static MathContext resolveContext(final String property, final String env) {
        final String configured = property != null ? property : env;
        if (configured == null || configured.isBlank()) {
            return MathContext.DECIMAL128;
        }

        final int digits;
        try {
            digits = Integer.parseInt(configured.trim());
        }
        catch (NumberFormatException e) {
            LOG.warn("ignoring unparseable precision '{}', using {} digits", configured, MathContext.DECIMAL128.getPrecision());
            return MathContext.DECIMAL128;
        }

        if (digits <= 0) {
            LOG.warn("ignoring non-positive precision {}, using {} digits", digits, MathContext.DECIMAL128.getPrecision());
            return MathContext.DECIMAL128;
        }

        LOG.debug("using {} significant digits for inexact division", digits);
        return new MathContext(digits, RoundingMode.HALF_EVEN);
    }

    /**
     * Canonical representation of a value: no trailing fractional zeros and never a negative scale, so that
     * {@code 2.0} becomes {@code 2} and {@code 100} stays {@code 100} rather than {@code 1E+2}.
     */
    static BigDecimal normalize(final BigDecimal value) {
        BigDecimal stripped = value.stripTrailingZeros();
        return stripped.scale() < 0 ? stripped.setScale(0) : stripped;
    }

    static BigDecimal toDecimal(final Number value) {
        Objects.requireNonNull(value, "value");
        if (value instanceof BigDecimal d) {
            return d;
        }
        if (value instanceof BigInteger i) {
            return new BigDecimal(i);
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte
                || value instanceof AtomicLong || value instanceof AtomicInteger
                || value instanceof LongAdder || value instanceof LongAccumulator) {
            return BigDecimal.valueOf(value.longValue());
        }

        double d = value.doubleValue();
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            throw new IllegalArgumentException("not a finite number: " + value);
        }
        return BigDecimal.valueOf(d);
    }

    static BigDecimal add(final BigDecimal a, final BigDecimal b) {
        return inRange(() -> a.add(b), () -> a + " + " + b);
    }

    static BigDecimal subtract(final BigDecimal a, final BigDecimal b) {
        return inRange(() -> a.subtract(b), () -> a + " - " + b);
    }

    static BigDecimal multiply(final BigDecimal a, final BigDecimal b) {
        return inRange(() -> a.multiply(b), () -> a + " * " + b);
    }

    static Optional<BigDecimal> addExact(final BigDecimal a, final BigDecimal b) {
        return representable(() -> a.add(b));
    }

    static Optional<BigDecimal> subtractExact(final BigDecimal a, final BigDecimal b) {
        return representable(() -> a.subtract(b));
    }

    static Optional<BigDecimal> multiplyExact(final BigDecimal a, final BigDecimal b) {
        return representable(() -> a.multiply(b));
    }

    static BigDecimal divide(final BigDecimal dividend, final BigDecimal divisor) {
        if (divisor.signum() == 0) {
            throw new DivisionByZeroException("division by zero: " + dividend.toPlainString() + " / 0");
        }
        return divideExact(dividend, divisor).orElseGet(() -> inRange(() -> dividend.divide(divisor, CONTEXT),
                () -> dividend + " / " + divisor));
    }

    /**
     * The quotient if it has a terminating decimal expansion; empty for a zero divisor or a repeating quotient.
     */
    static Optional<BigDecimal> divideExact(final BigDecimal dividend, final BigDecimal divisor) {
        if (divisor.signum() == 0) {
            return Optional.empty();
        }
        // a repeating quotient is reported as an ArithmeticException too
        return representable(() -> dividend.divide(divisor));
    }

    /**
     * @throws InvalidExponentException if the power has no finite real value, or its value is outside the range a
     *                                  {@link BigDecimal} can hold
     */
    static BigDecimal pow(final BigDecimal base, final BigDecimal exponent) {
        if (base.signum() == 0 && exponent.signum() < 0) {
            throw new InvalidExponentException("zero cannot be raised to the negative power " + exponent.toPlainString());
        }

        Optional<Integer> integral = integralExponent(exponent);
        if (integral.isPresent()) {
            int n = integral.get();
            BigDecimal power = inRange(() -> integerPower(base, Math.abs(n)),
                    () -> base + " ** " + exponent);
            return n >= 0 ? power : divide(BigDecimal.ONE, power);
        }

        if (base.signum() < 0 && !isInteger(exponent)) {
            throw new InvalidExponentException("no real value for " + base.toPlainString() + " ** " + exponent.toPlainString());
        }

        double result = Math.pow(base.doubleValue(), exponent.doubleValue());
        if (Double.isNaN(result) || Double.isInfinite(result)) {
            throw new InvalidExponentException("no finite real value for " + base.toPlainString() + " ** " + exponent.toPlainString());
        }
        return BigDecimal.valueOf(result);
    }

    /**
     * The power if it can be computed without rounding; empty otherwise, including every case {@link #pow} rejects.
     */
    static Optional<BigDecimal> powExact(final BigDecimal base, final BigDecimal exponent) {
        Optional<Integer> integral = integralExponent(exponent);
        if (integral.isEmpty()) {
            return Optional.empty();
        }

        int n = integral.get();
        Optional<BigDecimal> power = representable(() -> integerPower(base, Math.abs(n)));
        return n >= 0 ? power : power.flatMap(p -> divideExact(BigDecimal.ONE, p));
    }

    /**
     * {@code base ** n} for {@code n >= 0}. Results whose scale or unscaled value would not fit are refused before
     * computing them.
     */
    private static BigDecimal integerPower(final BigDecimal base, final int n) {
        long scale = (long) base.scale() * n;
        long bits = (long) base.unscaledValue().bitLength() * n;
        if (scale != (int) scale || bits > Integer.MAX_VALUE) {
            throw new ArithmeticException("power out of range");
        }
        return base.pow(n);
    }

    private static BigDecimal inRange(final Supplier<BigDecimal> computation, final Supplier<String> description) {
        try {
            return normalize(computation.get());
        }
        catch (ArithmeticException e) {
            throw new InvalidExponentException(description.get() + " is outside the representable range", e);
        }
    }

    private static Optional<BigDecimal> representable(final Supplier<BigDecimal> computation) {
        try {
            return Optional.of(normalize(computation.get()));
        }
        catch (ArithmeticException e) {
            return Optional.empty();
        }
    }

    private static boolean isInteger(final BigDecimal value) {
        return value.stripTrailingZeros().scale() <= 0;
    }

    private static Optional<Integer> integralExponent(final BigDecimal exponent) {
        BigDecimal normalized = exponent.stripTrailingZeros();
        if (!isInteger(normalized) || normalized.abs().compareTo(BigDecimal.valueOf(MAX_EXACT_EXPONENT)) > 0) {
            return Optional.empty();
        }
        return Optional.of(normalized.intValueExact());
    }
}
