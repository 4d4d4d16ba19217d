package io.kestra.plugin.etl.engine;

import com.amazon.ion.IonFloat;
import com.amazon.ion.IonValue;
import io.kestra.plugin.etl.MergeException;
import io.kestra.plugin.etl.graph.AggregateKind;
import io.kestra.plugin.etl.graph.AggregateSpec;
import io.kestra.plugin.etl.ion.CastException;
import io.kestra.plugin.etl.ion.ColumnType;
import io.kestra.plugin.etl.ion.IonValueUtils;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Instant;
import java.util.Objects;

/**
 * Mutable state of one aggregate output for one group.
 * <p>
 * Sums are kept as exact decimals, so {@link #combine} is commutative and associative and
 * the finalized value does not depend on how records were partitioned. Average keeps a sum
 * and a count and divides only in {@link #finish()}. Min and max break ties between values
 * that compare equal but render differently (1.0 and 1.00) on their text form.
 * <p>
 * Infinite and NaN floats cannot be held as decimals. A sum or average that sees one is
 * tracked as a double, follows IEEE arithmetic from then on and finalizes to that float.
 * Min and max over a FLOAT column order values with {@link Double#compare}.
 * <p>
 * Not thread-safe: an accumulator is owned by the worker folding its partition until the
 * partial result is handed to the merger.
 */
public final class AggregateAccumulator {
    private final AggregateSpec spec;
    private final ColumnType inputType;
    private long count;
    private BigDecimal sum;
    private Double nonFiniteSum;
    private IonValue extreme;
    private Object extremeKey;

    public AggregateAccumulator(AggregateSpec spec, ColumnType inputType) {
        this.spec = Objects.requireNonNull(spec, "spec is required");
        this.inputType = inputType;
    }

    public AggregateSpec spec() {
        return spec;
    }

    public ColumnType inputType() {
        return inputType;
    }

    public long count() {
        return count;
    }

    /**
     * Folds one value of the input column. For a row count the value is ignored.
     */
    public void add(IonValue value) throws CastException {
        if (spec.countsRows()) {
            count++;
            return;
        }
        if (IonValueUtils.isNull(value)) {
            return;
        }
        switch (spec.kind()) {
            case COUNT -> count++;
            case SUM -> addNumber(value);
            case AVERAGE -> {
                addNumber(value);
                count++;
            }
            case MIN, MAX -> offer(IonValueUtils.cloneValue(value), comparableKey(value));
        }
    }

    /**
     * Folds another accumulator of the same aggregate into this one. The other accumulator
     * is left untouched.
     */
    public void combine(AggregateAccumulator other) throws MergeException {
        if (!spec.equals(other.spec) || inputType != other.inputType) {
            throw new MergeException("Cannot combine " + spec + " over " + inputType
                + " with " + other.spec + " over " + other.inputType);
        }
        count += other.count;
        if (other.sum != null) {
            addToSum(other.sum);
        }
        if (other.nonFiniteSum != null) {
            addNonFinite(other.nonFiniteSum);
        }
        if (other.extreme != null) {
            offer(IonValueUtils.cloneValue(other.extreme), other.extremeKey);
        }
    }

    public AggregateAccumulator copy() {
        AggregateAccumulator copy = new AggregateAccumulator(spec, inputType);
        copy.count = count;
        copy.sum = sum;
        copy.nonFiniteSum = nonFiniteSum;
        copy.extreme = IonValueUtils.cloneValue(extreme);
        copy.extremeKey = extremeKey;
        return copy;
    }

    /**
     * Finalized value, typed as {@link AggregateKind#outputType(ColumnType)}. A sum over no
     * value is zero; average, min and max over no value are null.
     */
    public IonValue finish() {
        return switch (spec.kind()) {
            case COUNT -> IonValueUtils.system().newInt(count);
            case SUM, AVERAGE -> nonFiniteSum != null ? IonValueUtils.system().newFloat(nonFiniteSum) : finishExact();
            case MIN, MAX -> extreme == null ? IonValueUtils.nullValue() : IonValueUtils.cloneValue(extreme);
        };
    }

    private IonValue finishExact() {
        return switch (spec.kind()) {
            case SUM -> {
                BigDecimal total = sum == null ? BigDecimal.ZERO : sum;
                yield inputType == ColumnType.INT
                    ? IonValueUtils.system().newInt(total.toBigIntegerExact())
                    : IonValueUtils.system().newDecimal(total);
            }
            case AVERAGE -> count == 0
                ? IonValueUtils.nullValue()
                : IonValueUtils.system().newDecimal(sum.divide(BigDecimal.valueOf(count), MathContext.DECIMAL128));
            default -> throw new IllegalStateException("Not a numeric aggregate: " + spec);
        };
    }

    private void addNumber(IonValue value) throws CastException {
        if (value instanceof IonFloat ionFloat && !Double.isFinite(ionFloat.doubleValue())) {
            addNonFinite(ionFloat.doubleValue());
        } else {
            addToSum(IonValueUtils.asDecimal(value));
        }
    }

    private void addNonFinite(double value) {
        nonFiniteSum = nonFiniteSum == null ? value : nonFiniteSum + value;
    }

    private void addToSum(BigDecimal value) {
        sum = sum == null ? value : sum.add(value);
    }

    private void offer(IonValue candidate, Object candidateKey) {
        if (extreme == null) {
            extreme = candidate;
            extremeKey = candidateKey;
            return;
        }
        int comparison = compareKeys(candidateKey, extremeKey);
        if (comparison == 0) {
            comparison = candidate.toString().compareTo(extreme.toString());
            if (spec.kind() == AggregateKind.MAX) {
                comparison = -comparison;
            }
        }
        boolean replace = spec.kind() == AggregateKind.MIN ? comparison < 0 : comparison > 0;
        if (replace) {
            extreme = candidate;
            extremeKey = candidateKey;
        }
    }

    private Object comparableKey(IonValue value) throws CastException {
        return switch (inputType) {
            case TIMESTAMP -> IonValueUtils.asInstant(value);
            case STRING -> IonValueUtils.asString(value);
            case FLOAT -> IonValueUtils.asDouble(value);
            default -> IonValueUtils.asDecimal(value);
        };
    }

    private static int compareKeys(Object left, Object right) {
        if (left instanceof BigDecimal leftDecimal) {
            return leftDecimal.compareTo((BigDecimal) right);
        }
        if (left instanceof Double leftDouble) {
            return Double.compare(leftDouble, (Double) right);
        }
        if (left instanceof Instant leftInstant) {
            return leftInstant.compareTo((Instant) right);
        }
        return ((String) left).compareTo((String) right);
    }

    @Override
    public String toString() {
        return spec + "{count=" + count + ", sum=" + (nonFiniteSum != null ? nonFiniteSum : sum) + ", extreme=" + extreme + "}";
    }
}
