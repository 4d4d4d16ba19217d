package io.kestra.plugin.etl.expression;

import com.amazon.ion.IonBool;
import com.amazon.ion.IonDecimal;
import com.amazon.ion.IonFloat;
import com.amazon.ion.IonString;
import com.amazon.ion.IonStruct;
import com.amazon.ion.IonValue;
import io.kestra.plugin.etl.ion.ColumnType;
import io.kestra.plugin.etl.ion.IonValueUtils;
import io.kestra.plugin.etl.schema.Schema;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.sameInstance;

class DefaultExpressionEngineTest {
    private final DefaultExpressionEngine engine = new DefaultExpressionEngine();

    @Test
    void evaluatesArithmeticAndComparisons() throws Exception {
        IonStruct record = record();

        assertThat(decimal(engine.evaluate("amount * 2 + 1", record)), is(new BigDecimal("22.0")));
        assertThat(bool(engine.evaluate("amount > 10 && region == \"eu\"", record)), is(true));
        assertThat(bool(engine.evaluate("quantity >= 4 || missing == null", record)), is(true));
        assertThat(bool(engine.evaluate("!(quantity < 4)", record)), is(true));
    }

    @Test
    void propagatesNulls() throws Exception {
        IonStruct record = record();

        assertThat(IonValueUtils.isNull(engine.evaluate("missing + 1", record)), is(true));
        assertThat(IonValueUtils.isNull(engine.evaluate("missing > 1", record)), is(true));
        assertThat(bool(engine.evaluate("isNull(missing)", record)), is(true));
        assertThat(((IonString) engine.evaluate("coalesce(missing, region)", record)).stringValue(), is("eu"));
    }

    @Test
    void divisionByZeroIsNull() throws Exception {
        assertThat(IonValueUtils.isNull(engine.evaluate("amount / 0", record())), is(true));
    }

    @Test
    void comparesInfiniteAndNaNFloats() throws Exception {
        IonStruct record = IonValueUtils.system().newEmptyStruct();
        record.put("high", IonValueUtils.system().newFloat(Double.POSITIVE_INFINITY));
        record.put("low", IonValueUtils.system().newFloat(Double.NEGATIVE_INFINITY));
        record.put("nan", IonValueUtils.system().newFloat(Double.NaN));

        assertThat(bool(engine.evaluate("high > 0", record)), is(true));
        assertThat(bool(engine.evaluate("low < -1000000", record)), is(true));
        assertThat(bool(engine.evaluate("high == high", record)), is(true));
        assertThat(bool(engine.evaluate("high != low", record)), is(true));
        assertThat(bool(engine.evaluate("nan > 0", record)), is(false));
        assertThat(bool(engine.evaluate("nan <= 0", record)), is(false));
        assertThat(bool(engine.evaluate("nan == nan", record)), is(false));
        assertThat(((IonFloat) engine.evaluate("high * 2", record)).doubleValue(), is(Double.POSITIVE_INFINITY));
        assertThat(((IonFloat) engine.evaluate("-high", record)).doubleValue(), is(Double.NEGATIVE_INFINITY));
        assertThat(Double.isNaN(((IonFloat) engine.evaluate("high + low", record)).doubleValue()), is(true));
        assertThat(IonValueUtils.isNull(engine.evaluate("high / 0", record)), is(true));
    }

    @Test
    void appliesFunctions() throws Exception {
        IonStruct record = record();

        assertThat(((IonString) engine.evaluate("upper(region)", record)).stringValue(), is("EU"));
        assertThat(((IonString) engine.evaluate("concat(region, \"-\", quantity)", record)).stringValue(), is("eu-4"));
        assertThat(decimal(engine.evaluate("round(amount / 3, 2)", record)), is(new BigDecimal("3.50")));
        assertThat(decimal(engine.evaluate("abs(-amount)", record)), is(new BigDecimal("10.5")));
    }

    @Test
    void cachesCompiledExpressions() throws Exception {
        assertThat(engine.compile("amount > 1"), is(sameInstance(engine.compile("amount > 1"))));
    }

    @Test
    void reportsReferencedColumnsAndType() throws Exception {
        Schema schema = Schema.builder()
            .column("amount", ColumnType.FLOAT)
            .column("region", ColumnType.STRING)
            .build();

        CompiledExpression expression = engine.compile("amount > 0 && region != \"us\"");

        assertThat(expression.referencedColumns(), containsInAnyOrder("amount", "region"));
        assertThat(expression.inferType(schema), is(ColumnType.BOOLEAN));
        assertThat(engine.compile("coalesce(null, null)").inferType(schema), is(nullValue()));
    }

    @Test
    void rejectsIncompatibleOperandTypes() throws Exception {
        Schema schema = Schema.builder()
            .column("flag", ColumnType.BOOLEAN)
            .build();

        ExpressionException exception = Assertions.assertThrows(
            ExpressionException.class,
            () -> engine.compile("flag * 2").inferType(schema)
        );

        assertThat(exception.getMessage(), containsString("expects numeric operands"));
    }

    @Test
    void rejectsUnknownFunction() {
        ExpressionException exception = Assertions.assertThrows(
            ExpressionException.class,
            () -> engine.compile("missingFn(1)")
        );

        assertThat(exception.getMessage(), containsString("Unknown function: missingFn"));
    }

    @Test
    void rejectsWrongArity() {
        ExpressionException exception = Assertions.assertThrows(
            ExpressionException.class,
            () -> engine.compile("upper(a, b)")
        );

        assertThat(exception.getMessage(), containsString("upper expects 1 argument(s), got 2"));
    }

    @Test
    void rejectsTrailingTokens() {
        Assertions.assertThrows(ExpressionException.class, () -> engine.compile("amount amount"));
        Assertions.assertThrows(ExpressionException.class, () -> engine.compile("\"open"));
        Assertions.assertThrows(ExpressionException.class, () -> engine.compile("   "));
    }

    private static IonStruct record() {
        IonStruct record = IonValueUtils.system().newEmptyStruct();
        record.put("amount", IonValueUtils.system().newDecimal(new BigDecimal("10.5")));
        record.put("quantity", IonValueUtils.system().newInt(4));
        record.put("region", IonValueUtils.system().newString("eu"));
        record.put("missing", IonValueUtils.nullValue());
        return record;
    }

    private static BigDecimal decimal(IonValue value) {
        return ((IonDecimal) value).bigDecimalValue();
    }

    private static boolean bool(IonValue value) {
        return ((IonBool) value).booleanValue();
    }
}
