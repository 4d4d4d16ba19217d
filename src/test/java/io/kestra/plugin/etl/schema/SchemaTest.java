package io.kestra.plugin.etl.schema;

import com.amazon.ion.IonDecimal;
import com.amazon.ion.IonInt;
import com.amazon.ion.IonStruct;
import com.amazon.ion.IonValue;
import io.kestra.plugin.etl.SchemaException;
import io.kestra.plugin.etl.ion.CastException;
import io.kestra.plugin.etl.ion.ColumnType;
import io.kestra.plugin.etl.ion.DefaultIonCaster;
import io.kestra.plugin.etl.ion.IonValueUtils;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;

class SchemaTest {
    @Test
    void keepsDeclarationOrder() throws Exception {
        Schema schema = Schema.builder()
            .column("region", ColumnType.STRING)
            .column("amount", ColumnType.DECIMAL)
            .column("quantity", ColumnType.INT)
            .build();

        assertThat(schema.columnNames(), contains("region", "amount", "quantity"));
        assertThat(schema.typeOf("amount"), is(ColumnType.DECIMAL));
        assertThat(schema.size(), is(3));
    }

    @Test
    void rejectsDuplicateAndBlankColumns() {
        SchemaException duplicate = Assertions.assertThrows(
            SchemaException.class,
            () -> Schema.builder().column("a", ColumnType.INT).column("a", ColumnType.STRING)
        );
        assertThat(duplicate.getMessage(), is("Duplicate column 'a'"));

        Assertions.assertThrows(SchemaException.class, () -> Schema.builder().column(" ", ColumnType.INT));
        Assertions.assertThrows(SchemaException.class, () -> Schema.builder().column("a", null));
    }

    @Test
    void requireNamesAvailableColumns() throws Exception {
        Schema schema = Schema.builder().column("amount", ColumnType.FLOAT).build();

        SchemaException exception = Assertions.assertThrows(
            SchemaException.class,
            () -> schema.require("amout", "filter")
        );

        assertThat(exception.getMessage(), is("Unknown column 'amout' in filter; available columns: [amount]"));
    }

    @Test
    void equalityDependsOnOrder() throws Exception {
        Schema first = Schema.builder().column("a", ColumnType.INT).column("b", ColumnType.INT).build();
        Schema same = Schema.builder().column("a", ColumnType.INT).column("b", ColumnType.INT).build();
        Schema swapped = Schema.builder().column("b", ColumnType.INT).column("a", ColumnType.INT).build();

        assertThat(first, is(same));
        assertThat(first.hashCode(), is(same.hashCode()));
        assertThat(first, is(not(swapped)));
    }

    @Test
    void conformsRecordToSchemaOrderAndTypes() throws Exception {
        Schema schema = Schema.builder()
            .column("quantity", ColumnType.INT)
            .column("amount", ColumnType.DECIMAL)
            .column("note", ColumnType.STRING)
            .build();
        IonStruct input = IonValueUtils.system().newEmptyStruct();
        input.put("amount", IonValueUtils.system().newString("1.25"));
        input.put("quantity", IonValueUtils.system().newString("3"));

        IonStruct conformed = schema.conform(input, new DefaultIonCaster());

        List<String> names = new ArrayList<>();
        for (IonValue value : conformed) {
            names.add(value.getFieldName());
        }
        assertThat(names, contains("quantity", "amount", "note"));
        assertThat(((IonInt) conformed.get("quantity")).longValue(), is(3L));
        assertThat(((IonDecimal) conformed.get("amount")).bigDecimalValue(), is(new BigDecimal("1.25")));
        assertThat(IonValueUtils.isNull(conformed.get("note")), is(true));
        assertThat(conformed.isReadOnly(), is(true));
    }

    @Test
    void conformRejectsUndeclaredAndMalformedColumns() throws Exception {
        Schema schema = Schema.builder().column("quantity", ColumnType.INT).build();
        IonStruct extra = IonValueUtils.system().newEmptyStruct();
        extra.put("other", IonValueUtils.system().newInt(1));
        IonStruct malformed = IonValueUtils.system().newEmptyStruct();
        malformed.put("quantity", IonValueUtils.system().newString("three"));

        CastException unexpected = Assertions.assertThrows(CastException.class, () -> schema.conform(extra, new DefaultIonCaster()));
        CastException invalid = Assertions.assertThrows(CastException.class, () -> schema.conform(malformed, new DefaultIonCaster()));

        assertThat(unexpected.getMessage(), is("Unexpected column 'other'"));
        assertThat(invalid.getMessage(), containsString("Column 'quantity'"));
    }
}
