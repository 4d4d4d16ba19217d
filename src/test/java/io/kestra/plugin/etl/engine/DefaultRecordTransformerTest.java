package io.kestra.plugin.etl.engine;

import com.amazon.ion.IonDecimal;
import com.amazon.ion.IonInt;
import com.amazon.ion.IonString;
import com.amazon.ion.IonStruct;
import io.kestra.plugin.etl.EvaluationException;
import io.kestra.plugin.etl.SchemaException;
import io.kestra.plugin.etl.expression.DefaultExpressionEngine;
import io.kestra.plugin.etl.graph.FieldMapping;
import io.kestra.plugin.etl.ion.ColumnType;
import io.kestra.plugin.etl.ion.DefaultIonCaster;
import io.kestra.plugin.etl.ion.IonValueUtils;
import io.kestra.plugin.etl.schema.Schema;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;

class DefaultRecordTransformerTest {
    @Test
    void failsOnMissingRequiredField() throws Exception {
        DefaultRecordTransformer transformer = transformer(
            List.of(new FieldMapping("value", "value", ColumnType.INT, false)),
            false
        );

        IonStruct record = IonValueUtils.system().newEmptyStruct();

        EvaluationException exception = Assertions.assertThrows(
            EvaluationException.class,
            () -> transformer.transform(record)
        );

        assertThat(exception.getMessage(), is("Missing required field: value"));
    }

    @Test
    void nullsOptionalField() throws Exception {
        DefaultRecordTransformer transformer = transformer(
            List.of(new FieldMapping("value", "value", ColumnType.INT, true)),
            false
        );

        IonStruct output = transformer.transform(IonValueUtils.system().newEmptyStruct());

        assertThat(IonValueUtils.isNull(output.get("value")), is(true));
    }

    @Test
    void keepsOriginalFieldsWhenEnabled() throws Exception {
        DefaultRecordTransformer transformer = transformer(
            List.of(FieldMapping.of("value", "value + 1", ColumnType.INT)),
            true
        );

        IonStruct record = IonValueUtils.system().newEmptyStruct();
        record.put("extra", IonValueUtils.system().newString("keep-me"));
        record.put("value", IonValueUtils.system().newInt(7));

        IonStruct output = transformer.transform(record);

        assertThat(((IonString) output.get("extra")).stringValue(), is("keep-me"));
        assertThat(((IonInt) output.get("value")).intValue(), is(8));
        assertThat(output.isReadOnly(), is(true));
        assertThat(transformer.outputSchema().columnNames(), contains("extra", "value"));
    }

    @Test
    void dropsUnmappedFieldsByDefault() throws Exception {
        DefaultRecordTransformer transformer = transformer(
            List.of(FieldMapping.of("price", "toDecimal(value) / 2")),
            false
        );

        IonStruct record = IonValueUtils.system().newEmptyStruct();
        record.put("extra", IonValueUtils.system().newString("drop-me"));
        record.put("value", IonValueUtils.system().newInt(5));

        IonStruct output = transformer.transform(record);

        assertThat(output.size(), is(1));
        assertThat(((IonDecimal) output.get("price")).bigDecimalValue().compareTo(new BigDecimal("2.5")), is(0));
        assertThat(transformer.describe(), is("price=toDecimal(value) / 2"));
    }

    @Test
    void reportsFieldOnEvaluationError() throws Exception {
        DefaultRecordTransformer transformer = transformer(List.of(FieldMapping.of("number", "toInt(extra)")), false);

        IonStruct record = IonValueUtils.system().newEmptyStruct();
        record.put("extra", IonValueUtils.system().newString("abc"));

        EvaluationException exception = Assertions.assertThrows(
            EvaluationException.class,
            () -> transformer.transform(record)
        );

        assertThat(exception.getMessage(), containsString("Field 'number'"));
    }

    @Test
    void rejectsInvalidMappingsAtConstruction() {
        SchemaException duplicate = Assertions.assertThrows(
            SchemaException.class,
            () -> transformer(List.of(FieldMapping.of("a", "value"), FieldMapping.of("a", "extra")), false)
        );
        SchemaException untyped = Assertions.assertThrows(
            SchemaException.class,
            () -> transformer(List.of(FieldMapping.of("a", "null")), false)
        );
        SchemaException empty = Assertions.assertThrows(
            SchemaException.class,
            () -> transformer(List.of(), false)
        );

        assertThat(duplicate.getMessage(), is("Duplicate target field 'a'"));
        assertThat(untyped.getMessage(), containsString("Cannot infer the type"));
        assertThat(empty.getMessage(), is("map requires at least one field mapping"));
    }

    private static DefaultRecordTransformer transformer(List<FieldMapping> mappings, boolean keepOriginalFields) throws SchemaException {
        Schema schema = Schema.builder()
            .column("extra", ColumnType.STRING)
            .column("value", ColumnType.INT)
            .build();
        return new DefaultRecordTransformer(
            mappings,
            schema,
            new DefaultExpressionEngine(),
            new DefaultIonCaster(),
            keepOriginalFields
        );
    }
}
