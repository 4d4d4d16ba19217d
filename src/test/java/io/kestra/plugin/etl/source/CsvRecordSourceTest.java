package io.kestra.plugin.etl.source;

import com.amazon.ion.IonString;
import com.amazon.ion.IonStruct;
import io.kestra.plugin.etl.ion.IonValueUtils;
import org.junit.jupiter.api.Test;

import java.io.InputStreamReader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;

class CsvRecordSourceTest {
    @Test
    void readsHeaderDrivenRows() throws Exception {
        List<IonStruct> records = new ArrayList<>();
        try (CsvRecordSource source = new CsvRecordSource(new InputStreamReader(
            Objects.requireNonNull(getClass().getResourceAsStream("/sales.csv")), StandardCharsets.UTF_8))) {
            source.forEachRemaining(records::add);
        }

        assertThat(records, hasSize(8));
        IonStruct first = records.get(0);
        assertThat(((IonString) first.get("region")).stringValue(), is("eu"));
        assertThat(((IonString) first.get("amount")).stringValue(), is("12.50"));
        assertThat(IonValueUtils.isNull(records.get(5).get("amount")), is(true));
    }

    @Test
    void supportsOtherSeparators() throws Exception {
        try (CsvRecordSource source = new CsvRecordSource(new StringReader("a;b\n1;x\n"), ';')) {
            IonStruct record = source.next();

            assertThat(((IonString) record.get("a")).stringValue(), is("1"));
            assertThat(((IonString) record.get("b")).stringValue(), is("x"));
            assertThat(source.hasNext(), is(false));
        }
    }
}
