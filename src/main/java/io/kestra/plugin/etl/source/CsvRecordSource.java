package io.kestra.plugin.etl.source;

import com.amazon.ion.IonStruct;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import io.kestra.plugin.etl.ion.IonValueUtils;

import java.io.IOException;
import java.io.Reader;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Reads a CSV document whose first line names the columns. Every cell is read as text;
 * empty cells become nulls. Cells are cast to the pipeline schema during execution, so a
 * malformed cell fails only the partition holding its row.
 */
public final class CsvRecordSource implements RecordSource {
    private static final CsvMapper MAPPER = new CsvMapper();

    private final MappingIterator<Map<String, String>> rows;

    public CsvRecordSource(Reader reader) throws IOException {
        this(reader, CsvSchema.DEFAULT_COLUMN_SEPARATOR);
    }

    public CsvRecordSource(Reader reader, char columnSeparator) throws IOException {
        CsvSchema schema = CsvSchema.emptySchema()
            .withHeader()
            .withColumnSeparator(columnSeparator);
        this.rows = MAPPER.readerForMapOf(String.class)
            .with(schema)
            .readValues(reader);
    }

    @Override
    public boolean hasNext() {
        return rows.hasNext();
    }

    @Override
    public IonStruct next() {
        if (!rows.hasNext()) {
            throw new NoSuchElementException();
        }
        Map<String, String> row = rows.next();
        IonStruct record = IonValueUtils.system().newEmptyStruct();
        for (Map.Entry<String, String> cell : row.entrySet()) {
            String value = cell.getValue();
            record.put(cell.getKey(), value == null || value.isEmpty()
                ? IonValueUtils.nullValue()
                : IonValueUtils.system().newString(value));
        }
        return record;
    }

    @Override
    public void close() throws IOException {
        rows.close();
    }
}
