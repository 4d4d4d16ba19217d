package io.kestra.plugin.etl.source;

import com.amazon.ion.IonStruct;

import java.io.Closeable;
import java.util.Iterator;

/**
 * Forward-only, single-pass reader of records. The total count is not known up front and
 * records are not required to be typed yet; they are conformed to the pipeline schema when
 * their partition executes. Read failures surface as unchecked exceptions from
 * {@link #hasNext()} or {@link #next()}.
 */
public interface RecordSource extends Iterator<IonStruct>, Closeable {
}
