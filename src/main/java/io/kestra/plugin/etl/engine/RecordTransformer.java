package io.kestra.plugin.etl.engine;

import com.amazon.ion.IonStruct;
import io.kestra.plugin.etl.EvaluationException;

public interface RecordTransformer {
    IonStruct transform(IonStruct input) throws EvaluationException;
}
