package io.kestra.plugin.etl.expression;

import com.amazon.ion.IonStruct;
import com.amazon.ion.IonValue;

public interface ExpressionEngine {
    CompiledExpression compile(String expression) throws ExpressionException;

    IonValue evaluate(String expression, IonStruct record) throws ExpressionException;
}
