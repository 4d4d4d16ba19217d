package io.kestra.plugin.etl.expression;

import com.amazon.ion.IonStruct;
import com.amazon.ion.IonValue;
import io.kestra.plugin.etl.ion.ColumnType;
import io.kestra.plugin.etl.schema.Schema;

import java.util.Set;

/**
 * A parsed expression. Immutable and safe to evaluate from several threads at once.
 */
public interface CompiledExpression {
    String source();

    IonValue evaluate(IonStruct record) throws ExpressionException;

    /** Column names the expression reads. */
    Set<String> referencedColumns();

    /**
     * Result type against the given schema, or {@code null} when it can only be known per
     * record (a bare {@code null} literal, {@code coalesce} of nulls).
     *
     * @throws ExpressionException when an operator or function is applied to a column
     *                             whose declared type it cannot accept
     */
    ColumnType inferType(Schema schema) throws ExpressionException;
}
