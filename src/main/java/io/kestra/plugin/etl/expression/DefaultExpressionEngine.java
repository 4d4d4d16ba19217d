package io.kestra.plugin.etl.expression;

import com.amazon.ion.IonDecimal;
import com.amazon.ion.IonFloat;
import com.amazon.ion.IonInt;
import com.amazon.ion.IonString;
import com.amazon.ion.IonStruct;
import com.amazon.ion.IonTimestamp;
import com.amazon.ion.IonValue;
import io.kestra.plugin.etl.ion.CastException;
import io.kestra.plugin.etl.ion.ColumnType;
import io.kestra.plugin.etl.ion.IonValueUtils;
import io.kestra.plugin.etl.schema.Schema;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Small expression language over flat records: column references, literals, arithmetic,
 * comparisons, boolean connectives and a fixed set of scalar functions. Null operands
 * propagate to a null result, except through {@code coalesce}, {@code isNull} and
 * short-circuited {@code &&}/{@code ||}.
 */
public final class DefaultExpressionEngine implements ExpressionEngine {
    private static final int DIVISION_SCALE = 10;

    private final Map<String, CompiledExpression> cache = new ConcurrentHashMap<>();

    @Override
    public CompiledExpression compile(String expression) throws ExpressionException {
        if (expression == null || expression.isBlank()) {
            throw new ExpressionException("Expression is required");
        }
        CompiledExpression cached = cache.get(expression);
        if (cached != null) {
            return cached;
        }
        Parser parser = new Parser(new Tokenizer(expression));
        CompiledExpression compiled = new Compiled(expression, parser.parseExpression());
        CompiledExpression previous = cache.putIfAbsent(expression, compiled);
        return previous == null ? compiled : previous;
    }

    @Override
    public IonValue evaluate(String expression, IonStruct record) throws ExpressionException {
        return compile(expression).evaluate(record);
    }

    private static final class Compiled implements CompiledExpression {
        private final String source;
        private final Expr root;
        private final Set<String> columns;

        private Compiled(String source, Expr root) {
            this.source = source;
            this.root = root;
            Set<String> collected = new LinkedHashSet<>();
            root.collectColumns(collected);
            this.columns = Collections.unmodifiableSet(collected);
        }

        @Override
        public String source() {
            return source;
        }

        @Override
        public IonValue evaluate(IonStruct record) throws ExpressionException {
            return root.eval(record);
        }

        @Override
        public Set<String> referencedColumns() {
            return columns;
        }

        @Override
        public ColumnType inferType(Schema schema) throws ExpressionException {
            return root.inferType(schema);
        }

        @Override
        public String toString() {
            return source;
        }
    }

    private interface Expr {
        IonValue eval(IonStruct record) throws ExpressionException;

        ColumnType inferType(Schema schema) throws ExpressionException;

        default void collectColumns(Set<String> columns) {
        }
    }

    private static final class LiteralExpr implements Expr {
        private final IonValue value;

        private LiteralExpr(IonValue value) {
            value.makeReadOnly();
            this.value = value;
        }

        @Override
        public IonValue eval(IonStruct record) {
            return value;
        }

        @Override
        public ColumnType inferType(Schema schema) {
            return ColumnType.of(value.getType());
        }
    }

    private static final class ColumnExpr implements Expr {
        private final String column;

        private ColumnExpr(String column) {
            this.column = column;
        }

        @Override
        public IonValue eval(IonStruct record) {
            IonValue value = record.get(column);
            return value == null ? IonValueUtils.nullValue() : value;
        }

        @Override
        public ColumnType inferType(Schema schema) throws ExpressionException {
            ColumnType type = schema.typeOf(column);
            if (type == null) {
                throw new ExpressionException("Unknown column '" + column + "'");
            }
            return type;
        }

        @Override
        public void collectColumns(Set<String> columns) {
            columns.add(column);
        }
    }

    private static final class UnaryExpr implements Expr {
        private final TokenType operator;
        private final Expr expr;

        private UnaryExpr(TokenType operator, Expr expr) {
            this.operator = operator;
            this.expr = expr;
        }

        @Override
        public IonValue eval(IonStruct record) throws ExpressionException {
            IonValue value = expr.eval(record);
            if (IonValueUtils.isNull(value)) {
                return IonValueUtils.nullValue();
            }
            if (operator == TokenType.MINUS) {
                if (isNonFinite(value)) {
                    return IonValueUtils.system().newFloat(-asDouble(value));
                }
                return IonValueUtils.system().newDecimal(asDecimal(value).negate());
            }
            return IonValueUtils.system().newBool(!asBoolean(value));
        }

        @Override
        public ColumnType inferType(Schema schema) throws ExpressionException {
            ColumnType operand = expr.inferType(schema);
            if (operator == TokenType.MINUS) {
                requireNumeric(operand, "-");
                return ColumnType.DECIMAL;
            }
            requireBoolean(operand, "!");
            return ColumnType.BOOLEAN;
        }

        @Override
        public void collectColumns(Set<String> columns) {
            expr.collectColumns(columns);
        }
    }

    private static final class BinaryExpr implements Expr {
        private final Expr left;
        private final Expr right;
        private final TokenType operator;

        private BinaryExpr(Expr left, Expr right, TokenType operator) {
            this.left = left;
            this.right = right;
            this.operator = operator;
        }

        @Override
        public IonValue eval(IonStruct record) throws ExpressionException {
            if (operator == TokenType.AND_AND || operator == TokenType.OR_OR) {
                return evaluateBoolean(record);
            }
            IonValue leftValue = left.eval(record);
            IonValue rightValue = right.eval(record);
            return switch (operator) {
                case EQ_EQ -> IonValueUtils.system().newBool(equalsValue(leftValue, rightValue));
                case NOT_EQ -> IonValueUtils.system().newBool(!equalsValue(leftValue, rightValue));
                case GT, GTE, LT, LTE -> compare(leftValue, rightValue);
                default -> arithmetic(leftValue, rightValue);
            };
        }

        @Override
        public ColumnType inferType(Schema schema) throws ExpressionException {
            ColumnType leftType = left.inferType(schema);
            ColumnType rightType = right.inferType(schema);
            switch (operator) {
                case AND_AND, OR_OR -> {
                    requireBoolean(leftType, operator.text);
                    requireBoolean(rightType, operator.text);
                    return ColumnType.BOOLEAN;
                }
                case EQ_EQ, NOT_EQ -> {
                    return ColumnType.BOOLEAN;
                }
                case GT, GTE, LT, LTE -> {
                    requireComparable(leftType, rightType, operator.text);
                    return ColumnType.BOOLEAN;
                }
                default -> {
                    requireNumeric(leftType, operator.text);
                    requireNumeric(rightType, operator.text);
                    return ColumnType.DECIMAL;
                }
            }
        }

        @Override
        public void collectColumns(Set<String> columns) {
            left.collectColumns(columns);
            right.collectColumns(columns);
        }

        private IonValue evaluateBoolean(IonStruct record) throws ExpressionException {
            IonValue leftValue = left.eval(record);
            if (IonValueUtils.isNull(leftValue)) {
                return IonValueUtils.nullValue();
            }
            boolean leftBool = asBoolean(leftValue);
            if (operator == TokenType.AND_AND && !leftBool) {
                return IonValueUtils.system().newBool(false);
            }
            if (operator == TokenType.OR_OR && leftBool) {
                return IonValueUtils.system().newBool(true);
            }
            IonValue rightValue = right.eval(record);
            if (IonValueUtils.isNull(rightValue)) {
                return IonValueUtils.nullValue();
            }
            return IonValueUtils.system().newBool(asBoolean(rightValue));
        }

        private boolean equalsValue(IonValue leftValue, IonValue rightValue) throws ExpressionException {
            if (IonValueUtils.isNull(leftValue) || IonValueUtils.isNull(rightValue)) {
                return IonValueUtils.isNull(leftValue) && IonValueUtils.isNull(rightValue);
            }
            if (isNumber(leftValue) && isNumber(rightValue)) {
                if (isNonFinite(leftValue) || isNonFinite(rightValue)) {
                    return asDouble(leftValue) == asDouble(rightValue);
                }
                return asDecimal(leftValue).compareTo(asDecimal(rightValue)) == 0;
            }
            if (leftValue instanceof IonTimestamp || rightValue instanceof IonTimestamp) {
                return asInstant(leftValue).equals(asInstant(rightValue));
            }
            return leftValue.equals(rightValue);
        }

        private IonValue compare(IonValue leftValue, IonValue rightValue) throws ExpressionException {
            if (IonValueUtils.isNull(leftValue) || IonValueUtils.isNull(rightValue)) {
                return IonValueUtils.nullValue();
            }
            if (isNonFinite(leftValue) || isNonFinite(rightValue)) {
                return IonValueUtils.system().newBool(compareDoubles(asDouble(leftValue), asDouble(rightValue)));
            }
            int comparison;
            if (leftValue instanceof IonString leftString && rightValue instanceof IonString rightString) {
                comparison = leftString.stringValue().compareTo(rightString.stringValue());
            } else if (leftValue instanceof IonTimestamp || rightValue instanceof IonTimestamp) {
                comparison = asInstant(leftValue).compareTo(asInstant(rightValue));
            } else {
                comparison = asDecimal(leftValue).compareTo(asDecimal(rightValue));
            }
            boolean result = switch (operator) {
                case GT -> comparison > 0;
                case GTE -> comparison >= 0;
                case LT -> comparison < 0;
                default -> comparison <= 0;
            };
            return IonValueUtils.system().newBool(result);
        }

        // IEEE semantics: every ordering against NaN is false.
        private boolean compareDoubles(double left, double right) {
            return switch (operator) {
                case GT -> left > right;
                case GTE -> left >= right;
                case LT -> left < right;
                default -> left <= right;
            };
        }

        private IonValue arithmetic(IonValue leftValue, IonValue rightValue) throws ExpressionException {
            if (IonValueUtils.isNull(leftValue) || IonValueUtils.isNull(rightValue)) {
                return IonValueUtils.nullValue();
            }
            if (isNonFinite(leftValue) || isNonFinite(rightValue)) {
                return floatArithmetic(asDouble(leftValue), asDouble(rightValue));
            }
            BigDecimal leftDecimal = asDecimal(leftValue);
            BigDecimal rightDecimal = asDecimal(rightValue);
            BigDecimal result = switch (operator) {
                case PLUS -> leftDecimal.add(rightDecimal);
                case MINUS -> leftDecimal.subtract(rightDecimal);
                case STAR -> leftDecimal.multiply(rightDecimal);
                case SLASH -> rightDecimal.signum() == 0
                    ? null
                    : leftDecimal.divide(rightDecimal, DIVISION_SCALE, RoundingMode.HALF_UP);
                default -> throw new ExpressionException("Unsupported operator: " + operator.text);
            };
            return result == null ? IonValueUtils.nullValue() : IonValueUtils.system().newDecimal(result);
        }

        private IonValue floatArithmetic(double left, double right) throws ExpressionException {
            if (operator == TokenType.SLASH && right == 0) {
                return IonValueUtils.nullValue();
            }
            double result = switch (operator) {
                case PLUS -> left + right;
                case MINUS -> left - right;
                case STAR -> left * right;
                case SLASH -> left / right;
                default -> throw new ExpressionException("Unsupported operator: " + operator.text);
            };
            return IonValueUtils.system().newFloat(result);
        }
    }

    private static final class FunctionExpr implements Expr {
        private final Function function;
        private final List<Expr> args;

        private FunctionExpr(Function function, List<Expr> args) {
            this.function = function;
            this.args = args;
        }

        @Override
        public IonValue eval(IonStruct record) throws ExpressionException {
            List<IonValue> values = new ArrayList<>(args.size());
            for (Expr expr : args) {
                values.add(expr.eval(record));
            }
            if (function == Function.COALESCE) {
                for (IonValue value : values) {
                    if (!IonValueUtils.isNull(value)) {
                        return value;
                    }
                }
                return IonValueUtils.nullValue();
            }
            if (function == Function.IS_NULL) {
                return IonValueUtils.system().newBool(IonValueUtils.isNull(values.get(0)));
            }
            if (function == Function.CONCAT) {
                StringBuilder builder = new StringBuilder();
                for (IonValue value : values) {
                    if (!IonValueUtils.isNull(value)) {
                        builder.append(IonValueUtils.asString(value));
                    }
                }
                return IonValueUtils.system().newString(builder.toString());
            }
            IonValue first = values.get(0);
            if (IonValueUtils.isNull(first)) {
                return IonValueUtils.nullValue();
            }
            try {
                return apply(first, values);
            } catch (CastException | ArithmeticException e) {
                throw new ExpressionException(function.label + ": " + e.getMessage(), e);
            }
        }

        private IonValue apply(IonValue first, List<IonValue> values) throws CastException, ExpressionException {
            return switch (function) {
                case TO_INT -> IonValueUtils.system().newInt(IonValueUtils.asDecimal(first).longValueExact());
                case TO_FLOAT -> IonValueUtils.system().newFloat(IonValueUtils.asDouble(first));
                case TO_DECIMAL -> IonValueUtils.system().newDecimal(IonValueUtils.asDecimal(first));
                case TO_STRING -> IonValueUtils.system().newString(IonValueUtils.asString(first));
                case TO_BOOLEAN -> IonValueUtils.system().newBool(IonValueUtils.asBoolean(first));
                case PARSE_TIMESTAMP -> IonValueUtils.timestamp(IonValueUtils.asInstant(first));
                case UPPER -> IonValueUtils.system().newString(IonValueUtils.asString(first).toUpperCase(Locale.ROOT));
                case LOWER -> IonValueUtils.system().newString(IonValueUtils.asString(first).toLowerCase(Locale.ROOT));
                case TRIM -> IonValueUtils.system().newString(IonValueUtils.asString(first).trim());
                case ABS -> IonValueUtils.system().newDecimal(IonValueUtils.asDecimal(first).abs());
                case ROUND -> {
                    int scale = 0;
                    if (values.size() == 2) {
                        BigDecimal requested = IonValueUtils.asDecimal(values.get(1));
                        if (requested == null) {
                            yield IonValueUtils.nullValue();
                        }
                        scale = requested.intValueExact();
                    }
                    yield IonValueUtils.system().newDecimal(IonValueUtils.asDecimal(first).setScale(scale, RoundingMode.HALF_UP));
                }
                default -> throw new ExpressionException("Unsupported function: " + function.label);
            };
        }

        @Override
        public ColumnType inferType(Schema schema) throws ExpressionException {
            List<ColumnType> types = new ArrayList<>(args.size());
            for (Expr arg : args) {
                types.add(arg.inferType(schema));
            }
            return switch (function) {
                case TO_INT -> ColumnType.INT;
                case TO_FLOAT -> ColumnType.FLOAT;
                case TO_DECIMAL -> ColumnType.DECIMAL;
                case TO_STRING, CONCAT, UPPER, LOWER, TRIM -> ColumnType.STRING;
                case TO_BOOLEAN, IS_NULL -> ColumnType.BOOLEAN;
                case PARSE_TIMESTAMP -> ColumnType.TIMESTAMP;
                case ABS, ROUND -> {
                    for (ColumnType type : types) {
                        requireNumeric(type, function.label);
                    }
                    yield ColumnType.DECIMAL;
                }
                case COALESCE -> {
                    ColumnType resolved = null;
                    for (ColumnType type : types) {
                        if (type != null) {
                            resolved = type;
                            break;
                        }
                    }
                    yield resolved;
                }
            };
        }

        @Override
        public void collectColumns(Set<String> columns) {
            for (Expr arg : args) {
                arg.collectColumns(columns);
            }
        }
    }

    private enum Function {
        TO_INT("toInt", 1, 1),
        TO_FLOAT("toFloat", 1, 1),
        TO_DECIMAL("toDecimal", 1, 1),
        TO_STRING("toString", 1, 1),
        TO_BOOLEAN("toBoolean", 1, 1),
        PARSE_TIMESTAMP("parseTimestamp", 1, 1),
        COALESCE("coalesce", 1, Integer.MAX_VALUE),
        CONCAT("concat", 1, Integer.MAX_VALUE),
        UPPER("upper", 1, 1),
        LOWER("lower", 1, 1),
        TRIM("trim", 1, 1),
        ABS("abs", 1, 1),
        ROUND("round", 1, 2),
        IS_NULL("isNull", 1, 1);

        private final String label;
        private final int minArgs;
        private final int maxArgs;

        Function(String label, int minArgs, int maxArgs) {
            this.label = label;
            this.minArgs = minArgs;
            this.maxArgs = maxArgs;
        }

        static Function lookup(String name, int argCount) throws ExpressionException {
            for (Function function : values()) {
                if (function.label.equalsIgnoreCase(name)) {
                    if (argCount < function.minArgs || argCount > function.maxArgs) {
                        throw new ExpressionException(function.label + " expects "
                            + (function.minArgs == function.maxArgs ? String.valueOf(function.minArgs) : "at least " + function.minArgs)
                            + " argument(s), got " + argCount);
                    }
                    return function;
                }
            }
            throw new ExpressionException("Unknown function: " + name);
        }
    }

    private static boolean isNumber(IonValue value) {
        return value instanceof IonInt || value instanceof IonFloat || value instanceof IonDecimal;
    }

    private static boolean isNonFinite(IonValue value) {
        return value instanceof IonFloat ionFloat && !ionFloat.isNullValue() && !Double.isFinite(ionFloat.doubleValue());
    }

    private static double asDouble(IonValue value) throws ExpressionException {
        try {
            return IonValueUtils.asDouble(value);
        } catch (CastException e) {
            throw new ExpressionException(e.getMessage(), e);
        }
    }

    private static BigDecimal asDecimal(IonValue value) throws ExpressionException {
        try {
            return IonValueUtils.asDecimal(value);
        } catch (CastException e) {
            throw new ExpressionException(e.getMessage(), e);
        }
    }

    private static boolean asBoolean(IonValue value) throws ExpressionException {
        try {
            Boolean bool = IonValueUtils.asBoolean(value);
            return bool != null && bool;
        } catch (CastException e) {
            throw new ExpressionException(e.getMessage(), e);
        }
    }

    private static Instant asInstant(IonValue value) throws ExpressionException {
        try {
            return IonValueUtils.asInstant(value);
        } catch (CastException e) {
            throw new ExpressionException(e.getMessage(), e);
        }
    }

    private static void requireNumeric(ColumnType type, String operator) throws ExpressionException {
        if (type != null && !type.isNumeric() && type != ColumnType.STRING) {
            throw new ExpressionException("'" + operator + "' expects numeric operands, got " + type);
        }
    }

    private static void requireBoolean(ColumnType type, String operator) throws ExpressionException {
        if (type != null && type != ColumnType.BOOLEAN && type != ColumnType.STRING) {
            throw new ExpressionException("'" + operator + "' expects boolean operands, got " + type);
        }
    }

    private static void requireComparable(ColumnType left, ColumnType right, String operator) throws ExpressionException {
        if (left == null || right == null || left == ColumnType.STRING || right == ColumnType.STRING) {
            return;
        }
        boolean compatible = left.isNumeric()
            ? right.isNumeric()
            : left == right && left.isOrderable();
        if (!compatible) {
            throw new ExpressionException("Cannot compare " + left + " with " + right + " using '" + operator + "'");
        }
    }

    private enum TokenType {
        IDENT(""),
        NUMBER(""),
        STRING(""),
        LPAREN("("),
        RPAREN(")"),
        COMMA(","),
        PLUS("+"),
        MINUS("-"),
        STAR("*"),
        SLASH("/"),
        AND_AND("&&"),
        OR_OR("||"),
        EQ_EQ("=="),
        NOT_EQ("!="),
        GT(">"),
        GTE(">="),
        LT("<"),
        LTE("<="),
        BANG("!"),
        EOF("");

        private final String text;

        TokenType(String text) {
            this.text = text;
        }
    }

    private record Token(TokenType type, String text) {
    }

    private static final class Tokenizer {
        private final String input;
        private int index;

        private Tokenizer(String input) {
            this.input = input;
        }

        Token next() throws ExpressionException {
            skipWhitespace();
            if (index >= input.length()) {
                return new Token(TokenType.EOF, "");
            }
            char current = input.charAt(index);
            if (Character.isLetter(current) || current == '_') {
                return readIdentifier();
            }
            if (Character.isDigit(current)) {
                return readNumber();
            }
            if (current == '"') {
                return readString();
            }
            for (TokenType type : List.of(TokenType.AND_AND, TokenType.OR_OR, TokenType.EQ_EQ, TokenType.NOT_EQ, TokenType.GTE, TokenType.LTE)) {
                if (input.startsWith(type.text, index)) {
                    index += 2;
                    return new Token(type, type.text);
                }
            }
            index++;
            return switch (current) {
                case '(' -> new Token(TokenType.LPAREN, "(");
                case ')' -> new Token(TokenType.RPAREN, ")");
                case ',' -> new Token(TokenType.COMMA, ",");
                case '+' -> new Token(TokenType.PLUS, "+");
                case '-' -> new Token(TokenType.MINUS, "-");
                case '*' -> new Token(TokenType.STAR, "*");
                case '/' -> new Token(TokenType.SLASH, "/");
                case '>' -> new Token(TokenType.GT, ">");
                case '<' -> new Token(TokenType.LT, "<");
                case '!' -> new Token(TokenType.BANG, "!");
                default -> throw new ExpressionException("Unexpected character '" + current + "' at position " + (index - 1));
            };
        }

        private Token readIdentifier() {
            int start = index;
            index++;
            while (index < input.length()) {
                char current = input.charAt(index);
                if (!Character.isLetterOrDigit(current) && current != '_') {
                    break;
                }
                index++;
            }
            return new Token(TokenType.IDENT, input.substring(start, index));
        }

        private Token readNumber() {
            int start = index;
            index++;
            while (index < input.length()) {
                char current = input.charAt(index);
                if (Character.isDigit(current) || current == '.') {
                    index++;
                    continue;
                }
                if (current == 'e' || current == 'E') {
                    index++;
                    if (index < input.length() && (input.charAt(index) == '+' || input.charAt(index) == '-')) {
                        index++;
                    }
                    continue;
                }
                break;
            }
            return new Token(TokenType.NUMBER, input.substring(start, index));
        }

        private Token readString() throws ExpressionException {
            index++; // opening quote
            StringBuilder builder = new StringBuilder();
            while (index < input.length()) {
                char current = input.charAt(index);
                if (current == '"') {
                    index++;
                    return new Token(TokenType.STRING, builder.toString());
                }
                if (current == '\\') {
                    index++;
                    if (index >= input.length()) {
                        break;
                    }
                    char escaped = input.charAt(index);
                    builder.append(switch (escaped) {
                        case '"', '\\', '/' -> escaped;
                        case 'n' -> '\n';
                        case 'r' -> '\r';
                        case 't' -> '\t';
                        default -> throw new ExpressionException("Invalid escape sequence: \\" + escaped);
                    });
                    index++;
                    continue;
                }
                builder.append(current);
                index++;
            }
            throw new ExpressionException("Unterminated string literal");
        }

        private void skipWhitespace() {
            while (index < input.length() && Character.isWhitespace(input.charAt(index))) {
                index++;
            }
        }
    }

    private static final class Parser {
        private final Tokenizer tokenizer;
        private Token current;
        private Token previous;

        private Parser(Tokenizer tokenizer) throws ExpressionException {
            this.tokenizer = tokenizer;
            this.current = tokenizer.next();
        }

        Expr parseExpression() throws ExpressionException {
            Expr expr = parseOr();
            if (current.type() != TokenType.EOF) {
                throw new ExpressionException("Unexpected token: " + current.text());
            }
            return expr;
        }

        private Expr parseOr() throws ExpressionException {
            Expr expr = parseAnd();
            while (match(TokenType.OR_OR)) {
                expr = new BinaryExpr(expr, parseAnd(), TokenType.OR_OR);
            }
            return expr;
        }

        private Expr parseAnd() throws ExpressionException {
            Expr expr = parseEquality();
            while (match(TokenType.AND_AND)) {
                expr = new BinaryExpr(expr, parseEquality(), TokenType.AND_AND);
            }
            return expr;
        }

        private Expr parseEquality() throws ExpressionException {
            Expr expr = parseComparison();
            while (check(TokenType.EQ_EQ) || check(TokenType.NOT_EQ)) {
                TokenType operator = advance().type();
                expr = new BinaryExpr(expr, parseComparison(), operator);
            }
            return expr;
        }

        private Expr parseComparison() throws ExpressionException {
            Expr expr = parseTerm();
            while (check(TokenType.GT) || check(TokenType.GTE) || check(TokenType.LT) || check(TokenType.LTE)) {
                TokenType operator = advance().type();
                expr = new BinaryExpr(expr, parseTerm(), operator);
            }
            return expr;
        }

        private Expr parseTerm() throws ExpressionException {
            Expr expr = parseFactor();
            while (check(TokenType.PLUS) || check(TokenType.MINUS)) {
                TokenType operator = advance().type();
                expr = new BinaryExpr(expr, parseFactor(), operator);
            }
            return expr;
        }

        private Expr parseFactor() throws ExpressionException {
            Expr expr = parseUnary();
            while (check(TokenType.STAR) || check(TokenType.SLASH)) {
                TokenType operator = advance().type();
                expr = new BinaryExpr(expr, parseUnary(), operator);
            }
            return expr;
        }

        private Expr parseUnary() throws ExpressionException {
            if (match(TokenType.BANG)) {
                return new UnaryExpr(TokenType.BANG, parseUnary());
            }
            if (match(TokenType.MINUS)) {
                return new UnaryExpr(TokenType.MINUS, parseUnary());
            }
            return parsePrimary();
        }

        private Expr parsePrimary() throws ExpressionException {
            if (match(TokenType.NUMBER)) {
                String raw = previous.text();
                try {
                    return new LiteralExpr(IonValueUtils.system().newDecimal(new BigDecimal(raw)));
                } catch (NumberFormatException e) {
                    throw new ExpressionException("Invalid number literal: " + raw, e);
                }
            }
            if (match(TokenType.STRING)) {
                return new LiteralExpr(IonValueUtils.system().newString(previous.text()));
            }
            if (match(TokenType.IDENT)) {
                String ident = previous.text();
                if ("true".equalsIgnoreCase(ident)) {
                    return new LiteralExpr(IonValueUtils.system().newBool(true));
                }
                if ("false".equalsIgnoreCase(ident)) {
                    return new LiteralExpr(IonValueUtils.system().newBool(false));
                }
                if ("null".equalsIgnoreCase(ident)) {
                    return new LiteralExpr(IonValueUtils.nullValue());
                }
                if (match(TokenType.LPAREN)) {
                    List<Expr> args = new ArrayList<>();
                    if (!check(TokenType.RPAREN)) {
                        do {
                            args.add(parseOr());
                        } while (match(TokenType.COMMA));
                    }
                    consume(TokenType.RPAREN, "Expected ')' after arguments of " + ident);
                    return new FunctionExpr(Function.lookup(ident, args.size()), List.copyOf(args));
                }
                return new ColumnExpr(ident);
            }
            if (match(TokenType.LPAREN)) {
                Expr expr = parseOr();
                consume(TokenType.RPAREN, "Expected ')'");
                return expr;
            }
            throw new ExpressionException("Unexpected token: " + (current.type() == TokenType.EOF ? "end of expression" : current.text()));
        }

        private boolean match(TokenType type) throws ExpressionException {
            if (check(type)) {
                advance();
                return true;
            }
            return false;
        }

        private boolean check(TokenType type) {
            return current.type() == type;
        }

        private Token advance() throws ExpressionException {
            previous = current;
            current = tokenizer.next();
            return previous;
        }

        private void consume(TokenType type, String message) throws ExpressionException {
            if (!match(type)) {
                throw new ExpressionException(message);
            }
        }
    }
}
