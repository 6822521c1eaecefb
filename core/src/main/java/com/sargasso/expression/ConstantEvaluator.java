package com.sargasso.expression;

import com.sargasso.value.Value;
import com.sargasso.value.ValueType;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Folds expressions that do not depend on any document.
 *
 * <p>Evaluation follows the engine's missing/null propagation. Anything that
 * cannot be computed while planning (parameters, functions, subqueries, free
 * names) yields an empty result.
 */
public final class ConstantEvaluator implements ExpressionVisitor<Optional<Value>> {

    private final Map<String, Value> variables;

    private ConstantEvaluator(Map<String, Value> variables) {
        this.variables = variables;
    }

    /**
     * Evaluates a static expression.
     *
     * @param expr the expression
     * @return its value, or empty if it cannot be computed while planning
     */
    public static Optional<Value> evaluate(Expression expr) {
        return expr.accept(new ConstantEvaluator(new HashMap<>()));
    }

    private Optional<Value> eval(Expression expr) {
        return expr.accept(this);
    }

    @Override
    public Optional<Value> visitLiteral(Literal expr) {
        return Optional.of(expr.value());
    }

    @Override
    public Optional<Value> visitIdentifier(Identifier expr) {
        return Optional.ofNullable(variables.get(expr.name()));
    }

    @Override
    public Optional<Value> visitParameter(Parameter expr) {
        return Optional.empty();
    }

    @Override
    public Optional<Value> visitField(Field expr) {
        return eval(expr.base()).map(base -> {
            if (base.type() == ValueType.OBJECT) {
                return base.fields().getOrDefault(expr.name(), Value.MISSING);
            }
            return base.type() == ValueType.NULL ? Value.NULL : Value.MISSING;
        });
    }

    @Override
    public Optional<Value> visitElement(Element expr) {
        Optional<Value> base = eval(expr.base());
        Optional<Value> index = eval(expr.index());
        if (base.isEmpty() || index.isEmpty()) {
            return Optional.empty();
        }
        Value b = base.get();
        Value i = index.get();
        if (b.type() == ValueType.MISSING || i.type() == ValueType.MISSING) {
            return Optional.of(Value.MISSING);
        }
        if (b.type() != ValueType.ARRAY || i.type() != ValueType.NUMBER) {
            return Optional.of(Value.NULL);
        }
        int n = (int) i.number();
        List<Value> elements = b.elements();
        if (n < 0) {
            n += elements.size();
        }
        return Optional.of(n >= 0 && n < elements.size() ? elements.get(n) : Value.MISSING);
    }

    @Override
    public Optional<Value> visitMeta(Meta expr) {
        return Optional.empty();
    }

    @Override
    public Optional<Value> visitComparison(Comparison expr) {
        Optional<Value> left = eval(expr.left());
        Optional<Value> right = eval(expr.right());
        if (left.isEmpty() || right.isEmpty()) {
            return Optional.empty();
        }
        Value unknown = propagate(left.get(), right.get());
        if (unknown != null) {
            return Optional.of(unknown);
        }
        int c = left.get().compareTo(right.get());
        switch (expr.operator()) {
            case EQ: return Optional.of(Value.of(c == 0));
            case NE: return Optional.of(Value.of(c != 0));
            case LT: return Optional.of(Value.of(c < 0));
            case LE: return Optional.of(Value.of(c <= 0));
            case GT: return Optional.of(Value.of(c > 0));
            case GE: return Optional.of(Value.of(c >= 0));
            default: throw new IllegalStateException("Unknown operator: " + expr.operator());
        }
    }

    @Override
    public Optional<Value> visitArithmetic(Arithmetic expr) {
        Optional<Value> left = eval(expr.left());
        Optional<Value> right = eval(expr.right());
        if (left.isEmpty() || right.isEmpty()) {
            return Optional.empty();
        }
        Value l = left.get();
        Value r = right.get();
        Value unknown = propagate(l, r);
        if (unknown != null) {
            return Optional.of(unknown);
        }
        if (expr.operator() == Arithmetic.Operator.CONCAT) {
            if (l.type() != ValueType.STRING || r.type() != ValueType.STRING) {
                return Optional.of(Value.NULL);
            }
            return Optional.of(Value.of(l.string() + r.string()));
        }
        if (l.type() != ValueType.NUMBER || r.type() != ValueType.NUMBER) {
            return Optional.of(Value.NULL);
        }
        double a = l.number();
        double b = r.number();
        switch (expr.operator()) {
            case ADD: return Optional.of(Value.of(a + b));
            case SUB: return Optional.of(Value.of(a - b));
            case MULT: return Optional.of(Value.of(a * b));
            case DIV: return Optional.of(b == 0 ? Value.NULL : Value.of(a / b));
            case MOD: return Optional.of(b == 0 ? Value.NULL : Value.of(a % b));
            default: throw new IllegalStateException("Unknown operator: " + expr.operator());
        }
    }

    @Override
    public Optional<Value> visitAnd(And expr) {
        boolean missing = false;
        boolean nul = false;
        boolean unknown = false;
        for (Expression operand : expr.operands()) {
            Optional<Value> v = eval(operand);
            if (v.isEmpty()) {
                unknown = true;
                continue;
            }
            Value value = v.get();
            if (value.type() == ValueType.BOOLEAN) {
                if (!value.truth()) {
                    return Optional.of(Value.FALSE);
                }
            } else if (value.type() == ValueType.MISSING) {
                missing = true;
            } else {
                nul = true;
            }
        }
        if (unknown) {
            return Optional.empty();
        }
        if (missing) {
            return Optional.of(Value.MISSING);
        }
        return Optional.of(nul ? Value.NULL : Value.TRUE);
    }

    @Override
    public Optional<Value> visitOr(Or expr) {
        boolean missing = false;
        boolean nul = false;
        boolean unknown = false;
        for (Expression operand : expr.operands()) {
            Optional<Value> v = eval(operand);
            if (v.isEmpty()) {
                unknown = true;
                continue;
            }
            Value value = v.get();
            if (value.type() == ValueType.BOOLEAN) {
                if (value.truth()) {
                    return Optional.of(Value.TRUE);
                }
            } else if (value.type() == ValueType.MISSING) {
                missing = true;
            } else {
                nul = true;
            }
        }
        if (unknown) {
            return Optional.empty();
        }
        if (nul) {
            return Optional.of(Value.NULL);
        }
        return Optional.of(missing ? Value.MISSING : Value.FALSE);
    }

    @Override
    public Optional<Value> visitNot(Not expr) {
        return eval(expr.operand()).map(v -> {
            if (v.type() == ValueType.BOOLEAN) {
                return Value.of(!v.truth());
            }
            return v.type() == ValueType.MISSING ? Value.MISSING : Value.NULL;
        });
    }

    @Override
    public Optional<Value> visitBetween(Between expr) {
        Expression desugared = new And(
            Comparison.ge(expr.operand(), expr.low()),
            Comparison.le(expr.operand(), expr.high()));
        return eval(desugared);
    }

    @Override
    public Optional<Value> visitLike(Like expr) {
        Optional<Value> operand = eval(expr.operand());
        Optional<Value> pattern = eval(expr.pattern());
        if (operand.isEmpty() || pattern.isEmpty()) {
            return Optional.empty();
        }
        Value unknown = propagate(operand.get(), pattern.get());
        if (unknown != null) {
            return Optional.of(unknown);
        }
        if (operand.get().type() != ValueType.STRING || pattern.get().type() != ValueType.STRING) {
            return Optional.of(Value.NULL);
        }
        String regex = expr.isRegex() ? pattern.get().string() : likeToRegex(pattern.get().string());
        try {
            return Optional.of(Value.of(Pattern.matches(regex, operand.get().string())));
        } catch (PatternSyntaxException e) {
            return Optional.of(Value.NULL);
        }
    }

    /**
     * Translates a LIKE pattern to an equivalent regular expression.
     *
     * @param pattern the LIKE pattern ({@code %} and {@code _} wildcards, backslash escape)
     * @return the regular expression
     */
    public static String likeToRegex(String pattern) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < pattern.length(); i++) {
            char c = pattern.charAt(i);
            if (c == '\\' && i + 1 < pattern.length()) {
                sb.append(Pattern.quote(String.valueOf(pattern.charAt(++i))));
            } else if (c == '%') {
                sb.append(".*");
            } else if (c == '_') {
                sb.append('.');
            } else {
                sb.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return sb.toString();
    }

    @Override
    public Optional<Value> visitIn(In expr) {
        return membership(expr.operand(), expr.collection(), false);
    }

    @Override
    public Optional<Value> visitWithin(Within expr) {
        return membership(expr.operand(), expr.collection(), true);
    }

    private Optional<Value> membership(Expression operandExpr, Expression collectionExpr, boolean deep) {
        Optional<Value> operand = eval(operandExpr);
        Optional<Value> collection = eval(collectionExpr);
        if (operand.isEmpty() || collection.isEmpty()) {
            return Optional.empty();
        }
        Value unknown = propagate(operand.get(), collection.get());
        if (unknown != null) {
            return Optional.of(unknown);
        }
        Value c = collection.get();
        if (deep ? c.type().isScalar() : c.type() != ValueType.ARRAY) {
            return Optional.of(Value.NULL);
        }
        Iterable<Value> candidates = deep ? c.descendants() : c.elements();
        for (Value candidate : candidates) {
            if (candidate.equals(operand.get())) {
                return Optional.of(Value.TRUE);
            }
        }
        return Optional.of(Value.FALSE);
    }

    @Override
    public Optional<Value> visitIs(IsExpression expr) {
        return eval(expr.operand()).map(v -> {
            ValueType t = v.type();
            switch (expr.kind()) {
                case MISSING: return Value.of(t == ValueType.MISSING);
                case NOT_MISSING: return Value.of(t != ValueType.MISSING);
                case NULL: return t == ValueType.MISSING ? Value.MISSING : Value.of(t == ValueType.NULL);
                case NOT_NULL: return t == ValueType.MISSING ? Value.MISSING : Value.of(t != ValueType.NULL);
                case VALUED: return Value.of(t.isKnown());
                case NOT_VALUED: return Value.of(!t.isKnown());
                default: throw new IllegalStateException("Unknown kind: " + expr.kind());
            }
        });
    }

    @Override
    public Optional<Value> visitQuantified(Quantified expr) {
        if (expr.bindings().size() != 1) {
            return Optional.empty();
        }
        Quantified.Binding binding = expr.bindings().get(0);
        Optional<Value> collection = eval(binding.expression());
        if (collection.isEmpty()) {
            return Optional.empty();
        }
        if (collection.get().type() != ValueType.ARRAY) {
            return Optional.of(collection.get().type() == ValueType.MISSING ? Value.MISSING : Value.NULL);
        }
        List<Value> elements = collection.get().elements();
        boolean any = false;
        boolean every = true;
        Value saved = variables.get(binding.variable());
        try {
            for (Value element : elements) {
                variables.put(binding.variable(), element);
                Optional<Value> v = eval(expr.satisfies());
                if (v.isEmpty()) {
                    return Optional.empty();
                }
                boolean t = v.get().truth();
                any |= t;
                every &= t;
            }
        } finally {
            if (saved == null) {
                variables.remove(binding.variable());
            } else {
                variables.put(binding.variable(), saved);
            }
        }
        switch (expr.kind()) {
            case ANY: return Optional.of(Value.of(any));
            case EVERY: return Optional.of(Value.of(every));
            case ANY_EVERY: return Optional.of(Value.of(!elements.isEmpty() && every));
            default: throw new IllegalStateException("Unknown kind: " + expr.kind());
        }
    }

    @Override
    public Optional<Value> visitCaseWhen(CaseWhen expr) {
        for (CaseWhen.WhenClause clause : expr.whenClauses()) {
            Optional<Value> condition = eval(clause.condition());
            if (condition.isEmpty()) {
                return Optional.empty();
            }
            if (condition.get().truth()) {
                return eval(clause.result());
            }
        }
        return expr.elseExpr() == null ? Optional.of(Value.NULL) : eval(expr.elseExpr());
    }

    @Override
    public Optional<Value> visitArrayConstruct(ArrayConstruct expr) {
        List<Value> elements = new ArrayList<>();
        for (Expression element : expr.elements()) {
            Optional<Value> v = eval(element);
            if (v.isEmpty()) {
                return Optional.empty();
            }
            // MISSING elements become NULL inside arrays
            elements.add(v.get().type() == ValueType.MISSING ? Value.NULL : v.get());
        }
        return Optional.of(Value.array(elements));
    }

    @Override
    public Optional<Value> visitObjectConstruct(ObjectConstruct expr) {
        Map<String, Value> fields = new LinkedHashMap<>();
        for (Map.Entry<String, Expression> entry : expr.fields().entrySet()) {
            Optional<Value> v = eval(entry.getValue());
            if (v.isEmpty()) {
                return Optional.empty();
            }
            if (v.get().type() != ValueType.MISSING) {
                fields.put(entry.getKey(), v.get());
            }
        }
        return Optional.of(Value.of(fields));
    }

    @Override
    public Optional<Value> visitFunctionCall(FunctionCall expr) {
        return Optional.empty();
    }

    @Override
    public Optional<Value> visitSubquery(Subquery expr) {
        return Optional.empty();
    }

    private static Value propagate(Value left, Value right) {
        if (left.type() == ValueType.MISSING || right.type() == ValueType.MISSING) {
            return Value.MISSING;
        }
        if (left.type() == ValueType.NULL || right.type() == ValueType.NULL) {
            return Value.NULL;
        }
        return null;
    }
}
