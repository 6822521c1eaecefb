package com.sargasso.planner.sarg;

import com.sargasso.catalog.IndexKey;
import com.sargasso.expression.And;
import com.sargasso.expression.Arithmetic;
import com.sargasso.expression.ArrayConstruct;
import com.sargasso.expression.Between;
import com.sargasso.expression.CaseWhen;
import com.sargasso.expression.Comparison;
import com.sargasso.expression.Element;
import com.sargasso.expression.Expression;
import com.sargasso.expression.ExpressionTransformer;
import com.sargasso.expression.ExpressionVisitor;
import com.sargasso.expression.Expressions;
import com.sargasso.expression.Field;
import com.sargasso.expression.FunctionCall;
import com.sargasso.expression.Identifier;
import com.sargasso.expression.Implication;
import com.sargasso.expression.In;
import com.sargasso.expression.IsExpression;
import com.sargasso.expression.Like;
import com.sargasso.expression.Literal;
import com.sargasso.expression.Meta;
import com.sargasso.expression.Not;
import com.sargasso.expression.ObjectConstruct;
import com.sargasso.expression.Or;
import com.sargasso.expression.Parameter;
import com.sargasso.expression.Quantified;
import com.sargasso.expression.Subquery;
import com.sargasso.expression.Within;
import com.sargasso.value.Value;
import com.sargasso.value.ValueType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Derives the spans one index key can use for a predicate.
 *
 * <p>{@link #sarg(Expression)} returns null when the predicate has no relation
 * to the key. Otherwise it returns spans over the key alone: concrete ranges
 * for predicates that bound the key, {@link TermSpans#VALUED} for predicates
 * that only need the key to be present, and sentinels for IS predicates.
 *
 * <p>A range bound must not refer to the scanned keyspace. Outside a nested-loop
 * join it must be known before execution (a constant or a parameter); under a
 * nested-loop join it may refer to keyspaces on the outer side.
 */
public final class KeySarger implements ExpressionVisitor<SargSpans> {

    private final Expression key;
    private final IndexKey arrayKey;
    private final Set<String> excluded;
    private final boolean join;
    private final int fanout;

    /**
     * Creates a sarger for one key of an index.
     *
     * @param key the key, formalized to the scanned alias
     * @param alias the alias of the scanned keyspace
     * @param join whether the scan runs on the inner side of a nested-loop join
     * @param fanout the most points an IN list may expand to
     */
    public KeySarger(IndexKey key, String alias, boolean join, int fanout) {
        this(key.expression(),
            key.isArray() ? key : null,
            key.isArray() ? Set.of(alias, key.variable()) : Set.of(alias),
            join, fanout);
    }

    private KeySarger(Expression key, IndexKey arrayKey, Set<String> excluded, boolean join, int fanout) {
        this.key = key;
        this.arrayKey = arrayKey;
        this.excluded = excluded;
        this.join = join;
        this.fanout = fanout;
    }

    /**
     * Returns the spans of the key for a predicate.
     *
     * @param pred the predicate, over the scanned alias
     * @return the spans, or null if the predicate does not relate to the key
     */
    public SargSpans sarg(Expression pred) {
        if (arrayKey == null) {
            if (pred.equals(key)) {
                return TermSpans.EXACT_SELF;
            }
            if (isPredicateKey() && Implication.implies(pred, key)) {
                return TermSpans.SELF;
            }
        }
        return pred.accept(this);
    }

    /**
     * Whether the key is itself a condition, as in an index on {@code x > 10}.
     */
    private boolean isPredicateKey() {
        return key instanceof Comparison || key instanceof IsExpression || key instanceof Between
            || key instanceof Like || key instanceof In || key instanceof And || key instanceof Or;
    }

    private boolean isKey(Expression expr) {
        return arrayKey == null && expr.equals(key);
    }

    private boolean isBound(Expression expr) {
        if (Expressions.containsSubquery(expr)) {
            return false;
        }
        Set<String> names = Expressions.freeNames(expr);
        if (names.isEmpty()) {
            return true;
        }
        if (!join) {
            return false;
        }
        return Collections.disjoint(names, excluded);
    }

    private static Optional<Value> staticValue(Expression expr) {
        return Expressions.staticValue(expr);
    }

    private static boolean isUnknown(Expression bound) {
        Optional<Value> value = staticValue(bound);
        return value.isPresent() && !value.get().isKnown();
    }

    /**
     * Fallback for a predicate that mentions the key without bounding it. Only
     * shapes that are never TRUE for a MISSING or NULL operand qualify.
     */
    private SargSpans visitDefault(Expression pred) {
        if (arrayKey != null) {
            return null;
        }
        boolean propagating = pred instanceof Comparison || pred instanceof Between
            || pred instanceof Like || pred instanceof In || pred instanceof Within;
        if (pred instanceof Not) {
            Expression operand = ((Not) pred).operand();
            propagating = operand instanceof Comparison || operand instanceof Between
                || operand instanceof Like || operand instanceof In || operand instanceof Within;
        }
        if (propagating && Expressions.contains(pred, key)) {
            return TermSpans.VALUED;
        }
        return null;
    }

    // ==================== Connectives ====================

    @Override
    public SargSpans visitAnd(And pred) {
        SargSpans result = null;
        boolean complete = true;
        for (Expression operand : pred.operands()) {
            SargSpans spans = sarg(operand);
            if (spans == null) {
                complete = false;
                continue;
            }
            result = result == null ? spans : SpanAlgebra.constrain(result, spans);
        }
        if (result == null) {
            return null;
        }
        return complete ? result : SpanAlgebra.inexact(result);
    }

    @Override
    public SargSpans visitOr(Or pred) {
        List<SargSpans> branches = new ArrayList<>();
        for (Expression operand : pred.operands()) {
            SargSpans spans = sarg(operand);
            if (spans == null) {
                return null;
            }
            branches.add(spans);
        }
        return SpanAlgebra.union(branches);
    }

    @Override
    public SargSpans visitNot(Not pred) {
        return visitDefault(pred);
    }

    // ==================== Comparisons ====================

    @Override
    public SargSpans visitComparison(Comparison pred) {
        if (isKey(pred.left()) && isBound(pred.right())) {
            return range(pred.operator(), pred.right());
        }
        if (isKey(pred.right()) && isBound(pred.left())) {
            return range(pred.operator().mirror(), pred.left());
        }
        return visitDefault(pred);
    }

    private SargSpans range(Comparison.Operator operator, Expression bound) {
        if (isUnknown(bound)) {
            return SentinelSpans.EMPTY;
        }
        switch (operator) {
            case EQ:
                return TermSpans.single(KeyRange.point(bound), true);
            case NE:
                return TermSpans.of(
                    Span.of(KeyRange.below(bound, false), true),
                    Span.of(KeyRange.above(bound, false), true));
            case LT:
                return TermSpans.single(KeyRange.below(bound, false), true);
            case LE:
                return TermSpans.single(KeyRange.below(bound, true), true);
            case GT:
                return TermSpans.single(KeyRange.above(bound, false), true);
            case GE:
                return TermSpans.single(KeyRange.above(bound, true), true);
            default:
                throw new IllegalStateException("Unknown comparison operator: " + operator);
        }
    }

    @Override
    public SargSpans visitBetween(Between pred) {
        if (!isKey(pred.operand()) || !isBound(pred.low()) || !isBound(pred.high())) {
            return visitDefault(pred);
        }
        if (isUnknown(pred.low()) || isUnknown(pred.high())) {
            return SentinelSpans.EMPTY;
        }
        KeyRange range = new KeyRange(pred.low(), pred.high(), Inclusion.BOTH);
        if (range.isEmpty()) {
            return SentinelSpans.EMPTY;
        }
        return TermSpans.single(range, true);
    }

    @Override
    public SargSpans visitLike(Like pred) {
        if (!isKey(pred.operand()) || !isBound(pred.pattern())) {
            return visitDefault(pred);
        }
        Optional<Value> pattern = staticValue(pred.pattern());
        if (pattern.isEmpty()) {
            return TermSpans.VALUED;
        }
        if (!pattern.get().isKnown()) {
            return SentinelSpans.EMPTY;
        }
        if (pattern.get().type() != ValueType.STRING) {
            return SentinelSpans.EMPTY;
        }
        PatternPrefix prefix = pred.isRegex()
            ? PatternPrefix.ofRegex(pattern.get().string())
            : PatternPrefix.ofLike(pattern.get().string());
        if (prefix.literal) {
            return TermSpans.single(KeyRange.point(Value.of(prefix.prefix)), true);
        }
        if (prefix.prefix.isEmpty()) {
            return TermSpans.VALUED;
        }
        KeyRange range = new KeyRange(Literal.of(prefix.prefix), new Literal(successor(prefix.prefix)), Inclusion.LOW);
        return TermSpans.single(range, prefix.exactRange);
    }

    /**
     * Returns the smallest value greater than every string starting with a prefix:
     * the next string, or the empty array when every character is the largest one.
     */
    static Value successor(String prefix) {
        StringBuilder sb = new StringBuilder(prefix);
        for (int i = sb.length() - 1; i >= 0; i--) {
            char c = sb.charAt(i);
            if (c < Character.MAX_VALUE) {
                sb.setCharAt(i, (char) (c + 1));
                sb.setLength(i + 1);
                return Value.of(sb.toString());
            }
        }
        // arrays collate right after strings
        return Value.of(List.of());
    }

    @Override
    public SargSpans visitIn(In pred) {
        if (!isKey(pred.operand()) || !isBound(pred.collection())) {
            return visitDefault(pred);
        }
        Optional<Value> collection = staticValue(pred.collection());
        if (collection.isPresent()) {
            return staticPoints(collection.get());
        }
        if (pred.collection() instanceof ArrayConstruct) {
            List<Expression> elements = ((ArrayConstruct) pred.collection()).elements();
            Set<Expression> distinct = new LinkedHashSet<>();
            for (Expression element : elements) {
                if (!isUnknown(element)) {
                    distinct.add(element);
                }
            }
            if (distinct.isEmpty()) {
                return TermSpans.VALUED;
            }
            if (distinct.size() <= fanout) {
                List<Span> spans = new ArrayList<>();
                for (Expression element : distinct) {
                    spans.add(Span.of(KeyRange.point(element), true));
                }
                return new TermSpans(spans);
            }
        }
        // resolved at execution: scan from the smallest to the largest element
        KeyRange range = new KeyRange(
            new FunctionCall("ARRAY_MIN", pred.collection()),
            new FunctionCall("ARRAY_MAX", pred.collection()),
            Inclusion.BOTH);
        return TermSpans.single(range, false);
    }

    private SargSpans staticPoints(Value collection) {
        if (collection.type() != ValueType.ARRAY) {
            return SentinelSpans.EMPTY;
        }
        TreeSet<Value> points = new TreeSet<>();
        for (Value element : collection.elements()) {
            if (element.isKnown()) {
                points.add(element);
            }
        }
        if (points.isEmpty()) {
            return TermSpans.VALUED;
        }
        if (points.size() > fanout) {
            return TermSpans.single(
                new KeyRange(new Literal(points.first()), new Literal(points.last()), Inclusion.BOTH), false);
        }
        List<Span> spans = new ArrayList<>(points.size());
        for (Value point : points) {
            spans.add(Span.of(KeyRange.point(point), true));
        }
        return new TermSpans(spans);
    }

    @Override
    public SargSpans visitWithin(Within pred) {
        if (!isKey(pred.operand()) || !isBound(pred.collection())) {
            return visitDefault(pred);
        }
        Optional<Value> collection = staticValue(pred.collection());
        if (collection.isEmpty()) {
            return TermSpans.VALUED;
        }
        TreeSet<Value> points = new TreeSet<>();
        for (Value descendant : collection.get().descendants()) {
            if (!descendant.isKnown()) {
                continue;
            }
            if (!descendant.type().isScalar()) {
                // nested containers can equal the key too; scan every valued key
                return TermSpans.VALUED;
            }
            points.add(descendant);
        }
        if (points.isEmpty()) {
            return SentinelSpans.EMPTY;
        }
        if (points.size() > fanout) {
            return TermSpans.single(
                new KeyRange(new Literal(points.first()), new Literal(points.last()), Inclusion.BOTH), false);
        }
        List<Span> spans = new ArrayList<>(points.size());
        for (Value point : points) {
            spans.add(Span.of(KeyRange.point(point), true));
        }
        return new TermSpans(spans);
    }

    @Override
    public SargSpans visitIs(IsExpression pred) {
        if (!isKey(pred.operand())) {
            return visitDefault(pred);
        }
        switch (pred.kind()) {
            case NULL:
                return TermSpans.single(KeyRange.point(Literal.NULL), true);
            case NOT_NULL:
            case VALUED:
                return TermSpans.EXACT_VALUED;
            case NOT_MISSING:
                return SentinelSpans.EXACT_FULL;
            case MISSING:
            case NOT_VALUED:
                return SentinelSpans.WHOLE;
            default:
                throw new IllegalStateException("Unknown IS kind: " + pred.kind());
        }
    }

    // ==================== Collections ====================

    @Override
    public SargSpans visitQuantified(Quantified pred) {
        if (arrayKey == null || pred.kind() == Quantified.Kind.EVERY || pred.bindings().size() != 1) {
            return visitDefault(pred);
        }
        Quantified.Binding binding = pred.bindings().get(0);
        if (!binding.expression().equals(arrayKey.collection())) {
            return null;
        }
        Expression satisfies = new Rename(binding.variable(), arrayKey.variable()).transform(pred.satisfies());
        KeySarger element = new KeySarger(arrayKey.expression(), null, excluded, join, fanout);
        return element.sarg(satisfies);
    }

    /**
     * Renames a bound variable; stops at a nested binding of the same name.
     */
    private static final class Rename extends ExpressionTransformer {
        private final String from;
        private final String to;

        Rename(String from, String to) {
            this.from = from;
            this.to = to;
        }

        @Override
        public Expression visitIdentifier(Identifier expr) {
            return from.equals(expr.name()) ? new Identifier(to) : expr;
        }

        @Override
        public Expression visitQuantified(Quantified expr) {
            for (Quantified.Binding binding : expr.bindings()) {
                if (binding.variable().equals(from)) {
                    return expr;
                }
            }
            return super.visitQuantified(expr);
        }
    }

    // ==================== Values ====================

    @Override
    public SargSpans visitLiteral(Literal pred) {
        return null;
    }

    @Override
    public SargSpans visitIdentifier(Identifier pred) {
        return null;
    }

    @Override
    public SargSpans visitParameter(Parameter pred) {
        return null;
    }

    @Override
    public SargSpans visitField(Field pred) {
        return null;
    }

    @Override
    public SargSpans visitElement(Element pred) {
        return null;
    }

    @Override
    public SargSpans visitMeta(Meta pred) {
        return null;
    }

    @Override
    public SargSpans visitArithmetic(Arithmetic pred) {
        return null;
    }

    @Override
    public SargSpans visitCaseWhen(CaseWhen pred) {
        return null;
    }

    @Override
    public SargSpans visitArrayConstruct(ArrayConstruct pred) {
        return null;
    }

    @Override
    public SargSpans visitObjectConstruct(ObjectConstruct pred) {
        return null;
    }

    @Override
    public SargSpans visitFunctionCall(FunctionCall pred) {
        return null;
    }

    @Override
    public SargSpans visitSubquery(Subquery pred) {
        return null;
    }

    /**
     * Literal prefix of a LIKE or regular expression pattern.
     */
    static final class PatternPrefix {
        final String prefix;
        final boolean literal;
        final boolean exactRange;

        private PatternPrefix(String prefix, boolean literal, boolean exactRange) {
            this.prefix = prefix;
            this.literal = literal;
            this.exactRange = exactRange;
        }

        static PatternPrefix ofLike(String pattern) {
            StringBuilder prefix = new StringBuilder();
            int i = 0;
            while (i < pattern.length()) {
                char c = pattern.charAt(i);
                if (c == '\\' && i + 1 < pattern.length()) {
                    prefix.append(pattern.charAt(i + 1));
                    i += 2;
                    continue;
                }
                if (c == '%' || c == '_') {
                    break;
                }
                prefix.append(c);
                i++;
            }
            if (i == pattern.length()) {
                return new PatternPrefix(prefix.toString(), true, true);
            }
            // "abc%" selects exactly the strings starting with abc
            boolean exact = i == pattern.length() - 1 && pattern.charAt(i) == '%';
            return new PatternPrefix(prefix.toString(), false, exact);
        }

        static PatternPrefix ofRegex(String pattern) {
            StringBuilder prefix = new StringBuilder();
            int i = 0;
            while (i < pattern.length()) {
                char c = pattern.charAt(i);
                if (c == '\\' && i + 1 < pattern.length()
                        && !Character.isLetterOrDigit(pattern.charAt(i + 1))) {
                    prefix.append(pattern.charAt(i + 1));
                    i += 2;
                    continue;
                }
                if (".[]{}()\\*+?^$|".indexOf(c) >= 0) {
                    break;
                }
                prefix.append(c);
                i++;
            }
            if (i == pattern.length()) {
                return new PatternPrefix(prefix.toString(), true, true);
            }
            // a quantifier makes the last literal character optional
            char stop = pattern.charAt(i);
            if ((stop == '*' || stop == '?' || stop == '{') && prefix.length() > 0) {
                prefix.setLength(prefix.length() - 1);
            }
            boolean exact = pattern.substring(i).equals(".*");
            return new PatternPrefix(prefix.toString(), false, exact);
        }
    }
}
