package org.pragmatica.querylang.syntax;

import org.pragmatica.querylang.ast.QueryNode;
import org.pragmatica.querylang.peg.action.Action;
import org.pragmatica.querylang.peg.action.SemanticValues;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * PEG grammar of the query language and the actions folding its matches into {@link QueryNode}s.
 *
 * <p>Precedence, tightest first: {@code NOT}, {@code NEAR/n}, {@code AND}, {@code OR}.
 * Binary operators fold into left-leaning chains; {@code NEAR} collapses to {@code AND}.
 */
final class QueryGrammar {
    private static final Pattern ESCAPE = Pattern.compile("\\\\(.)", Pattern.DOTALL);

    private static final String TEMPLATE = """
        Query    <- OrExpr
        OrExpr   <- AndExpr (OrOp AndExpr)*
        AndExpr  <- NearExpr (AndOp NearExpr)*
        NearExpr <- NotExpr (NearOp NotExpr)*
        NotExpr  <- Negation / Atom
        Negation <- NotOp NotExpr
        Atom     <- '(' OrExpr ')' / Term
        Term     <- Literal / Phrase / Word

        # {ABC}: kept verbatim, delimiters included
        Literal  <- < %1$s (!%2$s .)* %2$s >
        Phrase   <- < '"' ('\\\\' . / [^"\\\\])+ '"' >
        Word     <- !Keyword !%1$s < WordChar+ >

        Keyword  <- NotOp / AndOp / OrOp / NearOp
        NotOp    <- 'NOT'i !WordChar
        AndOp    <- 'AND'i !WordChar
        OrOp     <- 'OR'i !WordChar
        NearOp   <- < 'NEAR/'i [0-9]+ 'f'i? > !WordChar
        WordChar <- [^ \\t\\r\\n()"]

        %%whitespace <- [ \\t\\r\\n]*
        """;

    private QueryGrammar() {}

    static String grammarText(String literalOpen, String literalClose) {
        return TEMPLATE.formatted(quote(literalOpen), quote(literalClose));
    }

    static Map<String, Action> actions(boolean caseFold) {
        Function<String, String> fold = caseFold
                                        ? text -> text.toLowerCase(Locale.ROOT)
                                        : Function.identity();
        return Map.of(
            "OrExpr", sv -> foldLeft(sv, QueryNode::or),
            "AndExpr", sv -> foldLeft(sv, QueryNode::and),
            "NearExpr", sv -> foldLeft(sv, QueryNode::and),
            "Negation", sv -> QueryNode.not(sv.get(0)),
            "Literal", sv -> QueryNode.literal(sv.token()),
            "Phrase", sv -> QueryNode.term(fold.apply(unquote(sv.token()))),
            "Word", sv -> QueryNode.term(fold.apply(sv.token()))
        );
    }

    private static QueryNode foldLeft(SemanticValues sv, BinaryNode combine) {
        List<QueryNode> operands = sv.transform();
        var result = operands.get(0);
        for (int i = 1; i < operands.size(); i++) {
            result = combine.apply(result, operands.get(i));
        }
        return result;
    }

    private static String unquote(String phrase) {
        return ESCAPE.matcher(phrase.substring(1, phrase.length() - 1))
                     .replaceAll("$1");
    }

    /**
     * Render text as a single-quoted grammar literal.
     */
    private static String quote(String text) {
        var sb = new StringBuilder(text.length() + 2).append('\'');
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\\' || c == '\'') {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.append('\'')
                 .toString();
    }

    @FunctionalInterface
    private interface BinaryNode {
        QueryNode apply(QueryNode left, QueryNode right);
    }
}
