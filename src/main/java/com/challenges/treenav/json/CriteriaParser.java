package com.challenges.treenav.json;

import com.challenges.treenav.search.SearchCriteria;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Parses the textual criteria accepted on the command line.
 * <pre>
 *   *                 any entry
 *   type=object       entries of a JSON type
 *   name=id           name equals       name^=it   name starts with
 *   name$=_at         name ends with    name~=re   name matches regex
 *   value=42          scalar text equals
 *   value~=re         scalar text matches regex
 *   !term             negation
 *   term&amp;term         conjunction
 * </pre>
 * A literal <code>&amp;</code> inside a term is escaped with a backslash, e.g. <code>name=R\&amp;D</code>.
 */
public class CriteriaParser {

    public SearchCriteria<JsonEntry> parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("Empty criteria");
        }

        MutableList<SearchCriteria<JsonEntry>> terms = Lists.mutable.empty();
        for (String term : splitTerms(expression)) {
            terms.add(parseTerm(term.trim(), expression));
        }
        return terms.size() == 1 ? terms.getFirst() : SearchCriteria.allOf(terms);
    }

    // Splits on unescaped '&'; an escaped one is kept as a literal '&'
    private MutableList<String> splitTerms(String expression) {
        MutableList<String> terms = Lists.mutable.empty();
        StringBuilder current = new StringBuilder();
        for (int i = 0; i < expression.length(); i++) {
            char c = expression.charAt(i);
            if (c == '\\' && i + 1 < expression.length() && expression.charAt(i + 1) == '&') {
                current.append('&');
                i++;
            } else if (c == '&') {
                terms.add(current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        terms.add(current.toString());
        return terms;
    }

    private SearchCriteria<JsonEntry> parseTerm(String term, String expression) {
        if (term.isEmpty()) {
            throw new IllegalArgumentException("Empty term in criteria: " + expression);
        }

        if (term.startsWith("!")) {
            return parseTerm(term.substring(1).trim(), expression).negate();
        }

        if (term.equals("*")) {
            return SearchCriteria.wildcard();
        }

        if (term.startsWith("type=")) {
            return JsonCriteria.ofType(JsonKind.fromLabel(term.substring(5).trim()));
        }

        if (term.startsWith("name^=")) {
            return JsonCriteria.nameStartsWith(term.substring(6));
        }
        if (term.startsWith("name$=")) {
            return JsonCriteria.nameEndsWith(term.substring(6));
        }
        if (term.startsWith("name~=")) {
            return JsonCriteria.nameMatches(compile(term.substring(6)));
        }
        if (term.startsWith("name=")) {
            return JsonCriteria.nameEquals(term.substring(5));
        }

        if (term.startsWith("value~=")) {
            return JsonCriteria.valueMatches(compile(term.substring(7)));
        }
        if (term.startsWith("value=")) {
            return JsonCriteria.valueEquals(term.substring(6));
        }

        throw new IllegalArgumentException("Unsupported criteria: " + term);
    }

    private Pattern compile(String regex) {
        try {
            return Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("Invalid pattern: " + regex, e);
        }
    }
}
