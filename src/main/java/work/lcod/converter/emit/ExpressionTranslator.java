package work.lcod.converter.emit;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Rewrites workflow expressions into pandas expressions. This is a token rewrite, not a parser.
 *
 * <p>Handled: {@code [Field]} references become {@code var['Field']}, a fixed set of function names and boolean
 * keywords is mapped, {@code =} becomes {@code ==} and {@code <>} becomes {@code !=}. Quoted strings are copied with
 * their line breaks escaped; line breaks between tokens become single spaces, so the result always fits on one line.
 * Anything else (IF/THEN/ELSE/ENDIF blocks, unmapped functions) passes through and may need manual repair.
 */
public final class ExpressionTranslator {
    private static final Map<String, String> TOKENS = new LinkedHashMap<>();

    static {
        TOKENS.put("TONUMBER", "pd.to_numeric");
        TOKENS.put("TOSTRING", "str");
        TOKENS.put("DATETIMENOW", "pd.Timestamp.now");
        TOKENS.put("DATETIMEPARSE", "pd.to_datetime");
        TOKENS.put("SUBSTRING", "str.slice");
        TOKENS.put("LENGTH", "str.len");
        TOKENS.put("TRIM", "str.strip");
        TOKENS.put("UPPER", "str.upper");
        TOKENS.put("LOWER", "str.lower");
        TOKENS.put("CONTAINS", "str.contains");
        TOKENS.put("ISNULL", "isna");
        TOKENS.put("IF", "np.where");
        TOKENS.put("AND", "&");
        TOKENS.put("OR", "|");
        TOKENS.put("NOT", "~");
    }

    private ExpressionTranslator() {}

    public static Map<String, String> tokenTable() {
        return Collections.unmodifiableMap(TOKENS);
    }

    public static Translation translate(String expression, String variable) {
        var out = new StringBuilder(expression.length() + 16);
        Set<String> imports = new TreeSet<>();
        int i = 0;
        int length = expression.length();
        while (i < length) {
            char c = expression.charAt(i);
            if (c == '[') {
                int close = expression.indexOf(']', i + 1);
                if (close < 0) {
                    out.append(expression, i, length);
                    break;
                }
                out.append(variable).append('[').append(PythonLiterals.quote(expression.substring(i + 1, close))).append(']');
                i = close + 1;
            } else if (c == '"' || c == '\'') {
                int close = expression.indexOf(c, i + 1);
                int end = close < 0 ? length : close + 1;
                appendLiteral(out, expression, i, end);
                i = end;
            } else if (Character.isLetter(c) || c == '_') {
                int end = i + 1;
                while (end < length && isWordChar(expression.charAt(end))) {
                    end++;
                }
                String word = expression.substring(i, end);
                String mapped = TOKENS.get(word.toUpperCase(Locale.ROOT));
                if (mapped == null) {
                    out.append(word);
                } else {
                    out.append(mapped);
                    if (mapped.startsWith("np.")) {
                        imports.add(Fragment.NUMPY);
                    } else if (mapped.startsWith("pd.")) {
                        imports.add(Fragment.PANDAS);
                    }
                }
                i = end;
            } else if (Character.isDigit(c)) {
                int end = i + 1;
                while (end < length && (isWordChar(expression.charAt(end)) || expression.charAt(end) == '.')) {
                    end++;
                }
                out.append(expression, i, end);
                i = end;
            } else if (c == '<' && next(expression, i) == '>') {
                out.append("!=");
                i += 2;
            } else if ((c == '<' || c == '>' || c == '!' || c == '=') && next(expression, i) == '=') {
                out.append(c).append('=');
                i += 2;
            } else if (c == '=') {
                out.append("==");
                i++;
            } else if (c == '\r' || c == '\n') {
                out.append(' ');
                i += c == '\r' && next(expression, i) == '\n' ? 2 : 1;
            } else {
                out.append(c);
                i++;
            }
        }
        return new Translation(out.toString(), imports);
    }

    private static void appendLiteral(StringBuilder out, String expression, int start, int end) {
        for (int i = start; i < end; i++) {
            char c = expression.charAt(i);
            if (c == '\n') {
                out.append("\\n");
            } else if (c == '\r') {
                out.append("\\r");
            } else {
                out.append(c);
            }
        }
    }

    private static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    private static char next(String text, int index) {
        return index + 1 < text.length() ? text.charAt(index + 1) : '\0';
    }

    /**
     * Translated text and the imports its mapped functions rely on.
     */
    public record Translation(String text, Set<String> imports) {
        public Translation {
            imports = Collections.unmodifiableSet(new TreeSet<>(imports));
        }
    }
}
