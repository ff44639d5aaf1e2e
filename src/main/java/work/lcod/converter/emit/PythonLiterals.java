package work.lcod.converter.emit;

/**
 * Escaping for values spliced into generated Python source.
 */
public final class PythonLiterals {
    private PythonLiterals() {}

    /**
     * Single-quoted Python string literal.
     */
    public static String quote(String value) {
        var out = new StringBuilder(value.length() + 2).append('\'');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\\' -> out.append("\\\\");
                case '\'' -> out.append("\\'");
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                case '\t' -> out.append("\\t");
                default -> out.append(c);
            }
        }
        return out.append('\'').toString();
    }

    /**
     * Text safe to put after a {@code #} comment marker.
     */
    public static String commentText(String value) {
        return value.replace('\r', ' ').replace('\n', ' ');
    }
}
