package work.lcod.converter.script;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Line counts of a generated script. Comment lines start with {@code #} once trimmed.
 */
public record ScriptStatistics(int totalLines, int codeLines, int commentLines, int blankLines) {
    public static ScriptStatistics of(String script) {
        if (script == null || script.isEmpty()) {
            return new ScriptStatistics(0, 0, 0, 0);
        }
        String[] lines = script.split("\n", -1);
        int total = lines.length;
        // a trailing newline does not start another line
        if (script.endsWith("\n")) {
            total--;
        }
        int code = 0;
        int comments = 0;
        int blank = 0;
        for (int i = 0; i < total; i++) {
            String trimmed = lines[i].trim();
            if (trimmed.isEmpty()) {
                blank++;
            } else if (trimmed.startsWith("#")) {
                comments++;
            } else {
                code++;
            }
        }
        return new ScriptStatistics(total, code, comments, blank);
    }

    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("totalLines", totalLines);
        map.put("codeLines", codeLines);
        map.put("commentLines", commentLines);
        map.put("blankLines", blankLines);
        return map;
    }
}
