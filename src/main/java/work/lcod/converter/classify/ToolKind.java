package work.lcod.converter.classify;

/**
 * Canonical processing semantics a workflow node can resolve to.
 */
public enum ToolKind {
    INPUT_DATA("input_data"),
    OUTPUT_DATA("output_data"),
    SELECT("select"),
    FILTER("filter"),
    FORMULA("formula"),
    JOIN("join"),
    UNION("union"),
    SORT("sort"),
    SUMMARIZE("summarize"),
    UNIQUE("unique"),
    SAMPLE("sample"),
    RECORD_ID("record_id"),
    TEXT_TO_COLUMNS("text_to_columns"),
    CROSS_TAB("cross_tab"),
    TRANSPOSE("transpose"),
    BROWSE("browse"),
    TEXT_INPUT("text_input"),
    MACRO("macro"),
    UNKNOWN("unknown");

    private final String tag;

    ToolKind(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }
}
