package work.lcod.converter.emit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;
import work.lcod.converter.classify.ToolKind;

class PreparationGeneratorsTest {
    @Test
    void filterTranslatesExpressionAgainstSource() {
        assertEquals(
            List.of(
                "# Apply filter",
                "df_9 = df_1[df_1['Amount'] > 100]",
                "print('Filter:', len(df_9), 'rows (from', len(df_1), ')')"
            ),
            GeneratorHarness.lines(ToolKind.FILTER, Map.of("Expression", "[Amount] > 100"), "1")
        );
    }

    @Test
    void filterWithoutExpressionCopies() {
        List<String> lines = GeneratorHarness.lines(ToolKind.FILTER, Map.of("Mode", "Simple"), "1");
        assertTrue(lines.contains("# TODO: Add filter condition"));
        assertTrue(lines.contains("df_9 = df_1.copy()"));
    }

    @Test
    void filterCarriesExpressionImports() {
        Fragment fragment = GeneratorHarness.generate(ToolKind.FILTER, Map.of("Filter", "ISNULL([A]) OR IF [B]"), "1");
        assertTrue(fragment.lines().contains("df_9 = df_1[isna(df_1['A']) | np.where df_1['B']]"));
        assertEquals(Set.of(Fragment.NUMPY), fragment.imports());
    }

    @Test
    void formulaWritesTargetColumn() {
        assertEquals(
            List.of(
                "# Apply formula",
                "df_9 = df_1.copy()",
                "df_9['Total'] = df_9['Price'] * df_9['Qty']"
            ),
            GeneratorHarness.lines(ToolKind.FORMULA, Map.of("Expression", "[Price] * [Qty]", "Field", "Total"), "1")
        );
    }

    @Test
    void formulaReadsFormulaFieldAttributes() {
        Map<String, Object> config = Map.of(
            "FormulaFields", Map.of("FormulaField", Map.of("expression", "[A] + 1", "field", "B"))
        );
        assertTrue(GeneratorHarness.lines(ToolKind.FORMULA, config, "1").contains("df_9['B'] = df_9['A'] + 1"));
    }

    @Test
    void formulaSpanningSeveralLinesStaysOnOneStatement() {
        Map<String, Object> config = Map.of(
            "Expression", "IF [Amount] > 100\nTHEN 'big'\nELSE 'small' ENDIF",
            "Field", "Band"
        );
        assertEquals(
            List.of(
                "# Apply formula",
                "df_9 = df_1.copy()",
                "df_9['Band'] = np.where df_9['Amount'] > 100 THEN 'big' ELSE 'small' ENDIF"
            ),
            GeneratorHarness.lines(ToolKind.FORMULA, config, "1")
        );
    }

    @Test
    void filterSpanningSeveralLinesStaysOnOneStatement() {
        List<String> lines = GeneratorHarness.lines(
            ToolKind.FILTER,
            Map.of("Expression", "[Amount] > 100\r\nAND [Region] = 'West'"),
            "1"
        );
        assertTrue(lines.contains("df_9 = df_1[df_1['Amount'] > 100 & df_1['Region'] == 'West']"), lines.toString());
    }

    @Test
    void formulaWithoutExpressionUsesPlaceholder() {
        List<String> lines = GeneratorHarness.lines(ToolKind.FORMULA, Map.of(), "1");
        assertTrue(lines.contains("# TODO: Add formula expression"));
        assertTrue(lines.contains("df_9['new_column'] = None"));
    }

    @Test
    void sortUsesConfiguredField() {
        Map<String, Object> config = Map.of("SortInfo", Map.of("Field", Map.of("field", "Amount", "order", "Descending")));
        assertTrue(GeneratorHarness.lines(ToolKind.SORT, config, "1")
            .contains("df_9 = df_1.sort_values('Amount', ascending=False)"));
    }

    @Test
    void sortWithoutFieldLeavesPlaceholder() {
        assertEquals(
            List.of(
                "# Sort data",
                "# TODO: Specify sort columns and order",
                "df_9 = df_1.sort_values('column_name', ascending=True)"
            ),
            GeneratorHarness.lines(ToolKind.SORT, Map.of(), "1")
        );
    }

    @Test
    void sampleUsesNumericSize() {
        assertTrue(GeneratorHarness.lines(ToolKind.SAMPLE, Map.of("N", " 25 "), "1")
            .contains("df_9 = df_1.sample(n=25, random_state=42)"));
        assertTrue(GeneratorHarness.lines(ToolKind.SAMPLE, Map.of("N", "all"), "1")
            .contains("df_9 = df_1.sample(n=100, random_state=42)"));
    }

    @Test
    void uniqueDropsDuplicates() {
        assertTrue(GeneratorHarness.lines(ToolKind.UNIQUE, Map.of(), "1").contains("df_9 = df_1.drop_duplicates()"));
    }

    @Test
    void recordIdAddsCounter() {
        assertEquals(
            List.of(
                "# Add record ID",
                "df_9 = df_1.copy()",
                "df_9['RecordID'] = range(1, len(df_9) + 1)"
            ),
            GeneratorHarness.lines(ToolKind.RECORD_ID, Map.of(), "1")
        );
    }

    @Test
    void selectCopiesSource() {
        assertTrue(GeneratorHarness.lines(ToolKind.SELECT, Map.of(), "1").contains("df_9 = df_1.copy()"));
    }

    @Test
    void missingSourceBecomesComment() {
        assertEquals(List.of("# Select tool: No source data"), GeneratorHarness.lines(ToolKind.SELECT, Map.of()));
        assertEquals(List.of("# Filter tool: No source data"), GeneratorHarness.lines(ToolKind.FILTER, Map.of()));
        assertEquals(List.of("# Record ID tool: No source data"), GeneratorHarness.lines(ToolKind.RECORD_ID, Map.of()));
    }
}
