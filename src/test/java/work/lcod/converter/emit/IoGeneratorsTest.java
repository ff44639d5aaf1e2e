package work.lcod.converter.emit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;
import work.lcod.converter.classify.ToolKind;

class IoGeneratorsTest {
    @Test
    void readsCsv() {
        Fragment fragment = GeneratorHarness.generate(ToolKind.INPUT_DATA, Map.of("File", "a.csv"));
        assertEquals(
            List.of(
                "# Read input file: a.csv",
                "df_9 = pd.read_csv('a.csv')",
                "print('Loaded', len(df_9), 'rows from', 'a.csv')"
            ),
            fragment.lines()
        );
        assertEquals(Set.of(Fragment.PANDAS), fragment.imports());
        assertFalse(fragment.needsManualCompletion());
    }

    @Test
    void readsExcelWithOpenpyxl() {
        Fragment fragment = GeneratorHarness.generate(ToolKind.INPUT_DATA, Map.of("FileName", "Sales.XLSX"));
        assertTrue(fragment.lines().contains("df_9 = pd.read_excel('Sales.XLSX')"));
        assertEquals(Set.of(Fragment.OPENPYXL, Fragment.PANDAS), fragment.imports());
    }

    @Test
    void readsDelimitedText() {
        assertTrue(GeneratorHarness.lines(ToolKind.INPUT_DATA, Map.of("File", "a.txt", "Delimeter", "|"))
            .contains("df_9 = pd.read_csv('a.txt', delimiter='|')"));
        assertTrue(GeneratorHarness.lines(ToolKind.INPUT_DATA, Map.of("File", "a.txt"))
            .contains("df_9 = pd.read_csv('a.txt', delimiter='\\t')"));
    }

    @Test
    void flagsUnknownExtensions() {
        assertTrue(GeneratorHarness.lines(ToolKind.INPUT_DATA, Map.of("File", "a.json"))
            .contains("df_9 = pd.read_csv('a.json')  # Adjust read method as needed"));
    }

    @Test
    void defaultsInputPath() {
        assertTrue(GeneratorHarness.lines(ToolKind.INPUT_DATA, Map.of())
            .contains("df_9 = pd.read_csv('input.csv')"));
    }

    @Test
    void escapesPathsInLiterals() {
        assertTrue(GeneratorHarness.lines(ToolKind.INPUT_DATA, Map.of("File", "o'neil.csv"))
            .contains("df_9 = pd.read_csv('o\\'neil.csv')"));
    }

    @Test
    void writesPrimarySource() {
        assertEquals(
            List.of(
                "# Write output file: b.csv",
                "df_2.to_csv('b.csv', index=False)",
                "print('Wrote', len(df_2), 'rows to', 'b.csv')"
            ),
            GeneratorHarness.lines(ToolKind.OUTPUT_DATA, Map.of("File", "b.csv", "FileName_Out", "b.csv"), "2", "3")
        );
    }

    @Test
    void writesExcel() {
        Fragment fragment = GeneratorHarness.generate(ToolKind.OUTPUT_DATA, Map.of("File", "out.xlsx"), "2");
        assertTrue(fragment.lines().contains("df_2.to_excel('out.xlsx', index=False)"));
        assertEquals(Set.of(Fragment.OPENPYXL), fragment.imports());
    }

    @Test
    void outputWithoutSourceIsComment() {
        assertEquals(List.of("# Output tool 9: No source data"), GeneratorHarness.lines(ToolKind.OUTPUT_DATA, Map.of()));
    }

    @Test
    void browsePrintsHead() {
        assertEquals(
            List.of(
                "# Display data (Browse equivalent)",
                "print('Browse - First 10 rows:')",
                "print(df_4.head(10))",
                "print('Shape:', df_4.shape)"
            ),
            GeneratorHarness.lines(ToolKind.BROWSE, Map.of(), "4")
        );
        assertEquals(List.of("# Browse tool: No source data"), GeneratorHarness.lines(ToolKind.BROWSE, Map.of()));
    }
}
