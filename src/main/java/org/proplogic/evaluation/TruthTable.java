package org.proplogic.evaluation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * TABELLA DI VERITÀ - Contenitore immutabile dell'enumerazione di una formula
 *
 * L'intestazione elenca le variabili libere nell'ordine di raccolta; ogni riga
 * contiene un valore per variabile, nello stesso ordine, e il risultato della
 * formula per quell'assegnamento.
 *
 * Una tabella non enumerata (formula con troppe variabili) ha intestazione e
 * righe vuote.
 */
public final class TruthTable {

    /** Intestazione della colonna del risultato nella forma testuale */
    public static final String RESULT_COLUMN = "=";

    private final List<String> header;
    private final List<Row> rows;
    private final boolean enumerated;

    TruthTable(List<String> header, List<Row> rows, boolean enumerated) {
        this.header = Collections.unmodifiableList(new ArrayList<>(header));
        this.rows = Collections.unmodifiableList(new ArrayList<>(rows));
        this.enumerated = enumerated;
    }

    static TruthTable notEnumerated() {
        return new TruthTable(Collections.emptyList(), Collections.emptyList(), false);
    }

    /** Variabili libere in ordine di prima occorrenza */
    public List<String> getHeader() {
        return header;
    }

    /** Righe in ordine crescente del contatore di enumerazione */
    public List<Row> getRows() {
        return rows;
    }

    /** @return false se la formula superava il limite di variabili */
    public boolean isEnumerated() {
        return enumerated;
    }

    //region RIEPILOGO

    public boolean isTautology() {
        return enumerated && rows.stream().allMatch(Row::getOutput);
    }

    public boolean isContradiction() {
        return enumerated && rows.stream().noneMatch(Row::getOutput);
    }

    public boolean isSatisfiable() {
        return enumerated && rows.stream().anyMatch(Row::getOutput);
    }

    //endregion

    //region FORMATTAZIONE

    /**
     * Forma testuale allineata, una riga per assegnamento, con 1 e 0 come valori.
     *
     * <pre>
     * a | b | =
     * --+---+--
     * 0 | 0 | 0
     * 1 | 0 | 0
     * </pre>
     */
    public String format() {
        if (!enumerated) {
            return "Tabella di verità non generata: più di "
                    + TruthTableGenerator.MAX_VARIABLES + " variabili libere";
        }

        List<String> columns = new ArrayList<>(header);
        columns.add(RESULT_COLUMN);

        int[] widths = new int[columns.size()];
        for (int i = 0; i < widths.length; i++) {
            widths[i] = Math.max(1, columns.get(i).length());
        }

        StringBuilder sb = new StringBuilder();
        appendLine(sb, columns, widths);

        List<String> separators = new ArrayList<>();
        for (int width : widths) {
            separators.add("-".repeat(width));
        }
        sb.append(String.join("-+-", separators)).append('\n');

        for (Row row : rows) {
            List<String> cells = new ArrayList<>();
            for (Boolean input : row.getInputs()) {
                cells.add(input ? "1" : "0");
            }
            cells.add(row.getOutput() ? "1" : "0");
            appendLine(sb, cells, widths);
        }

        return sb.toString();
    }

    private static void appendLine(StringBuilder sb, List<String> cells, int[] widths) {
        for (int i = 0; i < cells.size(); i++) {
            if (i > 0) {
                sb.append(" | ");
            }
            String cell = cells.get(i);
            sb.append(cell).append(" ".repeat(widths[i] - cell.length()));
        }
        // Niente spazi finali sull'ultima colonna
        int end = sb.length();
        while (end > 0 && sb.charAt(end - 1) == ' ') {
            end--;
        }
        sb.setLength(end);
        sb.append('\n');
    }

    //endregion

    @Override
    public String toString() {
        return "TruthTable{header=" + header + ", rows=" + rows.size() + ", enumerated=" + enumerated + "}";
    }

    /**
     * Riga della tabella: valori delle variabili in ordine di intestazione e risultato.
     */
    public static final class Row {

        private final List<Boolean> inputs;
        private final boolean output;

        Row(List<Boolean> inputs, boolean output) {
            this.inputs = Collections.unmodifiableList(new ArrayList<>(inputs));
            this.output = output;
        }

        public List<Boolean> getInputs() {
            return inputs;
        }

        public boolean getOutput() {
            return output;
        }

        @Override
        public String toString() {
            return inputs + " -> " + output;
        }
    }
}
