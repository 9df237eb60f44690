package org.proplogic.evaluation;

import org.proplogic.support.FormulaNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * GENERATORE DI TABELLE DI VERITÀ
 *
 * Enumera tutti gli assegnamenti delle variabili libere con un contatore da 0
 * a 2^n - 1: il bit j del contatore è il valore della variabile in posizione j
 * (la prima variabile raccolta è il bit meno significativo).
 *
 * CASI:
 * • 0 variabili: intestazione vuota e una sola riga con il valore costante
 * • 1-4 variabili: 2^n righe in ordine crescente del contatore
 * • più di 4 variabili: intestazione e righe vuote, nessuna enumerazione
 */
public final class TruthTableGenerator {

    private static final Logger LOGGER = Logger.getLogger(TruthTableGenerator.class.getName());

    /** Numero massimo di variabili libere enumerate */
    public static final int MAX_VARIABLES = 4;

    private TruthTableGenerator() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * @param formula albero sintattico
     * @return tabella di verità della formula
     */
    public static TruthTable createTruthTable(FormulaNode formula) {
        List<String> symbols = SymbolCollector.collect(formula);

        if (symbols.size() > MAX_VARIABLES) {
            LOGGER.warning(() -> "Tabella non generata: " + symbols.size()
                    + " variabili libere, massimo " + MAX_VARIABLES);
            return TruthTable.notEnumerated();
        }

        if (symbols.isEmpty()) {
            boolean constant = FormulaEvaluator.evaluate(formula);
            List<TruthTable.Row> rows = List.of(new TruthTable.Row(Collections.emptyList(), constant));
            return new TruthTable(symbols, rows, true);
        }

        int rowCount = 1 << symbols.size();
        List<TruthTable.Row> rows = new ArrayList<>(rowCount);

        for (int counter = 0; counter < rowCount; counter++) {
            List<Boolean> inputs = new ArrayList<>(symbols.size());
            Map<String, Boolean> assignment = new HashMap<>();

            for (int index = 0; index < symbols.size(); index++) {
                boolean value = ((counter >> index) & 1) == 1;
                inputs.add(value);
                assignment.put(symbols.get(index), value);
            }

            rows.add(new TruthTable.Row(inputs, FormulaEvaluator.evaluate(formula, assignment)));
        }

        LOGGER.fine(() -> "Tabella generata: " + symbols + ", " + rowCount + " righe");
        return new TruthTable(symbols, rows, true);
    }
}
