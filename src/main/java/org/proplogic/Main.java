package org.proplogic;

import org.proplogic.evaluation.FormulaEvaluator;
import org.proplogic.evaluation.TruthTable;
import org.proplogic.evaluation.TruthTableGenerator;
import org.proplogic.parser.FormulaParseException;
import org.proplogic.parser.FormulaParser;
import org.proplogic.support.FormulaNode;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * ANALIZZATORE DI FORMULE PROPOSIZIONALI
 *
 * PIPELINE DI ELABORAZIONE:
 * 1. INPUT: Formula da linea di comando (-e) o da file di testo (-f)
 * 2. PARSING: Tokenizzazione, raggruppamento, fusione unari, precedenze, validazione
 * 3. OUTPUT, secondo le opzioni:
 *    - Forma lineare postfissa (-rpn)
 *    - Valutazione sotto un assegnamento (-a p=1,q=0)
 *    - Tabella di verità fino a 4 variabili libere (-tt)
 *
 * Senza opzioni di output vengono mostrate forma lineare e tabella di verità.
 *
 * CONNETTIVI: ∨ ∧ ¬ → ↔ ← oppure or, and, not, implies, impl, ->, <->, ==, <-
 * COSTANTI: 1 (vero), 0 (falso)
 */
public final class Main {

    //region CONFIGURAZIONE PARAMETRI APPLICAZIONE

    /**
     * Parametri linea di comando supportati
     * */
    static final String HELP_PARAM = "-h";
    static final String EXPRESSION_PARAM = "-e";
    static final String FILE_PARAM = "-f";
    static final String ASSIGNMENT_PARAM = "-a";
    static final String TABLE_PARAM = "-tt";
    static final String LINEAR_PARAM = "-rpn";
    static final String VERBOSE_PARAM = "-v";

    /** Logger radice dell'applicazione, usato per la modalità verbosa */
    private static final String ROOT_LOGGER = "org.proplogic";

    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    /**
     * Previene istanziazione - classe utility
     * */
    private Main() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //endregion

    //region PUNTO PRINCIPALE

    public static void main(String[] args) {
        int exitCode = run(args, System.out);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    /**
     * Esegue l'applicazione scrivendo i risultati sullo stream indicato.
     *
     * @param args parametri linea di comando
     * @param out destinazione dei messaggi
     * @return 0 se l'elaborazione è riuscita, 1 altrimenti
     */
    static int run(String[] args, PrintStream out) {
        if (args.length == 0) {
            out.println("[E] Nessun parametro fornito. Usa -h per visualizzare l'help.");
            return 1;
        }

        FormulaConfiguration config;
        try {
            config = new ArgumentParser().parse(args);
        } catch (IllegalArgumentException e) {
            out.println("[E] Errore nella validazione dei parametri: " + e.getMessage());
            out.println("Usa -h per visualizzare l'help completo.");
            return 1;
        }

        if (config == null) {
            printApplicationHelp(out);
            return 0;
        }

        if (config.verbose) {
            enableVerboseLogging();
        }

        try {
            String text = config.formulaText != null ? config.formulaText : readFormulaFromFile(config.inputPath, out);
            FormulaNode formula = FormulaParser.parse(text);
            out.println("[I] Formula: " + formula);
            printRequestedOutputs(formula, config, out);
            return 0;

        } catch (FormulaParseException e) {
            out.println("[E] Formula non valida: " + e.getMessage()
                    + (e.hasOffset() ? " (posizione " + e.getOffset() + ")" : ""));
            return 1;
        } catch (IOException e) {
            LOGGER.log(Level.SEVERE, "Lettura formula fallita", e);
            out.println("[E] Impossibile leggere il file: " + config.inputPath);
            return 1;
        }
    }

    /**
     * Stampa le uscite richieste; senza richieste esplicite forma lineare e tabella.
     */
    private static void printRequestedOutputs(FormulaNode formula, FormulaConfiguration config, PrintStream out) {
        boolean defaults = !config.showLinearForm && !config.showTable && config.assignment == null;

        if (config.showLinearForm || defaults) {
            out.println("[I] Forma lineare: " + FormulaParser.toLinearForm(formula));
        }

        if (config.assignment != null) {
            boolean value = FormulaEvaluator.evaluate(formula, config.assignment);
            out.println("[I] Valutazione con " + config.assignment + ": " + (value ? "1" : "0"));
        }

        if (config.showTable || defaults) {
            TruthTable table = TruthTableGenerator.createTruthTable(formula);
            if (!table.isEnumerated()) {
                out.println("[W] " + table.format());
                return;
            }
            out.println("[I] Tabella di verità:");
            out.print(table.format());
            out.println("[I] " + describe(table));
        }
    }

    private static String describe(TruthTable table) {
        if (table.isTautology()) {
            return "Tautologia";
        }
        if (table.isContradiction()) {
            return "Contraddizione";
        }
        return "Soddisfacibile";
    }

    private static String readFormulaFromFile(String filePath, PrintStream out) throws IOException {
        String content = Files.readString(Path.of(filePath), StandardCharsets.UTF_8).trim();
        out.println("[I] Formula letta: " + content);
        return content;
    }

    private static void enableVerboseLogging() {
        Logger root = Logger.getLogger(ROOT_LOGGER);
        ConsoleHandler handler = new ConsoleHandler();
        handler.setLevel(Level.FINE);
        root.setLevel(Level.FINE);
        root.addHandler(handler);
        root.setUseParentHandlers(false);
    }

    private static void printApplicationHelp(PrintStream out) {
        out.println("USO: java -jar proplogic.jar (-e <formula> | -f <file>) [opzioni]");
        out.println();
        out.println("  -e <formula>   formula da analizzare");
        out.println("  -f <file>      file di testo contenente la formula");
        out.println("  -a <assegn.>   valuta la formula, es. -a p=1,q=0 (valori 1/0, true/false, v/f)");
        out.println("  -tt            mostra la tabella di verità (massimo "
                + TruthTableGenerator.MAX_VARIABLES + " variabili libere)");
        out.println("  -rpn           mostra la forma lineare postfissa");
        out.println("  -v             logging dettagliato delle fasi di parsing");
        out.println("  -h             mostra questo messaggio");
        out.println();
        out.println("Connettivi: ∨ ∧ ¬ → ↔ ← oppure or and not implies impl -> <-> == <-");
        out.println("Precedenze: ¬ > ∧ > ∨ > (→, ←) > ↔, associatività a sinistra");
    }

    //endregion

    //region STRUTTURE DI SUPPORTO

    /**
     * Configurazione immutabile risultante dal parsing dei parametri.
     */
    static final class FormulaConfiguration {
        final String formulaText;
        final String inputPath;
        final Map<String, Boolean> assignment;
        final boolean showTable;
        final boolean showLinearForm;
        final boolean verbose;

        FormulaConfiguration(String formulaText, String inputPath, Map<String, Boolean> assignment,
                             boolean showTable, boolean showLinearForm, boolean verbose) {
            this.formulaText = formulaText;
            this.inputPath = inputPath;
            this.assignment = assignment;
            this.showTable = showTable;
            this.showLinearForm = showLinearForm;
            this.verbose = verbose;
        }
    }

    /**
     * Parser dei parametri linea di comando con messaggi di errore informativi.
     */
    static final class ArgumentParser {

        /**
         * @param args parametri forniti dall'utente
         * @return configurazione validata, null se è stato richiesto l'help
         * @throws IllegalArgumentException se i parametri non sono validi
         */
        FormulaConfiguration parse(String[] args) {
            String formulaText = null;
            String inputPath = null;
            Map<String, Boolean> assignment = null;
            boolean showTable = false;
            boolean showLinearForm = false;
            boolean verbose = false;

            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case HELP_PARAM -> {
                        return null;
                    }
                    case EXPRESSION_PARAM -> {
                        validateExclusiveInput(formulaText, inputPath);
                        formulaText = getNextArgument(args, ++i, "formula");
                    }
                    case FILE_PARAM -> {
                        validateExclusiveInput(formulaText, inputPath);
                        inputPath = getNextArgument(args, ++i, "file");
                        validateFileExists(inputPath);
                    }
                    case ASSIGNMENT_PARAM -> assignment = parseAssignment(getNextArgument(args, ++i, "assegnamento"));
                    case TABLE_PARAM -> showTable = true;
                    case LINEAR_PARAM -> showLinearForm = true;
                    case VERBOSE_PARAM -> verbose = true;
                    default -> throw new IllegalArgumentException("Parametro sconosciuto: " + args[i]);
                }
            }

            if (formulaText == null && inputPath == null) {
                throw new IllegalArgumentException("Specificare una formula con -e oppure un file con -f");
            }

            return new FormulaConfiguration(formulaText, inputPath, assignment, showTable, showLinearForm, verbose);
        }

        /**
         * Interpreta un assegnamento nella forma nome=valore[,nome=valore...].
         */
        Map<String, Boolean> parseAssignment(String text) {
            Map<String, Boolean> assignment = new LinkedHashMap<>();

            for (String pair : text.split(",")) {
                String trimmed = pair.trim();
                if (trimmed.isEmpty()) {
                    continue;
                }

                int separator = trimmed.indexOf('=');
                if (separator <= 0 || separator == trimmed.length() - 1) {
                    throw new IllegalArgumentException("Assegnamento non valido: " + trimmed + " (atteso nome=valore)");
                }

                String name = trimmed.substring(0, separator).trim();
                String value = trimmed.substring(separator + 1).trim();
                assignment.put(name, parseTruthValue(value));
            }

            return assignment;
        }

        private Boolean parseTruthValue(String value) {
            return switch (value.toLowerCase(Locale.ROOT)) {
                case "1", "true", "t", "v", "vero" -> Boolean.TRUE;
                case "0", "false", "f", "falso" -> Boolean.FALSE;
                default -> throw new IllegalArgumentException("Valore di verità non riconosciuto: " + value);
            };
        }

        private void validateExclusiveInput(String formulaText, String inputPath) {
            if (formulaText != null || inputPath != null) {
                throw new IllegalArgumentException("Le opzioni -e e -f sono mutualmente esclusive e non ripetibili");
            }
        }

        private String getNextArgument(String[] args, int index, String description) {
            if (index >= args.length) {
                throw new IllegalArgumentException("Parametro mancante: " + description);
            }
            return args[index];
        }

        private void validateFileExists(String path) {
            if (!Files.isRegularFile(Path.of(path))) {
                throw new IllegalArgumentException("File non trovato: " + path);
            }
        }
    }

    //endregion
}
