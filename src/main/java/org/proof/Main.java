package org.proof;

import org.proof.formula.Formula;
import org.proof.parser.FormulaParser;
import org.proof.parser.FormulaSyntaxException;
import org.proof.rules.RewriteRule;
import org.proof.rules.RuleCatalog;
import org.proof.search.ReachableFormsExplorer;
import org.proof.search.SearchLimits;
import org.proof.search.TransformationProof;
import org.proof.search.TransformationProver;
import org.proof.truthtable.TruthTable;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * PROVE TRASFORMAZIONALI PER LA LOGICA PROPOSIZIONALE
 *
 * PIPELINE DI ELABORAZIONE:
 * 1. INPUT: Formula (o coppia di formule) da linea di comando o da file di testo
 * 2. PARSING: Conversione notazione infissa -> albero sintattico (ANTLR) -> Formula
 * 3. ELABORAZIONE:
 *    - Tavola di verità: valutazione su tutti gli assegnamenti
 *    - Prova: ricerca in ampiezza della sequenza di riscritture più corta
 *    - Forme: enumerazione delle formule equivalenti raggiungibili
 * 4. OUTPUT: Tavola, prova numerata con le regole applicate, statistiche
 *
 * MODALITÀ OPERATIVE SUPPORTATE:
 * - Tavola di verità (-table <formula>)
 * - Prova tra due formule (-prove <iniziale> <obiettivo>)
 * - Prova da file (-f <file>): prima riga iniziale, seconda riga obiettivo
 * - Forme raggiungibili (-forms <formula>)
 * - Elenco delle leggi del catalogo (-rules)
 * - Limiti configurabili (-s dimensione, -d profondità), timeout (-t secondi)
 * - Catalogo esteso con le leggi inverse (-ext), log dettagliato (-v)
 */
public final class Main {

    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    //region CONFIGURAZIONE PARAMETRI APPLICAZIONE

    /**
     * Parametri linea di comando supportati
     * */
    private static final String HELP_PARAM = "-h";
    private static final String TABLE_PARAM = "-table";
    private static final String PROVE_PARAM = "-prove";
    private static final String FORMS_PARAM = "-forms";
    private static final String RULES_PARAM = "-rules";
    private static final String FILE_PARAM = "-f";
    private static final String SIZE_PARAM = "-s";
    private static final String DEPTH_PARAM = "-d";
    private static final String TIMEOUT_PARAM = "-t";
    private static final String EXTENDED_PARAM = "-ext";
    private static final String VERBOSE_PARAM = "-v";

    /**
     * Configurazioni timeout di default e limiti
     * */
    private static final int DEFAULT_TIMEOUT_SECONDS = 10;
    private static final int MIN_TIMEOUT_SECONDS = 1;

    /** Forme mostrate a schermo prima di troncare l'elenco */
    private static final int MAX_FORMS_DISPLAYED = 200;

    private static final String LOGGING_CONFIG = "/logging.properties";

    private enum Mode { TABLE, PROVE, FORMS, RULES }

    /**
     * Previene istanziazione - classe utility
     * */
    private Main() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //endregion

    //region PUNTO PRINCIPALE

    /**
     * Punto principale dell'applicazione.
     *
     * FLUSSO ESECUZIONE:
     * 1. Parsing e validazione parametri linea di comando
     * 2. Parsing delle formule
     * 3. Esecuzione della modalità richiesta con timeout
     * 4. Gestione errori globali
     *
     * @param args parametri linea di comando forniti dall'utente
     */
    public static void main(String[] args) {
        if (args.length == 0) {
            System.out.println("[E] Nessun parametro fornito. Usa -h per visualizzare l'help.");
            return;
        }

        try {
            ProverConfiguration config = parseAndValidateArguments(args);
            if (config == null) return; // Help mostrato o errore

            if (config.verbose) {
                configureVerboseLogging();
            }
            executeMainPipeline(config);

        } catch (FormulaSyntaxException e) {
            System.out.println("[E] " + e.getMessage());
        } catch (IllegalArgumentException e) {
            System.out.println("[E] Input non valido: " + e.getMessage());
        } catch (Exception e) {
            handleGlobalError(e);
        }
    }

    private static void executeMainPipeline(ProverConfiguration config) throws IOException {
        switch (config.mode) {
            case TABLE -> processTruthTable(config);
            case PROVE -> processProof(config);
            case FORMS -> processReachableForms(config);
            case RULES -> printRuleCatalog(config);
        }
    }

    /**
     * Gestisce errori critici dell'applicazione con logging completo.
     *
     * @param e eccezione critica che ha causato il fallimento
     */
    private static void handleGlobalError(Exception e) {
        LOGGER.log(Level.SEVERE, "Errore critico nell'applicazione", e);
        System.out.println("[E] Errore critico nell'applicazione: " + e.getMessage());
        System.out.println("Controllare i log per dettagli completi.");
        System.exit(1);
    }

    /**
     * Carica la configurazione di logging dettagliata dal classpath.
     */
    private static void configureVerboseLogging() throws IOException {
        try (InputStream config = Main.class.getResourceAsStream(LOGGING_CONFIG)) {
            if (config == null) {
                System.out.println("[W] Configurazione di logging non trovata: " + LOGGING_CONFIG);
                return;
            }
            LogManager.getLogManager().readConfiguration(config);
        }
    }

    //endregion

    //region MODALITÀ OPERATIVE

    /**
     * Stampa la tavola di verità e la classificazione della formula.
     */
    private static void processTruthTable(ProverConfiguration config) {
        Formula formula = FormulaParser.parse(config.formulas.get(0));
        System.out.println("[I] Formula: " + formula);

        TruthTable table = TruthTable.of(formula);
        System.out.print(table.format());
        System.out.println("[I] Classificazione: " + table.classification());
    }

    /**
     * Cerca la prova tra formula iniziale e obiettivo e la stampa con le statistiche.
     */
    private static void processProof(ProverConfiguration config) throws IOException {
        List<String> texts = config.inputPath != null ? readFormulasFromFile(config.inputPath) : config.formulas;
        Formula start = FormulaParser.parse(texts.get(0));
        Formula goal = FormulaParser.parse(texts.get(1));

        System.out.println("[I] Formula iniziale: " + start);
        System.out.println("[I] Formula obiettivo: " + goal);
        if (!TruthTable.isTabulable(start, goal)) {
            System.out.println("[I] Oltre " + TruthTable.MAX_VARIABLES
                    + " variabili: verifica di equivalenza saltata");
        } else if (!TruthTable.equivalent(start, goal)) {
            System.out.println("[W] Le formule non sono equivalenti: nessuna prova può esistere.");
        }

        TransformationProver prover = new TransformationProver(config.catalog(), config.limits);
        System.out.println("[I] " + prover.getLimits());
        TransformationProof proof = runWithTimeout(() -> prover.findPath(start, goal),
                prover::interrupt, config.timeoutSeconds);

        if (proof == null) {
            System.out.println("[W] Timeout raggiunto dopo " + config.timeoutSeconds + " secondi");
            return;
        }

        System.out.println();
        System.out.println(proof.format());
        System.out.println("-->> STATISTICHE <<--");
        System.out.println(proof.getStatistics());
    }

    /**
     * Enumera le forme raggiungibili dalla formula entro i limiti.
     */
    private static void processReachableForms(ProverConfiguration config) {
        Formula start = FormulaParser.parse(config.formulas.get(0));
        System.out.println("[I] Formula: " + start);

        ReachableFormsExplorer explorer = new ReachableFormsExplorer(config.catalog(), config.limits);
        Set<Formula> forms = runWithTimeout(() -> explorer.explore(start),
                explorer::interrupt, config.timeoutSeconds);

        if (forms == null) {
            System.out.println("[W] Timeout raggiunto dopo " + config.timeoutSeconds + " secondi");
            return;
        }

        System.out.println("[I] Forme raggiungibili: " + forms.size());
        forms.stream().limit(MAX_FORMS_DISPLAYED).forEach(System.out::println);
        if (forms.size() > MAX_FORMS_DISPLAYED) {
            System.out.println("... (" + (forms.size() - MAX_FORMS_DISPLAYED) + " forme omesse)");
        }
        System.out.println("-->> STATISTICHE <<--");
        System.out.println(explorer.getStatistics());
    }

    /**
     * Elenca le leggi del catalogo attivo nell'ordine di applicazione.
     */
    private static void printRuleCatalog(ProverConfiguration config) {
        RuleCatalog catalog = config.catalog();
        System.out.println("[I] Catalogo " + (config.extendedCatalog ? "esteso" : "standard")
                + ": " + catalog.size() + " leggi");
        int index = 1;
        for (RewriteRule rule : catalog) {
            System.out.printf("%2d) %-30s %-11s %s%n", index++, rule.getName(), rule.getTag(), rule.getLaw());
        }
    }

    /**
     * Esegue la ricerca su un thread dedicato con controllo temporale.
     *
     * @return risultato della ricerca o null se timeout
     */
    private static <T> T runWithTimeout(Callable<T> task, Runnable interrupt, int timeoutSeconds) {
        ExecutorService executor = Executors.newSingleThreadExecutor();

        try {
            Future<T> future = executor.submit(task);
            return future.get(timeoutSeconds, TimeUnit.SECONDS);

        } catch (TimeoutException e) {
            interrupt.run();
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Attesa della ricerca interrotta", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Errore durante la ricerca", e.getCause());
        } finally {
            executor.shutdownNow();
        }
    }

    /**
     * Legge formula iniziale e obiettivo dalle prime due righe non vuote del file.
     */
    private static List<String> readFormulasFromFile(String filePath) throws IOException {
        System.out.println("Lettura formule da " + filePath + "...");
        List<String> lines = Files.readAllLines(Path.of(filePath)).stream()
                .map(String::trim)
                .filter(line -> !line.isEmpty())
                .collect(Collectors.toList());

        if (lines.size() < 2) {
            throw new IllegalArgumentException("Il file deve contenere formula iniziale e obiettivo su due righe: "
                    + filePath);
        }
        return lines.subList(0, 2);
    }

    //endregion

    //region PARSING E VALIDAZIONE PARAMETRI

    private static ProverConfiguration parseAndValidateArguments(String[] args) {
        try {
            return new ArgumentParser().parse(args);
        } catch (IllegalArgumentException e) {
            System.out.println("[E] Errore nella validazione dei parametri: " + e.getMessage());
            System.out.println("Usa -h per visualizzare l'help completo.");
            return null;
        }
    }

    private static void printApplicationHelp() {
        System.out.println("USO:");
        System.out.println("  -table <formula>             Tavola di verità della formula");
        System.out.println("  -prove <iniziale> <obiettivo> Prova trasformazionale tra due formule");
        System.out.println("  -f <file>                    Prova con formule lette da file (due righe)");
        System.out.println("  -forms <formula>             Forme equivalenti raggiungibili");
        System.out.println("  -rules                       Elenco delle leggi di riscrittura");
        System.out.println();
        System.out.println("OPZIONI:");
        System.out.println("  -s <n>    Dimensione massima delle formule espanse (default "
                + SearchLimits.DEFAULT_MAX_SIZE + ")");
        System.out.println("  -d <n>    Numero massimo di passi (default " + SearchLimits.DEFAULT_MAX_DEPTH + ")");
        System.out.println("  -t <sec>  Timeout in secondi (default " + DEFAULT_TIMEOUT_SECONDS + ")");
        System.out.println("  -ext      Catalogo esteso con le leggi inverse di idempotenza e identità");
        System.out.println("  -v        Log dettagliato");
        System.out.println("  -h        Mostra questo messaggio");
        System.out.println();
        System.out.println("CONNETTIVI: ! & | => <=>  (anche ~ ^ -> <-> not and or implies iff)");
        System.out.println("COSTANTI:   true false");
    }

    /**
     * Configurazione validata dell'esecuzione.
     */
    private static class ProverConfiguration {
        final Mode mode;
        final List<String> formulas;
        final String inputPath;
        final SearchLimits limits;
        final int timeoutSeconds;
        final boolean extendedCatalog;
        final boolean verbose;

        ProverConfiguration(Mode mode, List<String> formulas, String inputPath, SearchLimits limits,
                            int timeoutSeconds, boolean extendedCatalog, boolean verbose) {
            this.mode = mode;
            this.formulas = formulas;
            this.inputPath = inputPath;
            this.limits = limits;
            this.timeoutSeconds = timeoutSeconds;
            this.extendedCatalog = extendedCatalog;
            this.verbose = verbose;
        }

        RuleCatalog catalog() {
            return extendedCatalog ? RuleCatalog.extended() : RuleCatalog.standard();
        }
    }

    /**
     * Parser per parametri linea di comando con messaggi di errore informativi.
     */
    private static class ArgumentParser {

        /**
         * Processa sequenzialmente i parametri e costruisce la configurazione.
         *
         * @return configurazione validata, null se è stato richiesto l'help
         * @throws IllegalArgumentException se i parametri non sono validi
         */
        ProverConfiguration parse(String[] args) {
            Mode mode = null;
            List<String> formulas = List.of();
            String inputPath = null;
            SearchLimits limits = SearchLimits.defaults();
            int timeoutSeconds = DEFAULT_TIMEOUT_SECONDS;
            boolean extendedCatalog = false;
            boolean verbose = false;

            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case HELP_PARAM -> {
                        printApplicationHelp();
                        return null;
                    }
                    case TABLE_PARAM -> {
                        validateExclusiveMode(mode);
                        mode = Mode.TABLE;
                        formulas = List.of(getNextArgument(args, ++i, "formula"));
                    }
                    case PROVE_PARAM -> {
                        validateExclusiveMode(mode);
                        mode = Mode.PROVE;
                        String start = getNextArgument(args, ++i, "formula iniziale");
                        String goal = getNextArgument(args, ++i, "formula obiettivo");
                        formulas = List.of(start, goal);
                    }
                    case FILE_PARAM -> {
                        validateExclusiveMode(mode);
                        mode = Mode.PROVE;
                        inputPath = getNextArgument(args, ++i, "file");
                        validateFileExists(inputPath);
                    }
                    case FORMS_PARAM -> {
                        validateExclusiveMode(mode);
                        mode = Mode.FORMS;
                        formulas = List.of(getNextArgument(args, ++i, "formula"));
                    }
                    case RULES_PARAM -> {
                        validateExclusiveMode(mode);
                        mode = Mode.RULES;
                    }
                    case SIZE_PARAM -> limits = limits.withMaxSize(parsePositiveInt(args, ++i, "dimensione massima"));
                    case DEPTH_PARAM -> limits = limits.withMaxDepth(parsePositiveInt(args, ++i, "profondità massima"));
                    case TIMEOUT_PARAM -> {
                        timeoutSeconds = parsePositiveInt(args, ++i, "numero secondi");
                        if (timeoutSeconds < MIN_TIMEOUT_SECONDS) {
                            throw new IllegalArgumentException("Timeout minimo: " + MIN_TIMEOUT_SECONDS + " secondi");
                        }
                    }
                    case EXTENDED_PARAM -> extendedCatalog = true;
                    case VERBOSE_PARAM -> verbose = true;
                    default -> throw new IllegalArgumentException("Parametro sconosciuto: " + args[i]);
                }
            }

            if (mode == null) {
                throw new IllegalArgumentException("Specificare una modalità: -table, -prove, -f, -forms oppure -rules");
            }
            return new ProverConfiguration(mode, formulas, inputPath, limits, timeoutSeconds,
                    extendedCatalog, verbose);
        }

        private void validateExclusiveMode(Mode current) {
            if (current != null) {
                throw new IllegalArgumentException("Modalità " + current
                        + " non può essere combinata con altre modalità");
            }
        }

        private String getNextArgument(String[] args, int index, String description) {
            if (index >= args.length) {
                throw new IllegalArgumentException("Parametro mancante: " + description);
            }
            return args[index];
        }

        private int parsePositiveInt(String[] args, int index, String description) {
            String value = getNextArgument(args, index, description);
            try {
                int parsed = Integer.parseInt(value);
                if (parsed <= 0) {
                    throw new IllegalArgumentException("Valore non positivo per " + description + ": " + value);
                }
                return parsed;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Valore non valido per " + description + ": " + value);
            }
        }

        private void validateFileExists(String path) {
            if (!Files.isRegularFile(Path.of(path))) {
                throw new IllegalArgumentException("File non esistente: " + path);
            }
        }
    }

    //endregion
}
