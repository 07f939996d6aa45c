package org.graphplan;

import org.graphplan.graph.GraphNotLeveledException;
import org.graphplan.graph.GraphOptions;
import org.graphplan.graph.GraphOptions.ConnectionPolicy;
import org.graphplan.graph.GraphOptions.GoalMatching;
import org.graphplan.graph.GraphOptions.SupportCounting;
import org.graphplan.graph.GraphStatistics;
import org.graphplan.graph.LevelSumHeuristic;
import org.graphplan.graph.PlanningGraph;
import org.graphplan.optionalfeatures.AirCargoProblem;
import org.graphplan.problem.Literal;
import org.graphplan.problem.PlanningProblem;
import org.graphplan.problem.ProblemLoader;

import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;

/**
 * GRAFO DI PIANIFICAZIONE - Costruzione a livelli ed euristica level-sum da linea di comando
 *
 * PIPELINE DI ELABORAZIONE:
 * 1. INPUT: definizione del problema da file .plan
 * 2. PARSING: lexer e parser ANTLR -> PlanningProblem validato
 * 3. COSTRUZIONE: grafo di pianificazione fino al livellamento, con timeout
 * 4. EURISTICA: level-sum degli obiettivi sul grafo costruito
 * 5. OUTPUT: risultati e statistiche per livello
 *
 * MODALITÀ OPERATIVE:
 * - File singolo (-f), eventualmente da uno stato diverso da quello iniziale (-s)
 * - Directory batch (-d): tutti i file .plan della cartella
 * - Opzioni di costruzione tramite flag (-opt=<flag>, -opt=all)
 * - Timeout per problema (-t secondi), directory di output (-o)
 * - Generazione istanze Air Cargo (-gen=aircargo <numero>)
 *
 * ORGANIZZAZIONE DEGLI OUTPUT:
 * - RESULT/: livelli, nodi e mutex per livello, level-sum
 * - STATS/: report completo delle statistiche di costruzione
 * - AIRCARGO/: istanze generate
 */
public final class Main {

    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    //region CONFIGURAZIONE PARAMETRI APPLICAZIONE

    private static final String HELP_PARAM = "-h";
    private static final String FILE_PARAM = "-f";
    private static final String DIR_PARAM = "-d";
    private static final String OUTPUT_PARAM = "-o";
    private static final String TIMEOUT_PARAM = "-t";
    private static final String STATE_PARAM = "-s";
    private static final String OPT_PARAM = "-opt=";
    private static final String GEN_PARAM = "-gen=";

    /**
     * Flag opzioni disponibili
     * */
    private static final String OPT_PARALLEL = "p";
    private static final String OPT_ALL_LITERALS = "a";
    private static final String OPT_ALL_PAIRS = "c";
    private static final String OPT_GOAL_SYMBOL_ONLY = "g";
    private static final String OPT_MULTITHREAD = "m";
    private static final String OPT_ALL = "all";

    private static final String GEN_AIRCARGO = "aircargo";

    private static final String PLAN_EXTENSION = ".plan";

    private static final int DEFAULT_TIMEOUT_SECONDS = 10;
    private static final int MIN_TIMEOUT_SECONDS = 1;

    private Main() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //endregion

    //region PUNTO PRINCIPALE

    /**
     * Punto principale: analizza i parametri e delega alla modalità richiesta.
     *
     * @param args parametri linea di comando
     */
    public static void main(String[] args) {
        System.out.println("---> AVVIO GRAFO DI PIANIFICAZIONE <---");

        try {
            if (args.length == 0) {
                System.out.println("[E] Nessun parametro fornito. Usa -h per visualizzare l'help.");
                return;
            }

            GraphConfiguration config = parseAndValidateArguments(args);
            if (config == null) return;

            displayConfigurationSummary(config);
            executeMainPipeline(config);

        } catch (Exception e) {
            handleGlobalError(e);
        } finally {
            System.out.println("---> FINE ESECUZIONE GRAFO DI PIANIFICAZIONE <---");
        }
    }

    private static void executeMainPipeline(GraphConfiguration config) {
        if (config.isGenerationMode) {
            System.out.println("[I] Modalità: Generazione istanze " + config.generationType);
            processInstanceGeneration(config);
        } else if (config.isFileMode) {
            System.out.println("[I] Modalità: Elaborazione file singolo");
            processSingleFile(config);
        } else {
            System.out.println("[I] Modalità: Elaborazione della directory");
            processDirectoryBatch(config);
        }
    }

    private static void handleGlobalError(Exception e) {
        LOGGER.log(Level.SEVERE, "Errore critico", e);
        System.out.println("[E] Errore critico nell'applicazione: " + e.getMessage());
        System.out.println("Controllare i log per dettagli completi.");
        System.exit(1);
    }

    //endregion

    //region PARSING E VALIDAZIONE PARAMETRI

    /**
     * @return configurazione validata o null se help/errore
     */
    static GraphConfiguration parseAndValidateArguments(String[] args) {
        try {
            return new ArgumentParser().parse(args);
        } catch (IllegalArgumentException e) {
            System.out.println("[E] Errore nella validazione dei parametri: " + e.getMessage());
            System.out.println("Usa -h per visualizzare l'help completo.");
            return null;
        }
    }

    private static void displayConfigurationSummary(GraphConfiguration config) {
        System.out.println("\n-->> CONFIGURAZIONE GRAFO DI PIANIFICAZIONE <<--");

        if (config.isGenerationMode) {
            System.out.println("Modalità: Generazione istanze " + config.generationType);
            System.out.println("Numero istanze: " + config.generationCount);
        } else {
            System.out.println("Modalità: " + (config.isFileMode ? "File singolo" : "Directory"));
            System.out.println("Input: " + config.inputPath);
            if (config.state != null) {
                System.out.println("Stato: " + config.state);
            }
            System.out.println("Timeout: " + config.timeoutSeconds + " secondi");
            System.out.println("Opzioni: " + config.options);
        }

        System.out.println("Output: " + (config.outputPath != null ? config.outputPath : "Directory input"));
        System.out.println("====================================\n");
    }

    //endregion

    //region GENERAZIONE ISTANZE

    private static void processInstanceGeneration(GraphConfiguration config) {
        System.out.println("-->> GENERAZIONE ISTANZE <<--");

        if (!GEN_AIRCARGO.equals(config.generationType)) {
            throw new IllegalArgumentException("Tipo generazione non supportato: " + config.generationType);
        }

        AirCargoProblem generator = new AirCargoProblem();
        generator.setOutputDirectory(config.outputPath);
        generator.generateInstances(config.generationCount);

        System.out.println("\n[I] Report generazione:");
        System.out.print(generator.getGenerationReport());
    }

    //endregion

    //region ELABORAZIONE PROBLEMI

    /**
     * Elabora un singolo file: caricamento, costruzione con timeout, salvataggio risultati.
     * Gli errori vengono riportati senza interrompere un eventuale batch.
     *
     * @return true se il grafo è stato costruito e i risultati salvati
     */
    private static boolean processSingleFile(GraphConfiguration config) {
        System.out.println("-->> ELABORAZIONE FILE <<--");
        System.out.println("File: " + Paths.get(config.inputPath).getFileName());
        System.out.println("=========================\n");

        try {
            PlanningProblem problem = ProblemLoader.fromFile(Paths.get(config.inputPath));
            System.out.println("[I] Problema caricato: " + problem);

            String state = config.state != null ? config.state : problem.getInitialState();
            PlanningGraph graph = buildGraphWithTimeout(problem, state, config);
            if (graph == null) {
                saveTimeoutReport(config);
                return false;
            }

            saveResults(graph, state, config);
            saveStatistics(graph.getStatistics(), config);
            System.out.println("[I] " + graph.getStatistics().toCompactString());
            return true;

        } catch (Exception e) {
            LOGGER.log(Level.WARNING, "Errore elaborazione " + config.inputPath, e);
            System.out.println("[E] Errore elaborazione del file '" + config.inputPath + "': " + e.getMessage());
            return false;
        }
    }

    /**
     * Costruisce il grafo su un thread dedicato entro il timeout configurato.
     *
     * @return grafo costruito o null se il timeout è scaduto
     * @throws GraphNotLeveledException se il grafo non si livella entro il limite
     */
    private static PlanningGraph buildGraphWithTimeout(PlanningProblem problem, String state,
                                                       GraphConfiguration config) throws InterruptedException {
        System.out.println("Costruzione grafo (timeout: " + config.timeoutSeconds + "s)...");

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Callable<PlanningGraph> task = () -> new PlanningGraph(problem, state, config.options);
            Future<PlanningGraph> future = executor.submit(task);
            return future.get(config.timeoutSeconds, TimeUnit.SECONDS);

        } catch (TimeoutException e) {
            System.out.println("[W] Timeout raggiunto dopo " + config.timeoutSeconds + " secondi");
            return null;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Errore nella costruzione del grafo", cause);
        } finally {
            executor.shutdownNow();
        }
    }

    private static void processDirectoryBatch(GraphConfiguration config) {
        System.out.println("[I] Inizio elaborazione directory: " + config.inputPath);

        try {
            List<File> planFiles = findAllPlanFiles(config.inputPath);
            if (planFiles.isEmpty()) {
                System.out.println("[W] Nessun file " + PLAN_EXTENSION + " trovato nella directory specificata.");
                return;
            }

            BatchResult result = new BatchResult(planFiles.size());
            for (File file : planFiles) {
                System.out.println("Elaborazione: " + file.getName());
                if (processSingleFile(config.forFile(file.getAbsolutePath()))) {
                    result.incrementSuccess();
                } else {
                    result.incrementError();
                }
                System.out.println();
            }
            displayBatchSummary(result);

        } catch (IOException e) {
            System.out.println("[E] Errore durante l'accesso alla directory: " + e.getMessage());
        }
    }

    private static List<File> findAllPlanFiles(String dirPath) throws IOException {
        try (Stream<Path> entries = Files.list(Paths.get(dirPath))) {
            List<File> files = entries
                    .filter(path -> path.toString().toLowerCase().endsWith(PLAN_EXTENSION))
                    .map(Path::toFile)
                    .sorted(Comparator.comparing(File::getName))
                    .toList();
            System.out.println("Trovati " + files.size() + " file " + PLAN_EXTENSION + " da elaborare.");
            return files;
        }
    }

    private static void displayBatchSummary(BatchResult result) {
        System.out.println("\n-->> RIEPILOGO ELABORAZIONE DIRECTORY <<--");
        System.out.println("File trovati: " + result.totalFiles);
        System.out.println("File elaborati con successo: " + result.successCount);
        System.out.println("File con errori o timeout: " + result.errorCount);
        System.out.println("=========================================\n");
    }

    //endregion

    //region SALVATAGGIO OUTPUT

    private static void saveResults(PlanningGraph graph, String state, GraphConfiguration config) throws IOException {
        Path resultFile = resolveOutputFile(config, "RESULT", ".result");
        PlanningProblem problem = graph.getProblem();
        GraphStatistics stats = graph.getStatistics();

        try (BufferedWriter writer = Files.newBufferedWriter(resultFile, StandardCharsets.UTF_8)) {
            writer.write("=== GRAFO DI PIANIFICAZIONE: " + problem.getName() + " ===\n");
            writer.write("Stato: " + state + "\n");
            writer.write("Opzioni: " + graph.getOptions() + "\n");
            writer.write("Livelli S: " + graph.getLiteralLevelCount() + ", livelli A: " + graph.getActionLevelCount()
                    + (graph.isLeveled() ? " (livellato)" : "") + "\n\n");

            for (int level = 0; level < graph.getLiteralLevelCount(); level++) {
                writer.write(String.format("S%d: %d letterali, %d mutex%n", level,
                        stats.getLiteralNodesPerLevel().get(level), stats.getLiteralMutexPerLevel().get(level)));
                if (level < graph.getActionLevelCount()) {
                    writer.write(String.format("A%d: %d azioni, %d mutex%n", level,
                            stats.getActionNodesPerLevel().get(level), stats.getActionMutexPerLevel().get(level)));
                }
            }

            writer.write("\nObiettivi:\n");
            for (Literal goal : problem.getGoal()) {
                int cost = LevelSumHeuristic.levelCost(graph, goal);
                writer.write("  " + goal + " -> " + (cost < 0 ? "non raggiungibile" : "livello " + cost) + "\n");
            }
            writer.write("Level-sum: " + LevelSumHeuristic.levelSum(graph) + "\n");
        }

        System.out.println("[I] Risultati salvati: " + resultFile);
    }

    private static void saveStatistics(GraphStatistics stats, GraphConfiguration config) throws IOException {
        Path statsFile = resolveOutputFile(config, "STATS", ".stats");
        try (BufferedWriter writer = Files.newBufferedWriter(statsFile, StandardCharsets.UTF_8)) {
            writer.write(stats.toString());
        }
        System.out.println("[I] Statistiche salvate: " + statsFile);
    }

    private static void saveTimeoutReport(GraphConfiguration config) throws IOException {
        Path resultFile = resolveOutputFile(config, "RESULT", ".result");
        try (BufferedWriter writer = Files.newBufferedWriter(resultFile, StandardCharsets.UTF_8)) {
            writer.write("=== TIMEOUT ===\n");
            writer.write("Costruzione interrotta dopo " + config.timeoutSeconds + " secondi\n");
            writer.write("Opzioni: " + config.options + "\n");
        }
        System.out.println("[W] Report timeout salvato: " + resultFile);
    }

    private static Path resolveOutputFile(GraphConfiguration config, String subdirName, String extension)
            throws IOException {
        Path outputDir;
        if (config.outputPath != null) {
            outputDir = Paths.get(config.outputPath).resolve(subdirName);
        } else {
            Path parentDir = Paths.get(config.inputPath).toAbsolutePath().getParent();
            outputDir = parentDir != null ? parentDir.resolve(subdirName) : Paths.get(subdirName);
        }
        Files.createDirectories(outputDir);
        return outputDir.resolve(getBaseFileName(config.inputPath) + extension);
    }

    private static String getBaseFileName(String filePath) {
        String fileName = Paths.get(filePath).getFileName().toString();
        int lastDot = fileName.lastIndexOf('.');
        return lastDot > 0 ? fileName.substring(0, lastDot) : fileName;
    }

    //endregion

    //region HELP

    private static void printApplicationHelp() {
        System.out.println("\n::>> GRAFO DI PIANIFICAZIONE <<::");
        System.out.println("Costruzione di grafi di pianificazione con mutex ed euristica level-sum\n");

        System.out.println("UTILIZZO:");
        System.out.println("  java -jar grafo_pianificazione.jar [opzioni]\n");

        System.out.println("MODALITÀ OPERATIVE:");
        System.out.println("  1. COSTRUZIONE GRAFO:");
        System.out.println("     -f <file.plan>  Elabora un singolo problema");
        System.out.println("     -d <directory>  Elabora tutti i file .plan in una directory");
        System.out.println("     -s <TF...>      Stato di partenza al posto dello stato iniziale (solo con -f)");
        System.out.println("     -o <directory>  Directory di output (default: stessa di input)");
        System.out.println("     -t <secondi>    Timeout per problema (min: 1, default: 10)");
        System.out.println("     -opt=<flags>    Opzioni di costruzione (vedi sotto)");
        System.out.println();
        System.out.println("  2. GENERAZIONE ISTANZE:");
        System.out.println("     -gen=aircargo <numero>  Genera istanze Air Cargo (1-" + AirCargoProblem.MAX_INSTANCES + ")");
        System.out.println("     -o <directory>          Directory output (obbligatoria)");
        System.out.println();
        System.out.println("  3. AIUTO:");
        System.out.println("     -h              Mostra questa guida\n");

        System.out.println("OPZIONI DISPONIBILI (-opt=<flags>):");
        System.out.println("  p = Pianificazione parallela (nessuna esclusione seriale)");
        System.out.println("  a = Azioni collegate a tutti i letterali del livello");
        System.out.println("  c = Supporto inconsistente su tutte le coppie di produttori");
        System.out.println("  g = Obiettivi confrontati solo per simbolo");
        System.out.println("  m = Valutazione mutex multi-thread");
        System.out.println("  all = Tutte le opzioni\n");

        System.out.println("ESEMPI DI UTILIZZO:");
        System.out.println("  java -jar grafo_pianificazione.jar -f have_cake.plan");
        System.out.println("  java -jar grafo_pianificazione.jar -f have_cake.plan -s FT -opt=pg");
        System.out.println("  java -jar grafo_pianificazione.jar -d ./problemi/ -o ./output/ -t 60 -opt=m");
        System.out.println("  java -jar grafo_pianificazione.jar -gen=aircargo 3 -o ./output/\n");

        System.out.println("OUTPUT GENERATO:");
        System.out.println("  RESULT/    Livelli, nodi e mutex per livello, level-sum");
        System.out.println("  STATS/     Statistiche di costruzione per regola mutex");
        System.out.println("  AIRCARGO/  Istanze generate\n");

        System.out.println("===============================================\n");
    }

    //endregion

    //region CLASSI DI SUPPORTO E CONFIGURAZIONE

    /**
     * Configurazione validata dell'applicazione, immutabile.
     */
    static final class GraphConfiguration {
        final String inputPath;
        final String outputPath;
        final boolean isFileMode;
        final int timeoutSeconds;
        final String state;
        final GraphOptions options;
        final boolean isGenerationMode;
        final String generationType;
        final int generationCount;

        GraphConfiguration(String inputPath, String outputPath, boolean isFileMode, int timeoutSeconds,
                           String state, GraphOptions options, boolean isGenerationMode,
                           String generationType, int generationCount) {
            this.inputPath = inputPath;
            this.outputPath = outputPath;
            this.isFileMode = isFileMode;
            this.timeoutSeconds = timeoutSeconds;
            this.state = state;
            this.options = options;
            this.isGenerationMode = isGenerationMode;
            this.generationType = generationType;
            this.generationCount = generationCount;
        }

        /** Configurazione per un singolo file del batch */
        GraphConfiguration forFile(String filePath) {
            return new GraphConfiguration(filePath, outputPath, true, timeoutSeconds, null, options,
                    false, null, 0);
        }
    }

    /**
     * Parser dei parametri linea di comando con messaggi di errore per l'utente.
     */
    static final class ArgumentParser {

        /**
         * @return configurazione validata, null se è stato richiesto l'help
         * @throws IllegalArgumentException se i parametri non sono validi
         */
        GraphConfiguration parse(String[] args) {
            String inputPath = null;
            String outputPath = null;
            String state = null;
            boolean isFileMode = false;
            boolean isDirectoryMode = false;
            boolean isGenerationMode = false;
            GraphOptions options = GraphOptions.defaults();
            String generationType = null;
            int generationCount = 0;
            int timeoutSeconds = DEFAULT_TIMEOUT_SECONDS;

            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case HELP_PARAM -> {
                        printApplicationHelp();
                        return null;
                    }
                    case FILE_PARAM -> {
                        validateExclusiveMode(isDirectoryMode, isGenerationMode, "file");
                        inputPath = getNextArgument(args, ++i, "file");
                        validateFileExists(inputPath);
                        isFileMode = true;
                    }
                    case DIR_PARAM -> {
                        validateExclusiveMode(isFileMode, isGenerationMode, "directory");
                        inputPath = getNextArgument(args, ++i, "directory");
                        validateDirectoryExists(inputPath);
                        isDirectoryMode = true;
                    }
                    case OUTPUT_PARAM -> {
                        outputPath = getNextArgument(args, ++i, "directory output");
                        validateOrCreateOutputDirectory(outputPath);
                    }
                    case TIMEOUT_PARAM -> timeoutSeconds = parseAndValidateTimeout(args, ++i);
                    case STATE_PARAM -> state = getNextArgument(args, ++i, "stato TF...");
                    default -> {
                        if (args[i].startsWith(OPT_PARAM)) {
                            options = parseOptionFlags(args[i].substring(OPT_PARAM.length()));
                        } else if (args[i].startsWith(GEN_PARAM)) {
                            validateExclusiveMode(isFileMode, isDirectoryMode, "generazione");
                            generationType = args[i].substring(GEN_PARAM.length());
                            generationCount = parseGenerationCount(generationType, args, i);
                            isGenerationMode = true;
                            i++;
                        } else {
                            throw new IllegalArgumentException("Parametro sconosciuto: " + args[i]);
                        }
                    }
                }
            }

            if (isGenerationMode) {
                if (outputPath == null) {
                    throw new IllegalArgumentException("Modalità generazione richiede directory output (-o)");
                }
                return new GraphConfiguration(null, outputPath, false, 0, null, options,
                        true, generationType, generationCount);
            }
            if (inputPath == null) {
                throw new IllegalArgumentException("Specificare input con -f (file) o -d (directory)");
            }
            if (state != null && !isFileMode) {
                throw new IllegalArgumentException("Il parametro -s è ammesso solo con -f");
            }
            return new GraphConfiguration(inputPath, outputPath, isFileMode, timeoutSeconds, state, options,
                    false, null, 0);
        }

        private void validateExclusiveMode(boolean mode1, boolean mode2, String currentMode) {
            if (mode1 || mode2) {
                throw new IllegalArgumentException("Modalità " + currentMode +
                        " non può essere combinata con altre modalità (file/directory/generazione sono mutualmente esclusive)");
            }
        }

        private int parseGenerationCount(String genType, String[] args, int currentIndex) {
            if (!GEN_AIRCARGO.equals(genType)) {
                throw new IllegalArgumentException("Tipo generazione non supportato: " + genType +
                        ". Supportati: " + GEN_AIRCARGO);
            }
            String countStr = getNextArgument(args, currentIndex + 1, "numero istanze");
            int count;
            try {
                count = Integer.parseInt(countStr);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Numero istanze non valido: " + countStr);
            }
            if (count < 1 || count > AirCargoProblem.MAX_INSTANCES) {
                throw new IllegalArgumentException("Numero istanze deve essere tra 1 e " +
                        AirCargoProblem.MAX_INSTANCES + ", ricevuto: " + count);
            }
            return count;
        }

        private String getNextArgument(String[] args, int currentIndex, String argumentType) {
            if (currentIndex >= args.length) {
                throw new IllegalArgumentException("Parametro " + args[currentIndex - 1] +
                        " richiede " + argumentType);
            }
            return args[currentIndex];
        }

        private int parseAndValidateTimeout(String[] args, int currentIndex) {
            String timeoutStr = getNextArgument(args, currentIndex, "numero secondi");
            int timeout;
            try {
                timeout = Integer.parseInt(timeoutStr);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Valore timeout non valido: " + timeoutStr);
            }
            if (timeout < MIN_TIMEOUT_SECONDS) {
                throw new IllegalArgumentException("Timeout minimo: " + MIN_TIMEOUT_SECONDS + " secondi");
            }
            return timeout;
        }

        /**
         * Converte la stringa di flag -opt in opzioni di costruzione a partire dai valori predefiniti.
         */
        GraphOptions parseOptionFlags(String flagsStr) {
            if (flagsStr == null || flagsStr.trim().isEmpty()) {
                throw new IllegalArgumentException("Valore -opt vuoto");
            }
            boolean all = flagsStr.equals(OPT_ALL);
            if (!all && !flagsStr.matches("[pacgm]+")) {
                throw new IllegalArgumentException("Flag -opt non riconosciuti: " + flagsStr);
            }

            GraphOptions options = GraphOptions.defaults();
            if (all || flagsStr.contains(OPT_PARALLEL)) {
                options = options.withSerialPlanning(false);
            }
            if (all || flagsStr.contains(OPT_ALL_LITERALS)) {
                options = options.withConnectionPolicy(ConnectionPolicy.ALL_LITERALS);
            }
            if (all || flagsStr.contains(OPT_ALL_PAIRS)) {
                options = options.withSupportCounting(SupportCounting.ALL_PAIRS);
            }
            if (all || flagsStr.contains(OPT_GOAL_SYMBOL_ONLY)) {
                options = options.withGoalMatching(GoalMatching.SYMBOL_ONLY);
            }
            if (all || flagsStr.contains(OPT_MULTITHREAD)) {
                options = options.withParallelMutex(true, GraphOptions.DEFAULT_MUTEX_THREADS);
            }
            return options;
        }

        private void validateFileExists(String filePath) {
            File file = new File(filePath);
            if (!file.isFile()) {
                throw new IllegalArgumentException("File non esistente: " + filePath);
            }
            if (!file.canRead()) {
                throw new IllegalArgumentException("File non leggibile: " + filePath);
            }
        }

        private void validateDirectoryExists(String dirPath) {
            File dir = new File(dirPath);
            if (!dir.isDirectory()) {
                throw new IllegalArgumentException("Directory non esistente: " + dirPath);
            }
            if (!dir.canRead()) {
                throw new IllegalArgumentException("Directory non leggibile: " + dirPath);
            }
        }

        private void validateOrCreateOutputDirectory(String dirPath) {
            File dir = new File(dirPath);
            if (!dir.exists()) {
                System.out.println("Creazione directory output: " + dirPath);
                if (!dir.mkdirs()) {
                    throw new IllegalArgumentException("Impossibile creare directory: " + dirPath);
                }
            } else if (!dir.isDirectory()) {
                throw new IllegalArgumentException("Percorso non è una directory: " + dirPath);
            }
        }
    }

    /**
     * Esito aggregato del batch.
     */
    private static class BatchResult {
        final int totalFiles;
        int successCount = 0;
        int errorCount = 0;

        BatchResult(int totalFiles) {
            this.totalFiles = totalFiles;
        }

        void incrementSuccess() { successCount++; }
        void incrementError() { errorCount++; }
    }

    //endregion
}
