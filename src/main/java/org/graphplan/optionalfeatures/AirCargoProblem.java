package org.graphplan.optionalfeatures;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * GENERATORE AIR CARGO - Istanze di trasporto merci per benchmark del grafo di pianificazione
 *
 * L'istanza k contiene k merci (C1..Ck), k aerei (P1..Pk) e k aeroporti (A1..Ak).
 *
 * FORMULAZIONE:
 * - Fluenti: At(Ci,Aj), At(Pi,Aj), In(Ci,Pj)
 * - Load(c,p,a):   pre At(c,a), At(p,a)  eff In(c,p), ~At(c,a)
 * - Unload(c,p,a): pre In(c,p), At(p,a)  eff At(c,a), ~In(c,p)
 * - Fly(p,f,t):    pre At(p,f)           eff At(p,t), ~At(p,f)   con f != t
 * - Stato iniziale: merce i e aereo i nell'aeroporto i
 * - Obiettivo: merce i nell'aeroporto successivo (circolare)
 *
 * Il numero di azioni ground cresce come k^3: le istanze grandi servono a misurare
 * il costo della costruzione del grafo e dei test mutex.
 */
public class AirCargoProblem {

    private static final Logger LOGGER = Logger.getLogger(AirCargoProblem.class.getName());

    //region CONFIGURAZIONE E COSTANTI

    /** Sottodirectory delle istanze generate */
    private static final String AIRCARGO_DIR = "AIRCARGO";

    private static final String FILE_PREFIX = "aircargo_";

    private static final String FILE_EXTENSION = ".plan";

    /** Limite superiore del numero di istanze richiedibili */
    public static final int MAX_INSTANCES = 10;

    //endregion

    //region STATO GENERAZIONE

    private String outputDirectory;
    private int generatedInstances;
    private StringBuilder generationLog = new StringBuilder();

    //endregion

    public AirCargoProblem() {
        LOGGER.fine("AirCargoProblem inizializzato per generazione istanze");
    }

    /**
     * @param outputPath directory base in cui creare la sottodirectory AIRCARGO
     * @throws IllegalArgumentException se il percorso è null o vuoto
     */
    public void setOutputDirectory(String outputPath) {
        if (outputPath == null || outputPath.trim().isEmpty()) {
            throw new IllegalArgumentException("Directory output non può essere null o vuota");
        }
        this.outputDirectory = outputPath.trim();
        LOGGER.fine("Directory output configurata: " + outputDirectory);
    }

    //region INTERFACCIA PUBBLICA PRINCIPALE

    /**
     * Genera le istanze di dimensione 1..numberOfProblems, una per file.
     *
     * @param numberOfProblems numero istanze (1 ≤ n ≤ {@value #MAX_INSTANCES})
     * @throws IllegalArgumentException se il numero è fuori intervallo
     * @throws IllegalStateException se la directory di output non è configurata
     * @throws UncheckedIOException se la scrittura di un file fallisce
     */
    public void generateInstances(int numberOfProblems) {
        if (numberOfProblems < 1 || numberOfProblems > MAX_INSTANCES) {
            throw new IllegalArgumentException("Numero problemi deve essere tra 1 e " + MAX_INSTANCES
                    + ", ricevuto: " + numberOfProblems);
        }
        if (outputDirectory == null) {
            throw new IllegalStateException("Directory output non configurata - chiamare setOutputDirectory() prima");
        }

        generatedInstances = 0;
        generationLog = new StringBuilder("=== INIZIO GENERAZIONE AIR CARGO ===\n");
        LOGGER.info("Inizio generazione " + numberOfProblems + " istanze Air Cargo");

        Path targetDir = Paths.get(outputDirectory).resolve(AIRCARGO_DIR);
        try {
            Files.createDirectories(targetDir);
            for (int k = 1; k <= numberOfProblems; k++) {
                Path file = targetDir.resolve(FILE_PREFIX + k + FILE_EXTENSION);
                writeInstance(file, buildDefinition(k));
                generatedInstances++;
                generationLog.append("Istanza k=").append(k).append(": ")
                        .append(countGroundActions(k)).append(" azioni ground -> ").append(file).append("\n");
            }
        } catch (IOException e) {
            LOGGER.log(Level.SEVERE, "Errore durante generazione istanze Air Cargo", e);
            System.out.println("[E] Generazione fallita dopo " + generatedInstances + "/" + numberOfProblems + " istanze");
            throw new UncheckedIOException("Generazione istanze Air Cargo fallita", e);
        }

        generationLog.append("=== GENERAZIONE COMPLETATA: ").append(generatedInstances).append(" istanze ===\n");
        LOGGER.info("Generazione completata: " + generatedInstances + " istanze create");
        System.out.println("[I] Generazione Air Cargo completata!");
        System.out.println("[I] Istanze create: " + generatedInstances + "/" + numberOfProblems);
        System.out.println("[I] Directory: " + targetDir);
    }

    //endregion

    //region COSTRUZIONE DEFINIZIONE

    /**
     * Testo della definizione dell'istanza di dimensione k nel formato .plan.
     *
     * @param k numero di merci, aerei e aeroporti
     */
    public static String buildDefinition(int k) {
        if (k < 1) {
            throw new IllegalArgumentException("Dimensione istanza deve essere >= 1, ricevuto: " + k);
        }
        StringBuilder text = new StringBuilder();
        text.append("# Air Cargo: ").append(k).append(" merci, ").append(k).append(" aerei, ")
                .append(k).append(" aeroporti\n");
        text.append("problem AirCargo").append(k).append('\n');

        List<String> fluents = new ArrayList<>();
        for (int c = 1; c <= k; c++) {
            for (int a = 1; a <= k; a++) {
                fluents.add(at(cargo(c), airport(a)));
            }
        }
        for (int p = 1; p <= k; p++) {
            for (int a = 1; a <= k; a++) {
                fluents.add(at(plane(p), airport(a)));
            }
        }
        for (int c = 1; c <= k; c++) {
            for (int p = 1; p <= k; p++) {
                fluents.add(in(cargo(c), plane(p)));
            }
        }
        text.append("fluents: ").append(String.join(", ", fluents)).append('\n');

        List<String> init = new ArrayList<>();
        List<String> goal = new ArrayList<>();
        for (int i = 1; i <= k; i++) {
            init.add(at(cargo(i), airport(i)));
            init.add(at(plane(i), airport(i)));
            goal.add(at(cargo(i), airport(i % k + 1)));
        }
        text.append("init: ").append(String.join(", ", init)).append('\n');
        text.append("goal: ").append(String.join(", ", goal)).append('\n');

        for (int c = 1; c <= k; c++) {
            for (int p = 1; p <= k; p++) {
                for (int a = 1; a <= k; a++) {
                    String cargoAt = at(cargo(c), airport(a));
                    String planeAt = at(plane(p), airport(a));
                    String loaded = in(cargo(c), plane(p));
                    appendAction(text, "Load(" + cargo(c) + ", " + plane(p) + ", " + airport(a) + ")",
                            cargoAt + ", " + planeAt, loaded + ", ~" + cargoAt);
                    appendAction(text, "Unload(" + cargo(c) + ", " + plane(p) + ", " + airport(a) + ")",
                            loaded + ", " + planeAt, cargoAt + ", ~" + loaded);
                }
            }
        }
        for (int p = 1; p <= k; p++) {
            for (int from = 1; from <= k; from++) {
                for (int to = 1; to <= k; to++) {
                    if (from == to) {
                        continue;
                    }
                    String origin = at(plane(p), airport(from));
                    appendAction(text, "Fly(" + plane(p) + ", " + airport(from) + ", " + airport(to) + ")",
                            origin, at(plane(p), airport(to)) + ", ~" + origin);
                }
            }
        }
        return text.toString();
    }

    /**
     * Load e Unload per ogni terna, Fly per ogni aereo e coppia di aeroporti distinti.
     */
    public static int countGroundActions(int k) {
        return 2 * k * k * k + k * k * (k - 1);
    }

    private static void appendAction(StringBuilder text, String header, String pre, String eff) {
        text.append("action ").append(header).append('\n');
        text.append("  pre: ").append(pre).append('\n');
        text.append("  eff: ").append(eff).append('\n');
    }

    private static String at(String object, String place) { return "At(" + object + ", " + place + ")"; }
    private static String in(String cargo, String plane) { return "In(" + cargo + ", " + plane + ")"; }
    private static String cargo(int i) { return "C" + i; }
    private static String plane(int i) { return "P" + i; }
    private static String airport(int i) { return "A" + i; }

    private static void writeInstance(Path file, String definition) throws IOException {
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            writer.write(definition);
        }
        LOGGER.finest("Istanza salvata: " + file);
    }

    //endregion

    //region INFORMAZIONI

    public String getGenerationReport() {
        return generationLog.toString();
    }

    public int getGeneratedInstancesCount() {
        return generatedInstances;
    }

    public String getOutputDirectory() {
        return outputDirectory;
    }

    @Override
    public String toString() {
        return String.format("AirCargoProblem[generated=%d, output=%s]", generatedInstances, outputDirectory);
    }

    //endregion
}
