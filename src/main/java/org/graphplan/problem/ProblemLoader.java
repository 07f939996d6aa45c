package org.graphplan.problem;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.tree.ParseTree;
import org.graphplan.parser.PlanningProblemLexer;
import org.graphplan.parser.PlanningProblemParser;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.logging.Logger;

/**
 * CARICATORE PROBLEMI - Pipeline ANTLR completa: Lexing -> Parsing -> Visitor
 *
 * Ogni errore sintattico segnalato da lexer o parser interrompe il caricamento con
 * un'eccezione che riporta riga e colonna, invece della stampa su stderr predefinita.
 */
public final class ProblemLoader {

    private static final Logger LOGGER = Logger.getLogger(ProblemLoader.class.getName());

    private ProblemLoader() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Carica un problema da file di testo (UTF-8).
     *
     * @param file percorso del file .plan
     * @return problema validato
     * @throws IOException se il file non è leggibile
     * @throws IllegalArgumentException se la definizione non è valida
     */
    public static PlanningProblem fromFile(Path file) throws IOException {
        LOGGER.fine("Lettura definizione problema da " + file);
        return parse(CharStreams.fromPath(file, StandardCharsets.UTF_8));
    }

    /**
     * Carica un problema dal testo della definizione.
     *
     * @param definition testo nel formato della grammatica PlanningProblem
     * @return problema validato
     * @throws IllegalArgumentException se la definizione non è valida
     */
    public static PlanningProblem fromString(String definition) {
        if (definition == null) {
            throw new IllegalArgumentException("Definizione del problema non può essere null");
        }
        return parse(CharStreams.fromString(definition));
    }

    private static PlanningProblem parse(CharStream input) {
        PlanningProblemLexer lexer = new PlanningProblemLexer(input);
        lexer.removeErrorListeners();
        lexer.addErrorListener(FailFastErrorListener.INSTANCE);

        PlanningProblemParser parser = new PlanningProblemParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(FailFastErrorListener.INSTANCE);

        ParseTree tree = parser.problem();
        return new ProblemDefinitionParser().visit(tree);
    }

    /**
     * Listener che trasforma ogni errore di sintassi in IllegalArgumentException.
     */
    private static final class FailFastErrorListener extends BaseErrorListener {

        private static final FailFastErrorListener INSTANCE = new FailFastErrorListener();

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                                int line, int charPositionInLine, String msg, RecognitionException e) {
            throw new IllegalArgumentException("Errore di sintassi alla riga " + line + ":"
                    + charPositionInLine + " - " + msg, e);
        }
    }
}
