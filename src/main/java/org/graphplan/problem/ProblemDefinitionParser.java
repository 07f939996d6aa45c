package org.graphplan.problem;

import org.antlr.v4.runtime.tree.TerminalNode;
import org.graphplan.parser.PlanningProblemBaseVisitor;
import org.graphplan.parser.PlanningProblemParser.ActionDeclContext;
import org.graphplan.parser.PlanningProblemParser.AtomContext;
import org.graphplan.parser.PlanningProblemParser.EffSectionContext;
import org.graphplan.parser.PlanningProblemParser.FluentsSectionContext;
import org.graphplan.parser.PlanningProblemParser.GoalSectionContext;
import org.graphplan.parser.PlanningProblemParser.InitSectionContext;
import org.graphplan.parser.PlanningProblemParser.LiteralContext;
import org.graphplan.parser.PlanningProblemParser.NegativeContext;
import org.graphplan.parser.PlanningProblemParser.PositiveContext;
import org.graphplan.parser.PlanningProblemParser.PreSectionContext;
import org.graphplan.parser.PlanningProblemParser.ProblemContext;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * PARSER DEFINIZIONI DI PROBLEMA - Convertitore da albero sintattico ANTLR a PlanningProblem
 *
 * Implementa un visitor sull'albero generato dalla grammatica PlanningProblem e costruisce
 * il problema ground con mappa di stato, stato iniziale, azioni e obiettivo.
 *
 * SEZIONI GESTITE (nell'ordine della grammatica):
 * - problem: nome del problema
 * - fluents: vocabolario ordinato dei fluenti (diventa la mappa di stato)
 * - init: fluenti veri all'inizio, ogni altro fluente è falso (mondo chiuso)
 * - goal: letterali obiettivo, positivi o negati con ~ / !
 * - action: azione ground con precondizioni (opzionali) ed effetti
 *
 * TRASFORMAZIONI SEMANTICHE:
 * - Atomi normalizzati in forma compatta "Nome(a,b)" senza spazi
 * - Precondizioni ed effetti separati per polarità (pos/neg, add/rem)
 * - Sezione init convertita nella stringa di stato "TF..."
 */
public class ProblemDefinitionParser extends PlanningProblemBaseVisitor<PlanningProblem> {

    private static final Logger LOGGER = Logger.getLogger(ProblemDefinitionParser.class.getName());

    /** Visitor dedicato ai letterali (alternative etichettate negative / positive) */
    private final LiteralVisitor literalVisitor = new LiteralVisitor();

    //region PUNTO DI INGRESSO

    /**
     * METODO PRINCIPALE - Costruisce il problema completo dall'albero sintattico
     *
     * PIPELINE:
     * 1. Lettura vocabolario fluenti (mappa di stato)
     * 2. Codifica della sezione init in stringa di stato
     * 3. Lettura obiettivi
     * 4. Costruzione delle azioni ground
     * 5. Validazione finale delegata al costruttore di PlanningProblem
     *
     * @param ctx contesto radice della grammatica
     * @return problema di pianificazione validato
     * @throws IllegalArgumentException se la definizione non è semanticamente coerente
     */
    @Override
    public PlanningProblem visitProblem(ProblemContext ctx) {
        String problemName = ctx.IDENTIFIER().getText();
        LOGGER.fine("Inizio conversione problema " + problemName);

        List<String> stateMap = readFluents(ctx.fluentsSection());
        String initialState = readInitialState(ctx.initSection(), stateMap);
        List<Literal> goal = readGoal(ctx.goalSection());

        List<Action> actions = new ArrayList<>();
        for (ActionDeclContext actionCtx : ctx.actionDecl()) {
            actions.add(readAction(actionCtx));
        }

        PlanningProblem problem = new PlanningProblem(problemName, stateMap, initialState, actions, goal);
        LOGGER.info("Problema convertito: " + problem);
        return problem;
    }

    //endregion

    //region SEZIONI DEL PROBLEMA

    private List<String> readFluents(FluentsSectionContext ctx) {
        List<String> fluents = new ArrayList<>();
        for (AtomContext atomCtx : ctx.atom()) {
            fluents.add(atomText(atomCtx));
        }
        LOGGER.finest("Fluenti dichiarati: " + fluents);
        return fluents;
    }

    /**
     * Converte i fluenti elencati in init nella stringa di stato: 'T' per i fluenti
     * elencati, 'F' per tutti gli altri.
     */
    private String readInitialState(InitSectionContext ctx, List<String> stateMap) {
        Set<String> trueFluents = new HashSet<>();
        for (AtomContext atomCtx : ctx.atom()) {
            String fluent = atomText(atomCtx);
            if (!stateMap.contains(fluent)) {
                throw new IllegalArgumentException("Fluente iniziale non dichiarato: " + fluent
                        + " (riga " + atomCtx.getStart().getLine() + ")");
            }
            trueFluents.add(fluent);
        }

        List<String> pos = new ArrayList<>();
        List<String> neg = new ArrayList<>();
        for (String fluent : stateMap) {
            if (trueFluents.contains(fluent)) {
                pos.add(fluent);
            } else {
                neg.add(fluent);
            }
        }
        return StateCodec.encode(new FluentState(pos, neg), stateMap);
    }

    private List<Literal> readGoal(GoalSectionContext ctx) {
        List<Literal> goal = new ArrayList<>();
        for (LiteralContext literalCtx : ctx.literal()) {
            goal.add(literalVisitor.visit(literalCtx));
        }
        return goal;
    }

    /**
     * Costruisce un'azione ground separando precondizioni ed effetti per polarità.
     */
    private Action readAction(ActionDeclContext ctx) {
        List<TerminalNode> identifiers = ctx.atom().IDENTIFIER();
        String actionName = identifiers.get(0).getText();
        List<String> args = new ArrayList<>();
        for (int i = 1; i < identifiers.size(); i++) {
            args.add(identifiers.get(i).getText());
        }

        List<String> precondPos = new ArrayList<>();
        List<String> precondNeg = new ArrayList<>();
        PreSectionContext preCtx = ctx.preSection();
        if (preCtx != null) {
            splitByPolarity(preCtx.literal(), precondPos, precondNeg);
        }

        List<String> effectAdd = new ArrayList<>();
        List<String> effectRem = new ArrayList<>();
        EffSectionContext effCtx = ctx.effSection();
        splitByPolarity(effCtx.literal(), effectAdd, effectRem);

        Action action = new Action(actionName, args, precondPos, precondNeg, effectAdd, effectRem);
        LOGGER.finest("Azione convertita: " + action);
        return action;
    }

    private void splitByPolarity(List<LiteralContext> literals, List<String> positives, List<String> negatives) {
        for (LiteralContext literalCtx : literals) {
            Literal literal = literalVisitor.visit(literalCtx);
            if (literal.isPositive()) {
                positives.add(literal.getSymbol());
            } else {
                negatives.add(literal.getSymbol());
            }
        }
    }

    //endregion

    //region ATOMI E LETTERALI

    /**
     * Forma compatta di un atomo: "Nome" oppure "Nome(a,b,...)".
     */
    static String atomText(AtomContext ctx) {
        List<TerminalNode> identifiers = ctx.IDENTIFIER();
        if (identifiers.size() == 1) {
            return identifiers.get(0).getText();
        }
        StringBuilder text = new StringBuilder(identifiers.get(0).getText()).append('(');
        for (int i = 1; i < identifiers.size(); i++) {
            if (i > 1) text.append(',');
            text.append(identifiers.get(i).getText());
        }
        return text.append(')').toString();
    }

    /**
     * Visitor per le alternative etichettate della regola literal.
     */
    private static class LiteralVisitor extends PlanningProblemBaseVisitor<Literal> {

        @Override
        public Literal visitNegative(NegativeContext ctx) {
            return Literal.negative(atomText(ctx.atom()));
        }

        @Override
        public Literal visitPositive(PositiveContext ctx) {
            return Literal.positive(atomText(ctx.atom()));
        }
    }

    //endregion
}
