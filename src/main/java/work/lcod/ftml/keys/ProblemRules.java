package work.lcod.ftml.keys;

import java.util.List;
import java.util.Optional;
import work.lcod.ftml.extraction.CloseFtmlElement;
import work.lcod.ftml.extraction.ExtractorState;
import work.lcod.ftml.extraction.FtmlExtractionException;
import work.lcod.ftml.extraction.MetaDatum;
import work.lcod.ftml.extraction.OpenNarrativeElement;
import work.lcod.ftml.model.problem.AnswerKind;
import work.lcod.ftml.model.problem.ChoiceBlockStyle;
import work.lcod.ftml.model.problem.CognitiveDimension;
import work.lcod.ftml.model.problem.FillInSolOption;
import work.lcod.ftml.node.FtmlNode;
import work.lcod.ftml.uri.DocumentElementUri;
import work.lcod.ftml.uri.SymbolUri;
import work.lcod.ftml.uri.UriNames;

/**
 * Problems, their solutions and the grading material attached to them.
 */
final class ProblemRules {
    private ProblemRules() {}

    static void register(KeyRules.Builder rules) {
        rules.on(FtmlKey.PROBLEM, problem(false))
            .on(FtmlKey.SUB_PROBLEM, problem(true))
            .on(FtmlKey.PRECONDITION_SYMBOL, ProblemRules::precondition)
            .on(FtmlKey.OBJECTIVE_SYMBOL, ProblemRules::objective)
            .on(FtmlKey.PROBLEM_SOLUTION, ProblemRules::solution)
            .on(FtmlKey.PROBLEM_HINT, (state, attrs, keys, node) ->
                KeyResult.narrative(new OpenNarrativeElement.ProblemHint(), CloseFtmlElement.PROBLEM_HINT))
            .on(FtmlKey.PROBLEM_NOTE, (state, attrs, keys, node) ->
                KeyResult.narrative(new OpenNarrativeElement.ProblemExNote(), CloseFtmlElement.PROBLEM_EX_NOTE))
            .on(FtmlKey.PROBLEM_GRADING_NOTE, (state, attrs, keys, node) ->
                KeyResult.narrative(new OpenNarrativeElement.ProblemGradingNote(), CloseFtmlElement.PROBLEM_GRADING_NOTE))
            .on(FtmlKey.ANSWER_CLASS, ProblemRules::answerClass)
            .on(FtmlKey.ANSWER_CLASS_FEEDBACK, (state, attrs, keys, node) ->
                KeyResult.meta(new MetaDatum.AnswerClassFeedback()))
            .on(FtmlKey.PROBLEM_SINGLE_CHOICE_BLOCK, choiceBlock(false))
            .on(FtmlKey.PROBLEM_MULTIPLE_CHOICE_BLOCK, choiceBlock(true))
            .on(FtmlKey.PROBLEM_CHOICE, (state, attrs, keys, node) -> KeyResult.narrative(
                new OpenNarrativeElement.ProblemChoice(attrs.bool(FtmlKey.PROBLEM_CHOICE)), CloseFtmlElement.PROBLEM_CHOICE))
            .on(FtmlKey.PROBLEM_CHOICE_VERDICT, (state, attrs, keys, node) -> KeyResult.narrative(
                new OpenNarrativeElement.ProblemChoiceVerdict(), CloseFtmlElement.PROBLEM_CHOICE_VERDICT))
            .on(FtmlKey.PROBLEM_CHOICE_FEEDBACK, (state, attrs, keys, node) -> KeyResult.narrative(
                new OpenNarrativeElement.ProblemChoiceFeedback(), CloseFtmlElement.PROBLEM_CHOICE_FEEDBACK))
            .on(FtmlKey.PROBLEM_FILLINSOL, ProblemRules::fillinSol)
            .on(FtmlKey.PROBLEM_FILLINSOL_CASE, ProblemRules::fillinSolCase);
    }

    private static KeyHandler problem(boolean subProblem) {
        return (state, attrs, keys, node) -> {
            DocumentElementUri uri = attrs.elementUriFromId("problem");
            List<String> styles = attrs.stringList(FtmlKey.STYLES);
            boolean autogradable = attrs.takeBool(FtmlKey.AUTOGRADABLE);
            Float points = attrs.optionalTyped(FtmlKey.PROBLEM_POINTS, KeyRules::parseFloat).orElse(null);
            Float minutes = attrs.optionalTyped(FtmlKey.PROBLEM_MINUTES, KeyRules::parseFloat).orElse(null);
            keys.remove(FtmlKey.ID, FtmlKey.STYLES, FtmlKey.AUTOGRADABLE, FtmlKey.PROBLEM_POINTS, FtmlKey.PROBLEM_MINUTES);
            return KeyResult.narrative(
                new OpenNarrativeElement.Problem(uri, subProblem, autogradable, points, minutes, styles),
                CloseFtmlElement.PROBLEM);
        };
    }

    private static KeyResult precondition(ExtractorState state, Attributes attrs, KeyList keys, FtmlNode node) {
        SymbolUri symbol = attrs.symbolUri(FtmlKey.PRECONDITION_SYMBOL);
        CognitiveDimension dimension = attrs.optionalTyped(FtmlKey.PRECONDITION_DIMENSION, CognitiveDimension::parse)
            .orElse(CognitiveDimension.REMEMBER);
        keys.remove(FtmlKey.PRECONDITION_DIMENSION);
        return KeyResult.meta(new MetaDatum.Precondition(symbol, dimension));
    }

    private static KeyResult objective(ExtractorState state, Attributes attrs, KeyList keys, FtmlNode node) {
        SymbolUri symbol = attrs.symbolUri(FtmlKey.OBJECTIVE_SYMBOL);
        CognitiveDimension dimension = attrs.optionalTyped(FtmlKey.OBJECTIVE_DIMENSION, CognitiveDimension::parse)
            .orElse(CognitiveDimension.REMEMBER);
        keys.remove(FtmlKey.OBJECTIVE_DIMENSION);
        return KeyResult.meta(new MetaDatum.Objective(symbol, dimension));
    }

    private static KeyResult solution(ExtractorState state, Attributes attrs, KeyList keys, FtmlNode node) {
        String answerClass = attrs.takeTyped(FtmlKey.PROBLEM_SOLUTION,
            v -> UriNames.isId(v) ? Optional.of(v) : Optional.empty()).orElse(null);
        attrs.take(FtmlKey.ANSWER_CLASS);
        keys.remove(FtmlKey.ANSWER_CLASS);
        return KeyResult.narrative(new OpenNarrativeElement.Solution(answerClass), CloseFtmlElement.SOLUTION);
    }

    private static KeyResult answerClass(ExtractorState state, Attributes attrs, KeyList keys, FtmlNode node) {
        String id = attrs.elementUriFromId("AC").lastName();
        AnswerKind kind = attrs.optionalTyped(FtmlKey.ANSWER_CLASS_PTS, AnswerKind::parse).orElse(AnswerKind.DEFAULT);
        keys.remove(FtmlKey.ID, FtmlKey.ANSWER_CLASS_PTS);
        return KeyResult.narrative(new OpenNarrativeElement.AnswerClass(id, kind), CloseFtmlElement.ANSWER_CLASS);
    }

    private static KeyHandler choiceBlock(boolean multiple) {
        return (state, attrs, keys, node) -> {
            List<String> styles = attrs.stringList(FtmlKey.STYLES);
            ChoiceBlockStyle style = ChoiceBlockStyle.fromStyles(styles);
            keys.remove(FtmlKey.STYLES);
            return KeyResult.narrative(
                new OpenNarrativeElement.ChoiceBlock(styles, style, multiple), CloseFtmlElement.CHOICE_BLOCK);
        };
    }

    /** An unreadable width is treated as absent. */
    private static KeyResult fillinSol(ExtractorState state, Attributes attrs, KeyList keys, FtmlNode node) {
        Float width = attrs.optional(FtmlKey.PROBLEM_FILLINSOL_WIDTH).flatMap(KeyRules::parseFloat).orElse(null);
        keys.remove(FtmlKey.PROBLEM_FILLINSOL_WIDTH);
        return KeyResult.narrative(new OpenNarrativeElement.FillinSol(width), CloseFtmlElement.FILLIN_SOL);
    }

    private static KeyResult fillinSolCase(ExtractorState state, Attributes attrs, KeyList keys, FtmlNode node) {
        String kind = attrs.takeOptional(FtmlKey.PROBLEM_FILLINSOL_CASE)
            .orElseThrow(() -> FtmlExtractionException.missingKey(FtmlKey.PROBLEM_FILLINSOL_CASE));
        boolean verdict = attrs.takeBool(FtmlKey.PROBLEM_FILLINSOL_CASE_VERDICT);
        keys.remove(FtmlKey.PROBLEM_FILLINSOL_CASE_VALUE, FtmlKey.PROBLEM_FILLINSOL_CASE_VERDICT);
        String value = attrs.take(FtmlKey.PROBLEM_FILLINSOL_CASE_VALUE)
            .orElseThrow(() -> FtmlExtractionException.missingKey(FtmlKey.PROBLEM_FILLINSOL_CASE_VALUE));
        FillInSolOption option = FillInSolOption.fromValues(kind, value, verdict)
            .orElseThrow(() -> FtmlExtractionException.invalidValue(FtmlKey.PROBLEM_FILLINSOL_CASE));
        return KeyResult.narrative(new OpenNarrativeElement.FillinSolCase(option), CloseFtmlElement.FILLIN_SOL_CASE);
    }
}
