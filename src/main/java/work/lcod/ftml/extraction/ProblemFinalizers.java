package work.lcod.ftml.extraction;

import com.fasterxml.jackson.core.JsonProcessingException;
import java.util.List;
import work.lcod.ftml.keys.FtmlKey;
import work.lcod.ftml.model.DataRef;
import work.lcod.ftml.model.narrative.DocumentElement;
import work.lcod.ftml.model.problem.AnswerClass;
import work.lcod.ftml.model.problem.Choice;
import work.lcod.ftml.model.problem.ChoiceBlock;
import work.lcod.ftml.model.problem.FillInSol;
import work.lcod.ftml.model.problem.FillInSolOption;
import work.lcod.ftml.model.problem.GradingNote;
import work.lcod.ftml.model.problem.ProblemData;
import work.lcod.ftml.model.problem.SolutionData;
import work.lcod.ftml.node.FtmlNode;
import work.lcod.ftml.node.NodeChild;

/**
 * Finalizers for problems and their solutions, hints, notes and grading material.
 * Solution content is moved into the blob buffer and removed from the output markup.
 */
final class ProblemFinalizers {
    private final ExtractorState state;

    ProblemFinalizers(ExtractorState state) {
        this.state = state;
    }

    private DataRef push(Object value, FtmlKey key) {
        try {
            return state.buffer().push(value);
        } catch (JsonProcessingException ex) {
            throw FtmlExtractionException.encodingError(key, ex.getOriginalMessage());
        }
    }

    private OpenNarrativeElement.Problem nearestProblem() {
        for (OpenNarrativeElement frame : state.narrative()) {
            if (frame instanceof OpenNarrativeElement.Problem p) {
                return p;
            }
        }
        return null;
    }

    private static void deleteElementChildren(FtmlNode node) {
        for (NodeChild child : List.copyOf(node.children())) {
            if (child instanceof NodeChild.Element e) {
                e.node().delete();
            }
        }
    }

    void closeProblem(OpenNarrativeElement.Problem problem, FtmlNode node) {
        DataRef solutions = push(problem.solutions(), FtmlKey.PROBLEM);
        state.addSolutions(problem.uri(), problem.solutions());
        ProblemData data = new ProblemData(
            problem.subProblem(),
            problem.autogradable(),
            problem.points(),
            problem.minutes(),
            solutions,
            problem.gradingNotes(),
            problem.hints(),
            problem.notes(),
            problem.styles(),
            problem.title(),
            problem.preconditions(),
            problem.objectives(),
            state.currentSourceRange());
        state.pushElem(new DocumentElement.Problem(problem.uri(), node.range(), problem.children(), data));
    }

    /** The text typed into the blank is the first accepted answer; explicit cases follow. */
    void closeFillinSol(OpenNarrativeElement.FillinSol fillin, FtmlNode node) {
        fillin.nodes().forEach(FtmlNode::delete);
        String exact = node.innerString();
        fillin.cases().add(0, new FillInSolOption.Exact(exact, true, ""));
        OpenNarrativeElement.Problem problem = nearestProblem();
        if (problem == null) {
            throw FtmlExtractionException.notIn(FtmlKey.PROBLEM_FILLINSOL, "problems");
        }
        problem.solutions().add(new SolutionData.FillIn(new FillInSol(fillin.width(), fillin.cases())));
    }

    void closeFillinSolCase(OpenNarrativeElement.FillinSolCase open, FtmlNode node) {
        if (!(state.topNarrative() instanceof OpenNarrativeElement.FillinSol fillin)) {
            throw FtmlExtractionException.notIn(FtmlKey.PROBLEM_FILLINSOL_CASE, "fill-in-solutions");
        }
        fillin.nodes().add(node);
        fillin.cases().add(open.option().withFeedback(node.innerString()));
    }

    void closeSolution(OpenNarrativeElement.Solution solution, FtmlNode node) {
        OpenNarrativeElement.Problem problem = nearestProblem();
        if (problem == null) {
            throw FtmlExtractionException.unexpectedEndOf(FtmlKey.PROBLEM_SOLUTION);
        }
        problem.solutions().add(new SolutionData.Solution(node.string(), solution.answerClass()));
        deleteElementChildren(node);
    }

    void closeHint(FtmlNode node) {
        OpenNarrativeElement.Problem problem = nearestProblem();
        if (problem == null) {
            throw FtmlExtractionException.unexpectedEndOf(FtmlKey.PROBLEM_HINT);
        }
        problem.hints().add(push(node.string(), FtmlKey.PROBLEM_HINT));
        deleteElementChildren(node);
    }

    void closeExNote(FtmlNode node) {
        OpenNarrativeElement.Problem problem = nearestProblem();
        if (problem == null) {
            throw FtmlExtractionException.unexpectedEndOf(FtmlKey.PROBLEM_NOTE);
        }
        problem.notes().add(push(node.string(), FtmlKey.PROBLEM_NOTE));
        deleteElementChildren(node);
    }

    void closeGradingNote(OpenNarrativeElement.ProblemGradingNote note, FtmlNode node) {
        OpenNarrativeElement.Problem problem = nearestProblem();
        if (problem == null) {
            throw FtmlExtractionException.unexpectedEndOf(FtmlKey.PROBLEM_GRADING_NOTE);
        }
        GradingNote grading = new GradingNote(node.string(), note.answerClasses());
        problem.gradingNotes().add(push(grading, FtmlKey.PROBLEM_GRADING_NOTE));
        deleteElementChildren(node);
    }

    void answerClassFeedback(FtmlNode node) {
        for (OpenNarrativeElement frame : state.narrative()) {
            if (frame instanceof OpenNarrativeElement.AnswerClass cls) {
                cls.nodes().add(node);
                return;
            }
        }
        throw FtmlExtractionException.notIn(FtmlKey.ANSWER_CLASS_FEEDBACK, "answer classes");
    }

    /** Feedback nodes are read into the class and removed; what remains is its description. */
    void closeAnswerClass(OpenNarrativeElement.AnswerClass open, FtmlNode node) {
        StringBuilder feedback = new StringBuilder();
        for (FtmlNode n : open.nodes()) {
            feedback.append(n.innerString());
            n.delete();
        }
        String description = node.innerString();
        if (!(state.topNarrative() instanceof OpenNarrativeElement.ProblemGradingNote note)) {
            throw FtmlExtractionException.unexpectedEndOf(FtmlKey.ANSWER_CLASS);
        }
        note.answerClasses().add(new AnswerClass(open.id(), feedback.toString(), open.kind(), description));
    }

    void closeChoiceBlock(OpenNarrativeElement.ChoiceBlock block, FtmlNode node) {
        OpenNarrativeElement.Problem problem = nearestProblem();
        if (problem == null) {
            throw FtmlExtractionException.unexpectedEndOf(
                block.multiple() ? FtmlKey.PROBLEM_MULTIPLE_CHOICE_BLOCK : FtmlKey.PROBLEM_SINGLE_CHOICE_BLOCK);
        }
        problem.solutions().add(new SolutionData.Choices(
            new ChoiceBlock(block.multiple(), block.style(), node.range(), block.styles(), block.choices())));
    }

    void closeChoice(OpenNarrativeElement.ProblemChoice choice) {
        choice.nodes().forEach(FtmlNode::delete);
        for (OpenNarrativeElement frame : state.narrative()) {
            if (frame instanceof OpenNarrativeElement.ChoiceBlock block) {
                String verdict = choice.verdict();
                if (verdict == null || verdict.isEmpty()) {
                    verdict = choice.correct() ? "correct" : "wrong";
                }
                block.choices().add(new Choice(choice.correct(), verdict, choice.feedback()));
                return;
            }
        }
        throw FtmlExtractionException.unexpectedEndOf(FtmlKey.PROBLEM_CHOICE);
    }

    void closeChoiceVerdict(FtmlNode node) {
        OpenNarrativeElement.ProblemChoice choice = nearestChoice(FtmlKey.PROBLEM_CHOICE_VERDICT);
        choice.verdict(node.innerString());
        choice.nodes().add(node);
    }

    void closeChoiceFeedback(FtmlNode node) {
        OpenNarrativeElement.ProblemChoice choice = nearestChoice(FtmlKey.PROBLEM_CHOICE_FEEDBACK);
        choice.feedback(node.innerString());
        choice.nodes().add(node);
    }

    private OpenNarrativeElement.ProblemChoice nearestChoice(FtmlKey key) {
        for (OpenNarrativeElement frame : state.narrative()) {
            if (frame instanceof OpenNarrativeElement.ProblemChoice choice) {
                return choice;
            }
        }
        throw FtmlExtractionException.notIn(key, "problem choices");
    }
}
