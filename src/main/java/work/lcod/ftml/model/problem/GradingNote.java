package work.lcod.ftml.model.problem;

import java.util.List;

/**
 * Instructions for graders, with the answer classes they may assign.
 */
public record GradingNote(String html, List<AnswerClass> answerClasses) {
    public GradingNote {
        answerClasses = List.copyOf(answerClasses);
    }
}
