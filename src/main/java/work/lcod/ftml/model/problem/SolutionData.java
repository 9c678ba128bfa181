package work.lcod.ftml.model.problem;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * One entry of a problem's ordered solutions list.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.SIMPLE_NAME, property = "kind")
@JsonInclude(JsonInclude.Include.NON_NULL)
public sealed interface SolutionData {
    record Solution(String html, String answerClass) implements SolutionData {}

    record Choices(ChoiceBlock block) implements SolutionData {}

    record FillIn(FillInSol fillIn) implements SolutionData {}
}
