package work.lcod.ftml.model.problem;

import java.util.List;
import work.lcod.ftml.node.SourceRange;

public record ChoiceBlock(boolean multiple, ChoiceBlockStyle style, SourceRange range, List<String> styles, List<Choice> choices) {
    public ChoiceBlock {
        styles = List.copyOf(styles);
        choices = List.copyOf(choices);
    }
}
