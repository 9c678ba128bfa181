package work.lcod.ftml.model.narrative;

import java.util.List;

public record DocumentStyles(List<DocumentCounter> counters, List<DocumentStyle> styles) {
    public DocumentStyles {
        counters = List.copyOf(counters);
        styles = List.copyOf(styles);
    }
}
