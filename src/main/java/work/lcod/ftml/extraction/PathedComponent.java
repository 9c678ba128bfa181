package work.lcod.ftml.extraction;

import java.util.List;
import work.lcod.ftml.model.notation.NotationComponent;

/**
 * A notation component recorded at a child-index path below the collecting frame's node.
 */
public record PathedComponent(NotationComponent component, List<Integer> path) {
    public PathedComponent {
        path = List.copyOf(path);
    }
}
