package work.lcod.ftml.model.problem;

import java.util.List;

public record FillInSol(Float width, List<FillInSolOption> opts) {
    public FillInSol {
        opts = List.copyOf(opts);
    }
}
