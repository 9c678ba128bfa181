package work.lcod.ftml.model.problem;

public record Choice(boolean correct, String verdict, String feedback) {}
