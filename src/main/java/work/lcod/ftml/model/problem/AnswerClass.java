package work.lcod.ftml.model.problem;

public record AnswerClass(String id, String feedback, AnswerKind kind, String description) {}
