package work.lcod.ftml.model.narrative;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import java.util.Optional;

/**
 * What kind of document is being extracted; exams, homeworks and quizzes carry course data.
 * Dates are ISO-8601 strings.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.SIMPLE_NAME, property = "kind")
@JsonInclude(JsonInclude.Include.NON_NULL)
public sealed interface DocumentKind {
    record Article() implements DocumentKind {}

    record Fragment() implements DocumentKind {}

    record Exam(String date, String course, boolean retake, int num, String term) implements DocumentKind {}

    record Homework(String date, String course, int num, String term) implements DocumentKind {}

    record Quiz(String date, String course, int num, String term) implements DocumentKind {}

    DocumentKind ARTICLE = new Article();

    public static Optional<DocumentKind> parse(String value) {
        switch (value.trim().toLowerCase(java.util.Locale.ROOT)) {
            case "article":
                return Optional.of(ARTICLE);
            case "fragment":
                return Optional.of(new Fragment());
            case "exam":
                return Optional.of(new Exam(null, null, false, 0, null));
            case "homework":
                return Optional.of(new Homework(null, null, 0, null));
            case "quiz":
                return Optional.of(new Quiz(null, null, 0, null));
            default:
                return Optional.empty();
        }
    }
}
