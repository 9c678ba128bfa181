package work.lcod.ftml.extraction;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.ftml.support.FtmlTestSupport.DOCUMENT;
import static work.lcod.ftml.support.FtmlTestSupport.extract;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.ftml.api.LogLevel;
import work.lcod.ftml.model.narrative.DocumentElement;
import work.lcod.ftml.model.problem.FillInSol;
import work.lcod.ftml.model.problem.FillInSolOption;
import work.lcod.ftml.model.problem.SolutionData;
import work.lcod.ftml.node.HtmlSource;
import work.lcod.ftml.shared.Diagnostics;

class ProblemExtractionTest {
    @Test
    void fillInSolutionCollectsCases() throws Exception {
        var html = HtmlSource.parse(
            "<div data-ftml-problem=\"\" data-ftml-autogradable=\"true\" data-ftml-problempoints=\"2\">"
                + "<p>How many?</p>"
                + "<span data-ftml-fillinsol=\"\" data-ftml-fillinsol-width=\"3\">42"
                + "<span data-ftml-fillin-case=\"numrange\" data-ftml-fillin-case-value=\"40-45\""
                + " data-ftml-fillin-case-verdict=\"true\">close enough</span></span>"
                + "</div>");
        var result = new HtmlExtractor().extract(html, DOCUMENT, Diagnostics.silent(LogLevel.WARN));

        var problem = assertInstanceOf(DocumentElement.Problem.class, result.document().elements().get(0));
        assertEquals(DOCUMENT.element("problem"), problem.uri());
        assertTrue(problem.data().autogradable());
        assertEquals(2.0f, problem.data().points());

        List<SolutionData> solutions = result.solutions().get(problem.uri());
        assertEquals(List.of(new SolutionData.FillIn(new FillInSol(3.0f, List.of(
            new FillInSolOption.Exact("42", true, ""),
            new FillInSolOption.NumericalRange(40.0f, 45.0f, true, "close enough"))))), solutions);

        assertFalse(html.body().html().contains("close enough"));
        assertTrue(DataBuffer.read(result.data(), problem.data().solutions()).isArray());
    }

    @Test
    void solutionsLeaveTheMarkup() {
        var html = HtmlSource.parse(
            "<div data-ftml-problem=\"\" data-ftml-id=\"p1\"><p>What?</p>"
                + "<div data-ftml-solution=\"\"><p>Answer <b>42</b></p></div></div>");
        var result = new HtmlExtractor().extract(html, DOCUMENT, Diagnostics.silent(LogLevel.WARN));

        var uri = DOCUMENT.element("p1");
        var solution = assertInstanceOf(SolutionData.Solution.class, result.solutions().get(uri).get(0));
        assertTrue(solution.html().contains("Answer <b>42</b>"));
        assertFalse(html.body().html().contains("Answer"));
        assertTrue(html.body().html().contains("What?"));
    }

    @Test
    void hintsAndNotesLeaveTheMarkup() throws Exception {
        var html = HtmlSource.parse(
            "<div data-ftml-problem=\"\"><p>Count the successors.</p>"
                + "<div data-ftml-problemhint=\"\"><p>Start at zero</p></div>"
                + "<div data-ftml-problemnote=\"\"><p>Induction works too</p></div></div>");
        var result = new HtmlExtractor().extract(html, DOCUMENT, Diagnostics.silent(LogLevel.WARN));

        var problem = assertInstanceOf(DocumentElement.Problem.class, result.document().elements().get(0));
        assertEquals(1, problem.data().hints().size());
        assertEquals(1, problem.data().notes().size());
        assertTrue(DataBuffer.read(result.data(), problem.data().hints().get(0)).asText().contains("Start at zero"));
        assertTrue(DataBuffer.read(result.data(), problem.data().notes().get(0)).asText().contains("Induction works too"));

        assertFalse(html.body().html().contains("Start at zero"));
        assertFalse(html.body().html().contains("Induction works too"));
        assertTrue(html.body().html().contains("Count the successors."));
    }

    @Test
    void singleChoiceBlock() {
        var result = extract(
            "<div data-ftml-problem=\"\">"
                + "<ul data-ftml-single-choice-block=\"\">"
                + "<li data-ftml-problem-choice=\"true\">yes<span data-ftml-problem-choice-feedback=\"\">right</span></li>"
                + "<li data-ftml-problem-choice=\"false\">no</li>"
                + "</ul></div>");

        var problem = (DocumentElement.Problem) result.document().elements().get(0);
        var block = assertInstanceOf(SolutionData.Choices.class, result.solutions().get(problem.uri()).get(0)).block();
        assertEquals(2, block.choices().size());
        assertTrue(block.choices().get(0).correct());
        assertEquals("correct", block.choices().get(0).verdict());
        assertEquals("right", block.choices().get(0).feedback());
        assertEquals("wrong", block.choices().get(1).verdict());
    }

    @Test
    void fillInOutsideProblem() {
        var ex = assertThrows(FtmlExtractionException.class,
            () -> extract("<span data-ftml-fillinsol=\"\">42</span>"));
        assertEquals(FtmlErrorKind.NOT_IN, ex.kind());
    }

    @Test
    void invalidCaseKind() {
        var ex = assertThrows(FtmlExtractionException.class, () -> extract(
            "<div data-ftml-problem=\"\"><span data-ftml-fillinsol=\"\">"
                + "<span data-ftml-fillin-case=\"fuzzy\" data-ftml-fillin-case-value=\"x\"></span></span></div>"));
        assertEquals(FtmlErrorKind.INVALID_VALUE, ex.kind());
    }

    @Test
    void paragraphsInsideSolutionsAreSkipped() {
        var diagnostics = Diagnostics.silent(LogLevel.INFO);
        var result = extract(
            "<div data-ftml-problem=\"\"><div data-ftml-solution=\"\">"
                + "<div data-ftml-paragraph=\"\">aside</div></div></div>", diagnostics);

        var problem = (DocumentElement.Problem) result.document().elements().get(0);
        assertTrue(problem.children().isEmpty());
        assertTrue(diagnostics.emitted().stream().anyMatch(line -> line.startsWith("[info] skipping paragraph")));
    }
}
