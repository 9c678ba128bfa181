package work.lcod.ftml.keys;

import java.util.Optional;
import work.lcod.ftml.extraction.CloseFtmlElement;
import work.lcod.ftml.extraction.ExtractorState;
import work.lcod.ftml.extraction.FtmlExtractionException;
import work.lcod.ftml.extraction.MetaDatum;
import work.lcod.ftml.extraction.OpenNarrativeElement;
import work.lcod.ftml.model.narrative.DocumentCounter;
import work.lcod.ftml.model.narrative.DocumentKind;
import work.lcod.ftml.model.narrative.DocumentStyle;
import work.lcod.ftml.model.narrative.SectionLevel;
import work.lcod.ftml.node.FtmlNode;
import work.lcod.ftml.uri.DocumentElementUri;
import work.lcod.ftml.uri.DocumentUri;
import work.lcod.ftml.uri.UriNames;

/**
 * Document level keys: metadata, styles and counters, sections, slides, titles and references to
 * other documents.
 */
final class DocumentRules {
    private DocumentRules() {}

    static void register(KeyRules.Builder rules) {
        rules.on(FtmlKey.DOC_URI, DocumentRules::docUri)
            .on(FtmlKey.DOC_TITLE, (state, attrs, keys, node) -> KeyResult.closeOnly(CloseFtmlElement.DOC_TITLE))
            .on(FtmlKey.DOC_KIND, DocumentRules::docKind)
            .on(FtmlKey.STYLE, DocumentRules::style)
            .on(FtmlKey.COUNTER, DocumentRules::counter)
            .on(FtmlKey.COUNTER_PARENT, DocumentRules::counterParent)
            .on(FtmlKey.INPUT_REF, DocumentRules::inputRef)
            .on(FtmlKey.IF_INPUTREF, (state, attrs, keys, node) ->
                KeyResult.meta(new MetaDatum.IfInputref(attrs.bool(FtmlKey.IF_INPUTREF))))
            .on(FtmlKey.USE_MODULE, (state, attrs, keys, node) ->
                KeyResult.meta(new MetaDatum.UseModule(attrs.takeSymbolOrModuleUri(FtmlKey.USE_MODULE))))
            .on(FtmlKey.SECTION, DocumentRules::section)
            .on(FtmlKey.SKIP_SECTION, (state, attrs, keys, node) ->
                KeyResult.narrative(new OpenNarrativeElement.SkipSection(), CloseFtmlElement.SKIP_SECTION))
            .on(FtmlKey.SET_SECTION_LEVEL, DocumentRules::setSectionLevel)
            .on(FtmlKey.CURRENT_SECTION_LEVEL, DocumentRules::currentSectionLevel)
            .on(FtmlKey.TITLE, DocumentRules::title)
            .on(FtmlKey.SLIDE, DocumentRules::slide)
            .on(FtmlKey.SLIDE_NUMBER, KeyRules.NO_OP)
            .on(FtmlKey.INVISIBLE, DocumentRules::invisible);
    }

    private static KeyResult docUri(ExtractorState state, Attributes attrs, KeyList keys, FtmlNode node) {
        return KeyResult.meta(new MetaDatum.Uri(attrs.documentUri(FtmlKey.DOC_URI)));
    }

    private static KeyResult docKind(ExtractorState state, Attributes attrs, KeyList keys, FtmlNode node) {
        DocumentKind kind = attrs.typed(FtmlKey.DOC_KIND, DocumentKind::parse);
        if (kind instanceof DocumentKind.Exam) {
            kind = new DocumentKind.Exam(
                attrs.string(FtmlKey.DOC_KIND_DATE),
                attrs.string(FtmlKey.DOC_KIND_COURSE),
                attrs.bool(FtmlKey.DOC_KIND_RETAKE),
                number(attrs),
                attrs.optional(FtmlKey.DOC_KIND_TERM).orElse(null));
        } else if (kind instanceof DocumentKind.Homework) {
            kind = new DocumentKind.Homework(
                attrs.string(FtmlKey.DOC_KIND_DATE),
                attrs.string(FtmlKey.DOC_KIND_COURSE),
                number(attrs),
                attrs.optional(FtmlKey.DOC_KIND_TERM).orElse(null));
        } else if (kind instanceof DocumentKind.Quiz) {
            kind = new DocumentKind.Quiz(
                attrs.string(FtmlKey.DOC_KIND_DATE),
                attrs.string(FtmlKey.DOC_KIND_COURSE),
                number(attrs),
                attrs.optional(FtmlKey.DOC_KIND_TERM).orElse(null));
        }
        keys.remove(FtmlKey.DOC_KIND_DATE, FtmlKey.DOC_KIND_COURSE, FtmlKey.DOC_KIND_RETAKE,
            FtmlKey.DOC_KIND_NUM, FtmlKey.DOC_KIND_TERM);
        return KeyResult.meta(new MetaDatum.Kind(kind));
    }

    private static int number(Attributes attrs) {
        return attrs.optionalTyped(FtmlKey.DOC_KIND_NUM, KeyRules::parseInt).orElse(0);
    }

    private static KeyResult style(ExtractorState state, Attributes attrs, KeyList keys, FtmlNode node) {
        DocumentStyle style = attrs.typed(FtmlKey.STYLE, DocumentStyle::parse);
        Optional<String> counter = attrs.optional(FtmlKey.COUNTER);
        if (counter.isPresent()) {
            style = style.withCounter(counter.get());
        }
        keys.remove(FtmlKey.COUNTER);
        return KeyResult.meta(new MetaDatum.Style(style));
    }

    private static KeyResult counter(ExtractorState state, Attributes attrs, KeyList keys, FtmlNode node) {
        String name = attrs.string(FtmlKey.COUNTER);
        SectionLevel parent = attrs.optionalTyped(FtmlKey.COUNTER_PARENT, DocumentRules::level).orElse(null);
        keys.remove(FtmlKey.COUNTER, FtmlKey.COUNTER_PARENT);
        return KeyResult.meta(new MetaDatum.Counter(new DocumentCounter(name, parent)));
    }

    private static KeyResult counterParent(ExtractorState state, Attributes attrs, KeyList keys, FtmlNode node) {
        String name = attrs.string(FtmlKey.COUNTER);
        SectionLevel parent = attrs.typed(FtmlKey.COUNTER_PARENT, DocumentRules::level);
        keys.remove(FtmlKey.COUNTER, FtmlKey.COUNTER_PARENT);
        return KeyResult.meta(new MetaDatum.Counter(new DocumentCounter(name, parent)));
    }

    private static Optional<SectionLevel> level(String value) {
        return KeyRules.parseInt(value).flatMap(SectionLevel::fromNumber);
    }

    private static KeyResult inputRef(ExtractorState state, Attributes attrs, KeyList keys, FtmlNode node) {
        DocumentUri target = attrs.documentUri(FtmlKey.INPUT_REF);
        String prefix = UriNames.isId(target.name()) ? target.name() : "inputref";
        DocumentElementUri uri = attrs.elementUriFromId(prefix);
        keys.remove(FtmlKey.ID);
        return KeyResult.meta(new MetaDatum.InputRef(target, uri));
    }

    private static KeyResult section(ExtractorState state, Attributes attrs, KeyList keys, FtmlNode node) {
        DocumentElementUri uri = attrs.elementUriFromId("section");
        keys.remove(FtmlKey.ID);
        return KeyResult.narrative(new OpenNarrativeElement.Section(uri), CloseFtmlElement.SECTION);
    }

    private static KeyResult setSectionLevel(ExtractorState state, Attributes attrs, KeyList keys, FtmlNode node) {
        SectionLevel level = attrs.typed(FtmlKey.SET_SECTION_LEVEL, DocumentRules::level);
        return KeyResult.meta(new MetaDatum.SetSectionLevel(level));
    }

    /** Renders the name of the current level; nothing to extract. */
    private static KeyResult currentSectionLevel(ExtractorState state, Attributes attrs, KeyList keys, FtmlNode node) {
        keys.remove(FtmlKey.CAPITALIZE);
        return KeyResult.NOTHING;
    }

    private static KeyResult title(ExtractorState state, Attributes attrs, KeyList keys, FtmlNode node) {
        keys.remove(FtmlKey.INVISIBLE);
        attrs.take(FtmlKey.INVISIBLE);
        for (OpenNarrativeElement frame : state.narrative()) {
            if (frame instanceof OpenNarrativeElement.Section) {
                return KeyResult.closeOnly(CloseFtmlElement.SECTION_TITLE);
            }
            if (frame instanceof OpenNarrativeElement.Paragraph) {
                return KeyResult.closeOnly(CloseFtmlElement.PARAGRAPH_TITLE);
            }
            if (frame instanceof OpenNarrativeElement.Slide) {
                return KeyResult.closeOnly(CloseFtmlElement.SLIDE_TITLE);
            }
            if (frame instanceof OpenNarrativeElement.Problem) {
                return KeyResult.closeOnly(CloseFtmlElement.PROBLEM_TITLE);
            }
            if (!(frame instanceof OpenNarrativeElement.Module
                || frame instanceof OpenNarrativeElement.MathStructure
                || frame instanceof OpenNarrativeElement.Morphism
                || frame instanceof OpenNarrativeElement.Invisible)) {
                break;
            }
        }
        throw FtmlExtractionException.notIn(FtmlKey.TITLE, "a section or paragraph");
    }

    private static KeyResult slide(ExtractorState state, Attributes attrs, KeyList keys, FtmlNode node) {
        DocumentElementUri uri = attrs.elementUriFromId("slide");
        keys.remove(FtmlKey.ID);
        return KeyResult.narrative(new OpenNarrativeElement.Slide(uri), CloseFtmlElement.SLIDE);
    }

    private static KeyResult invisible(ExtractorState state, Attributes attrs, KeyList keys, FtmlNode node) {
        if (attrs.takeBool(FtmlKey.INVISIBLE)) {
            return KeyResult.narrative(new OpenNarrativeElement.Invisible(), CloseFtmlElement.INVISIBLE);
        }
        return KeyResult.NOTHING;
    }
}
