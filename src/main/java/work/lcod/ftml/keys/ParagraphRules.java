package work.lcod.ftml.keys;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import work.lcod.ftml.extraction.CloseFtmlElement;
import work.lcod.ftml.extraction.MetaDatum;
import work.lcod.ftml.extraction.OpenNarrativeElement;
import work.lcod.ftml.model.narrative.ForEntry;
import work.lcod.ftml.model.narrative.ParagraphFormatting;
import work.lcod.ftml.model.narrative.ParagraphKind;
import work.lcod.ftml.uri.DocumentElementUri;
import work.lcod.ftml.uri.SymbolUri;
import work.lcod.ftml.uri.UriParseException;

final class ParagraphRules {
    private ParagraphRules() {}

    static void register(KeyRules.Builder rules) {
        rules.on(FtmlKey.DEFINITION, paragraph(ParagraphKind.DEFINITION))
            .on(FtmlKey.ASSERTION, paragraph(ParagraphKind.ASSERTION))
            .on(FtmlKey.EXAMPLE, paragraph(ParagraphKind.EXAMPLE))
            .on(FtmlKey.PROOF, paragraph(ParagraphKind.PROOF))
            .on(FtmlKey.SUB_PROOF, paragraph(ParagraphKind.SUBPROOF))
            .on(FtmlKey.PARAGRAPH, paragraph(ParagraphKind.PARAGRAPH))
            .on(FtmlKey.PROOF_BODY, (state, attrs, keys, node) -> KeyResult.meta(new MetaDatum.ProofBody()));
    }

    private static KeyHandler paragraph(ParagraphKind kind) {
        return (state, attrs, keys, node) -> {
            DocumentElementUri uri = attrs.elementUriFromId(kind.key());
            boolean inline = attrs.bool(FtmlKey.INLINE);
            List<String> styles = attrs.stringList(FtmlKey.STYLES);
            Set<SymbolUri> fors = new LinkedHashSet<>(attrs.typedList(FtmlKey.FORS, ParagraphRules::symbol));
            List<ForEntry> entries = new ArrayList<>();
            for (SymbolUri symbol : fors) {
                entries.add(new ForEntry(symbol, null));
            }
            ParagraphFormatting formatting;
            if (inline) {
                formatting = ParagraphFormatting.INLINE;
            } else if ((kind == ParagraphKind.PROOF || kind == ParagraphKind.SUBPROOF) && attrs.bool(FtmlKey.PROOF_HIDE)) {
                formatting = ParagraphFormatting.COLLAPSED;
            } else {
                formatting = ParagraphFormatting.BLOCK;
            }
            keys.remove(FtmlKey.ID, FtmlKey.INLINE, FtmlKey.FORS, FtmlKey.STYLES, FtmlKey.PROOF_HIDE);
            return KeyResult.narrative(
                new OpenNarrativeElement.Paragraph(uri, kind, formatting, styles, entries),
                CloseFtmlElement.PARAGRAPH);
        };
    }

    private static Optional<SymbolUri> symbol(String value) {
        try {
            return Optional.of(SymbolUri.parse(value));
        } catch (UriParseException ex) {
            return Optional.empty();
        }
    }
}
