package work.lcod.ftml.keys;

import java.util.Objects;
import work.lcod.ftml.extraction.AnyOpen;
import work.lcod.ftml.extraction.CloseFtmlElement;
import work.lcod.ftml.extraction.MetaDatum;
import work.lcod.ftml.extraction.OpenDomainElement;
import work.lcod.ftml.extraction.OpenNarrativeElement;

/**
 * What a handler produced: something to open now and, optionally, the finalizer to run when the
 * node is left. {@code close} may be null.
 */
public record KeyResult(AnyOpen open, CloseFtmlElement close) {
    public static final KeyResult NOTHING = new KeyResult(AnyOpen.NOTHING, null);

    public KeyResult {
        Objects.requireNonNull(open, "open");
    }

    public static KeyResult closeOnly(CloseFtmlElement close) {
        return new KeyResult(AnyOpen.NOTHING, close);
    }

    public static KeyResult meta(MetaDatum datum) {
        return new KeyResult(AnyOpen.meta(datum), null);
    }

    public static KeyResult domain(OpenDomainElement element, CloseFtmlElement close) {
        return new KeyResult(AnyOpen.domain(element), close);
    }

    public static KeyResult narrative(OpenNarrativeElement element, CloseFtmlElement close) {
        return new KeyResult(AnyOpen.narrative(element), close);
    }

    public static KeyResult both(OpenDomainElement domain, OpenNarrativeElement narrative, CloseFtmlElement close) {
        return new KeyResult(AnyOpen.both(domain, narrative), close);
    }
}
