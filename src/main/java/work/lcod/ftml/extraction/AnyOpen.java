package work.lcod.ftml.extraction;

/**
 * What a key handler asks the state to do on entering a node.
 */
public sealed interface AnyOpen {
    AnyOpen NOTHING = new Nothing();

    record Meta(MetaDatum datum) implements AnyOpen {}

    /** At most one frame per stack; either side may be null. */
    record Open(OpenDomainElement domain, OpenNarrativeElement narrative) implements AnyOpen {}

    record Nothing() implements AnyOpen {}

    static AnyOpen domain(OpenDomainElement element) {
        return new Open(element, null);
    }

    static AnyOpen narrative(OpenNarrativeElement element) {
        return new Open(null, element);
    }

    static AnyOpen both(OpenDomainElement domain, OpenNarrativeElement narrative) {
        return new Open(domain, narrative);
    }

    static AnyOpen meta(MetaDatum datum) {
        return new Meta(datum);
    }
}
