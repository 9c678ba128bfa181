package work.lcod.ftml.model.problem;

import work.lcod.ftml.uri.SymbolUri;

public record DimensionedSymbol(CognitiveDimension dimension, SymbolUri symbol) {}
