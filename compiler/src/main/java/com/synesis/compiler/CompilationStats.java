package com.synesis.compiler;

/** Counts of a compilation run. {@code codeCount} is the number of distinct ontology concepts. */
public final class CompilationStats {
    private final int sourceCount;
    private final int itemCount;
    private final int ontologyCount;
    private final int codeCount;
    private final int chainCount;
    private final int tripleCount;

    public CompilationStats(
            int sourceCount, int itemCount, int ontologyCount, int codeCount, int chainCount, int tripleCount) {
        this.sourceCount = sourceCount;
        this.itemCount = itemCount;
        this.ontologyCount = ontologyCount;
        this.codeCount = codeCount;
        this.chainCount = chainCount;
        this.tripleCount = tripleCount;
    }

    public int getSourceCount() {
        return sourceCount;
    }

    public int getItemCount() {
        return itemCount;
    }

    public int getOntologyCount() {
        return ontologyCount;
    }

    public int getCodeCount() {
        return codeCount;
    }

    public int getChainCount() {
        return chainCount;
    }

    public int getTripleCount() {
        return tripleCount;
    }

    @Override
    public String toString() {
        return "CompilationStats{sources="
                + sourceCount
                + ", items="
                + itemCount
                + ", ontologies="
                + ontologyCount
                + ", codes="
                + codeCount
                + ", chains="
                + chainCount
                + ", triples="
                + tripleCount
                + "}";
    }
}
