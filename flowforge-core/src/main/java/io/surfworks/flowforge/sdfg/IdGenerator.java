package io.surfworks.flowforge.sdfg;

/**
 * Name and graph-id source for one translation run.
 */
public final class IdGenerator {

    private int nameCounter;
    private int graphCounter;

    /**
     * Returns {@code prefix_<n>} with a run-wide counter.
     */
    public String generateName(String prefix) {
        return prefix + "_" + nameCounter++;
    }

    /**
     * Next {@code sdfg_list_id}. The outermost graph receives 0.
     */
    public int nextGraphId() {
        return graphCounter++;
    }
}
