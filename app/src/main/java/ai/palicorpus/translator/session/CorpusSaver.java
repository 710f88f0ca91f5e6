package ai.palicorpus.translator.session;

import ai.palicorpus.translator.corpus.CorpusTree;

/**
 * Persists the tree after a unit is processed and before the checkpoint moves past it.
 */
@FunctionalInterface
public interface CorpusSaver {

    void save(CorpusTree tree);

    static CorpusSaver discarding() {
        return tree -> { };
    }
}
