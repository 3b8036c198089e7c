package ai.flowgraph.common;

/**
 * Source of opaque entity ids. Ids are only required to be unique within one process.
 */
public interface IdGenerator {
    String generate(String prefix);
}
