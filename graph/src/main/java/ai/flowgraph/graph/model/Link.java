package ai.flowgraph.graph.model;

import javax.annotation.Nullable;

/**
 * Directed connection from an outlet to an inlet. The target is fixed; the source may be absent
 * (a pending link) and can be reassigned.
 */
public final class Link implements GraphEntity {
    private final String id;
    private final Inlet target;
    @Nullable
    private Outlet source;
    private final long serial;

    Link(@Nullable Outlet source, Inlet target, long serial) {
        this.id = Operator.IDS.generate("link");
        this.source = source;
        this.target = target;
        this.serial = serial;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public EntityKind kind() {
        return EntityKind.LINK;
    }

    public Inlet target() {
        return target;
    }

    @Nullable
    public Outlet source() {
        return source;
    }

    public boolean isPending() {
        return source == null;
    }

    /**
     * Creation order within the owning store; a larger serial means a more recent link.
     */
    public long serial() {
        return serial;
    }

    void setSource(@Nullable Outlet source) {
        this.source = source;
    }

    @Override
    public String toString() {
        return "Link(" + (source == null ? "<pending>" : source) + " -> " + target + ")";
    }
}
