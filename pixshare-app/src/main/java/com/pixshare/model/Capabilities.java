package com.pixshare.model;

/**
 * Write capabilities carried by a share, or captured on a participant row at
 * join time. Reading never needs a flag.
 */
public record Capabilities(
    boolean canComment,
    boolean canReact,
    boolean canUpload,
    boolean canCurate
) {
    public static final Capabilities NONE = new Capabilities(false, false, false, false);
    public static final Capabilities ALL = new Capabilities(true, true, true, true);

    public boolean allows(Capability capability) {
        if (capability == null) {
            return true;
        }
        return switch (capability) {
            case COMMENT -> canComment;
            case REACT -> canReact;
            case UPLOAD -> canUpload;
            case CURATE -> canCurate;
        };
    }

    public Capabilities union(Capabilities other) {
        return new Capabilities(
            canComment || other.canComment,
            canReact || other.canReact,
            canUpload || other.canUpload,
            canCurate || other.canCurate
        );
    }
}
