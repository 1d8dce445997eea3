package com.pixshare.security;

import com.pixshare.model.Capability;
import com.pixshare.model.ResourceKind;

import java.util.EnumSet;
import java.util.Set;

import static com.pixshare.model.ResourceKind.ALBUM;
import static com.pixshare.model.ResourceKind.EVENT;
import static com.pixshare.model.ResourceKind.PHOTO;

/**
 * Protected operations, with the target kinds each accepts, the share flag a
 * non-owner needs for it, and which non-owner paths may grant it at all.
 */
public enum Operation {
    VIEW_ALBUM(EnumSet.of(ALBUM), null, true, true, false),
    VIEW_PHOTO(EnumSet.of(PHOTO), null, true, true, false),
    VIEW_EVENT(EnumSet.of(EVENT), null, true, true, false),
    FETCH_FILE(EnumSet.of(PHOTO), null, true, true, false),
    UPLOAD_PHOTO(EnumSet.of(ALBUM), Capability.UPLOAD, true, true, false),
    COMMENT(EnumSet.of(PHOTO), Capability.COMMENT, true, true, false),
    REACT(EnumSet.of(PHOTO), Capability.REACT, true, true, false),
    CURATE(EnumSet.of(ALBUM, PHOTO), Capability.CURATE, true, true, false),
    JOIN_EVENT(EnumSet.of(EVENT), null, true, true, true),
    LEAVE_EVENT(EnumSet.of(EVENT), null, false, true, true),
    EDIT_EVENT(EnumSet.of(EVENT), null, false, false, true),
    LINK_ALBUM(EnumSet.of(EVENT), null, false, false, true),
    MANAGE(EnumSet.of(ALBUM, PHOTO, EVENT), null, false, false, true);

    private final Set<ResourceKind> targets;
    private final Capability capability;
    private final boolean viaShare;
    private final boolean viaParticipant;
    private final boolean requiresIdentity;

    Operation(Set<ResourceKind> targets, Capability capability,
              boolean viaShare, boolean viaParticipant, boolean requiresIdentity) {
        this.targets = targets;
        this.capability = capability;
        this.viaShare = viaShare;
        this.viaParticipant = viaParticipant;
        this.requiresIdentity = requiresIdentity;
    }

    public boolean appliesTo(ResourceKind kind) {
        return targets.contains(kind);
    }

    /** Flag a share or participant needs; null for read-only operations. */
    public Capability capability() {
        return capability;
    }

    public boolean grantableViaShare() {
        return viaShare;
    }

    public boolean grantableViaParticipant() {
        return viaParticipant;
    }

    public boolean requiresIdentity() {
        return requiresIdentity;
    }
}
