package org.lorristack.alignment.match;

import java.io.Serializable;

import org.lorristack.alignment.transform.RigidTransform2D;

/**
 * Result of registering one frame of a sequence: either a transform relative to the
 * sequence anchor or the reason registration failed.
 */
public class RegistrationOutcome
        implements Serializable {

    /** Reasons a frame could not be registered. */
    public enum FailureReason {
        /** Stars could not be extracted from the frame, so it was never registered. */
        EXTRACTION_FAILED,

        /** No anchor candidate produced a consistent pairing of sufficient size. */
        REGISTRATION_FAILED
    }

    private final String frameId;
    private final RigidTransform2D transform;
    private final String anchorFrameId;
    private final FailureReason failureReason;
    private final String failureMessage;

    private RegistrationOutcome(final String frameId,
                                final RigidTransform2D transform,
                                final String anchorFrameId,
                                final FailureReason failureReason,
                                final String failureMessage) {
        this.frameId = frameId;
        this.transform = transform;
        this.anchorFrameId = anchorFrameId;
        this.failureReason = failureReason;
        this.failureMessage = failureMessage;
    }

    /**
     * @param  frameId        identifies the registered frame.
     * @param  transform      maps sequence anchor coordinates to the frame's coordinates.
     * @param  anchorFrameId  identifies the frame the registration was derived from.
     */
    public static RegistrationOutcome success(final String frameId,
                                              final RigidTransform2D transform,
                                              final String anchorFrameId) {
        return new RegistrationOutcome(frameId, transform, anchorFrameId, null, null);
    }

    public static RegistrationOutcome failure(final String frameId,
                                              final FailureReason reason,
                                              final String message) {
        return new RegistrationOutcome(frameId, null, null, reason, message);
    }

    public String getFrameId() {
        return frameId;
    }

    public boolean isSuccess() {
        return transform != null;
    }

    /**
     * @return transform for successful outcomes.
     *
     * @throws IllegalStateException
     *   if this is a failure outcome.
     */
    public RigidTransform2D getTransform()
            throws IllegalStateException {
        if (transform == null) {
            throw new IllegalStateException("frame " + frameId + " was not registered (" + failureReason + ")");
        }
        return transform;
    }

    public String getAnchorFrameId() {
        return anchorFrameId;
    }

    public FailureReason getFailureReason() {
        return failureReason;
    }

    public String getFailureMessage() {
        return failureMessage;
    }

    @Override
    public String toString() {
        if (isSuccess()) {
            return "{\"frameId\": \"" + frameId + "\", \"anchorFrameId\": \"" + anchorFrameId +
                   "\", \"transform\": \"" + transform + "\"}";
        } else {
            return "{\"frameId\": \"" + frameId + "\", \"failureReason\": \"" + failureReason +
                   "\", \"failureMessage\": \"" + failureMessage + "\"}";
        }
    }
}
