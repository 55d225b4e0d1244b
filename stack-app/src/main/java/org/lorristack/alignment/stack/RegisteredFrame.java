package org.lorristack.alignment.stack;

import org.lorristack.alignment.transform.RigidTransform2D;

/**
 * A frame paired with the transform that maps sequence anchor coordinates to the frame's coordinates.
 */
public class RegisteredFrame {

    private final Frame frame;
    private final RigidTransform2D transform;

    public RegisteredFrame(final Frame frame,
                           final RigidTransform2D transform) {
        this.frame = frame;
        this.transform = transform;
    }

    public Frame getFrame() {
        return frame;
    }

    public RigidTransform2D getTransform() {
        return transform;
    }

    @Override
    public String toString() {
        return frame.getId();
    }
}
