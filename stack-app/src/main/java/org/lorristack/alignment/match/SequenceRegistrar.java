package org.lorristack.alignment.match;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.lorristack.alignment.match.RegistrationOutcome.FailureReason;
import org.lorristack.alignment.stack.Frame;
import org.lorristack.alignment.stack.RegisteredFrame;
import org.lorristack.alignment.transform.RigidTransform2D;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registers every frame of a time ordered sequence relative to the sequence anchor (the first frame with stars).
 *
 * Each frame is first registered directly against the anchor.  If that fails, the most recently
 * registered frames are tried (most recent first) and the pairwise result is composed with that
 * frame's own anchor transform.  Trying the anchor first limits drift while the short window of
 * recent frames tolerates gradual changes in the visible star field.  Frames that fail are never
 * used as anchors for later frames.
 */
public class SequenceRegistrar {

    private final StarSetRegistrar pairRegistrar;
    private final int registrationRetries;

    public SequenceRegistrar(final StarSetRegistrar pairRegistrar,
                             final int registrationRetries) {
        if (registrationRetries < 0) {
            throw new IllegalArgumentException("registrationRetries must not be negative");
        }
        this.pairRegistrar = pairRegistrar;
        this.registrationRetries = registrationRetries;
    }

    /**
     * @param  frames  time ordered frames to register.
     *
     * @return one outcome per frame in the same order as the specified frames.
     */
    public List<RegistrationOutcome> registerSequence(final List<Frame> frames) {

        LOG.info("registerSequence: entry, registering {} frames", frames.size());

        final RegistrationOutcome[] outcomes = new RegistrationOutcome[frames.size()];
        final List<RegisteredFrame> registered = new ArrayList<>();
        int successCount = 0;

        for (int i = 0; i < frames.size(); i++) {

            final Frame frame = frames.get(i);

            if (! frame.hasStars()) {

                outcomes[i] = RegistrationOutcome.failure(frame.getId(),
                                                          FailureReason.EXTRACTION_FAILED,
                                                          frame.getExtractionFailure());

            } else if (registered.isEmpty()) {

                LOG.info("registerSequence: using frame {} as anchor", frame.getId());
                registered.add(new RegisteredFrame(frame, RigidTransform2D.identity()));
                outcomes[i] = RegistrationOutcome.success(frame.getId(), RigidTransform2D.identity(), frame.getId());

            } else {

                outcomes[i] = registerFrame(frame, getCandidateAnchors(registered));
                if (outcomes[i].isSuccess()) {
                    registered.add(new RegisteredFrame(frame, outcomes[i].getTransform()));
                }

            }

            if (outcomes[i].isSuccess()) {
                successCount++;
            } else {
                LOG.warn("registerSequence: failed to register frame {}, reason is {}: {}",
                         frame.getId(), outcomes[i].getFailureReason(), outcomes[i].getFailureMessage());
            }
        }

        LOG.info("registerSequence: exit, registered {} out of {} frames", successCount, frames.size());

        return Arrays.asList(outcomes);
    }

    /**
     * @return the anchor followed by up to registrationRetries of the most recently registered frames
     *         (most recent first).
     */
    List<RegisteredFrame> getCandidateAnchors(final List<RegisteredFrame> registered) {
        final List<RegisteredFrame> candidates = new ArrayList<>();
        candidates.add(registered.get(0));
        final int stop = Math.max(1, registered.size() - registrationRetries);
        for (int i = registered.size() - 1; i >= stop; i--) {
            candidates.add(registered.get(i));
        }
        return candidates;
    }

    private RegistrationOutcome registerFrame(final Frame frame,
                                              final List<RegisteredFrame> candidateAnchors) {

        final List<String> failures = new ArrayList<>();

        for (final RegisteredFrame anchor : candidateAnchors) {
            try {
                final RigidTransform2D pairwise = pairRegistrar.register(anchor.getFrame().getStars(),
                                                                         frame.getStars());

                // pairwise maps anchor candidate coordinates to frame coordinates,
                // so it is applied after the candidate's own transform
                final RigidTransform2D composed = pairwise.concatenate(anchor.getTransform());

                LOG.info("registerFrame: registered frame {} against frame {}", frame.getId(), anchor);

                return RegistrationOutcome.success(frame.getId(), composed, anchor.getFrame().getId());

            } catch (final RegistrationFailedException e) {
                LOG.debug("registerFrame: failed to register frame {} against frame {}: {}",
                          frame.getId(), anchor, e.getMessage());
                failures.add(anchor + ": " + e.getMessage());
            }
        }

        return RegistrationOutcome.failure(frame.getId(),
                                           FailureReason.REGISTRATION_FAILED,
                                           "all " + candidateAnchors.size() + " anchor candidates failed " +
                                           failures);
    }

    private static final Logger LOG = LoggerFactory.getLogger(SequenceRegistrar.class);
}
