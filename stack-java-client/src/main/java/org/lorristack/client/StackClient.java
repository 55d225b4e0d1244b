package org.lorristack.client;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParametersDelegate;

import ij.process.ByteProcessor;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import org.lorristack.alignment.Utils;
import org.lorristack.alignment.match.ExtractFailedException;
import org.lorristack.alignment.match.RegistrationOutcome;
import org.lorristack.alignment.match.SequenceRegistrar;
import org.lorristack.alignment.match.StarExtractor;
import org.lorristack.alignment.match.StarSet;
import org.lorristack.alignment.match.StarSetRegistrar;
import org.lorristack.alignment.match.parameters.RegistrationParameters;
import org.lorristack.alignment.match.parameters.StarExtractionParameters;
import org.lorristack.alignment.stack.BoundingRect;
import org.lorristack.alignment.stack.Frame;
import org.lorristack.alignment.stack.FrameStacker;
import org.lorristack.alignment.stack.RegisteredFrame;
import org.lorristack.alignment.stack.StackedGroup;
import org.lorristack.client.archive.FrameArchiveClient;
import org.lorristack.client.archive.FrameMetadata;
import org.lorristack.client.archive.FrameMetadataStore;
import org.lorristack.client.archive.FrameStore;
import org.lorristack.client.archive.RequestBudget;
import org.lorristack.client.parameter.BoundingRectConverter;
import org.lorristack.client.parameter.CommandLineParameters;
import org.lorristack.client.parameter.UtcTimeConverter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Java client that registers a time range of archived frames using their stars and
 * writes one stacked PNG for each group of temporally close frames.
 */
public class StackClient {

    public static class Parameters extends CommandLineParameters {

        @ParametersDelegate
        public RegistrationParameters registration = new RegistrationParameters();

        @ParametersDelegate
        public StarExtractionParameters extraction = new StarExtractionParameters();

        @Parameter(
                names = "--from",
                description = "Earliest capture time (UTC) to include, formatted as 'yyyy-MM-dd HH:mm:ss' or 'yyyy-MM-dd'",
                converter = UtcTimeConverter.class)
        public Long from;

        @Parameter(
                names = "--to",
                description = "Latest capture time (UTC) to include, formatted as 'yyyy-MM-dd HH:mm:ss' or 'yyyy-MM-dd'",
                converter = UtcTimeConverter.class)
        public Long to;

        @Parameter(
                names = "--exposure",
                description = "Regular expression that exposure labels of included frames must match")
        public String exposure;

        @Parameter(
                names = "--crop",
                description = "Restrict output to this rectangle in first frame coordinates, formatted as x,y,w,h",
                converter = BoundingRectConverter.class)
        public BoundingRect crop;

        @Parameter(
                names = "--maxBrightness",
                description = "Exclude frames whose mean pixel value exceeds this value")
        public Double maxBrightness;

        @Parameter(
                names = "--updateMetadata",
                description = "Fetch new frame listings from the archive before stacking",
                arity = 0)
        public boolean updateMetadata = false;

        @Parameter(
                names = "--downloadMissing",
                description = "Download frame images that are not yet local",
                arity = 0)
        public boolean downloadMissing = false;

        @Parameter(
                names = "--maxFrameInterval",
                description = "Frames captured at most this many seconds after the previous frame are stacked together")
        public Long maxFrameInterval = FrameStacker.DEFAULT_MAX_FRAME_INTERVAL;

        @Parameter(
                names = "--dataDirectory",
                description = "Directory containing the metadata cache and downloaded frames")
        public String dataDirectory = "data";

        @Parameter(
                names = "--outputDirectory",
                description = "Directory for stacked images")
        public String outputDirectory = "data/images/stacked";

        @Parameter(
                names = "--archiveUrl",
                description = "Base URL of the frame archive")
        public String archiveUrl = FrameArchiveClient.DEFAULT_ARCHIVE_URL;

        @Parameter(
                names = "--maxRequests",
                description = "Maximum number of HTTP requests sent to the archive")
        public Integer maxRequests = RequestBudget.DEFAULT_MAX_REQUESTS;

        @Parameter(
                names = "--requestPause",
                description = "Milliseconds to wait after each HTTP request")
        public Long requestPause = RequestBudget.DEFAULT_PAUSE_MILLISECONDS;

        @Parameter(
                names = "--numberOfThreads",
                description = "Number of threads for star extraction and compositing")
        public Integer numberOfThreads = 1;

        /**
         * @return compiled exposure pattern or null if no pattern was specified.
         *
         * @throws IllegalArgumentException
         *   if the pattern is invalid.
         */
        public Pattern getExposurePattern()
                throws IllegalArgumentException {
            if (exposure == null) {
                return null;
            }
            try {
                return Pattern.compile(exposure);
            } catch (final PatternSyntaxException e) {
                throw new IllegalArgumentException("invalid --exposure pattern '" + exposure + "'", e);
            }
        }

        public void validate()
                throws IllegalArgumentException {
            registration.validate();
            extraction.validate();
            getExposurePattern();
            if ((from != null) && (to != null) && (from > to)) {
                throw new IllegalArgumentException("--from must not be after --to");
            }
            if (maxFrameInterval < 0) {
                throw new IllegalArgumentException("--maxFrameInterval must not be negative");
            }
            if (numberOfThreads < 1) {
                throw new IllegalArgumentException("--numberOfThreads must be positive");
            }
        }
    }

    public static void main(final String[] args) {
        final ClientRunner clientRunner = new ClientRunner(args) {
            @Override
            public void runClient(final String[] args) throws Exception {

                final Parameters parameters = new Parameters();
                parameters.parse(args);

                LOG.info("runClient: entry, parameters={}", parameters);

                final StackClient client = new StackClient(parameters);
                client.updateMetadataIfRequested();
                client.stackFrames();
            }
        };
        clientRunner.run();
    }

    private final Parameters parameters;
    private final FrameArchiveClient archiveClient;
    private final FrameStore frameStore;
    private final FrameMetadataStore metadataStore;

    public StackClient(final Parameters parameters)
            throws IllegalArgumentException {

        parameters.validate();

        this.parameters = parameters;
        this.archiveClient = new FrameArchiveClient(parameters.archiveUrl,
                                                    FrameStore.IMAGE_PATH_PREFIX,
                                                    new RequestBudget(parameters.maxRequests,
                                                                      parameters.requestPause));
        this.frameStore = new FrameStore(new File(parameters.dataDirectory), archiveClient);
        this.metadataStore = new FrameMetadataStore(frameStore.getMetadataFile());
    }

    public void updateMetadataIfRequested()
            throws IOException {
        if (parameters.updateMetadata) {
            metadataStore.update(archiveClient);
        }
    }

    /**
     * @return files written for each stacked group.
     */
    public List<File> stackFrames()
            throws IOException, InterruptedException, ExecutionException {

        final List<FrameMetadata> records = metadataStore.listMetadata(parameters.from,
                                                                       parameters.to,
                                                                       parameters.getExposurePattern());

        final List<File> imageFiles = new ArrayList<>(records.size());
        for (final FrameMetadata record : records) {
            imageFiles.add(frameStore.ensureLocal(record, parameters.downloadMissing));
        }

        final List<Frame> frames = loadFrames(records, imageFiles);

        final StarSetRegistrar pairRegistrar = new StarSetRegistrar(parameters.registration);
        final SequenceRegistrar sequenceRegistrar =
                new SequenceRegistrar(pairRegistrar, parameters.registration.registrationRetries);
        final List<RegistrationOutcome> outcomes = sequenceRegistrar.registerSequence(frames);

        final List<RegisteredFrame> registeredFrames = new ArrayList<>();
        for (int i = 0; i < frames.size(); i++) {
            final RegistrationOutcome outcome = outcomes.get(i);
            if (outcome.isSuccess()) {
                registeredFrames.add(new RegisteredFrame(frames.get(i), outcome.getTransform()));
            }
        }

        LOG.info("stackFrames: stacking {} of {} frames", registeredFrames.size(), records.size());

        final FrameStacker frameStacker = new FrameStacker(parameters.maxFrameInterval,
                                                           parameters.crop,
                                                           parameters.numberOfThreads);
        final List<StackedGroup> stackedGroups = frameStacker.stack(registeredFrames);

        final File outputDirectory = new File(parameters.outputDirectory);
        final List<File> outputFiles = new ArrayList<>(stackedGroups.size());
        for (final StackedGroup stackedGroup : stackedGroups) {
            final File outputFile = new File(outputDirectory, stackedGroup.getName() + "." + Utils.PNG_FORMAT);
            Utils.saveImage(stackedGroup.getImage(), outputFile);
            outputFiles.add(outputFile);
        }

        LOG.info("stackFrames: exit, wrote {} stacked images to {}",
                 outputFiles.size(), outputDirectory.getAbsolutePath());

        return outputFiles;
    }

    /**
     * Loads frame rasters and extracts their stars in parallel.
     * Unreadable frames and frames brighter than the configured maximum are excluded.
     *
     * @return time ordered frames (extraction failures included without stars).
     */
    List<Frame> loadFrames(final List<FrameMetadata> records,
                           final List<File> imageFiles)
            throws InterruptedException, ExecutionException {

        final StarExtractor starExtractor = new StarExtractor(parameters.extraction);

        final List<Frame> frames = new ArrayList<>(records.size());

        final ExecutorService executorService = Executors.newFixedThreadPool(parameters.numberOfThreads);
        try {
            final List<Future<Frame>> futures = new ArrayList<>(records.size());
            for (int i = 0; i < records.size(); i++) {
                final FrameMetadata record = records.get(i);
                final File imageFile = imageFiles.get(i);
                futures.add(executorService.submit(() -> loadFrame(record, imageFile, starExtractor)));
            }
            for (final Future<Frame> future : futures) {
                final Frame frame = future.get();
                if (frame != null) {
                    frames.add(frame);
                }
            }
        } finally {
            executorService.shutdownNow();
        }

        LOG.info("loadFrames: loaded {} of {} frames", frames.size(), records.size());

        return frames;
    }

    private Frame loadFrame(final FrameMetadata record,
                            final File imageFile,
                            final StarExtractor starExtractor) {

        final ByteProcessor raster;
        try {
            raster = Utils.openGrayImage(imageFile);
        } catch (final IOException e) {
            LOG.warn("loadFrame: excluding {} because it cannot be read", imageFile.getName(), e);
            return null;
        }

        if (parameters.maxBrightness != null) {
            final double brightness = Utils.meanIntensity(raster);
            if (brightness > parameters.maxBrightness) {
                LOG.info("loadFrame: excluding {} because mean brightness {} exceeds {}",
                         imageFile.getName(), brightness, parameters.maxBrightness);
                return null;
            }
        }

        Frame frame;
        try {
            final StarSet stars = starExtractor.extract(raster);
            frame = new Frame(record.getTimestamp(), raster, stars);
            LOG.debug("loadFrame: extracted {} stars from {}", stars.size(), imageFile.getName());
        } catch (final ExtractFailedException e) {
            LOG.warn("loadFrame: failed to extract stars from {}: {}", imageFile.getName(), e.getMessage());
            frame = Frame.withoutStars(record.getTimestamp(), raster, e.getMessage());
        }

        return frame;
    }

    private static final Logger LOG = LoggerFactory.getLogger(StackClient.class);
}
