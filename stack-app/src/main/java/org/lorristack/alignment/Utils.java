package org.lorristack.alignment;

import ij.ImagePlus;
import ij.io.Opener;
import ij.process.ByteProcessor;
import ij.process.ImageProcessor;

import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;
import java.util.Iterator;

import javax.imageio.ImageIO;
import javax.imageio.ImageWriter;
import javax.imageio.stream.FileImageOutputStream;
import javax.imageio.stream.ImageOutputStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Image file utilities.
 */
public class Utils {

    public static final String PNG_FORMAT = "png";

    private Utils() {
    }

    /**
     * Writes the specified image using ImageIO.
     */
    public static void writeImage(final BufferedImage image,
                                  final String format,
                                  final ImageOutputStream outputStream)
            throws IOException {

        final Iterator<ImageWriter> writersForFormat = ImageIO.getImageWritersByFormatName(format);

        if ((writersForFormat != null) && writersForFormat.hasNext()) {
            final ImageWriter writer = writersForFormat.next();
            try {
                writer.setOutput(outputStream);
                writer.write(image);
            } finally {
                writer.dispose();
            }
        } else {
            throw new IOException("no ImageIO writers exist for the '" + format + "' format");
        }
    }

    public static File prepareFileForWrite(final File file) {

        final File parentDirectory = file.getAbsoluteFile().getParentFile();
        if ((parentDirectory != null) && (! parentDirectory.exists())) {
            if (! parentDirectory.mkdirs()) {
                // check for existence again in case another parallel process already created the directory
                if (! parentDirectory.exists()) {
                    throw new IllegalArgumentException("failed to create directory " +
                                                       parentDirectory.getAbsolutePath());
                }
            }
        }

        return file;
    }

    /**
     * Saves the specified 8-bit image to a file.  The format is derived from the file extension.
     */
    public static void saveImage(final ImageProcessor image,
                                 final File toFile)
            throws IOException {

        final File file = prepareFileForWrite(toFile);
        final String path = file.getAbsolutePath();
        final String format = path.substring(path.lastIndexOf('.') + 1);

        try (final FileImageOutputStream outputStream = new FileImageOutputStream(file)) {
            writeImage(image.convertToByteProcessor().getBufferedImage(), format, outputStream);
        }

        LOG.info("saveImage: exit, saved {}", path);
    }

    /**
     * Opens an image file as an 8-bit gray scale processor.  Tries ImageIO first, then ImageJ.
     *
     * @throws IOException
     *   if the file does not exist or cannot be decoded.
     */
    public static ByteProcessor openGrayImage(final File file)
            throws IOException {

        if (! file.exists()) {
            throw new IOException(file.getAbsolutePath() + " does not exist");
        }

        final BufferedImage image = ImageIO.read(file);
        if ((image != null) && (image.getType() == BufferedImage.TYPE_BYTE_GRAY)) {
            return new ByteProcessor(image);
        } else if (image != null) {
            // drawing into a gray image converts color frames to luminance
            final BufferedImage gray = new BufferedImage(image.getWidth(),
                                                         image.getHeight(),
                                                         BufferedImage.TYPE_BYTE_GRAY);
            final Graphics2D g2d = gray.createGraphics();
            g2d.drawImage(image, 0, 0, null);
            g2d.dispose();
            return new ByteProcessor(gray);
        }

        final ImagePlus imagePlus = new Opener().openImage(file.getAbsolutePath());
        if (imagePlus == null) {
            throw new IOException("failed to decode " + file.getAbsolutePath());
        }

        return imagePlus.getProcessor().convertToByteProcessor();
    }

    /**
     * @return mean pixel value of the specified image.
     */
    public static double meanIntensity(final ImageProcessor image) {
        return image.getStatistics().mean;
    }

    private static final Logger LOG = LoggerFactory.getLogger(Utils.class);
}
