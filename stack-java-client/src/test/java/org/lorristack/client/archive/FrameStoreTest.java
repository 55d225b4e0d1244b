package org.lorristack.client.archive;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import static org.lorristack.client.archive.FakeFrameArchive.buildRecord;

/**
 * Tests the {@link FrameStore} class.
 */
public class FrameStoreTest {

    @Rule
    public TemporaryFolder temporaryFolder = new TemporaryFolder();

    @Test
    public void testEnsureExistingImage() throws Exception {

        final FakeFrameArchive archive = new FakeFrameArchive();
        final FrameStore store = new FrameStore(temporaryFolder.getRoot(), archive);

        final File imageFile = store.getImageFile(RECORD);
        Assert.assertTrue("failed to create " + imageFile.getParentFile(), imageFile.getParentFile().mkdirs());
        Files.write(imageFile.toPath(), new byte[] { 1, 2, 3 });

        Assert.assertEquals("invalid file returned", imageFile, store.ensureLocal(RECORD, true));
        Assert.assertTrue("existing image should not be downloaded", archive.getDownloadedRecords().isEmpty());
    }

    @Test(expected = MissingImageException.class)
    public void testMissingImageWithoutDownload() throws Exception {
        new FrameStore(temporaryFolder.getRoot(), new FakeFrameArchive()).ensureLocal(RECORD, false);
    }

    @Test
    public void testDownloadMissingImage() throws Exception {

        final FakeFrameArchive archive = new FakeFrameArchive();
        final FrameStore store = new FrameStore(temporaryFolder.getRoot(), archive);

        final File imageFile = store.ensureLocal(RECORD, true);

        Assert.assertTrue("image not downloaded", imageFile.exists());
        Assert.assertEquals("invalid image content",
                            RECORD.getUrl(), new String(Files.readAllBytes(imageFile.toPath()), StandardCharsets.UTF_8));
        Assert.assertFalse("partial download left behind",
                           new File(imageFile.getAbsolutePath() + ".part").exists());
        Assert.assertEquals("invalid image location",
                            new File(temporaryFolder.getRoot(), "images/input/2015-07-13_120000_UTC.jpg"), imageFile);
    }

    private static final FrameMetadata RECORD = buildRecord(1436788800L, "150");
}
