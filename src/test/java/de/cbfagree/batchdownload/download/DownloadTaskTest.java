package de.cbfagree.batchdownload.download;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import de.cbfagree.batchdownload.config.Config;
import de.cbfagree.batchdownload.testsupport.ScriptedHttpServer;
import de.cbfagree.batchdownload.testsupport.ScriptedHttpServer.ScriptedResource;
import de.cbfagree.batchdownload.testsupport.TestConfigs;

public class DownloadTaskTest
{
    private static final byte[] CONTENT = ScriptedHttpServer.content(8000);

    @TempDir
    Path tempDir;

    private ScriptedHttpServer server;
    private Path downloads;
    private StopSignal stopSignal;
    private RecordingReporter reporter;
    private DownloadComponents components;

    @BeforeEach
    void setUp() throws Exception
    {
        this.server = new ScriptedHttpServer();
        TestConfigs configs = TestConfigs.in(this.tempDir).retryCount(3);
        this.downloads = configs.downloads();
        Files.createDirectories(this.downloads);
        this.components = this.components(configs.build());
    }

    @AfterEach
    void tearDown() throws Exception
    {
        this.server.close();
    }

    private DownloadComponents components(Config cfg)
    {
        this.stopSignal = new StopSignal();
        this.reporter = new RecordingReporter();
        HttpConnector connector = new HttpConnector(cfg.getNetwork(), this.stopSignal);
        return new DownloadComponents( //
            new DestinationResolver(cfg.getFiles()), //
            new RemoteMetadataProbe(connector, this.stopSignal), //
            new ResumePlanner(), //
            new RangeFetcher(connector, cfg.getNetwork(), this.stopSignal, this.reporter), //
            new RetryPolicy(cfg.getSettings()), //
            this.stopSignal, //
            this.reporter);
    }

    private TransferState download(String path)
    {
        TransferState state = new TransferState(7, this.server.url(path));
        new DownloadTask(state, this.components).run();
        return state;
    }

    @Test
    void testFreshDownload() throws Exception
    {
        long lastModified = 1_600_000_000_000L;
        ScriptedResource resource = this.server.serve("/a.bin", CONTENT).withLastModified(lastModified);

        TransferState state = this.download("/a.bin");

        assertThat(state.getStatus()).isEqualTo(ETransferStatus.COMPLETED);
        assertThat(state.getAttempt()).isZero();
        assertThat(state.getBytesDownloaded()).isEqualTo(CONTENT.length);
        assertThat(state.getDestination()).isEqualTo(this.downloads.toAbsolutePath().normalize().resolve("a.bin"));
        assertThat(Files.readAllBytes(state.getDestination())).isEqualTo(CONTENT);
        assertThat(Files.getLastModifiedTime(state.getDestination()).toMillis()).isEqualTo(lastModified);
        assertThat(resource.rangeHeaders()).containsExactly((String) null);
        assertThat(this.reporter.started).containsExactly(7);
    }

    @Test
    void testResumeFromPartialFile() throws Exception
    {
        ScriptedResource resource = this.server.serve("/a.bin", CONTENT);
        Files.write(this.downloads.resolve("a.bin"), Arrays.copyOf(CONTENT, 3000));

        TransferState state = this.download("/a.bin");

        assertThat(state.getStatus()).isEqualTo(ETransferStatus.COMPLETED);
        assertThat(resource.rangeHeaders()).containsExactly("bytes=3000-");
        assertThat(Files.readAllBytes(state.getDestination())).isEqualTo(CONTENT);
    }

    @Test
    void testIgnoredRangeRestartsWithCleanFile() throws Exception
    {
        ScriptedResource resource = this.server.serve("/a.bin", CONTENT).ignoringRanges();
        Files.write(this.downloads.resolve("a.bin"), Arrays.copyOf(CONTENT, 3000));

        TransferState state = this.download("/a.bin");

        assertThat(state.getStatus()).isEqualTo(ETransferStatus.COMPLETED);
        assertThat(state.getAttempt()).isZero();
        assertThat(resource.rangeHeaders()).containsExactly("bytes=3000-", null);
        assertThat(Files.readAllBytes(state.getDestination())).isEqualTo(CONTENT);
    }

    @Test
    void testNoRangeSupportDiscardsPartialFile() throws Exception
    {
        ScriptedResource resource = this.server.serve("/a.bin", CONTENT).withoutRangeSupport();
        Files.write(this.downloads.resolve("a.bin"), new byte[3000]);

        TransferState state = this.download("/a.bin");

        assertThat(state.getStatus()).isEqualTo(ETransferStatus.COMPLETED);
        assertThat(resource.rangeHeaders()).containsExactly((String) null);
        assertThat(Files.readAllBytes(state.getDestination())).isEqualTo(CONTENT);
    }

    @Test
    void testCompleteFileIsNotFetchedAgain() throws Exception
    {
        ScriptedResource resource = this.server.serve("/a.bin", CONTENT);
        Files.write(this.downloads.resolve("a.bin"), CONTENT);

        TransferState state = this.download("/a.bin");

        assertThat(state.getStatus()).isEqualTo(ETransferStatus.COMPLETED);
        assertThat(state.getBytesDownloaded()).isEqualTo(CONTENT.length);
        assertThat(resource.heads()).isEqualTo(1);
        assertThat(resource.gets()).isZero();
    }

    @Test
    void testUnknownLengthWithoutHead() throws Exception
    {
        ScriptedResource resource = this.server.serve("/a.bin", CONTENT).withoutHead();
        Files.write(this.downloads.resolve("a.bin"), Arrays.copyOf(CONTENT, 3000));

        TransferState state = this.download("/a.bin");

        assertThat(state.getStatus()).isEqualTo(ETransferStatus.COMPLETED);
        assertThat(resource.rangeHeaders()).containsExactly((String) null);
        assertThat(Files.readAllBytes(state.getDestination())).isEqualTo(CONTENT);
    }

    @Test
    void testTransientFailuresAreRetried() throws Exception
    {
        ScriptedResource resource = this.server.serve("/a.bin", CONTENT).failingGets(2);

        TransferState state = this.download("/a.bin");

        assertThat(state.getStatus()).isEqualTo(ETransferStatus.COMPLETED);
        assertThat(state.getAttempt()).isEqualTo(2);
        assertThat(resource.gets()).isEqualTo(3);
        assertThat(Files.readAllBytes(state.getDestination())).isEqualTo(CONTENT);
    }

    @Test
    void testRetriesAreExhausted() throws Exception
    {
        ScriptedResource resource = this.server.serve("/a.bin", CONTENT).failingGets(Integer.MAX_VALUE);

        TransferState state = this.download("/a.bin");

        assertThat(state.getStatus()).isEqualTo(ETransferStatus.FAILED);
        assertThat(state.getFailureKind()).isEqualTo(EFailureKind.SERVER_OVERLOAD);
        assertThat(state.getFailureMessage()).isNotBlank();
        assertThat(state.getAttempt()).isEqualTo(3);
        assertThat(resource.gets()).isEqualTo(4);
    }

    @Test
    void testTruncatedBodyResumesOnRetry() throws Exception
    {
        ScriptedResource resource = this.server.serve("/a.bin", CONTENT).truncatingFirstGetAt(2500);

        TransferState state = this.download("/a.bin");

        assertThat(state.getStatus()).isEqualTo(ETransferStatus.COMPLETED);
        assertThat(state.getAttempt()).isEqualTo(1);
        assertThat(resource.gets()).isEqualTo(2);
        assertThat(resource.rangeHeaders().get(0)).isNull();
        assertThat(Files.readAllBytes(state.getDestination())).isEqualTo(CONTENT);
    }

    @Test
    void testPermanentFailureIsAttemptedOnce() throws Exception
    {
        ScriptedResource resource = this.server.serve("/b.bin", CONTENT).withStatus(404);

        TransferState state = this.download("/b.bin");

        assertThat(state.getStatus()).isEqualTo(ETransferStatus.FAILED);
        assertThat(state.getFailureKind()).isEqualTo(EFailureKind.SERVER_REJECTED);
        assertThat(state.getAttempt()).isZero();
        assertThat(resource.heads()).isEqualTo(1);
        assertThat(resource.gets()).isEqualTo(1);
        assertThat(this.downloads.resolve("b.bin")).doesNotExist();
    }

    @Test
    void testRejectedHeadFallsBackToGet() throws Exception
    {
        ScriptedResource resource = this.server.serve("/signed.bin", CONTENT).withHeadStatus(403);

        TransferState state = this.download("/signed.bin");

        assertThat(state.getStatus()).isEqualTo(ETransferStatus.COMPLETED);
        assertThat(state.getAttempt()).isZero();
        assertThat(resource.heads()).isEqualTo(1);
        assertThat(resource.gets()).isEqualTo(1);
        assertThat(Files.readAllBytes(state.getDestination())).isEqualTo(CONTENT);
    }

    @Test
    void testRejectedHeadDisablesResume() throws Exception
    {
        ScriptedResource resource = this.server.serve("/signed.bin", CONTENT).withHeadStatus(403);
        Files.write(this.downloads.resolve("signed.bin"), Arrays.copyOf(CONTENT, 3000));

        TransferState state = this.download("/signed.bin");

        assertThat(state.getStatus()).isEqualTo(ETransferStatus.COMPLETED);
        assertThat(resource.rangeHeaders()).containsExactly((String) null);
        assertThat(Files.readAllBytes(state.getDestination())).isEqualTo(CONTENT);
    }

    @Test
    void testOverloadedHeadIsRetried() throws Exception
    {
        ScriptedResource resource = this.server.serve("/a.bin", CONTENT).withHeadStatus(503);

        TransferState state = this.download("/a.bin");

        assertThat(state.getStatus()).isEqualTo(ETransferStatus.FAILED);
        assertThat(state.getFailureKind()).isEqualTo(EFailureKind.SERVER_OVERLOAD);
        assertThat(state.getAttempt()).isEqualTo(3);
        assertThat(resource.heads()).isEqualTo(4);
        assertThat(resource.gets()).isZero();
    }

    @Test
    void testResumeWithoutAcceptRangesHeader() throws Exception
    {
        ScriptedResource resource = this.server.serve("/a.bin", CONTENT).withoutRangeHeader();
        Files.write(this.downloads.resolve("a.bin"), Arrays.copyOf(CONTENT, 3000));

        TransferState state = this.download("/a.bin");

        assertThat(state.getStatus()).isEqualTo(ETransferStatus.COMPLETED);
        assertThat(resource.rangeHeaders()).containsExactly("bytes=3000-");
        assertThat(Files.readAllBytes(state.getDestination())).isEqualTo(CONTENT);
    }

    @Test
    void testInvalidUrlFailsWithoutRequest()
    {
        TransferState state = new TransferState(1, "ftp://example.com/a.bin");
        new DownloadTask(state, this.components).run();

        assertThat(state.getStatus()).isEqualTo(ETransferStatus.FAILED);
        assertThat(state.getFailureKind()).isEqualTo(EFailureKind.INVALID_URL);
        assertThat(state.getDestination()).isNull();
    }

    @Test
    void testStoppedBeforeStartIsCancelled()
    {
        ScriptedResource resource = this.server.serve("/a.bin", CONTENT);
        this.stopSignal.stop();

        TransferState state = this.download("/a.bin");

        assertThat(state.getStatus()).isEqualTo(ETransferStatus.FAILED);
        assertThat(state.getFailureKind()).isEqualTo(EFailureKind.CANCELLED);
        assertThat(resource.heads() + resource.gets()).isZero();
    }
}
