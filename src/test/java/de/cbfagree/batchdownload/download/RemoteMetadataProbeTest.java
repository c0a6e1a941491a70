package de.cbfagree.batchdownload.download;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

import java.net.URL;
import java.nio.file.Path;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import de.cbfagree.batchdownload.config.NetworkConfig;
import de.cbfagree.batchdownload.testsupport.ScriptedHttpServer;
import de.cbfagree.batchdownload.testsupport.TestConfigs;

public class RemoteMetadataProbeTest
{
    private static final byte[] CONTENT = ScriptedHttpServer.content(1234);

    @TempDir
    Path tempDir;

    private ScriptedHttpServer server;
    private RemoteMetadataProbe probe;

    @BeforeEach
    void setUp() throws Exception
    {
        this.server = new ScriptedHttpServer();
        StopSignal stopSignal = new StopSignal();
        NetworkConfig cfg = TestConfigs.in(this.tempDir).build().getNetwork();
        this.probe = new RemoteMetadataProbe(new HttpConnector(cfg, stopSignal), stopSignal);
    }

    @AfterEach
    void tearDown() throws Exception
    {
        this.server.close();
    }

    private URL url(String path) throws Exception
    {
        return new URL(this.server.url(path));
    }

    @Test
    void testMetadata() throws Exception
    {
        this.server.serve("/a.bin", CONTENT).withLastModified(1_500_000_000_000L);

        RemoteMetadata metadata = this.probe.probe(this.url("/a.bin"));

        assertThat(metadata.contentLength()).isEqualTo(CONTENT.length);
        assertThat(metadata.acceptsRanges()).isTrue();
        assertThat(metadata.lastModified()).isEqualTo(1_500_000_000_000L);
    }

    @Test
    void testAcceptRangesHeader() throws Exception
    {
        this.server.serve("/none.bin", CONTENT).withoutRangeSupport();
        this.server.serve("/silent.bin", CONTENT).withoutRangeHeader();

        assertThat(this.probe.probe(this.url("/none.bin")).acceptsRanges()).isFalse();
        assertThat(this.probe.probe(this.url("/silent.bin")).acceptsRanges()).isTrue();
    }

    @Test
    void testRejectedHeadMeansUnknown() throws Exception
    {
        this.server.serve("/forbidden.bin", CONTENT).withHeadStatus(403);
        this.server.serve("/nohead.bin", CONTENT).withoutHead();
        this.server.serve("/missing.bin", CONTENT).withStatus(404);

        assertThat(this.probe.probe(this.url("/forbidden.bin"))).isEqualTo(RemoteMetadata.UNKNOWN);
        assertThat(this.probe.probe(this.url("/nohead.bin"))).isEqualTo(RemoteMetadata.UNKNOWN);
        assertThat(this.probe.probe(this.url("/missing.bin"))).isEqualTo(RemoteMetadata.UNKNOWN);
    }

    @Test
    void testOverloadIsReported() throws Exception
    {
        this.server.serve("/busy.bin", CONTENT).withHeadStatus(503);
        this.server.serve("/limited.bin", CONTENT).withHeadStatus(429);

        DownloadException busy = catchThrowableOfType(() -> this.probe.probe(this.url("/busy.bin")), DownloadException.class);
        DownloadException limited = catchThrowableOfType(() -> this.probe.probe(this.url("/limited.bin")), DownloadException.class);

        assertThat(busy.getKind()).isEqualTo(EFailureKind.SERVER_OVERLOAD);
        assertThat(limited.getKind()).isEqualTo(EFailureKind.SERVER_OVERLOAD);
    }
}
