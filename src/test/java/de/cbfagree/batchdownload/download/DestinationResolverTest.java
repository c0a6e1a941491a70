package de.cbfagree.batchdownload.download;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import de.cbfagree.batchdownload.testsupport.TestConfigs;

public class DestinationResolverTest
{
    @TempDir
    Path tempDir;

    private Path downloads;
    private DestinationResolver resolver;

    @BeforeEach
    void setUp() throws Exception
    {
        TestConfigs configs = TestConfigs.in(this.tempDir).subfolderPrefixes("DM", "RPT");
        this.downloads = configs.downloads().toAbsolutePath().normalize();
        this.resolver = new DestinationResolver(configs.build().getFiles());
    }

    @Test
    void testFileNameIsLastPathSegment() throws Exception
    {
        DownloadTarget target = this.resolver.resolve("http://example.com/files/2024/a.bin?session=42");
        assertThat(target.destination()).isEqualTo(this.downloads.resolve("a.bin"));
        assertThat(target.requestUrl().toString()).isEqualTo("http://example.com/files/2024/a.bin?session=42");
    }

    @Test
    void testIllegalCharactersAreEncoded() throws Exception
    {
        DownloadTarget target = this.resolver.resolve("https://example.com/docs/my report.pdf");
        assertThat(target.destination().getFileName().toString()).isEqualTo("my report.pdf");
        assertThat(target.requestUrl().toString()).isEqualTo("https://example.com/docs/my%20report.pdf");
    }

    @Test
    void testPrefixSelectsSubfolder() throws Exception
    {
        DownloadTarget target = this.resolver.resolve("http://example.com/DM_report.pdf");
        assertThat(target.destination()).isEqualTo(this.downloads.resolve("DM").resolve("DM_report.pdf"));
        assertThat(Files.isDirectory(this.downloads.resolve("DM"))).isTrue();

        DownloadTarget other = this.resolver.resolve("http://example.com/DMX.pdf");
        assertThat(other.destination()).isEqualTo(this.downloads.resolve("DMX.pdf"));
    }

    @Test
    void testDestinationIsClaimedOnce() throws Exception
    {
        this.resolver.resolve("http://example.com/x/f.bin");
        DownloadException e = catchThrowableOfType(() -> this.resolver.resolve("http://mirror.example.com/y/f.bin"), DownloadException.class);
        assertThat(e.getKind()).isEqualTo(EFailureKind.FILE_SYSTEM);
    }

    @Test
    void testInvalidUrls()
    {
        this.assertInvalid("ftp://example.com/a.bin");
        this.assertInvalid("not a url");
        this.assertInvalid("/relative/a.bin");
        this.assertInvalid("http://example.com/");
        this.assertInvalid("http://example.com");
        this.assertInvalid("http://example.com/dir/..");
    }

    private void assertInvalid(String url)
    {
        DownloadException e = catchThrowableOfType(() -> this.resolver.resolve(url), DownloadException.class);
        assertThat(e).as(url).isNotNull();
        assertThat(e.getKind()).as(url).isEqualTo(EFailureKind.INVALID_URL);
    }
}
