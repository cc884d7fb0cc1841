package com.catalogharvester.crawl.state;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class IdentifierListFileTest {
    @TempDir
    Path tempDir;

    @Test
    void readTrimsSkipsBlanksAndDropsDuplicates() throws IOException {
        Path file = tempDir.resolve("ids.txt");
        Files.writeString(file, " 111 \n\n222\n111\n   \n333\n");

        assertThat(IdentifierListFile.read(file)).containsExactly("111", "222", "333");
    }

    @Test
    void writeCreatesParentDirectories() throws IOException {
        Path file = tempDir.resolve("nested/dir/ids.txt");

        IdentifierListFile.write(file, List.of("a", "b"));

        assertThat(Files.readString(file)).isEqualTo("a\nb\n");
    }

    @Test
    void siteSlugStripsSchemeAndWww() {
        assertThat(RunLayout.siteSlug("https://www.ebay.co.uk")).isEqualTo("ebay-co-uk");
        assertThat(RunLayout.siteSlug("shop.example.com/path")).isEqualTo("shop-example-com");
    }
}
