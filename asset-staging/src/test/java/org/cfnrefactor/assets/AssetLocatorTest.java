package org.cfnrefactor.assets;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.*;

class AssetLocatorTest {

    @TempDir
    Path cdkOut;

    @TempDir
    Path otherRoot;

    @Test
    void testLocatesRelativeAssetUnderSearchRoot() throws Exception {
        Path bundle = Files.createDirectories(cdkOut.resolve("asset.7f3a"));
        AssetLocator locator = new AssetLocator(List.of(otherRoot, cdkOut));

        AssetLocator.LocatedAsset located = locator.locate("asset.7f3a");

        assertTrue(located.exists());
        assertEquals(bundle.toAbsolutePath().normalize(), located.path());
    }

    @Test
    void testMissingAssetPointsAtFirstCandidate() {
        AssetLocator locator = new AssetLocator(List.of(cdkOut, otherRoot));

        AssetLocator.LocatedAsset located = locator.locate("asset.missing");

        assertFalse(located.exists());
        assertEquals(cdkOut.resolve("asset.missing").toAbsolutePath().normalize(), located.path());
    }

    @Test
    void testFindFirstTriesNamesPerRoot() throws Exception {
        Files.writeString(otherRoot.resolve("asset.resolver.js"), "export function request() {}");
        AssetLocator locator = new AssetLocator(List.of(cdkOut, otherRoot));

        assertEquals(Optional.of(otherRoot.resolve("asset.resolver.js")),
            locator.findFirst(List.of("resolver.js", "asset.resolver.js")));
        assertEquals(Optional.empty(), AssetLocator.none().findFirst(List.of("resolver.js")));
    }

    @Test
    void testFormatPathRelativeWhenBelowBase() {
        Path staged = cdkOut.resolve("src").resolve("Handler");

        assertEquals("src/Handler", AssetLocator.formatPath(staged, cdkOut));
        assertEquals(staged.toAbsolutePath().normalize().toString().replace('\\', '/'),
            AssetLocator.formatPath(staged, otherRoot));
        assertEquals(staged.toAbsolutePath().normalize().toString().replace('\\', '/'),
            AssetLocator.formatPath(staged, null));
    }
}
