package org.cfnrefactor.assets;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import org.cfnrefactor.assets.s3.S3Location;
import org.cfnrefactor.assets.s3.S3ObjectDownloader;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.*;

class DirectoryAssetStagerTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final AwsEnvironment ENV = AwsEnvironment.of("123456789012", "us-west-2");

    @TempDir
    Path projectDir;

    @TempDir
    Path sourceDir;

    private final List<S3Location> downloads = new ArrayList<>();

    private DirectoryAssetStager stager(S3ObjectDownloader downloader, AwsEnvironment env) {
        return new DirectoryAssetStager(projectDir, "src", downloader,
            () -> Optional.ofNullable(env), projectDir);
    }

    private static void writeZip(Path target, Map<String, String> entries) throws IOException {
        try (OutputStream out = Files.newOutputStream(target); ZipOutputStream zip = new ZipOutputStream(out)) {
            for (var entry : entries.entrySet()) {
                zip.putNextEntry(new ZipEntry(entry.getKey()));
                zip.write(entry.getValue().getBytes(StandardCharsets.UTF_8));
                zip.closeEntry();
            }
        }
    }

    private static JsonNode json(String text) throws IOException {
        return MAPPER.readTree(text);
    }

    @Test
    void testStageLocalPathCopiesDirectoryOnce() throws IOException {
        Path lambdaDir = Files.createDirectories(sourceDir.resolve("asset.abc123"));
        Files.writeString(lambdaDir.resolve("index.js"), "exports.handler = async () => {};");
        DirectoryAssetStager stager = stager(null, ENV);

        Path first = stager.stageLocalPath("FnA", lambdaDir);
        Path second = stager.stageLocalPath("FnB", lambdaDir);

        assertEquals(first, second);
        assertEquals(projectDir.resolve("src").resolve("asset.abc123"), first);
        assertTrue(Files.exists(first.resolve("index.js")));
        assertEquals(2, stager.getRecords().size());
        assertEquals("src/asset.abc123", stager.formatCodeUri(first));
    }

    @Test
    void testStageLocalPathAvoidsNameClashes() throws IOException {
        Path one = Files.createDirectories(sourceDir.resolve("a").resolve("code"));
        Path two = Files.createDirectories(sourceDir.resolve("b").resolve("code"));
        DirectoryAssetStager stager = stager(null, ENV);

        assertEquals("src/code", stager.formatCodeUri(stager.stageLocalPath("FnA", one)));
        assertEquals("src/code-2", stager.formatCodeUri(stager.stageLocalPath("FnB", two)));
    }

    @Test
    void testStageInlineTextAddsTrailingNewline() throws IOException {
        DirectoryAssetStager stager = stager(null, ENV);

        Path staged = stager.stageInlineText("Fn", "def handler(event, context):\n    return 1", "index.py");

        assertEquals(projectDir.resolve("src/Fn/index.py"), staged);
        assertEquals("def handler(event, context):\n    return 1\n", Files.readString(staged));
        assertEquals(StagedAsset.Kind.INLINE_TEXT, stager.getRecords().get(0).kind());
    }

    @Test
    void testStageS3CodeExtractsArchive() throws IOException {
        DirectoryAssetStager stager = stager((location, target) -> {
            downloads.add(location);
            writeZip(target, Map.of("index.js", "exports.handler = 1;", "lib/util.js", "module.exports = {};"));
        }, ENV);

        Path staged = stager.stageS3Code("Fn", "assets-bucket", "code/fn.zip", "v1");

        assertEquals(List.of(new S3Location("assets-bucket", "code/fn.zip", "v1")), downloads);
        assertTrue(Files.exists(staged.resolve("index.js")));
        assertTrue(Files.exists(staged.resolve("lib/util.js")));
        assertEquals("s3://assets-bucket/code/fn.zip?versionId=v1", stager.getRecords().get(0).source());
    }

    @Test
    void testStageS3CodeRejectsEscapingEntries() {
        DirectoryAssetStager stager = stager(
            (location, target) -> writeZip(target, Map.of("../../evil.sh", "rm -rf /")), ENV);

        assertThrows(AssetStagingException.class, () -> stager.stageS3Code("Fn", "b", "k.zip", null));
        assertFalse(Files.exists(projectDir.resolve("evil.sh")));
    }

    @Test
    void testStageS3FileUsesKeyName() throws IOException {
        DirectoryAssetStager stager = stager(
            (location, target) -> Files.writeString(target, "export function request() {}"), ENV);

        Path staged = stager.stageS3File("Resolver", "b", "resolvers/query.js", null, null);

        assertEquals(projectDir.resolve("src/Resolver/query.js"), staged);
    }

    @Test
    void testS3WithoutDownloaderFails() {
        DirectoryAssetStager stager = stager(null, ENV);
        assertThrows(AssetStagingException.class, () -> stager.stageS3Code("Fn", "b", "k.zip", null));
    }

    @Test
    void testResolveStringSubstitutesPseudoParameters() throws IOException {
        DirectoryAssetStager stager = stager(null, ENV);

        assertEquals(Optional.of("plain"), stager.resolveString(json("\"plain\"")));
        assertEquals(Optional.of("cdk-hnb659fds-assets-123456789012-us-west-2"), stager.resolveString(
            json("{\"Fn::Sub\": \"cdk-hnb659fds-assets-${AWS::AccountId}-${AWS::Region}\"}")));
        assertEquals(Optional.of("arn:aws:s3:::bucket-x"), stager.resolveString(
            json("{\"Fn::Sub\": [\"arn:${AWS::Partition}:s3:::${Name}\", {\"Name\": \"bucket-x\"}]}")));
        assertEquals(Optional.of("us-west-2"), stager.resolveString(json("{\"Ref\": \"AWS::Region\"}")));
    }

    @Test
    void testResolveStringLeavesUnresolvableValues() throws IOException {
        DirectoryAssetStager withEnv = stager(null, ENV);
        DirectoryAssetStager withoutEnv = stager(null, null);

        assertTrue(withEnv.resolveString(json("{\"Fn::Sub\": \"${Bucket}-x\"}")).isEmpty());
        assertTrue(withEnv.resolveString(json("{\"Ref\": \"Bucket\"}")).isEmpty());
        assertTrue(withEnv.resolveString(json("{\"Fn::GetAtt\": [\"Bucket\", \"Arn\"]}")).isEmpty());
        assertTrue(withoutEnv.resolveString(json("{\"Fn::Sub\": \"${AWS::AccountId}\"}")).isEmpty());
        assertEquals(Optional.of("no-pseudo"), withoutEnv.resolveString(json("{\"Fn::Sub\": \"no-pseudo\"}")));
    }

    @Test
    void testApplyRenameMapMovesResourceDirectories() throws IOException {
        DirectoryAssetStager stager = stager(null, ENV);
        stager.stageInlineText("MyFnABCDEF12", "exports.handler = 1;", "index.js");

        stager.applyRenameMap(Map.of("MyFnABCDEF12", "MyFn"));

        StagedAsset record = stager.getRecords().get(0);
        assertEquals("MyFn", record.logicalId());
        assertEquals(projectDir.resolve("src/MyFn/index.js"), record.stagedPath());
        assertTrue(Files.exists(record.stagedPath()));
        assertFalse(Files.exists(projectDir.resolve("src/MyFnABCDEF12")));
    }
}
