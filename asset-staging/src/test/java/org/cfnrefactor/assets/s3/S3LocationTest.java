package org.cfnrefactor.assets.s3;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class S3LocationTest {

    @Test
    void testParseBasicS3Uri() {
        S3Location location = S3Location.parse("s3://my-bucket/resolvers/query.js");

        assertEquals("my-bucket", location.bucket());
        assertEquals("resolvers/query.js", location.key());
        assertNull(location.version());
        assertEquals("query.js", location.fileName());
        assertEquals("s3://my-bucket/resolvers/query.js", location.toUri());
    }

    @Test
    void testParseKeepsVersion() {
        S3Location location = S3Location.parse("s3://my-bucket/code.zip?versionId=abc");

        assertEquals("code.zip", location.key());
        assertEquals("abc", location.version());
        assertEquals("s3://my-bucket/code.zip?versionId=abc", location.toUri());
    }

    @Test
    void testInvalidLocations() {
        assertThrows(IllegalArgumentException.class, () -> S3Location.parse("http://my-bucket/path"));
        assertThrows(IllegalArgumentException.class, () -> S3Location.parse("s3://my-bucket"));
        assertThrows(IllegalArgumentException.class, () -> S3Location.parse(null));
        assertThrows(IllegalArgumentException.class, () -> new S3Location("  ", "key"));
        assertThrows(IllegalArgumentException.class, () -> new S3Location("bucket", ""));
    }

    @Test
    void testBuilder() {
        S3Location location = S3Location.builder().bucket("b").key("k").version("1").build();
        assertEquals(new S3Location("b", "k", "1"), location);
    }
}
