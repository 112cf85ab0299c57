package io.sigv4;

import org.apache.hadoop.conf.Configuration;
import org.junit.Assert;
import org.junit.Test;

import java.io.IOException;
import java.util.Map;

public class SignerConfigurationTest {

    private static Configuration headersConf(String value) {
        Configuration conf = new Configuration(false);
        conf.set("sigv4.default." + Constants.ADDITIONAL_HEADERS_KEY_SUFFIX, value);
        return conf;
    }

    private static Map<String, String> parseHeaders(String value) throws IOException {
        return SignerConfiguration.getHeaders(headersConf(value), Constants.DEFAULT_PROFILE, Constants.ADDITIONAL_HEADERS_KEY_SUFFIX);
    }

    private static IOException assertInvalidHeaders(String value) {
        return Assert.assertThrows(IOException.class, () -> parseHeaders(value));
    }

    @Test
    public void testProfileFallsBackToDefault() {
        Configuration conf = new Configuration(false);
        conf.set("sigv4.default.region", "us-east-1");
        conf.set("sigv4.api.region", "ap-northeast-1");
        conf.set("sigv4.default.service", "iam");
        conf.set("sigv4.api.endpoint", "https://abc123.execute-api.ap-northeast-1.amazonaws.com");
        Assert.assertEquals("us-east-1", SignerConfiguration.get(conf, "default", "region"));
        Assert.assertEquals("ap-northeast-1", SignerConfiguration.get(conf, "api", "region"));
        Assert.assertEquals("iam", SignerConfiguration.get(conf, "api", "service"));
        Assert.assertEquals("https://abc123.execute-api.ap-northeast-1.amazonaws.com", SignerConfiguration.get(conf, "api", "endpoint"));
        Assert.assertNull(SignerConfiguration.get(conf, "default", "endpoint"));
        Assert.assertNull(SignerConfiguration.get(conf, "api", "access.key"));
    }

    @Test
    public void testGetInt() throws IOException {
        Configuration conf = new Configuration(false);
        conf.setInt("sigv4.default.time.offset_seconds", 30);
        conf.set("sigv4.api.time.offset_seconds", " -5 ");
        Assert.assertEquals(30, SignerConfiguration.getInt(conf, "default", "time.offset_seconds", 0));
        Assert.assertEquals(-5, SignerConfiguration.getInt(conf, "api", "time.offset_seconds", 0));
        Assert.assertEquals(30, SignerConfiguration.getInt(conf, "other", "time.offset_seconds", 0));
        Assert.assertEquals(7, SignerConfiguration.getInt(conf, "api", "missing", 7));
    }

    @Test
    public void testGetIntRejectsNonNumber() {
        Configuration conf = new Configuration(false);
        conf.set("sigv4.default.time.offset_seconds", "abc");
        IOException e = Assert.assertThrows(IOException.class,
                () -> SignerConfiguration.getInt(conf, "api", "time.offset_seconds", 0));
        Assert.assertEquals("Invalid number 'abc' in sigv4.default.time.offset_seconds", e.getMessage());
        Assert.assertTrue(e.getCause() instanceof NumberFormatException);
    }

    @Test
    public void testGetHeaders() throws IOException {
        Map<String, String> headers = parseHeaders("X-Api-Client:sigv4, Content-Type : application/json,X-Trace:a:b,X-Empty:");
        Assert.assertEquals(4, headers.size());
        Assert.assertEquals("sigv4", headers.get("X-Api-Client"));
        // names compare without regard to case
        Assert.assertEquals("application/json", headers.get("content-type"));
        // only the first ':' separates name from value
        Assert.assertEquals("a:b", headers.get("x-trace"));
        Assert.assertEquals("", headers.get("X-Empty"));
        Assert.assertNull(SignerConfiguration.getHeaders(new Configuration(false), "api", Constants.ADDITIONAL_HEADERS_KEY_SUFFIX));
    }

    @Test
    public void testGetHeadersRejectsMalformedEntries() {
        IOException e = assertInvalidHeaders("X-Foo");
        Assert.assertEquals("Invalid header 'X-Foo' in sigv4.default.additional_headers, expected name:value", e.getMessage());
        assertInvalidHeaders("");
        assertInvalidHeaders("X-A:1,");
        assertInvalidHeaders(":value");
        assertInvalidHeaders("X Foo:value");
    }

    @Test
    public void testGetHeadersRejectsRepeatedName() {
        IOException e = assertInvalidHeaders("X-A:1,x-a:2,X-A:3");
        Assert.assertEquals("Header x-a given more than once in sigv4.default.additional_headers", e.getMessage());
    }
}
