package io.sigv4.auth;

import com.amazonaws.util.BinaryUtils;
import org.junit.Assert;
import org.junit.Test;

public class SigningKeyDeriverTest {
    private static final String SECRET_KEY = "wJalrXUtnFEMI/K7MDENG+bPxRfiCYEXAMPLEKEY";

    @Test
    public void testPublishedIamVector() {
        byte[] key = SigningKeyDeriver.deriveSigningKey(SECRET_KEY, "20150830", "us-east-1", "iam");
        Assert.assertEquals(32, key.length);
        Assert.assertEquals("c4afb1cc5771d871763a393e44b703571b55cc28424d1a5e86da6ed3c154a4b9", BinaryUtils.toHex(key));
    }

    @Test
    public void testTestSuiteServiceVector() {
        byte[] key = SigningKeyDeriver.deriveSigningKey(SECRET_KEY, new CredentialScope("20150830", "us-east-1", "service"));
        Assert.assertEquals("938127b5336810ddb6a5d6af445fcac9e371f9ed418ed386b022aed82901be75", BinaryUtils.toHex(key));
    }

    @Test
    public void testChainUsesRawIntermediateKeys() {
        byte[] kDate = HmacSigner.hmacSha256("20150830", ("AWS4" + SECRET_KEY).getBytes());
        byte[] kRegion = HmacSigner.hmacSha256("us-east-1", kDate);
        byte[] kService = HmacSigner.hmacSha256("iam", kRegion);
        byte[] expected = HmacSigner.hmacSha256("aws4_request", kService);
        Assert.assertArrayEquals(expected, SigningKeyDeriver.deriveSigningKey(SECRET_KEY, "20150830", "us-east-1", "iam"));

        // keying a step with the hex form gives a different key
        byte[] hexKeyed = HmacSigner.hmacSha256("us-east-1", BinaryUtils.toHex(kDate).getBytes());
        Assert.assertFalse(java.util.Arrays.equals(kRegion, hexKeyed));
    }

    @Test
    public void testScopeRendering() {
        CredentialScope scope = CredentialScope.of(java.time.Instant.parse("2020-01-01T23:59:59Z"), "ap-northeast-1", "execute-api");
        Assert.assertEquals("20200101/ap-northeast-1/execute-api/aws4_request", scope.toString());
        Assert.assertEquals(new CredentialScope("20200101", "ap-northeast-1", "execute-api"), scope);
    }
}
