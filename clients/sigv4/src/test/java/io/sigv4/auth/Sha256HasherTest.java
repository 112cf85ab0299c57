package io.sigv4.auth;

import com.amazonaws.util.BinaryUtils;
import org.junit.Assert;
import org.junit.Test;

import java.nio.charset.StandardCharsets;

public class Sha256HasherTest {

    @Test
    public void testEmptyDigest() {
        String empty = "e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855";
        Assert.assertEquals(empty, Sha256Hasher.hashHex(new byte[0]));
        Assert.assertEquals(empty, Sha256Hasher.hashHex((byte[]) null));
        Assert.assertEquals(empty, Sha256Hasher.hashHex(""));
    }

    @Test
    public void testKnownDigest() {
        Assert.assertEquals("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad", Sha256Hasher.hashHex("abc"));
    }

    @Test
    public void testHmacSha256() {
        // RFC 4231 test case 2
        byte[] mac = HmacSigner.hmacSha256("what do ya want for nothing?", "Jefe".getBytes(StandardCharsets.UTF_8));
        Assert.assertEquals("5bdcc146bf60754e6a042426089575c75a003f089d2739839dec58b964ec3843", BinaryUtils.toHex(mac));
    }
}
